package org.satba.optionalfeatures;

import org.satba.ba.CircuitSimplifier;
import org.satba.support.Literal;

import java.util.*;
import java.util.logging.Logger;

/**
 * CACHE STRUTTURALE DELLE RELAZIONI XOR
 *
 * Registra le relazioni closer = XOR(letterali) prodotte dalle catene di
 * biimplicazioni, attivata dal driver con l'opzione -opt=x. Non modifica mai lo
 * store: serve a riconoscere catene ripetute e a riportarne il numero nelle statistiche.
 */
public class ParityCircuitCache implements CircuitSimplifier {

    private static final Logger LOGGER = Logger.getLogger(ParityCircuitCache.class.getName());

    /**
     * Relazione registrata.
     *
     * @param closer letterale che vale lo XOR degli ingressi
     * @param inputs ingressi della relazione
     */
    public record ParityRelation(Literal closer, List<Literal> inputs) {
    }

    private final List<ParityRelation> relations = new ArrayList<>();

    /** Ingressi ordinati per variabile → relazioni con quegli ingressi */
    private final Map<List<Integer>, List<ParityRelation>> byInputVariables = new HashMap<>();

    @Override
    public void addParity(Literal closer, List<Literal> literals) {
        ParityRelation relation = new ParityRelation(closer, List.copyOf(literals));
        relations.add(relation);
        List<ParityRelation> sameInputs = byInputVariables.computeIfAbsent(inputKey(literals), key -> new ArrayList<>());
        if (!sameInputs.isEmpty()) {
            LOGGER.fine("Relazione XOR su variabili già viste: " + literals);
        }
        sameInputs.add(relation);
    }

    /**
     * @return relazioni registrate su esattamente le stesse variabili d'ingresso (polarità ignorata)
     */
    public List<ParityRelation> findByInputs(List<Literal> literals) {
        return Collections.unmodifiableList(byInputVariables.getOrDefault(inputKey(literals), List.of()));
    }

    /**
     * @return numero di relazioni che ripetono un insieme di ingressi già registrato
     */
    public int getDuplicateCount() {
        int duplicates = 0;
        for (List<ParityRelation> group : byInputVariables.values()) {
            duplicates += group.size() - 1;
        }
        return duplicates;
    }

    public List<ParityRelation> getRelations() {
        return Collections.unmodifiableList(relations);
    }

    public int size() {
        return relations.size();
    }

    private static List<Integer> inputKey(List<Literal> literals) {
        List<Integer> variables = new ArrayList<>(literals.size());
        for (Literal literal : literals) {
            variables.add(literal.getVariable());
        }
        Collections.sort(variables);
        return variables;
    }
}
