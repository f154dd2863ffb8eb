package org.satba.support;

import java.util.*;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CONSTRAINT STORE - Memoria di variabili, clausole e vincoli della sessione
 *
 * Implementazione in memoria del backend del solutore. Riceve i vincoli prodotti
 * dallo strato di internalizzazione e li conserva nell'ordine di inserimento,
 * insieme alle clausole ausiliarie (combinatori, definizioni di Tseitin, unità).
 *
 * STRUTTURE GESTITE:
 * - Pool di variabili con ID progressivi ≥ 1 (mai riciclati)
 * - Mapping bidirezionale nome simbolico ↔ ID per le variabili atomiche
 * - Lista ordinata dei vincoli (cardinalità, pseudo-booleani, parità)
 * - Lista ordinata delle clausole
 * - Insieme delle variabili esterne
 * - Stack degli scope di backtracking con ritrazione su pop()
 *
 * INVARIANTI MANTENUTE:
 * - Ogni nome simbolico ha ID univoco, e ogni letterale memorizzato referenzia una variabile allocata
 * - Un vincolo memorizzato non viene mai modificato
 * - pop() ritrae vincoli e clausole dello scope, non le variabili
 *
 * Non thread-safe: una istanza per sessione, usata da un solo thread.
 */
public class ConstraintStore implements SolverBackend {

    private static final Logger LOGGER = Logger.getLogger(ConstraintStore.class.getName());

    //region STRUTTURE DATI CORE

    /** Numero di variabili allocate; l'ultimo ID assegnato coincide con questo valore */
    private int variableCount;

    /** Mapping nome simbolico → ID, preserva ordine di inserimento */
    private final Map<String, Integer> variableMapping;

    /** Mapping inverso ID → nome simbolico (solo variabili atomiche) */
    private final Map<Integer, String> variableNames;

    /** Variabili esterne: reificate alla creazione o marcate come operandi */
    private final Set<Integer> externalVariables;

    private final List<BooleanConstraint> constraints;

    private final List<List<Literal>> clauses;

    private final ScopeStack scopes;

    //endregion

    //region COSTRUZIONE

    public ConstraintStore() {
        this.variableCount = 0;
        this.variableMapping = new LinkedHashMap<>();
        this.variableNames = new HashMap<>();
        this.externalVariables = new HashSet<>();
        this.constraints = new ArrayList<>();
        this.clauses = new ArrayList<>();
        this.scopes = new ScopeStack();
        LOGGER.fine("ConstraintStore inizializzato");
    }

    //endregion

    //region GESTIONE VARIABILI

    @Override
    public int mintVariable(boolean reified) {
        int variable = ++variableCount;
        if (reified) {
            externalVariables.add(variable);
        }
        LOGGER.finest("Nuova variabile allocata: b" + variable + (reified ? " (reificata)" : ""));
        return variable;
    }

    /**
     * Ottiene ID numerico per variabile simbolica, creandola se necessario.
     *
     * @param name nome simbolico (non vuoto)
     * @return ID univoco della variabile (sempre > 0)
     * @throws IllegalArgumentException se nome null o vuoto
     */
    public int getOrCreateVariable(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome variabile non può essere null o vuoto");
        }
        String normalizedName = name.trim();
        return variableMapping.computeIfAbsent(normalizedName, key -> {
            int newId = mintVariable(false);
            variableNames.put(newId, key);
            LOGGER.finest("Nuova variabile mappata: " + key + " → ID " + newId);
            return newId;
        });
    }

    @Override
    public void markExternal(int variable) {
        validateVariable(variable);
        externalVariables.add(variable);
    }

    public boolean isExternal(int variable) {
        return externalVariables.contains(variable);
    }

    /**
     * @return nome simbolico della variabile, vuoto per variabili generate
     */
    public Optional<String> getVariableName(int variable) {
        return Optional.ofNullable(variableNames.get(variable));
    }

    /**
     * @return ID della variabile simbolica, vuoto se mai creata
     */
    public Optional<Integer> findVariable(String name) {
        return Optional.ofNullable(variableMapping.get(name));
    }

    //endregion

    //region MEMORIZZAZIONE VINCOLI

    @Override
    public void addPbThreshold(Literal tag, List<WeightedLiteral> weightedLiterals, int threshold,
                               boolean redundant) {
        List<Literal> referenced = new ArrayList<>();
        for (WeightedLiteral weightedLiteral : weightedLiterals) {
            referenced.add(weightedLiteral.getLiteral());
        }
        validateLiterals(referenced, tag);
        storeConstraint(new PseudoBooleanConstraint(tag, weightedLiterals, threshold, redundant));
    }

    @Override
    public void addCardinalityThreshold(Literal tag, List<Literal> literals, int threshold, boolean redundant) {
        validateLiterals(literals, tag);
        storeConstraint(new CardinalityConstraint(tag, literals, threshold, redundant));
    }

    @Override
    public void addParity(List<Literal> literals, boolean redundant) {
        validateLiterals(literals, null);
        storeConstraint(new ParityConstraint(null, literals, redundant));
    }

    @Override
    public void addClause(List<Literal> literals) {
        if (literals == null || literals.isEmpty()) {
            throw new IllegalArgumentException("Clausola vuota non ammessa");
        }
        validateLiterals(literals, null);
        clauses.add(Collections.unmodifiableList(new ArrayList<>(literals)));
        LOGGER.finest("Clausola aggiunta: " + literals);
    }

    private void storeConstraint(BooleanConstraint constraint) {
        constraints.add(constraint);
        LOGGER.finest("Vincolo memorizzato [livello " + scopes.depth() + "]: " + constraint);
    }

    //endregion

    //region SCOPE DI BACKTRACKING

    @Override
    public int scopeDepth() {
        return scopes.depth();
    }

    @Override
    public void push() {
        scopes.push(constraints.size(), clauses.size());
    }

    /**
     * Chiude lo scope più interno ritraendo vincoli e clausole aggiunti al suo interno.
     *
     * @throws IllegalStateException se nessuno scope è aperto
     */
    @Override
    public void pop() {
        ScopeStack.ScopeMark mark = scopes.pop();
        int retractedConstraints = constraints.size() - mark.constraintCount();
        int retractedClauses = clauses.size() - mark.clauseCount();
        constraints.subList(mark.constraintCount(), constraints.size()).clear();
        clauses.subList(mark.clauseCount(), clauses.size()).clear();

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("Ritratti %d vincoli e %d clausole", retractedConstraints, retractedClauses));
        }
    }

    //endregion

    //region VALIDAZIONE

    private void validateVariable(int variable) {
        if (variable <= 0 || variable > variableCount) {
            throw new IllegalArgumentException("Variabile non allocata: " + variable
                    + " (allocate: " + variableCount + ")");
        }
    }

    private void validateLiterals(List<Literal> literals, Literal tag) {
        Objects.requireNonNull(literals, "Lista letterali non può essere null");
        for (Literal literal : literals) {
            if (literal == null) {
                throw new IllegalArgumentException("Letterale null non ammesso");
            }
            validateVariable(literal.getVariable());
        }
        if (tag != null) {
            validateVariable(tag.getVariable());
        }
    }

    //endregion

    //region VERIFICA MODELLI

    /**
     * Verifica se un assegnamento soddisfa tutti i vincoli e tutte le clausole.
     *
     * @param truth restituisce true se il letterale è vero nell'assegnamento
     */
    public boolean isSatisfiedBy(Predicate<Literal> truth) {
        for (List<Literal> clause : clauses) {
            boolean satisfied = false;
            for (Literal literal : clause) {
                if (truth.test(literal)) {
                    satisfied = true;
                    break;
                }
            }
            if (!satisfied) {
                return false;
            }
        }
        for (BooleanConstraint constraint : constraints) {
            if (!constraint.isSatisfiedBy(truth)) {
                return false;
            }
        }
        return true;
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * @return copia immutabile dei vincoli in ordine di inserimento
     */
    public List<BooleanConstraint> getConstraints() {
        return Collections.unmodifiableList(new ArrayList<>(constraints));
    }

    /**
     * @return copia immutabile delle clausole in ordine di inserimento
     */
    public List<List<Literal>> getClauses() {
        return Collections.unmodifiableList(new ArrayList<>(clauses));
    }

    public int getVariableCount() {
        return variableCount;
    }

    public int getConstraintCount() {
        return constraints.size();
    }

    public int getClauseCount() {
        return clauses.size();
    }

    /**
     * @return copia del mapping variabili simboliche → ID numerici
     */
    public Map<String, Integer> getVariableMapping() {
        return new LinkedHashMap<>(variableMapping);
    }

    @Override
    public String toString() {
        return String.format("ConstraintStore{variabili=%d, vincoli=%d, clausole=%d, livello=%d}",
                variableCount, constraints.size(), clauses.size(), scopes.depth());
    }

    //endregion
}
