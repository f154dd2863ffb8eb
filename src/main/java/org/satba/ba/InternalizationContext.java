package org.satba.ba;

import org.satba.support.Literal;
import org.satba.support.SolverBackend;
import org.satba.support.WeightedLiteral;
import org.satba.term.Term;

import java.util.*;
import java.util.logging.Logger;

/**
 * CONTESTO DI INTERNALIZZAZIONE - Stato esplicito di una sessione
 *
 * Raccoglie tutto lo stato mutabile condiviso tra le chiamate di internalizzazione
 * e viene passato per riferimento a ogni percorso di lowering:
 * • backend del solutore (variabili, vincoli, clausole, scope)
 * • cache termine → letterale, indicizzata per identità del termine
 * • rientro ricorsivo per gli operandi
 * • semplificatore di circuiti opzionale (no-op di default)
 * • statistiche della sessione
 *
 * INVARIANTI:
 * • Ogni termine è scritto in cache al più una volta (scrittura prima della lettura)
 * • In cache si memorizza sempre il letterale positivo del termine
 * • popScope() rimuove le voci di cache scritte nello scope chiuso
 *
 * Non thread-safe: un contesto per sessione, usato dal solo thread chiamante.
 */
public class InternalizationContext {

    private static final Logger LOGGER = Logger.getLogger(InternalizationContext.class.getName());

    //region COLLABORATORI E STATO

    private final SolverBackend backend;
    private final OperandInternalizer operandInternalizer;
    private final CircuitSimplifier circuitSimplifier;
    private final InternalizationStatistics statistics;

    private final Map<Term, Literal> cache;

    /** Termini in cache in ordine di scrittura, per l'evizione alla chiusura degli scope */
    private final List<Term> cacheTrail;

    private final Deque<Integer> cacheMarks;

    //endregion

    //region COSTRUZIONE

    public InternalizationContext(SolverBackend backend, OperandInternalizer operandInternalizer) {
        this(backend, operandInternalizer, CircuitSimplifier.NO_OP);
    }

    /**
     * @param backend backend del solutore che riceve vincoli e clausole
     * @param operandInternalizer rientro per gli operandi annidati
     * @param circuitSimplifier semplificatore opzionale, {@link CircuitSimplifier#NO_OP} se assente
     */
    public InternalizationContext(SolverBackend backend, OperandInternalizer operandInternalizer,
                                  CircuitSimplifier circuitSimplifier) {
        this.backend = Objects.requireNonNull(backend, "Backend non può essere null");
        this.operandInternalizer = Objects.requireNonNull(operandInternalizer,
                "Internalizzatore degli operandi non può essere null");
        this.circuitSimplifier = Objects.requireNonNull(circuitSimplifier,
                "Usare CircuitSimplifier.NO_OP in assenza di semplificatore");
        this.statistics = new InternalizationStatistics();
        this.cache = new IdentityHashMap<>();
        this.cacheTrail = new ArrayList<>();
        this.cacheMarks = new ArrayDeque<>();
    }

    //endregion

    //region CACHE TERMINE → LETTERALE

    /**
     * @return letterale positivo già prodotto per questo termine, se presente
     */
    public Optional<Literal> lookup(Term term) {
        Literal cached = cache.get(term);
        if (cached != null) {
            statistics.incrementCacheHits();
            LOGGER.finest("Cache hit: " + term + " → " + cached);
        }
        return Optional.ofNullable(cached);
    }

    /**
     * Registra il letterale positivo prodotto per un termine.
     *
     * @throws IllegalStateException se il termine è già in cache
     */
    public void cache(Term term, Literal literal) {
        Objects.requireNonNull(literal, "Letterale in cache non può essere null");
        if (cache.putIfAbsent(term, literal) != null) {
            throw new IllegalStateException("Termine già internalizzato: " + term);
        }
        cacheTrail.add(term);
        LOGGER.finest("Cache: " + term + " → " + literal);
    }

    public int cacheSize() {
        return cache.size();
    }

    //endregion

    //region FACCIATA VERSO IL BACKEND

    public int mintVariable(boolean reified) {
        statistics.incrementMintedVariables();
        return backend.mintVariable(reified);
    }

    public void addCardinality(Literal tag, List<Literal> literals, int threshold, boolean redundant) {
        backend.addCardinalityThreshold(tag, literals, threshold, redundant);
        statistics.incrementCardinalityConstraints();
        countAssertion(tag);
    }

    public void addPseudoBoolean(Literal tag, List<WeightedLiteral> weightedLiterals, int threshold,
                                 boolean redundant) {
        backend.addPbThreshold(tag, weightedLiterals, threshold, redundant);
        statistics.incrementPseudoBooleanConstraints();
        countAssertion(tag);
    }

    public void addParity(List<Literal> literals, boolean redundant) {
        backend.addParity(literals, redundant);
        statistics.incrementParityConstraints();
    }

    public void addClause(Literal... literals) {
        addClause(Arrays.asList(literals));
    }

    public void addClause(List<Literal> literals) {
        backend.addClause(literals);
        statistics.incrementClauses();
    }

    public void markExternal(int variable) {
        backend.markExternal(variable);
    }

    public int scopeDepth() {
        return backend.scopeDepth();
    }

    private void countAssertion(Literal tag) {
        if (tag == null) {
            statistics.incrementUnconditionalAssertions();
        } else {
            statistics.incrementReifiedAssertions();
        }
    }

    //endregion

    //region OPERANDI

    /**
     * Internalizza un operando tramite il rientro ricorsivo e ne marca la variabile come esterna.
     */
    public Literal internalizeOperand(Term operand, boolean redundant) throws CoefficientOutOfRangeException {
        Literal literal = operandInternalizer.internalizeOperand(operand, this, redundant);
        backend.markExternal(literal.getVariable());
        return literal;
    }

    /**
     * Internalizza tutti gli operandi del termine, nell'ordine.
     *
     * @return nuova lista di letterali, uno per operando
     */
    public List<Literal> internalizeOperands(Term term, boolean redundant) throws CoefficientOutOfRangeException {
        List<Literal> literals = new ArrayList<>(term.getOperandCount());
        for (Term operand : term.getOperands()) {
            literals.add(internalizeOperand(operand, redundant));
        }
        return literals;
    }

    //endregion

    //region SCOPE

    /**
     * Apre uno scope nel backend e marca la cache.
     */
    public void pushScope() {
        backend.push();
        cacheMarks.push(cacheTrail.size());
    }

    /**
     * Chiude lo scope più interno: il backend ritrae i vincoli, la cache dimentica
     * i termini internalizzati nello scope.
     *
     * @throws IllegalStateException se nessuno scope è aperto
     */
    public void popScope() {
        if (cacheMarks.isEmpty()) {
            throw new IllegalStateException("Nessuno scope aperto");
        }
        backend.pop();
        int mark = cacheMarks.pop();
        List<Term> evicted = cacheTrail.subList(mark, cacheTrail.size());
        for (Term term : evicted) {
            cache.remove(term);
        }
        LOGGER.fine("Scope chiuso: " + evicted.size() + " voci di cache rimosse");
        evicted.clear();
    }

    //endregion

    //region ACCESSO

    public SolverBackend getBackend() {
        return backend;
    }

    public CircuitSimplifier getCircuitSimplifier() {
        return circuitSimplifier;
    }

    public InternalizationStatistics getStatistics() {
        return statistics;
    }

    void recordRejection() {
        statistics.incrementRejectedTerms();
    }

    //endregion
}
