package org.satba.support;

import java.util.List;

/**
 * Interfaccia verso il motore di ricerca: pool di variabili e memoria dei vincoli.
 *
 * Lo strato di internalizzazione crea vincoli e li consegna subito al backend,
 * che ne mantiene la proprietà per tutta la sessione di risoluzione.
 */
public interface SolverBackend {

    /**
     * Alloca una nuova variabile booleana.
     *
     * @param reified true se la variabile è esterna (visibile al chiamante e non eliminabile)
     * @return ID della nuova variabile (≥ 1)
     */
    int mintVariable(boolean reified);

    /**
     * Memorizza un vincolo pseudo-booleano sum(c_i·l_i) ≥ k, eventualmente reificato.
     *
     * @param tag letterale di reificazione, null per asserzione incondizionata
     */
    void addPbThreshold(Literal tag, List<WeightedLiteral> weightedLiterals, int threshold, boolean redundant);

    /**
     * Memorizza un vincolo "almeno k di n", eventualmente reificato.
     *
     * @param tag letterale di reificazione, null per asserzione incondizionata
     */
    void addCardinalityThreshold(Literal tag, List<Literal> literals, int threshold, boolean redundant);

    /**
     * Memorizza un vincolo di parità senza tag.
     */
    void addParity(List<Literal> literals, boolean redundant);

    /**
     * Memorizza una clausola (disgiunzione di letterali).
     */
    void addClause(List<Literal> literals);

    /**
     * Segnala che la variabile è referenziata da un vincolo di algebra booleana.
     */
    void markExternal(int variable);

    /**
     * @return numero di scope di backtracking attualmente aperti
     */
    int scopeDepth();

    /**
     * Apre uno scope di backtracking.
     */
    void push();

    /**
     * Chiude lo scope più interno ritraendo quanto vi è stato asserito.
     */
    void pop();
}
