package org.satba.ba;

/**
 * STATISTICHE DI INTERNALIZZAZIONE - Metriche raccolte durante una sessione
 *
 * Conta variabili generate, vincoli memorizzati per famiglia, clausole ausiliarie,
 * asserzioni incondizionate o reificate, rifiuti e riusi della cache.
 * Aggiornate dal {@link InternalizationContext}; nessuna sincronizzazione perché
 * la sessione è usata da un solo thread.
 */
public class InternalizationStatistics {

    //region CONTATORI

    /** Variabili allocate dallo strato (reificazione, combinatori, chiusure di catene) */
    private int mintedVariables = 0;

    private int cardinalityConstraints = 0;

    private int pseudoBooleanConstraints = 0;

    private int parityConstraints = 0;

    /** Clausole ausiliarie: combinatori delle uguaglianze, definizioni Tseitin, unità */
    private int clauses = 0;

    /** Vincoli asseriti senza tag alla radice */
    private int unconditionalAssertions = 0;

    /** Vincoli asseriti in forma reificata */
    private int reifiedAssertions = 0;

    /** Termini rifiutati per coefficienti fuori range */
    private int rejectedTerms = 0;

    /** Sottotermini risolti dalla cache termine → letterale */
    private int cacheHits = 0;

    private final long startTime;

    //endregion

    public InternalizationStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region INCREMENTI

    void incrementMintedVariables() {
        mintedVariables++;
    }

    void incrementCardinalityConstraints() {
        cardinalityConstraints++;
    }

    void incrementPseudoBooleanConstraints() {
        pseudoBooleanConstraints++;
    }

    void incrementParityConstraints() {
        parityConstraints++;
    }

    void incrementClauses() {
        clauses++;
    }

    void incrementUnconditionalAssertions() {
        unconditionalAssertions++;
    }

    void incrementReifiedAssertions() {
        reifiedAssertions++;
    }

    void incrementRejectedTerms() {
        rejectedTerms++;
    }

    void incrementCacheHits() {
        cacheHits++;
    }

    //endregion

    //region ACCESSO

    public int getMintedVariables() {
        return mintedVariables;
    }

    public int getCardinalityConstraints() {
        return cardinalityConstraints;
    }

    public int getPseudoBooleanConstraints() {
        return pseudoBooleanConstraints;
    }

    public int getParityConstraints() {
        return parityConstraints;
    }

    public int getTotalConstraints() {
        return cardinalityConstraints + pseudoBooleanConstraints + parityConstraints;
    }

    public int getClauses() {
        return clauses;
    }

    public int getUnconditionalAssertions() {
        return unconditionalAssertions;
    }

    public int getReifiedAssertions() {
        return reifiedAssertions;
    }

    public int getRejectedTerms() {
        return rejectedTerms;
    }

    public int getCacheHits() {
        return cacheHits;
    }

    public long getElapsedTimeMs() {
        return System.currentTimeMillis() - startTime;
    }

    //endregion

    //region OUTPUT

    /**
     * Riepilogo su più righe per i file STATS.
     */
    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("==========================[ INTERNALIZATION STATS ]==========================\n");
        output.append("    Variabili generate:     ").append(mintedVariables).append("\n");
        output.append("    Vincoli cardinalità:    ").append(cardinalityConstraints).append("\n");
        output.append("    Vincoli pseudo-booleani:").append(' ').append(pseudoBooleanConstraints).append("\n");
        output.append("    Vincoli di parità:      ").append(parityConstraints).append("\n");
        output.append("    Clausole ausiliarie:    ").append(clauses).append("\n");
        output.append("    Asserzioni alla radice: ").append(unconditionalAssertions).append("\n");
        output.append("    Asserzioni reificate:   ").append(reifiedAssertions).append("\n");
        if (rejectedTerms > 0) {
            output.append("    Termini rifiutati:      ").append(rejectedTerms).append("\n");
        }
        output.append("    Riusi cache:            ").append(cacheHits).append("\n");
        output.append("    Tempo:                  ").append(getElapsedTimeMs()).append("ms\n");
        output.append("=============================================================================\n");
        return output.toString();
    }

    /**
     * Formato su singola linea per il logging.
     */
    public String toCompactString() {
        return String.format("Stats[Var:%d, Card:%d, PB:%d, Xor:%d, Cl:%d, Root:%d, Reif:%d, Rej:%d, Hit:%d]",
                mintedVariables, cardinalityConstraints, pseudoBooleanConstraints, parityConstraints, clauses,
                unconditionalAssertions, reifiedAssertions, rejectedTerms, cacheHits);
    }

    //endregion
}
