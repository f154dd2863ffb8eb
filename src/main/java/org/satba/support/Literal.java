package org.satba.support;

/**
 * LETTERALE - Riferimento con segno a una variabile booleana del solutore
 *
 * Coppia immutabile (identificatore variabile, polarità). Il letterale è il mattone
 * di base di ogni vincolo memorizzato: clausole, vincoli di cardinalità, vincoli
 * pseudo-booleani e vincoli di parità.
 *
 * CONVENZIONI:
 * • variable: ID numerico della variabile (sempre ≥ 1)
 * • negated: true se il letterale è la negazione della variabile
 * • negate() inverte la polarità, negate().negate() restituisce un letterale uguale
 * • Vista DIMACS: +ID per letterale positivo, -ID per letterale negato
 *
 * Semantica per valore: due letterali sono uguali se hanno stessa variabile e polarità.
 */
public final class Literal {

    //region ATTRIBUTI

    /** ID numerico della variabile (≥ 1) */
    private final int variable;

    /** Polarità: true se il letterale è negato */
    private final boolean negated;

    //endregion

    //region COSTRUZIONE

    /**
     * Costruisce letterale con validazione dell'identificatore.
     *
     * @param variable ID numerico variabile (≥ 1)
     * @param negated true per il letterale negativo
     * @throws IllegalArgumentException se variable ≤ 0
     */
    public Literal(int variable, boolean negated) {
        if (variable <= 0) {
            throw new IllegalArgumentException("Variable ID deve essere > 0, ricevuto: " + variable);
        }
        this.variable = variable;
        this.negated = negated;
    }

    /**
     * @return letterale positivo della variabile
     */
    public static Literal positive(int variable) {
        return new Literal(variable, false);
    }

    /**
     * @return letterale negato della variabile
     */
    public static Literal negative(int variable) {
        return new Literal(variable, true);
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    public int getVariable() {
        return variable;
    }

    public boolean isNegated() {
        return negated;
    }

    /**
     * @return letterale complementare (stessa variabile, polarità opposta)
     */
    public Literal negate() {
        return new Literal(variable, !negated);
    }

    /**
     * Applica un segno al letterale: con sign=true restituisce il complemento.
     */
    public Literal withSign(boolean sign) {
        return sign ? negate() : this;
    }

    /**
     * Valuta il letterale dato il valore della sua variabile.
     */
    public boolean evaluate(boolean variableValue) {
        return variableValue != negated;
    }

    /**
     * @return ID positivo se letterale positivo, negativo se negato
     */
    public int toDimacs() {
        return negated ? -variable : variable;
    }

    //endregion

    //region UTILITÀ

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal other = (Literal) obj;
        return variable == other.variable && negated == other.negated;
    }

    @Override
    public int hashCode() {
        return 31 * variable + (negated ? 1 : 0);
    }

    @Override
    public String toString() {
        return (negated ? "¬" : "") + "b" + variable;
    }

    //endregion
}
