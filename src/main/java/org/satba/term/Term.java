package org.satba.term;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * TERMINE DI SUPERFICIE - Rappresentazione ad albero delle asserzioni di algebra booleana
 *
 * Albero immutabile delle formule accettate dallo strato di internalizzazione e
 * prodotte dalla proiezione inversa. Copre la logica proposizionale di base e
 * gli operatori di soglia (cardinalità e pseudo-booleani) con coefficienti a
 * precisione arbitraria.
 *
 * FAMIGLIE DI NODI:
 * • Foglie: ATOM (variabile proposizionale), TRUE, FALSE
 * • Connettivi: NOT, AND, OR, IFF (binaria), XOR (n-aria)
 * • Soglie unitarie: AT_LEAST_K, AT_MOST_K (coefficienti implicitamente 1)
 * • Soglie pesate: PB_GE, PB_LE, PB_EQ (un coefficiente per operando)
 *
 * IDENTITÀ:
 * I termini non ridefiniscono equals(): due occorrenze dello stesso sottotermine
 * sono lo stesso oggetto, e la cache termine → letterale è indicizzata per identità.
 */
public final class Term {

    //region TIPI E STRUTTURA DATI

    /**
     * Operatori del linguaggio di superficie.
     */
    public enum Type {
        ATOM,
        TRUE,
        FALSE,
        NOT,
        AND,
        OR,
        IFF,
        XOR,
        AT_LEAST_K,
        AT_MOST_K,
        PB_GE,
        PB_LE,
        PB_EQ
    }

    private final Type type;

    /** Nome della variabile (solo per ATOM) */
    private final String atom;

    /** Operandi (vuota per le foglie) */
    private final List<Term> operands;

    /** Coefficienti, uno per operando (solo per PB_GE, PB_LE, PB_EQ) */
    private final List<BigDecimal> coefficients;

    /** Soglia k (solo per gli operatori di soglia) */
    private final BigDecimal threshold;

    private Term(Type type, String atom, List<Term> operands, List<BigDecimal> coefficients, BigDecimal threshold) {
        this.type = type;
        this.atom = atom;
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        this.coefficients = Collections.unmodifiableList(new ArrayList<>(coefficients));
        this.threshold = threshold;
    }

    //endregion

    //region COSTRUTTORI STATICI

    /**
     * @param name nome della variabile proposizionale (non null, non vuoto)
     * @throws IllegalArgumentException se nome null o vuoto
     */
    public static Term atom(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome variabile atomica non può essere null o vuoto");
        }
        return new Term(Type.ATOM, name.trim(), List.of(), List.of(), null);
    }

    public static Term trueTerm() {
        return new Term(Type.TRUE, null, List.of(), List.of(), null);
    }

    public static Term falseTerm() {
        return new Term(Type.FALSE, null, List.of(), List.of(), null);
    }

    public static Term not(Term operand) {
        Objects.requireNonNull(operand, "Operando per negazione non può essere null");
        return new Term(Type.NOT, null, List.of(operand), List.of(), null);
    }

    public static Term and(List<Term> operands) {
        return new Term(Type.AND, null, validateOperands(operands, 1), List.of(), null);
    }

    public static Term or(List<Term> operands) {
        return new Term(Type.OR, null, validateOperands(operands, 1), List.of(), null);
    }

    /**
     * Biimplicazione binaria; le catene si costruiscono annidando a destra.
     */
    public static Term iff(Term left, Term right) {
        Objects.requireNonNull(left, "Operando sinistro di <-> non può essere null");
        Objects.requireNonNull(right, "Operando destro di <-> non può essere null");
        return new Term(Type.IFF, null, List.of(left, right), List.of(), null);
    }

    /**
     * Costruisce la catena annidata a destra t0 <-> (t1 <-> (... <-> tn)).
     *
     * @param operands almeno due operandi
     */
    public static Term iffChain(List<Term> operands) {
        List<Term> validated = validateOperands(operands, 2);
        Term chain = validated.get(validated.size() - 1);
        for (int i = validated.size() - 2; i >= 0; i--) {
            chain = iff(validated.get(i), chain);
        }
        return chain;
    }

    public static Term xor(List<Term> operands) {
        return new Term(Type.XOR, null, validateOperands(operands, 1), List.of(), null);
    }

    public static Term atLeast(BigDecimal k, List<Term> operands) {
        return new Term(Type.AT_LEAST_K, null, validateOperands(operands, 0), List.of(),
                Objects.requireNonNull(k, "Soglia non può essere null"));
    }

    public static Term atLeast(long k, Term... operands) {
        return atLeast(BigDecimal.valueOf(k), List.of(operands));
    }

    public static Term atMost(BigDecimal k, List<Term> operands) {
        return new Term(Type.AT_MOST_K, null, validateOperands(operands, 0), List.of(),
                Objects.requireNonNull(k, "Soglia non può essere null"));
    }

    public static Term atMost(long k, Term... operands) {
        return atMost(BigDecimal.valueOf(k), List.of(operands));
    }

    public static Term pbGe(List<BigDecimal> coefficients, List<Term> operands, BigDecimal k) {
        return weighted(Type.PB_GE, coefficients, operands, k);
    }

    public static Term pbLe(List<BigDecimal> coefficients, List<Term> operands, BigDecimal k) {
        return weighted(Type.PB_LE, coefficients, operands, k);
    }

    public static Term pbEq(List<BigDecimal> coefficients, List<Term> operands, BigDecimal k) {
        return weighted(Type.PB_EQ, coefficients, operands, k);
    }

    /**
     * Costruttore generico per i vincoli pesati con coefficienti interi.
     */
    public static Term weighted(Type type, long[] coefficients, List<Term> operands, long k) {
        List<BigDecimal> values = new ArrayList<>();
        for (long coefficient : coefficients) {
            values.add(BigDecimal.valueOf(coefficient));
        }
        return weighted(type, values, operands, BigDecimal.valueOf(k));
    }

    /**
     * @throws IllegalArgumentException se il tipo non è pesato o se coefficienti e operandi non corrispondono
     */
    public static Term weighted(Type type, List<BigDecimal> coefficients, List<Term> operands, BigDecimal k) {
        if (type != Type.PB_GE && type != Type.PB_LE && type != Type.PB_EQ) {
            throw new IllegalArgumentException("Tipo deve essere PB_GE, PB_LE o PB_EQ: " + type);
        }
        Objects.requireNonNull(coefficients, "Lista coefficienti non può essere null");
        Objects.requireNonNull(k, "Soglia non può essere null");
        List<Term> validated = validateOperands(operands, 0);
        if (coefficients.size() != validated.size() || coefficients.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Servono " + validated.size()
                    + " coefficienti non null, ricevuti: " + coefficients);
        }
        return new Term(type, null, validated, coefficients, k);
    }

    private static List<Term> validateOperands(List<Term> operands, int minimumSize) {
        if (operands == null || operands.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Lista operandi non può essere null o contenere null");
        }
        if (operands.size() < minimumSize) {
            throw new IllegalArgumentException("Servono almeno " + minimumSize + " operandi, ricevuti: "
                    + operands.size());
        }
        return operands;
    }

    //endregion

    //region ACCESSO ALLA STRUTTURA

    public Type getType() {
        return type;
    }

    public String getAtom() {
        return atom;
    }

    public List<Term> getOperands() {
        return operands;
    }

    public Term getOperand(int index) {
        return operands.get(index);
    }

    public int getOperandCount() {
        return operands.size();
    }

    /**
     * @return soglia k degli operatori di soglia, null altrimenti
     */
    public BigDecimal getThreshold() {
        return threshold;
    }

    /**
     * Coefficiente dell'operando i-esimo; 1 per le soglie unitarie.
     *
     * @throws IllegalStateException se il termine non è un operatore di soglia
     */
    public BigDecimal getCoefficient(int index) {
        if (!isThreshold()) {
            throw new IllegalStateException("Coefficienti definiti solo per operatori di soglia: " + type);
        }
        return coefficients.isEmpty() ? BigDecimal.ONE : coefficients.get(index);
    }

    public List<BigDecimal> getCoefficients() {
        return coefficients;
    }

    /**
     * @return true se il termine è un confronto pseudo-booleano (soglie unitarie incluse)
     */
    public boolean isThreshold() {
        return switch (type) {
            case AT_LEAST_K, AT_MOST_K, PB_GE, PB_LE, PB_EQ -> true;
            default -> false;
        };
    }

    /**
     * @return true se tutti i coefficienti valgono esattamente 1
     */
    public boolean hasUnitCoefficients() {
        if (!isThreshold()) {
            return false;
        }
        for (BigDecimal coefficient : coefficients) {
            if (coefficient.compareTo(BigDecimal.ONE) != 0) {
                return false;
            }
        }
        return true;
    }

    public boolean isIff() {
        return type == Type.IFF;
    }

    //endregion

    //region SEMANTICA

    /**
     * Valuta il termine sotto un assegnamento delle variabili atomiche.
     *
     * @param atomValue valore di verità di ciascuna variabile per nome
     */
    public boolean evaluate(Predicate<String> atomValue) {
        return switch (type) {
            case ATOM -> atomValue.test(atom);
            case TRUE -> true;
            case FALSE -> false;
            case NOT -> !operands.get(0).evaluate(atomValue);
            case AND -> operands.stream().allMatch(operand -> operand.evaluate(atomValue));
            case OR -> operands.stream().anyMatch(operand -> operand.evaluate(atomValue));
            case IFF -> operands.get(0).evaluate(atomValue) == operands.get(1).evaluate(atomValue);
            case XOR -> operands.stream().filter(operand -> operand.evaluate(atomValue)).count() % 2 == 1;
            case AT_LEAST_K, PB_GE -> weightOfTrueOperands(atomValue).compareTo(threshold) >= 0;
            case AT_MOST_K, PB_LE -> weightOfTrueOperands(atomValue).compareTo(threshold) <= 0;
            case PB_EQ -> weightOfTrueOperands(atomValue).compareTo(threshold) == 0;
        };
    }

    private BigDecimal weightOfTrueOperands(Predicate<String> atomValue) {
        BigDecimal sum = BigDecimal.ZERO;
        for (int i = 0; i < operands.size(); i++) {
            if (operands.get(i).evaluate(atomValue)) {
                sum = sum.add(getCoefficient(i));
            }
        }
        return sum;
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Rappresentazione nella sintassi accettata da {@link TermParser}
     * (XOR escluso, prodotto solo dalla proiezione inversa).
     */
    @Override
    public String toString() {
        return switch (type) {
            case ATOM -> atom;
            case TRUE -> "true";
            case FALSE -> "false";
            case NOT -> "!" + operands.get(0);
            case AND -> joinInfix(" & ");
            case OR -> joinInfix(" | ");
            case IFF -> "(" + operands.get(0) + " <-> " + operands.get(1) + ")";
            case XOR -> "xor(" + joinOperands() + ")";
            case AT_LEAST_K -> "atleast(" + threshold.toPlainString() + ": " + joinOperands() + ")";
            case AT_MOST_K -> "atmost(" + threshold.toPlainString() + ": " + joinOperands() + ")";
            case PB_GE -> weightedString(">=");
            case PB_LE -> weightedString("<=");
            case PB_EQ -> weightedString("=");
        };
    }

    private String joinInfix(String operator) {
        if (operands.size() == 1) {
            return operands.get(0).toString();
        }
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) sb.append(operator);
            sb.append(operands.get(i));
        }
        return sb.append(")").toString();
    }

    private String joinOperands() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(operands.get(i));
        }
        return sb.toString();
    }

    private String weightedString(String comparison) {
        StringBuilder sb = new StringBuilder("pb(");
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) sb.append(" + ");
            sb.append(coefficients.get(i).toPlainString()).append(' ').append(operands.get(i));
        }
        return sb.append(' ').append(comparison).append(' ').append(threshold.toPlainString()).append(')').toString();
    }

    //endregion
}
