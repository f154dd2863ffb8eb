package org.satba.ba;

import org.satba.support.Literal;
import org.satba.support.WeightedLiteral;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ARITMETICA DELLE SOGLIE - Negazione e riscrittura dei predicati di soglia
 *
 * Funzioni pure usate da tutti i percorsi di internalizzazione. Ogni funzione
 * restituisce nuove liste: la lista di letterali del chiamante non viene mai
 * modificata, e nessuna lista restituita condivide struttura con quella in ingresso.
 *
 * IDENTITÀ IMPLEMENTATE (C = somma coefficienti, n = numero letterali):
 * • ¬(Σ c_i·l_i ≥ k)  ≡  Σ c_i·¬l_i ≥ C + 1 - k
 * • ¬(almeno k di n)  ≡  almeno n + 1 - k dei complementi
 * • Σ c_i·l_i ≤ k     ≡  Σ c_i·¬l_i ≥ C - k
 * • al più k di n     ≡  almeno n - k dei complementi
 *
 * Le soglie derivate sono calcolate in long e convertite con controllo: un
 * risultato negativo o oltre Integer.MAX_VALUE produce un {@link NarrowedValue} rifiutato.
 */
public final class ThresholdArithmetic {

    /**
     * Soglia con letterali pesati già complementati.
     */
    public record WeightedThreshold(List<WeightedLiteral> literals, NarrowedValue threshold) {
    }

    /**
     * Soglia con letterali già complementati.
     */
    public record CardinalityThreshold(List<Literal> literals, NarrowedValue threshold) {
    }

    private ThresholdArithmetic() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region CONVERSIONE CONTROLLATA

    /**
     * Converte un valore dichiarato (coefficiente o soglia) in int non negativo.
     *
     * @param value valore a precisione arbitraria
     * @return esito della conversione, mai un'eccezione
     */
    public static NarrowedValue narrow(BigDecimal value) {
        if (value == null) {
            return NarrowedValue.rejected("null", "valore mancante");
        }
        String source = value.toPlainString();
        if (value.signum() < 0) {
            return NarrowedValue.rejected(source, "valore negativo");
        }
        BigDecimal normalized = value.stripTrailingZeros();
        if (normalized.scale() > 0) {
            return NarrowedValue.rejected(source, "valore non intero");
        }
        if (normalized.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0) {
            return NarrowedValue.rejected(source, "oltre la larghezza intera supportata");
        }
        return NarrowedValue.of(normalized.intValueExact());
    }

    /**
     * Converte una soglia derivata calcolata in long.
     */
    public static NarrowedValue narrow(long value) {
        if (value < 0) {
            return NarrowedValue.rejected(Long.toString(value), "soglia derivata negativa");
        }
        if (value > Integer.MAX_VALUE) {
            return NarrowedValue.rejected(Long.toString(value), "oltre la larghezza intera supportata");
        }
        return NarrowedValue.of((int) value);
    }

    //endregion

    //region SOGLIE DERIVATE

    /**
     * Soglia della negazione pesata: accumulatore inizializzato a 1 - k, a cui si
     * somma il coefficiente di ogni letterale. Risultato C + 1 - k.
     */
    public static NarrowedValue negatedThreshold(List<Integer> coefficients, int k) {
        return foldCoefficients(coefficients, 1L - k);
    }

    /**
     * Soglia della riscrittura ≤ → ≥ (e della seconda metà di un'uguaglianza): C - k.
     */
    public static NarrowedValue complementedThreshold(List<Integer> coefficients, int k) {
        return foldCoefficients(coefficients, -(long) k);
    }

    /**
     * Peso totale C: deve restare nella larghezza intera perché i vincoli lo memorizzano.
     */
    public static NarrowedValue totalWeight(List<Integer> coefficients) {
        return foldCoefficients(coefficients, 0L);
    }

    private static NarrowedValue foldCoefficients(List<Integer> coefficients, long accumulator) {
        for (int coefficient : coefficients) {
            accumulator += coefficient;
        }
        return narrow(accumulator);
    }

    /**
     * Soglia della negazione di "almeno k di n": n + 1 - k.
     */
    public static NarrowedValue negatedCardinalityThreshold(int n, int k) {
        return narrow((long) n + 1 - k);
    }

    /**
     * Soglia di "al più k di n" riscritto come "almeno n - k dei complementi".
     */
    public static NarrowedValue atMostThreshold(int n, int k) {
        return narrow((long) n - k);
    }

    //endregion

    //region TRASFORMAZIONI DI LETTERALI

    public static List<Literal> complementAll(List<Literal> literals) {
        List<Literal> complemented = new ArrayList<>(literals.size());
        for (Literal literal : literals) {
            complemented.add(literal.negate());
        }
        return Collections.unmodifiableList(complemented);
    }

    public static List<WeightedLiteral> complementAllWeighted(List<WeightedLiteral> weightedLiterals) {
        List<WeightedLiteral> complemented = new ArrayList<>(weightedLiterals.size());
        for (WeightedLiteral weightedLiteral : weightedLiterals) {
            complemented.add(weightedLiteral.negate());
        }
        return Collections.unmodifiableList(complemented);
    }

    public static List<Integer> coefficientsOf(List<WeightedLiteral> weightedLiterals) {
        List<Integer> coefficients = new ArrayList<>(weightedLiterals.size());
        for (WeightedLiteral weightedLiteral : weightedLiterals) {
            coefficients.add(weightedLiteral.getCoefficient());
        }
        return coefficients;
    }

    /**
     * ¬(Σ c_i·l_i ≥ k) → Σ c_i·¬l_i ≥ C + 1 - k
     */
    public static WeightedThreshold negateWeighted(List<WeightedLiteral> weightedLiterals, int k) {
        return new WeightedThreshold(complementAllWeighted(weightedLiterals),
                negatedThreshold(coefficientsOf(weightedLiterals), k));
    }

    /**
     * Σ c_i·l_i ≤ k → Σ c_i·¬l_i ≥ C - k
     */
    public static WeightedThreshold toGreaterEqual(List<WeightedLiteral> weightedLiterals, int k) {
        return new WeightedThreshold(complementAllWeighted(weightedLiterals),
                complementedThreshold(coefficientsOf(weightedLiterals), k));
    }

    /**
     * ¬(almeno k di L) → almeno n + 1 - k di ¬L
     */
    public static CardinalityThreshold negateCardinality(List<Literal> literals, int k) {
        return new CardinalityThreshold(complementAll(literals),
                negatedCardinalityThreshold(literals.size(), k));
    }

    /**
     * al più k di L → almeno n - k di ¬L
     */
    public static CardinalityThreshold atMostToAtLeast(List<Literal> literals, int k) {
        return new CardinalityThreshold(complementAll(literals), atMostThreshold(literals.size(), k));
    }

    //endregion
}
