package org.satba.support;

import java.util.Collection;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * VINCOLO DI ALGEBRA BOOLEANA - Base comune dei vincoli memorizzati nello store
 *
 * Ogni vincolo ha un corpo (letterali eventualmente pesati) e un letterale di
 * reificazione opzionale ("tag"). Con tag il vincolo memorizzato è l'equivalenza
 * tag ↔ corpo; senza tag il corpo vale incondizionatamente.
 *
 * INVARIANTI:
 * • La variabile del tag non compare mai tra i letterali del corpo
 * • Il vincolo è immutabile dopo la costruzione
 * • Il flag redundant distingue vincoli appresi/ridondanti da vincoli originali
 */
public abstract class BooleanConstraint {

    /**
     * Famiglie di vincoli supportate dallo store.
     */
    public enum Type {
        CARDINALITY,      // almeno k letterali veri
        PSEUDO_BOOLEAN,   // somma pesata dei letterali veri ≥ k
        PARITY            // numero dispari di letterali veri
    }

    private final Literal tag;
    private final boolean redundant;

    /**
     * @param tag letterale di reificazione, null per vincoli asseriti alla radice
     * @param redundant true se il vincolo è ridondante
     */
    protected BooleanConstraint(Literal tag, boolean redundant) {
        this.tag = tag;
        this.redundant = redundant;
    }

    /**
     * Verifica che la variabile del tag non compaia nel corpo.
     *
     * @throws IllegalArgumentException se il tag occorre nel corpo
     */
    protected final void validateTagNotInBody(Collection<Literal> bodyLiterals) {
        if (tag == null) {
            return;
        }
        for (Literal literal : bodyLiterals) {
            if (literal.getVariable() == tag.getVariable()) {
                throw new IllegalArgumentException("La variabile del tag " + tag
                        + " compare nel corpo del vincolo");
            }
        }
    }

    /**
     * @return famiglia del vincolo
     */
    public abstract Type type();

    /**
     * Valuta il corpo del vincolo sotto un assegnamento.
     *
     * @param truth restituisce true se il letterale è vero nell'assegnamento
     */
    public abstract boolean isBodySatisfiedBy(Predicate<Literal> truth);

    /**
     * Valuta il vincolo completo: tag ↔ corpo se il tag è presente, altrimenti il corpo.
     */
    public boolean isSatisfiedBy(Predicate<Literal> truth) {
        boolean body = isBodySatisfiedBy(truth);
        return tag == null ? body : truth.test(tag) == body;
    }

    public Optional<Literal> getTag() {
        return Optional.ofNullable(tag);
    }

    public boolean hasTag() {
        return tag != null;
    }

    public boolean isRedundant() {
        return redundant;
    }

    /**
     * Prefisso testuale comune: "tag ↔ " se presente.
     */
    protected String tagPrefix() {
        return tag == null ? "" : tag + " ↔ ";
    }
}
