package org.satba.ba;

/**
 * Politica di reificazione e di asserzione alla radice.
 *
 * Un'asserzione è incondizionata quando è la formula più esterna (isRoot) e non ci
 * sono scope di backtracking aperti: in quel caso il vincolo vale per tutto il resto
 * della sessione e viene memorizzato senza tag. In ogni altro caso serve una
 * variabile fresca che ne rappresenti il valore di verità.
 */
public final class ReificationPolicy {

    private ReificationPolicy() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @return true se il vincolo può essere asserito senza tag
     */
    public static boolean isUnconditional(boolean isRoot, int scopeDepth) {
        return isRoot && scopeDepth == 0;
    }

    /**
     * Le uguaglianze si asseriscono come due metà senza combinatore solo se
     * incondizionate e non negate: la negazione di una congiunzione richiede il combinatore.
     */
    public static boolean isUnconditionalConjunction(boolean isRoot, boolean sign, int scopeDepth) {
        return !sign && isUnconditional(isRoot, scopeDepth);
    }

    /**
     * Le catene di parità producono sempre un letterale. Un'uguaglianza ne produce uno
     * se non è una congiunzione incondizionata, ogni altra soglia se non è incondizionata.
     *
     * @return true se l'internalizzazione del termine produce un letterale in cache
     */
    public static boolean isReified(ConstraintKind kind, boolean isRoot, boolean sign, int scopeDepth) {
        return switch (kind) {
            case PARITY_CHAIN -> true;
            case EQ -> !isUnconditionalConjunction(isRoot, sign, scopeDepth);
            case AT_MOST_K, AT_LEAST_K, LE, GE -> !isUnconditional(isRoot, scopeDepth);
        };
    }
}
