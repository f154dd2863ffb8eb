package org.satba.ba;

import org.satba.support.Literal;
import org.satba.term.Term;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * INTERNALIZZATORE DI ALGEBRA BOOLEANA - Punto d'ingresso dello strato
 *
 * Riceve un termine di soglia (cardinalità o pseudo-booleano) oppure una catena di
 * biimplicazioni e lo traduce nei vincoli nativi del backend, con la negazione
 * opzionale e la distinzione tra asserzione alla radice e sottotermine.
 *
 * PERCORSI:
 * • AT_LEAST_K / AT_MOST_K → lowering di cardinalità
 * • GE / LE / EQ → lowering pseudo-booleano, o di cardinalità se tutti i coefficienti valgono 1
 * • PARITY_CHAIN → vincolo di parità con variabile di chiusura
 *
 * CONTRATTO DI RITORNO:
 * • Optional vuoto: vincolo asserito incondizionatamente, nessun letterale da collegare
 * • Letterale presente: rappresenta il valore di verità del termine (già negato se sign)
 *
 * ERRORI:
 * • {@link CoefficientOutOfRangeException}: termine rifiutato, store invariato
 * • {@link UnsupportedOperatorException}: termine estraneo alle famiglie gestite, errore fatale
 */
public class BooleanAlgebraInternalizer {

    private static final Logger LOGGER = Logger.getLogger(BooleanAlgebraInternalizer.class.getName());

    private final InternalizationContext context;
    private final CardinalityLowering cardinality;
    private final PseudoBooleanLowering pseudoBoolean;
    private final ParityChainCollector parity;

    public BooleanAlgebraInternalizer(InternalizationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("Contesto di internalizzazione non può essere null");
        }
        this.context = context;
        this.cardinality = new CardinalityLowering(context);
        this.pseudoBoolean = new PseudoBooleanLowering(context);
        this.parity = new ParityChainCollector(context);
    }

    //region INTERNALIZZAZIONE

    public Optional<Literal> internalize(Term term, boolean sign, boolean isRoot)
            throws CoefficientOutOfRangeException {
        return internalize(term, sign, isRoot, false);
    }

    public Optional<Literal> internalize(InternalizationRequest request) throws CoefficientOutOfRangeException {
        return internalize(request.term(), request.sign(), request.root(), request.redundant());
    }

    /**
     * @param term termine di soglia o catena di biimplicazioni
     * @param sign true per internalizzare la negazione del termine
     * @param isRoot true se il termine è un'asserzione di primo livello
     * @param redundant flag riportato su ogni vincolo prodotto
     * @return letterale del termine, vuoto se asserito senza tag
     */
    public Optional<Literal> internalize(Term term, boolean sign, boolean isRoot, boolean redundant)
            throws CoefficientOutOfRangeException {
        ConstraintKind kind = ConstraintKind.of(term);

        if (ReificationPolicy.isReified(kind, isRoot, sign, context.scopeDepth())) {
            Optional<Literal> cached = context.lookup(term);
            if (cached.isPresent()) {
                return Optional.of(cached.get().withSign(sign));
            }
        }

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Internalizzazione " + kind + (sign ? " negata" : "") + (isRoot ? " [radice]" : "")
                    + ": " + term);
        }

        try {
            ThresholdValidator.validateOperands(term);
            return dispatch(kind, term, sign, isRoot, redundant);
        } catch (CoefficientOutOfRangeException e) {
            context.recordRejection();
            LOGGER.warning("Asserzione rifiutata: " + term + " - " + e.getMessage());
            throw e;
        }
    }

    private Optional<Literal> dispatch(ConstraintKind kind, Term term, boolean sign, boolean isRoot,
                                       boolean redundant)
            throws CoefficientOutOfRangeException {
        return switch (kind) {
            case AT_MOST_K -> cardinality.convertAtMostK(term, threshold(term), sign, isRoot, redundant);
            case AT_LEAST_K -> cardinality.convertAtLeastK(term, threshold(term), sign, isRoot, redundant);
            case LE -> term.hasUnitCoefficients()
                    ? cardinality.convertAtMostK(term, threshold(term), sign, isRoot, redundant)
                    : pseudoBoolean.convertPbLe(term, threshold(term), sign, isRoot, redundant);
            case GE -> term.hasUnitCoefficients()
                    ? cardinality.convertAtLeastK(term, threshold(term), sign, isRoot, redundant)
                    : pseudoBoolean.convertPbGe(term, threshold(term), sign, isRoot, redundant);
            case EQ -> term.hasUnitCoefficients()
                    ? cardinality.convertEqK(term, threshold(term), sign, isRoot, redundant)
                    : pseudoBoolean.convertPbEq(term, threshold(term), sign, isRoot, redundant);
            case PARITY_CHAIN -> Optional.of(parity.collect(term, sign, redundant));
        };
    }

    private static int threshold(Term term) throws CoefficientOutOfRangeException {
        return ThresholdArithmetic.narrow(term.getThreshold()).orElseReject();
    }

    /**
     * Asserisce il termine come vero al livello corrente. Se l'internalizzazione
     * restituisce un letterale (catene di parità, scope aperti), lo fissa con una clausola unitaria.
     */
    public void assertRoot(Term term) throws CoefficientOutOfRangeException {
        Optional<Literal> literal = internalize(term, false, true);
        literal.ifPresent(unit -> context.addClause(unit));
    }

    //endregion

    //region PROIEZIONE INVERSA

    /**
     * Ricostruisce una formula per ogni vincolo memorizzato nello store del contesto.
     *
     * @param projector mappa ogni letterale in un termine
     * @throws IllegalStateException se il backend del contesto non espone i vincoli memorizzati
     */
    public List<Term> toFormulas(Function<Literal, Term> projector) {
        return ReverseProjector.of(context.getBackend()).toFormulas(projector);
    }

    //endregion

    public InternalizationContext getContext() {
        return context;
    }
}
