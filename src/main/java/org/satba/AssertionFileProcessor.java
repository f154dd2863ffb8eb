package org.satba;

import org.satba.ba.*;
import org.satba.optionalfeatures.ParityCircuitCache;
import org.satba.optionalfeatures.TseitinOperandInternalizer;
import org.satba.support.ConstraintStore;
import org.satba.support.Literal;
import org.satba.term.Term;
import org.satba.term.TermParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * ELABORAZIONE DI UN FILE DI ASSERZIONI
 *
 * Legge un file con una asserzione per riga e la asserisce alla radice in una
 * sessione nuova. Righe speciali:
 * - vuote o che iniziano con '#': ignorate
 * - "push" / "pop": aprono e chiudono uno scope di backtracking
 *
 * Vincoli di soglia e catene di biimplicazioni passano per l'internalizzatore di
 * algebra booleana; le altre formule diventano una clausola unitaria sul loro
 * letterale di Tseitin. Una asserzione rifiutata per coefficienti fuori range
 * viene riportata e l'elaborazione prosegue; un errore sintattico interrompe il file.
 */
public class AssertionFileProcessor {

    private static final Logger LOGGER = Logger.getLogger(AssertionFileProcessor.class.getName());

    private static final String PUSH_COMMAND = "push";
    private static final String POP_COMMAND = "pop";
    private static final String COMMENT_PREFIX = "#";

    private final boolean useParityCache;

    /**
     * @param useParityCache true per collegare la cache delle relazioni XOR (-opt=x)
     */
    public AssertionFileProcessor(boolean useParityCache) {
        this.useParityCache = useParityCache;
    }

    /**
     * Esito dell'elaborazione di un file.
     *
     * @param store vincoli e clausole rimasti al termine del file
     * @param statistics statistiche della sessione
     * @param formulas formule ricostruite dai vincoli memorizzati
     * @param rejectedLines descrizione delle righe rifiutate
     * @param parityCache cache XOR, null se non attiva
     */
    public record ProcessingReport(ConstraintStore store, InternalizationStatistics statistics, List<Term> formulas,
                                   List<String> rejectedLines, ParityCircuitCache parityCache) {
    }

    public ProcessingReport process(Path input) throws IOException {
        return process(Files.readAllLines(input, StandardCharsets.UTF_8));
    }

    /**
     * @throws IllegalArgumentException per errori sintattici o pop senza scope aperto, con numero di riga
     */
    public ProcessingReport process(List<String> lines) {
        ConstraintStore store = new ConstraintStore();
        ParityCircuitCache parityCache = useParityCache ? new ParityCircuitCache() : null;
        InternalizationContext context = new InternalizationContext(store, new TseitinOperandInternalizer(store),
                parityCache != null ? parityCache : CircuitSimplifier.NO_OP);
        BooleanAlgebraInternalizer internalizer = new BooleanAlgebraInternalizer(context);
        List<String> rejectedLines = new ArrayList<>();

        for (int index = 0; index < lines.size(); index++) {
            String line = lines.get(index).trim();
            int lineNumber = index + 1;
            if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
                continue;
            }

            try {
                switch (line) {
                    case PUSH_COMMAND -> context.pushScope();
                    case POP_COMMAND -> context.popScope();
                    default -> assertLine(TermParser.parse(line), context, internalizer);
                }
            } catch (CoefficientOutOfRangeException e) {
                rejectedLines.add("riga " + lineNumber + ": " + line + " (" + e.getMessage() + ")");
            } catch (IllegalArgumentException | IllegalStateException e) {
                throw new IllegalArgumentException("Riga " + lineNumber + ": " + e.getMessage(), e);
            }
        }

        List<Term> formulas = internalizer.toFormulas(ReverseProjector.variableProjection(store));
        LOGGER.info("Elaborazione completata: " + context.getStatistics().toCompactString());
        return new ProcessingReport(store, context.getStatistics(), formulas, rejectedLines, parityCache);
    }

    private static void assertLine(Term term, InternalizationContext context, BooleanAlgebraInternalizer internalizer)
            throws CoefficientOutOfRangeException {
        if (ConstraintKind.supports(term)) {
            internalizer.assertRoot(term);
        } else {
            ThresholdValidator.validate(term);
            Literal literal = context.internalizeOperand(term, false);
            context.addClause(literal);
        }
    }
}
