package org.satba.term;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.satba.antlr.BooleanAlgebraBaseVisitor;
import org.satba.antlr.BooleanAlgebraLexer;
import org.satba.antlr.BooleanAlgebraParser;
import org.satba.antlr.BooleanAlgebraParser.AndContext;
import org.satba.antlr.BooleanAlgebraParser.ArgumentListContext;
import org.satba.antlr.BooleanAlgebraParser.AtLeastContext;
import org.satba.antlr.BooleanAlgebraParser.AtMostContext;
import org.satba.antlr.BooleanAlgebraParser.BiconditionalContext;
import org.satba.antlr.BooleanAlgebraParser.ComparisonContext;
import org.satba.antlr.BooleanAlgebraParser.ExactlyContext;
import org.satba.antlr.BooleanAlgebraParser.FalseContext;
import org.satba.antlr.BooleanAlgebraParser.FormulaContext;
import org.satba.antlr.BooleanAlgebraParser.IdContext;
import org.satba.antlr.BooleanAlgebraParser.IffContext;
import org.satba.antlr.BooleanAlgebraParser.NotContext;
import org.satba.antlr.BooleanAlgebraParser.OrContext;
import org.satba.antlr.BooleanAlgebraParser.ParContext;
import org.satba.antlr.BooleanAlgebraParser.PrimContext;
import org.satba.antlr.BooleanAlgebraParser.PseudoBooleanContext;
import org.satba.antlr.BooleanAlgebraParser.TrueContext;
import org.satba.antlr.BooleanAlgebraParser.WeightedTermContext;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER ASSERZIONI - Convertitore da albero sintattico ANTLR a {@link Term}
 *
 * Implementa un visitor sull'albero generato dalla grammatica BooleanAlgebra,
 * costruendo il termine di superficie corrispondente senza alcuna trasformazione
 * semantica: la catena di biimplicazioni resta annidata a destra e i coefficienti
 * restano valori decimali esatti, così che la validazione di range avvenga
 * durante l'internalizzazione.
 *
 * OPERATORI SUPPORTATI (in ordine di precedenza crescente):
 * - Biimplicazione (<->): annidata a destra, a <-> b <-> c ~ a <-> (b <-> c)
 * - Disgiunzione (|) e congiunzione (&): n-arie
 * - Negazione (!)
 * - atleast(k: ...), atmost(k: ...), exactly(k: ...), pb(c1 t1 + ... >= k)
 * - Identificatori e costanti true/false
 */
public class TermParser extends BooleanAlgebraBaseVisitor<Term> {

    private static final Logger LOGGER = Logger.getLogger(TermParser.class.getName());

    //region PUNTO DI INGRESSO

    /**
     * Analizza una singola asserzione testuale.
     *
     * @param text asserzione nella sintassi della grammatica BooleanAlgebra
     * @return termine di superficie corrispondente
     * @throws IllegalArgumentException se il testo non è sintatticamente valido
     */
    public static Term parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("Asserzione vuota");
        }

        BooleanAlgebraLexer lexer = new BooleanAlgebraLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        BooleanAlgebraParser parser = new BooleanAlgebraParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        Term term = new TermParser().visit(parser.formula());
        LOGGER.fine("Asserzione analizzata: " + term);
        return term;
    }

    @Override
    public Term visitFormula(FormulaContext ctx) {
        return visit(ctx.biconditional());
    }

    //endregion

    //region CONNETTIVI

    /**
     * a <-> rest, con rest già annidato a destra dalla grammatica.
     */
    @Override
    public Term visitIff(IffContext ctx) {
        Term left = visit(ctx.disjunction());
        if (ctx.IFF() == null) {
            return left;
        }
        return Term.iff(left, visit(ctx.biconditional()));
    }

    @Override
    public Term visitOr(OrContext ctx) {
        if (ctx.conjunction().size() == 1) {
            return visit(ctx.conjunction(0));
        }
        List<Term> operands = new ArrayList<>();
        ctx.conjunction().forEach(operand -> operands.add(visit(operand)));
        return Term.or(operands);
    }

    @Override
    public Term visitAnd(AndContext ctx) {
        if (ctx.negation().size() == 1) {
            return visit(ctx.negation(0));
        }
        List<Term> operands = new ArrayList<>();
        ctx.negation().forEach(operand -> operands.add(visit(operand)));
        return Term.and(operands);
    }

    @Override
    public Term visitNot(NotContext ctx) {
        return Term.not(visit(ctx.negation()));
    }

    @Override
    public Term visitPrim(PrimContext ctx) {
        return visit(ctx.atom());
    }

    @Override
    public Term visitPar(ParContext ctx) {
        return visit(ctx.biconditional());
    }

    @Override
    public Term visitTrue(TrueContext ctx) {
        return Term.trueTerm();
    }

    @Override
    public Term visitFalse(FalseContext ctx) {
        return Term.falseTerm();
    }

    @Override
    public Term visitId(IdContext ctx) {
        return Term.atom(ctx.IDENTIFIER().getText());
    }

    //endregion

    //region OPERATORI DI SOGLIA

    @Override
    public Term visitAtLeast(AtLeastContext ctx) {
        return Term.atLeast(number(ctx.NUMBER()), arguments(ctx.argumentList()));
    }

    @Override
    public Term visitAtMost(AtMostContext ctx) {
        return Term.atMost(number(ctx.NUMBER()), arguments(ctx.argumentList()));
    }

    /**
     * exactly(k: ...) è un confronto di uguaglianza a coefficienti unitari.
     */
    @Override
    public Term visitExactly(ExactlyContext ctx) {
        List<Term> operands = arguments(ctx.argumentList());
        List<BigDecimal> ones = new ArrayList<>(Collections.nCopies(operands.size(), BigDecimal.ONE));
        return Term.pbEq(ones, operands, number(ctx.NUMBER()));
    }

    @Override
    public Term visitPseudoBoolean(PseudoBooleanContext ctx) {
        List<BigDecimal> coefficients = new ArrayList<>();
        List<Term> operands = new ArrayList<>();
        for (WeightedTermContext weightedTerm : ctx.weightedTerm()) {
            coefficients.add(weightedTerm.NUMBER() == null ? BigDecimal.ONE : number(weightedTerm.NUMBER()));
            operands.add(visit(weightedTerm.negation()));
        }
        return Term.weighted(comparisonType(ctx.comparison()), coefficients, operands, number(ctx.NUMBER()));
    }

    private Term.Type comparisonType(ComparisonContext ctx) {
        if (ctx.GE() != null) {
            return Term.Type.PB_GE;
        }
        if (ctx.LE() != null) {
            return Term.Type.PB_LE;
        }
        return Term.Type.PB_EQ;
    }

    private List<Term> arguments(ArgumentListContext ctx) {
        List<Term> operands = new ArrayList<>();
        for (BiconditionalContext argument : ctx.biconditional()) {
            operands.add(visit(argument));
        }
        return operands;
    }

    private static BigDecimal number(TerminalNode node) {
        return new BigDecimal(node.getText());
    }

    //endregion

    //region GESTIONE ERRORI SINTATTICI

    /**
     * Trasforma gli errori di lexer e parser in IllegalArgumentException con posizione.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new IllegalArgumentException("Errore sintattico " + line + ":" + charPositionInLine + " " + msg);
        }
    }

    //endregion
}
