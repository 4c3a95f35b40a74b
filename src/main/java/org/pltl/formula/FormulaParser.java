package org.pltl.formula;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.pltl.antlr.PltlFormulaBaseVisitor;
import org.pltl.antlr.PltlFormulaLexer;
import org.pltl.antlr.PltlFormulaParser;
import org.pltl.antlr.PltlFormulaParser.AtomContext;
import org.pltl.antlr.PltlFormulaParser.BinaryContext;
import org.pltl.antlr.PltlFormulaParser.BottomContext;
import org.pltl.antlr.PltlFormulaParser.FormulaContext;
import org.pltl.antlr.PltlFormulaParser.ParContext;
import org.pltl.antlr.PltlFormulaParser.TopContext;
import org.pltl.antlr.PltlFormulaParser.UnaryContext;

import java.util.logging.Logger;

/**
 * PARSER FORMULE PLTL - Convertitore da albero sintattico ANTLR a {@link Formula}
 *
 * Visitor sulla grammatica PltlFormula in notazione prefissa:
 * - Binari: op(f,g) con op tra &amp;, |, =&gt;, S, U
 * - Unari: op f oppure op(f) con op tra !, Y, O, H, X, F, G
 * - Costanti: Top/TRUE, Bottom/FALSE
 * - Identificatori: proposizioni atomiche
 *
 * Gli errori sintattici non vengono recuperati: il primo errore di lexer o parser
 * interrompe l'analisi con {@link MalformedFormulaException}.
 */
public class FormulaParser extends PltlFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    //region PUNTO DI INGRESSO

    /**
     * Analizza il testo di una formula PLTL.
     *
     * @param text formula in notazione prefissa
     * @return albero della formula
     * @throws MalformedFormulaException se il testo non rispetta la grammatica
     */
    public static Formula parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new MalformedFormulaException("Testo formula vuoto");
        }

        CharStream input = CharStreams.fromString(text);
        PltlFormulaLexer lexer = new PltlFormulaLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        PltlFormulaParser parser = new PltlFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        ParseTree tree = parser.formula();
        Formula formula = new FormulaParser().visit(tree);

        LOGGER.fine("Formula analizzata: " + formula);
        return formula;
    }

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        return visit(ctx.expr());
    }

    //endregion

    //region OPERATORI

    @Override
    public Formula visitBinary(BinaryContext ctx) {
        String symbol = ctx.BINARY_OP().getText();
        Formula left = visit(ctx.expr(0));
        Formula right = visit(ctx.expr(1));
        return new Formula(symbol, left, right);
    }

    @Override
    public Formula visitUnary(UnaryContext ctx) {
        String symbol = ctx.UNARY_OP().getText();
        return new Formula(symbol, visit(ctx.expr()), null);
    }

    @Override
    public Formula visitPar(ParContext ctx) {
        return visit(ctx.expr());
    }

    //endregion

    //region FOGLIE

    @Override
    public Formula visitTop(TopContext ctx) {
        return Formula.TRUE;
    }

    @Override
    public Formula visitBottom(BottomContext ctx) {
        return Formula.FALSE;
    }

    @Override
    public Formula visitAtom(AtomContext ctx) {
        String name = ctx.IDENTIFIER().getText();
        LOGGER.finest("Proposizione atomica: " + name);
        return Formula.atom(name);
    }

    //endregion

    //region GESTIONE ERRORI

    /**
     * Listener che converte il primo errore sintattico in eccezione.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new MalformedFormulaException(
                    "Errore di sintassi alla riga " + line + ", colonna " + charPositionInLine + ": " + msg, e);
        }
    }

    //endregion
}
