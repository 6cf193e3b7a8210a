package org.logica.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.logica.antlr.LogicFormulaBaseVisitor;
import org.logica.antlr.LogicFormulaLexer;
import org.logica.antlr.LogicFormulaParser;
import org.logica.antlr.LogicFormulaParser.AndContext;
import org.logica.antlr.LogicFormulaParser.FalseContext;
import org.logica.antlr.LogicFormulaParser.FormulaContext;
import org.logica.antlr.LogicFormulaParser.IdContext;
import org.logica.antlr.LogicFormulaParser.IffContext;
import org.logica.antlr.LogicFormulaParser.ImpliesContext;
import org.logica.antlr.LogicFormulaParser.NotContext;
import org.logica.antlr.LogicFormulaParser.OrContext;
import org.logica.antlr.LogicFormulaParser.ParContext;
import org.logica.antlr.LogicFormulaParser.PlainContext;
import org.logica.antlr.LogicFormulaParser.QuantifiedContext;
import org.logica.antlr.LogicFormulaParser.TrueContext;
import org.logica.antlr.LogicFormulaParser.VarContext;
import org.logica.exception.LogicSyntaxException;
import org.logica.format.ConnectiveFormat;
import org.logica.proposition.AtomicProposition;
import org.logica.proposition.Connective;
import org.logica.proposition.Proposition;
import org.logica.proposition.TruthConstant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * PARSER DI PROPOSIZIONI - Da testo ad albero {@link Proposition}
 *
 * Visita l'albero sintattico prodotto dalla grammatica LogicFormula e costruisce la
 * proposizione canonica corrispondente. Accetta sia la sintassi limboole sia quella
 * Unicode della stampa leggibile, quindi l'output di {@link Proposition#toLimboole()}
 * e {@link Proposition#toPrettyPrint()} può essere riletto.
 *
 * OPERATORI SUPPORTATI (in ordine di precedenza crescente):
 * • Quantificatori (? ∃, # ∀): il corpo si estende il più a destra possibile
 * • Bicondizionale (&lt;-&gt; ↔): associativo a sinistra
 * • Implicazioni (-&gt; →, &lt;- ←): associative a destra
 * • Disgiunzione (| ∨) e congiunzione (&amp; ∧): n-arie
 * • Negazione (! ~ ¬)
 * • Costanti TRUE ⊤ e FALSE ⊥, identificatori con eventuali apici (a', a-prime, a′)
 *
 * TABELLA DEI SIMBOLI:
 * Lo stesso nome produce sempre la stessa {@link AtomicProposition} per tutta la vita
 * del parser, anche tra chiamate diverse a {@link #parse(String)}.
 */
public class PropositionParser extends LogicFormulaBaseVisitor<Proposition> {

    private static final Logger LOGGER = Logger.getLogger(PropositionParser.class.getName());

    private final Map<String, AtomicProposition> symbols = new LinkedHashMap<>();

    //region PUNTO DI INGRESSO

    /**
     * Analizza il testo di una formula.
     *
     * @param text formula in sintassi limboole o Unicode
     * @return la proposizione canonica
     * @throws LogicSyntaxException se il testo non è una formula valida
     */
    public Proposition parse(String text) {
        LOGGER.fine(() -> "Analisi formula: " + text);

        ThrowingErrorListener errorListener = new ThrowingErrorListener(text);

        LogicFormulaLexer lexer = new LogicFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        LogicFormulaParser parser = new LogicFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        ParseTree tree = parser.formula();
        Proposition result = visit(tree);

        LOGGER.fine(() -> "Formula analizzata: " + result);
        return result;
    }

    /**
     * @return la proposizione atomica associata al nome, creandola se non esiste
     */
    public AtomicProposition variable(String name) {
        return symbols.computeIfAbsent(normalizeName(name), AtomicProposition::named);
    }

    /**
     * @return vista immutabile della tabella dei simboli, nell'ordine di prima apparizione
     */
    public Map<String, AtomicProposition> getSymbols() {
        return Collections.unmodifiableMap(symbols);
    }

    /**
     * Uniforma le varianti del simbolo primo (', -prime) al simbolo della stampa leggibile.
     */
    static String normalizeName(String name) {
        return name.replace("-prime", ConnectiveFormat.PRIME).replace("'", ConnectiveFormat.PRIME);
    }

    //endregion

    //region VISITA DELL'ALBERO SINTATTICO

    @Override
    public Proposition visitFormula(FormulaContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public Proposition visitQuantified(QuantifiedContext ctx) {
        Connective quantifier = ctx.quantifier.getType() == LogicFormulaLexer.EXISTS
                ? Connective.EXIST
                : Connective.UNIV;
        AtomicProposition variable = variable(ctx.IDENTIFIER().getText());
        return Proposition.of(quantifier, variable, visit(ctx.expression()));
    }

    @Override
    public Proposition visitPlain(PlainContext ctx) {
        return visit(ctx.biconditional());
    }

    /**
     * Catene A ↔ B ↔ C sono lette come (A ↔ B) ↔ C.
     */
    @Override
    public Proposition visitIff(IffContext ctx) {
        Proposition result = visit(ctx.implication(0));
        for (int i = 1; i < ctx.implication().size(); i++) {
            result = result.iff(visit(ctx.implication(i)));
        }
        return result;
    }

    /**
     * Catene A → B → C sono lette come A → (B → C).
     */
    @Override
    public Proposition visitImplies(ImpliesContext ctx) {
        Proposition antecedent = visit(ctx.disjunction());
        if (ctx.op == null) {
            return antecedent;
        }
        Proposition consequent = visit(ctx.implication());
        return ctx.op.getType() == LogicFormulaLexer.IMPLIES
                ? antecedent.implies(consequent)
                : antecedent.impliedBy(consequent);
    }

    @Override
    public Proposition visitOr(OrContext ctx) {
        if (ctx.conjunction().size() == 1) {
            return visit(ctx.conjunction(0));
        }
        List<Proposition> operands = new ArrayList<>();
        for (var conjunctionCtx : ctx.conjunction()) {
            operands.add(visit(conjunctionCtx));
        }
        return Proposition.disjunction(operands);
    }

    @Override
    public Proposition visitAnd(AndContext ctx) {
        if (ctx.negation().size() == 1) {
            return visit(ctx.negation(0));
        }
        List<Proposition> operands = new ArrayList<>();
        for (var negationCtx : ctx.negation()) {
            operands.add(visit(negationCtx));
        }
        return Proposition.conjunction(operands);
    }

    @Override
    public Proposition visitNot(NotContext ctx) {
        return visit(ctx.negation()).not();
    }

    @Override
    public Proposition visitVar(VarContext ctx) {
        return visit(ctx.atom());
    }

    @Override
    public Proposition visitPar(ParContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public Proposition visitTrue(TrueContext ctx) {
        return TruthConstant.TOP;
    }

    @Override
    public Proposition visitFalse(FalseContext ctx) {
        return TruthConstant.BOTTOM;
    }

    @Override
    public Proposition visitId(IdContext ctx) {
        return variable(ctx.IDENTIFIER().getText());
    }

    //endregion

    /**
     * Converte il primo errore lessicale o sintattico in {@link LogicSyntaxException},
     * con la posizione del simbolo incriminato nel testo.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        private final String text;

        ThrowingErrorListener(String text) {
            this.text = text;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            int offset = offendingSymbol instanceof Token
                    ? ((Token) offendingSymbol).getStartIndex()
                    : offsetOf(line, charPositionInLine);
            throw new LogicSyntaxException("Errore di sintassi: " + msg, text, offset, e);
        }

        private int offsetOf(int line, int charPositionInLine) {
            int offset = 0;
            for (int currentLine = 1; currentLine < line; currentLine++) {
                int newline = text.indexOf('\n', offset);
                if (newline < 0) {
                    break;
                }
                offset = newline + 1;
            }
            return offset + charPositionInLine;
        }
    }
}
