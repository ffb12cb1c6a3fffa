package org.cexpr.parser.antlr4;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.cexpr.Mode;
import org.cexpr.cst.CstNode;
import org.cexpr.cst.CstProvider;

/**
 * Parses expressions with the generated {@code CExpression} grammar. In {@link Mode#CPP} the lexer
 * also recognizes the C++ alternative operator tokens and {@code ::}.
 * <p>
 * Syntax errors are not recovered from: any lexer or parser error fails the whole parse.
 */
public class Antlr4CstProvider implements CstProvider {

    public static final Antlr4CstProvider INSTANCE = new Antlr4CstProvider();

    @Override
    public CstNode parse(String source, Mode mode) {
        SyntaxErrorCollector errors = new SyntaxErrorCollector();

        CExpressionLexer lexer = new CExpressionLexer(CharStreams.fromString(source));
        lexer.setCpp(mode == Mode.CPP);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        CExpressionParser parser = new CExpressionParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        CExpressionParser.TranslationUnitContext tree = parser.translationUnit();
        errors.throwIfAny(source);

        return new CstTreeBuilder(source).visit(tree);
    }
}
