package org.cexpr.parser.antlr4;

import java.util.ArrayList;
import java.util.List;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.cexpr.ExpressionParseException;

/**
 * Collects lexer and parser errors instead of printing them, so a failed parse can be reported
 * as a single {@link ExpressionParseException}.
 */
class SyntaxErrorCollector extends BaseErrorListener {

    record SyntaxError(int line, int column, String message) {
    }

    private final List<SyntaxError> errors = new ArrayList<>();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
                            String msg, RecognitionException e) {
        errors.add(new SyntaxError(line, charPositionInLine + 1, msg));
    }

    void throwIfAny(String expression) {
        if (errors.isEmpty()) {
            return;
        }
        SyntaxError first = errors.get(0);
        String message = String.format("Parse error at line %d:%d - %s", first.line(), first.column(), first.message());
        if (errors.size() > 1) {
            message += " (and " + (errors.size() - 1) + " more)";
        }
        throw new ExpressionParseException(message, expression, first.line(), first.column(), errors.size());
    }
}
