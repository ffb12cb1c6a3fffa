package org.cexpr;

/**
 * Raised by a {@link org.cexpr.cst.CstProvider} when the source is not a well-formed expression.
 * Position and message describe the first syntax error; {@link #getErrorCount()} tells how many
 * the parser reported in total.
 */
public class ExpressionParseException extends CExprException {

    private final String expression;
    private final int line;
    private final int column;
    private final int errorCount;

    public ExpressionParseException(String message, String expression, int line, int column, int errorCount) {
        super(message);
        this.expression = expression;
        this.line = line;
        this.column = column;
        this.errorCount = errorCount;
    }

    public String getExpression() {
        return expression;
    }

    public int getLine() {
        return line;
    }

    /**
     * @return the one-based column of the first error
     */
    public int getColumn() {
        return column;
    }

    public int getErrorCount() {
        return errorCount;
    }
}
