package org.cexpr.ast;

public enum UnaryOperator {
    PLUS("+"),
    NEGATE("-"),
    NOT("not");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the target language spelling
     */
    public String symbol() {
        return symbol;
    }
}
