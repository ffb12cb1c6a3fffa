package org.cexpr.ast;

public enum BinaryOperator {
    OR("or"),
    AND("and"),
    XOR("xor"),
    MOD("mod"),
    EQUALS("=="),
    NOT_EQUALS("!="),
    PLUS("+"),
    MINUS("-"),
    DIVIDE("/"),
    MULTIPLY("*"),
    GREATER(">"),
    LESS("<"),
    GREATER_EQUALS(">="),
    LESS_EQUALS("<="),
    SHIFT_LEFT("shl"),
    SHIFT_RIGHT("shr");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the target language spelling
     */
    public String symbol() {
        return symbol;
    }
}
