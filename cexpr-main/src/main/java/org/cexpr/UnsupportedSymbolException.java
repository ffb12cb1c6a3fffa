package org.cexpr;

public class UnsupportedSymbolException extends ExpressionTranslateException {

    private final String symbolKind;
    private final String symbol;

    public UnsupportedSymbolException(String symbolKind, String symbol) {
        super("Unsupported " + symbolKind + " symbol \"" + symbol + "\"", symbol);
        this.symbolKind = symbolKind;
        this.symbol = symbol;
    }

    /**
     * @return "unary", "binary" or "shift"
     */
    public String getSymbolKind() {
        return symbolKind;
    }

    public String getSymbol() {
        return symbol;
    }
}
