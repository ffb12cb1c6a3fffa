package org.cexpr;

public class LiteralDecodeException extends ExpressionTranslateException {

    public LiteralDecodeException(String message, String literal) {
        super(message, literal);
    }

    public LiteralDecodeException(String message, String literal, Throwable cause) {
        super(message, literal, cause);
    }
}
