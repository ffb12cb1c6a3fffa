package org.cexpr;

public class CExprException extends RuntimeException {

    public CExprException(String message) {
        super(message);
    }

    public CExprException(String message, Throwable cause) {
        super(message, cause);
    }
}
