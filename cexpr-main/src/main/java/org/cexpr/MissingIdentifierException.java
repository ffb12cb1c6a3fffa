package org.cexpr;

public class MissingIdentifierException extends ExpressionTranslateException {

    private final String identifier;

    public MissingIdentifierException(String identifier) {
        super("Missing identifier \"" + identifier + "\"", identifier);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
