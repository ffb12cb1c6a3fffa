package org.cexpr;

public class MissingTypeException extends ExpressionTranslateException {

    private final String typeName;

    public MissingTypeException(String typeName) {
        super("Missing type specifier \"" + typeName + "\"", typeName);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
