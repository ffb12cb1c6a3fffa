package org.cexpr;

public class InvalidNodeStructureException extends ExpressionTranslateException {

    private final String kindName;
    private final int childCount;

    public InvalidNodeStructureException(String message, String kindName, String nodeText, int childCount) {
        super(message, nodeText);
        this.kindName = kindName;
        this.childCount = childCount;
    }

    public String getKindName() {
        return kindName;
    }

    public int getChildCount() {
        return childCount;
    }
}
