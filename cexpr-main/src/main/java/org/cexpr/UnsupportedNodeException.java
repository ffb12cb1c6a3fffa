package org.cexpr;

public class UnsupportedNodeException extends ExpressionTranslateException {

    private final String kindName;

    public UnsupportedNodeException(String kindName, String nodeText) {
        super("Unsupported node type \"" + kindName + "\" for node \"" + nodeText + "\"", nodeText);
        this.kindName = kindName;
    }

    public String getKindName() {
        return kindName;
    }
}
