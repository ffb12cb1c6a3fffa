package org.cexpr;

/**
 * Base class of every failure raised while walking a CST. The translation driver catches these
 * and reports the whole expression as untranslated.
 */
public class ExpressionTranslateException extends CExprException {

    private final String nodeDescription;

    public ExpressionTranslateException(String message, String nodeDescription) {
        super(message);
        this.nodeDescription = nodeDescription;
    }

    public ExpressionTranslateException(String message, String nodeDescription, Throwable cause) {
        super(message, cause);
        this.nodeDescription = nodeDescription;
    }

    /**
     * @return the source text (or symbol) the failing rule was applied to
     */
    public String getNodeDescription() {
        return nodeDescription;
    }
}
