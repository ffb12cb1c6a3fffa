package org.cexpr.cst;

import org.cexpr.ExpressionParseException;
import org.cexpr.Mode;

/**
 * Produces the CST of a source expression.
 */
@FunctionalInterface
public interface CstProvider {

    /**
     * @throws ExpressionParseException if the source cannot be parsed in the given mode
     */
    CstNode parse(String source, Mode mode);
}
