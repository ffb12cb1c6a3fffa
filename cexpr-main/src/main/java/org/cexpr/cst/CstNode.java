package org.cexpr.cst;

import java.util.Optional;

/**
 * Read-only view of a concrete syntax tree node.
 * <p>
 * Named children are the sub-expressions a handler recurses into. Raw children additionally
 * contain the anonymous token leaves (operators, parentheses) in source order, so an operator
 * symbol is read by raw position.
 */
public interface CstNode {

    /**
     * @return the grammar's tag for this node, for example {@code "math_expression"}
     */
    String kindName();

    default CstKind kind() {
        return CstKind.fromName(kindName());
    }

    /**
     * @return the source text covered by this node, without surrounding whitespace
     */
    String text();

    int startIndex();

    /**
     * @return the exclusive end offset of this node's span
     */
    int endIndex();

    /**
     * @return false for anonymous tokens such as operators and punctuation
     */
    boolean isNamed();

    int childCount();

    CstNode child(int index);

    int rawChildCount();

    CstNode rawChild(int index);

    Optional<CstNode> parent();
}
