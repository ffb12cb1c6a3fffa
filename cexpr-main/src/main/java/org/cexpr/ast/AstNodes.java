package org.cexpr.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Factories for composite nodes. Each returns {@link AstNode#ABSENT} when one of the required
 * children is absent, so a placeholder operand makes the enclosing expression absent instead of
 * producing a partial tree.
 */
public final class AstNodes {

    public static final String TYPEOF = "typeof";
    public static final String SIZEOF = "sizeof";

    private AstNodes() {
    }

    public static AstNode identifier(String name) {
        return new AstNode.Identifier(name);
    }

    /**
     * @return {@code typeof(node)}, the late-bound type of an already translated operand
     */
    public static AstNode typeOf(AstNode node) {
        return call(identifier(TYPEOF), node);
    }

    public static AstNode sizeOf(AstNode node) {
        return call(identifier(SIZEOF), node);
    }

    public static AstNode call(AstNode callee, AstNode... arguments) {
        if (callee.isAbsent() || anyAbsent(Arrays.asList(arguments))) {
            return AstNode.ABSENT;
        }
        return new AstNode.Call(callee, Arrays.asList(arguments));
    }

    public static AstNode unary(UnaryOperator operator, AstNode operand) {
        return operand.isAbsent() ? AstNode.ABSENT : new AstNode.UnaryOp(operator, operand);
    }

    public static AstNode binary(BinaryOperator operator, AstNode left, AstNode right) {
        if (left.isAbsent() || right.isAbsent()) {
            return AstNode.ABSENT;
        }
        return new AstNode.BinaryOp(operator, left, right);
    }

    public static AstNode cast(AstNode type, AstNode operand) {
        if (type.isAbsent() || operand.isAbsent()) {
            return AstNode.ABSENT;
        }
        return new AstNode.Cast(type, operand);
    }

    public static AstNode paren(AstNode... items) {
        return paren(Arrays.asList(items));
    }

    public static AstNode paren(List<AstNode> items) {
        return anyAbsent(items) ? AstNode.ABSENT : new AstNode.Paren(items);
    }

    public static AstNode statements(List<AstNode> items) {
        return anyAbsent(items) ? AstNode.ABSENT : new AstNode.StatementList(items);
    }

    private static boolean anyAbsent(List<AstNode> nodes) {
        for (AstNode node : nodes) {
            if (node.isAbsent()) {
                return true;
            }
        }
        return false;
    }
}
