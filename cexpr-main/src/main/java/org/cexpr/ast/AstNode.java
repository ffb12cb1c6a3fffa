package org.cexpr.ast;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Target-side expression tree produced by the translator.
 * <p>
 * {@link Absent} is the "no value" sentinel. Composite nodes reject it as a child; use the
 * factories in {@link AstNodes}, which collapse a composite to {@link #ABSENT} instead.
 */
public sealed interface AstNode permits AstNode.Absent, AstNode.IntLiteral, AstNode.FloatLiteral,
        AstNode.CharLiteral, AstNode.StringLiteral, AstNode.Identifier, AstNode.UnaryOp,
        AstNode.BinaryOp, AstNode.Cast, AstNode.Call, AstNode.Paren, AstNode.StatementList {

    AstNode ABSENT = new Absent();

    default boolean isAbsent() {
        return this instanceof Absent;
    }

    record Absent() implements AstNode {
        @Override
        public String toString() {
            return "Absent";
        }
    }

    /**
     * @param value the non-negative literal value; the sign of a negative literal is a separate
     *              {@link UnaryOp}
     */
    record IntLiteral(BigInteger value, IntKind kind, Radix radix) implements AstNode {
        public IntLiteral {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(radix, "radix");
        }

        public static IntLiteral decimal(long value) {
            return new IntLiteral(BigInteger.valueOf(value), IntKind.INT, Radix.DECIMAL);
        }
    }

    record FloatLiteral(double value, FloatKind kind) implements AstNode {
        public FloatLiteral {
            Objects.requireNonNull(kind, "kind");
        }
    }

    record CharLiteral(int value) implements AstNode {
        public CharLiteral {
            if (value < 0 || value > 0xFF) {
                throw new IllegalArgumentException("Char literal out of byte range: " + value);
            }
        }
    }

    record StringLiteral(byte[] bytes) implements AstNode {
        public StringLiteral {
            bytes = bytes.clone();
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof StringLiteral other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "StringLiteral[bytes=" + Arrays.toString(bytes) + "]";
        }
    }

    record Identifier(String name) implements AstNode {
        public Identifier {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Identifier name is blank");
            }
        }
    }

    record UnaryOp(UnaryOperator operator, AstNode operand) implements AstNode {
        public UnaryOp {
            Objects.requireNonNull(operator, "operator");
            requirePresent(operand);
        }
    }

    record BinaryOp(BinaryOperator operator, AstNode left, AstNode right) implements AstNode {
        public BinaryOp {
            Objects.requireNonNull(operator, "operator");
            requirePresent(left);
            requirePresent(right);
        }
    }

    record Cast(AstNode type, AstNode operand) implements AstNode {
        public Cast {
            requirePresent(type);
            requirePresent(operand);
        }
    }

    /**
     * A call, also used for the synthesized coercions ({@code typeof(x)(y)}) and {@code sizeof}.
     */
    record Call(AstNode callee, List<AstNode> arguments) implements AstNode {
        public Call {
            requirePresent(callee);
            arguments = List.copyOf(arguments);
            arguments.forEach(AstNode::requirePresent);
        }
    }

    record Paren(List<AstNode> items) implements AstNode {
        public Paren {
            items = List.copyOf(items);
            items.forEach(AstNode::requirePresent);
        }
    }

    record StatementList(List<AstNode> items) implements AstNode {
        public StatementList {
            items = List.copyOf(items);
            items.forEach(AstNode::requirePresent);
        }
    }

    private static void requirePresent(AstNode child) {
        Objects.requireNonNull(child, "child");
        if (child.isAbsent()) {
            throw new IllegalArgumentException("Absent node cannot be a child of a composite node");
        }
    }
}
