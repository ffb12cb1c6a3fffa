package org.cexpr.transpiler;

import java.util.Map;
import java.util.Optional;

import org.cexpr.UnsupportedSymbolException;
import org.cexpr.ast.BinaryOperator;
import org.cexpr.ast.UnaryOperator;

/**
 * Fixed mappings from C operator spellings, including the C++ alternative tokens, to target
 * operators.
 */
public final class OperatorTables {

    private static final Map<String, UnaryOperator> UNARY_OPERATORS = Map.of(
            "+", UnaryOperator.PLUS,
            "-", UnaryOperator.NEGATE,
            "~", UnaryOperator.NOT,
            "!", UnaryOperator.NOT,
            "compl", UnaryOperator.NOT,
            "not", UnaryOperator.NOT
    );

    private static final Map<String, BinaryOperator> BINARY_OPERATORS = Map.ofEntries(
            Map.entry("|", BinaryOperator.OR),
            Map.entry("||", BinaryOperator.OR),
            Map.entry("&", BinaryOperator.AND),
            Map.entry("&&", BinaryOperator.AND),
            Map.entry("^", BinaryOperator.XOR),
            Map.entry("%", BinaryOperator.MOD),
            Map.entry("==", BinaryOperator.EQUALS),
            Map.entry("!=", BinaryOperator.NOT_EQUALS),
            Map.entry("+", BinaryOperator.PLUS),
            Map.entry("-", BinaryOperator.MINUS),
            Map.entry("/", BinaryOperator.DIVIDE),
            Map.entry("*", BinaryOperator.MULTIPLY),
            Map.entry(">", BinaryOperator.GREATER),
            Map.entry("<", BinaryOperator.LESS),
            Map.entry(">=", BinaryOperator.GREATER_EQUALS),
            Map.entry("<=", BinaryOperator.LESS_EQUALS),
            Map.entry("or", BinaryOperator.OR),
            Map.entry("bitor", BinaryOperator.OR),
            Map.entry("and", BinaryOperator.AND),
            Map.entry("bitand", BinaryOperator.AND),
            Map.entry("xor", BinaryOperator.XOR),
            Map.entry("not_eq", BinaryOperator.NOT_EQUALS)
    );

    private static final Map<String, BinaryOperator> SHIFT_OPERATORS = Map.of(
            "<<", BinaryOperator.SHIFT_LEFT,
            ">>", BinaryOperator.SHIFT_RIGHT
    );

    private static final Map<String, String> BOOLEAN_LITERALS = Map.of(
            "true", "true",
            "false", "false"
    );

    private OperatorTables() {
    }

    public static UnaryOperator unary(String symbol) {
        UnaryOperator operator = UNARY_OPERATORS.get(symbol);
        if (operator == null) {
            throw new UnsupportedSymbolException("unary", symbol);
        }
        return operator;
    }

    public static BinaryOperator binary(String symbol) {
        BinaryOperator operator = BINARY_OPERATORS.get(symbol);
        if (operator == null) {
            throw new UnsupportedSymbolException("binary", symbol);
        }
        return operator;
    }

    public static BinaryOperator shift(String symbol) {
        BinaryOperator operator = SHIFT_OPERATORS.get(symbol);
        if (operator == null) {
            throw new UnsupportedSymbolException("shift", symbol);
        }
        return operator;
    }

    public static Optional<String> booleanLiteral(String text) {
        return Optional.ofNullable(BOOLEAN_LITERALS.get(text));
    }
}
