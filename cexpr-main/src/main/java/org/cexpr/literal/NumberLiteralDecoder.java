package org.cexpr.literal;

import java.math.BigInteger;

import org.cexpr.LiteralDecodeException;
import org.cexpr.ast.AstNode;
import org.cexpr.ast.AstNodes;
import org.cexpr.ast.FloatKind;
import org.cexpr.ast.IntKind;
import org.cexpr.ast.Radix;
import org.cexpr.ast.UnaryOperator;

/**
 * Decodes C number literals.
 * <pre>
 *   literal := '-'? body suffix?
 *   body    := '0' [xX] hex+ | '0' [bB] [01]+ | '0' oct+
 *            | digit+ '.' digit* exponent? | '.' digit+ exponent? | digit+ exponent
 *            | digit+
 *   suffix  := integer: u, l, ll in the combinations C allows; float: f, F, l, L
 * </pre>
 * A leading minus becomes a negation around the positive literal; it is never folded into the
 * value.
 */
public final class NumberLiteralDecoder {

    private static final BigInteger MAX_UNSIGNED_64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private NumberLiteralDecoder() {
    }

    public static AstNode decode(String literal) {
        return new Scanner(literal.strip()).scan();
    }

    /**
     * Maps an integer suffix onto the literal's width and signedness. Accepts {@code u} before or
     * after {@code l}/{@code ll}, in either case; {@code ll} must not mix cases.
     */
    public static IntKind intKind(String suffix) {
        boolean unsigned = false;
        String size = suffix;
        if (size.startsWith("u") || size.startsWith("U")) {
            unsigned = true;
            size = size.substring(1);
        } else if (size.endsWith("u") || size.endsWith("U")) {
            unsigned = true;
            size = size.substring(0, size.length() - 1);
        }
        return switch (size) {
            case "" -> unsigned ? IntKind.UINT : IntKind.INT;
            case "l", "L" -> unsigned ? IntKind.UINT32 : IntKind.INT32;
            case "ll", "LL" -> unsigned ? IntKind.UINT64 : IntKind.INT64;
            default -> throw new LiteralDecodeException("Invalid integer suffix \"" + suffix + "\"", suffix);
        };
    }

    public static FloatKind floatKind(String suffix) {
        return switch (suffix) {
            case "" -> FloatKind.FLOAT;
            // TODO: emit a 128-bit kind for 'l'/'L' once the AST can carry long double values
            case "f", "F", "l", "L" -> FloatKind.FLOAT64;
            default -> throw new LiteralDecodeException("Invalid float suffix \"" + suffix + "\"", suffix);
        };
    }

    private static final class Scanner {

        private final String text;
        private int pos;

        Scanner(String text) {
            this.text = text;
        }

        AstNode scan() {
            boolean negative = peek() == '-';
            if (negative) {
                pos++;
            }

            AstNode literal;
            if (lookingAtPrefix('x', 'X')) {
                literal = integer(radixDigits(Radix.HEXADECIMAL), Radix.HEXADECIMAL);
            } else if (lookingAtPrefix('b', 'B')) {
                literal = integer(radixDigits(Radix.BINARY), Radix.BINARY);
            } else {
                literal = decimalOrOctal();
            }

            return negative ? AstNodes.unary(UnaryOperator.NEGATE, literal) : literal;
        }

        private AstNode decimalOrOctal() {
            int start = pos;
            String whole = digits();
            boolean fraction = peek() == '.';
            String fractionDigits = "";
            if (fraction) {
                pos++;
                fractionDigits = digits();
            }
            if (whole.isEmpty() && fractionDigits.isEmpty()) {
                throw noNumber();
            }
            boolean exponent = exponent();
            if (fraction || exponent) {
                String body = text.substring(start, pos);
                FloatKind kind = floatKind(rest());
                double value;
                try {
                    value = Double.parseDouble(body);
                } catch (NumberFormatException e) {
                    throw new LiteralDecodeException("Could not parse float value \"" + body + "\"", text, e);
                }
                if (Double.isInfinite(value)) {
                    throw new LiteralDecodeException("Float literal out of range \"" + text + "\"", text);
                }
                return new AstNode.FloatLiteral(value, kind);
            }
            if (whole.length() > 1 && whole.charAt(0) == '0') {
                return integer(whole.substring(1), Radix.OCTAL);
            }
            return integer(whole, Radix.DECIMAL);
        }

        private AstNode integer(String digits, Radix radix) {
            IntKind kind = intKind(rest());
            BigInteger value;
            try {
                value = new BigInteger(digits, radix.base());
            } catch (NumberFormatException e) {
                throw new LiteralDecodeException("Invalid digits for base " + radix.base() + " in \"" + text + "\"", text, e);
            }
            if (value.compareTo(MAX_UNSIGNED_64) > 0) {
                throw new LiteralDecodeException("Integer literal out of range \"" + text + "\"", text);
            }
            return new AstNode.IntLiteral(value, kind, radix);
        }

        private boolean lookingAtPrefix(char lower, char upper) {
            if (pos + 1 < text.length() && text.charAt(pos) == '0') {
                char marker = text.charAt(pos + 1);
                if (marker == lower || marker == upper) {
                    pos += 2;
                    return true;
                }
            }
            return false;
        }

        private String radixDigits(Radix radix) {
            int start = pos;
            while (pos < text.length() && Character.digit(text.charAt(pos), radix.base()) >= 0) {
                pos++;
            }
            if (pos == start) {
                throw noNumber();
            }
            return text.substring(start, pos);
        }

        // Digits 8 and 9 are scanned too so that "09" fails as a bad octal literal.
        private String digits() {
            int start = pos;
            while (pos < text.length() && text.charAt(pos) >= '0' && text.charAt(pos) <= '9') {
                pos++;
            }
            return text.substring(start, pos);
        }

        private boolean exponent() {
            if (peek() != 'e' && peek() != 'E') {
                return false;
            }
            pos++;
            if (peek() == '+' || peek() == '-') {
                pos++;
            }
            if (digits().isEmpty()) {
                throw new LiteralDecodeException("Missing exponent digits in \"" + text + "\"", text);
            }
            return true;
        }

        private String rest() {
            String suffix = text.substring(pos);
            pos = text.length();
            return suffix;
        }

        private char peek() {
            return pos < text.length() ? text.charAt(pos) : '\0';
        }

        private LiteralDecodeException noNumber() {
            return new LiteralDecodeException("Could not find a number in number_literal: \"" + text + "\"", text);
        }
    }
}
