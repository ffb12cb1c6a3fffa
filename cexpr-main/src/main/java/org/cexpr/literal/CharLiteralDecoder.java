package org.cexpr.literal;

import java.math.BigInteger;

import org.cexpr.LiteralDecodeException;
import org.cexpr.ast.AstNode;

/**
 * Decodes C character literals into a single byte value.
 */
public final class CharLiteralDecoder {

    private CharLiteralDecoder() {
    }

    /**
     * @param literal the literal as written, including quotes and an optional encoding prefix
     */
    public static AstNode.CharLiteral decode(String literal) {
        return new AstNode.CharLiteral(decodeChar(stripQuotes(literal, '\'')));
    }

    /**
     * Decodes the text between the quotes of a character literal.
     * <ul>
     *   <li>a single character is its own value</li>
     *   <li>{@code \x} followed by hex digits, and a backslash followed by exactly three octal
     *   digits, are numeric escapes</li>
     *   <li>anything else is looked up as a single-character escape; unknown escapes are 0</li>
     * </ul>
     * The result is clamped to 0-255.
     */
    public static int decodeChar(String inner) {
        if (inner.length() == 1) {
            return EscapeSequences.clampToByte(inner.charAt(0));
        }

        if (inner.startsWith("\\x")) {
            String digits = inner.substring(2);
            if (digits.isEmpty() || !digits.chars().allMatch(c -> EscapeSequences.isHexDigit((char) c))) {
                throw new LiteralDecodeException("Invalid hex escape in char literal \"" + inner + "\"", inner);
            }
            BigInteger value = new BigInteger(digits, 16);
            return value.bitLength() > 8 ? EscapeSequences.MAX_BYTE : value.intValue();
        }

        if (isOctalEscape(inner)) {
            return EscapeSequences.clampToByte(Integer.parseInt(inner.substring(1), 8));
        }

        if (inner.length() == 2 && inner.charAt(0) == '\\') {
            int value = EscapeSequences.simpleEscape(inner.charAt(1));
            if (value >= 0) {
                return value;
            }
        }
        return 0;
    }

    private static boolean isOctalEscape(String inner) {
        return inner.length() == 4 && inner.charAt(0) == '\\' && EscapeSequences.isOctalTriple(inner, 1);
    }

    static String stripQuotes(String literal, char quote) {
        String text = literal.strip();
        int open = text.indexOf(quote);
        if (open < 0 || text.length() - open < 2 || text.charAt(text.length() - 1) != quote) {
            throw new LiteralDecodeException("Malformed literal " + text, text);
        }
        return text.substring(open + 1, text.length() - 1);
    }
}
