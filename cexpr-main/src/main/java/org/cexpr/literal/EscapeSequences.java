package org.cexpr.literal;

import java.util.Map;

/**
 * C's single-character escapes ({@code \n}, {@code \t}, ...) and digit helpers shared by the
 * character and string decoders.
 */
final class EscapeSequences {

    static final int MAX_BYTE = 0xFF;

    private static final Map<Character, Integer> SIMPLE_ESCAPES = Map.ofEntries(
            Map.entry('0', 0x00),
            Map.entry('a', 0x07),
            Map.entry('b', 0x08),
            Map.entry('e', 0x1B),
            Map.entry('f', 0x0C),
            Map.entry('n', 0x0A),
            Map.entry('r', 0x0D),
            Map.entry('t', 0x09),
            Map.entry('v', 0x0B),
            Map.entry('\\', 0x5C),
            Map.entry('\'', 0x27),
            Map.entry('"', 0x22),
            Map.entry('?', 0x3F)
    );

    private EscapeSequences() {
    }

    /**
     * @return the byte for {@code \c}, or -1 if {@code c} does not form a single-character escape
     */
    static int simpleEscape(char c) {
        Integer value = SIMPLE_ESCAPES.get(c);
        return value == null ? -1 : value;
    }

    static boolean isOctalDigit(char c) {
        return c >= '0' && c <= '7';
    }

    static boolean isOctalTriple(String text, int index) {
        return isOctalDigit(text.charAt(index))
                && isOctalDigit(text.charAt(index + 1))
                && isOctalDigit(text.charAt(index + 2));
    }

    static boolean isHexDigit(char c) {
        return Character.digit(c, 16) >= 0 && c < 0x80;
    }

    static int clampToByte(int value) {
        return Math.min(value, MAX_BYTE);
    }
}
