package org.cexpr.literal;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import org.cexpr.ast.AstNode;

/**
 * Decodes C string literals into the bytes they denote.
 */
public final class StringLiteralDecoder {

    private StringLiteralDecoder() {
    }

    /**
     * @param literal the literal as written, including quotes and an optional encoding prefix
     */
    public static AstNode.StringLiteral decode(String literal) {
        return new AstNode.StringLiteral(decodeBytes(CharLiteralDecoder.stripQuotes(literal, '"')));
    }

    /**
     * Scans left to right, decoding at each position the longest of: {@code \x} with two hex
     * digits, a backslash with exactly three octal digits, a single-character escape, or one plain
     * character. A backslash that starts none of these is kept as is. Characters outside ASCII
     * are written as UTF-8.
     */
    public static byte[] decodeBytes(String inner) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(inner.length());
        int i = 0;
        int length = inner.length();
        while (i < length) {
            char c = inner.charAt(i);
            if (c == '\\' && i + 1 < length) {
                char next = inner.charAt(i + 1);
                if (next == 'x' && i + 3 < length && isHexPair(inner, i + 2)) {
                    out.write(Integer.parseInt(inner.substring(i + 2, i + 4), 16));
                    i += 4;
                    continue;
                }
                if (i + 3 < length && EscapeSequences.isOctalTriple(inner, i + 1)) {
                    out.write(EscapeSequences.clampToByte(Integer.parseInt(inner.substring(i + 1, i + 4), 8)));
                    i += 4;
                    continue;
                }
                int simple = EscapeSequences.simpleEscape(next);
                if (simple >= 0) {
                    out.write(simple);
                    i += 2;
                    continue;
                }
            }

            if (c < 0x80) {
                out.write(c);
                i++;
            } else {
                int codePoint = inner.codePointAt(i);
                out.writeBytes(new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8));
                i += Character.charCount(codePoint);
            }
        }
        return out.toByteArray();
    }

    private static boolean isHexPair(String text, int index) {
        return EscapeSequences.isHexDigit(text.charAt(index)) && EscapeSequences.isHexDigit(text.charAt(index + 1));
    }
}
