package org.cexpr.literal;

import java.nio.charset.StandardCharsets;

import org.cexpr.ast.AstNode.StringLiteral;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StringLiteralDecoderTest {

    @Test
    void quotesAreStrippedAndEscapesDecoded() {
        StringLiteral literal = StringLiteralDecoder.decode("\"foo\\n\"");

        assertThat(literal.bytes()).containsExactly('f', 'o', 'o', '\n');
    }

    @Test
    void emptyString() {
        assertThat(StringLiteralDecoder.decode("\"\"").bytes()).isEmpty();
    }

    @Test
    void hexEscapeTakesTwoDigits() {
        assertThat(StringLiteralDecoder.decodeBytes("\\x41BC")).containsExactly('A', 'B', 'C');
    }

    @Test
    void hexEscapeWithoutTwoDigitsIsKeptAsText() {
        assertThat(StringLiteralDecoder.decodeBytes("\\x4")).containsExactly('\\', 'x', '4');
    }

    @Test
    void octalEscapeTakesExactlyThreeDigits() {
        assertThat(StringLiteralDecoder.decodeBytes("\\1014")).containsExactly('A', '4');
        assertThat(StringLiteralDecoder.decodeBytes("a\\012b")).containsExactly('a', '\n', 'b');
        assertThat(StringLiteralDecoder.decodeBytes("\\0")).containsExactly(0);
        assertThat(StringLiteralDecoder.decodeBytes("\\12")).containsExactly('\\', '1', '2');
        assertThat(StringLiteralDecoder.decodeBytes("\\400")).containsExactly(0xFF);
    }

    @Test
    void simpleEscapes() {
        assertThat(StringLiteralDecoder.decodeBytes("\\t\\\"\\\\\\?"))
                .containsExactly('\t', '"', '\\', '?');
    }

    @Test
    void unknownEscapeKeepsTheBackslash() {
        assertThat(StringLiteralDecoder.decodeBytes("\\q")).containsExactly('\\', 'q');
        assertThat(StringLiteralDecoder.decodeBytes("end\\")).containsExactly('e', 'n', 'd', '\\');
    }

    @Test
    void nonAsciiIsWrittenAsUtf8() {
        assertThat(StringLiteralDecoder.decodeBytes("café"))
                .isEqualTo("café".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void encodingPrefixIsStripped() {
        assertThat(StringLiteralDecoder.decode("u8\"ok\"").bytes()).containsExactly('o', 'k');
    }
}
