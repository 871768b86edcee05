package io.github.reugn.snapshot4j.render;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Literals")
class LiteralsTest {

    @Nested
    @DisplayName("String Literals")
    class Strings {

        @Test
        @DisplayName("Plain text is quoted unchanged")
        void plain() {
            assertThat(Literals.stringLiteral("hello world")).isEqualTo("\"hello world\"");
        }

        @Test
        @DisplayName("Quotes, backslashes and line terminators use short escapes")
        void shortEscapes() {
            assertThat(Literals.stringLiteral("a\"b\\c\nd\re\tf"))
                    .isEqualTo("\"a\\\"b\\\\c\\nd\\re\\tf\"");
        }

        @Test
        @DisplayName("Single quote is not escaped inside a string")
        void singleQuote() {
            assertThat(Literals.stringLiteral("it's")).isEqualTo("\"it's\"");
        }

        @Test
        @DisplayName("Non-ASCII and control characters become unicode escapes")
        void unicodeEscapes() {
            assertThat(Literals.stringLiteral("caf\u00e9")).isEqualTo("\"caf\\u00e9\"");
            assertThat(Literals.stringLiteral("\u0001")).isEqualTo("\"\\u0001\"");
            assertThat(Literals.stringLiteral("\uD83D\uDE00")).isEqualTo("\"\\ud83d\\ude00\"");
        }

        @Test
        @DisplayName("Empty string")
        void empty() {
            assertThat(Literals.stringLiteral("")).isEqualTo("\"\"");
        }
    }

    @Nested
    @DisplayName("Char Literals")
    class Chars {

        @Test
        @DisplayName("Single quote is escaped, double quote is not")
        void quotes() {
            assertThat(Literals.charLiteral('\'')).isEqualTo("'\\''");
            assertThat(Literals.charLiteral('"')).isEqualTo("'\"'");
        }

        @Test
        @DisplayName("Newline uses the short escape")
        void newline() {
            assertThat(Literals.charLiteral('\n')).isEqualTo("'\\n'");
        }
    }

    @Nested
    @DisplayName("Number Literals")
    class Numbers {

        @Test
        @DisplayName("Integral types carry their suffix or cast")
        void integral() {
            assertThat(Literals.intLiteral(-42)).isEqualTo("-42");
            assertThat(Literals.longLiteral(7L)).isEqualTo("7L");
            assertThat(Literals.shortLiteral((short) 3)).isEqualTo("(short) 3");
        }

        @Test
        @DisplayName("Bytes are hexadecimal, negative ones cast")
        void bytes() {
            assertThat(Literals.byteLiteral((byte) 0x01)).isEqualTo("0x01");
            assertThat(Literals.byteLiteral((byte) 127)).isEqualTo("0x7F");
            assertThat(Literals.byteLiteral((byte) -1)).isEqualTo("(byte) 0xFF");
            assertThat(Literals.byteLiteral((byte) -128)).isEqualTo("(byte) 0x80");
            assertThat(Literals.byteValueLiteral((byte) 0x01)).isEqualTo("(byte) 0x01");
            assertThat(Literals.byteValueLiteral((byte) -1)).isEqualTo("(byte) 0xFF");
        }

        @Test
        @DisplayName("Doubles use canonical text")
        void doubles() {
            assertThat(Literals.doubleLiteral(1.5)).isEqualTo("1.5");
            assertThat(Literals.doubleLiteral(1.0)).isEqualTo("1.0");
            assertThat(Literals.doubleLiteral(1.0E-5)).isEqualTo("1.0E-5");
            assertThat(Literals.doubleLiteral(1.0E10)).isEqualTo("1.0E10");
        }

        @Test
        @DisplayName("Non-finite doubles become constants")
        void nonFinite() {
            assertThat(Literals.doubleLiteral(Double.NaN)).isEqualTo("Double.NaN");
            assertThat(Literals.doubleLiteral(Double.POSITIVE_INFINITY)).isEqualTo("Double.POSITIVE_INFINITY");
            assertThat(Literals.doubleLiteral(Double.NEGATIVE_INFINITY)).isEqualTo("Double.NEGATIVE_INFINITY");
            assertThat(Literals.floatLiteral(Float.NaN)).isEqualTo("Float.NaN");
        }

        @Test
        @DisplayName("Floats carry the F suffix")
        void floats() {
            assertThat(Literals.floatLiteral(2.5f)).isEqualTo("2.5F");
        }
    }

    @Test
    @DisplayName("capitalize upper-cases the first letter only")
    void capitalize() {
        assertThat(Literals.capitalize("admin")).isEqualTo("Admin");
        assertThat(Literals.capitalize("")).isEmpty();
        assertThat(Literals.capitalize(null)).isNull();
    }
}
