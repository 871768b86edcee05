package io.github.reugn.snapshot4j.format;

import io.github.reugn.snapshot4j.error.ErrorKind;
import io.github.reugn.snapshot4j.error.FormattingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CodeFormatter")
class CodeFormatterTest {

    private static String format(String text) {
        return CodeFormatter.format(text, FormatProfile.defaults());
    }

    @Nested
    @DisplayName("Indentation")
    class Indentation {

        @Test
        @DisplayName("Lines inside brackets are indented one level")
        void brackets() {
            assertThat(format("foo(\na,\n      b\n)")).isEqualTo("foo(\n    a,\n    b\n)\n");
        }

        @Test
        @DisplayName("Several brackets opened on one line count as one level")
        void sameLineOpeners() {
            assertThat(format("new Set<>(List.of(\n\"a\",\n\"b\"\n))"))
                    .isEqualTo("new Set<>(List.of(\n    \"a\",\n    \"b\"\n))\n");
        }

        @Test
        @DisplayName("Class bodies and nested blocks")
        void classBody() {
            String input = """
                    public final class A {
                    public static final int X = call(
                    1,
                    2
                    );
                    }
                    """;
            assertThat(format(input)).isEqualTo("""
                    public final class A {
                        public static final int X = call(
                            1,
                            2
                        );
                    }
                    """);
        }

        @Test
        @DisplayName("Tabs are used when the profile asks for them")
        void tabs() {
            FormatProfile profile = FormatProfile.builder().indentStyle(FormatProfile.IndentStyle.TAB).build();
            assertThat(CodeFormatter.format("f(\na,\nb\n)", profile)).isEqualTo("f(\n\ta,\n\tb\n)\n");
        }

        @Test
        @DisplayName("Indent width is configurable")
        void width() {
            FormatProfile profile = FormatProfile.builder().indentWidth(2).build();
            assertThat(CodeFormatter.format("f(\na,\nb\n)", profile)).isEqualTo("f(\n  a,\n  b\n)\n");
        }

        @Test
        @DisplayName("Block comment continuation lines align under the opening star")
        void blockComments() {
            assertThat(format("class A {\n/**\n* Doc\n*/\nint x;\n}"))
                    .isEqualTo("class A {\n    /**\n     * Doc\n     */\n    int x;\n}\n");
        }
    }

    @Nested
    @DisplayName("Array Initializers")
    class ArrayInitializers {

        @Test
        @DisplayName("Multi-line initializers get a trailing comma")
        void trailingComma() {
            assertThat(format("new int[] {\n1,\n2\n}")).isEqualTo("new int[] {\n    1,\n    2,\n}\n");
        }

        @Test
        @DisplayName("Existing trailing commas are kept as is")
        void existingComma() {
            assertThat(format("new int[] {\n1,\n2,\n}")).isEqualTo("new int[] {\n    1,\n    2,\n}\n");
        }

        @Test
        @DisplayName("Single-line initializers and call arguments are left alone")
        void noComma() {
            assertThat(format("new int[] {1, 2}")).isEqualTo("new int[] {1, 2}\n");
            assertThat(format("f(\n1,\n2\n)")).isEqualTo("f(\n    1,\n    2\n)\n");
        }

        @Test
        @DisplayName("Nested initializers")
        void nested() {
            assertThat(format("new int[][] {\n{1, 2},\n{3}\n}"))
                    .isEqualTo("new int[][] {\n    {1, 2},\n    {3},\n}\n");
        }

        @Test
        @DisplayName("Class bodies are not initializers")
        void classBody() {
            assertThat(format("class A {\nint x;\n}")).isEqualTo("class A {\n    int x;\n}\n");
        }
    }

    @Nested
    @DisplayName("Literals and Comments")
    class LiteralsAndComments {

        @Test
        @DisplayName("Brackets inside strings and chars are ignored")
        void stringsIgnored() {
            assertThat(format("f(\n\"(\",\n'}',\n\"\\\"{\"\n)"))
                    .isEqualTo("f(\n    \"(\",\n    '}',\n    \"\\\"{\"\n)\n");
        }

        @Test
        @DisplayName("Brackets inside comments are ignored")
        void commentsIgnored() {
            assertThat(format("f( // (\na /* { */\n)")).isEqualTo("f( // (\n    a /* { */\n)\n");
        }
    }

    @Nested
    @DisplayName("Whitespace and Line Endings")
    class Whitespace {

        @Test
        @DisplayName("Trailing whitespace is trimmed and trailing blank lines collapse")
        void trailing() {
            assertThat(format("a   \n\n\n")).isEqualTo("a\n");
        }

        @Test
        @DisplayName("Blank lines in the middle are kept empty")
        void innerBlankLines() {
            assertThat(format("class A {\n\n    int x;\n}")).isEqualTo("class A {\n\n    int x;\n}\n");
        }

        @Test
        @DisplayName("CRLF input and output")
        void crlf() {
            FormatProfile profile = FormatProfile.builder().lineEnding(FormatProfile.LineEnding.CRLF).build();
            assertThat(CodeFormatter.format("f(\r\na\r\n)", profile)).isEqualTo("f(\r\n    a\r\n)\r\n");
            assertThat(format("f(\r\na\r\n)")).isEqualTo("f(\n    a\n)\n");
        }

        @Test
        @DisplayName("Final newline can be turned off")
        void noFinalNewline() {
            FormatProfile profile = FormatProfile.builder().insertFinalNewline(false).build();
            assertThat(CodeFormatter.format("x\n\n", profile)).isEqualTo("x");
        }

        @Test
        @DisplayName("Empty input stays empty")
        void empty() {
            assertThat(format("")).isEmpty();
            assertThat(format("\n\n")).isEmpty();
        }
    }

    @Test
    @DisplayName("Formatting is idempotent")
    void idempotent() {
        String input = """
                package a;

                /**
                * Doc
                */
                public final class A {
                public static final int[][] X = new int[][] {
                {1, 2},
                {
                3,
                4
                }
                };
                public static final Object Y = f(/* x= */ "a(", g(
                'b'
                ));
                }
                """;
        String once = format(input);
        assertThat(format(once)).isEqualTo(once);
        assertThat(once).contains("            4,\n        },\n    };");
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Unclosed bracket")
        void unclosed() {
            assertThatThrownBy(() -> format("f(\na"))
                    .isInstanceOfSatisfying(FormattingException.class,
                            e -> assertThat(e.kind()).isEqualTo(ErrorKind.FORMATTING_FAILURE))
                    .hasMessageContaining("unbalanced brackets");
        }

        @Test
        @DisplayName("Unexpected or mismatched closer")
        void mismatched() {
            assertThatThrownBy(() -> format("a)")).hasMessageContaining("unexpected ')'");
            assertThatThrownBy(() -> format("(]")).hasMessageContaining("does not close '('");
        }

        @Test
        @DisplayName("Unterminated literals and comments")
        void unterminated() {
            assertThatThrownBy(() -> format("\"abc")).hasMessageContaining("unterminated string literal");
            assertThatThrownBy(() -> format("'a")).hasMessageContaining("unterminated char literal");
            assertThatThrownBy(() -> format("/* open")).hasMessageContaining("unterminated block comment");
        }

        @Test
        @DisplayName("Text blocks are rejected")
        void textBlocks() {
            assertThatThrownBy(() -> format("String s = \"\"\"\nx\n\"\"\";"))
                    .isInstanceOf(FormattingException.class)
                    .hasMessageContaining("text blocks");
        }
    }
}
