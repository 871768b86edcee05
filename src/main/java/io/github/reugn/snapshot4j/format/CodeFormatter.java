package io.github.reugn.snapshot4j.format;

import io.github.reugn.snapshot4j.error.FormattingException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Lays out generated Java source according to a {@link FormatProfile}.
 *
 * <p>The formatter works on brackets, literals and comments only; it never parses Java.
 * <ul>
 *   <li>Each line is indented one level deeper than the line that opened the innermost
 *       bracket still open at its start. A line starting with a closing bracket is indented
 *       like the line that opened it.</li>
 *   <li>Continuation lines of a block comment ({@code * ...}) are indented one extra space.</li>
 *   <li>The last element of a multi-line array initializer gets a trailing comma.</li>
 *   <li>Trailing whitespace is trimmed, trailing blank lines are collapsed and line endings
 *       are normalised as the profile says.</li>
 * </ul>
 *
 * <p>Formatting is idempotent: formatting already formatted text returns it unchanged.
 * Brackets and quotes inside string literals, char literals and comments are ignored.
 * Text blocks are not supported.
 */
public final class CodeFormatter {

    private CodeFormatter() {
    }

    /**
     * Formats source text.
     *
     * @param text    the source text, with any line endings
     * @param profile the layout rules
     * @return the formatted text
     * @throws FormattingException if brackets are unbalanced or a literal or comment is unterminated
     */
    public static String format(String text, FormatProfile profile) {
        return new Pass(profile).run(text);
    }

    private record Open(char bracket, int lineIndent, boolean arrayInitializer, int line) {
    }

    private static final class Pass {
        private final FormatProfile profile;
        private final String unit;
        private final List<StringBuilder> out = new ArrayList<>();
        private final Deque<Open> open = new ArrayDeque<>();

        private boolean inBlockComment;
        private char previous;
        private int previousLine = -1;
        private int previousOffset = -1;
        private int shift;

        Pass(FormatProfile profile) {
            this.profile = profile;
            this.unit = profile.indentUnit();
        }

        String run(String text) {
            String[] lines = text.split("\r\n|\r|\n", -1);
            for (int i = 0; i < lines.length; i++) {
                formatLine(lines[i], i);
            }
            if (inBlockComment) {
                throw new FormattingException("unterminated block comment");
            }
            if (!open.isEmpty()) {
                Open unclosed = open.peek();
                throw new FormattingException("unbalanced brackets: '" + unclosed.bracket()
                        + "' opened at line " + (unclosed.line() + 1) + " is never closed");
            }
            return assemble();
        }

        private void formatLine(String raw, int lineNo) {
            String content = raw.stripLeading();
            StringBuilder line = new StringBuilder();
            out.add(line);
            if (content.isEmpty()) {
                return;
            }

            int indent;
            boolean continuation = inBlockComment && content.charAt(0) == '*';
            if (!inBlockComment && isCloser(content.charAt(0)) && !open.isEmpty()) {
                indent = open.peek().lineIndent();
            } else {
                indent = open.isEmpty() ? 0 : open.peek().lineIndent() + 1;
            }
            line.append(unit.repeat(indent));
            if (continuation) {
                line.append(' ');
            }
            int base = line.length();
            line.append(content);
            shift = 0;

            int i = 0;
            while (i < content.length()) {
                char c = content.charAt(i);
                if (inBlockComment) {
                    if (c == '*' && next(content, i) == '/') {
                        inBlockComment = false;
                        i += 2;
                    } else {
                        i++;
                    }
                    continue;
                }
                if (c == '/' && next(content, i) == '/') {
                    return;
                }
                if (c == '/' && next(content, i) == '*') {
                    inBlockComment = true;
                    i += 2;
                    continue;
                }
                if (c == '"' || c == '\'') {
                    if (c == '"' && content.startsWith("\"\"\"", i)) {
                        throw new FormattingException("text blocks are not supported (line " + (lineNo + 1) + ")");
                    }
                    i = skipLiteral(content, i, lineNo);
                    markSignificant(c, lineNo, base + shift + i);
                    i++;
                    continue;
                }
                if (c == '(' || c == '[' || c == '{') {
                    boolean array = c == '{' && startsArrayInitializer();
                    open.push(new Open(c, indent, array, lineNo));
                } else if (isCloser(c)) {
                    close(c, lineNo);
                }
                if (!Character.isWhitespace(c)) {
                    markSignificant(c, lineNo, base + shift + i);
                }
                i++;
            }
        }

        private boolean startsArrayInitializer() {
            return switch (previous) {
                case ']', '=', ',', '(' -> true;
                case '{' -> !open.isEmpty() && open.peek().arrayInitializer();
                default -> false;
            };
        }

        private void close(char closer, int lineNo) {
            if (open.isEmpty()) {
                throw new FormattingException("unbalanced brackets: unexpected '" + closer
                        + "' at line " + (lineNo + 1));
            }
            Open opener = open.pop();
            if (opener.bracket() != matching(closer)) {
                throw new FormattingException("unbalanced brackets: '" + closer + "' at line " + (lineNo + 1)
                        + " does not close '" + opener.bracket() + "' opened at line " + (opener.line() + 1));
            }
            if (opener.arrayInitializer() && opener.line() != lineNo && previous != ',' && previous != '{') {
                out.get(previousLine).insert(previousOffset + 1, ',');
                if (previousLine == lineNo) {
                    shift++;
                }
                previous = ',';
                previousOffset++;
            }
        }

        private int skipLiteral(String content, int start, int lineNo) {
            char quote = content.charAt(start);
            int i = start + 1;
            while (i < content.length()) {
                char c = content.charAt(i);
                if (c == '\\') {
                    i += 2;
                    continue;
                }
                if (c == quote) {
                    return i;
                }
                i++;
            }
            throw new FormattingException("unterminated " + (quote == '"' ? "string" : "char")
                    + " literal at line " + (lineNo + 1));
        }

        private void markSignificant(char c, int lineNo, int offset) {
            previous = c;
            previousLine = lineNo;
            previousOffset = offset;
        }

        private String assemble() {
            List<String> lines = new ArrayList<>(out.size());
            for (StringBuilder line : out) {
                String s = line.toString();
                if (profile.trimTrailingWhitespace() || s.isBlank()) {
                    s = s.stripTrailing();
                }
                lines.add(s);
            }
            int end = lines.size();
            while (end > 0 && lines.get(end - 1).isEmpty()) {
                end--;
            }
            if (end == 0) {
                return "";
            }
            String separator = profile.lineEnding().separator();
            String body = String.join(separator, lines.subList(0, end));
            return profile.insertFinalNewline() ? body + separator : body;
        }

        private static char next(String s, int i) {
            return i + 1 < s.length() ? s.charAt(i + 1) : '\0';
        }

        private static boolean isCloser(char c) {
            return c == ')' || c == ']' || c == '}';
        }

        private static char matching(char closer) {
            return switch (closer) {
                case ')' -> '(';
                case ']' -> '[';
                default -> '{';
            };
        }
    }
}
