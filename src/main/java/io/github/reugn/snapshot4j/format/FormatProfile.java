package io.github.reugn.snapshot4j.format;

/**
 * Layout rules applied by {@link CodeFormatter} to generated source text.
 *
 * <p>Defaults: four spaces per level, LF line endings, a single final newline and no
 * trailing whitespace.
 *
 * @param indentStyle            spaces or tabs
 * @param indentWidth            spaces per level; ignored for tabs
 * @param lineEnding             line separator written to the output
 * @param insertFinalNewline     end the text with exactly one line ending
 * @param trimTrailingWhitespace strip spaces and tabs at the end of every line
 */
public record FormatProfile(
        IndentStyle indentStyle,
        int indentWidth,
        LineEnding lineEnding,
        boolean insertFinalNewline,
        boolean trimTrailingWhitespace
) {
    static final FormatProfile DEFAULTS = new FormatProfile(IndentStyle.SPACE, 4, LineEnding.LF, true, true);

    public FormatProfile {
        if (indentStyle == null) {
            throw new NullPointerException("indentStyle");
        }
        if (lineEnding == null) {
            throw new NullPointerException("lineEnding");
        }
        if (indentWidth < 1 || indentWidth > 16) {
            throw new IllegalArgumentException("indentWidth must be between 1 and 16: " + indentWidth);
        }
    }

    public static FormatProfile defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder(DEFAULTS);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Returns the text of one indentation level.
     *
     * @return a tab, or {@link #indentWidth()} spaces
     */
    public String indentUnit() {
        return indentStyle == IndentStyle.TAB ? "\t" : " ".repeat(indentWidth);
    }

    public enum IndentStyle {
        SPACE,
        TAB
    }

    public enum LineEnding {
        LF("\n"),
        CRLF("\r\n");

        private final String separator;

        LineEnding(String separator) {
            this.separator = separator;
        }

        public String separator() {
            return separator;
        }
    }

    public static final class Builder {
        private IndentStyle indentStyle;
        private int indentWidth;
        private LineEnding lineEnding;
        private boolean insertFinalNewline;
        private boolean trimTrailingWhitespace;

        private Builder(FormatProfile base) {
            this.indentStyle = base.indentStyle;
            this.indentWidth = base.indentWidth;
            this.lineEnding = base.lineEnding;
            this.insertFinalNewline = base.insertFinalNewline;
            this.trimTrailingWhitespace = base.trimTrailingWhitespace;
        }

        public Builder indentStyle(IndentStyle indentStyle) {
            this.indentStyle = indentStyle;
            return this;
        }

        public Builder indentWidth(int indentWidth) {
            this.indentWidth = indentWidth;
            return this;
        }

        public Builder lineEnding(LineEnding lineEnding) {
            this.lineEnding = lineEnding;
            return this;
        }

        public Builder insertFinalNewline(boolean insertFinalNewline) {
            this.insertFinalNewline = insertFinalNewline;
            return this;
        }

        public Builder trimTrailingWhitespace(boolean trimTrailingWhitespace) {
            this.trimTrailingWhitespace = trimTrailingWhitespace;
            return this;
        }

        public FormatProfile build() {
            return new FormatProfile(indentStyle, indentWidth, lineEnding, insertFinalNewline,
                    trimTrailingWhitespace);
        }
    }
}
