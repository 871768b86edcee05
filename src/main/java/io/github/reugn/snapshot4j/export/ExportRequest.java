package io.github.reugn.snapshot4j.export;

import java.nio.file.Path;

/**
 * Per-call export options. Every option left unset falls back to global configuration or
 * to a value derived from the exported value.
 *
 * @param outputDirectory source root to write under; {@code null} to resolve it
 * @param className       holder class name; {@code null} for {@code <Type><Variable>Snapshot}
 * @param packageName     holder package; {@code null} for the package of the value's type
 * @param header          file header, replacing the global header; {@code null} to use the global one
 * @param context         Javadoc for the generated field; {@code null} for none
 * @param allowOverwrite  whether an existing file may be replaced
 */
public record ExportRequest(
        Path outputDirectory,
        String className,
        String packageName,
        String header,
        String context,
        boolean allowOverwrite
) {
    private static final ExportRequest DEFAULTS = new ExportRequest(null, null, null, null, null, true);

    public static ExportRequest defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path outputDirectory;
        private String className;
        private String packageName;
        private String header;
        private String context;
        private boolean allowOverwrite = true;

        private Builder() {
        }

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder className(String className) {
            this.className = className;
            return this;
        }

        public Builder packageName(String packageName) {
            this.packageName = packageName;
            return this;
        }

        public Builder header(String header) {
            this.header = header;
            return this;
        }

        public Builder context(String context) {
            this.context = context;
            return this;
        }

        public Builder allowOverwrite(boolean allowOverwrite) {
            this.allowOverwrite = allowOverwrite;
            return this;
        }

        public ExportRequest build() {
            return new ExportRequest(outputDirectory, className, packageName, header, context, allowOverwrite);
        }
    }
}
