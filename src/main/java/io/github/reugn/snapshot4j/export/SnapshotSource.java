package io.github.reugn.snapshot4j.export;

import java.nio.file.Path;

/**
 * A fully formatted fixture file that has not been written yet.
 *
 * @param packageName  holder package, empty for the unnamed package
 * @param className    holder class simple name
 * @param variableName sanitized field name
 * @param content      formatted file content
 */
public record SnapshotSource(String packageName, String className, String variableName, String content) {

    /**
     * Returns the file location relative to a source root.
     *
     * @return {@code com/example/UserAdminSnapshot.java} for package {@code com.example}
     */
    public Path relativePath() {
        Path file = Path.of(className + ".java");
        if (packageName.isEmpty()) {
            return file;
        }
        return Path.of("", packageName.split("\\.")).resolve(file);
    }
}
