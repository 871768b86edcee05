package io.github.reugn.snapshot4j.error;

import java.nio.file.Path;
import java.util.List;

/**
 * Thrown when an export targets an existing file and overwriting was not allowed.
 */
public class OverwriteDisallowedException extends SnapshotException {

    private final Path file;

    public OverwriteDisallowedException(Path file) {
        super("Overwrite disallowed for file: " + file, List.of(), null);
        this.file = file;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.OVERWRITE_DISALLOWED;
    }

    public Path file() {
        return file;
    }
}
