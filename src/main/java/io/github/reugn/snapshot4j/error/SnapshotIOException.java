package io.github.reugn.snapshot4j.error;

import java.io.IOException;
import java.util.List;

/**
 * Wraps a file system failure raised while persisting a snapshot.
 */
public class SnapshotIOException extends SnapshotException {

    public SnapshotIOException(String reason, IOException cause) {
        super("I/O error: " + reason, List.of(), cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.IO_FAILURE;
    }
}
