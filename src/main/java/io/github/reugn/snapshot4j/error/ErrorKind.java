package io.github.reugn.snapshot4j.error;

/**
 * Failure categories reported by {@link SnapshotException#kind()}.
 */
public enum ErrorKind {
    UNSUPPORTED_TYPE,
    IO_FAILURE,
    OVERWRITE_DISALLOWED,
    REFLECTION_FAILURE,
    FORMATTING_FAILURE
}
