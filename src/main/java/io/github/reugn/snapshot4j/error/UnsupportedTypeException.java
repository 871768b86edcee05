package io.github.reugn.snapshot4j.error;

import io.github.reugn.snapshot4j.render.PathSegment;

import java.util.List;

/**
 * Thrown when no metadata, registered renderer, built-in handler or reflection path can
 * express a value as Java source.
 */
public class UnsupportedTypeException extends SnapshotException {

    private final String typeName;

    public UnsupportedTypeException(String typeName, List<PathSegment> path) {
        this(typeName, null, path);
    }

    public UnsupportedTypeException(String typeName, String detail, List<PathSegment> path) {
        super(withPath("Unsupported type: " + typeName + (detail == null ? "" : " (" + detail + ")"), path),
                path, null);
        this.typeName = typeName;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UNSUPPORTED_TYPE;
    }

    public String typeName() {
        return typeName;
    }
}
