package io.github.reugn.snapshot4j.error;

import io.github.reugn.snapshot4j.render.PathSegment;

import java.util.List;

/**
 * Thrown when structural introspection cannot produce an expression for a value, for
 * example when a class has no constructor matching its fields or a member cannot be read.
 */
public class ReflectionFailureException extends SnapshotException {

    private final String reason;

    public ReflectionFailureException(String reason, List<PathSegment> path) {
        this(reason, path, null);
    }

    public ReflectionFailureException(String reason, List<PathSegment> path, Throwable cause) {
        super(withPath("Reflection error: " + reason, path), path, cause);
        this.reason = reason;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.REFLECTION_FAILURE;
    }

    public String reason() {
        return reason;
    }
}
