package io.github.reugn.snapshot4j.error;

import io.github.reugn.snapshot4j.render.PathSegment;

import java.util.List;

/**
 * Base type of every failure raised while rendering, formatting or exporting a snapshot.
 *
 * <p>Errors are created once, at the point of failure, with the breadcrumb path that was
 * current at that moment. They travel to the caller unchanged; the engine never catches
 * and re-wraps them, and never returns partial output.
 *
 * <p><b>Hierarchy:</b>
 * <table border="1">
 *   <caption>Snapshot failures</caption>
 *   <tr><th>Type</th><th>Kind</th><th>Carries path</th></tr>
 *   <tr><td>{@link UnsupportedTypeException}</td><td>{@link ErrorKind#UNSUPPORTED_TYPE}</td><td>yes</td></tr>
 *   <tr><td>{@link ReflectionFailureException}</td><td>{@link ErrorKind#REFLECTION_FAILURE}</td><td>yes</td></tr>
 *   <tr><td>{@link FormattingException}</td><td>{@link ErrorKind#FORMATTING_FAILURE}</td><td>no</td></tr>
 *   <tr><td>{@link SnapshotIOException}</td><td>{@link ErrorKind#IO_FAILURE}</td><td>no</td></tr>
 *   <tr><td>{@link OverwriteDisallowedException}</td><td>{@link ErrorKind#OVERWRITE_DISALLOWED}</td><td>no</td></tr>
 * </table>
 */
public abstract class SnapshotException extends RuntimeException {

    private final List<PathSegment> path;

    protected SnapshotException(String message, List<PathSegment> path, Throwable cause) {
        super(message, cause);
        this.path = List.copyOf(path);
    }

    /**
     * Returns the failure category.
     *
     * @return the kind of this error
     */
    public abstract ErrorKind kind();

    /**
     * Returns the breadcrumb path of the node that failed.
     *
     * @return the path, root first; empty for failures not tied to a value
     */
    public List<PathSegment> path() {
        return path;
    }

    static String withPath(String message, List<PathSegment> path) {
        if (path.isEmpty()) {
            return message;
        }
        return message + " at path: " + PathSegment.format(path);
    }
}
