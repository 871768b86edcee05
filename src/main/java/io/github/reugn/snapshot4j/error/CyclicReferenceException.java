package io.github.reugn.snapshot4j.error;

import io.github.reugn.snapshot4j.render.PathSegment;

import java.util.List;

/**
 * Thrown when a value is reached again while it is still being rendered by one of its
 * ancestors. Cyclic graphs cannot be written as a single expression.
 */
public class CyclicReferenceException extends ReflectionFailureException {

    public CyclicReferenceException(String typeName, List<PathSegment> path) {
        super("cyclic reference to an instance of " + typeName, path);
    }
}
