package io.github.reugn.snapshot4j.render;

import com.squareup.javapoet.CodeBlock;
import io.github.reugn.snapshot4j.config.RenderOptions;
import io.github.reugn.snapshot4j.error.CyclicReferenceException;
import io.github.reugn.snapshot4j.error.ReflectionFailureException;
import io.github.reugn.snapshot4j.metadata.MetadataProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable state of one node in a render.
 *
 * <p>Each context links to its parent, so the breadcrumb path and the chain of ancestors are
 * shared structurally and never copied between siblings. Descending into a child with
 * {@link #child(PathSegment, Object)} returns a new context one level deeper; the receiver is
 * left untouched.
 *
 * <p>The registry map, options and metadata provider are captured once when the root context
 * is created and are the same object on every descendant.
 */
public final class RenderContext {

    private final RenderContext parent;
    private final PathSegment segment;
    private final Object value;
    private final int depth;
    private final RenderOptions options;
    private final Map<Class<?>, SnapshotRenderer<?>> renderers;
    private final MetadataProvider metadata;
    private final ValueRenderer dispatcher;

    private RenderContext(RenderContext parent, PathSegment segment, Object value, int depth,
                          RenderOptions options, Map<Class<?>, SnapshotRenderer<?>> renderers,
                          MetadataProvider metadata, ValueRenderer dispatcher) {
        this.parent = parent;
        this.segment = segment;
        this.value = value;
        this.depth = depth;
        this.options = options;
        this.renderers = renderers;
        this.metadata = metadata;
        this.dispatcher = dispatcher;
    }

    static RenderContext root(Object value, RenderOptions options, Map<Class<?>, SnapshotRenderer<?>> renderers,
                              MetadataProvider metadata, ValueRenderer dispatcher) {
        return new RenderContext(null, null, value, 0,
                Objects.requireNonNull(options, "options"),
                Objects.requireNonNull(renderers, "renderers"),
                Objects.requireNonNull(metadata, "metadata"),
                dispatcher);
    }

    // ==================== DESCENT ====================

    /**
     * Creates the context of a child node.
     *
     * @param segment    the step from this node to the child
     * @param childValue the child value, used for cycle detection
     * @return the child context
     * @throws CyclicReferenceException   if {@code childValue} is this node's value or one of its ancestors'
     * @throws ReflectionFailureException if the child would be deeper than {@link RenderOptions#maxDepth()}
     */
    public RenderContext child(PathSegment segment, Object childValue) {
        Objects.requireNonNull(segment, "segment");
        RenderContext next = new RenderContext(this, segment, childValue, depth + 1,
                options, renderers, metadata, dispatcher);
        if (next.depth > options.maxDepth()) {
            throw new ReflectionFailureException("maximum depth of " + options.maxDepth() + " exceeded",
                    next.path());
        }
        if (childValue != null) {
            for (RenderContext node = this; node != null; node = node.parent) {
                if (node.value == childValue) {
                    throw new CyclicReferenceException(childValue.getClass().getName(), next.path());
                }
            }
        }
        return next;
    }

    /**
     * Renders a child value one level below this node.
     *
     * @param segment    the step from this node to the child
     * @param childValue the child value, may be {@code null}
     * @return the child expression
     */
    public CodeBlock renderChild(PathSegment segment, Object childValue) {
        return dispatcher.render(childValue, child(segment, childValue));
    }

    /**
     * Renders a value at this node's position without adding a breadcrumb.
     *
     * <p>Used for map keys and for the payload of an {@link java.util.Optional}.
     *
     * @param other the value to render
     * @return the expression
     */
    public CodeBlock renderInPlace(Object other) {
        return dispatcher.render(other, this);
    }

    // ==================== ACCESSORS ====================

    /**
     * Returns the breadcrumb path from the root to this node.
     *
     * @return an unmodifiable list, root first; empty for the root
     */
    public List<PathSegment> path() {
        List<PathSegment> path = new ArrayList<>(depth);
        for (RenderContext node = this; node.parent != null; node = node.parent) {
            path.add(node.segment);
        }
        Collections.reverse(path);
        return Collections.unmodifiableList(path);
    }

    public int depth() {
        return depth;
    }

    public RenderOptions options() {
        return options;
    }

    /**
     * Returns the registry contents captured when the render started.
     *
     * @return an immutable map of exact type to renderer
     */
    public Map<Class<?>, SnapshotRenderer<?>> renderers() {
        return renderers;
    }

    public MetadataProvider metadata() {
        return metadata;
    }
}
