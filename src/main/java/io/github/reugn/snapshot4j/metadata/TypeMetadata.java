package io.github.reugn.snapshot4j.metadata;

import com.squareup.javapoet.CodeBlock;
import io.github.reugn.snapshot4j.render.RenderContext;

import java.util.List;

/**
 * Compile-time description of how to render instances of one type.
 *
 * <p>Implementations are normally generated by the {@code @SnapshotFixture} annotation
 * processor as {@code <Type>SnapshotMetadata} next to the annotated type. When a value's
 * class has metadata, it is used before the built-in renderers and reflection. A renderer
 * registered for the same class still takes precedence.
 *
 * @param <T> the described type
 */
public interface TypeMetadata<T> {

    /**
     * Returns the described type.
     *
     * @return the class whose instances this metadata renders
     */
    Class<T> type();

    /**
     * Returns the members in constructor order.
     *
     * @return the property descriptors
     */
    List<PropertyDescriptor> properties();

    /**
     * Renders an instance, applying renames, redactions and ignores.
     *
     * @param instance the value
     * @param ctx      the context of the node being rendered
     * @return the constructor expression
     */
    CodeBlock render(T instance, RenderContext ctx);

    /**
     * Output directory hint from {@code @SnapshotFixture(folder = ...)}.
     *
     * @return the folder, or an empty string when none was given
     */
    default String folder() {
        return "";
    }

    /**
     * Documentation from {@code @SnapshotFixture(context = ...)}.
     *
     * @return the context text, or an empty string when none was given
     */
    default String context() {
        return "";
    }
}
