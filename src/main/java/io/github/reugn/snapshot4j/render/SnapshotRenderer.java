package io.github.reugn.snapshot4j.render;

import com.squareup.javapoet.CodeBlock;

/**
 * Produces the Java expression for values of one type.
 *
 * <p>Implementations are registered in a {@link RendererRegistry} and selected by the exact
 * runtime class of a value. Child values are rendered through
 * {@link RenderContext#renderChild(PathSegment, Object)} so that ordering, cycle detection and
 * breadcrumbs keep working below a custom renderer.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * registry.register(Money.class, (money, ctx) ->
 *         CodeBlock.of("$T.of($L, $S)", Money.class, money.amount(), money.currency()));
 * }</pre>
 *
 * @param <T> the rendered type
 */
@FunctionalInterface
public interface SnapshotRenderer<T> {

    /**
     * Renders a value as a single Java expression without a trailing semicolon.
     *
     * @param value the non-null value
     * @param ctx   the context of the node being rendered
     * @return the expression
     */
    CodeBlock render(T value, RenderContext ctx);
}
