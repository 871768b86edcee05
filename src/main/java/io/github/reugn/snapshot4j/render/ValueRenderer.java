package io.github.reugn.snapshot4j.render;

import com.squareup.javapoet.CodeBlock;
import io.github.reugn.snapshot4j.config.RenderOptions;
import io.github.reugn.snapshot4j.metadata.GeneratedMetadataProvider;
import io.github.reugn.snapshot4j.metadata.MetadataProvider;
import io.github.reugn.snapshot4j.metadata.TypeMetadata;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Turns a runtime value into a Java expression.
 *
 * <p>Each node is resolved by the first step that accepts it:
 * <ol>
 *   <li>{@code null} and the {@link Optional} family</li>
 *   <li>a renderer registered for the exact class (the declaring class for enum constants)</li>
 *   <li>{@link TypeMetadata} from the metadata provider</li>
 *   <li>{@link BuiltinRenderers}</li>
 *   <li>arrays, collections and maps</li>
 *   <li>structural reflection over enums, records and classes</li>
 * </ol>
 *
 * <p>A render is a pure function of the value, the options and the registry contents at
 * the moment it starts. Failures surface as {@link io.github.reugn.snapshot4j.error.SnapshotException}
 * with the path of the failing node; no partial expression is ever returned.
 *
 * <p>Instances are stateless apart from their collaborators and can be shared between threads.
 */
public final class ValueRenderer {

    private final RendererRegistry registry;
    private final MetadataProvider metadata;
    private final CollectionRenderer collections = new CollectionRenderer();
    private final ReflectionRenderer reflection = new ReflectionRenderer();

    public ValueRenderer(RendererRegistry registry, MetadataProvider metadata) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    /**
     * Creates a renderer over the given registry that also consults generated metadata.
     *
     * @param registry the renderer registry
     * @return a new value renderer
     */
    public static ValueRenderer create(RendererRegistry registry) {
        return new ValueRenderer(registry, GeneratedMetadataProvider.getInstance());
    }

    /**
     * Renders a root value.
     *
     * @param value   the value, may be {@code null}
     * @param options the rendering policy
     * @return the expression
     */
    public CodeBlock render(Object value, RenderOptions options) {
        RenderContext root = RenderContext.root(value, options, registry.snapshot(), metadata, this);
        return render(value, root);
    }

    /**
     * Renders a value at the node described by {@code ctx}.
     *
     * @param value the value, may be {@code null}
     * @param ctx   the node context
     * @return the expression
     */
    public CodeBlock render(Object value, RenderContext ctx) {
        if (value == null) {
            return CodeBlock.of("null");
        }
        CodeBlock optional = renderOptional(value, ctx);
        if (optional != null) {
            return optional;
        }

        Class<?> type = value.getClass();
        Class<?> key = value instanceof Enum<?> e ? e.getDeclaringClass() : type;
        SnapshotRenderer<?> registered = ctx.renderers().get(key);
        if (registered != null) {
            return apply(registered, value, ctx);
        }

        Optional<TypeMetadata<?>> typeMetadata = ctx.metadata().metadataFor(type);
        if (typeMetadata.isPresent()) {
            return renderWith(typeMetadata.get(), value, ctx);
        }

        Optional<SnapshotRenderer<?>> builtin = BuiltinRenderers.forType(key);
        if (builtin.isPresent()) {
            return apply(builtin.get(), value, ctx);
        }

        if (CollectionRenderer.handles(type)) {
            return collections.render(value, ctx);
        }
        return reflection.render(value, ctx);
    }

    private static CodeBlock renderOptional(Object value, RenderContext ctx) {
        if (value instanceof Optional<?> optional) {
            return optional.isPresent()
                    ? CodeBlock.of("$T.of($L)", Optional.class, ctx.renderInPlace(optional.get()))
                    : CodeBlock.of("$T.empty()", Optional.class);
        }
        if (value instanceof OptionalInt optional) {
            return optional.isPresent()
                    ? CodeBlock.of("$T.of($L)", OptionalInt.class, Literals.intLiteral(optional.getAsInt()))
                    : CodeBlock.of("$T.empty()", OptionalInt.class);
        }
        if (value instanceof OptionalLong optional) {
            return optional.isPresent()
                    ? CodeBlock.of("$T.of($L)", OptionalLong.class, Literals.longLiteral(optional.getAsLong()))
                    : CodeBlock.of("$T.empty()", OptionalLong.class);
        }
        if (value instanceof OptionalDouble optional) {
            return optional.isPresent()
                    ? CodeBlock.of("$T.of($L)", OptionalDouble.class, Literals.doubleLiteral(optional.getAsDouble()))
                    : CodeBlock.of("$T.empty()", OptionalDouble.class);
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static CodeBlock apply(SnapshotRenderer<?> renderer, Object value, RenderContext ctx) {
        return ((SnapshotRenderer<Object>) renderer).render(value, ctx);
    }

    @SuppressWarnings("unchecked")
    private static CodeBlock renderWith(TypeMetadata<?> metadata, Object value, RenderContext ctx) {
        return ((TypeMetadata<Object>) metadata).render(value, ctx);
    }
}
