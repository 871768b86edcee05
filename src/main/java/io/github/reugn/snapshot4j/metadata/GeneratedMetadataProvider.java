package io.github.reugn.snapshot4j.metadata;

import com.squareup.javapoet.CodeBlock;
import io.github.reugn.snapshot4j.error.ReflectionFailureException;
import io.github.reugn.snapshot4j.render.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Finds the metadata classes generated by the {@code @SnapshotFixture} processor.
 *
 * <p>For a type {@code com.example.User} the provider loads
 * {@code com.example.UserSnapshotMetadata} through the type's own class loader. The result,
 * found, missing or failed, is computed once per class and cached in a {@link ClassValue}.
 * A metadata class that cannot be instantiated fails every render of its type with a
 * {@link ReflectionFailureException} carrying the path of the failing node.
 */
public final class GeneratedMetadataProvider implements MetadataProvider {

    private static final Logger log = LoggerFactory.getLogger(GeneratedMetadataProvider.class);

    private static final GeneratedMetadataProvider INSTANCE = new GeneratedMetadataProvider();

    private final ClassValue<Optional<TypeMetadata<?>>> cache = new ClassValue<>() {
        @Override
        protected Optional<TypeMetadata<?>> computeValue(Class<?> type) {
            return load(type);
        }
    };

    private GeneratedMetadataProvider() {
    }

    public static GeneratedMetadataProvider getInstance() {
        return INSTANCE;
    }

    @Override
    public Optional<TypeMetadata<?>> metadataFor(Class<?> type) {
        return cache.get(type);
    }

    private static Optional<TypeMetadata<?>> load(Class<?> type) {
        ClassLoader loader = type.getClassLoader();
        if (loader == null || type.isArray() || type.isPrimitive()) {
            return Optional.empty();
        }
        String name = MetadataSupport.metadataClassName(type);
        Class<?> metadataClass;
        try {
            metadataClass = Class.forName(name, true, loader);
        } catch (ClassNotFoundException e) {
            return Optional.empty();
        }
        if (!TypeMetadata.class.isAssignableFrom(metadataClass)) {
            return Optional.empty();
        }
        TypeMetadata<?> metadata;
        try {
            metadata = (TypeMetadata<?>) metadataClass.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            log.warn("Cannot instantiate snapshot metadata {}", name, e);
            TypeMetadata<?> unloadable = new UnloadableMetadata<>(type, name, e);
            return Optional.of(unloadable);
        }
        if (metadata.type() != type) {
            return Optional.empty();
        }
        log.debug("Loaded snapshot metadata {} for {}", name, type.getName());
        return Optional.of(metadata);
    }

    /**
     * Stands in for a metadata class that exists but cannot be instantiated, so the failure is
     * cached with the lookup and reported at the path of each node that needs it.
     */
    private static final class UnloadableMetadata<T> implements TypeMetadata<T> {

        private final Class<T> type;
        private final String className;
        private final ReflectiveOperationException cause;

        UnloadableMetadata(Class<T> type, String className, ReflectiveOperationException cause) {
            this.type = type;
            this.className = className;
            this.cause = cause;
        }

        @Override
        public Class<T> type() {
            return type;
        }

        @Override
        public List<PropertyDescriptor> properties() {
            return List.of();
        }

        @Override
        public CodeBlock render(T instance, RenderContext ctx) {
            throw new ReflectionFailureException("cannot instantiate metadata class " + className,
                    ctx.path(), cause);
        }
    }
}
