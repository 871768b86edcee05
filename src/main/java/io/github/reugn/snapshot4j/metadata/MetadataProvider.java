package io.github.reugn.snapshot4j.metadata;

import java.util.Optional;

/**
 * Source of {@link TypeMetadata} for runtime classes.
 */
@FunctionalInterface
public interface MetadataProvider {

    /**
     * Finds metadata for a class.
     *
     * @param type the exact runtime class of a value
     * @return the metadata, or empty when the class has none
     */
    Optional<TypeMetadata<?>> metadataFor(Class<?> type);

    /**
     * Returns a provider that never finds metadata.
     *
     * @return the empty provider
     */
    static MetadataProvider none() {
        return type -> Optional.empty();
    }
}
