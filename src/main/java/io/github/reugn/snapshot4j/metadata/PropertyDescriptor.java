package io.github.reugn.snapshot4j.metadata;

import java.util.Objects;

/**
 * Rendering instructions for one member of a type described by {@link TypeMetadata}.
 *
 * @param originalName the declared member name
 * @param renamedLabel the label written instead of the member name, or {@code null}
 * @param redaction    how the value is hidden, or {@code null} to render it as is
 * @param ignored      {@code true} to render the type's default value in place of the member
 */
public record PropertyDescriptor(String originalName, String renamedLabel, Redaction redaction, boolean ignored) {

    public PropertyDescriptor {
        Objects.requireNonNull(originalName, "originalName");
    }

    public static PropertyDescriptor of(String originalName) {
        return new PropertyDescriptor(originalName, null, null, false);
    }

    /**
     * Returns the label written in parameter comments and breadcrumbs.
     *
     * @return the renamed label if present, otherwise the original name
     */
    public String label() {
        return renamedLabel != null ? renamedLabel : originalName;
    }
}
