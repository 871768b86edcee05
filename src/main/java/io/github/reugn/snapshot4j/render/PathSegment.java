package io.github.reugn.snapshot4j.render;

import java.util.List;
import java.util.Objects;

/**
 * One step of a breadcrumb path from the root value to the node being rendered.
 *
 * <p>A path is an ordered list of segments. Its display form reads like a Java access chain:
 * <ul>
 *   <li>{@code address.zipCode}: two {@link Field} segments</li>
 *   <li>{@code orders[2].total}: a field, then an {@link Index}, then a field</li>
 *   <li>{@code scores["alice"]}: a field followed by a {@link Key} holding the rendered key text</li>
 * </ul>
 *
 * @see RenderContext#path()
 */
public sealed interface PathSegment permits PathSegment.Field, PathSegment.Index, PathSegment.Key {

    /**
     * Creates a field segment.
     *
     * @param name the member label
     * @return the segment
     */
    static PathSegment field(String name) {
        return new Field(name);
    }

    /**
     * Creates an index segment.
     *
     * @param position zero-based position in a sequence, set or array
     * @return the segment
     */
    static PathSegment index(int position) {
        return new Index(position);
    }

    /**
     * Creates a map key segment.
     *
     * @param renderedKeyText the key as it appears in the generated source
     * @return the segment
     */
    static PathSegment key(String renderedKeyText) {
        return new Key(renderedKeyText);
    }

    /**
     * Formats a path for error messages.
     *
     * @param path the segments, root first
     * @return the display form, or an empty string for the root
     */
    static String format(List<PathSegment> path) {
        StringBuilder sb = new StringBuilder();
        for (PathSegment segment : path) {
            if (segment instanceof Field f) {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(f.name());
            } else if (segment instanceof Index i) {
                sb.append('[').append(i.position()).append(']');
            } else if (segment instanceof Key k) {
                sb.append('[').append(k.renderedKeyText()).append(']');
            }
        }
        return sb.toString();
    }

    /**
     * A labelled member of a record, class or metadata-described type.
     *
     * @param name the member label
     */
    record Field(String name) implements PathSegment {
        public Field {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * A position inside a sequence, set or array.
     *
     * @param position zero-based position
     */
    record Index(int position) implements PathSegment {
        public Index {
            if (position < 0) {
                throw new IllegalArgumentException("position must not be negative: " + position);
            }
        }
    }

    /**
     * The value slot of a map entry, identified by the rendered key.
     *
     * @param renderedKeyText the key expression text
     */
    record Key(String renderedKeyText) implements PathSegment {
        public Key {
            Objects.requireNonNull(renderedKeyText, "renderedKeyText");
        }
    }
}
