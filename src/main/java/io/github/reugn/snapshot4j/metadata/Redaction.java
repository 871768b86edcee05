package io.github.reugn.snapshot4j.metadata;

import java.util.Objects;

/**
 * How a sensitive member is hidden in a rendered fixture.
 */
public sealed interface Redaction permits Redaction.Mask, Redaction.Hash {

    /**
     * Mask text used when {@code @SnapshotRedact} names none.
     */
    String DEFAULT_MASK = "•••";

    static Redaction mask(String text) {
        return new Mask(text);
    }

    static Redaction hash() {
        return new Hash();
    }

    /**
     * Replaces the value with a fixed string.
     *
     * @param text the replacement
     */
    record Mask(String text) implements Redaction {
        public Mask {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * Replaces the value with a short SHA-256 digest of its rendered expression, so equal
     * values stay recognisably equal without being revealed.
     */
    record Hash() implements Redaction {
    }
}
