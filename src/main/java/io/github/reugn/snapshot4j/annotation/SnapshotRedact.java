package io.github.reugn.snapshot4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Hides the value of a {@code String} member in rendered fixtures.
 * <p>
 * Two modes are available:
 * <ul>
 *   <li><b>Mask</b> (default): the value is replaced by {@link #mask()}</li>
 *   <li><b>Hash</b>: the value is replaced by {@code "<sha256:...>"}, the first 16 hex digits of
 *       the SHA-256 digest of the rendered value. Equal values produce equal placeholders.</li>
 * </ul>
 * <pre>
 * {@code
 * public record Credentials(
 *         String user,
 *         @SnapshotRedact String password,
 *         @SnapshotRedact(mask = "<token>") String token,
 *         @SnapshotRedact(hash = true) String email) {
 * }
 * }
 * </pre>
 * Setting both a custom {@code mask} and {@code hash = true} is a compilation error.
 */
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.SOURCE)
public @interface SnapshotRedact {
    /**
     * Replacement text written instead of the value.
     *
     * @return the mask
     */
    String mask() default "•••";

    /**
     * Whether to write a digest placeholder instead of a mask.
     *
     * @return {@code true} for hash mode
     */
    boolean hash() default false;
}
