package io.github.reugn.snapshot4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Changes the label of a member in parameter comments and error paths.
 * <pre>
 * {@code
 * public record User(@SnapshotRename("displayName") String name) { }
 * // new User(/* displayName= *}{@code / "Alice")
 * }
 * </pre>
 */
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.SOURCE)
public @interface SnapshotRename {
    /**
     * The label to write instead of the member name. Must be a valid Java identifier.
     *
     * @return the new label
     */
    String value();
}
