package io.github.reugn.snapshot4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Leaves a member out of rendered fixtures.
 * <p>
 * The constructor argument is replaced by the default value of the member type:
 * {@code null}, {@code 0}, {@code 0L}, {@code false} and so on. The real value is never read.
 */
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.SOURCE)
public @interface SnapshotIgnore {
}
