package io.github.reugn.snapshot4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Generates snapshot metadata for a record or class.
 * <p>
 * The annotation processor writes a {@code {ClassName}SnapshotMetadata} class next to the
 * annotated type. At runtime the value renderer finds it by name and uses it before any
 * registered renderer or reflection, so renames, redactions and ignored members apply
 * wherever an instance appears, including deep inside collections.
 *
 * <p><b>Records:</b>
 * <pre>
 * {@code
 * @SnapshotFixture(folder = "src/test/fixtures", context = "Customer accounts")
 * public record Account(
 *         long id,
 *         @SnapshotRename("owner") String holderName,
 *         @SnapshotRedact String iban,
 *         @SnapshotIgnore Session session) {
 * }
 * }
 * </pre>
 * Rendered:
 * <pre>
 * {@code
 * new Account(
 *     /* id= *}{@code / 7L,
 *     /* owner= *}{@code / "Alice",
 *     /* iban= *}{@code / "•••",
 *     null
 * )
 * }
 * </pre>
 *
 * <p><b>Classes:</b>
 * <p>Instance fields (non-static, non-transient) are passed to a constructor whose parameter
 * types match the fields in declaration order. Each field must be non-private or have a
 * {@code getX()}, {@code isX()} or {@code x()} accessor.
 *
 * @see SnapshotIgnore
 * @see SnapshotRename
 * @see SnapshotRedact
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.SOURCE)
public @interface SnapshotFixture {
    /**
     * Source root that fixtures of this type are exported under, unless an export names its
     * own directory.
     *
     * @return the output directory, or empty to use the configured root
     */
    String folder() default "";

    /**
     * Documentation attached to exported fixture fields of this type.
     *
     * @return the Javadoc text, or empty for none
     */
    String context() default "";
}
