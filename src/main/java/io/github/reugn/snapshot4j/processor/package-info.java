/**
 * Annotation processor implementation for snapshot4j.
 * <p>
 * This package contains the compile-time processor that generates a
 * {@link io.github.reugn.snapshot4j.metadata.TypeMetadata} implementation for every type
 * annotated with {@link io.github.reugn.snapshot4j.annotation.SnapshotFixture}.
 * <p>
 * <b>Internal implementation</b> - not part of the public API.
 *
 * <p><b>Architecture:</b>
 * <pre>
 * SnapshotProcessor (entry point)
 *     └── MetadataGenerator   - {ClassName}SnapshotMetadata source
 *
 * Support utilities:
 *     ├── MemberInfo      - One constructor argument and its annotations
 *     ├── ValidationUtils - Compile-time validation checks
 *     └── ErrorReporter   - Error reporting interface
 * </pre>
 *
 * @see io.github.reugn.snapshot4j.annotation
 * @see io.github.reugn.snapshot4j.metadata.MetadataSupport
 */
package io.github.reugn.snapshot4j.processor;
