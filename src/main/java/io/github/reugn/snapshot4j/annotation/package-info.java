/**
 * Annotations that control how types are rendered as snapshot fixtures.
 * <p>
 * This package provides:
 * <ul>
 *   <li>{@link io.github.reugn.snapshot4j.annotation.SnapshotFixture} - Generate rendering metadata for a record or class</li>
 *   <li>{@link io.github.reugn.snapshot4j.annotation.SnapshotIgnore} - Render a member as its type's default value</li>
 *   <li>{@link io.github.reugn.snapshot4j.annotation.SnapshotRename} - Use a different label for a member</li>
 *   <li>{@link io.github.reugn.snapshot4j.annotation.SnapshotRedact} - Mask or hash a sensitive member</li>
 * </ul>
 * <p>
 * All annotations are processed by {@link io.github.reugn.snapshot4j.processor.SnapshotProcessor},
 * generating a {@code {ClassName}SnapshotMetadata} class per annotated type.
 */
package io.github.reugn.snapshot4j.annotation;
