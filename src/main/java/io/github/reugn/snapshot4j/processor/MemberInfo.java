package io.github.reugn.snapshot4j.processor;

import com.squareup.javapoet.CodeBlock;

import javax.lang.model.element.Element;
import javax.lang.model.type.TypeMirror;

/**
 * One constructor argument of a {@code @SnapshotFixture} type, as seen at compile time.
 *
 * @param element      the record component or field
 * @param name         the declared member name
 * @param type         the member type
 * @param access       expression reading the member from {@code instance}
 * @param renamedLabel label from {@code @SnapshotRename}, or {@code null}
 * @param mask         mask text from {@code @SnapshotRedact}, or {@code null} when not masked
 * @param hash         {@code true} for {@code @SnapshotRedact(hash = true)}
 * @param ignored      {@code true} for {@code @SnapshotIgnore}
 */
record MemberInfo(Element element, String name, TypeMirror type, CodeBlock access,
                  String renamedLabel, String mask, boolean hash, boolean ignored) {
}
