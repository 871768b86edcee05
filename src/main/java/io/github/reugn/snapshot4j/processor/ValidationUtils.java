package io.github.reugn.snapshot4j.processor;

import io.github.reugn.snapshot4j.annotation.SnapshotFixture;
import io.github.reugn.snapshot4j.annotation.SnapshotIgnore;
import io.github.reugn.snapshot4j.annotation.SnapshotRedact;
import io.github.reugn.snapshot4j.annotation.SnapshotRename;
import io.github.reugn.snapshot4j.metadata.Redaction;

import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.NestingKind;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import java.util.Locale;

/**
 * Compile-time validation for snapshot annotations.
 *
 * <p>Each check reports through the {@link ErrorReporter} and returns {@code false} on failure,
 * so one compilation reports every problem instead of stopping at the first.
 *
 * <p><b>Example Error Messages:</b>
 * <pre>
 * error: @SnapshotFixture cannot be applied to an interface. Use it on a record or class.
 * error: @SnapshotRedact is only supported on String members, but 'pin' is int.
 * error: @SnapshotRedact on 'token' cannot specify both 'mask' and 'hash'. Use one or the other.
 * error: @SnapshotIgnore on 'session' has no effect without @SnapshotFixture on the enclosing type.
 * </pre>
 */
final class ValidationUtils {

    private ValidationUtils() {
    }

    // ==================== TYPE VALIDATION ====================

    /**
     * Checks that a {@code @SnapshotFixture} element is a type the generated metadata can construct.
     *
     * @param type          the annotated type
     * @param errorReporter callback for reporting compilation errors
     * @return {@code true} if the type is a concrete, accessible record or class
     */
    static boolean validateFixtureType(TypeElement type, ErrorReporter errorReporter) {
        ElementKind kind = type.getKind();
        if (kind != ElementKind.RECORD && kind != ElementKind.CLASS) {
            errorReporter.error(type, "@SnapshotFixture cannot be applied to " + describe(kind)
                    + ". Use it on a record or class.");
            return false;
        }
        if (type.getModifiers().contains(Modifier.PRIVATE)) {
            errorReporter.error(type, "Type '" + type.getSimpleName() + "' is private. "
                    + "Generated metadata cannot access private types.");
            return false;
        }
        if (type.getModifiers().contains(Modifier.ABSTRACT)) {
            errorReporter.error(type, "Type '" + type.getSimpleName() + "' is abstract. "
                    + "Annotate the concrete subclasses instead.");
            return false;
        }
        NestingKind nesting = type.getNestingKind();
        if (nesting == NestingKind.LOCAL || nesting == NestingKind.ANONYMOUS) {
            errorReporter.error(type, "@SnapshotFixture cannot be applied to local or anonymous classes.");
            return false;
        }
        if (nesting == NestingKind.MEMBER && kind == ElementKind.CLASS
                && !type.getModifiers().contains(Modifier.STATIC)) {
            errorReporter.error(type, "Inner class '" + type.getSimpleName() + "' must be static "
                    + "to be instantiated from a fixture.");
            return false;
        }
        return true;
    }

    // ==================== MEMBER VALIDATION ====================

    /**
     * Checks the snapshot annotations of one member.
     *
     * @param member        the record component or field
     * @param memberType    the member type
     * @param elements      element utilities
     * @param types         type utilities
     * @param errorReporter callback for reporting compilation errors
     * @return {@code true} if the annotations are consistent
     */
    static boolean validateMemberAnnotations(Element member, TypeMirror memberType, Elements elements,
                                             Types types, ErrorReporter errorReporter) {
        String name = member.getSimpleName().toString();
        SnapshotIgnore ignore = member.getAnnotation(SnapshotIgnore.class);
        SnapshotRename rename = member.getAnnotation(SnapshotRename.class);
        SnapshotRedact redact = member.getAnnotation(SnapshotRedact.class);
        boolean valid = true;

        if (redact != null) {
            TypeMirror stringType = elements.getTypeElement(String.class.getCanonicalName()).asType();
            if (!types.isSameType(memberType, stringType)) {
                errorReporter.error(member, "@SnapshotRedact is only supported on String members, but '"
                        + name + "' is " + memberType + ".");
                valid = false;
            }
            if (redact.hash() && !Redaction.DEFAULT_MASK.equals(redact.mask())) {
                errorReporter.error(member, "@SnapshotRedact on '" + name
                        + "' cannot specify both 'mask' and 'hash'. Use one or the other.");
                valid = false;
            }
            if (ignore != null) {
                errorReporter.error(member, "'" + name + "' cannot be both ignored and redacted. "
                        + "Remove @SnapshotIgnore or @SnapshotRedact.");
                valid = false;
            }
        }

        if (rename != null) {
            if (!SourceVersion.isIdentifier(rename.value()) || SourceVersion.isKeyword(rename.value())) {
                errorReporter.error(member, "@SnapshotRename value '" + rename.value()
                        + "' is not a valid Java identifier.");
                valid = false;
            }
            if (ignore != null) {
                errorReporter.warning(member, "@SnapshotRename on '" + name
                        + "' has no effect because the member is ignored.");
            }
        }
        return valid;
    }

    /**
     * Reports member annotations used on a type that is not a {@code @SnapshotFixture}.
     *
     * @param member        an element carrying a snapshot member annotation
     * @param errorReporter callback for reporting compilation errors
     * @return {@code true} if the enclosing type is annotated
     */
    static boolean validateEnclosingFixture(Element member, ErrorReporter errorReporter) {
        Element enclosing = member.getEnclosingElement();
        if (enclosing != null && enclosing.getAnnotation(SnapshotFixture.class) != null) {
            return true;
        }
        String annotation = member.getAnnotation(SnapshotIgnore.class) != null ? "@SnapshotIgnore"
                : member.getAnnotation(SnapshotRename.class) != null ? "@SnapshotRename" : "@SnapshotRedact";
        errorReporter.error(member, annotation + " on '" + member.getSimpleName()
                + "' has no effect without @SnapshotFixture on the enclosing type.");
        return false;
    }

    private static String describe(ElementKind kind) {
        return switch (kind) {
            case INTERFACE -> "an interface";
            case ENUM -> "an enum";
            case ANNOTATION_TYPE -> "an annotation type";
            default -> kind.toString().toLowerCase(Locale.ROOT);
        };
    }
}
