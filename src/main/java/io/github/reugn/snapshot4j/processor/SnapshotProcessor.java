package io.github.reugn.snapshot4j.processor;

import com.google.auto.service.AutoService;
import com.squareup.javapoet.CodeBlock;
import io.github.reugn.snapshot4j.annotation.SnapshotFixture;
import io.github.reugn.snapshot4j.annotation.SnapshotIgnore;
import io.github.reugn.snapshot4j.annotation.SnapshotRedact;
import io.github.reugn.snapshot4j.annotation.SnapshotRename;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Messager;
import javax.annotation.processing.ProcessingEnvironment;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.annotation.processing.SupportedSourceVersion;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.RecordComponentElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Annotation processor for snapshot4j that generates rendering metadata for fixture types.
 *
 * <p>Registered via {@link com.google.auto.service.AutoService} for automatic discovery by the
 * Java compiler.
 *
 * <p><b>Supported Annotations:</b>
 * <table border="1">
 *   <caption>Annotations processed by this processor</caption>
 *   <tr><th>Annotation</th><th>Target</th><th>Purpose</th></tr>
 *   <tr>
 *     <td>{@link SnapshotFixture}</td>
 *     <td>Record, Class</td>
 *     <td>Generates a {@code {ClassName}SnapshotMetadata} class</td>
 *   </tr>
 *   <tr>
 *     <td>{@link SnapshotIgnore}, {@link SnapshotRename}, {@link SnapshotRedact}</td>
 *     <td>Record component, Field</td>
 *     <td>Adjust how one member is rendered</td>
 *   </tr>
 * </table>
 *
 * <p><b>Processing Pipeline:</b>
 * <ol>
 *   <li><b>Validation</b>: Check the annotated type and every member annotation</li>
 *   <li><b>Collection</b>: Resolve constructor arguments from record components, or from fields matched
 *       against a constructor for classes</li>
 *   <li><b>Generation</b>: Write the metadata class through {@link MetadataGenerator}</li>
 * </ol>
 *
 * <p><b>Error Handling:</b>
 * Problems are reported via the {@link Messager} and processing continues so that a single
 * compilation reports as many errors as possible.
 *
 * @see MetadataGenerator
 * @see ValidationUtils
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes({
        "io.github.reugn.snapshot4j.annotation.SnapshotFixture",
        "io.github.reugn.snapshot4j.annotation.SnapshotIgnore",
        "io.github.reugn.snapshot4j.annotation.SnapshotRename",
        "io.github.reugn.snapshot4j.annotation.SnapshotRedact"
})
@SupportedSourceVersion(SourceVersion.RELEASE_17)
public class SnapshotProcessor extends AbstractProcessor {

    private ErrorReporter errorReporter;
    private Types typeUtils;
    private Elements elementUtils;

    /**
     * Creates a new SnapshotProcessor instance.
     *
     * <p>This no-arg constructor is required for annotation processor discovery via
     * {@link java.util.ServiceLoader}.
     */
    public SnapshotProcessor() {
        // Required for ServiceLoader-based processor discovery
    }

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        this.errorReporter = ErrorReporter.of(processingEnv.getMessager());
        this.typeUtils = processingEnv.getTypeUtils();
        this.elementUtils = processingEnv.getElementUtils();
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        validateStrayMemberAnnotations(roundEnv);

        for (Element element : roundEnv.getElementsAnnotatedWith(SnapshotFixture.class)) {
            if (!(element instanceof TypeElement type)) {
                errorReporter.error(element, "@SnapshotFixture can only be applied to records and classes.");
                continue;
            }
            if (!ValidationUtils.validateFixtureType(type, errorReporter)) {
                continue;
            }
            List<MemberInfo> members = type.getKind() == ElementKind.RECORD
                    ? collectRecordMembers(type)
                    : collectClassMembers(type);
            if (members == null) {
                continue; // Error already reported
            }

            SnapshotFixture fixture = type.getAnnotation(SnapshotFixture.class);
            try {
                MetadataGenerator.generate(type, getPackageName(type), members, fixture.folder(), fixture.context())
                        .writeTo(processingEnv.getFiler());
            } catch (IOException e) {
                errorReporter.error(type, "Failed to generate snapshot metadata: " + e.getMessage());
            }
        }
        return true;
    }

    // ==================== VALIDATION ====================

    // A record component annotation is also copied to the backing field; report each member once.
    private void validateStrayMemberAnnotations(RoundEnvironment roundEnv) {
        Set<String> reported = new HashSet<>();
        Set<Element> annotated = new LinkedHashSet<>();
        annotated.addAll(roundEnv.getElementsAnnotatedWith(SnapshotIgnore.class));
        annotated.addAll(roundEnv.getElementsAnnotatedWith(SnapshotRename.class));
        annotated.addAll(roundEnv.getElementsAnnotatedWith(SnapshotRedact.class));
        for (Element member : annotated) {
            String key = member.getEnclosingElement() + "#" + member.getSimpleName();
            if (reported.add(key)) {
                ValidationUtils.validateEnclosingFixture(member, errorReporter);
            }
        }
    }

    // ==================== COLLECTION ====================

    /**
     * Collects record components in declaration order. Accessors of records are always public,
     * so every component is read through its accessor.
     *
     * @param recordElement the record type
     * @return the members, or {@code null} if a member annotation is invalid
     */
    private List<MemberInfo> collectRecordMembers(TypeElement recordElement) {
        List<MemberInfo> members = new ArrayList<>();
        boolean valid = true;
        for (Element enclosed : recordElement.getEnclosedElements()) {
            if (enclosed.getKind() != ElementKind.RECORD_COMPONENT) {
                continue;
            }
            RecordComponentElement component = (RecordComponentElement) enclosed;
            String name = component.getSimpleName().toString();
            valid &= ValidationUtils.validateMemberAnnotations(component, component.asType(), elementUtils,
                    typeUtils, errorReporter);
            members.add(memberInfo(component, name, component.asType(), CodeBlock.of("instance.$N()", name)));
        }
        return valid ? members : null;
    }

    /**
     * Collects the instance fields of a class, superclass fields first, and checks that a
     * constructor takes them in that order.
     *
     * @param classElement the class
     * @return the members, or {@code null} if an error was reported
     */
    private List<MemberInfo> collectClassMembers(TypeElement classElement) {
        List<VariableElement> fields = instanceFields(classElement);
        List<TypeMirror> fieldTypes = new ArrayList<>();
        for (VariableElement field : fields) {
            fieldTypes.add(field.asType());
        }
        if (!hasMatchingConstructor(classElement, fieldTypes)) {
            errorReporter.error(classElement, "Class '" + classElement.getSimpleName()
                    + "' has no non-private constructor taking its fields " + fieldTypes
                    + ". Add one or use a record.");
            return null;
        }

        List<MemberInfo> members = new ArrayList<>();
        boolean valid = true;
        for (VariableElement field : fields) {
            String name = field.getSimpleName().toString();
            valid &= ValidationUtils.validateMemberAnnotations(field, field.asType(), elementUtils,
                    typeUtils, errorReporter);
            if (field.getAnnotation(SnapshotIgnore.class) != null) {
                members.add(memberInfo(field, name, field.asType(), CodeBlock.of("null")));
                continue;
            }
            CodeBlock access = accessExpression(classElement, field);
            if (access == null) {
                errorReporter.error(field, "Field '" + name + "' is private and has no accessor. "
                        + "Add a getter or make the field package-private.");
                valid = false;
                continue;
            }
            members.add(memberInfo(field, name, field.asType(), access));
        }
        return valid ? members : null;
    }

    private MemberInfo memberInfo(Element element, String name, TypeMirror type, CodeBlock access) {
        SnapshotRename rename = element.getAnnotation(SnapshotRename.class);
        SnapshotRedact redact = element.getAnnotation(SnapshotRedact.class);
        boolean hash = redact != null && redact.hash();
        String mask = redact != null && !hash ? redact.mask() : null;
        return new MemberInfo(element, name, type, access,
                rename != null ? rename.value() : null, mask, hash,
                element.getAnnotation(SnapshotIgnore.class) != null);
    }

    private List<VariableElement> instanceFields(TypeElement classElement) {
        Deque<TypeElement> hierarchy = new ArrayDeque<>();
        for (TypeElement current = classElement; current != null; current = superclassOf(current)) {
            hierarchy.push(current);
        }
        List<VariableElement> fields = new ArrayList<>();
        for (TypeElement type : hierarchy) {
            for (Element enclosed : type.getEnclosedElements()) {
                Set<Modifier> modifiers = enclosed.getModifiers();
                if (enclosed.getKind() == ElementKind.FIELD
                        && !modifiers.contains(Modifier.STATIC)
                        && !modifiers.contains(Modifier.TRANSIENT)) {
                    fields.add((VariableElement) enclosed);
                }
            }
        }
        return fields;
    }

    private TypeElement superclassOf(TypeElement type) {
        TypeMirror superclass = type.getSuperclass();
        if (superclass.getKind() != TypeKind.DECLARED) {
            return null;
        }
        TypeElement element = (TypeElement) ((DeclaredType) superclass).asElement();
        return element.getQualifiedName().contentEquals(Object.class.getCanonicalName()) ? null : element;
    }

    private boolean hasMatchingConstructor(TypeElement classElement, List<TypeMirror> fieldTypes) {
        for (Element enclosed : classElement.getEnclosedElements()) {
            if (enclosed.getKind() != ElementKind.CONSTRUCTOR || enclosed.getModifiers().contains(Modifier.PRIVATE)) {
                continue;
            }
            List<? extends VariableElement> params = ((ExecutableElement) enclosed).getParameters();
            if (params.size() != fieldTypes.size()) {
                continue;
            }
            boolean matches = true;
            for (int i = 0; i < params.size(); i++) {
                if (!typeUtils.isSameType(params.get(i).asType(), fieldTypes.get(i))) {
                    matches = false;
                    break;
                }
            }
            if (matches) {
                return true;
            }
        }
        return false;
    }

    /**
     * Finds how the generated class, which lives in the same package, can read a field:
     * directly when it is visible, otherwise through a {@code getX()}, {@code isX()} or
     * {@code x()} accessor.
     *
     * @return the read expression, or {@code null} if the field cannot be read
     */
    private CodeBlock accessExpression(TypeElement classElement, VariableElement field) {
        String name = field.getSimpleName().toString();
        if (isVisibleFromPackage(field, classElement)) {
            return CodeBlock.of("instance.$N", name);
        }
        String capitalized = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        List<String> candidates = List.of("get" + capitalized, "is" + capitalized, name);
        for (Element member : elementUtils.getAllMembers(classElement)) {
            if (member.getKind() != ElementKind.METHOD) {
                continue;
            }
            ExecutableElement method = (ExecutableElement) member;
            if (candidates.contains(method.getSimpleName().toString())
                    && method.getParameters().isEmpty()
                    && !method.getModifiers().contains(Modifier.STATIC)
                    && isVisibleFromPackage(method, classElement)
                    && typeUtils.isSameType(method.getReturnType(), field.asType())) {
                return CodeBlock.of("instance.$N()", method.getSimpleName().toString());
            }
        }
        return null;
    }

    private boolean isVisibleFromPackage(Element member, TypeElement classElement) {
        Set<Modifier> modifiers = member.getModifiers();
        if (modifiers.contains(Modifier.PRIVATE)) {
            return false;
        }
        if (modifiers.contains(Modifier.PUBLIC)) {
            return true;
        }
        return elementUtils.getPackageOf(member).equals(elementUtils.getPackageOf(classElement));
    }

    private String getPackageName(TypeElement type) {
        return elementUtils.getPackageOf(type).getQualifiedName().toString();
    }
}
