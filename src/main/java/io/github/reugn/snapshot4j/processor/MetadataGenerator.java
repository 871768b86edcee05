package io.github.reugn.snapshot4j.processor;

import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeSpec;
import io.github.reugn.snapshot4j.metadata.MetadataSupport;
import io.github.reugn.snapshot4j.metadata.PropertyDescriptor;
import io.github.reugn.snapshot4j.metadata.Redaction;
import io.github.reugn.snapshot4j.metadata.TypeMetadata;
import io.github.reugn.snapshot4j.render.RenderContext;

import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeMirror;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the {@code {ClassName}SnapshotMetadata} source for a {@code @SnapshotFixture} type.
 *
 * <p><b>Generated Structure:</b>
 * <pre>
 * {@code @Generated("io.github.reugn.snapshot4j.processor.SnapshotProcessor")
 * public final class AccountSnapshotMetadata implements TypeMetadata<Account> {
 *     private static final List<PropertyDescriptor> PROPERTIES = List.of(
 *             new PropertyDescriptor("id", null, null, false),
 *             new PropertyDescriptor("iban", null, Redaction.mask("•••"), false));
 *
 *     public Class<Account> type() { return Account.class; }
 *
 *     public List<PropertyDescriptor> properties() { return PROPERTIES; }
 *
 *     public CodeBlock render(Account instance, RenderContext ctx) {
 *         List<CodeBlock> args = new ArrayList<>();
 *         args.add(MetadataSupport.member(ctx, PROPERTIES.get(0), instance.id()));
 *         args.add(MetadataSupport.member(ctx, PROPERTIES.get(1), instance.iban()));
 *         return MetadataSupport.construct(Account.class, args);
 *     }
 * }}
 * </pre>
 */
final class MetadataGenerator {

    private static final String PROPERTIES = "PROPERTIES";
    private static final String INSTANCE_PARAM = "instance";
    private static final String CONTEXT_PARAM = "ctx";

    private MetadataGenerator() {
    }

    /**
     * Generates the metadata source file.
     *
     * @param type        the annotated type
     * @param packageName the package of the annotated type
     * @param members     constructor arguments in parameter order
     * @param folder      {@code @SnapshotFixture.folder()}
     * @param context     {@code @SnapshotFixture.context()}
     * @return the file ready to be written to the filer
     */
    static JavaFile generate(TypeElement type, String packageName, List<MemberInfo> members,
                             String folder, String context) {
        ClassName described = ClassName.get(type);
        boolean generic = !type.getTypeParameters().isEmpty();
        String className = metadataSimpleName(described);

        TypeSpec.Builder builder = TypeSpec.classBuilder(className)
                .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
                .addSuperinterface(ParameterizedTypeName.get(ClassName.get(TypeMetadata.class), described))
                .addAnnotation(AnnotationSpec.builder(ClassName.get("javax.annotation.processing", "Generated"))
                        .addMember("value", "$S", SnapshotProcessor.class.getCanonicalName())
                        .build())
                .addJavadoc("Snapshot metadata for {@link $T}.\n", described)
                .addJavadoc("<p>Generated by snapshot4j annotation processor.\n")
                .addField(propertiesField(members))
                .addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PUBLIC).build())
                .addMethod(MethodSpec.methodBuilder("type")
                        .addAnnotation(Override.class)
                        .addModifiers(Modifier.PUBLIC)
                        .returns(ParameterizedTypeName.get(ClassName.get(Class.class), described))
                        .addStatement("return $T.class", described)
                        .build())
                .addMethod(MethodSpec.methodBuilder("properties")
                        .addAnnotation(Override.class)
                        .addModifiers(Modifier.PUBLIC)
                        .returns(ParameterizedTypeName.get(List.class, PropertyDescriptor.class))
                        .addStatement("return $N", PROPERTIES)
                        .build())
                .addMethod(renderMethod(described, members));
        if (generic) {
            builder.addAnnotation(AnnotationSpec.builder(SuppressWarnings.class)
                    .addMember("value", "$S", "rawtypes")
                    .build());
        }
        if (!folder.isEmpty()) {
            builder.addMethod(stringConstant("folder", folder));
        }
        if (!context.isEmpty()) {
            builder.addMethod(stringConstant("context", context));
        }

        return JavaFile.builder(packageName, builder.build())
                .addFileComment("Generated by snapshot4j annotation processor. Do not modify.")
                .build();
    }

    /**
     * Returns the metadata class name, with nested type names flattened by underscores.
     *
     * @param described the annotated type
     * @return {@code Outer_InnerSnapshotMetadata} for {@code Outer.Inner}
     */
    static String metadataSimpleName(ClassName described) {
        return String.join("_", described.simpleNames()) + MetadataSupport.CLASS_SUFFIX;
    }

    private static FieldSpec propertiesField(List<MemberInfo> members) {
        CodeBlock.Builder list = CodeBlock.builder().add("$T.of(", List.class);
        for (int i = 0; i < members.size(); i++) {
            list.add(i == 0 ? "\n$>$>" : ",\n").add(descriptor(members.get(i)));
        }
        if (!members.isEmpty()) {
            list.add("$<$<");
        }
        list.add(")");
        return FieldSpec.builder(ParameterizedTypeName.get(List.class, PropertyDescriptor.class), PROPERTIES,
                        Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL)
                .initializer(list.build())
                .build();
    }

    private static CodeBlock descriptor(MemberInfo member) {
        CodeBlock label = member.renamedLabel() == null
                ? CodeBlock.of("null")
                : CodeBlock.of("$S", member.renamedLabel());
        CodeBlock redaction;
        if (member.hash()) {
            redaction = CodeBlock.of("$T.hash()", Redaction.class);
        } else if (member.mask() != null) {
            redaction = CodeBlock.of("$T.mask($S)", Redaction.class, member.mask());
        } else {
            redaction = CodeBlock.of("null");
        }
        return CodeBlock.of("new $T($S, $L, $L, $L)", PropertyDescriptor.class, member.name(), label, redaction,
                member.ignored());
    }

    private static MethodSpec renderMethod(ClassName described, List<MemberInfo> members) {
        MethodSpec.Builder method = MethodSpec.methodBuilder("render")
                .addAnnotation(Override.class)
                .addModifiers(Modifier.PUBLIC)
                .returns(CodeBlock.class)
                .addParameter(described, INSTANCE_PARAM)
                .addParameter(RenderContext.class, CONTEXT_PARAM)
                .addStatement("$T<$T> args = new $T<>()", List.class, CodeBlock.class, ArrayList.class);
        for (int i = 0; i < members.size(); i++) {
            MemberInfo member = members.get(i);
            if (member.ignored()) {
                method.addStatement("args.add($T.ignored($S))", MetadataSupport.class, defaultLiteral(member.type()));
            } else {
                method.addStatement("args.add($T.member($N, $N.get($L), $L))", MetadataSupport.class,
                        CONTEXT_PARAM, PROPERTIES, i, member.access());
            }
        }
        return method.addStatement("return $T.construct($T.class, args)", MetadataSupport.class, described)
                .build();
    }

    private static MethodSpec stringConstant(String name, String value) {
        return MethodSpec.methodBuilder(name)
                .addAnnotation(Override.class)
                .addModifiers(Modifier.PUBLIC)
                .returns(String.class)
                .addStatement("return $S", value)
                .build();
    }

    /**
     * Returns the Java default value literal of a type, written for ignored members.
     *
     * @param type the member type
     * @return {@code null} for references, {@code 0}, {@code 0L}, {@code false} and so on for primitives
     */
    static String defaultLiteral(TypeMirror type) {
        return switch (type.getKind()) {
            case BOOLEAN -> "false";
            case BYTE -> "(byte) 0x00";
            case SHORT -> "(short) 0";
            case INT -> "0";
            case LONG -> "0L";
            case FLOAT -> "0.0F";
            case DOUBLE -> "0.0";
            case CHAR -> "'\\0'";
            default -> "null";
        };
    }
}
