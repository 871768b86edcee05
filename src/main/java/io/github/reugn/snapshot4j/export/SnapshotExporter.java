package io.github.reugn.snapshot4j.export;

import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import io.github.reugn.snapshot4j.config.SnapshotConfig;
import io.github.reugn.snapshot4j.error.OverwriteDisallowedException;
import io.github.reugn.snapshot4j.error.SnapshotIOException;
import io.github.reugn.snapshot4j.format.CodeFormatter;
import io.github.reugn.snapshot4j.metadata.MetadataProvider;
import io.github.reugn.snapshot4j.metadata.TypeMetadata;
import io.github.reugn.snapshot4j.render.Literals;
import io.github.reugn.snapshot4j.render.ValueRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.lang.model.element.Modifier;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes rendered values as compilable Java fixture files.
 *
 * <p>An export renders the value, wraps the expression in a holder class and formats the
 * result:
 * <pre>{@code
 * // Generated by snapshot4j
 * package com.example;
 *
 * public final class UserAdminSnapshot {
 *     /**
 *      * Admin user for authorization tests
 *      *}{@code /
 *     public static final User admin = new User(
 *         /* id= *}{@code / 42,
 *         /* name= *}{@code / "Alice"
 *     );
 *
 *     private UserAdminSnapshot() {
 *     }
 * }
 * }</pre>
 *
 * <p>Configuration is read once per call through {@link SnapshotConfig#snapshot()}.
 */
public final class SnapshotExporter {

    private static final Logger log = LoggerFactory.getLogger(SnapshotExporter.class);

    private static final String CLASS_SUFFIX = "Snapshot";

    private final SnapshotConfig config;
    private final ValueRenderer renderer;
    private final MetadataProvider metadata;
    private final OutputDirectoryResolver resolver;

    public SnapshotExporter(SnapshotConfig config, ValueRenderer renderer, MetadataProvider metadata,
                            OutputDirectoryResolver resolver) {
        this.config = Objects.requireNonNull(config, "config");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Renders and writes a value with default options.
     *
     * @param value        the value to capture
     * @param variableName the requested field name
     * @return the written file
     */
    public Path export(Object value, String variableName) {
        return export(value, variableName, ExportRequest.defaults());
    }

    /**
     * Renders and writes a value.
     *
     * @param value        the value to capture
     * @param variableName the requested field name, sanitized with {@link VariableNames}
     * @param request      per-call options
     * @return the written file
     * @throws OverwriteDisallowedException if the file exists and the request forbids overwriting
     * @throws SnapshotIOException          if the directory or file cannot be written
     */
    public Path export(Object value, String variableName, ExportRequest request) {
        SnapshotConfig.Settings settings = config.snapshot();
        Optional<TypeMetadata<?>> typeMetadata = metadataOf(value);
        SnapshotSource source = source(value, variableName, request, settings, typeMetadata);

        Path explicit = request.outputDirectory();
        if (explicit == null && typeMetadata.isPresent() && !typeMetadata.get().folder().isEmpty()) {
            explicit = Path.of(typeMetadata.get().folder());
        }
        Path file = resolver.resolve(explicit, settings).resolve(source.relativePath());
        write(file, source.content(), request.allowOverwrite());
        return file;
    }

    /**
     * Renders a value into fixture file content without touching the file system.
     *
     * @param value        the value to capture
     * @param variableName the requested field name
     * @param request      per-call options; the output directory and overwrite flag are ignored
     * @return the formatted source
     */
    public SnapshotSource source(Object value, String variableName, ExportRequest request) {
        return source(value, variableName, request, config.snapshot(), metadataOf(value));
    }

    private SnapshotSource source(Object value, String variableName, ExportRequest request,
                                  SnapshotConfig.Settings settings, Optional<TypeMetadata<?>> typeMetadata) {
        String name = VariableNames.sanitize(variableName);
        CodeBlock expression = renderer.render(value, settings.renderOptions());

        TypeName fieldType = FieldTypes.declaredType(value);
        String className = request.className() != null
                ? request.className()
                : FieldTypes.simpleName(fieldType) + Literals.capitalize(name) + CLASS_SUFFIX;
        String packageName = request.packageName() != null ? request.packageName() : packageOf(value);

        FieldSpec.Builder field = FieldSpec.builder(fieldType, name,
                        Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                .initializer(expression);
        String context = request.context() != null
                ? request.context()
                : typeMetadata.map(TypeMetadata::context).orElse("");
        if (!context.isEmpty()) {
            field.addJavadoc("$L\n", javadocText(context));
        }

        TypeSpec holder = TypeSpec.classBuilder(className)
                .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
                .addField(field.build())
                .addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build())
                .build();

        JavaFile.Builder file = JavaFile.builder(packageName, holder)
                .skipJavaLangImports(true)
                .indent(settings.formatProfile().indentUnit());
        String header = request.header() != null ? request.header() : settings.header();
        if (header != null && !header.isEmpty()) {
            file.addFileComment("$L", headerComment(header));
        }

        String content = CodeFormatter.format(file.build().toString(), settings.formatProfile());
        return new SnapshotSource(packageName, className, name, content);
    }

    private Optional<TypeMetadata<?>> metadataOf(Object value) {
        return value == null ? Optional.empty() : metadata.metadataFor(value.getClass());
    }

    // JDK types live in packages that cannot hold user classes; their fixtures go to the unnamed package.
    private static String packageOf(Object value) {
        if (value == null) {
            return "";
        }
        Class<?> type = value instanceof Enum<?> e ? e.getDeclaringClass() : value.getClass();
        if (type.isArray() || type.getClassLoader() == null) {
            return "";
        }
        return type.getPackageName();
    }

    // JavaFile prefixes every comment line with "// "; drop markers already present in the header.
    // "*/" would close the Javadoc early; the entity renders the same in generated docs.
    static String javadocText(String context) {
        return context.replace("*/", "*&#47;");
    }

    private static String headerComment(String header) {
        StringBuilder sb = new StringBuilder();
        for (String line : header.split("\r\n|\r|\n", -1)) {
            String text = line.strip();
            if (text.startsWith("//")) {
                text = text.substring(2).strip();
            }
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(text);
        }
        return sb.toString();
    }

    private static void write(Path file, String content, boolean allowOverwrite) {
        if (!allowOverwrite && Files.exists(file)) {
            throw new OverwriteDisallowedException(file);
        }
        Path directory = file.toAbsolutePath().getParent();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new SnapshotIOException("failed to create directory " + directory, e);
        }
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SnapshotIOException("failed to write file " + file, e);
        }
        log.info("Wrote snapshot {}", file);
    }
}
