package io.github.reugn.snapshot4j;

import io.github.reugn.snapshot4j.config.SnapshotConfig;
import io.github.reugn.snapshot4j.export.DefaultOutputDirectoryResolver;
import io.github.reugn.snapshot4j.export.ExportRequest;
import io.github.reugn.snapshot4j.export.SnapshotExporter;
import io.github.reugn.snapshot4j.export.SnapshotSource;
import io.github.reugn.snapshot4j.format.CodeFormatter;
import io.github.reugn.snapshot4j.metadata.GeneratedMetadataProvider;
import io.github.reugn.snapshot4j.render.RendererRegistry;
import io.github.reugn.snapshot4j.render.ValueRenderer;

import java.nio.file.Path;

/**
 * Entry point over the shared configuration and the shared renderer registry.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * // expression text only
 * String expr = Snapshot4j.render(List.of(1, 2, 3));
 *
 * // full fixture file under src/test/java
 * Path file = Snapshot4j.export(user, "admin");
 *
 * // custom rendering for a third-party type
 * Snapshot4j.registry().register(Money.class,
 *         (money, ctx) -> CodeBlock.of("$T.parse($S)", Money.class, money.toString()));
 * }</pre>
 *
 * @see SnapshotConfig#shared()
 * @see RendererRegistry#shared()
 */
public final class Snapshot4j {

    private static final ValueRenderer RENDERER =
            new ValueRenderer(RendererRegistry.shared(), GeneratedMetadataProvider.getInstance());

    private static final SnapshotExporter EXPORTER = new SnapshotExporter(SnapshotConfig.shared(), RENDERER,
            GeneratedMetadataProvider.getInstance(), new DefaultOutputDirectoryResolver());

    private Snapshot4j() {
    }

    /**
     * Renders a value as a formatted Java expression.
     *
     * <p>Without an enclosing file there are no imports, so type references are fully
     * qualified: {@code java.util.List.of(1, 2)}.
     *
     * @param value the value, may be {@code null}
     * @return the expression text, without a trailing semicolon or newline
     */
    public static String render(Object value) {
        SnapshotConfig.Settings settings = SnapshotConfig.shared().snapshot();
        String expression = RENDERER.render(value, settings.renderOptions()).toString();
        return CodeFormatter.format(expression,
                settings.formatProfile().toBuilder().insertFinalNewline(false).build());
    }

    /**
     * Builds the fixture file for a value without writing it.
     *
     * @param value        the value
     * @param variableName the requested field name
     * @return the formatted source
     */
    public static SnapshotSource source(Object value, String variableName) {
        return EXPORTER.source(value, variableName, ExportRequest.defaults());
    }

    public static Path export(Object value, String variableName) {
        return EXPORTER.export(value, variableName);
    }

    public static Path export(Object value, String variableName, ExportRequest request) {
        return EXPORTER.export(value, variableName, request);
    }

    public static RendererRegistry registry() {
        return RendererRegistry.shared();
    }

    public static SnapshotConfig config() {
        return SnapshotConfig.shared();
    }
}
