package io.github.reugn.snapshot4j;

import com.squareup.javapoet.CodeBlock;
import io.github.reugn.snapshot4j.config.RenderOptions;
import io.github.reugn.snapshot4j.export.ExportRequest;
import io.github.reugn.snapshot4j.export.SnapshotSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Snapshot4j")
class Snapshot4jTest {

    record Money(long cents, String currency) {
    }

    @AfterEach
    void tearDown() {
        Snapshot4j.config().resetToDefaults();
        Snapshot4j.registry().unregister(Money.class);
    }

    @Test
    @DisplayName("render returns the formatted expression without a final newline")
    void render() {
        assertThat(Snapshot4j.render(List.of(1, 2))).isEqualTo("java.util.List.of(\n    1,\n    2\n)");
        assertThat(Snapshot4j.render(null)).isEqualTo("null");
    }

    @Test
    @DisplayName("render follows the shared configuration")
    void sharedConfig() {
        Snapshot4j.config().setRenderOptions(RenderOptions.builder().inlineBinaryThreshold(0).build());
        assertThat(Snapshot4j.render(new byte[]{1})).startsWith("java.util.Base64");
    }

    @Test
    @DisplayName("Shared registry entries apply to renders and sources")
    void sharedRegistry() {
        Snapshot4j.registry().register(Money.class,
                (money, ctx) -> CodeBlock.of("$T.of($LL, $S)", Money.class, money.cents(), money.currency()));

        assertThat(Snapshot4j.render(Map.of("price", new Money(250, "EUR"))))
                .contains("io.github.reugn.snapshot4j.Snapshot4jTest.Money.of(250L, \"EUR\")");

        SnapshotSource source = Snapshot4j.source(new Money(1, "USD"), "price");
        assertThat(source.content()).contains("price = Snapshot4jTest.Money.of(1L, \"USD\");");
    }

    @Test
    @DisplayName("export writes under the configured root")
    void export(@TempDir Path root) {
        Snapshot4j.config().setRoot(root);
        Path file = Snapshot4j.export("hello", "greeting");

        assertThat(file).isEqualTo(root.resolve("StringGreetingSnapshot.java"));
        assertThat(Files.exists(file)).isTrue();

        Path other = Snapshot4j.export("hi", "greeting",
                ExportRequest.builder().outputDirectory(root.resolve("other")).build());
        assertThat(other).isEqualTo(root.resolve("other").resolve("StringGreetingSnapshot.java"));
    }
}
