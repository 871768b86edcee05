package io.github.reugn.snapshot4j.metadata;

import com.squareup.javapoet.CodeBlock;
import io.github.reugn.snapshot4j.config.RenderOptions;
import io.github.reugn.snapshot4j.render.RenderContext;
import io.github.reugn.snapshot4j.render.RendererRegistry;
import io.github.reugn.snapshot4j.render.ValueRenderer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the runtime half of generated metadata, driven by a hand-written
 * {@link TypeMetadata} so the processor is not involved.
 */
@DisplayName("MetadataSupport")
class MetadataSupportTest {

    record Credentials(String user, String password, String token, long session) {
    }

    static class Outer {
        record Inner(int value) {
        }
    }

    private static final List<PropertyDescriptor> PROPERTIES = List.of(
            new PropertyDescriptor("user", "login", null, false),
            new PropertyDescriptor("password", null, Redaction.mask(Redaction.DEFAULT_MASK), false),
            new PropertyDescriptor("token", null, Redaction.hash(), false),
            new PropertyDescriptor("session", null, null, true));

    private static final TypeMetadata<Credentials> METADATA = new TypeMetadata<>() {
        @Override
        public Class<Credentials> type() {
            return Credentials.class;
        }

        @Override
        public List<PropertyDescriptor> properties() {
            return PROPERTIES;
        }

        @Override
        public CodeBlock render(Credentials instance, RenderContext ctx) {
            return MetadataSupport.construct(Credentials.class, List.of(
                    MetadataSupport.member(ctx, PROPERTIES.get(0), instance.user()),
                    MetadataSupport.member(ctx, PROPERTIES.get(1), instance.password()),
                    MetadataSupport.member(ctx, PROPERTIES.get(2), instance.token()),
                    MetadataSupport.ignored("0L")));
        }
    };

    private static String render(Object value) {
        MetadataProvider provider = type -> type == Credentials.class ? Optional.of(METADATA) : Optional.empty();
        return new ValueRenderer(RendererRegistry.withDefaults(), provider)
                .render(value, RenderOptions.defaults())
                .toString();
    }

    @Nested
    @DisplayName("Members")
    class Members {

        @Test
        @DisplayName("Renames, masks, hashes and ignores are applied")
        void applied() {
            String rendered = render(new Credentials("alice", "hunter2", "tok-123", 99L));

            assertThat(rendered)
                    .contains("/* login= */ \"alice\"")
                    .contains("/* password= */ \"\\u2022\\u2022\\u2022\"")
                    .contains("/* token= */ \"<sha256:")
                    .doesNotContain("hunter2")
                    .doesNotContain("tok-123")
                    .endsWith("0L\n)");
        }

        @Test
        @DisplayName("Masks are written even for null values")
        void maskNull() {
            assertThat(render(new Credentials("bob", null, "t", 1L))).contains("/* password= */ \"\\u2022");
        }

        @Test
        @DisplayName("Metadata applies to nested values too")
        void nested() {
            String rendered = render(Map.of("admin", new Credentials("root", "pw", "t", 0L)));
            assertThat(rendered).contains("/* login= */ \"root\"").doesNotContain("\"pw\"");
        }
    }

    @Nested
    @DisplayName("Hash Placeholder")
    class HashPlaceholder {

        @Test
        @DisplayName("Placeholder is a short SHA-256 prefix of the rendered value")
        void format() {
            String placeholder = MetadataSupport.hashPlaceholder("\"abc\"");
            assertThat(placeholder).matches("<sha256:[0-9a-f]{16}>");
        }

        @Test
        @DisplayName("Equal values hash equally, different values differently")
        void deterministic() {
            assertThat(MetadataSupport.hashPlaceholder("\"a\"")).isEqualTo(MetadataSupport.hashPlaceholder("\"a\""));
            assertThat(MetadataSupport.hashPlaceholder("\"a\"")).isNotEqualTo(MetadataSupport.hashPlaceholder("\"b\""));
        }

        @Test
        @DisplayName("Known digest")
        void knownDigest() {
            // sha256("") = e3b0c44298fc1c149afbf4c8996fb924...
            assertThat(MetadataSupport.hashPlaceholder("")).isEqualTo("<sha256:e3b0c44298fc1c14>");
        }
    }

    @Test
    @DisplayName("Metadata class names flatten nested types")
    void metadataClassName() {
        assertThat(MetadataSupport.metadataClassName(Credentials.class))
                .isEqualTo("io.github.reugn.snapshot4j.metadata.MetadataSupportTest_CredentialsSnapshotMetadata");
        assertThat(MetadataSupport.metadataClassName(Outer.Inner.class))
                .isEqualTo("io.github.reugn.snapshot4j.metadata.MetadataSupportTest_Outer_InnerSnapshotMetadata");
    }

    @Test
    @DisplayName("Generated provider finds nothing for types without metadata")
    void generatedProviderMiss() {
        assertThat(GeneratedMetadataProvider.getInstance().metadataFor(Credentials.class)).isEmpty();
        assertThat(GeneratedMetadataProvider.getInstance().metadataFor(String.class)).isEmpty();
    }

    @Test
    @DisplayName("Property label falls back to the original name")
    void label() {
        assertThat(PropertyDescriptor.of("name").label()).isEqualTo("name");
        assertThat(new PropertyDescriptor("name", "alias", null, false).label()).isEqualTo("alias");
    }
}
