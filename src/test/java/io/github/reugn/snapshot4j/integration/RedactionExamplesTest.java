package io.github.reugn.snapshot4j.integration;

import com.google.testing.compile.JavaFileObjects;
import io.github.reugn.snapshot4j.metadata.MetadataSupport;
import io.github.reugn.snapshot4j.util.RuntimeTestHelper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.tools.JavaFileObject;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runtime tests: compile annotated fixture types, instantiate them and render the instances
 * through the generated metadata.
 */
@DisplayName("Redaction Examples (Runtime)")
class RedactionExamplesTest {

    private static final JavaFileObject ACCOUNT = JavaFileObjects.forSourceString("example.Account",
            """
                    package example;

                    import io.github.reugn.snapshot4j.annotation.SnapshotFixture;
                    import io.github.reugn.snapshot4j.annotation.SnapshotIgnore;
                    import io.github.reugn.snapshot4j.annotation.SnapshotRedact;
                    import io.github.reugn.snapshot4j.annotation.SnapshotRename;

                    @SnapshotFixture
                    public record Account(
                            String id,
                            @SnapshotRename("owner") String name,
                            @SnapshotRedact String iban,
                            @SnapshotRedact(hash = true) String token,
                            @SnapshotIgnore long session) {}
                    """);

    private static final Class<?>[] ACCOUNT_PARAMS = {String.class, String.class, String.class, String.class, long.class};

    @Test
    @DisplayName("Renamed, masked, hashed and ignored members")
    void account() {
        RuntimeTestHelper helper = RuntimeTestHelper.compile(ACCOUNT);
        Object account = helper.newInstance("example.Account", ACCOUNT_PARAMS,
                "A-1", "Alice", "DE89370400440532013000", "secret-token", 4242L);

        String rendered = helper.render(account);

        assertThat(rendered)
                .startsWith("new example.Account(")
                .contains("/* id= */ \"A-1\"")
                .contains("/* owner= */ \"Alice\"")
                .contains("/* iban= */ \"\\u2022\\u2022\\u2022\"")
                .contains("/* token= */ \"" + MetadataSupport.hashPlaceholder("\"secret-token\"") + "\"")
                .doesNotContain("DE89370400440532013000")
                .doesNotContain("secret-token")
                .doesNotContain("name=")
                .endsWith("0L\n)");
    }

    @Test
    @DisplayName("Equal secrets produce equal placeholders")
    void hashIsStable() {
        RuntimeTestHelper helper = RuntimeTestHelper.compile(ACCOUNT);
        Object first = helper.newInstance("example.Account", ACCOUNT_PARAMS, "1", "a", "x", "same", 0L);
        Object second = helper.newInstance("example.Account", ACCOUNT_PARAMS, "2", "b", "y", "same", 0L);

        String firstToken = tokenLine(helper.render(first));
        String secondToken = tokenLine(helper.render(second));

        assertThat(firstToken).isEqualTo(secondToken).contains("<sha256:");
    }

    @Test
    @DisplayName("Class fixture with a custom mask and getters")
    void classFixture() {
        JavaFileObject source = JavaFileObjects.forSourceString("example.Customer",
                """
                        package example;

                        import io.github.reugn.snapshot4j.annotation.SnapshotFixture;
                        import io.github.reugn.snapshot4j.annotation.SnapshotRedact;

                        @SnapshotFixture
                        public class Customer {
                            private final String name;
                            @SnapshotRedact(mask = "***")
                            private final String card;

                            public Customer(String name, String card) {
                                this.name = name;
                                this.card = card;
                            }

                            public String getName() {
                                return name;
                            }

                            public String getCard() {
                                return card;
                            }
                        }
                        """);

        RuntimeTestHelper helper = RuntimeTestHelper.compile(source);
        Object customer = helper.newInstance("example.Customer",
                new Class<?>[]{String.class, String.class}, "Bob", "4111111111111111");

        assertThat(helper.render(customer))
                .contains("/* name= */ \"Bob\"")
                .contains("/* card= */ \"***\"")
                .doesNotContain("4111");
    }

    @Test
    @DisplayName("Metadata is used for fixture values nested in collections")
    void nestedInCollection() {
        RuntimeTestHelper helper = RuntimeTestHelper.compile(ACCOUNT);
        Object account = helper.newInstance("example.Account", ACCOUNT_PARAMS, "A-2", "Eve", "iban", "tok", 1L);

        String rendered = helper.render(List.of(account));

        assertThat(rendered).startsWith("java.util.List.of(new example.Account(").doesNotContain("\"tok\"");
    }

    private static String tokenLine(String rendered) {
        return rendered.lines()
                .filter(line -> line.contains("/* token= */"))
                .findFirst()
                .orElseThrow();
    }
}
