package io.github.reugn.snapshot4j.export;

import io.github.reugn.snapshot4j.config.SnapshotConfig;

import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;

/**
 * Resolves the output root from the first available source:
 * <ol>
 *   <li>the directory requested for the export</li>
 *   <li>the root set on {@link SnapshotConfig}</li>
 *   <li>the {@value #ENV_ROOT} environment variable</li>
 *   <li>{@code src/test/java} under the working directory</li>
 * </ol>
 */
public final class DefaultOutputDirectoryResolver implements OutputDirectoryResolver {

    public static final String ENV_ROOT = "SNAPSHOT4J_ROOT";

    static final Path DEFAULT_ROOT = Path.of("src", "test", "java");

    private final Function<String, String> environment;

    public DefaultOutputDirectoryResolver() {
        this(System::getenv);
    }

    /**
     * Creates a resolver reading variables from the given lookup instead of the process
     * environment.
     *
     * @param environment variable name to value, returning {@code null} when unset
     */
    public DefaultOutputDirectoryResolver(Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    @Override
    public Path resolve(Path explicitDirectory, SnapshotConfig.Settings settings) {
        if (explicitDirectory != null) {
            return explicitDirectory;
        }
        if (settings.root() != null) {
            return settings.root();
        }
        String fromEnvironment = environment.apply(ENV_ROOT);
        if (fromEnvironment != null && !fromEnvironment.isBlank()) {
            return Path.of(fromEnvironment);
        }
        return DEFAULT_ROOT;
    }
}
