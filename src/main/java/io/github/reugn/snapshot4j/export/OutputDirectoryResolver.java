package io.github.reugn.snapshot4j.export;

import io.github.reugn.snapshot4j.config.SnapshotConfig;

import java.nio.file.Path;

/**
 * Chooses the source root a fixture file is written under.
 */
@FunctionalInterface
public interface OutputDirectoryResolver {

    /**
     * Resolves the output root.
     *
     * @param explicitDirectory directory requested for this export, or {@code null}
     * @param settings          configuration captured at the start of the export
     * @return the source root; the holder's package directories are created beneath it
     */
    Path resolve(Path explicitDirectory, SnapshotConfig.Settings settings);
}
