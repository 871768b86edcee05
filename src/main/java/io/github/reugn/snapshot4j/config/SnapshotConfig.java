package io.github.reugn.snapshot4j.config;

import io.github.reugn.snapshot4j.format.FormatProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Mutable settings shared by snapshot renders and exports.
 *
 * <p>Holds the output root, the global header, the format profile and the render options.
 * Every getter and setter takes the lock for its own duration only. A render must call
 * {@link #snapshot()} once at entry and use the returned {@link Settings} throughout, so a
 * change made by another thread mid-render is never observed halfway.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SnapshotConfig config = SnapshotConfig.shared();
 * config.setRoot(Path.of("src/test/java"));
 * config.setHeader("Generated by snapshot4j. Do not edit.");
 * config.setRenderOptions(RenderOptions.builder().inlineBinaryThreshold(32).build());
 * }</pre>
 *
 * <p>Tests that change the shared instance should call {@link #resetToDefaults()} afterwards.
 */
public final class SnapshotConfig {

    private static final Logger log = LoggerFactory.getLogger(SnapshotConfig.class);

    private static final SnapshotConfig SHARED = new SnapshotConfig();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private Path root;
    private String header;
    private FormatProfile formatProfile = FormatProfile.defaults();
    private RenderOptions renderOptions = RenderOptions.defaults();

    /**
     * Creates a configuration holding the library defaults.
     */
    public SnapshotConfig() {
    }

    /**
     * Returns the process-wide configuration used by {@link io.github.reugn.snapshot4j.Snapshot4j}.
     *
     * @return the shared instance
     */
    public static SnapshotConfig shared() {
        return SHARED;
    }

    public static RenderOptions libraryDefaultRenderOptions() {
        return RenderOptions.defaults();
    }

    public static FormatProfile libraryDefaultFormatProfile() {
        return FormatProfile.defaults();
    }

    // ==================== ROOT ====================

    public Optional<Path> getRoot() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(root);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Sets the directory fixtures are written under, or clears it.
     *
     * @param root the output root, or {@code null} to fall back to the next source
     */
    public void setRoot(Path root) {
        lock.writeLock().lock();
        try {
            this.root = root;
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Snapshot root set to {}", root);
    }

    // ==================== HEADER ====================

    public Optional<String> getHeader() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(header);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Sets the header written at the top of every fixture file unless a call supplies its own.
     *
     * @param header header text, one comment line per line; {@code null} to clear
     */
    public void setHeader(String header) {
        lock.writeLock().lock();
        try {
            this.header = header;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ==================== FORMAT PROFILE ====================

    public FormatProfile getFormatProfile() {
        lock.readLock().lock();
        try {
            return formatProfile;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setFormatProfile(FormatProfile profile) {
        Objects.requireNonNull(profile, "profile");
        lock.writeLock().lock();
        try {
            this.formatProfile = profile;
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Format profile set to {}", profile);
    }

    // ==================== RENDER OPTIONS ====================

    public RenderOptions getRenderOptions() {
        lock.readLock().lock();
        try {
            return renderOptions;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setRenderOptions(RenderOptions options) {
        Objects.requireNonNull(options, "options");
        lock.writeLock().lock();
        try {
            this.renderOptions = options;
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Render options set to {}", options);
    }

    // ==================== LIFECYCLE ====================

    /**
     * Restores every setting to the library defaults.
     */
    public void resetToDefaults() {
        lock.writeLock().lock();
        try {
            root = null;
            header = null;
            formatProfile = FormatProfile.defaults();
            renderOptions = RenderOptions.defaults();
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Snapshot configuration reset to defaults");
    }

    /**
     * Reads all settings under one lock acquisition.
     *
     * @return a consistent, immutable view of the current settings
     */
    public Settings snapshot() {
        lock.readLock().lock();
        try {
            return new Settings(root, header, formatProfile, renderOptions);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Immutable copy of a {@link SnapshotConfig} taken by {@link #snapshot()}.
     *
     * @param root          output root, may be {@code null}
     * @param header        global header, may be {@code null}
     * @param formatProfile format profile
     * @param renderOptions render options
     */
    public record Settings(Path root, String header, FormatProfile formatProfile, RenderOptions renderOptions) {
    }
}
