package io.github.reugn.snapshot4j.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Type-keyed table of custom renderers.
 *
 * <p>Entries are keyed by exact class; there is no lookup through superclasses or interfaces.
 * Registering a type that already has an entry replaces it.
 *
 * <p><b>Concurrency:</b> the table is an immutable map behind a volatile reference. Lookups
 * read the reference and never block. Writers copy the map, change the copy and publish it
 * while holding a lock, so concurrent registrations are never lost and a lookup sees either
 * the old or the new table, never a partial one.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RendererRegistry registry = RendererRegistry.withDefaults();
 * registry.register(Money.class, (money, ctx) -> CodeBlock.of("$T.parse($S)", Money.class, money));
 * }</pre>
 */
public final class RendererRegistry {

    private static final Logger log = LoggerFactory.getLogger(RendererRegistry.class);

    private static final RendererRegistry SHARED = withDefaults();

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile Map<Class<?>, SnapshotRenderer<?>> entries = Map.of();

    /**
     * Creates an empty registry. Values without an entry still reach the built-in handlers.
     */
    public RendererRegistry() {
    }

    /**
     * Creates a registry holding the built-in renderers as ordinary, replaceable entries.
     *
     * @return a new registry
     */
    public static RendererRegistry withDefaults() {
        RendererRegistry registry = new RendererRegistry();
        BuiltinRenderers.installDefaults(registry);
        return registry;
    }

    /**
     * Returns the process-wide registry used by {@link io.github.reugn.snapshot4j.Snapshot4j}.
     *
     * @return the shared registry
     */
    public static RendererRegistry shared() {
        return SHARED;
    }

    /**
     * Registers a renderer for an exact type, replacing any existing entry.
     *
     * @param type     the key class
     * @param renderer the renderer
     * @param <T>      the rendered type
     */
    public <T> void register(Class<T> type, SnapshotRenderer<? super T> renderer) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(renderer, "renderer");
        SnapshotRenderer<?> previous;
        writeLock.lock();
        try {
            Map<Class<?>, SnapshotRenderer<?>> copy = new HashMap<>(entries);
            previous = copy.put(type, renderer);
            entries = Map.copyOf(copy);
        } finally {
            writeLock.unlock();
        }
        if (previous != null) {
            log.debug("Replaced renderer for {}", type.getName());
        }
    }

    /**
     * Removes the entry for a type.
     *
     * @param type the key class
     * @return {@code true} if an entry was removed
     */
    public boolean unregister(Class<?> type) {
        Objects.requireNonNull(type, "type");
        writeLock.lock();
        try {
            if (!entries.containsKey(type)) {
                return false;
            }
            Map<Class<?>, SnapshotRenderer<?>> copy = new HashMap<>(entries);
            copy.remove(type);
            entries = Map.copyOf(copy);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Looks up the renderer registered for an exact type.
     *
     * @param type the key class
     * @return the renderer, or empty when none is registered
     */
    public Optional<SnapshotRenderer<?>> lookup(Class<?> type) {
        return Optional.ofNullable(entries.get(type));
    }

    /**
     * Returns the current table. A render captures it once and uses it throughout, so
     * registrations made while the render runs do not affect it.
     *
     * @return an immutable map of exact type to renderer
     */
    public Map<Class<?>, SnapshotRenderer<?>> snapshot() {
        return entries;
    }
}
