package io.github.reugn.snapshot4j.render;

import com.squareup.javapoet.CodeBlock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RendererRegistry")
class RendererRegistryTest {

    @Test
    @DisplayName("A new registry is empty")
    void emptyRegistry() {
        RendererRegistry registry = new RendererRegistry();
        assertThat(registry.snapshot()).isEmpty();
        assertThat(registry.lookup(String.class)).isEmpty();
    }

    @Test
    @DisplayName("withDefaults installs the built-in renderers as ordinary entries")
    void defaults() {
        RendererRegistry registry = RendererRegistry.withDefaults();
        assertThat(registry.lookup(String.class)).isPresent();
        assertThat(registry.lookup(byte[].class)).isPresent();
        assertThat(registry.unregister(String.class)).isTrue();
        assertThat(registry.lookup(String.class)).isEmpty();
    }

    @Test
    @DisplayName("Registering again replaces the entry")
    void replace() {
        RendererRegistry registry = new RendererRegistry();
        SnapshotRenderer<String> first = (s, ctx) -> CodeBlock.of("first");
        SnapshotRenderer<String> second = (s, ctx) -> CodeBlock.of("second");
        registry.register(String.class, first);
        registry.register(String.class, second);
        assertThat(registry.lookup(String.class)).containsSame(second);
    }

    @Test
    @DisplayName("unregister reports whether an entry existed")
    void unregister() {
        RendererRegistry registry = new RendererRegistry();
        assertThat(registry.unregister(Integer.class)).isFalse();
        registry.register(Integer.class, (i, ctx) -> CodeBlock.of("$L", i));
        assertThat(registry.unregister(Integer.class)).isTrue();
    }

    @Test
    @DisplayName("Lookups use the exact class, not supertypes")
    void exactClass() {
        RendererRegistry registry = new RendererRegistry();
        registry.register(Number.class, (n, ctx) -> CodeBlock.of("number"));
        assertThat(registry.lookup(Integer.class)).isEmpty();
    }

    @Test
    @DisplayName("A snapshot is not affected by later registrations")
    void snapshotIsStable() {
        RendererRegistry registry = new RendererRegistry();
        Map<Class<?>, SnapshotRenderer<?>> before = registry.snapshot();
        registry.register(Long.class, (l, ctx) -> CodeBlock.of("$LL", l));
        assertThat(before).isEmpty();
        assertThat(registry.snapshot()).containsKey(Long.class);
    }

    @Test
    @DisplayName("Concurrent registrations are never lost")
    void concurrentRegistrations() throws InterruptedException {
        RendererRegistry registry = new RendererRegistry();
        List<Class<?>> types = List.of(String.class, Integer.class, Long.class, Short.class, Byte.class,
                Double.class, Float.class, Boolean.class, Character.class, Object.class);
        CountDownLatch start = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();
        for (Class<?> type : types) {
            Thread thread = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                registry.register(type, (v, ctx) -> CodeBlock.of("x"));
            });
            thread.start();
            threads.add(thread);
        }
        start.countDown();
        for (Thread thread : threads) {
            thread.join();
        }
        assertThat(registry.snapshot()).hasSize(types.size());
    }
}
