package io.github.reugn.snapshot4j.util;

import com.google.testing.compile.Compilation;
import io.github.reugn.snapshot4j.config.RenderOptions;
import io.github.reugn.snapshot4j.processor.SnapshotProcessor;
import io.github.reugn.snapshot4j.render.RendererRegistry;
import io.github.reugn.snapshot4j.render.ValueRenderer;

import javax.tools.JavaFileObject;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.lang.reflect.Constructor;
import java.util.HashMap;
import java.util.Map;

import static com.google.testing.compile.Compiler.javac;

/**
 * Compiles fixture types with the processor, instantiates them and renders the instances.
 * Generated metadata is found through the same class-loader lookup the library uses.
 *
 * <p>Usage:
 * <pre>{@code
 * RuntimeTestHelper helper = RuntimeTestHelper.compile(source);
 * Object account = helper.newInstance("example.Account",
 *         new Class<?>[]{String.class, String.class}, "alice", "s3cret");
 * String expression = helper.render(account);
 * }</pre>
 */
public final class RuntimeTestHelper {

    private final ClassLoader classLoader;

    private RuntimeTestHelper(Map<String, byte[]> classFiles) {
        this.classLoader = new GeneratedClassLoader(classFiles);
    }

    /**
     * Compiles the given sources with the SnapshotProcessor.
     *
     * @param sources the source files to compile
     * @return a helper over the compiled classes
     * @throws AssertionError if compilation fails
     */
    public static RuntimeTestHelper compile(JavaFileObject... sources) {
        Compilation compilation = javac()
                .withProcessors(new SnapshotProcessor())
                .compile(sources);
        if (compilation.status() != Compilation.Status.SUCCESS) {
            throw new AssertionError("Compilation failed: " + compilation.diagnostics());
        }

        Map<String, byte[]> classFiles = new HashMap<>();
        for (JavaFileObject file : compilation.generatedFiles()) {
            if (file.getKind() == JavaFileObject.Kind.CLASS) {
                classFiles.put(binaryName(file), readAll(file));
            }
        }
        return new RuntimeTestHelper(classFiles);
    }

    /**
     * Instantiates a compiled fixture type.
     *
     * @param className  fully qualified class name
     * @param paramTypes constructor parameter types
     * @param args       constructor arguments
     * @return the new instance
     */
    public Object newInstance(String className, Class<?>[] paramTypes, Object... args) {
        try {
            Constructor<?> constructor = classLoader.loadClass(className).getDeclaredConstructor(paramTypes);
            constructor.setAccessible(true);
            return constructor.newInstance(args);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to create instance of " + className, e);
        }
    }

    /**
     * Renders a value with default options, a default registry and generated metadata.
     *
     * @param value the value
     * @return the expression text, types fully qualified
     */
    public String render(Object value) {
        return ValueRenderer.create(RendererRegistry.withDefaults())
                .render(value, RenderOptions.defaults())
                .toString();
    }

    // compile-testing class files live at mem:///CLASS_OUTPUT/<binary/name>.class
    private static String binaryName(JavaFileObject file) {
        String path = file.toUri().getPath();
        String marker = "CLASS_OUTPUT/";
        int start = path.indexOf(marker);
        String relative = start >= 0 ? path.substring(start + marker.length()) : path.substring(1);
        return relative.substring(0, relative.length() - ".class".length()).replace('/', '.');
    }

    private static byte[] readAll(JavaFileObject file) {
        try (InputStream in = file.openInputStream()) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file.toUri(), e);
        }
    }

    private static final class GeneratedClassLoader extends ClassLoader {

        private final Map<String, byte[]> classFiles;

        GeneratedClassLoader(Map<String, byte[]> classFiles) {
            super(RuntimeTestHelper.class.getClassLoader());
            this.classFiles = classFiles;
        }

        @Override
        protected Class<?> findClass(String name) throws ClassNotFoundException {
            byte[] bytes = classFiles.get(name);
            if (bytes == null) {
                throw new ClassNotFoundException(name);
            }
            return defineClass(name, bytes, 0, bytes.length);
        }
    }
}
