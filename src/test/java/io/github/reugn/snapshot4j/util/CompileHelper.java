package io.github.reugn.snapshot4j.util;

import com.google.testing.compile.Compilation;
import io.github.reugn.snapshot4j.processor.SnapshotProcessor;

import javax.tools.JavaFileObject;

import static com.google.testing.compile.Compiler.javac;

/**
 * Shared compilation helper for processor tests.
 */
public final class CompileHelper {

    private CompileHelper() {
    }

    public static Compilation compile(JavaFileObject... sources) {
        return javac()
                .withProcessors(new SnapshotProcessor())
                .compile(sources);
    }
}
