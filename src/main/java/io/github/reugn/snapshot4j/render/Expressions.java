package io.github.reugn.snapshot4j.render;

import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.TypeName;

import java.util.List;

/**
 * Layout helpers shared by the built-in, collection, reflection and metadata renderers.
 *
 * <p>A call or initializer with zero or one element stays on one line. With more elements,
 * each goes on its own line and the closing bracket gets a line of its own:
 * <pre>{@code
 * List.of(
 *     "a",
 *     "b"
 * )
 * }</pre>
 */
public final class Expressions {

    private Expressions() {
    }

    /**
     * Appends an argument list to a callee expression.
     *
     * @param callee    the text before the opening parenthesis, such as {@code List.of}
     * @param arguments the rendered arguments
     * @return {@code callee(arguments)}
     */
    public static CodeBlock call(CodeBlock callee, List<CodeBlock> arguments) {
        return enclose(callee, "(", arguments, ")");
    }

    /**
     * Builds a constructor call.
     *
     * @param type      the instantiated type
     * @param arguments the rendered arguments
     * @return {@code new Type(arguments)}
     */
    public static CodeBlock construct(TypeName type, List<CodeBlock> arguments) {
        return call(CodeBlock.of("new $T", type), arguments);
    }

    /**
     * Builds an array creation expression with an initializer.
     *
     * @param arrayType the array type, for example {@code String[]}
     * @param elements  the rendered elements
     * @return {@code new String[] {elements}}
     */
    public static CodeBlock array(TypeName arrayType, List<CodeBlock> elements) {
        return enclose(CodeBlock.of("new $T ", arrayType), "{", elements, "}");
    }

    /**
     * Prefixes an argument with a parameter comment naming it.
     *
     * @param label the member label
     * @param value the rendered argument
     * @return {@code /* label= *}{@code / value}
     */
    public static CodeBlock labelled(String label, CodeBlock value) {
        return CodeBlock.of("/* $L= */ $L", label.replace("*/", "* /"), value);
    }

    private static CodeBlock enclose(CodeBlock head, String open, List<CodeBlock> elements, String close) {
        CodeBlock.Builder builder = CodeBlock.builder().add(head).add(open);
        if (elements.size() <= 1) {
            if (!elements.isEmpty()) {
                builder.add(elements.get(0));
            }
            return builder.add(close).build();
        }
        builder.add("\n").indent();
        for (int i = 0; i < elements.size(); i++) {
            builder.add(elements.get(i));
            if (i < elements.size() - 1) {
                builder.add(",");
            }
            builder.add("\n");
        }
        return builder.unindent().add(close).build();
    }
}
