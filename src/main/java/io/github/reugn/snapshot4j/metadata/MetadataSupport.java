package io.github.reugn.snapshot4j.metadata;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import io.github.reugn.snapshot4j.render.Expressions;
import io.github.reugn.snapshot4j.render.Literals;
import io.github.reugn.snapshot4j.render.PathSegment;
import io.github.reugn.snapshot4j.render.RenderContext;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Runtime helpers called by generated {@link TypeMetadata} classes.
 *
 * <p>A generated {@code render} method builds one argument per constructor parameter and
 * hands them to {@link #construct(Class, List)}:
 * <pre>{@code
 * List<CodeBlock> args = new ArrayList<>();
 * args.add(MetadataSupport.member(ctx, PROPERTIES.get(0), instance.name()));
 * args.add(MetadataSupport.ignored("0"));
 * return MetadataSupport.construct(User.class, args);
 * }</pre>
 */
public final class MetadataSupport {

    /**
     * Suffix of generated metadata class names.
     */
    public static final String CLASS_SUFFIX = "SnapshotMetadata";

    private static final int HASH_HEX_LENGTH = 16;

    private MetadataSupport() {
    }

    /**
     * Returns the binary name of the metadata class generated for a type.
     *
     * <p>Nested type names are flattened with underscores: metadata for {@code a.Outer.Inner}
     * lives in {@code a.Outer_InnerSnapshotMetadata}.
     *
     * @param type the described type
     * @return the fully qualified metadata class name
     */
    public static String metadataClassName(Class<?> type) {
        String packageName = type.getPackageName();
        String binarySimpleName = packageName.isEmpty()
                ? type.getName()
                : type.getName().substring(packageName.length() + 1);
        String simpleName = binarySimpleName.replace('$', '_') + CLASS_SUFFIX;
        return packageName.isEmpty() ? simpleName : packageName + "." + simpleName;
    }

    /**
     * Renders one member as a labelled constructor argument, applying its redaction.
     *
     * @param ctx      the context of the owning instance
     * @param property the member descriptor
     * @param value    the member value
     * @return {@code /* label= *}{@code / expression}
     */
    public static CodeBlock member(RenderContext ctx, PropertyDescriptor property, Object value) {
        String label = property.label();
        Redaction redaction = property.redaction();
        CodeBlock expression;
        if (redaction instanceof Redaction.Mask mask) {
            expression = CodeBlock.of("$L", Literals.stringLiteral(mask.text()));
        } else if (redaction instanceof Redaction.Hash) {
            String rendered = ctx.renderChild(PathSegment.field(label), value).toString();
            expression = CodeBlock.of("$L", Literals.stringLiteral(hashPlaceholder(rendered)));
        } else {
            expression = ctx.renderChild(PathSegment.field(label), value);
        }
        return Expressions.labelled(label, expression);
    }

    /**
     * Returns the argument written for an ignored member.
     *
     * @param defaultLiteral the default value literal of the member type, such as {@code null} or {@code 0L}
     * @return the unlabelled argument
     */
    public static CodeBlock ignored(String defaultLiteral) {
        return CodeBlock.of("$L", defaultLiteral);
    }

    /**
     * Builds the constructor call for a described type.
     *
     * @param type      the described type
     * @param arguments one argument per constructor parameter
     * @return {@code new Type(arguments)}
     */
    public static CodeBlock construct(Class<?> type, List<CodeBlock> arguments) {
        return Expressions.construct(ClassName.get(type), arguments);
    }

    /**
     * Computes the placeholder that replaces a hashed member.
     *
     * @param renderedValue the rendered expression of the real value
     * @return {@code <sha256:} followed by the first 16 hex digits of the digest and {@code >}
     */
    public static String hashPlaceholder(String renderedValue) {
        byte[] digest = sha256().digest(renderedValue.getBytes(StandardCharsets.UTF_8));
        return "<sha256:" + HexFormat.of().formatHex(digest).substring(0, HASH_HEX_LENGTH) + ">";
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every Java platform is required to support SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
