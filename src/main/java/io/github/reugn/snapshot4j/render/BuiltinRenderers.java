package io.github.reugn.snapshot4j.render;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.TypeName;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Base64;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * Renderers for scalar JDK types that have a canonical literal or factory form.
 *
 * <p><b>Renderings:</b>
 * <table border="1">
 *   <caption>Built-in renderings</caption>
 *   <tr><th>Type</th><th>Example output</th></tr>
 *   <tr><td>{@code String}</td><td>{@code "hello\n"}</td></tr>
 *   <tr><td>{@code Character}</td><td>{@code 'x'}</td></tr>
 *   <tr><td>{@code Integer}, {@code Long}</td><td>{@code 42}, {@code 42L}</td></tr>
 *   <tr><td>{@code Short}, {@code Byte}</td><td>{@code (short) 4}, {@code (byte) 0x04}</td></tr>
 *   <tr><td>{@code Double}, {@code Float}</td><td>{@code 1.5}, {@code 1.0E-5}, {@code 2.5F}</td></tr>
 *   <tr><td>{@code BigInteger}, {@code BigDecimal}</td><td>{@code new BigDecimal("19.99")}</td></tr>
 *   <tr><td>{@code Instant}</td><td>{@code Instant.ofEpochSecond(1700000000L, 500)}</td></tr>
 *   <tr><td>{@code Date}</td><td>{@code Date.from(Instant.ofEpochSecond(1700000000L))}</td></tr>
 *   <tr><td>{@code LocalDate}, {@code LocalTime}, {@code LocalDateTime}</td>
 *       <td>{@code LocalDate.of(2024, 1, 15)}</td></tr>
 *   <tr><td>{@code Duration}</td><td>{@code Duration.ofSeconds(90L)}</td></tr>
 *   <tr><td>{@code UUID}, {@code URI}</td><td>{@code UUID.fromString("…")}, {@code URI.create("…")}</td></tr>
 *   <tr><td>{@code byte[]}</td>
 *       <td>{@code new byte[] {0x01, (byte) 0xFF}} up to the inline threshold,
 *           {@code Base64.getDecoder().decode("…")} above it</td></tr>
 *   <tr><td>{@code Class}</td><td>{@code String.class}</td></tr>
 * </table>
 *
 * <p>{@link java.net.URL} is deliberately absent: its constructors throw a checked exception
 * and cannot appear in a field initializer. Use {@link URI} in fixture types instead.
 */
public final class BuiltinRenderers {

    private static final Map<Class<?>, SnapshotRenderer<?>> BUILTINS = createBuiltins();

    private BuiltinRenderers() {
    }

    /**
     * Registers every built-in renderer in a registry. The entries are ordinary and may be
     * replaced or removed afterwards.
     *
     * @param registry the registry to populate
     */
    public static void installDefaults(RendererRegistry registry) {
        for (Map.Entry<Class<?>, SnapshotRenderer<?>> entry : BUILTINS.entrySet()) {
            install(registry, entry.getKey(), entry.getValue());
        }
    }

    /**
     * Finds the built-in renderer for an exact type.
     *
     * @param type the runtime class
     * @return the renderer, or empty when the type has no built-in form
     */
    public static Optional<SnapshotRenderer<?>> forType(Class<?> type) {
        return Optional.ofNullable(BUILTINS.get(type));
    }

    @SuppressWarnings("unchecked")
    private static <T> void install(RendererRegistry registry, Class<T> type, SnapshotRenderer<?> renderer) {
        registry.register(type, (SnapshotRenderer<T>) renderer);
    }

    private static Map<Class<?>, SnapshotRenderer<?>> createBuiltins() {
        Map<Class<?>, SnapshotRenderer<?>> map = new LinkedHashMap<>();

        // text
        put(map, String.class, (s, ctx) -> CodeBlock.of("$L", Literals.stringLiteral(s)));
        put(map, Character.class, (c, ctx) -> CodeBlock.of("$L", Literals.charLiteral(c)));

        // numbers
        put(map, Integer.class, (i, ctx) -> CodeBlock.of("$L", Literals.intLiteral(i)));
        put(map, Long.class, (l, ctx) -> CodeBlock.of("$L", Literals.longLiteral(l)));
        put(map, Short.class, (s, ctx) -> CodeBlock.of("$L", Literals.shortLiteral(s)));
        put(map, Byte.class, (b, ctx) -> CodeBlock.of("$L", Literals.byteValueLiteral(b)));
        put(map, Double.class, (d, ctx) -> CodeBlock.of("$L", Literals.doubleLiteral(d)));
        put(map, Float.class, (f, ctx) -> CodeBlock.of("$L", Literals.floatLiteral(f)));
        put(map, Boolean.class, (b, ctx) -> CodeBlock.of("$L", b));
        put(map, BigInteger.class, (b, ctx) ->
                CodeBlock.of("new $T($L)", BigInteger.class, Literals.stringLiteral(b.toString())));
        put(map, BigDecimal.class, (b, ctx) ->
                CodeBlock.of("new $T($L)", BigDecimal.class, Literals.stringLiteral(b.toString())));

        // time
        put(map, Instant.class, (instant, ctx) -> instant(instant));
        put(map, Date.class, (date, ctx) -> CodeBlock.of("$T.from($L)", Date.class, instant(date.toInstant())));
        put(map, LocalDate.class, (date, ctx) -> CodeBlock.of("$T.of($L, $L, $L)", LocalDate.class,
                date.getYear(), date.getMonthValue(), date.getDayOfMonth()));
        put(map, LocalTime.class, (time, ctx) -> CodeBlock.of("$T.of($L)", LocalTime.class, timeArguments(time)));
        put(map, LocalDateTime.class, (dateTime, ctx) -> CodeBlock.of("$T.of($L, $L, $L, $L)",
                LocalDateTime.class, dateTime.getYear(), dateTime.getMonthValue(), dateTime.getDayOfMonth(),
                timeArguments(dateTime.toLocalTime())));
        put(map, Duration.class, (duration, ctx) -> duration.getNano() == 0
                ? CodeBlock.of("$T.ofSeconds($L)", Duration.class, Literals.longLiteral(duration.getSeconds()))
                : CodeBlock.of("$T.ofSeconds($L, $L)", Duration.class,
                Literals.longLiteral(duration.getSeconds()), duration.getNano()));

        // identifiers
        put(map, UUID.class, (uuid, ctx) ->
                CodeBlock.of("$T.fromString($L)", UUID.class, Literals.stringLiteral(uuid.toString())));
        put(map, URI.class, (uri, ctx) ->
                CodeBlock.of("$T.create($L)", URI.class, Literals.stringLiteral(uri.toString())));
        put(map, Class.class, (type, ctx) -> CodeBlock.of("$T.class", TypeName.get(type)));

        // binary
        put(map, byte[].class, BuiltinRenderers::bytes);

        return Map.copyOf(map);
    }

    private static <T> void put(Map<Class<?>, SnapshotRenderer<?>> map, Class<T> type, SnapshotRenderer<T> renderer) {
        map.put(type, renderer);
    }

    private static CodeBlock instant(Instant instant) {
        if (instant.getNano() == 0) {
            return CodeBlock.of("$T.ofEpochSecond($L)", Instant.class, Literals.longLiteral(instant.getEpochSecond()));
        }
        return CodeBlock.of("$T.ofEpochSecond($L, $L)", Instant.class,
                Literals.longLiteral(instant.getEpochSecond()), instant.getNano());
    }

    // Shortest LocalTime.of overload that keeps full precision.
    private static String timeArguments(LocalTime time) {
        StringJoiner args = new StringJoiner(", ");
        args.add(Integer.toString(time.getHour())).add(Integer.toString(time.getMinute()));
        if (time.getSecond() != 0 || time.getNano() != 0) {
            args.add(Integer.toString(time.getSecond()));
        }
        if (time.getNano() != 0) {
            args.add(Integer.toString(time.getNano()));
        }
        return args.toString();
    }

    private static CodeBlock bytes(byte[] bytes, RenderContext ctx) {
        if (bytes.length > ctx.options().inlineBinaryThreshold()) {
            return CodeBlock.of("$T.getDecoder().decode($L)", ClassName.get(Base64.class),
                    Literals.stringLiteral(Base64.getEncoder().encodeToString(bytes)));
        }
        StringJoiner elements = new StringJoiner(", ");
        for (byte b : bytes) {
            elements.add(Literals.byteLiteral(b));
        }
        return CodeBlock.of("new byte[] {$L}", elements.toString());
    }
}
