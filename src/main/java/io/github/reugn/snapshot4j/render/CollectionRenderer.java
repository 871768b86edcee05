package io.github.reugn.snapshot4j.render;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.TypeName;
import io.github.reugn.snapshot4j.error.UnsupportedTypeException;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Renders arrays, collections and maps by rendering each element as a child node.
 *
 * <ul>
 *   <li>arrays: {@code new T[] {…}}</li>
 *   <li>lists: {@code List.of(…)}, or {@code Arrays.asList(…)} when an element is null</li>
 *   <li>sets: {@code new LinkedHashSet<>(List.of(…))}, {@code new TreeSet<>(…)} for sorted sets</li>
 *   <li>other collections: {@code new RuntimeType<>(List.of(…))} through a public
 *       {@code Collection} constructor</li>
 *   <li>maps: {@code Map.ofEntries(Map.entry(k, v), …)}, wrapped in {@code new TreeMap<>(…)}
 *       for sorted maps</li>
 * </ul>
 */
final class CollectionRenderer {

    private static final Comparator<Entry> BY_TEXT = Comparator.comparing(Entry::sortKey);

    static boolean handles(Class<?> type) {
        return type.isArray() || Collection.class.isAssignableFrom(type) || Map.class.isAssignableFrom(type);
    }

    CodeBlock render(Object value, RenderContext ctx) {
        if (value.getClass().isArray()) {
            return renderArray(value, ctx);
        }
        if (value instanceof Map<?, ?> map) {
            return renderMap(map, ctx);
        }
        return renderCollection((Collection<?>) value, ctx);
    }

    // ==================== ARRAYS ====================

    private CodeBlock renderArray(Object array, RenderContext ctx) {
        int length = Array.getLength(array);
        List<CodeBlock> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(ctx.renderChild(PathSegment.index(i), Array.get(array, i)));
        }
        return Expressions.array(TypeName.get(array.getClass()), elements);
    }

    // ==================== COLLECTIONS ====================

    private CodeBlock renderCollection(Collection<?> collection, RenderContext ctx) {
        List<CodeBlock> elements = new ArrayList<>(collection.size());
        boolean hasNull = false;
        int index = 0;
        for (Object element : collection) {
            hasNull |= element == null;
            elements.add(ctx.renderChild(PathSegment.index(index++), element));
        }

        if (collection instanceof List<?>) {
            return sequence(elements, hasNull);
        }
        if (collection instanceof Set<?>) {
            if (ctx.options().deterministicSetOrder()) {
                elements.sort(Comparator.comparing(CodeBlock::toString));
            }
            Class<?> setType = collection instanceof SortedSet<?> ? TreeSet.class : LinkedHashSet.class;
            return wrap(ClassName.get(setType), elements, hasNull);
        }

        Class<?> type = collection.getClass();
        if (!hasCollectionConstructor(type)) {
            throw new UnsupportedTypeException(type.getName(),
                    "no public constructor taking a Collection", ctx.path());
        }
        return wrap(ClassName.get(type), elements, hasNull);
    }

    private static CodeBlock sequence(List<CodeBlock> elements, boolean hasNull) {
        CodeBlock callee = hasNull
                ? CodeBlock.of("$T.asList", Arrays.class)
                : CodeBlock.of("$T.of", List.class);
        return Expressions.call(callee, elements);
    }

    private static CodeBlock wrap(ClassName type, List<CodeBlock> elements, boolean hasNull) {
        if (elements.isEmpty()) {
            return CodeBlock.of("new $T<>()", type);
        }
        return CodeBlock.of("new $T<>($L)", type, sequence(elements, hasNull));
    }

    private static boolean hasCollectionConstructor(Class<?> type) {
        if (!Modifier.isPublic(type.getModifiers())) {
            return false;
        }
        try {
            Constructor<?> constructor = type.getConstructor(Collection.class);
            return Modifier.isPublic(constructor.getModifiers());
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    // ==================== MAPS ====================

    private CodeBlock renderMap(Map<?, ?> map, RenderContext ctx) {
        List<Entry> entries = new ArrayList<>(map.size());
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getKey() == null) {
                throw new UnsupportedTypeException(map.getClass().getName(),
                        "null map keys cannot be rendered", ctx.path());
            }
            CodeBlock key = ctx.renderInPlace(entry.getKey());
            String keyText = key.toString();
            PathSegment segment = PathSegment.key(keyText);
            if (entry.getValue() == null) {
                throw new UnsupportedTypeException(map.getClass().getName(),
                        "null map values cannot be rendered", ctx.child(segment, null).path());
            }
            CodeBlock value = ctx.renderChild(segment, entry.getValue());
            entries.add(new Entry(keyText, CodeBlock.of("$T.entry($L, $L)", Map.class, key, value)));
        }
        if (ctx.options().sortMapKeys()) {
            entries.sort(BY_TEXT);
        }

        boolean sorted = map instanceof SortedMap<?, ?>;
        if (entries.isEmpty()) {
            return sorted ? CodeBlock.of("new $T<>()", TreeMap.class) : CodeBlock.of("$T.of()", Map.class);
        }
        List<CodeBlock> rendered = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            rendered.add(entry.expression());
        }
        CodeBlock ofEntries = Expressions.call(CodeBlock.of("$T.ofEntries", Map.class), rendered);
        return sorted ? CodeBlock.of("new $T<>($L)", TreeMap.class, ofEntries) : ofEntries;
    }

    private record Entry(String sortKey, CodeBlock expression) {
    }
}
