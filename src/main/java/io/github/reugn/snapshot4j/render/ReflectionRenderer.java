package io.github.reugn.snapshot4j.render;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import io.github.reugn.snapshot4j.error.ReflectionFailureException;
import io.github.reugn.snapshot4j.error.UnsupportedTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Last-resort renderer that derives an expression from a value's structure.
 *
 * <p><b>Supported shapes:</b>
 * <ul>
 *   <li><b>Enums</b>: {@code Status.ACTIVE}, or {@code com.example.Status.ACTIVE} when enum
 *       shorthand is disabled</li>
 *   <li><b>Records</b>: the canonical constructor, {@code new Point(/* x= *}{@code / 1, /* y= *}{@code / 2)}</li>
 *   <li><b>Classes</b>: instance fields, superclass fields first, passed to a non-private
 *       constructor whose parameter types match the field types in the same order</li>
 * </ul>
 *
 * <p>Field order comes from {@link Class#getDeclaredFields()}, which the JVM does not promise
 * to keep stable. Records, registered renderers and generated metadata are the stable paths.
 */
final class ReflectionRenderer {

    private static final Logger log = LoggerFactory.getLogger(ReflectionRenderer.class);

    CodeBlock render(Object value, RenderContext ctx) {
        if (value instanceof Enum<?> constant) {
            return renderEnum(constant, ctx);
        }
        Class<?> type = value.getClass();
        checkInspectable(type, ctx);
        log.debug("Rendering {} through reflection at '{}'", type.getName(), PathSegment.format(ctx.path()));
        if (type.isRecord()) {
            return renderRecord(value, type, ctx);
        }
        return renderClass(value, type, ctx);
    }

    // ==================== ENUMS ====================

    private static CodeBlock renderEnum(Enum<?> constant, RenderContext ctx) {
        Class<?> declaring = constant.getDeclaringClass();
        String canonicalName = declaring.getCanonicalName();
        if (canonicalName == null) {
            throw new UnsupportedTypeException(declaring.getName(), "enum has no canonical name", ctx.path());
        }
        if (ctx.options().forceEnumShorthand()) {
            return CodeBlock.of("$T.$L", ClassName.get(declaring), constant.name());
        }
        return CodeBlock.of("$L.$L", canonicalName, constant.name());
    }

    // ==================== RECORDS ====================

    private static CodeBlock renderRecord(Object value, Class<?> type, RenderContext ctx) {
        RecordComponent[] components = type.getRecordComponents();
        List<CodeBlock> arguments = new ArrayList<>(components.length);
        for (RecordComponent component : components) {
            Object member = readComponent(value, component, ctx);
            String name = component.getName();
            arguments.add(Expressions.labelled(name, ctx.renderChild(PathSegment.field(name), member)));
        }
        return Expressions.construct(ClassName.get(type), arguments);
    }

    private static Object readComponent(Object value, RecordComponent component, RenderContext ctx) {
        Method accessor = component.getAccessor();
        try {
            accessor.setAccessible(true);
            return accessor.invoke(value);
        } catch (InaccessibleObjectException | SecurityException e) {
            throw new UnsupportedTypeException(value.getClass().getName(),
                    "record component '" + component.getName() + "' is not accessible", ctx.path());
        } catch (IllegalAccessException e) {
            throw new ReflectionFailureException("cannot read record component '" + component.getName() + "'",
                    ctx.path(), e);
        } catch (InvocationTargetException e) {
            throw new ReflectionFailureException("accessor of record component '" + component.getName()
                    + "' threw " + e.getCause(), ctx.path(), e.getCause());
        }
    }

    // ==================== CLASSES ====================

    private static CodeBlock renderClass(Object value, Class<?> type, RenderContext ctx) {
        List<Field> fields = instanceFields(type);
        Class<?>[] fieldTypes = fields.stream().map(Field::getType).toArray(Class<?>[]::new);
        if (findConstructor(type, fieldTypes) == null) {
            String signature = Arrays.stream(fieldTypes).map(Class::getSimpleName).collect(Collectors.joining(", "));
            throw new ReflectionFailureException("no constructor matching fields (" + signature + ") of "
                    + type.getName(), ctx.path());
        }

        boolean labelled = fields.stream().noneMatch(f -> f.getName().indexOf('$') >= 0);
        List<CodeBlock> arguments = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            Field field = fields.get(i);
            Object member = readField(value, field, ctx);
            if (labelled) {
                String name = field.getName();
                arguments.add(Expressions.labelled(name, ctx.renderChild(PathSegment.field(name), member)));
            } else {
                arguments.add(ctx.renderChild(PathSegment.index(i), member));
            }
        }
        return Expressions.construct(ClassName.get(type), arguments);
    }

    private static List<Field> instanceFields(Class<?> type) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.push(c);
        }
        List<Field> fields = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field field : c.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (!Modifier.isStatic(modifiers) && !Modifier.isTransient(modifiers) && !field.isSynthetic()) {
                    fields.add(field);
                }
            }
        }
        return fields;
    }

    private static Constructor<?> findConstructor(Class<?> type, Class<?>[] parameterTypes) {
        for (Constructor<?> constructor : type.getDeclaredConstructors()) {
            if (!Modifier.isPrivate(constructor.getModifiers())
                    && Arrays.equals(constructor.getParameterTypes(), parameterTypes)) {
                return constructor;
            }
        }
        return null;
    }

    private static Object readField(Object value, Field field, RenderContext ctx) {
        try {
            field.setAccessible(true);
            return field.get(value);
        } catch (InaccessibleObjectException | SecurityException e) {
            throw new UnsupportedTypeException(value.getClass().getName(),
                    "field '" + field.getName() + "' is not accessible", ctx.path());
        } catch (IllegalAccessException e) {
            throw new ReflectionFailureException("cannot read field '" + field.getName() + "'", ctx.path(), e);
        }
    }

    // ==================== INSPECTABILITY ====================

    private static void checkInspectable(Class<?> type, RenderContext ctx) {
        String detail = null;
        if (type.isHidden() || type.isSynthetic()) {
            detail = "lambdas and synthetic classes have no source form";
        } else if (type.isAnonymousClass() || type.isLocalClass()) {
            detail = "anonymous and local classes cannot be instantiated by name";
        } else if (type.isMemberClass() && !Modifier.isStatic(type.getModifiers())) {
            detail = "inner classes require an enclosing instance";
        } else if (type.getClassLoader() == null && !type.isRecord()) {
            detail = "JDK types are only rendered by built-in or registered renderers";
        }
        if (detail != null) {
            throw new UnsupportedTypeException(type.getName(), detail, ctx.path());
        }
    }
}
