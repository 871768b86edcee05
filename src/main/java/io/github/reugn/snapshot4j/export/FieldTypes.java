package io.github.reugn.snapshot4j.export;

import com.squareup.javapoet.ArrayTypeName;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.WildcardTypeName;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Picks the declared type of a generated fixture field.
 *
 * <p>Collections are declared through their interface, since the rendered expression builds a
 * different implementation than the captured one. Generic types get wildcard arguments:
 * a list is declared as {@code List<?>}, a record {@code Pair<A, B>} as {@code Pair<?, ?>}.
 */
final class FieldTypes {

    private static final WildcardTypeName ANY = WildcardTypeName.subtypeOf(Object.class);

    private FieldTypes() {
    }

    static TypeName declaredType(Object value) {
        if (value == null) {
            return ClassName.OBJECT;
        }
        return declaredType(value instanceof Enum<?> e ? e.getDeclaringClass() : value.getClass());
    }

    private static TypeName declaredType(Class<?> type) {
        if (type.isArray()) {
            return ArrayTypeName.of(declaredComponent(type.getComponentType()));
        }
        if (Optional.class.isAssignableFrom(type)) {
            return generic(Optional.class);
        }
        if (SortedMap.class.isAssignableFrom(type)) {
            return generic(SortedMap.class);
        }
        if (Map.class.isAssignableFrom(type)) {
            return generic(Map.class);
        }
        if (List.class.isAssignableFrom(type)) {
            return generic(List.class);
        }
        if (SortedSet.class.isAssignableFrom(type)) {
            return generic(SortedSet.class);
        }
        if (Set.class.isAssignableFrom(type)) {
            return generic(Set.class);
        }
        return generic(type);
    }

    private static TypeName declaredComponent(Class<?> component) {
        if (component.isPrimitive()) {
            return TypeName.get(component);
        }
        // array creation needs a reifiable component type
        return component.isArray() ? ArrayTypeName.of(declaredComponent(component.getComponentType()))
                : ClassName.get(component);
    }

    private static TypeName generic(Class<?> type) {
        int arity = type.getTypeParameters().length;
        if (arity == 0) {
            return ClassName.get(type);
        }
        TypeName[] arguments = new TypeName[arity];
        Arrays.fill(arguments, ANY);
        return ParameterizedTypeName.get(ClassName.get(type), arguments);
    }

    /**
     * Returns the simple name used to build the default holder class name.
     *
     * @param declared the declared field type
     * @return the raw simple name, with {@code Array} appended for arrays
     */
    static String simpleName(TypeName declared) {
        if (declared instanceof ArrayTypeName array) {
            return simpleName(array.componentType) + "Array";
        }
        if (declared instanceof ParameterizedTypeName parameterized) {
            return parameterized.rawType.simpleName();
        }
        if (declared instanceof ClassName className) {
            return className.simpleName();
        }
        return capitalizePrimitive(declared.toString());
    }

    private static String capitalizePrimitive(String keyword) {
        return Character.toUpperCase(keyword.charAt(0)) + keyword.substring(1);
    }
}
