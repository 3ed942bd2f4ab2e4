package dev.fumaz.conduit.util;

import dev.fumaz.conduit.annotation.Inject;
import dev.fumaz.conduit.bind.BindingQualifier;
import dev.fumaz.conduit.bind.Dependency;
import dev.fumaz.conduit.bind.Key;
import dev.fumaz.conduit.reflection.ReflectionException;
import dev.fumaz.conduit.reflection.Reflections;
import org.jetbrains.annotations.NotNull;

import java.lang.annotation.Annotation;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Set;

public final class InjectionUtils {

    private InjectionUtils() {
    }

    public static boolean isOptional(Annotation[] annotations) {
        if (annotations == null) {
            return false;
        }

        for (Annotation annotation : annotations) {
            if (annotation instanceof Inject) {
                return ((Inject) annotation).optional();
            }
        }

        return false;
    }

    /**
     * Describes an injection point as a dependency. The qualifier comes from the annotations, a
     * {@code List<X>} type collects every contribution for {@code X}, a {@code Set<X>} type collects
     * them without duplicates and {@code @Inject(optional = true)} marks the point optional.
     *
     * @param point names the injection point in error messages
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static @NotNull Dependency<?> dependencyOf(@NotNull Class<?> rawType,
                                                      @NotNull Type genericType,
                                                      Annotation[] annotations,
                                                      @NotNull String point) {
        BindingQualifier qualifier = BindingQualifier.fromAnnotations(annotations);
        boolean optional = isOptional(annotations);

        if (optional && rawType.isPrimitive()) {
            throw new ReflectionException("Optional " + point + " cannot target primitive type " + rawType.getName());
        }

        if (rawType == List.class || rawType == Set.class) {
            Class<?> elementType = Reflections.elementType(genericType);

            if (elementType == null) {
                throw new ReflectionException("Cannot determine the element type of " + point);
            }

            Key<?> elementKey = Key.of((Class) elementType, qualifier);
            return rawType == Set.class ? Dependency.set(elementKey) : Dependency.collection(elementKey);
        }

        Key<?> key = Key.of((Class) rawType, qualifier);
        return optional ? Dependency.optional(key) : Dependency.required(key);
    }
}
