package dev.fumaz.conduit.bind;

import dev.fumaz.conduit.annotation.Named;
import dev.fumaz.conduit.annotation.Qualifier;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.annotation.Annotation;
import java.lang.reflect.Array;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Represents an identifying qualifier for a binding.
 * <p>
 * Two qualifiers are equal when they share the same annotation type and attribute values, so
 * {@code BindingQualifier.named("db")} and a {@code @Named("db")} annotation read from an injection
 * point are interchangeable.
 */
public final class BindingQualifier {

    private static final BindingQualifier NONE = new BindingQualifier(null, Collections.emptyMap(), "default");

    private final @Nullable Class<? extends Annotation> annotationType;
    private final @NotNull Map<String, Object> attributes;
    private final @NotNull String alias;

    private BindingQualifier(@Nullable Class<? extends Annotation> annotationType,
                             @NotNull Map<String, Object> attributes,
                             @NotNull String alias) {
        this.annotationType = annotationType;
        this.attributes = attributes;
        this.alias = alias;
    }

    public static @NotNull BindingQualifier none() {
        return NONE;
    }

    public static @NotNull BindingQualifier named(@NotNull String name) {
        Objects.requireNonNull(name, "name");

        return new BindingQualifier(Named.class, Collections.singletonMap("value", name),
                "@" + Named.class.getSimpleName() + "(\"" + name + "\")");
    }

    public static @NotNull BindingQualifier of(@NotNull Class<? extends Annotation> qualifierType) {
        requireQualifier(qualifierType);

        Map<String, Object> attributes = new LinkedHashMap<>();

        for (Method method : qualifierType.getDeclaredMethods()) {
            Object defaultValue = method.getDefaultValue();

            if (defaultValue == null) {
                throw new IllegalArgumentException("Qualifier " + qualifierType.getName() + " declares attribute "
                        + method.getName() + " without a default; qualify with an annotation instance instead");
            }

            attributes.put(method.getName(), normalizeValue(defaultValue));
        }

        return new BindingQualifier(qualifierType, Collections.unmodifiableMap(attributes),
                "@" + qualifierType.getSimpleName());
    }

    public static @NotNull BindingQualifier from(@NotNull Annotation annotation) {
        Class<? extends Annotation> annotationType = annotation.annotationType();
        requireQualifier(annotationType);

        Map<String, Object> attributes = new LinkedHashMap<>();

        for (Method method : annotationType.getDeclaredMethods()) {
            try {
                method.setAccessible(true);
                attributes.put(method.getName(), normalizeValue(method.invoke(annotation)));
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Unable to read qualifier attribute " + method.getName(), e);
            }
        }

        String alias = annotationType == Named.class
                ? "@" + Named.class.getSimpleName() + "(\"" + ((Named) annotation).value() + "\")"
                : annotation.toString();

        return new BindingQualifier(annotationType, Collections.unmodifiableMap(attributes), alias);
    }

    /**
     * Reads the qualifier declared among the given annotations, if any.
     *
     * @throws IllegalStateException if more than one qualifier annotation is present
     */
    public static @NotNull BindingQualifier fromAnnotations(@Nullable Annotation[] annotations) {
        if (annotations == null || annotations.length == 0) {
            return NONE;
        }

        BindingQualifier qualifier = NONE;

        for (Annotation annotation : annotations) {
            if (!annotation.annotationType().isAnnotationPresent(Qualifier.class)) {
                continue;
            }

            if (!qualifier.isDefault()) {
                throw new IllegalStateException("Multiple qualifier annotations found on injection point: "
                        + qualifier + " and " + annotation);
            }

            qualifier = from(annotation);
        }

        return qualifier;
    }

    public @Nullable Class<? extends Annotation> getAnnotationType() {
        return annotationType;
    }

    public @NotNull Map<String, Object> getAttributes() {
        return attributes;
    }

    public @NotNull String getAlias() {
        return alias;
    }

    public boolean isDefault() {
        return annotationType == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof BindingQualifier)) {
            return false;
        }

        BindingQualifier that = (BindingQualifier) o;
        return Objects.equals(annotationType, that.annotationType)
                && Objects.equals(attributes, that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(annotationType, attributes);
    }

    @Override
    public String toString() {
        return alias;
    }

    private static void requireQualifier(@NotNull Class<? extends Annotation> annotationType) {
        Objects.requireNonNull(annotationType, "annotationType");

        if (!annotationType.isAnnotationPresent(Qualifier.class)) {
            throw new IllegalArgumentException("Annotation " + annotationType.getName() + " is not marked with @Qualifier");
        }
    }

    private static Object normalizeValue(Object value) {
        if (value == null) {
            return null;
        }

        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            Object[] normalized = new Object[length];

            for (int i = 0; i < length; i++) {
                normalized[i] = normalizeValue(Array.get(value, i));
            }

            return Arrays.asList(normalized);
        }

        if (value instanceof Annotation) {
            Annotation nested = (Annotation) value;

            if (nested.annotationType().isAnnotationPresent(Qualifier.class)) {
                return from(nested);
            }
        }

        return value;
    }
}
