package dev.fumaz.conduit.bind;

import org.jetbrains.annotations.NotNull;

import java.lang.annotation.Annotation;
import java.util.Objects;

/**
 * Identifies a binding: a contract type plus an optional {@link BindingQualifier}.
 * <p>
 * An unqualified key never matches a qualified binding and vice versa.
 *
 * @param <T> the contract type
 */
public final class Key<T> {

    private final @NotNull Class<T> type;
    private final @NotNull BindingQualifier qualifier;
    private final int hash;

    private Key(@NotNull Class<T> type, @NotNull BindingQualifier qualifier) {
        this.type = Objects.requireNonNull(type, "type");
        this.qualifier = Objects.requireNonNull(qualifier, "qualifier");
        this.hash = 31 * type.hashCode() + qualifier.hashCode();
    }

    public static <T> @NotNull Key<T> of(@NotNull Class<T> type) {
        return new Key<>(type, BindingQualifier.none());
    }

    public static <T> @NotNull Key<T> of(@NotNull Class<T> type, @NotNull BindingQualifier qualifier) {
        return new Key<>(type, qualifier);
    }

    public static <T> @NotNull Key<T> of(@NotNull Class<T> type, @NotNull Annotation qualifier) {
        return new Key<>(type, BindingQualifier.from(qualifier));
    }

    public static <T> @NotNull Key<T> of(@NotNull Class<T> type, @NotNull Class<? extends Annotation> qualifierType) {
        return new Key<>(type, BindingQualifier.of(qualifierType));
    }

    public static <T> @NotNull Key<T> named(@NotNull Class<T> type, @NotNull String name) {
        return new Key<>(type, BindingQualifier.named(name));
    }

    public @NotNull Class<T> getType() {
        return type;
    }

    public @NotNull BindingQualifier getQualifier() {
        return qualifier;
    }

    public boolean isQualified() {
        return !qualifier.isDefault();
    }

    public String describe() {
        return type.getName() + (qualifier.isDefault() ? "" : " " + qualifier);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof Key)) {
            return false;
        }

        Key<?> that = (Key<?>) o;
        return type == that.type && qualifier.equals(that.qualifier);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return type.getSimpleName() + (qualifier.isDefault() ? "" : " " + qualifier);
    }
}
