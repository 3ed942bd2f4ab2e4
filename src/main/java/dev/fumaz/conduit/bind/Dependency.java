package dev.fumaz.conduit.bind;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A requirement declared by a provider or an injectable member.
 * <p>
 * Optional dependencies resolve to {@code null} when their key is unbound. Collection dependencies
 * resolve to the ordered list of every multi-binding contribution for their key; set dependencies
 * resolve to the same contributions with duplicates removed.
 *
 * @param <T> the contract type
 */
public final class Dependency<T> {

    private final @NotNull Key<T> key;
    private final boolean optional;
    private final boolean collection;
    private final boolean set;

    private Dependency(@NotNull Key<T> key, boolean optional, boolean collection, boolean set) {
        this.key = Objects.requireNonNull(key, "key");
        this.optional = optional;
        this.collection = collection;
        this.set = set;
    }

    public static <T> @NotNull Dependency<T> required(@NotNull Key<T> key) {
        return new Dependency<>(key, false, false, false);
    }

    public static <T> @NotNull Dependency<T> required(@NotNull Class<T> type) {
        return required(Key.of(type));
    }

    public static <T> @NotNull Dependency<T> optional(@NotNull Key<T> key) {
        return new Dependency<>(key, true, false, false);
    }

    public static <T> @NotNull Dependency<T> optional(@NotNull Class<T> type) {
        return optional(Key.of(type));
    }

    public static <T> @NotNull Dependency<T> collection(@NotNull Key<T> key) {
        return new Dependency<>(key, false, true, false);
    }

    public static <T> @NotNull Dependency<T> collection(@NotNull Class<T> type) {
        return collection(Key.of(type));
    }

    public static <T> @NotNull Dependency<T> set(@NotNull Key<T> key) {
        return new Dependency<>(key, false, true, true);
    }

    public static <T> @NotNull Dependency<T> set(@NotNull Class<T> type) {
        return set(Key.of(type));
    }

    public @NotNull Key<T> getKey() {
        return key;
    }

    public boolean isOptional() {
        return optional;
    }

    /**
     * Whether this dependency collects multi-binding contributions, either as a list or as a set.
     */
    public boolean isCollection() {
        return collection;
    }

    public boolean isSet() {
        return set;
    }

    public String describe() {
        String prefix = set ? "set of " : collection ? "all of " : "";
        return (optional ? "optional " : "") + prefix + key.describe();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof Dependency)) {
            return false;
        }

        Dependency<?> that = (Dependency<?>) o;
        return optional == that.optional && collection == that.collection && set == that.set
                && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, optional, collection, set);
    }

    @Override
    public String toString() {
        return "{" + describe() + "}";
    }
}
