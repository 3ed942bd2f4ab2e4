package dev.fumaz.conduit.bind;

import dev.fumaz.conduit.exception.ConfigurationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/**
 * Maps keys to bindings.
 * <p>
 * A key holds either one single binding or an ordered list of multi-binding contributions, never both.
 * Registering a second single binding for a key replaces the first and logs a warning. Lookups never
 * block and may run concurrently with each other; registration is serialized.
 */
public final class BindingRegistry {

    private static final Logger LOGGER = Logger.getLogger(BindingRegistry.class.getName());

    private final Map<Key<?>, Binding<?>> singles = new ConcurrentHashMap<>();
    private final Map<Key<?>, CopyOnWriteArrayList<Binding<?>>> multis = new ConcurrentHashMap<>();
    private final List<Binding<?>> insertionOrder = new CopyOnWriteArrayList<>();

    public synchronized void bind(@NotNull Binding<?> binding) {
        Objects.requireNonNull(binding, "binding");
        Key<?> key = binding.getKey();

        if (binding.isMulti()) {
            throw new ConfigurationException("Multi-binding contribution for " + key.describe()
                    + " must be registered with bindMulti");
        }

        if (multis.containsKey(key)) {
            throw new ConfigurationException("Cannot bind " + key.describe()
                    + " as a single binding: it already has multi-binding contributions");
        }

        Binding<?> previous = singles.put(key, binding);

        if (previous != null) {
            insertionOrder.remove(previous);
            LOGGER.warning(() -> "Ambiguous binding for " + key.describe() + ": " + previous
                    + " is replaced by " + binding + " (last registration wins)");
        }

        insertionOrder.add(binding);
    }

    public synchronized void bindMulti(@NotNull Binding<?> binding) {
        Objects.requireNonNull(binding, "binding");
        Key<?> key = binding.getKey();

        if (!binding.isMulti()) {
            throw new ConfigurationException("Single binding for " + key.describe()
                    + " must be registered with bind");
        }

        if (singles.containsKey(key)) {
            throw new ConfigurationException("Cannot add a multi-binding contribution to " + key.describe()
                    + ": it already has a single binding");
        }

        multis.computeIfAbsent(key, ignored -> new CopyOnWriteArrayList<>()).add(binding);
        insertionOrder.add(binding);
    }

    /**
     * Merges every binding of {@code other} into this registry, in the order they were registered there.
     */
    public synchronized void install(@NotNull BindingRegistry other) {
        Objects.requireNonNull(other, "other");

        if (other == this) {
            throw new IllegalArgumentException("A registry cannot install itself");
        }

        for (Binding<?> binding : other.all()) {
            if (binding.isMulti()) {
                bindMulti(binding);
            } else {
                bind(binding);
            }
        }
    }

    @SuppressWarnings("unchecked")
    public <T> @Nullable Binding<T> lookup(@NotNull Key<T> key) {
        return (Binding<T>) singles.get(key);
    }

    @SuppressWarnings("unchecked")
    public <T> @NotNull List<Binding<T>> lookupMulti(@NotNull Key<T> key) {
        List<Binding<?>> contributions = multis.get(key);

        if (contributions == null) {
            return Collections.emptyList();
        }

        return Collections.unmodifiableList((List<Binding<T>>) (List<?>) contributions);
    }

    public boolean isMultiBound(@NotNull Key<?> key) {
        return multis.containsKey(key);
    }

    public boolean contains(@NotNull Key<?> key) {
        return singles.containsKey(key) || multis.containsKey(key);
    }

    /**
     * Returns the qualifiers of the single bindings registered for {@code type}, in registration order.
     * The unqualified binding, if any, is not included.
     */
    public @NotNull List<BindingQualifier> qualifiersOf(@NotNull Class<?> type) {
        List<BindingQualifier> qualifiers = new ArrayList<>();

        for (Binding<?> binding : insertionOrder) {
            Key<?> key = binding.getKey();

            if (!binding.isMulti() && key.getType() == type && key.isQualified()) {
                qualifiers.add(key.getQualifier());
            }
        }

        return qualifiers;
    }

    /**
     * Returns every effective binding in registration order. Replaced single bindings are not included.
     */
    public @NotNull List<Binding<?>> all() {
        return new ArrayList<>(insertionOrder);
    }

    public boolean isEmpty() {
        return insertionOrder.isEmpty();
    }

    public synchronized void clear() {
        singles.clear();
        multis.clear();
        insertionOrder.clear();
    }
}
