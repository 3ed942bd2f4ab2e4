package dev.fumaz.conduit.injector;

import dev.fumaz.conduit.bind.Key;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves instances for keys.
 * <p>
 * The resolver handed to a {@link dev.fumaz.conduit.provider.FactoryProvider} belongs to the resolution
 * call that invoked the factory, so dependencies requested through it take part in the same cycle
 * detection and diagnostic chain.
 */
public interface Resolver {

    /**
     * @throws dev.fumaz.conduit.exception.UnboundDependencyException if the key has no binding
     * @throws dev.fumaz.conduit.exception.CyclicDependencyException  if the key depends on itself
     * @throws dev.fumaz.conduit.exception.ConstructionException       if a provider fails
     */
    <T> @NotNull T resolve(@NotNull Key<T> key);

    /**
     * Resolves the key, or returns an empty optional if the key itself is unbound. Failures further
     * down the graph still propagate.
     */
    <T> @NotNull Optional<T> resolveOptional(@NotNull Key<T> key);

    /**
     * Resolves every multi-binding contribution for the key, in registration order.
     */
    <T> @NotNull List<T> resolveAll(@NotNull Key<T> key);

    /**
     * Resolves the multi-binding contributions for the key without duplicates. Contributions bound to
     * the same implementation class or to equal instances count once, and equal resolved instances
     * collapse. Iteration follows the first occurrence in registration order.
     */
    <T> @NotNull Set<T> resolveSet(@NotNull Key<T> key);

    default <T> @NotNull T resolve(@NotNull Class<T> type) {
        return resolve(Key.of(type));
    }

    /**
     * Resolves the binding of {@code type} qualified with {@code @Named(name)}.
     */
    default <T> @NotNull T resolve(@NotNull Class<T> type, @NotNull String name) {
        return resolve(Key.named(type, name));
    }

    default <T> @NotNull Optional<T> resolveOptional(@NotNull Class<T> type) {
        return resolveOptional(Key.of(type));
    }

    default <T> @NotNull List<T> resolveAll(@NotNull Class<T> type) {
        return resolveAll(Key.of(type));
    }

    default <T> @NotNull Set<T> resolveSet(@NotNull Class<T> type) {
        return resolveSet(Key.of(type));
    }

}
