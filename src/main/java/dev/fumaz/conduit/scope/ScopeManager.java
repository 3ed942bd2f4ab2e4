package dev.fumaz.conduit.scope;

import dev.fumaz.conduit.bind.BindingScope;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Applies a {@link BindingScope} to an instance computation. Each injector owns one manager and
 * with it the cache of its injector singletons.
 */
public final class ScopeManager {

    private final @NotNull InstanceCache injectorCache = new InstanceCache();

    /**
     * Returns what {@code compute} returns, cached according to {@code scope}. A {@code null} result
     * is never cached.
     */
    public <T> T get(@NotNull Object slotKey, @NotNull BindingScope scope, @NotNull Supplier<T> compute) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(compute, "compute");

        switch (scope) {
            case TRANSIENT:
                return compute.get();
            case INJECTOR_SINGLETON:
                return injectorCache.getOrCompute(slotKey, compute);
            case GLOBAL_SINGLETON:
                return GlobalSingletons.cache().getOrCompute(slotKey, compute);
            default:
                throw new IllegalArgumentException("Unknown scope " + scope);
        }
    }

    /**
     * Returns the cached instance for the slot, or {@code null} if none was built yet or the scope
     * does not cache.
     */
    public @Nullable Object peek(@NotNull Object slotKey, @NotNull BindingScope scope) {
        switch (scope) {
            case INJECTOR_SINGLETON:
                return injectorCache.peek(slotKey);
            case GLOBAL_SINGLETON:
                return GlobalSingletons.cache().peek(slotKey);
            default:
                return null;
        }
    }

    public int getInjectorSingletonCount() {
        return injectorCache.size();
    }
}
