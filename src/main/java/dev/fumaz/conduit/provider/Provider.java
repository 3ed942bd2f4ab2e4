package dev.fumaz.conduit.provider;

import dev.fumaz.conduit.bind.Dependency;
import dev.fumaz.conduit.injector.Resolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * A {@link Provider} is a deferred factory for instances of a contract.
 * <p>
 * The resolver resolves {@link #getDependencies()} in declaration order and hands the results to
 * {@link #provide(Resolver, Object[])}. Providers are only invoked as often as the binding's scope allows.
 *
 * @param <T> the type of the class
 */
public interface Provider<T> {

    static <T> @NotNull Provider<T> instance(@NotNull T instance) {
        return new InstanceProvider<>(instance);
    }

    static <T> @NotNull Provider<T> factory(@NotNull FactoryProvider.Factory<? extends T> factory) {
        return new FactoryProvider<>(factory);
    }

    static <T> @NotNull Provider<T> constructor(@NotNull List<Dependency<?>> dependencies,
                                                @NotNull ConstructorFunction<? extends T> function) {
        return new ConstructorProvider<>(dependencies, function);
    }

    /**
     * Dependencies the resolver must satisfy before calling {@link #provide(Resolver, Object[])}.
     */
    default @NotNull List<Dependency<?>> getDependencies() {
        return Collections.emptyList();
    }

    /**
     * Builds the instance.
     *
     * @param resolver  the resolver of the active resolution call
     * @param arguments resolved dependencies, index-aligned with {@link #getDependencies()}
     */
    @Nullable T provide(@NotNull Resolver resolver, @NotNull Object[] arguments) throws Exception;

}
