package dev.fumaz.conduit.provider;

import dev.fumaz.conduit.injector.Resolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A {@link FactoryProvider} hands the active {@link Resolver} to a user function, which may resolve
 * whatever it needs dynamically, including optional dependencies.
 *
 * @param <T> the type of the class
 */
public class FactoryProvider<T> implements Provider<T> {

    private final @NotNull Factory<? extends T> factory;

    public FactoryProvider(@NotNull Factory<? extends T> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    public @Nullable T provide(@NotNull Resolver resolver, @NotNull Object[] arguments) throws Exception {
        return factory.create(resolver);
    }

    @FunctionalInterface
    public interface Factory<T> {
        @Nullable T create(@NotNull Resolver resolver) throws Exception;
    }
}
