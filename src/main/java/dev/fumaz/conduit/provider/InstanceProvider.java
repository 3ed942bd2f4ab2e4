package dev.fumaz.conduit.provider;

import dev.fumaz.conduit.injector.Resolver;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * An {@link InstanceProvider} is a {@link Provider} that provides a specific, already built instance.
 * Scopes do not apply to it.
 *
 * @param <T> the type of the class
 */
public class InstanceProvider<T> implements Provider<T> {

    private final @NotNull T instance;

    public InstanceProvider(@NotNull T instance) {
        this.instance = Objects.requireNonNull(instance, "instance");
    }

    @Override
    public @NotNull T provide(@NotNull Resolver resolver, @NotNull Object[] arguments) {
        return instance;
    }

    public @NotNull T getInstance() {
        return instance;
    }

    @Override
    public String toString() {
        return "instance " + instance.getClass().getName();
    }
}
