package dev.fumaz.conduit.provider;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Builds an instance from resolved dependencies, index-aligned with the declared dependency list.
 *
 * @param <T> the type of the class
 */
@FunctionalInterface
public interface ConstructorFunction<T> {

    @Nullable T create(@NotNull Object[] arguments) throws Exception;

}
