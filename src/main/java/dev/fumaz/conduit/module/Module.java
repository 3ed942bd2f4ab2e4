package dev.fumaz.conduit.module;

import dev.fumaz.conduit.bind.BindingRegistry;
import org.jetbrains.annotations.NotNull;

/**
 * A {@link Module} is a collection of bindings.
 * <p>
 * An injector calls {@link #reset()} and then {@link #configure()} before reading
 * {@link #getRegistry()}, so the same module can configure several injectors.
 */
public interface Module {

    void configure();

    void reset();

    @NotNull BindingRegistry getRegistry();

}
