package dev.fumaz.conduit.module;

import dev.fumaz.conduit.bind.BindingBuilder;
import dev.fumaz.conduit.bind.BindingRegistry;
import dev.fumaz.conduit.bind.Key;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Base class for modules that declare their bindings in {@link #configure()}:
 *
 * <pre>{@code
 * public class StorageModule extends ConduitModule {
 *     @Override
 *     public void configure() {
 *         bind(Storage.class).asSingleton().to(DiskStorage.class);
 *         bindMulti(Codec.class).toInstance(new JsonCodec());
 *     }
 * }
 * }</pre>
 */
public abstract class ConduitModule implements Module {

    private final BindingRegistry registry = new BindingRegistry();

    @Override
    public @NotNull BindingRegistry getRegistry() {
        return registry;
    }

    @Override
    public void reset() {
        registry.clear();
    }

    public <T> @NotNull BindingBuilder<T> bind(@NotNull Class<T> type) {
        return bind(Key.of(type));
    }

    public <T> @NotNull BindingBuilder<T> bind(@NotNull Key<T> key) {
        return new BindingBuilder<>(key, registry, false);
    }

    /**
     * Starts a multi-binding contribution. Every contribution for a key is kept and resolved, in
     * registration order, by {@code resolveAll} or a {@code List<T>} dependency.
     */
    public <T> @NotNull BindingBuilder<T> bindMulti(@NotNull Class<T> type) {
        return bindMulti(Key.of(type));
    }

    public <T> @NotNull BindingBuilder<T> bindMulti(@NotNull Key<T> key) {
        return new BindingBuilder<>(key, registry, true);
    }

    protected final void install(@NotNull Module module) {
        Objects.requireNonNull(module, "module");

        if (module == this) {
            throw new IllegalArgumentException("A module cannot install itself");
        }

        module.reset();
        module.configure();

        registry.install(module.getRegistry());
    }

}
