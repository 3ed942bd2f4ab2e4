package dev.fumaz.conduit.bind;

import dev.fumaz.conduit.provider.InstanceProvider;
import dev.fumaz.conduit.provider.Provider;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A {@link Binding} is a link between a {@link Key} and a {@link Provider}, applied in a {@link BindingScope}.
 * <p>
 * Bindings use identity equality: two multi-binding contributions with the same provider are still
 * two contributions.
 *
 * @param <T> the type of the class
 */
public class Binding<T> {

    private final @NotNull Key<T> key;
    private final @NotNull Provider<? extends T> provider;
    private final @NotNull BindingScope scope;
    private final boolean multi;

    public Binding(@NotNull Key<T> key, @NotNull Provider<? extends T> provider) {
        this(key, provider, BindingScope.TRANSIENT, false);
    }

    public Binding(@NotNull Key<T> key,
                   @NotNull Provider<? extends T> provider,
                   @NotNull BindingScope scope,
                   boolean multi) {
        this.key = Objects.requireNonNull(key, "key");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.multi = multi;
    }

    public @NotNull Key<T> getKey() {
        return key;
    }

    public @NotNull Provider<? extends T> getProvider() {
        return provider;
    }

    public @NotNull BindingScope getScope() {
        return scope;
    }

    public boolean isMulti() {
        return multi;
    }

    /**
     * Whether resolved instances go through a singleton cache. Pre-built instances never do.
     */
    public boolean isCached() {
        return scope.isCached() && !(provider instanceof InstanceProvider);
    }

    @Override
    public String toString() {
        return (multi ? "MultiBinding{" : "Binding{") + key + " -> " + provider + ", " + scope + "}";
    }
}
