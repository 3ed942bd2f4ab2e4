package dev.fumaz.conduit.injector;

import dev.fumaz.conduit.bind.Binding;
import dev.fumaz.conduit.bind.BindingRegistry;
import dev.fumaz.conduit.bind.BindingScope;
import dev.fumaz.conduit.bind.Dependency;
import dev.fumaz.conduit.bind.Key;
import dev.fumaz.conduit.exception.ConduitException;
import dev.fumaz.conduit.exception.ConfigurationException;
import dev.fumaz.conduit.exception.ConstructionException;
import dev.fumaz.conduit.exception.ProvisionException;
import dev.fumaz.conduit.exception.UnboundDependencyException;
import dev.fumaz.conduit.module.Module;
import dev.fumaz.conduit.provider.ConstructorProvider;
import dev.fumaz.conduit.provider.InstanceProvider;
import dev.fumaz.conduit.provider.Provider;
import dev.fumaz.conduit.scope.ScopeManager;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link Injector}.
 * <p>
 * A resolution walks the provider dependencies depth first. Each top-level call owns a
 * {@link ResolutionContext} holding the keys in flight, which detects cycles and names the chain of
 * requesting keys in errors. Singleton instances are cached through the {@link ScopeManager}; once
 * cached, their dependencies are never walked again.
 */
public class ConduitInjector implements Injector {

    private static final Logger LOGGER = Logger.getLogger(ConduitInjector.class.getName());
    private static final Object[] NO_ARGUMENTS = new Object[0];

    private final @NotNull BindingRegistry registry;
    private final @NotNull ScopeManager scopeManager;

    public ConduitInjector(@NotNull List<? extends Module> modules) {
        Objects.requireNonNull(modules, "modules");

        this.registry = new BindingRegistry();
        this.scopeManager = new ScopeManager();

        for (Module module : modules) {
            Objects.requireNonNull(module, "module");

            module.reset();
            module.configure();

            registry.install(module.getRegistry());
        }

        Key<Injector> self = Key.of(Injector.class);

        if (!registry.contains(self)) {
            registry.bind(new Binding<>(self, new InstanceProvider<>(this)));
        }

        LOGGER.fine(() -> "Created injector with " + registry.all().size() + " binding(s) from "
                + modules.size() + " module(s)");
    }

    @Override
    public <T> @NotNull T resolve(@NotNull Key<T> key) {
        Objects.requireNonNull(key, "key");

        return Objects.requireNonNull(resolveKey(key, new ResolutionContext(), false));
    }

    @Override
    public <T> @NotNull Optional<T> resolveOptional(@NotNull Key<T> key) {
        Objects.requireNonNull(key, "key");

        return Optional.ofNullable(resolveKey(key, new ResolutionContext(), true));
    }

    @Override
    public <T> @NotNull List<T> resolveAll(@NotNull Key<T> key) {
        Objects.requireNonNull(key, "key");

        return resolveAll(key, new ResolutionContext());
    }

    @Override
    public <T> @NotNull Set<T> resolveSet(@NotNull Key<T> key) {
        Objects.requireNonNull(key, "key");

        return resolveSet(key, new ResolutionContext());
    }

    @Override
    public <T> @NotNull Supplier<T> getProvider(@NotNull Key<T> key) {
        Objects.requireNonNull(key, "key");

        return () -> resolve(key);
    }

    @Override
    public void injectMembers(@NotNull Object instance) {
        Objects.requireNonNull(instance, "instance");

        injectMembers(instance, MembersInjector.forType(instance.getClass()));
    }

    @Override
    public void injectMembers(@NotNull Object instance, @NotNull List<MemberSlot> slots) {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(slots, "slots");

        ResolutionContext context = new ResolutionContext();

        for (MemberSlot slot : slots) {
            Object[] values = resolveDependencies(slot.getDependencies(), context);

            try {
                slot.assign(instance, values);
            } catch (ConduitException e) {
                throw e;
            } catch (Throwable throwable) {
                throw new ProvisionException("Failed to inject " + slot + " of " + instance.getClass().getName(), throwable);
            }

            LOGGER.finer(() -> "Injected " + slot);
        }
    }

    @Override
    public @NotNull List<Binding<?>> getBindings() {
        return Collections.unmodifiableList(registry.all());
    }

    @Override
    public boolean hasBinding(@NotNull Key<?> key) {
        return registry.contains(key);
    }

    public @NotNull ScopeManager getScopeManager() {
        return scopeManager;
    }

    private <T> @Nullable T resolveKey(Key<T> key, ResolutionContext context, boolean optional) {
        context.enter(key);

        try {
            Binding<T> binding = registry.lookup(key);

            if (binding == null) {
                if (registry.isMultiBound(key)) {
                    throw new ConfigurationException(key.describe()
                            + " only has multi-binding contributions; resolve it with resolveAll or a List dependency");
                }

                if (optional) {
                    LOGGER.finer(() -> "No binding for optional " + key.describe());
                    return null;
                }

                throw new UnboundDependencyException(key, context.path(), registry.qualifiersOf(key.getType()));
            }

            return provision(binding, key, context);
        } finally {
            context.exit(key);
        }
    }

    private <T> List<T> resolveAll(Key<T> key, ResolutionContext context) {
        context.enter(key);

        try {
            List<Binding<T>> contributions = contributions(key);
            List<T> instances = new ArrayList<>(contributions.size());

            for (int i = 0; i < contributions.size(); i++) {
                instances.add(provision(contributions.get(i), new ContributionSlot(key, i), context));
            }

            return Collections.unmodifiableList(instances);
        } finally {
            context.exit(key);
        }
    }

    private <T> Set<T> resolveSet(Key<T> key, ResolutionContext context) {
        context.enter(key);

        try {
            List<Binding<T>> contributions = contributions(key);
            Set<Object> seen = new HashSet<>();
            Set<T> instances = new LinkedHashSet<>();

            for (int i = 0; i < contributions.size(); i++) {
                Binding<T> contribution = contributions.get(i);

                if (!seen.add(identityOf(contribution))) {
                    LOGGER.finer(() -> "Skipping duplicate contribution " + contribution);
                    continue;
                }

                instances.add(provision(contribution, new ContributionSlot(key, i), context));
            }

            return Collections.unmodifiableSet(instances);
        } finally {
            context.exit(key);
        }
    }

    private <T> List<Binding<T>> contributions(Key<T> key) {
        List<Binding<T>> contributions = registry.lookupMulti(key);

        if (contributions.isEmpty() && registry.lookup(key) != null) {
            throw new ConfigurationException(key.describe()
                    + " has a single binding; resolve it with resolve instead of resolveAll");
        }

        return contributions;
    }

    /**
     * What makes two contributions duplicates in a set: the same pre-built instance (by equality) or
     * the same reflectively constructed class. Any other contribution is unique.
     */
    private static Object identityOf(Binding<?> contribution) {
        Provider<?> provider = contribution.getProvider();

        if (provider instanceof InstanceProvider) {
            return ((InstanceProvider<?>) provider).getInstance();
        }

        if (provider instanceof ConstructorProvider) {
            Class<?> implementation = ((ConstructorProvider<?>) provider).getImplementation();

            if (implementation != null) {
                return implementation;
            }
        }

        return contribution;
    }

    private <T> T provision(Binding<T> binding, Object slot, ResolutionContext context) {
        BindingScope scope = binding.isCached() ? binding.getScope() : BindingScope.TRANSIENT;

        return scopeManager.get(slot, scope, () -> construct(binding, context));
    }

    private <T> T construct(Binding<T> binding, ResolutionContext context) {
        Key<T> key = binding.getKey();
        Provider<? extends T> provider = binding.getProvider();
        Object[] arguments = resolveDependencies(provider.getDependencies(), context);
        T instance;

        try {
            instance = provider.provide(new ContextResolver(context), arguments);
        } catch (ConduitException e) {
            throw e;
        } catch (Throwable throwable) {
            LOGGER.log(Level.FINE, "Provider for " + key.describe() + " failed", throwable);
            throw new ConstructionException(key, context.path(), throwable);
        }

        if (instance == null) {
            throw new ConstructionException(key, context.path(), "Provider returned null");
        }

        if (binding.isCached()) {
            LOGGER.fine(() -> "Created " + binding.getScope() + " instance for " + key.describe());
        } else {
            LOGGER.finer(() -> "Created instance for " + key.describe());
        }

        return instance;
    }

    private Object[] resolveDependencies(List<Dependency<?>> dependencies, ResolutionContext context) {
        if (dependencies.isEmpty()) {
            return NO_ARGUMENTS;
        }

        Object[] arguments = new Object[dependencies.size()];

        for (int i = 0; i < arguments.length; i++) {
            arguments[i] = resolveDependency(dependencies.get(i), context);
        }

        return arguments;
    }

    private @Nullable Object resolveDependency(Dependency<?> dependency, ResolutionContext context) {
        if (dependency.isSet()) {
            return resolveSet(dependency.getKey(), context);
        }

        if (dependency.isCollection()) {
            return resolveAll(dependency.getKey(), context);
        }

        return resolveKey(dependency.getKey(), context, dependency.isOptional());
    }

    /**
     * The resolver handed to providers. It continues the resolution context of the call that invoked
     * the provider.
     */
    private final class ContextResolver implements Resolver {

        private final ResolutionContext context;

        private ContextResolver(ResolutionContext context) {
            this.context = context;
        }

        @Override
        public <T> @NotNull T resolve(@NotNull Key<T> key) {
            Objects.requireNonNull(key, "key");

            return Objects.requireNonNull(resolveKey(key, context, false));
        }

        @Override
        public <T> @NotNull Optional<T> resolveOptional(@NotNull Key<T> key) {
            Objects.requireNonNull(key, "key");

            return Optional.ofNullable(resolveKey(key, context, true));
        }

        @Override
        public <T> @NotNull List<T> resolveAll(@NotNull Key<T> key) {
            Objects.requireNonNull(key, "key");

            return ConduitInjector.this.resolveAll(key, context);
        }

        @Override
        public <T> @NotNull Set<T> resolveSet(@NotNull Key<T> key) {
            Objects.requireNonNull(key, "key");

            return ConduitInjector.this.resolveSet(key, context);
        }
    }

    /**
     * Cache slot of a multi-binding contribution: its key and position. Injectors configured from the
     * same modules share global contributions through it, while contributions of one key stay apart.
     */
    private static final class ContributionSlot {

        private final Key<?> key;
        private final int index;

        private ContributionSlot(Key<?> key, int index) {
            this.key = key;
            this.index = index;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }

            if (!(o instanceof ContributionSlot)) {
                return false;
            }

            ContributionSlot that = (ContributionSlot) o;
            return index == that.index && key.equals(that.key);
        }

        @Override
        public int hashCode() {
            return 31 * key.hashCode() + index;
        }

        @Override
        public String toString() {
            return key + "[" + index + "]";
        }
    }
}
