package dev.fumaz.conduit.module;

import dev.fumaz.conduit.bind.BindingScope;
import dev.fumaz.conduit.provider.FactoryProvider;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A module configured by plain method calls instead of a {@link #configure()} override:
 *
 * <pre>{@code
 * SimpleConfig config = new SimpleConfig()
 *         .register(Clock.class, SystemClock.class, BindingScope.GLOBAL_SINGLETON)
 *         .registerInstance(Settings.class, settings);
 * Injector injector = Injector.create(config);
 * }</pre>
 *
 * Each call records an ordinary binding, so later registrations for the same type replace earlier
 * ones exactly as they would in a {@link ConduitModule}.
 */
public class SimpleConfig extends ConduitModule {

    private final List<Consumer<ConduitModule>> registrations = new ArrayList<>();

    /**
     * Registers an implementation in the scope its {@link dev.fumaz.conduit.annotation.Singleton}
     * annotation asks for, or as transient without one.
     */
    public <T> @NotNull SimpleConfig register(@NotNull Class<T> contract, @NotNull Class<? extends T> implementation) {
        ensureAssignable(contract, implementation);

        return record(module -> module.bind(contract).to(implementation));
    }

    public <T> @NotNull SimpleConfig register(@NotNull Class<T> contract,
                                              @NotNull Class<? extends T> implementation,
                                              @NotNull BindingScope scope) {
        Objects.requireNonNull(scope, "scope");
        ensureAssignable(contract, implementation);

        return record(module -> module.bind(contract).in(scope).to(implementation));
    }

    public <T> @NotNull SimpleConfig registerInstance(@NotNull Class<T> contract, @NotNull T instance) {
        ensureInstance(contract, instance);

        return record(module -> module.bind(contract).toInstance(instance));
    }

    /**
     * Registers one of several implementations of a contract under a name. It is looked up with
     * {@code resolve(contract, name)} or injected into a parameter annotated {@code @Named(name)}.
     */
    public <T> @NotNull SimpleConfig registerNamed(@NotNull Class<T> contract,
                                                   @NotNull String name,
                                                   @NotNull Class<? extends T> implementation) {
        Objects.requireNonNull(name, "name");
        ensureAssignable(contract, implementation);

        return record(module -> module.bind(contract).named(name).to(implementation));
    }

    public <T> @NotNull SimpleConfig registerNamed(@NotNull Class<T> contract,
                                                   @NotNull String name,
                                                   @NotNull Class<? extends T> implementation,
                                                   @NotNull BindingScope scope) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(scope, "scope");
        ensureAssignable(contract, implementation);

        return record(module -> module.bind(contract).named(name).in(scope).to(implementation));
    }

    public <T> @NotNull SimpleConfig registerNamedInstance(@NotNull Class<T> contract,
                                                           @NotNull String name,
                                                           @NotNull T instance) {
        Objects.requireNonNull(name, "name");
        ensureInstance(contract, instance);

        return record(module -> module.bind(contract).named(name).toInstance(instance));
    }

    /**
     * Adds an implementation to the contributions of a contract, resolved with {@code resolveAll} or
     * {@code resolveSet}.
     */
    public <T> @NotNull SimpleConfig registerMulti(@NotNull Class<T> contract, @NotNull Class<? extends T> implementation) {
        ensureAssignable(contract, implementation);

        return record(module -> module.bindMulti(contract).to(implementation));
    }

    public <T> @NotNull SimpleConfig registerMultiInstance(@NotNull Class<T> contract, @NotNull T instance) {
        ensureInstance(contract, instance);

        return record(module -> module.bindMulti(contract).toInstance(instance));
    }

    public <T> @NotNull SimpleConfig registerFactory(@NotNull Class<T> contract,
                                                     @NotNull FactoryProvider.Factory<? extends T> factory,
                                                     @NotNull BindingScope scope) {
        Objects.requireNonNull(contract, "contract");
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(scope, "scope");

        return record(module -> module.bind(contract).in(scope).toFactory(factory));
    }

    @Override
    public void configure() {
        for (Consumer<ConduitModule> registration : registrations) {
            registration.accept(this);
        }
    }

    private static void ensureAssignable(Class<?> contract, Class<?> implementation) {
        Objects.requireNonNull(contract, "contract");
        Objects.requireNonNull(implementation, "implementation");

        if (!contract.isAssignableFrom(implementation)) {
            throw new IllegalArgumentException("Type " + implementation.getName()
                    + " is not assignable to " + contract.getName());
        }
    }

    private static void ensureInstance(Class<?> contract, Object instance) {
        Objects.requireNonNull(contract, "contract");
        Objects.requireNonNull(instance, "instance");

        if (!contract.isInstance(instance)) {
            throw new IllegalArgumentException("Instance of " + instance.getClass().getName()
                    + " is not an instance of " + contract.getName());
        }
    }

    private SimpleConfig record(Consumer<ConduitModule> registration) {
        registrations.add(registration);
        return this;
    }

}
