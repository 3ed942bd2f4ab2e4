package dev.fumaz.conduit.bind;

import dev.fumaz.conduit.annotation.Singleton;
import dev.fumaz.conduit.provider.ConstructorFunction;
import dev.fumaz.conduit.provider.ConstructorProvider;
import dev.fumaz.conduit.provider.Constructors;
import dev.fumaz.conduit.provider.FactoryProvider;
import dev.fumaz.conduit.provider.InstanceProvider;
import dev.fumaz.conduit.provider.Provider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.annotation.Annotation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A {@link BindingBuilder} is used to create a {@link Binding}. Modifiers come first, then exactly one
 * terminal method ({@code to...}) registers the binding.
 *
 * @param <T> the type of the class
 */
public class BindingBuilder<T> {

    private final @NotNull Class<T> type;
    private final @NotNull BindingRegistry registry;
    private final boolean multi;

    private @NotNull BindingQualifier qualifier;
    private @Nullable BindingScope scope;
    private boolean registered;

    public BindingBuilder(@NotNull Key<T> key, @NotNull BindingRegistry registry, boolean multi) {
        Objects.requireNonNull(key, "key");
        this.type = key.getType();
        this.qualifier = key.getQualifier();
        this.registry = Objects.requireNonNull(registry, "registry");
        this.multi = multi;
    }

    public BindingBuilder<T> named(@NotNull String name) {
        qualifier = BindingQualifier.named(name);
        return this;
    }

    public BindingBuilder<T> qualifiedBy(@NotNull Class<? extends Annotation> qualifierType) {
        qualifier = BindingQualifier.of(qualifierType);
        return this;
    }

    public BindingBuilder<T> qualifiedBy(@NotNull Annotation qualifierAnnotation) {
        qualifier = BindingQualifier.from(qualifierAnnotation);
        return this;
    }

    public BindingBuilder<T> in(@NotNull BindingScope scope) {
        this.scope = Objects.requireNonNull(scope, "scope");
        return this;
    }

    public BindingBuilder<T> asTransient() {
        return in(BindingScope.TRANSIENT);
    }

    public BindingBuilder<T> asSingleton() {
        return in(BindingScope.INJECTOR_SINGLETON);
    }

    public BindingBuilder<T> asGlobalSingleton() {
        return in(BindingScope.GLOBAL_SINGLETON);
    }

    /**
     * Binds to a concrete implementation built through its injectable constructor. Unless a scope was
     * chosen explicitly, a {@link Singleton} annotation on the implementation decides the scope.
     *
     * @throws IllegalArgumentException if the implementation is not assignable to the bound type
     */
    public Binding<T> to(@NotNull Class<? extends T> implementation) {
        Objects.requireNonNull(implementation, "implementation");
        ensureAssignable(implementation);

        if (scope == null) {
            Singleton singleton = implementation.getAnnotation(Singleton.class);

            if (singleton != null) {
                scope = singleton.global() ? BindingScope.GLOBAL_SINGLETON : BindingScope.INJECTOR_SINGLETON;
            }
        }

        return toProvider(ConstructorProvider.reflective(implementation));
    }

    public Binding<T> toSelf() {
        return to(type);
    }

    /**
     * Binds to a pre-built instance. Scopes do not apply: the instance is returned as is.
     *
     * @throws IllegalArgumentException if the instance is not an instance of the bound type
     */
    public Binding<T> toInstance(@NotNull T instance) {
        Objects.requireNonNull(instance, "instance");

        if (!type.isInstance(instance)) {
            throw new IllegalArgumentException("Instance of " + instance.getClass().getName()
                    + " is not an instance of " + type.getName());
        }

        return toProvider(new InstanceProvider<>(instance));
    }

    public Binding<T> toFactory(@NotNull FactoryProvider.Factory<? extends T> factory) {
        return toProvider(new FactoryProvider<>(factory));
    }

    public Binding<T> toSupplier(@NotNull Supplier<? extends T> supplier) {
        Objects.requireNonNull(supplier, "supplier");

        return toFactory(resolver -> supplier.get());
    }

    public Binding<T> toConstructor(@NotNull List<Dependency<?>> dependencies,
                                    @NotNull ConstructorFunction<? extends T> function) {
        return toProvider(new ConstructorProvider<>(dependencies, function));
    }

    public Binding<T> toConstructor(@NotNull Constructors.Constructor0<? extends T> constructor) {
        Objects.requireNonNull(constructor, "constructor");

        return toConstructor(List.of(), arguments -> constructor.create());
    }

    public <A> Binding<T> toConstructor(@NotNull Class<A> first,
                                        @NotNull Constructors.Constructor1<? super A, ? extends T> constructor) {
        return toConstructor(Key.of(first), constructor);
    }

    @SuppressWarnings("unchecked")
    public <A> Binding<T> toConstructor(@NotNull Key<A> first,
                                        @NotNull Constructors.Constructor1<? super A, ? extends T> constructor) {
        Objects.requireNonNull(constructor, "constructor");

        return toConstructor(dependencies(first),
                arguments -> constructor.create((A) arguments[0]));
    }

    public <A, B> Binding<T> toConstructor(@NotNull Class<A> first,
                                           @NotNull Class<B> second,
                                           @NotNull Constructors.Constructor2<? super A, ? super B, ? extends T> constructor) {
        return toConstructor(Key.of(first), Key.of(second), constructor);
    }

    @SuppressWarnings("unchecked")
    public <A, B> Binding<T> toConstructor(@NotNull Key<A> first,
                                           @NotNull Key<B> second,
                                           @NotNull Constructors.Constructor2<? super A, ? super B, ? extends T> constructor) {
        Objects.requireNonNull(constructor, "constructor");

        return toConstructor(dependencies(first, second),
                arguments -> constructor.create((A) arguments[0], (B) arguments[1]));
    }

    public <A, B, C> Binding<T> toConstructor(@NotNull Class<A> first,
                                              @NotNull Class<B> second,
                                              @NotNull Class<C> third,
                                              @NotNull Constructors.Constructor3<? super A, ? super B, ? super C, ? extends T> constructor) {
        return toConstructor(Key.of(first), Key.of(second), Key.of(third), constructor);
    }

    @SuppressWarnings("unchecked")
    public <A, B, C> Binding<T> toConstructor(@NotNull Key<A> first,
                                              @NotNull Key<B> second,
                                              @NotNull Key<C> third,
                                              @NotNull Constructors.Constructor3<? super A, ? super B, ? super C, ? extends T> constructor) {
        Objects.requireNonNull(constructor, "constructor");

        return toConstructor(dependencies(first, second, third),
                arguments -> constructor.create((A) arguments[0], (B) arguments[1], (C) arguments[2]));
    }

    public Binding<T> toProvider(@NotNull Provider<? extends T> provider) {
        Objects.requireNonNull(provider, "provider");

        if (registered) {
            throw new IllegalStateException("Binding for " + Key.of(type, qualifier).describe()
                    + " was already registered");
        }

        Binding<T> binding = new Binding<>(Key.of(type, qualifier), provider,
                scope != null ? scope : BindingScope.TRANSIENT, multi);

        if (multi) {
            registry.bindMulti(binding);
        } else {
            registry.bind(binding);
        }

        registered = true;
        return binding;
    }

    private void ensureAssignable(Class<?> implementation) {
        if (!type.isAssignableFrom(implementation)) {
            throw new IllegalArgumentException("Type " + implementation.getName()
                    + " is not assignable to " + type.getName());
        }
    }

    private static List<Dependency<?>> dependencies(Key<?>... keys) {
        List<Dependency<?>> dependencies = new ArrayList<>(keys.length);

        for (Key<?> key : keys) {
            dependencies.add(Dependency.required(key));
        }

        return dependencies;
    }
}
