package dev.fumaz.conduit.provider;

import dev.fumaz.conduit.annotation.Inject;
import dev.fumaz.conduit.bind.Dependency;
import dev.fumaz.conduit.injector.Resolver;
import dev.fumaz.conduit.reflection.ReflectionException;
import dev.fumaz.conduit.reflection.Reflections;
import dev.fumaz.conduit.util.InjectionUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodHandle;
import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A {@link ConstructorProvider} declares an ordered list of dependencies and a build function that
 * receives them once resolved.
 *
 * @param <T> the type of the class
 */
public class ConstructorProvider<T> implements Provider<T> {

    private final @NotNull List<Dependency<?>> dependencies;
    private final @NotNull ConstructorFunction<? extends T> function;
    private final @Nullable Class<? extends T> implementation;
    private final @Nullable String description;

    public ConstructorProvider(@NotNull List<Dependency<?>> dependencies,
                               @NotNull ConstructorFunction<? extends T> function) {
        this(dependencies, function, null, null);
    }

    private ConstructorProvider(@NotNull List<Dependency<?>> dependencies,
                                @NotNull ConstructorFunction<? extends T> function,
                                @Nullable Class<? extends T> implementation,
                                @Nullable String description) {
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(dependencies, "dependencies")));
        this.function = Objects.requireNonNull(function, "function");
        this.implementation = implementation;
        this.description = description;
    }

    /**
     * Describes the injectable constructor of {@code type}: the one annotated with {@link Inject},
     * otherwise the no-argument constructor, otherwise the only declared constructor.
     * <p>
     * Parameters become dependencies in declaration order. Qualifier annotations select the key,
     * {@code @Inject(optional = true)} marks a parameter optional, a {@code List<X>} parameter
     * collects every contribution bound for {@code X} and a {@code Set<X>} parameter collects them
     * without duplicates.
     *
     * @throws ReflectionException if no constructor qualifies
     */
    public static <T> @NotNull ConstructorProvider<T> reflective(@NotNull Class<T> type) {
        Objects.requireNonNull(type, "type");

        if (type.isInterface() || Modifier.isAbstract(type.getModifiers()) || type.isPrimitive() || type.isArray()) {
            throw new ReflectionException("Cannot construct " + type.getName() + ": not a concrete class");
        }

        Constructor<?> constructor = selectConstructor(type);
        List<Dependency<?>> dependencies = new ArrayList<>();

        for (Parameter parameter : constructor.getParameters()) {
            dependencies.add(describeParameter(parameter));
        }

        MethodHandle invoker = Reflections.constructorInvoker(constructor);
        ConstructorFunction<T> function = arguments -> {
            try {
                return type.cast(invoker.invoke(arguments));
            } catch (Exception | Error e) {
                throw e;
            } catch (Throwable throwable) {
                throw new IllegalStateException("Constructor of " + type.getName() + " failed", throwable);
            }
        };

        return new ConstructorProvider<>(dependencies, function, type, "constructor " + constructor.toGenericString());
    }

    /**
     * Returns the class this provider instantiates reflectively, or {@code null} for an explicit
     * constructor function.
     */
    public @Nullable Class<? extends T> getImplementation() {
        return implementation;
    }

    @Override
    public @NotNull List<Dependency<?>> getDependencies() {
        return dependencies;
    }

    @Override
    public @Nullable T provide(@NotNull Resolver resolver, @NotNull Object[] arguments) throws Exception {
        return function.create(arguments);
    }

    @Override
    public String toString() {
        return description != null ? description : "constructor function of " + dependencies;
    }

    private static Constructor<?> selectConstructor(Class<?> type) {
        Constructor<?>[] declaredConstructors = type.getDeclaredConstructors();
        Constructor<?> injectable = null;
        Constructor<?> zeroArgument = null;

        for (Constructor<?> constructor : declaredConstructors) {
            if (constructor.isAnnotationPresent(Inject.class)) {
                if (injectable != null) {
                    throw new ReflectionException("Multiple injectable constructors found for type " + type.getName());
                }

                injectable = constructor;
            }

            if (constructor.getParameterCount() == 0) {
                zeroArgument = constructor;
            }
        }

        if (injectable != null) {
            return injectable;
        }

        if (zeroArgument != null) {
            return zeroArgument;
        }

        if (declaredConstructors.length == 1) {
            return declaredConstructors[0];
        }

        throw new ReflectionException("No suitable constructor found for " + type.getName()
                + "; annotate one with @Inject");
    }

    private static Dependency<?> describeParameter(Parameter parameter) {
        return InjectionUtils.dependencyOf(parameter.getType(), parameter.getParameterizedType(),
                parameter.getAnnotations(), "constructor parameter " + parameter.getName() + " in "
                        + parameter.getDeclaringExecutable().getDeclaringClass().getName());
    }
}
