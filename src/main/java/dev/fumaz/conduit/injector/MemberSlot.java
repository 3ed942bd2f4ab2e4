package dev.fumaz.conduit.injector;

import dev.fumaz.conduit.bind.Dependency;
import dev.fumaz.conduit.reflection.ReflectionException;
import dev.fumaz.conduit.reflection.Reflections;
import dev.fumaz.conduit.util.InjectionUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.VarHandle;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A {@link MemberSlot} is an injection point on an existing instance: the dependencies it needs and
 * how the resolved values are assigned to the instance.
 */
public final class MemberSlot {

    private final @NotNull String description;
    private final @NotNull List<Dependency<?>> dependencies;
    private final @NotNull Assignment assignment;

    private MemberSlot(@NotNull String description,
                       @NotNull List<Dependency<?>> dependencies,
                       @NotNull Assignment assignment) {
        this.description = Objects.requireNonNull(description, "description");
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(dependencies, "dependencies")));
        this.assignment = Objects.requireNonNull(assignment, "assignment");
    }

    public static @NotNull MemberSlot of(@NotNull String description,
                                         @NotNull List<Dependency<?>> dependencies,
                                         @NotNull Assignment assignment) {
        return new MemberSlot(description, dependencies, assignment);
    }

    public static @NotNull MemberSlot of(@NotNull String description,
                                         @NotNull Dependency<?> dependency,
                                         @NotNull Assignment assignment) {
        return new MemberSlot(description, List.of(dependency), assignment);
    }

    /**
     * Describes an instance field. Qualifier annotations and {@code @Inject(optional = true)} on the
     * field are honoured.
     *
     * @throws ReflectionException if the field is static or final
     */
    public static @NotNull MemberSlot field(@NotNull Field field) {
        Objects.requireNonNull(field, "field");
        String description = "field " + field.getDeclaringClass().getName() + "." + field.getName();
        int modifiers = field.getModifiers();

        if (Modifier.isStatic(modifiers)) {
            throw new ReflectionException("Cannot inject static " + description);
        }

        if (Modifier.isFinal(modifiers)) {
            throw new ReflectionException("Cannot inject final " + description);
        }

        Dependency<?> dependency = InjectionUtils.dependencyOf(field.getType(), field.getGenericType(),
                field.getAnnotations(), description);
        VarHandle handle = Reflections.fieldHandle(field);

        if (handle == null) {
            field.setAccessible(true);
        }

        return new MemberSlot(description, List.of(dependency), (target, values) -> {
            if (handle != null) {
                handle.set(target, values[0]);
                return;
            }

            field.set(target, values[0]);
        });
    }

    /**
     * Describes an instance method. Each parameter becomes one dependency, in declaration order.
     *
     * @throws ReflectionException if the method is static
     */
    public static @NotNull MemberSlot method(@NotNull Method method) {
        Objects.requireNonNull(method, "method");
        String description = "method " + method.getDeclaringClass().getName() + "." + method.getName();

        if (Modifier.isStatic(method.getModifiers())) {
            throw new ReflectionException("Cannot inject static " + description);
        }

        List<Dependency<?>> dependencies = new ArrayList<>(method.getParameterCount());

        for (Parameter parameter : method.getParameters()) {
            dependencies.add(InjectionUtils.dependencyOf(parameter.getType(), parameter.getParameterizedType(),
                    parameter.getAnnotations(), "parameter " + parameter.getName() + " of " + description));
        }

        MethodHandle handle = Reflections.methodInvoker(method);

        if (handle == null) {
            method.setAccessible(true);
        }

        return new MemberSlot(description, dependencies, (target, values) -> invoke(method, handle, target, values));
    }

    public @NotNull String getDescription() {
        return description;
    }

    public @NotNull List<Dependency<?>> getDependencies() {
        return dependencies;
    }

    void assign(@NotNull Object target, @NotNull Object[] values) throws Exception {
        assignment.assign(target, values);
    }

    @Override
    public String toString() {
        return description;
    }

    private static void invoke(Method method, @Nullable MethodHandle handle, Object target, Object[] values) throws Exception {
        if (handle == null) {
            try {
                method.invoke(target, values);
                return;
            } catch (InvocationTargetException e) {
                Throwable cause = Reflections.unwrap(e);

                if (cause instanceof Exception) {
                    throw (Exception) cause;
                }

                if (cause instanceof Error) {
                    throw (Error) cause;
                }

                throw e;
            }
        }

        try {
            handle.invoke(target, values);
        } catch (Exception | Error e) {
            throw e;
        } catch (Throwable throwable) {
            throw new IllegalStateException("Invocation of " + method + " failed", throwable);
        }
    }

    /**
     * Assigns resolved values, index-aligned with the slot's dependencies, to a target instance.
     */
    @FunctionalInterface
    public interface Assignment {
        void assign(@NotNull Object target, @NotNull Object[] values) throws Exception;
    }
}
