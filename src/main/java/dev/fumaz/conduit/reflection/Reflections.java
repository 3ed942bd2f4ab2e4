package dev.fumaz.conduit.reflection;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.invoke.VarHandle;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Method handle plumbing shared by the reflective constructor and member descriptors.
 * Everything here runs when a descriptor is built, never on the resolution path.
 */
public final class Reflections {

    private static final MethodHandles.Lookup ROOT_LOOKUP = MethodHandles.lookup();
    private static final ConcurrentMap<Class<?>, MethodHandles.Lookup> PRIVATE_LOOKUPS = new ConcurrentHashMap<>();

    private Reflections() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static @NotNull MethodHandles.Lookup lookupFor(@NotNull Class<?> type) {
        return PRIVATE_LOOKUPS.computeIfAbsent(type, Reflections::createLookupFor);
    }

    /**
     * Returns a handle of type {@code (Object[])Object} that invokes the constructor with spread arguments.
     */
    public static @NotNull MethodHandle constructorInvoker(@NotNull Constructor<?> constructor) {
        constructor.setAccessible(true);

        MethodHandle handle = unreflectConstructor(constructor);
        handle = handle.asSpreader(Object[].class, constructor.getParameterCount());
        return handle.asType(MethodType.methodType(Object.class, Object[].class));
    }

    /**
     * Returns a handle of type {@code (Object, Object[])void} that invokes the method on a receiver,
     * or {@code null} if no handle could be created and plain reflection must be used.
     */
    public static @Nullable MethodHandle methodInvoker(@NotNull Method method) {
        try {
            MethodHandle base = lookupFor(method.getDeclaringClass()).unreflect(method);
            MethodHandle spread = base.asSpreader(Object[].class, method.getParameterCount());

            if (Modifier.isStatic(method.getModifiers())) {
                spread = MethodHandles.dropArguments(spread, 0, Object.class);
            }

            return spread.asType(MethodType.methodType(void.class, Object.class, Object[].class));
        } catch (IllegalAccessException | RuntimeException e) {
            return null;
        }
    }

    /**
     * Returns a var handle for the field, or {@code null} if plain reflection must be used.
     */
    public static @Nullable VarHandle fieldHandle(@NotNull Field field) {
        try {
            return lookupFor(field.getDeclaringClass()).unreflectVarHandle(field);
        } catch (IllegalAccessException | RuntimeException e) {
            return null;
        }
    }

    /**
     * Returns the class argument of a {@code List<X>} style type, or {@code null} if it cannot be determined.
     */
    public static @Nullable Class<?> elementType(@NotNull Type genericType) {
        if (!(genericType instanceof ParameterizedType)) {
            return null;
        }

        Type[] arguments = ((ParameterizedType) genericType).getActualTypeArguments();

        if (arguments.length != 1) {
            return null;
        }

        Type argument = arguments[0];

        if (argument instanceof Class) {
            return (Class<?>) argument;
        }

        if (argument instanceof ParameterizedType) {
            return (Class<?>) ((ParameterizedType) argument).getRawType();
        }

        return null;
    }

    public static @NotNull Throwable unwrap(@NotNull Throwable throwable) {
        if (throwable instanceof InvocationTargetException) {
            Throwable target = ((InvocationTargetException) throwable).getTargetException();
            return target != null ? target : throwable;
        }

        return throwable;
    }

    private static MethodHandles.Lookup createLookupFor(Class<?> type) {
        try {
            return MethodHandles.privateLookupIn(type, ROOT_LOOKUP);
        } catch (IllegalAccessException | RuntimeException e) {
            return ROOT_LOOKUP;
        }
    }

    private static MethodHandle unreflectConstructor(Constructor<?> constructor) {
        try {
            return lookupFor(constructor.getDeclaringClass()).unreflectConstructor(constructor);
        } catch (IllegalAccessException firstFailure) {
            try {
                return ROOT_LOOKUP.unreflectConstructor(constructor);
            } catch (IllegalAccessException secondFailure) {
                ReflectionException exception = new ReflectionException(
                        "Unable to access constructor handle for " + constructor, secondFailure);
                exception.addSuppressed(firstFailure);
                throw exception;
            }
        }
    }
}
