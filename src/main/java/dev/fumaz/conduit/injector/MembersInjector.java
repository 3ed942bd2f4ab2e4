package dev.fumaz.conduit.injector;

import dev.fumaz.conduit.annotation.Inject;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Derives the {@link MemberSlot}s of a class from its {@link Inject} annotated fields and methods.
 * Superclass members come before subclass members; within a class, fields come before methods.
 * Static members are ignored. Results are cached per class.
 */
public final class MembersInjector {

    private static final ClassValue<List<MemberSlot>> PLANS = new ClassValue<>() {
        @Override
        protected List<MemberSlot> computeValue(Class<?> type) {
            return plan(type);
        }
    };

    private MembersInjector() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    /**
     * @throws dev.fumaz.conduit.reflection.ReflectionException if an annotated member cannot be injected
     */
    public static @NotNull List<MemberSlot> forType(@NotNull Class<?> type) {
        return PLANS.get(type);
    }

    private static List<MemberSlot> plan(Class<?> type) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();

        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            hierarchy.push(current);
        }

        List<MemberSlot> slots = new ArrayList<>();

        for (Class<?> current : hierarchy) {
            for (Field field : current.getDeclaredFields()) {
                if (field.isAnnotationPresent(Inject.class) && !Modifier.isStatic(field.getModifiers())) {
                    slots.add(MemberSlot.field(field));
                }
            }

            for (Method method : current.getDeclaredMethods()) {
                if (method.isAnnotationPresent(Inject.class) && !method.isBridge()
                        && !Modifier.isStatic(method.getModifiers())) {
                    slots.add(MemberSlot.method(method));
                }
            }
        }

        return Collections.unmodifiableList(slots);
    }
}
