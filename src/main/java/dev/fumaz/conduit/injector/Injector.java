package dev.fumaz.conduit.injector;

import dev.fumaz.conduit.bind.Binding;
import dev.fumaz.conduit.bind.Key;
import dev.fumaz.conduit.module.Module;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * An {@link Injector} is responsible for providing instances of bound keys and injecting dependencies
 * into existing objects. Every injector binds itself under {@code Key.of(Injector.class)} unless a
 * module already did.
 */
public interface Injector extends Resolver {

    static @NotNull Injector create(@NotNull List<? extends Module> modules) {
        return new ConduitInjector(modules);
    }

    static @NotNull Injector create(@NotNull Module... modules) {
        return create(Arrays.asList(modules));
    }

    /**
     * Returns a supplier that resolves the key each time it is called. The binding is not looked up
     * until then, so the supplier can be obtained before the graph is complete.
     */
    <T> @NotNull Supplier<T> getProvider(@NotNull Key<T> key);

    default <T> @NotNull Supplier<T> getProvider(@NotNull Class<T> type) {
        return getProvider(Key.of(type));
    }

    /**
     * Injects the {@link dev.fumaz.conduit.annotation.Inject} annotated fields and methods of an
     * existing instance.
     */
    void injectMembers(@NotNull Object instance);

    /**
     * Resolves and assigns each slot in order, sharing one resolution context. The first failure is
     * thrown as is; slots assigned before it keep their values.
     */
    void injectMembers(@NotNull Object instance, @NotNull List<MemberSlot> slots);

    @NotNull List<Binding<?>> getBindings();

    boolean hasBinding(@NotNull Key<?> key);

    default boolean hasBinding(@NotNull Class<?> type) {
        return hasBinding(Key.of(type));
    }

}
