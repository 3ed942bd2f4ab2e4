package dev.fumaz.conduit.scope;

import dev.fumaz.conduit.exception.ProvisionException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Holds singleton instances by slot.
 * <p>
 * Every slot has its own lock, so concurrent callers for the same slot are serialized while
 * callers for different slots build in parallel. A supplier runs at most once per slot unless it
 * fails or returns {@code null}, in which case the slot stays empty and the next caller tries again.
 * <p>
 * A thread about to wait for a slot first follows the chain of slot owners and the slots they wait
 * for. If the chain leads back to the calling thread, waiting would never end, and a
 * {@link ProvisionException} is thrown instead.
 */
public final class InstanceCache {

    private static final ConcurrentMap<Thread, Slot> WAITING = new ConcurrentHashMap<>();

    private final ConcurrentMap<Object, Slot> slots = new ConcurrentHashMap<>();

    public <T> T getOrCompute(@NotNull Object slotKey, @NotNull Supplier<T> supplier) {
        Objects.requireNonNull(slotKey, "slotKey");
        Objects.requireNonNull(supplier, "supplier");

        Slot slot = slots.computeIfAbsent(slotKey, Slot::new);
        return slot.getOrCreate(supplier);
    }

    public @Nullable Object peek(@NotNull Object slotKey) {
        Slot slot = slots.get(slotKey);
        return slot == null ? null : slot.get();
    }

    public boolean contains(@NotNull Object slotKey) {
        return peek(slotKey) != null;
    }

    public int size() {
        int size = 0;

        for (Slot slot : slots.values()) {
            if (slot.get() != null) {
                size++;
            }
        }

        return size;
    }

    void clear() {
        slots.clear();
    }

    private static final class Slot {

        private static final VarHandle INSTANCE_HANDLE;

        static {
            try {
                INSTANCE_HANDLE = MethodHandles.lookup().findVarHandle(Slot.class, "instance", Object.class);
            } catch (ReflectiveOperationException e) {
                throw new ExceptionInInitializerError(e);
            }
        }

        private final Object key;
        private final ReentrantLock lock = new ReentrantLock();
        private volatile Thread owner;
        private Object instance;

        private Slot(Object key) {
            this.key = key;
        }

        private Object get() {
            return INSTANCE_HANDLE.getAcquire(this);
        }

        @SuppressWarnings("unchecked")
        private <T> T getOrCreate(Supplier<T> supplier) {
            Object local = get();

            if (local != null) {
                return (T) local;
            }

            acquire();
            Thread previous = owner;

            try {
                owner = Thread.currentThread();
                local = get();

                if (local == null) {
                    local = supplier.get();
                    INSTANCE_HANDLE.setRelease(this, local);
                }

                return (T) local;
            } finally {
                owner = previous;
                lock.unlock();
            }
        }

        private void acquire() {
            if (lock.tryLock()) {
                return;
            }

            Thread current = Thread.currentThread();
            WAITING.put(current, this);

            try {
                checkWaitChain(current);
                lock.lock();
            } finally {
                WAITING.remove(current);
            }
        }

        private void checkWaitChain(Thread current) {
            List<Object> chain = new ArrayList<>();
            Slot target = this;

            while (target != null && !chain.contains(target.key)) {
                chain.add(target.key);

                Thread holder = target.owner;

                if (holder == null) {
                    return;
                }

                if (holder == current) {
                    throw new ProvisionException("Dependency cycle across threads while waiting for singleton "
                            + key + "; slots involved: " + chain);
                }

                target = WAITING.get(holder);
            }
        }
    }
}
