package dev.fumaz.conduit.scope;

import org.jetbrains.annotations.NotNull;

import java.util.logging.Logger;

/**
 * Process-wide cache behind {@link dev.fumaz.conduit.bind.BindingScope#GLOBAL_SINGLETON} bindings,
 * shared by every injector in the JVM. It is created on first use and is only ever emptied by
 * {@link #reset()}.
 */
public final class GlobalSingletons {

    private static final Logger LOGGER = Logger.getLogger(GlobalSingletons.class.getName());

    private GlobalSingletons() {
    }

    static @NotNull InstanceCache cache() {
        return Holder.CACHE;
    }

    public static boolean contains(@NotNull Object slotKey) {
        return Holder.CACHE.contains(slotKey);
    }

    /**
     * Drops every global singleton. Intended for test isolation; injectors created afterwards build
     * fresh instances on first use.
     */
    public static void reset() {
        int dropped = Holder.CACHE.size();
        Holder.CACHE.clear();
        LOGGER.fine(() -> "Cleared " + dropped + " global singleton(s)");
    }

    private static final class Holder {
        private static final InstanceCache CACHE = new InstanceCache();
    }
}
