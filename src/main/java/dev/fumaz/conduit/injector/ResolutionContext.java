package dev.fumaz.conduit.injector;

import dev.fumaz.conduit.bind.Key;
import dev.fumaz.conduit.exception.CyclicDependencyException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * The keys being resolved by one top-level call, in the order they were entered. Confined to the
 * calling thread and discarded when the call returns.
 */
final class ResolutionContext {

    private final LinkedHashSet<Key<?>> inFlight = new LinkedHashSet<>();

    void enter(@NotNull Key<?> key) {
        if (inFlight.add(key)) {
            return;
        }

        List<Key<?>> path = path();
        List<Key<?>> cycle = new ArrayList<>(path.subList(path.indexOf(key), path.size()));
        cycle.add(key);

        path.add(key);
        throw new CyclicDependencyException(cycle, path);
    }

    void exit(@NotNull Key<?> key) {
        inFlight.remove(key);
    }

    /**
     * Returns a snapshot of the in-flight keys, root request first.
     */
    @NotNull List<Key<?>> path() {
        return new ArrayList<>(inFlight);
    }
}
