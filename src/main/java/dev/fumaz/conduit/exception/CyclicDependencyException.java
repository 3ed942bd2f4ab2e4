package dev.fumaz.conduit.exception;

import dev.fumaz.conduit.bind.Key;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Thrown when a key depends on itself, directly or transitively, within one resolution call.
 */
public class CyclicDependencyException extends ProvisionException {

    private final @NotNull List<Key<?>> cycle;

    public CyclicDependencyException(@NotNull List<Key<?>> cycle, @NotNull List<Key<?>> resolutionPath) {
        super("Dependency cycle detected while resolving " + cycle.get(0).describe()
                + System.lineSeparator() + "Cycle path: " + describePath(cycle), resolutionPath);
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Returns the cycle, starting and ending with the repeated key.
     */
    public @NotNull List<Key<?>> getCycle() {
        return cycle;
    }
}
