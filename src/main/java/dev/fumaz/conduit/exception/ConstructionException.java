package dev.fumaz.conduit.exception;

import dev.fumaz.conduit.bind.Key;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Thrown when a provider fails while building an instance. The original failure is kept as the cause.
 */
public class ConstructionException extends ProvisionException {

    private final @NotNull Key<?> key;

    public ConstructionException(@NotNull Key<?> key, @NotNull List<Key<?>> resolutionPath, Throwable cause) {
        super("Failed to construct " + key.describe() + ": " + cause, resolutionPath, cause);
        this.key = key;
    }

    public ConstructionException(@NotNull Key<?> key, @NotNull List<Key<?>> resolutionPath, String reason) {
        super("Failed to construct " + key.describe() + ": " + reason, resolutionPath);
        this.key = key;
    }

    public @NotNull Key<?> getKey() {
        return key;
    }
}
