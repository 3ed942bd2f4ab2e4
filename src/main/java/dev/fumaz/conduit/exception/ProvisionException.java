package dev.fumaz.conduit.exception;

import dev.fumaz.conduit.bind.Key;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Signals a failure while provisioning or injecting a dependency.
 * <p>
 * The resolution path lists the keys being resolved when the failure happened, from the
 * top-level request down to the failing key.
 */
public class ProvisionException extends ConduitException {

    private final @NotNull List<Key<?>> resolutionPath;

    public ProvisionException(String message) {
        this(message, Collections.emptyList());
    }

    public ProvisionException(String message, Throwable cause) {
        this(message, Collections.emptyList(), cause);
    }

    public ProvisionException(String message, @NotNull List<Key<?>> resolutionPath) {
        super(message);
        this.resolutionPath = List.copyOf(resolutionPath);
    }

    public ProvisionException(String message, @NotNull List<Key<?>> resolutionPath, Throwable cause) {
        super(message, cause);
        this.resolutionPath = List.copyOf(resolutionPath);
    }

    public @NotNull List<Key<?>> getResolutionPath() {
        return resolutionPath;
    }

    protected static String describePath(@NotNull List<Key<?>> path) {
        return path.stream()
                .map(Key::describe)
                .collect(Collectors.joining(" -> "));
    }
}
