package dev.fumaz.conduit.exception;

import dev.fumaz.conduit.bind.BindingQualifier;
import dev.fumaz.conduit.bind.Key;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * Thrown when a required key has no binding.
 */
public class UnboundDependencyException extends ProvisionException {

    private final @NotNull Key<?> key;
    private final @NotNull List<BindingQualifier> alternatives;

    public UnboundDependencyException(@NotNull Key<?> key, @NotNull List<Key<?>> resolutionPath) {
        this(key, resolutionPath, Collections.emptyList());
    }

    /**
     * @param alternatives the qualifiers that are bound for the same type, listed in the message
     */
    public UnboundDependencyException(@NotNull Key<?> key,
                                      @NotNull List<Key<?>> resolutionPath,
                                      @NotNull List<BindingQualifier> alternatives) {
        super(buildMessage(key, resolutionPath, alternatives), resolutionPath);
        this.key = key;
        this.alternatives = Collections.unmodifiableList(new ArrayList<>(alternatives));
    }

    public @NotNull Key<?> getKey() {
        return key;
    }

    /**
     * Returns the qualifiers bound for the missing key's type, such as the available names of a
     * {@code @Named} lookup.
     */
    public @NotNull List<BindingQualifier> getAlternatives() {
        return alternatives;
    }

    /**
     * Returns the key whose provider needed the missing one, or {@code null} for a top-level request.
     */
    public @Nullable Key<?> getRequestingKey() {
        List<Key<?>> path = getResolutionPath();
        return path.size() < 2 ? null : path.get(path.size() - 2);
    }

    private static String buildMessage(Key<?> key, List<Key<?>> path, List<BindingQualifier> alternatives) {
        StringBuilder builder = new StringBuilder("No binding found for ").append(key.describe());

        if (!alternatives.isEmpty()) {
            StringJoiner joiner = new StringJoiner(", ");

            for (BindingQualifier alternative : alternatives) {
                joiner.add(alternative.toString());
            }

            builder.append(" (available: ").append(joiner).append(')');
        }

        if (path.size() > 1) {
            builder.append(" required by ")
                    .append(path.get(path.size() - 2).describe())
                    .append(System.lineSeparator())
                    .append("Resolution path: ")
                    .append(describePath(path));
        }

        return builder.toString();
    }
}
