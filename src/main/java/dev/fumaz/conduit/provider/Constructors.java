package dev.fumaz.conduit.provider;

/**
 * Typed build functions for constructor providers with a fixed number of dependencies.
 */
public final class Constructors {

    private Constructors() {
    }

    @FunctionalInterface
    public interface Constructor0<R> {
        R create() throws Exception;
    }

    @FunctionalInterface
    public interface Constructor1<T1, R> {
        R create(T1 first) throws Exception;
    }

    @FunctionalInterface
    public interface Constructor2<T1, T2, R> {
        R create(T1 first, T2 second) throws Exception;
    }

    @FunctionalInterface
    public interface Constructor3<T1, T2, T3, R> {
        R create(T1 first, T2 second, T3 third) throws Exception;
    }
}
