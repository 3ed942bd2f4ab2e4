package dev.fumaz.conduit.bind;

/**
 * Represents the lifecycle scope of a binding.
 */
public enum BindingScope {

    /**
     * A new instance for every resolution.
     */
    TRANSIENT,

    /**
     * One instance per injector, created lazily on first resolution.
     */
    INJECTOR_SINGLETON,

    /**
     * One instance per process, shared by every injector.
     */
    GLOBAL_SINGLETON;

    public boolean isCached() {
        return this != TRANSIENT;
    }
}
