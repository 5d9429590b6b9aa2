package com.ivamare.interactions.module;

/**
 * A named group of handler registrations that is loaded and unloaded as a unit.
 *
 * <p>Declare implementations as Spring beans to have them loaded at startup, or
 * load them manually through {@link ModuleLoader}.
 */
public interface InteractionModule {

    /**
     * @return unique module name
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Declare the module's handlers.
     *
     * @param registrar collector for registrations
     */
    void register(ModuleRegistrar registrar);

    /**
     * Called after all registrations of the module are active.
     */
    default void onLoad() {
    }

    /**
     * Called after the module's registrations were removed.
     */
    default void onUnload() {
    }
}
