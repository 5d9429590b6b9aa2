package com.ivamare.interactions.module;

import com.ivamare.interactions.handler.HandlerRegistration;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collects the registrations a module declares before they are applied to the registry.
 */
public class ModuleRegistrar {

    private final String moduleName;
    private final List<HandlerRegistration> registrations = new ArrayList<>();

    ModuleRegistrar(String moduleName) {
        this.moduleName = moduleName;
    }

    public String moduleName() {
        return moduleName;
    }

    public ModuleRegistrar add(HandlerRegistration registration) {
        registrations.add(Objects.requireNonNull(registration, "registration"));
        return this;
    }

    public ModuleRegistrar add(HandlerRegistration.Builder builder) {
        return add(builder.build());
    }

    List<HandlerRegistration> registrations() {
        return List.copyOf(registrations);
    }
}
