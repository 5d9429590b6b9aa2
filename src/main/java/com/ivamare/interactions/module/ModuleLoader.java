package com.ivamare.interactions.module;

import com.ivamare.interactions.exception.DuplicateRegistrationException;
import com.ivamare.interactions.exception.ModuleLoadException;
import com.ivamare.interactions.handler.HandlerRegistration;
import com.ivamare.interactions.handler.HandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads modules into a registry, all or nothing.
 *
 * <p>If any registration of a module conflicts with an existing one, the
 * registrations already applied for that module are removed again.
 */
public class ModuleLoader {

    private static final Logger log = LoggerFactory.getLogger(ModuleLoader.class);

    private final HandlerRegistry registry;
    private final Map<String, LoadedModule> loaded = new LinkedHashMap<>();

    public ModuleLoader(HandlerRegistry registry) {
        this.registry = registry;
    }

    /**
     * Load a module.
     *
     * @param module the module
     * @throws ModuleLoadException if a module with the same name is loaded or a
     *         registration conflicts with an existing handler
     */
    public synchronized void load(InteractionModule module) {
        String name = module.name();
        if (loaded.containsKey(name)) {
            throw new ModuleLoadException(name, "module already loaded");
        }

        ModuleRegistrar registrar = new ModuleRegistrar(name);
        module.register(registrar);

        List<HandlerRegistration> applied = new ArrayList<>();
        try {
            for (HandlerRegistration registration : registrar.registrations()) {
                registry.register(registration);
                applied.add(registration);
            }
        } catch (DuplicateRegistrationException e) {
            applied.forEach(registry::deregister);
            throw new ModuleLoadException(name, e.getMessage(), e);
        }

        loaded.put(name, new LoadedModule(module, List.copyOf(applied)));
        log.info("Loaded module {} with {} handlers", name, applied.size());
        module.onLoad();
    }

    /**
     * Unload a module and remove its registrations.
     *
     * @param name module name
     * @return true if the module was loaded
     */
    public synchronized boolean unload(String name) {
        LoadedModule module = loaded.remove(name);
        if (module == null) {
            return false;
        }
        module.registrations().forEach(registry::deregister);
        log.info("Unloaded module {}", name);
        module.module().onUnload();
        return true;
    }

    public synchronized void unloadAll() {
        new ArrayList<>(loaded.keySet()).forEach(this::unload);
    }

    public synchronized Set<String> loadedModules() {
        return Set.copyOf(loaded.keySet());
    }

    private record LoadedModule(InteractionModule module, List<HandlerRegistration> registrations) {}
}
