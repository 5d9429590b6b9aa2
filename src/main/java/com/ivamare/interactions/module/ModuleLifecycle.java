package com.ivamare.interactions.module;

import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.SmartInitializingSingleton;

import java.util.List;

/**
 * Loads every {@link InteractionModule} bean once the context is initialized and
 * unloads them on shutdown.
 */
public class ModuleLifecycle implements SmartInitializingSingleton, DisposableBean {

    private final ModuleLoader loader;
    private final List<InteractionModule> modules;

    public ModuleLifecycle(ModuleLoader loader, List<InteractionModule> modules) {
        this.loader = loader;
        this.modules = modules;
    }

    @Override
    public void afterSingletonsInstantiated() {
        modules.forEach(loader::load);
    }

    @Override
    public void destroy() {
        loader.unloadAll();
    }
}
