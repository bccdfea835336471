package com.testbridge.module;

import java.net.URL;
import java.util.Objects;

/**
 * The test module together with the framework module it was built against.
 *
 * @param target the test module
 * @param framework the companion framework module
 */
public record LoadedModules(ModuleHandle target, ModuleHandle framework) {

    public LoadedModules {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(framework, "framework");
    }

    /**
     * Returns the class path for an execution context, test module first.
     *
     * @return the module URLs
     */
    public URL[] urls() {
        return new URL[] { target.toUrl(), framework.toUrl() };
    }
}
