package com.testbridge.driver;

import com.testbridge.DriverException;
import com.testbridge.FrameworkDriver;
import com.testbridge.config.DriverConfig;
import com.testbridge.module.ModuleLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Creates drivers for test modules built against the framework this driver understands.
 * A module qualifies when the framework jar sits next to it.
 */
public class FrameworkDriverFactory {

    private static final Logger logger = LoggerFactory.getLogger(FrameworkDriverFactory.class);

    private final DriverConfig config;
    private final ModuleLoader moduleLoader;

    public FrameworkDriverFactory() {
        this(new DriverConfig());
    }

    public FrameworkDriverFactory(DriverConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.moduleLoader = new ModuleLoader(config);
    }

    /**
     * Checks whether a test module can be driven by drivers from this factory.
     *
     * @param targetLocation a path or file URI of the test module
     * @return true if the framework module is present next to it
     */
    public boolean isSupported(String targetLocation) {
        try {
            Path target = moduleLoader.resolveTarget(targetLocation);
            return Files.isRegularFile(moduleLoader.frameworkPathFor(target));
        } catch (DriverException e) {
            logger.debug("Cannot resolve {}: {}", targetLocation, e.getMessage());
            return false;
        }
    }

    /**
     * Creates a driver whose test identifiers are prefixed with an ID.
     *
     * @param id the ID, or null for unprefixed identifiers
     * @return a new driver in the unloaded state
     */
    public FrameworkDriver createDriver(String id) {
        String name = id == null || id.isEmpty()
                ? DefaultFrameworkDriver.class.getName()
                : DefaultFrameworkDriver.class.getName() + "." + id;
        DefaultFrameworkDriver driver = new DefaultFrameworkDriver(config, LoggerFactory.getLogger(name));
        driver.setId(id);
        logger.debug("Created {} driver with ID '{}'", config.getExecutionStrategy(), driver.getId());
        return driver;
    }

    public DriverConfig getConfig() {
        return config;
    }
}
