package com.testbridge.module;

import com.testbridge.PathResolutionException;
import com.testbridge.config.DriverConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Locates a test module and the framework module that sits next to it.
 * Both are verified to be readable jars; class loading is left to the executor.
 */
public class ModuleLoader {

    private static final Logger logger = LoggerFactory.getLogger(ModuleLoader.class);

    private final PathResolver pathResolver;
    private final String frameworkModuleName;

    public ModuleLoader(DriverConfig config) {
        this(config.getPathResolver(), config.getFrameworkModuleName());
    }

    public ModuleLoader(PathResolver pathResolver, String frameworkModuleName) {
        this.pathResolver = Objects.requireNonNull(pathResolver, "pathResolver");
        this.frameworkModuleName = Objects.requireNonNull(frameworkModuleName, "frameworkModuleName");
    }

    /**
     * Locates and verifies the test module and its framework module.
     *
     * @param targetLocation a path or file URI of the test module
     * @return handles for both modules
     * @throws PathResolutionException if the location is malformed
     * @throws com.testbridge.ModuleLoadException if either module is missing or unreadable
     */
    public LoadedModules load(String targetLocation) {
        Path targetPath = resolveTarget(targetLocation);
        ModuleHandle target = ModuleHandle.open(targetPath, "Test module");
        ModuleHandle framework = ModuleHandle.open(frameworkPathFor(targetPath), "Framework module");
        logger.debug("Located test module {} with framework {}", target.path(), framework.path());
        return new LoadedModules(target, framework);
    }

    /**
     * Resolves a location descriptor to an absolute, normalised path.
     *
     * @param targetLocation a path or file URI
     * @return the absolute path
     */
    public Path resolveTarget(String targetLocation) {
        String resolved = pathResolver.resolve(targetLocation);
        try {
            return Paths.get(resolved).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new PathResolutionException("Not a valid path: " + resolved, e);
        }
    }

    /**
     * Returns the expected location of the framework module for a test module.
     *
     * @param targetPath absolute path of the test module
     * @return the sibling framework module path
     */
    public Path frameworkPathFor(Path targetPath) {
        Path directory = targetPath.getParent();
        if (directory == null) {
            throw new PathResolutionException("Test module has no parent directory: " + targetPath);
        }
        return directory.resolve(frameworkModuleName);
    }

    public String getFrameworkModuleName() {
        return frameworkModuleName;
    }
}
