package com.testbridge.module;

import com.testbridge.ModuleLoadException;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.jar.JarFile;

/**
 * A module jar that has been located and verified to be readable.
 *
 * @param path absolute, normalised path of the jar
 */
public record ModuleHandle(Path path) {

    private static final String CLASS_SUFFIX = ".class";

    public ModuleHandle {
        Objects.requireNonNull(path, "path");
    }

    /**
     * Verifies that a path names a readable jar and returns a handle for it.
     *
     * @param path the jar path
     * @param role description used in error messages, for example "Test module"
     * @return the handle
     * @throws ModuleLoadException if the file is missing, unreadable, or not a jar
     */
    public static ModuleHandle open(Path path, String role) {
        if (!Files.isRegularFile(path)) {
            throw new ModuleLoadException(role + " not found: " + path);
        }
        if (!Files.isReadable(path)) {
            throw new ModuleLoadException(role + " is not readable: " + path);
        }
        try (JarFile ignored = new JarFile(path.toFile())) {
            return new ModuleHandle(path);
        } catch (IOException e) {
            throw new ModuleLoadException(role + " could not be opened as a jar: " + path, e);
        }
    }

    /**
     * Returns the file name of the module.
     *
     * @return the file name
     */
    public String fileName() {
        return path.getFileName().toString();
    }

    /**
     * Returns the URL used to add this module to a class loader.
     *
     * @return the module URL
     */
    public URL toUrl() {
        try {
            return path.toUri().toURL();
        } catch (MalformedURLException e) {
            throw new ModuleLoadException("Module path cannot be expressed as a URL: " + path, e);
        }
    }

    /**
     * Checks whether the jar itself defines a type, without consulting any class loader.
     *
     * @param typeName the binary class name
     * @return true if the jar has an entry for the class
     */
    public boolean containsType(String typeName) {
        String entryName = typeName.replace('.', '/') + CLASS_SUFFIX;
        try (JarFile jar = new JarFile(path.toFile())) {
            return jar.getJarEntry(entryName) != null;
        } catch (IOException e) {
            throw new ModuleLoadException("Module could not be read: " + path, e);
        }
    }
}
