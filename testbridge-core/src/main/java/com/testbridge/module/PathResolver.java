package com.testbridge.module;

/**
 * Converts a module location descriptor into a filesystem path.
 * A descriptor is either a plain path or a file URI.
 */
@FunctionalInterface
public interface PathResolver {

    /**
     * Resolves a location descriptor.
     *
     * @param locationDescriptor a plain path or a file-scheme URI
     * @return the filesystem path
     * @throws com.testbridge.PathResolutionException if the descriptor is malformed
     */
    String resolve(String locationDescriptor);
}
