package com.testbridge.module;

import com.testbridge.PathResolutionException;

/**
 * Resolves file-scheme URIs to filesystem paths, passing plain paths through unchanged.
 *
 * <p>Handles the platform quirks of file URIs:
 * <ul>
 *   <li>{@code file:///C:/dir/test.jar} becomes {@code C:/dir/test.jar}</li>
 *   <li>{@code file:///home/me/test.jar} becomes {@code /home/me/test.jar}</li>
 *   <li>{@code file://server/share/test.jar} becomes {@code //server/share/test.jar}</li>
 *   <li>{@code file:/home/me/test.jar}, as produced by {@link java.io.File#toURI()},
 *       becomes {@code /home/me/test.jar}</li>
 * </ul>
 * Percent-escapes are left as they are.
 */
public class FileUriPathResolver implements PathResolver {

    private static final String FILE_SCHEME = "file:";
    private static final String AUTHORITY_PREFIX = "//";

    @Override
    public String resolve(String locationDescriptor) {
        if (locationDescriptor == null) {
            throw new PathResolutionException("Location descriptor must not be null");
        }
        if (!isFileUri(locationDescriptor)) {
            return locationDescriptor;
        }

        String remainder = locationDescriptor.substring(FILE_SCHEME.length());
        boolean hasAuthority = remainder.startsWith(AUTHORITY_PREFIX);
        if (hasAuthority) {
            // Skip over the scheme delimiter
            remainder = remainder.substring(AUTHORITY_PREFIX.length());
        }
        if (remainder.isEmpty()) {
            throw new PathResolutionException("File URI has no path: " + locationDescriptor);
        }

        if (remainder.charAt(0) == '/') {
            // A third slash means a local path; drop it only in front of a drive letter
            return hasDriveSpec(remainder, 1) ? remainder.substring(1) : remainder;
        }
        if (hasAuthority && !hasDriveSpec(remainder, 0)) {
            // Share name: back up to include two slashes
            return AUTHORITY_PREFIX + remainder;
        }
        return remainder;
    }

    private static boolean isFileUri(String descriptor) {
        return descriptor.regionMatches(true, 0, FILE_SCHEME, 0, FILE_SCHEME.length());
    }

    private static boolean hasDriveSpec(String path, int index) {
        return path.length() > index + 1
                && Character.isLetter(path.charAt(index))
                && path.charAt(index + 1) == ':';
    }
}
