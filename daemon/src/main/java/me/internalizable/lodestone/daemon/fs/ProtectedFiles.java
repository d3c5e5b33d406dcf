package me.internalizable.lodestone.daemon.fs;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Deny-list of file types that may never be written or removed through the
 * file API, even by an authorized user.
 *
 * <p>A file without an extension is protected as well.</p>
 */
public final class ProtectedFiles {

    private static final Set<String> PROTECTED_EXTENSIONS = Set.of(
            "jar",
            "lua",
            "sh",
            "exe",
            "bat",
            "cmd",
            "msi",
            "lodestone_config",
            "out",
            "inf"
    );

    private ProtectedFiles() {
    }

    /**
     * Check whether the file at {@code path} is protected.
     *
     * @param path file path
     * @return true if the path must not be modified
     */
    public static boolean isProtected(@Nonnull Path path) {
        Path fileName = path.getFileName();
        return fileName == null || isProtected(fileName.toString());
    }

    /**
     * Check whether a file name is protected.
     *
     * @param fileName bare file name
     * @return true if the extension is deny-listed or missing
     */
    public static boolean isProtected(@Nonnull String fileName) {
        int dot = fileName.lastIndexOf('.');
        // dot-files and trailing dots have no extension
        if (dot <= 0 || dot == fileName.length() - 1) {
            return true;
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return PROTECTED_EXTENSIONS.contains(extension);
    }
}
