package me.internalizable.lodestone.daemon.fs;

import me.internalizable.lodestone.api.error.ErrorKind;
import me.internalizable.lodestone.api.error.LodestoneException;

import javax.annotation.Nonnull;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Resolves user-supplied relative paths against a sandbox root.
 *
 * <p>Both {@code /} and {@code \} are treated as separators on every host so
 * that alternate separator syntax cannot be used to escape the root. The
 * resolved path is not required to exist.</p>
 */
public final class ScopedPaths {

    private ScopedPaths() {
    }

    /**
     * Join a relative path onto a root without leaving it.
     *
     * @param root sandbox root
     * @param relativePath user-supplied path
     * @return absolute, normalized path inside {@code root}
     * @throws LodestoneException with {@link ErrorKind#MALFORMED_PATH} if the path
     *         is absolute, malformed, or climbs above {@code root}
     */
    @Nonnull
    public static Path resolve(@Nonnull Path root, @Nonnull String relativePath) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(relativePath, "relativePath");

        if (relativePath.indexOf('\0') >= 0) {
            throw malformed("Path contains a NUL character");
        }

        String unified = relativePath.replace('\\', '/');
        if (unified.startsWith("/")) {
            throw malformed("Absolute paths are not allowed");
        }
        if (hasDrivePrefix(unified)) {
            throw malformed("Drive-qualified paths are not allowed");
        }

        Deque<String> segments = new ArrayDeque<>();
        for (String segment : unified.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (segments.isEmpty()) {
                    throw malformed("Path escapes the instance root");
                }
                segments.removeLast();
                continue;
            }
            // rejects drive letters mid-path and NTFS alternate data streams
            if (segment.indexOf(':') >= 0) {
                throw malformed("Path segment contains ':'");
            }
            segments.addLast(segment);
        }

        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path resolved = normalizedRoot;
        try {
            for (String segment : segments) {
                resolved = resolved.resolve(segment);
            }
        } catch (InvalidPathException e) {
            throw new LodestoneException(ErrorKind.MALFORMED_PATH, "Path is not valid on this host", e);
        }

        resolved = resolved.normalize();
        if (!resolved.startsWith(normalizedRoot)) {
            throw malformed("Path escapes the instance root");
        }
        return resolved;
    }

    /**
     * Express a path below {@code root} with {@code /} separators.
     *
     * @param root sandbox root
     * @param path path inside the root
     * @return relative path, empty for the root itself
     */
    @Nonnull
    public static String relativize(@Nonnull Path root, @Nonnull Path path) {
        Path relative = root.toAbsolutePath().normalize().relativize(path.toAbsolutePath().normalize());
        return relative.toString().replace('\\', '/');
    }

    private static boolean hasDrivePrefix(String path) {
        return path.length() >= 2 && Character.isLetter(path.charAt(0)) && path.charAt(1) == ':';
    }

    private static LodestoneException malformed(String detail) {
        return new LodestoneException(ErrorKind.MALFORMED_PATH, detail);
    }
}
