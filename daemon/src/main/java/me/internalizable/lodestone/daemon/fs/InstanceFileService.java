package me.internalizable.lodestone.daemon.fs;

import me.internalizable.lodestone.api.error.ErrorKind;
import me.internalizable.lodestone.api.error.LodestoneException;
import me.internalizable.lodestone.api.fs.FileEntry;
import me.internalizable.lodestone.api.fs.FileType;
import me.internalizable.lodestone.api.instance.InstanceHandle;
import me.internalizable.lodestone.api.instance.InstanceUuid;
import me.internalizable.lodestone.daemon.auth.User;
import me.internalizable.lodestone.daemon.auth.UserAction;
import me.internalizable.lodestone.daemon.instance.InstanceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * File operations inside instance directories.
 *
 * <p>Every operation checks the requester's file permission for the instance,
 * looks up the instance root and confines the requested path to it. Writes
 * and removals refuse protected files and the root itself. There is no
 * per-file locking; the last write wins.</p>
 */
public class InstanceFileService {

    private static final Logger LOGGER = LoggerFactory.getLogger(InstanceFileService.class);

    private final InstanceRegistry registry;

    public InstanceFileService(@Nonnull InstanceRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    // ==================== Read Operations ====================

    /**
     * List a directory.
     *
     * @param requester authenticated requester
     * @param uuid instance identity
     * @param relativePath directory relative to the instance root
     * @return entries sorted by name
     */
    @Nonnull
    public List<FileEntry> listFiles(@Nonnull User requester, @Nonnull InstanceUuid uuid,
                                     @Nonnull String relativePath) {
        Path root = authorizeAndLocate(requester, UserAction.readInstanceFile(uuid), uuid);
        Path directory = ScopedPaths.resolve(root, relativePath);
        if (!Files.isDirectory(directory)) {
            throw LodestoneException.notFound("Path is not a directory");
        }

        List<FileEntry> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path child : stream) {
                entries.add(toEntry(root, child));
            }
        } catch (IOException e) {
            throw LodestoneException.ioFailure("Failed to list directory", e);
        }
        entries.sort(Comparator.comparing(FileEntry::name));
        return entries;
    }

    private static FileEntry toEntry(Path root, Path child) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(child, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        FileType type;
        if (attrs.isDirectory()) {
            type = FileType.DIRECTORY;
        } else if (attrs.isRegularFile()) {
            type = FileType.FILE;
        } else {
            type = FileType.UNKNOWN;
        }
        return new FileEntry(
                child.getFileName().toString(),
                ScopedPaths.relativize(root, child),
                type,
                attrs.isDirectory() ? 0 : attrs.size(),
                attrs.lastModifiedTime().toMillis() / 1000);
    }

    /**
     * Read a UTF-8 text file.
     *
     * @param requester authenticated requester
     * @param uuid instance identity
     * @param relativePath file relative to the instance root
     * @return file content
     */
    @Nonnull
    public String readFile(@Nonnull User requester, @Nonnull InstanceUuid uuid, @Nonnull String relativePath) {
        Path root = authorizeAndLocate(requester, UserAction.readInstanceFile(uuid), uuid);
        Path file = ScopedPaths.resolve(root, relativePath);
        if (!Files.isRegularFile(file)) {
            throw LodestoneException.badRequest("Path is not a file");
        }

        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw LodestoneException.ioFailure("Failed to read file", e);
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new LodestoneException(ErrorKind.BAD_REQUEST,
                    "You may only view/edit text files encoded in UTF-8.", e);
        }
    }

    // ==================== Write Operations ====================

    /**
     * Create or overwrite a file.
     *
     * @param requester authenticated requester
     * @param uuid instance identity
     * @param relativePath file relative to the instance root
     * @param content new content
     */
    public void writeFile(@Nonnull User requester, @Nonnull InstanceUuid uuid, @Nonnull String relativePath,
                          @Nonnull byte[] content) {
        Objects.requireNonNull(content, "content");
        Path root = authorizeAndLocate(requester, UserAction.writeInstanceFile(uuid), uuid);
        Path file = ScopedPaths.resolve(root, relativePath);
        requireModifiable(root, file);

        try {
            Files.write(file, content);
        } catch (IOException e) {
            throw LodestoneException.ioFailure("Failed to write file", e);
        }
        LOGGER.debug("{} wrote {} bytes to {} in instance {}", requester.getUsername(), content.length,
                relativePath, uuid);
    }

    /**
     * Create a directory and any missing parents.
     *
     * @param requester authenticated requester
     * @param uuid instance identity
     * @param relativePath directory relative to the instance root
     */
    public void makeDirectory(@Nonnull User requester, @Nonnull InstanceUuid uuid, @Nonnull String relativePath) {
        Path root = authorizeAndLocate(requester, UserAction.writeInstanceFile(uuid), uuid);
        Path directory = ScopedPaths.resolve(root, relativePath);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw LodestoneException.ioFailure("Failed to create directory", e);
        }
    }

    /**
     * Remove a file, or a directory with everything below it.
     *
     * @param requester authenticated requester
     * @param uuid instance identity
     * @param relativePath path relative to the instance root
     */
    public void removeFile(@Nonnull User requester, @Nonnull InstanceUuid uuid, @Nonnull String relativePath) {
        Path root = authorizeAndLocate(requester, UserAction.writeInstanceFile(uuid), uuid);
        Path target = ScopedPaths.resolve(root, relativePath);
        requireModifiable(root, target);
        if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            throw LodestoneException.notFound("Path does not exist");
        }

        try {
            FileTrees.deleteRecursively(target);
        } catch (IOException e) {
            throw LodestoneException.ioFailure("Failed to remove path", e);
        }
        LOGGER.debug("{} removed {} in instance {}", requester.getUsername(), relativePath, uuid);
    }

    // ==================== Helpers ====================

    private Path authorizeAndLocate(User requester, UserAction action, InstanceUuid uuid) {
        if (!requester.canPerform(action)) {
            throw new LodestoneException(ErrorKind.FORBIDDEN, "Not authorized to access instance files");
        }
        return registry.inspect(uuid, InstanceHandle::getPath)
                .orElseThrow(() -> LodestoneException.notFound("Instance not found"))
                .toAbsolutePath()
                .normalize();
    }

    private static void requireModifiable(Path root, Path target) {
        if (target.equals(root) || ProtectedFiles.isProtected(target)) {
            throw new LodestoneException(ErrorKind.PROTECTED_RESOURCE, "Cannot modify protected file");
        }
    }
}
