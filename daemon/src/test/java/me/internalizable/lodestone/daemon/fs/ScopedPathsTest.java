package me.internalizable.lodestone.daemon.fs;

import me.internalizable.lodestone.api.error.ErrorKind;
import me.internalizable.lodestone.api.error.LodestoneException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ScopedPaths}.
 */
class ScopedPathsTest {

    @TempDir
    Path root;

    @Nested
    @DisplayName("accepted paths")
    class Accepted {

        @Test
        @DisplayName("joins nested segments")
        void joinsNestedSegments() {
            assertEquals(root.toAbsolutePath().normalize().resolve("a").resolve("b").resolve("c"),
                    ScopedPaths.resolve(root, "a/b/c"));
        }

        @Test
        @DisplayName("treats backslashes as separators")
        void backslashesAreSeparators() {
            assertEquals(ScopedPaths.resolve(root, "world/region"), ScopedPaths.resolve(root, "world\\region"));
        }

        @Test
        @DisplayName("empty path resolves to the root")
        void emptyPathIsRoot() {
            assertEquals(root.toAbsolutePath().normalize(), ScopedPaths.resolve(root, ""));
            assertEquals(root.toAbsolutePath().normalize(), ScopedPaths.resolve(root, "./."));
        }

        @Test
        @DisplayName("parent segments inside the root are folded")
        void parentSegmentsInsideRoot() {
            assertEquals(ScopedPaths.resolve(root, "a/c"), ScopedPaths.resolve(root, "a/b/../c"));
        }

        @Test
        @DisplayName("does not require the target to exist")
        void targetNeedNotExist() {
            Path resolved = ScopedPaths.resolve(root, "does/not/exist.txt");
            assertTrue(resolved.startsWith(root.toAbsolutePath().normalize()));
        }
    }

    @Nested
    @DisplayName("rejected paths")
    class Rejected {

        @ParameterizedTest
        @ValueSource(strings = {"../../etc/passwd", "..\\..\\secret", "a/../..", "..", "/etc/passwd",
                "\\windows", "C:\\Windows", "c:/temp", "file.txt:stream", "bad\0name"})
        @DisplayName("escapes and absolute paths fail with MALFORMED_PATH")
        void rejectsEscapes(String path) {
            LodestoneException e = assertThrows(LodestoneException.class, () -> ScopedPaths.resolve(root, path));
            assertEquals(ErrorKind.MALFORMED_PATH, e.getKind());
        }
    }

    @Test
    @DisplayName("relativize uses forward slashes")
    void relativizeUsesForwardSlashes() {
        Path nested = ScopedPaths.resolve(root, "world/region/r.0.0.mca");
        assertEquals("world/region/r.0.0.mca", ScopedPaths.relativize(root, nested));
    }
}
