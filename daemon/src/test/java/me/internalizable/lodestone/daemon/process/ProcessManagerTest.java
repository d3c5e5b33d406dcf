package me.internalizable.lodestone.daemon.process;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ProcessManager}.
 */
class ProcessManagerTest {

    @Test
    @DisplayName("builds the java command line")
    void buildsJavaCommand() {
        ProcessManager manager = new ProcessManager(Path.of("logs"), "/opt/java/bin/java");

        List<String> command = manager.javaCommand(1024, 4096, List.of("-XX:+UseG1GC"), "server.jar",
                List.of("nogui"));

        assertEquals(List.of("/opt/java/bin/java", "-Xms1024M", "-Xmx4096M", "-XX:+UseG1GC",
                "-jar", "server.jar", "nogui"), command);
    }

    @Test
    @DisplayName("stopping an unknown process reports false")
    void stopUnknown() {
        ProcessManager manager = new ProcessManager(Path.of("logs"), "java");
        assertFalse(manager.stopProcess("missing", "stop", 1));
    }
}
