package me.internalizable.lodestone.daemon.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Spawns and terminates game server processes.
 *
 * <p>Console output of every process is captured to a log file and fanned out
 * to the process's line listeners.</p>
 */
public class ProcessManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessManager.class);

    private final Map<String, ManagedProcess> processes = new ConcurrentHashMap<>();
    private final Path logsDirectory;
    private final String javaPath;

    private volatile boolean shutdown = false;

    /**
     * Create a process manager.
     *
     * @param logsDirectory directory for console logs
     * @param javaPath path to the java executable
     */
    public ProcessManager(@Nonnull Path logsDirectory, @Nonnull String javaPath) {
        this.logsDirectory = Objects.requireNonNull(logsDirectory, "logsDirectory");
        this.javaPath = Objects.requireNonNull(javaPath, "javaPath");
    }

    /**
     * Initialize the process manager.
     *
     * @throws IOException if the logs directory cannot be created
     */
    public void initialize() throws IOException {
        Files.createDirectories(logsDirectory);
    }

    /**
     * Build the command line for a Java server.
     *
     * @param minRamMb initial heap in megabytes
     * @param maxRamMb maximum heap in megabytes
     * @param jvmArgs extra JVM arguments
     * @param serverJar jar relative to the working directory
     * @param serverArgs arguments passed to the server
     * @return the command
     */
    @Nonnull
    public List<String> javaCommand(int minRamMb, int maxRamMb, @Nonnull List<String> jvmArgs,
                                    @Nonnull String serverJar, @Nonnull List<String> serverArgs) {
        List<String> command = new ArrayList<>();
        command.add(javaPath);
        command.add("-Xms" + minRamMb + "M");
        command.add("-Xmx" + maxRamMb + "M");
        command.addAll(jvmArgs);
        command.add("-jar");
        command.add(serverJar);
        command.addAll(serverArgs);
        return command;
    }

    /**
     * Spawn a process.
     *
     * @param processId owner identifier, unique among live processes
     * @param workingDir working directory
     * @param command command line
     * @return the managed process
     * @throws IOException if spawning fails
     */
    @Nonnull
    public ManagedProcess spawn(@Nonnull String processId, @Nonnull Path workingDir,
                                @Nonnull List<String> command) throws IOException {
        Objects.requireNonNull(processId, "processId");
        Objects.requireNonNull(workingDir, "workingDir");
        Objects.requireNonNull(command, "command");

        ManagedProcess existing = processes.get(processId);
        if (existing != null && existing.isAlive()) {
            throw new IllegalStateException("Process already running for " + processId);
        }

        if (!Files.isDirectory(workingDir)) {
            throw new IOException("Working directory does not exist: " + workingDir);
        }

        LOGGER.info("Spawning process '{}' in {}", processId, workingDir);
        LOGGER.debug("Command: {}", String.join(" ", command));

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(workingDir.toFile());
        builder.redirectErrorStream(true);
        builder.environment().put("LODESTONE_INSTANCE_ID", processId);

        Process process = builder.start();

        Path logFile = logsDirectory.resolve(processId + ".log");
        ManagedProcess managed = new ManagedProcess(processId, process, logFile);
        processes.put(processId, managed);

        startLogCapture(managed);
        managed.onExit().thenAccept(p -> {
            processes.remove(processId, managed);
            LOGGER.info("Process '{}' exited with code {}", processId, p.exitValue());
        });

        LOGGER.info("Process '{}' started with PID {}", processId, process.pid());
        return managed;
    }

    private void startLogCapture(ManagedProcess managed) {
        Thread logThread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(managed.getProcess().getInputStream(), StandardCharsets.UTF_8));
                 BufferedWriter writer = Files.newBufferedWriter(managed.getLogFile(), StandardCharsets.UTF_8)) {

                String line;
                while ((line = reader.readLine()) != null) {
                    writer.write(line);
                    writer.newLine();
                    writer.flush();
                    managed.acceptLine(line);
                }
            } catch (IOException e) {
                if (!shutdown) {
                    LOGGER.error("Error capturing console of '{}': {}", managed.getProcessId(), e.getMessage());
                }
            }
        }, "LogCapture-" + managed.getProcessId());
        logThread.setDaemon(true);
        logThread.start();
    }

    /**
     * Stop a process, first by sending a stop command and then forcibly.
     *
     * @param processId owner identifier
     * @param stopCommand console command asking the server to stop, null to skip
     * @param timeoutSeconds how long to wait for a graceful exit
     * @return false if no such process exists
     */
    public boolean stopProcess(@Nonnull String processId, @Nullable String stopCommand, int timeoutSeconds) {
        Objects.requireNonNull(processId, "processId");

        ManagedProcess managed = processes.get(processId);
        if (managed == null) {
            LOGGER.warn("No process found for: {}", processId);
            return false;
        }

        Process process = managed.getProcess();
        if (!process.isAlive()) {
            processes.remove(processId, managed);
            return true;
        }

        LOGGER.info("Requesting graceful shutdown for '{}'", processId);
        try {
            if (stopCommand != null) {
                managed.sendCommand(stopCommand);
            } else {
                process.destroy();
            }
            if (process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                LOGGER.info("Process '{}' shut down gracefully", processId);
                processes.remove(processId, managed);
                return true;
            }
        } catch (IOException e) {
            LOGGER.warn("Could not send stop command to '{}': {}", processId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        LOGGER.warn("Process '{}' did not shut down gracefully, forcing...", processId);
        process.destroyForcibly();
        try {
            process.waitFor(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        processes.remove(processId, managed);
        LOGGER.info("Process '{}' forcibly terminated", processId);
        return true;
    }

    /**
     * Forcibly terminate every remaining process.
     */
    public void shutdown() {
        shutdown = true;
        LOGGER.info("Shutting down process manager...");

        for (ManagedProcess managed : new ArrayList<>(processes.values())) {
            if (managed.isAlive()) {
                LOGGER.warn("Killing leftover process '{}'", managed.getProcessId());
                managed.getProcess().destroyForcibly();
            }
        }
        processes.clear();

        LOGGER.info("Process manager shut down");
    }
}
