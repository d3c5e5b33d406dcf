package me.internalizable.lodestone.daemon.process;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * A running game server process.
 *
 * <p>Wraps a Java {@link Process} with console listeners
 * and a stdin channel for server commands.</p>
 */
public class ManagedProcess {

    private final String processId;
    private final Process process;
    private final Path logFile;
    private final List<Consumer<String>> lineListeners = new CopyOnWriteArrayList<>();

    /**
     * Create a managed process.
     *
     * @param processId owner identifier, usually the instance uuid
     * @param process the Java process
     * @param logFile console log file
     */
    public ManagedProcess(
            @Nonnull String processId,
            @Nonnull Process process,
            @Nonnull Path logFile) {
        this.processId = Objects.requireNonNull(processId, "processId");
        this.process = Objects.requireNonNull(process, "process");
        this.logFile = Objects.requireNonNull(logFile, "logFile");
    }

    @Nonnull
    public String getProcessId() {
        return processId;
    }

    public long getPid() {
        return process.pid();
    }

    @Nonnull
    public Path getLogFile() {
        return logFile;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /**
     * Completes when the process exits.
     *
     * @return exit future
     */
    @Nonnull
    public CompletableFuture<Process> onExit() {
        return process.onExit();
    }

    Process getProcess() {
        return process;
    }

    // ==================== Console ====================

    /**
     * Register a listener called for every console line.
     *
     * <p>Called on the log capture thread; listeners must not block.</p>
     *
     * @param listener line listener
     */
    public void addLineListener(@Nonnull Consumer<String> listener) {
        lineListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Write a command line to the process's stdin.
     *
     * @param command command without trailing newline
     * @throws IOException if the process is gone or stdin is closed
     */
    public synchronized void sendCommand(@Nonnull String command) throws IOException {
        if (!process.isAlive()) {
            throw new IOException("Process " + processId + " is not running");
        }
        OutputStream stdin = process.getOutputStream();
        stdin.write((command + "\n").getBytes(StandardCharsets.UTF_8));
        stdin.flush();
    }

    void acceptLine(@Nonnull String line) {
        for (Consumer<String> listener : lineListeners) {
            listener.accept(line);
        }
    }

    @Override
    public String toString() {
        return "ManagedProcess{" +
                "processId='" + processId + '\'' +
                ", pid=" + getPid() +
                ", alive=" + isAlive() +
                '}';
    }
}
