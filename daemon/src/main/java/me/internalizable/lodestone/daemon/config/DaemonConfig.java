package me.internalizable.lodestone.daemon.config;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.nodes.Tag;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Configuration of the Lodestone daemon.
 *
 * <p>Loaded from {@code lodestone.yml} in the daemon root. Relative paths
 * resolve against the daemon root.</p>
 */
public class DaemonConfig {

    public static final String FILE_NAME = "lodestone.yml";

    private String instancesDirectory = "instances";
    private String usersFile = "users.yml";
    private String logsDirectory = "logs";
    private HttpConfig http = new HttpConfig();
    private EventsConfig events = new EventsConfig();
    private ProcessConfig process = new ProcessConfig();

    /**
     * Load configuration from file, creating default if not exists.
     *
     * @param path path to config file
     * @return loaded configuration
     * @throws IOException if loading fails
     */
    @Nonnull
    public static DaemonConfig load(@Nonnull Path path) throws IOException {
        if (!Files.exists(path)) {
            DaemonConfig config = new DaemonConfig();
            config.save(path);
            return config;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(DaemonConfig.class, options));
        try (InputStream is = Files.newInputStream(path)) {
            DaemonConfig config = yaml.load(is);
            return config != null ? config : new DaemonConfig();
        }
    }

    /**
     * Save configuration to file.
     *
     * @param path path to save to
     * @throws IOException if saving fails
     */
    public void save(@Nonnull Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Yaml yaml = new Yaml(dumperOptions);
        Files.writeString(path, yaml.dumpAs(this, Tag.MAP, DumperOptions.FlowStyle.BLOCK), StandardCharsets.UTF_8);
    }

    /**
     * Resolve a configured path against the daemon root.
     *
     * @param root daemon root
     * @param configured configured path
     * @return absolute path
     */
    @Nonnull
    public static Path resolve(@Nonnull Path root, @Nonnull String configured) {
        return root.resolve(configured).toAbsolutePath().normalize();
    }

    // Getters and Setters

    public String getInstancesDirectory() {
        return instancesDirectory;
    }

    public void setInstancesDirectory(String instancesDirectory) {
        this.instancesDirectory = instancesDirectory;
    }

    public String getUsersFile() {
        return usersFile;
    }

    public void setUsersFile(String usersFile) {
        this.usersFile = usersFile;
    }

    public String getLogsDirectory() {
        return logsDirectory;
    }

    public void setLogsDirectory(String logsDirectory) {
        this.logsDirectory = logsDirectory;
    }

    public HttpConfig getHttp() {
        return http;
    }

    public void setHttp(HttpConfig http) {
        this.http = http != null ? http : new HttpConfig();
    }

    public EventsConfig getEvents() {
        return events;
    }

    public void setEvents(EventsConfig events) {
        this.events = events != null ? events : new EventsConfig();
    }

    public ProcessConfig getProcess() {
        return process;
    }

    public void setProcess(ProcessConfig process) {
        this.process = process != null ? process : new ProcessConfig();
    }

    /**
     * HTTP listener settings.
     */
    public static class HttpConfig {
        private String host = "0.0.0.0";
        private int port = 16662;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }
    }

    /**
     * Event delivery settings.
     */
    public static class EventsConfig {
        private int subscriberBufferCapacity = 512;

        public int getSubscriberBufferCapacity() {
            return subscriberBufferCapacity;
        }

        public void setSubscriberBufferCapacity(int subscriberBufferCapacity) {
            this.subscriberBufferCapacity = subscriberBufferCapacity;
        }
    }

    /**
     * Game server process settings.
     */
    public static class ProcessConfig {
        private String javaPath = "java";
        private int gracefulStopTimeoutSeconds = 30;

        public String getJavaPath() {
            return javaPath;
        }

        public void setJavaPath(String javaPath) {
            this.javaPath = javaPath;
        }

        public int getGracefulStopTimeoutSeconds() {
            return gracefulStopTimeoutSeconds;
        }

        public void setGracefulStopTimeoutSeconds(int gracefulStopTimeoutSeconds) {
            this.gracefulStopTimeoutSeconds = gracefulStopTimeoutSeconds;
        }
    }
}
