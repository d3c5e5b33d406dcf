package me.internalizable.lodestone.daemon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Command line entry point.
 *
 * <p>Usage: {@code lodestone-daemon [root]}. The root defaults to
 * {@code ./lodestone}.</p>
 */
public final class LodestoneBootstrap {

    private static final Logger LOGGER = LoggerFactory.getLogger(LodestoneBootstrap.class);

    private LodestoneBootstrap() {
    }

    public static void main(String[] args) {
        Path root = Path.of(args.length > 0 ? args[0] : "lodestone");
        LodestoneDaemon daemon = new LodestoneDaemon(root);

        try {
            daemon.initialize();
            daemon.start();
        } catch (Exception e) {
            LOGGER.error("Failed to start Lodestone daemon", e);
            daemon.shutdown();
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(daemon::shutdown, "Lodestone-Shutdown"));
        LOGGER.info("Lodestone daemon started");
    }
}
