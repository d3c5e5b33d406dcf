package me.internalizable.lodestone.daemon;

import me.internalizable.lodestone.api.LodestoneAPI;
import me.internalizable.lodestone.api.instance.GameType;
import me.internalizable.lodestone.api.instance.InstanceInfo;
import me.internalizable.lodestone.api.instance.InstanceUuid;
import me.internalizable.lodestone.daemon.auth.UserPermission;
import me.internalizable.lodestone.daemon.config.DaemonConfig;
import me.internalizable.lodestone.daemon.event.EventSubscription;
import me.internalizable.lodestone.daemon.event.ProgressionEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for {@link LodestoneDaemon} without a running HTTP listener.
 */
class LodestoneDaemonTest {

    @TempDir
    Path root;

    private LodestoneDaemon initialize() throws Exception {
        LodestoneDaemon daemon = new LodestoneDaemon(root);
        daemon.initialize();
        return daemon;
    }

    @Test
    @DisplayName("first start writes config, users and the instances directory")
    void firstStart() throws Exception {
        LodestoneDaemon daemon = initialize();
        try {
            assertTrue(daemon.isInitialized());
            assertEquals(root.toAbsolutePath().normalize(), daemon.getRoot());
            assertEquals(16662, daemon.getConfig().getHttp().getPort());
            assertEquals(16662, daemon.getHttpServer().getPort());
            assertTrue(Files.exists(root.resolve(DaemonConfig.FILE_NAME)));
            assertTrue(Files.exists(root.resolve("users.yml")));
            assertTrue(Files.isDirectory(root.resolve("instances")));
            assertEquals(1, daemon.getUserStore().getUserCount());
            assertEquals(0, daemon.getRegistry().size());
        } finally {
            daemon.shutdown();
        }
    }

    @Test
    @DisplayName("created instances survive a restart")
    void instancesSurviveRestart() throws Exception {
        LodestoneDaemon daemon = initialize();
        InstanceUuid uuid;
        try {
            daemon.getUserStore().addUser("tester", "tester-token", true, false, new UserPermission());
            LodestoneAPI api = daemon.getApi();

            try (EventSubscription subscription = daemon.getEventBroadcaster().subscribe()) {
                uuid = api.createInstance("tester-token", GameType.MINECRAFT_JAVA_VANILLA,
                        Map.of("name", "survival", "port", 25565));
                awaitEnd(subscription);
            }
            awaitRegistered(daemon, uuid);

            List<InstanceInfo> listed = api.listInstances("tester-token");
            assertEquals(1, listed.size());
            assertEquals(uuid, listed.get(0).uuid());
            assertEquals("eula=true\n", api.readInstanceFile("tester-token", uuid, "eula.txt"));
        } finally {
            daemon.shutdown();
        }

        LodestoneDaemon restarted = initialize();
        try {
            assertTrue(restarted.getRegistry().contains(uuid));
            assertEquals("survival", restarted.getApi().getInstanceInfo("tester-token", uuid).name());
        } finally {
            restarted.shutdown();
        }
    }

    private static void awaitRegistered(LodestoneDaemon daemon, InstanceUuid uuid) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!daemon.getRegistry().contains(uuid)) {
            if (System.nanoTime() > deadline) {
                fail("Instance was never registered");
            }
            Thread.sleep(20);
        }
    }

    private static void awaitEnd(EventSubscription subscription) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (System.nanoTime() < deadline) {
            ProgressionEvent event = subscription.poll(100, TimeUnit.MILLISECONDS);
            if (event != null && event.phase() == ProgressionEvent.Phase.END) {
                assertEquals(Boolean.TRUE, event.success(), event.message());
                return;
            }
        }
        fail("Provisioning did not finish");
    }
}
