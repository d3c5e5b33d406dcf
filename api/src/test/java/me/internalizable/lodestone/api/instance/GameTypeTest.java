package me.internalizable.lodestone.api.instance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link GameType}.
 */
class GameTypeTest {

    @Test
    @DisplayName("parses snake, camel and kebab case")
    void parsesLeniently() {
        assertEquals(GameType.MINECRAFT_JAVA_VANILLA, GameType.fromString("minecraft_java_vanilla"));
        assertEquals(GameType.MINECRAFT_JAVA_VANILLA, GameType.fromString("MinecraftJavaVanilla"));
        assertEquals(GameType.MINECRAFT_PAPER, GameType.fromString("minecraft-paper"));
    }

    @Test
    @DisplayName("rejects unknown game types")
    void rejectsUnknown() {
        assertThrows(IllegalArgumentException.class, () -> GameType.fromString("terraria"));
    }

    @Test
    @DisplayName("exposes game and flavour")
    void exposesGameAndFlavour() {
        assertEquals("minecraft", GameType.MINECRAFT_FABRIC.getGame());
        assertEquals("fabric", GameType.MINECRAFT_FABRIC.getFlavour());
        assertEquals("vanilla", GameType.MINECRAFT_JAVA_VANILLA.getFlavour());
    }
}
