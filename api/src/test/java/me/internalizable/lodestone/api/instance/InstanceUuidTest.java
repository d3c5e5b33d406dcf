package me.internalizable.lodestone.api.instance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link InstanceUuid}.
 */
class InstanceUuidTest {

    @Test
    @DisplayName("short prefix is the first eight characters")
    void shortPrefixIsFirstEightCharacters() {
        InstanceUuid uuid = InstanceUuid.of("1a2b3c4d-0000-0000-0000-000000000000");
        assertEquals("1a2b3c4d", uuid.shortPrefix());
    }

    @Test
    @DisplayName("generated identities are distinct")
    void generatedIdentitiesAreDistinct() {
        Set<InstanceUuid> seen = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            assertTrue(seen.add(InstanceUuid.generate()));
        }
    }

    @Test
    @DisplayName("rejects values shorter than the short prefix")
    void rejectsShortValues() {
        assertThrows(IllegalArgumentException.class, () -> InstanceUuid.of("abc"));
        assertThrows(IllegalArgumentException.class, () -> InstanceUuid.of("   "));
    }

    @Test
    @DisplayName("equality is by value")
    void equalityIsByValue() {
        InstanceUuid a = InstanceUuid.of("1a2b3c4d-aaaa");
        InstanceUuid b = InstanceUuid.of(" 1a2b3c4d-aaaa ");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
