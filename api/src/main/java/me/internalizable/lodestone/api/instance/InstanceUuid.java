package me.internalizable.lodestone.api.instance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.UUID;

/**
 * Opaque, immutable identity of a managed instance.
 *
 * <p>The first {@value #SHORT_PREFIX_LENGTH} characters form the short prefix
 * that is embedded in the instance directory name, so no two live instances
 * may share it.</p>
 */
public final class InstanceUuid implements Comparable<InstanceUuid> {

    public static final int SHORT_PREFIX_LENGTH = 8;

    private final String value;

    private InstanceUuid(String value) {
        this.value = value;
    }

    /**
     * Generate a fresh random identity.
     *
     * @return new identity
     */
    @Nonnull
    public static InstanceUuid generate() {
        return new InstanceUuid(UUID.randomUUID().toString());
    }

    /**
     * Wrap an existing identity string.
     *
     * @param value identity string
     * @return the identity
     * @throws IllegalArgumentException if the value is blank or shorter than the short prefix
     */
    @Nonnull
    @JsonCreator
    public static InstanceUuid of(@Nonnull String value) {
        Objects.requireNonNull(value, "value");
        String trimmed = value.trim();
        if (trimmed.length() < SHORT_PREFIX_LENGTH) {
            throw new IllegalArgumentException("Invalid instance uuid: " + value);
        }
        return new InstanceUuid(trimmed);
    }

    /**
     * Get the short prefix used in directory names.
     *
     * @return first {@value #SHORT_PREFIX_LENGTH} characters
     */
    @Nonnull
    public String shortPrefix() {
        return value.substring(0, SHORT_PREFIX_LENGTH);
    }

    @Nonnull
    @JsonValue
    public String value() {
        return value;
    }

    @Override
    public int compareTo(@Nonnull InstanceUuid other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((InstanceUuid) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
