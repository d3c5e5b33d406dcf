package me.internalizable.lodestone.api.fs;

import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nonnull;

/**
 * An entry of an instance directory listing.
 *
 * @param name file name
 * @param path path relative to the instance root, {@code /}-separated
 * @param fileType entry kind
 * @param size size in bytes, 0 for directories
 * @param modificationTime last modification in epoch seconds
 */
public record FileEntry(
        @Nonnull String name,
        @Nonnull String path,
        @Nonnull @JsonProperty("file_type") FileType fileType,
        long size,
        @JsonProperty("modification_time") long modificationTime
) {}
