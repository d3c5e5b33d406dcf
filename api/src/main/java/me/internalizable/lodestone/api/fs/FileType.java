package me.internalizable.lodestone.api.fs;

/**
 * Kind of a directory entry.
 */
public enum FileType {
    FILE,
    DIRECTORY,
    UNKNOWN
}
