package com.tyron.nanofs.api.vfs;

/**
 * What an entity is, as reported by its adapter. Links are reported as {@link #LINK},
 * never as the type of their target.
 */
public enum NodeType {
    FILE,
    DIRECTORY,
    LINK,
    UNKNOWN
}
