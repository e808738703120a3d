package com.tyron.nanofs.api.vfs;

import java.util.Objects;

/**
 * One entry of {@link Adapter#readDirectory(Pathname)}.
 *
 * @param name     the basename of the child
 * @param typeHint what the adapter saw while enumerating; nodes re-stat before trusting it
 */
public record DirectoryEntry(String name, NodeType typeHint) {

    public DirectoryEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(typeHint, "typeHint");
    }
}
