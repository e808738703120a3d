package com.tyron.nanofs.api.vfs;

import java.io.Closeable;

/**
 * Represents a storage backend (e.g., Local Disk, ZIP file, FTP, Memory) rooted at one
 * {@link Adapter}. It is the only producer of {@link Node}s for its tree.
 */
public interface Filesystem extends Closeable {

    PathConventions getConventions();

    Adapter getAdapter() throws FilesystemClosedException;

    /**
     * Parses a raw path string with this filesystem's conventions.
     */
    Pathname parse(String raw) throws InvalidPathnameException;

    Node getRoot();

    Node getNode(String path) throws InvalidPathnameException;

    Node getNode(Pathname pathname);

    boolean isClosed();

    /**
     * Releases the adapter. Nodes produced earlier stay usable as objects but every
     * operation on them fails with {@link FilesystemClosedException}.
     */
    @Override
    void close();
}
