package com.tyron.nanofs.api.vfs;

/**
 * A node was used after its owning {@link Filesystem} was closed.
 */
public class FilesystemClosedException extends NodeIOException {

    public FilesystemClosedException(Pathname pathname) {
        super(pathname, "Filesystem owning " + pathname + " is closed");
    }
}
