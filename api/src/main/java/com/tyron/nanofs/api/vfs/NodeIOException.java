package com.tyron.nanofs.api.vfs;

import org.jetbrains.annotations.Nullable;

/**
 * The underlying storage or transport failed.
 */
public class NodeIOException extends FilesystemException {

    public NodeIOException(@Nullable Pathname pathname, String message) {
        super(Kind.IO_FAILURE, pathname, message);
    }

    public NodeIOException(@Nullable Pathname pathname, String message, @Nullable Throwable cause) {
        super(Kind.IO_FAILURE, pathname, message, cause);
    }
}
