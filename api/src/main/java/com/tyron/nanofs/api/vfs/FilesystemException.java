package com.tyron.nanofs.api.vfs;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;

/**
 * Base of every failure raised by nodes, adapters and the listing engine.
 * <p>
 * Callers branch on {@link #getKind()} (or on the concrete subclass); a plain
 * {@code FilesystemException} is never thrown on its own.
 */
public abstract class FilesystemException extends IOException {

    public enum Kind {
        INVALID_PATH,
        NOT_FOUND,
        NOT_A_FILE,
        NOT_A_DIRECTORY,
        NOT_A_LINK,
        ALREADY_EXISTS,
        DIRECTORY_NOT_EMPTY,
        UNSUPPORTED,
        IO_FAILURE,
        CYCLIC_STRUCTURE,
        PARTIAL_OPERATION
    }

    private final Kind kind;
    private final Pathname pathname;

    protected FilesystemException(Kind kind, @Nullable Pathname pathname, String message) {
        this(kind, pathname, message, null);
    }

    protected FilesystemException(Kind kind, @Nullable Pathname pathname, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.pathname = pathname;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the pathname the failure is about, or null when it could not be parsed.
     */
    public @Nullable Pathname getPathname() {
        return pathname;
    }
}
