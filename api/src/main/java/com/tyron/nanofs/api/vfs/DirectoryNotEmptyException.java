package com.tyron.nanofs.api.vfs;

/**
 * Raised by a non-recursive delete of a directory that still has entries.
 */
public class DirectoryNotEmptyException extends FilesystemException {

    public DirectoryNotEmptyException(Pathname pathname) {
        super(Kind.DIRECTORY_NOT_EMPTY, pathname, "Directory " + pathname + " is not empty");
    }
}
