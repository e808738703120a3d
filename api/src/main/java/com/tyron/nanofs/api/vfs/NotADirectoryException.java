package com.tyron.nanofs.api.vfs;

public class NotADirectoryException extends FilesystemException {

    public NotADirectoryException(Pathname pathname) {
        super(Kind.NOT_A_DIRECTORY, pathname, "Pathname " + pathname + " is not a directory");
    }
}
