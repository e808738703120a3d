package com.tyron.nanofs.api.vfs;

public class NotAFileException extends FilesystemException {

    public NotAFileException(Pathname pathname) {
        super(Kind.NOT_A_FILE, pathname, "Pathname " + pathname + " is not a file");
    }
}
