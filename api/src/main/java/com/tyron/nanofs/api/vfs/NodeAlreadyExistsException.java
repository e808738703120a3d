package com.tyron.nanofs.api.vfs;

public class NodeAlreadyExistsException extends FilesystemException {

    public NodeAlreadyExistsException(Pathname pathname) {
        super(Kind.ALREADY_EXISTS, pathname, "Pathname " + pathname + " already exists");
    }
}
