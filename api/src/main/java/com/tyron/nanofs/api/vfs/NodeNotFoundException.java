package com.tyron.nanofs.api.vfs;

public class NodeNotFoundException extends FilesystemException {

    public NodeNotFoundException(Pathname pathname) {
        super(Kind.NOT_FOUND, pathname, "Pathname " + pathname + " does not exist");
    }
}
