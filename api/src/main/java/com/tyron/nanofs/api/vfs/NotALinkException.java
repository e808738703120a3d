package com.tyron.nanofs.api.vfs;

public class NotALinkException extends FilesystemException {

    public NotALinkException(Pathname pathname) {
        super(Kind.NOT_A_LINK, pathname, "Pathname " + pathname + " is not a link");
    }
}
