package com.tyron.nanofs.api.vfs;

/**
 * The adapter behind a node does not advertise the capability an operation needs,
 * or the operation is undefined for the node's type (e.g. hashing a directory).
 */
public class UnsupportedCapabilityException extends FilesystemException {

    private final String capability;

    public UnsupportedCapabilityException(Pathname pathname, String capability) {
        super(Kind.UNSUPPORTED, pathname, capability + " is not supported for " + pathname);
        this.capability = capability;
    }

    public String getCapability() {
        return capability;
    }
}
