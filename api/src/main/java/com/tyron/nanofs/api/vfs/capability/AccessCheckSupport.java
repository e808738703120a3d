package com.tyron.nanofs.api.vfs.capability;

import com.tyron.nanofs.api.vfs.FilesystemException;
import com.tyron.nanofs.api.vfs.Pathname;

public interface AccessCheckSupport extends AdapterCapability {

    enum AccessMode {
        READ,
        WRITE,
        EXECUTE
    }

    boolean isAccessible(Pathname pathname, AccessMode mode) throws FilesystemException;
}
