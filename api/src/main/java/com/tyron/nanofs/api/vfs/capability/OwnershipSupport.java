package com.tyron.nanofs.api.vfs.capability;

import com.tyron.nanofs.api.vfs.FilesystemException;
import com.tyron.nanofs.api.vfs.Pathname;

public interface OwnershipSupport extends AdapterCapability {

    String getOwner(Pathname pathname) throws FilesystemException;

    void setOwner(Pathname pathname, String owner) throws FilesystemException;

    String getGroup(Pathname pathname) throws FilesystemException;

    void setGroup(Pathname pathname, String group) throws FilesystemException;
}
