package com.tyron.nanofs.api.vfs.capability;

import com.tyron.nanofs.api.vfs.FilesystemException;
import com.tyron.nanofs.api.vfs.Pathname;

public interface TruncateSupport extends AdapterCapability {

    void truncate(Pathname pathname, long size) throws FilesystemException;
}
