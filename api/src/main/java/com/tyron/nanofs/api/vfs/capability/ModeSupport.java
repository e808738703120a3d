package com.tyron.nanofs.api.vfs.capability;

import com.tyron.nanofs.api.vfs.FilesystemException;
import com.tyron.nanofs.api.vfs.Pathname;

/**
 * POSIX permission bits, e.g. {@code 0644}.
 */
public interface ModeSupport extends AdapterCapability {

    int getMode(Pathname pathname) throws FilesystemException;

    void setMode(Pathname pathname, int mode) throws FilesystemException;
}
