package com.tyron.nanofs.api.vfs.capability;

import com.tyron.nanofs.api.vfs.FilesystemException;
import com.tyron.nanofs.api.vfs.Pathname;

import java.time.Instant;

/**
 * Writable timestamps. Reading them goes through {@code stat}.
 */
public interface TimestampSupport extends AdapterCapability {

    void setModifyTime(Pathname pathname, Instant time) throws FilesystemException;

    void setAccessTime(Pathname pathname, Instant time) throws FilesystemException;
}
