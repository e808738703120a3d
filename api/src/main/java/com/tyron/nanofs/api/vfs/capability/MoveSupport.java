package com.tyron.nanofs.api.vfs.capability;

import com.tyron.nanofs.api.vfs.FilesystemException;
import com.tyron.nanofs.api.vfs.Pathname;

/**
 * Native rename within one adapter. Without it, nodes move by copy and delete.
 */
public interface MoveSupport extends AdapterCapability {

    /**
     * @param target must not exist yet; its parent must
     */
    void move(Pathname source, Pathname target) throws FilesystemException;
}
