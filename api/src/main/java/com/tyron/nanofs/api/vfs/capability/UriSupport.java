package com.tyron.nanofs.api.vfs.capability;

import com.tyron.nanofs.api.vfs.FilesystemException;
import com.tyron.nanofs.api.vfs.Pathname;

import java.net.URI;

/**
 * @see com.tyron.nanofs.api.vfs.Node#toUri()
 */
public interface UriSupport extends AdapterCapability {

    /**
     * @return a URI naming the entity, e.g. {@code mem://scratch/notes/todo.txt}
     */
    URI toUri(Pathname pathname) throws FilesystemException;
}
