package com.tyron.nanofs.api.vfs;

import com.tyron.nanofs.api.vfs.capability.AdapterCapability;
import org.jetbrains.annotations.Nullable;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;

/**
 * What a backend must implement so nodes can run on top of it.
 * <p>
 * Everything here is mandatory. Optional features (ownership, POSIX mode, timestamps,
 * native move, ...) are advertised through {@link #getCapability(Class)}; nodes check
 * for them and report {@link UnsupportedCapabilityException} when they are absent.
 * <p>
 * All pathnames handed in are canonical. Intermediate links in a pathname are the
 * adapter's to follow; only the last segment is ever treated as the link itself.
 */
public interface Adapter {

    /**
     * Looks at the entity without following a link in the last segment.
     *
     * @return the metadata, or null if nothing exists there
     */
    @Nullable NodeMetadata stat(Pathname pathname) throws FilesystemException;

    /**
     * @throws NodeNotFoundException    if the directory is missing
     * @throws NotADirectoryException   if it is not a directory
     */
    List<DirectoryEntry> readDirectory(Pathname pathname) throws FilesystemException;

    InputStream openRead(Pathname pathname) throws FilesystemException;

    /**
     * Opens the file for writing, creating it when missing. The parent must exist.
     */
    OutputStream openWrite(Pathname pathname, boolean append) throws FilesystemException;

    /**
     * @return the link's target, resolved against the link's parent
     * @throws NotALinkException if the entity is not a link
     */
    Pathname resolveLink(Pathname pathname) throws FilesystemException;

    void createDirectory(Pathname pathname, boolean parents) throws FilesystemException;

    void createFile(Pathname pathname, boolean parents) throws FilesystemException;

    void delete(Pathname pathname, boolean recursive, boolean force) throws FilesystemException;

    /**
     * @return the capability, or null if this adapter does not offer it
     */
    default <T extends AdapterCapability> @Nullable T getCapability(Class<T> capability) {
        return capability.isInstance(this) ? capability.cast(this) : null;
    }

    /**
     * Called once when the owning filesystem closes.
     */
    default void close() {
    }
}
