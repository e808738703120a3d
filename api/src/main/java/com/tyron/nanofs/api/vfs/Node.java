package com.tyron.nanofs.api.vfs;

import org.jetbrains.annotations.Nullable;

import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Handle to a file, directory or link inside one {@link Filesystem}.
 * <p>
 * A node is only a pathname plus its owner. It caches nothing: every query goes to the
 * adapter again, so a node may outlive the entity it names (deleted or moved elsewhere)
 * and simply reports the current state. Path separators are always '/'.
 */
public interface Node {

    Filesystem getFilesystem();

    Pathname getPathname();

    /**
     * @return The last name in the pathname (e.g., "Main.java"), empty for the root.
     */
    default String getBasename() {
        return getPathname().getBasename();
    }

    default String getBasename(String suffix) {
        return getPathname().getBasename(suffix);
    }

    /**
     * @return The extension without the dot (e.g., "java"), or empty string if none.
     */
    default String getExtension() {
        return getPathname().getExtension();
    }

    default boolean isHidden() {
        return getPathname().isHidden();
    }

    // --- Hierarchy ---

    /**
     * @return The parent node, or null if this is the root.
     */
    @Nullable Node getParent();

    /**
     * @param name a single name or a relative path
     * @return the child node (which might not exist yet)
     */
    Node getChild(String name) throws InvalidPathnameException;

    // --- Type ---

    boolean exists() throws FilesystemException;

    /**
     * @return the type of this entity itself; a link is {@link NodeType#LINK}
     * @throws NodeNotFoundException if nothing exists here
     */
    NodeType getType() throws FilesystemException;

    /**
     * @return true if this exists and is a file, or is a link that ends at a file
     */
    boolean isFile() throws FilesystemException;

    /**
     * @return true if this exists and is a directory, or is a link that ends at a directory
     */
    boolean isDirectory() throws FilesystemException;

    boolean isLink() throws FilesystemException;

    /**
     * @return where this link points, resolved against the link's parent
     * @throws NotALinkException if this is not a link
     */
    Pathname getLinkTarget() throws FilesystemException;

    /**
     * @return this pathname with every link along it resolved
     * @throws CyclicStructureException if the links do not end
     */
    Pathname getRealPathname() throws FilesystemException;

    URI toUri() throws FilesystemException;

    // --- Metadata ---

    long getSize() throws FilesystemException;

    Instant getModifyTime() throws FilesystemException;

    Instant getAccessTime() throws FilesystemException;

    Instant getCreationTime() throws FilesystemException;

    /**
     * @return false if the adapter cannot store modification times
     */
    boolean setModifyTime(Instant time) throws FilesystemException;

    /**
     * @return false if the adapter cannot store access times
     */
    boolean setAccessTime(Instant time) throws FilesystemException;

    /**
     * Creates the file if it is missing, then sets both times to now.
     *
     * @return false if the file exists but its times could not be set
     */
    default boolean touch() throws FilesystemException {
        return touch(null, null);
    }

    /**
     * Creates the file if it is missing, then sets its times. A null {@code modifyTime}
     * means now, a null {@code accessTime} means the same as {@code modifyTime}.
     *
     * @return false if the adapter cannot store timestamps
     */
    boolean touch(@Nullable Instant modifyTime, @Nullable Instant accessTime) throws FilesystemException;

    String getOwner() throws FilesystemException;

    boolean setOwner(String owner) throws FilesystemException;

    String getGroup() throws FilesystemException;

    boolean setGroup(String group) throws FilesystemException;

    int getMode() throws FilesystemException;

    boolean setMode(int mode) throws FilesystemException;

    boolean isReadable() throws FilesystemException;

    boolean isWritable() throws FilesystemException;

    boolean isExecutable() throws FilesystemException;

    // --- Content ---

    /**
     * Callers are responsible for closing the returned stream.
     */
    InputStream openInputStream() throws FilesystemException;

    /**
     * Creates the file if it does not exist. Callers are responsible for closing the
     * returned stream.
     */
    OutputStream openOutputStream(boolean append) throws FilesystemException;

    byte[] read() throws FilesystemException;

    /**
     * Convenience method to read file as UTF-8 string.
     */
    default String readText() throws FilesystemException {
        return new String(read(), StandardCharsets.UTF_8);
    }

    void write(byte[] content) throws FilesystemException;

    default void write(String content) throws FilesystemException {
        write(content.getBytes(StandardCharsets.UTF_8));
    }

    void append(byte[] content) throws FilesystemException;

    default void append(String content) throws FilesystemException {
        append(content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Cuts the file to {@code size} bytes, or pads it with zeros up to it.
     *
     * @return the new size
     */
    long truncate(long size) throws FilesystemException;

    default long truncate() throws FilesystemException {
        return truncate(0);
    }

    /**
     * @return lower-case hex MD5 of the content
     */
    String getMD5() throws FilesystemException;

    /**
     * @return the 16 byte MD5 digest of the content
     */
    byte[] getRawMD5() throws FilesystemException;

    /**
     * @return lower-case hex SHA-1 of the content
     */
    String getSHA1() throws FilesystemException;

    byte[] getRawSHA1() throws FilesystemException;

    // --- Structure ---

    /**
     * @param parents create missing ancestors; with it, an existing directory is not an error
     */
    void createDirectory(boolean parents) throws FilesystemException;

    default void createDirectory() throws FilesystemException {
        createDirectory(false);
    }

    void createFile(boolean parents) throws FilesystemException;

    default void createFile() throws FilesystemException {
        createFile(false);
    }

    /**
     * @param recursive delete directory contents too; without it a non-empty directory
     *                  fails with {@link DirectoryNotEmptyException}
     * @param force     a missing node is not an error
     */
    void delete(boolean recursive, boolean force) throws FilesystemException;

    default void delete() throws FilesystemException {
        delete(false, false);
    }

    /**
     * Copies this node to {@code destination}. If the destination is an existing
     * directory the copy is placed inside it under this basename.
     *
     * @return the node that now holds the copy
     */
    Node copyTo(Node destination, boolean parents) throws FilesystemException;

    default Node copyTo(Node destination) throws FilesystemException {
        return copyTo(destination, false);
    }

    /**
     * Moves this node; same placement rules as {@link #copyTo(Node, boolean)}.
     *
     * @return the node at the new location
     */
    Node moveTo(Node destination, boolean parents) throws FilesystemException;

    default Node moveTo(Node destination) throws FilesystemException {
        return moveTo(destination, false);
    }

    // --- Listing ---

    List<Node> ls(List<ListFilter> filters) throws FilesystemException;

    default List<Node> ls(ListFilter... filters) throws FilesystemException {
        return ls(Arrays.asList(filters));
    }

    /**
     * @return the immediate children, unfiltered.
     */
    default List<Node> getChildren() throws FilesystemException {
        return ls(List.of());
    }

    /**
     * @return number of immediate children
     */
    int count() throws FilesystemException;
}
