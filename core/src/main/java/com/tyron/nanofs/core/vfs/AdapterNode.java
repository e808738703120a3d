package com.tyron.nanofs.core.vfs;

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.tyron.nanofs.api.vfs.Adapter;
import com.tyron.nanofs.api.vfs.CyclicStructureException;
import com.tyron.nanofs.api.vfs.DirectoryNotEmptyException;
import com.tyron.nanofs.api.vfs.Filesystem;
import com.tyron.nanofs.api.vfs.FilesystemException;
import com.tyron.nanofs.api.vfs.InvalidPathnameException;
import com.tyron.nanofs.api.vfs.ListFilter;
import com.tyron.nanofs.api.vfs.Node;
import com.tyron.nanofs.api.vfs.NodeAlreadyExistsException;
import com.tyron.nanofs.api.vfs.NodeIOException;
import com.tyron.nanofs.api.vfs.NodeMetadata;
import com.tyron.nanofs.api.vfs.NodeNotFoundException;
import com.tyron.nanofs.api.vfs.NodeType;
import com.tyron.nanofs.api.vfs.NotADirectoryException;
import com.tyron.nanofs.api.vfs.NotAFileException;
import com.tyron.nanofs.api.vfs.NotALinkException;
import com.tyron.nanofs.api.vfs.Pathname;
import com.tyron.nanofs.api.vfs.UnsupportedCapabilityException;
import com.tyron.nanofs.api.vfs.capability.AccessCheckSupport;
import com.tyron.nanofs.api.vfs.capability.ModeSupport;
import com.tyron.nanofs.api.vfs.capability.OwnershipSupport;
import com.tyron.nanofs.api.vfs.capability.TimestampSupport;
import com.tyron.nanofs.api.vfs.capability.TruncateSupport;
import com.tyron.nanofs.api.vfs.capability.UriSupport;
import com.tyron.nanofs.core.filter.FilterEngine;
import com.tyron.nanofs.core.filter.ListEvaluator;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Node} implementation that asks its filesystem's {@link Adapter} for everything.
 * <p>
 * Nothing is cached on construction; the same instance can be queried again at any time.
 */
public class AdapterNode implements Node {

    private static final Logger LOG = Logger.getLogger(AdapterNode.class.getName());

    private final AdapterFilesystem fs;
    private final Pathname pathname;

    AdapterNode(AdapterFilesystem fs, Pathname pathname) {
        this.fs = fs;
        this.pathname = pathname;
    }

    @Override
    public Filesystem getFilesystem() {
        return fs;
    }

    @Override
    public Pathname getPathname() {
        return pathname;
    }

    private Adapter adapter() throws FilesystemException {
        return fs.requireAdapter(pathname);
    }

    // --- Hierarchy ---

    @Override
    public @Nullable Node getParent() {
        Pathname parent = pathname.getParent();
        return parent != null ? new AdapterNode(fs, parent) : null;
    }

    @Override
    public Node getChild(String name) throws InvalidPathnameException {
        return new AdapterNode(fs, pathname.join(name));
    }

    // --- Type ---

    /**
     * Stats this node, following a link in the last segment to wherever it ends.
     *
     * @return null if nothing exists there (including a dangling link)
     */
    private @Nullable NodeMetadata statFollowing(Adapter adapter) throws FilesystemException {
        NodeMetadata metadata = adapter.stat(pathname);
        if (metadata == null || metadata.type() != NodeType.LINK) {
            return metadata;
        }
        return adapter.stat(getRealPathname());
    }

    private NodeMetadata requireStat(Adapter adapter) throws FilesystemException {
        NodeMetadata metadata = statFollowing(adapter);
        if (metadata == null) {
            throw new NodeNotFoundException(pathname);
        }
        return metadata;
    }

    private void requireExists(Adapter adapter) throws FilesystemException {
        if (adapter.stat(pathname) == null) {
            throw new NodeNotFoundException(pathname);
        }
    }

    @Override
    public boolean exists() throws FilesystemException {
        return adapter().stat(pathname) != null;
    }

    @Override
    public NodeType getType() throws FilesystemException {
        NodeMetadata metadata = adapter().stat(pathname);
        if (metadata == null) {
            throw new NodeNotFoundException(pathname);
        }
        return metadata.type();
    }

    @Override
    public boolean isFile() throws FilesystemException {
        NodeMetadata metadata = statFollowing(adapter());
        return metadata != null && metadata.type() == NodeType.FILE;
    }

    @Override
    public boolean isDirectory() throws FilesystemException {
        NodeMetadata metadata = statFollowing(adapter());
        return metadata != null && metadata.type() == NodeType.DIRECTORY;
    }

    @Override
    public boolean isLink() throws FilesystemException {
        NodeMetadata metadata = adapter().stat(pathname);
        return metadata != null && metadata.type() == NodeType.LINK;
    }

    @Override
    public Pathname getLinkTarget() throws FilesystemException {
        Adapter adapter = adapter();
        NodeMetadata metadata = adapter.stat(pathname);
        if (metadata == null) {
            throw new NodeNotFoundException(pathname);
        }
        if (metadata.type() != NodeType.LINK) {
            throw new NotALinkException(pathname);
        }
        return adapter.resolveLink(pathname);
    }

    /**
     * Walks the pathname segment by segment and splices in link targets as they are met,
     * the way {@code realpath(3)} does. Missing segments are kept as they are.
     */
    @Override
    public Pathname getRealPathname() throws FilesystemException {
        Adapter adapter = adapter();
        int maxHops = fs.getConfiguration().getMaxLinkHops();
        int hops = 0;

        Deque<String> remaining = new ArrayDeque<>(pathname.getSegments());
        Pathname current = pathname.getRootPathname();

        while (!remaining.isEmpty()) {
            Pathname next = current.join(remaining.pollFirst());
            NodeMetadata metadata = adapter.stat(next);
            if (metadata == null || metadata.type() != NodeType.LINK) {
                current = next;
                continue;
            }
            if (++hops > maxHops) {
                throw new CyclicStructureException(pathname, next);
            }
            Pathname target = adapter.resolveLink(next);
            List<String> targetSegments = target.getSegments();
            for (int i = targetSegments.size() - 1; i >= 0; i--) {
                remaining.addFirst(targetSegments.get(i));
            }
            current = target.getRootPathname();
        }
        return current;
    }

    @Override
    public URI toUri() throws FilesystemException {
        UriSupport uris = adapter().getCapability(UriSupport.class);
        if (uris == null) {
            throw new UnsupportedCapabilityException(pathname, "URI");
        }
        return uris.toUri(pathname);
    }

    // --- Metadata ---

    @Override
    public long getSize() throws FilesystemException {
        return requireStat(adapter()).size();
    }

    @Override
    public Instant getModifyTime() throws FilesystemException {
        return requireTime(requireStat(adapter()).modifyTime(), "modification time");
    }

    @Override
    public Instant getAccessTime() throws FilesystemException {
        return requireTime(requireStat(adapter()).accessTime(), "access time");
    }

    @Override
    public Instant getCreationTime() throws FilesystemException {
        return requireTime(requireStat(adapter()).creationTime(), "creation time");
    }

    private Instant requireTime(@Nullable Instant time, String what) throws UnsupportedCapabilityException {
        if (time == null) {
            throw new UnsupportedCapabilityException(pathname, what);
        }
        return time;
    }

    @Override
    public boolean setModifyTime(Instant time) throws FilesystemException {
        Objects.requireNonNull(time, "time");
        Adapter adapter = adapter();
        requireExists(adapter);
        TimestampSupport timestamps = adapter.getCapability(TimestampSupport.class);
        if (timestamps == null) {
            return false;
        }
        timestamps.setModifyTime(pathname, time);
        return true;
    }

    @Override
    public boolean setAccessTime(Instant time) throws FilesystemException {
        Objects.requireNonNull(time, "time");
        Adapter adapter = adapter();
        requireExists(adapter);
        TimestampSupport timestamps = adapter.getCapability(TimestampSupport.class);
        if (timestamps == null) {
            return false;
        }
        timestamps.setAccessTime(pathname, time);
        return true;
    }

    @Override
    public boolean touch(@Nullable Instant modifyTime, @Nullable Instant accessTime) throws FilesystemException {
        Adapter adapter = adapter();
        if (adapter.stat(pathname) == null) {
            createFile(false);
        }
        TimestampSupport timestamps = adapter.getCapability(TimestampSupport.class);
        if (timestamps == null) {
            return false;
        }
        Instant mtime = modifyTime != null ? modifyTime : Instant.now();
        timestamps.setModifyTime(pathname, mtime);
        timestamps.setAccessTime(pathname, accessTime != null ? accessTime : mtime);
        return true;
    }

    private OwnershipSupport requireOwnership(Adapter adapter) throws FilesystemException {
        OwnershipSupport ownership = adapter.getCapability(OwnershipSupport.class);
        if (ownership == null) {
            throw new UnsupportedCapabilityException(pathname, "ownership");
        }
        requireExists(adapter);
        return ownership;
    }

    @Override
    public String getOwner() throws FilesystemException {
        return requireOwnership(adapter()).getOwner(pathname);
    }

    @Override
    public boolean setOwner(String owner) throws FilesystemException {
        Objects.requireNonNull(owner, "owner");
        Adapter adapter = adapter();
        requireExists(adapter);
        OwnershipSupport ownership = adapter.getCapability(OwnershipSupport.class);
        if (ownership == null) {
            return false;
        }
        ownership.setOwner(pathname, owner);
        return true;
    }

    @Override
    public String getGroup() throws FilesystemException {
        return requireOwnership(adapter()).getGroup(pathname);
    }

    @Override
    public boolean setGroup(String group) throws FilesystemException {
        Objects.requireNonNull(group, "group");
        Adapter adapter = adapter();
        requireExists(adapter);
        OwnershipSupport ownership = adapter.getCapability(OwnershipSupport.class);
        if (ownership == null) {
            return false;
        }
        ownership.setGroup(pathname, group);
        return true;
    }

    @Override
    public int getMode() throws FilesystemException {
        Adapter adapter = adapter();
        ModeSupport modes = adapter.getCapability(ModeSupport.class);
        if (modes == null) {
            throw new UnsupportedCapabilityException(pathname, "mode");
        }
        requireExists(adapter);
        return modes.getMode(pathname);
    }

    @Override
    public boolean setMode(int mode) throws FilesystemException {
        Adapter adapter = adapter();
        requireExists(adapter);
        ModeSupport modes = adapter.getCapability(ModeSupport.class);
        if (modes == null) {
            return false;
        }
        modes.setMode(pathname, mode);
        return true;
    }

    @Override
    public boolean isReadable() throws FilesystemException {
        return isAccessible(AccessCheckSupport.AccessMode.READ);
    }

    @Override
    public boolean isWritable() throws FilesystemException {
        return isAccessible(AccessCheckSupport.AccessMode.WRITE);
    }

    @Override
    public boolean isExecutable() throws FilesystemException {
        return isAccessible(AccessCheckSupport.AccessMode.EXECUTE);
    }

    private boolean isAccessible(AccessCheckSupport.AccessMode mode) throws FilesystemException {
        Adapter adapter = adapter();
        AccessCheckSupport access = adapter.getCapability(AccessCheckSupport.class);
        if (access == null) {
            throw new UnsupportedCapabilityException(pathname, "access check");
        }
        if (adapter.stat(pathname) == null) {
            return false;
        }
        return access.isAccessible(pathname, mode);
    }

    // --- Content ---

    @Override
    public InputStream openInputStream() throws FilesystemException {
        Adapter adapter = adapter();
        requireFile(adapter);
        return adapter.openRead(pathname);
    }

    @Override
    public OutputStream openOutputStream(boolean append) throws FilesystemException {
        Adapter adapter = adapter();
        NodeMetadata metadata = statFollowing(adapter);
        if (metadata == null) {
            requireParentDirectory();
        } else if (metadata.type() == NodeType.DIRECTORY) {
            throw new NotAFileException(pathname);
        }
        return adapter.openWrite(pathname, append);
    }

    private NodeMetadata requireFile(Adapter adapter) throws FilesystemException {
        NodeMetadata metadata = requireStat(adapter);
        if (metadata.type() == NodeType.DIRECTORY) {
            throw new NotAFileException(pathname);
        }
        return metadata;
    }

    @Override
    public byte[] read() throws FilesystemException {
        try (InputStream in = openInputStream()) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw wrap(pathname, "read", e);
        }
    }

    @Override
    public void write(byte[] content) throws FilesystemException {
        writeContent(content, false);
    }

    @Override
    public void append(byte[] content) throws FilesystemException {
        writeContent(content, true);
    }

    private void writeContent(byte[] content, boolean append) throws FilesystemException {
        Objects.requireNonNull(content, "content");
        try (OutputStream out = openOutputStream(append)) {
            out.write(content);
        } catch (IOException e) {
            throw wrap(pathname, append ? "append" : "write", e);
        }
    }

    @Override
    public long truncate(long size) throws FilesystemException {
        if (size < 0) {
            throw new IllegalArgumentException("size < 0: " + size);
        }
        Adapter adapter = adapter();
        NodeMetadata metadata = requireFile(adapter);

        TruncateSupport truncation = adapter.getCapability(TruncateSupport.class);
        if (truncation != null) {
            truncation.truncate(pathname, size);
            return size;
        }

        // Without native support the kept head is rewritten and the tail zero-filled.
        long keep = Math.min(size, metadata.size());
        if (keep > Integer.MAX_VALUE - 8) {
            throw new UnsupportedCapabilityException(pathname, "truncating to " + size + " bytes");
        }
        try {
            byte[] head;
            try (InputStream in = adapter.openRead(pathname)) {
                head = in.readNBytes((int) keep);
            }
            try (OutputStream out = adapter.openWrite(pathname, false)) {
                out.write(head);
                byte[] zeros = new byte[fs.getConfiguration().getBufferSize()];
                long pad = size - head.length;
                while (pad > 0) {
                    int n = (int) Math.min(pad, zeros.length);
                    out.write(zeros, 0, n);
                    pad -= n;
                }
            }
        } catch (IOException e) {
            throw wrap(pathname, "truncate", e);
        }
        return size;
    }

    @Override
    @SuppressWarnings("deprecation")
    public String getMD5() throws FilesystemException {
        return digest(Hashing.md5(), "MD5").toString();
    }

    @Override
    @SuppressWarnings("deprecation")
    public byte[] getRawMD5() throws FilesystemException {
        return digest(Hashing.md5(), "MD5").asBytes();
    }

    @Override
    @SuppressWarnings("deprecation")
    public String getSHA1() throws FilesystemException {
        return digest(Hashing.sha1(), "SHA-1").toString();
    }

    @Override
    @SuppressWarnings("deprecation")
    public byte[] getRawSHA1() throws FilesystemException {
        return digest(Hashing.sha1(), "SHA-1").asBytes();
    }

    private HashCode digest(HashFunction function, String name) throws FilesystemException {
        Adapter adapter = adapter();
        NodeMetadata metadata = requireStat(adapter);
        if (metadata.type() != NodeType.FILE) {
            throw new UnsupportedCapabilityException(pathname, name + " of a " + metadata.type().name().toLowerCase());
        }
        try (InputStream in = adapter.openRead(pathname)) {
            return Hashes.hash(in, function, fs.getConfiguration().getBufferSize());
        } catch (IOException e) {
            throw wrap(pathname, name, e);
        }
    }

    // --- Structure ---

    private void requireParentDirectory() throws FilesystemException {
        Node parent = getParent();
        if (parent == null) {
            return;
        }
        if (!parent.exists()) {
            throw new NodeNotFoundException(parent.getPathname());
        }
        if (!parent.isDirectory()) {
            throw new NotADirectoryException(parent.getPathname());
        }
    }

    @Override
    public void createDirectory(boolean parents) throws FilesystemException {
        Adapter adapter = adapter();
        if (adapter.stat(pathname) != null) {
            if (parents && isDirectory()) {
                return;
            }
            throw new NodeAlreadyExistsException(pathname);
        }
        if (!parents) {
            requireParentDirectory();
        }
        adapter.createDirectory(pathname, parents);

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Created directory " + pathname);
        }
    }

    @Override
    public void createFile(boolean parents) throws FilesystemException {
        Adapter adapter = adapter();
        if (adapter.stat(pathname) != null) {
            throw new NodeAlreadyExistsException(pathname);
        }
        if (!parents) {
            requireParentDirectory();
        }
        adapter.createFile(pathname, parents);

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Created file " + pathname);
        }
    }

    @Override
    public void delete(boolean recursive, boolean force) throws FilesystemException {
        Adapter adapter = adapter();
        NodeMetadata metadata = adapter.stat(pathname);
        if (metadata == null) {
            if (force) {
                return;
            }
            throw new NodeNotFoundException(pathname);
        }
        if (pathname.isRoot()) {
            throw new UnsupportedCapabilityException(pathname, "deleting the root");
        }
        if (metadata.type() == NodeType.DIRECTORY && !recursive && !adapter.readDirectory(pathname).isEmpty()) {
            throw new DirectoryNotEmptyException(pathname);
        }
        adapter.delete(pathname, recursive, force);

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Deleted " + pathname + (recursive ? " recursively" : ""));
        }
    }

    @Override
    public Node copyTo(Node destination, boolean parents) throws FilesystemException {
        return NodeTransfer.copy(this, destination, parents);
    }

    @Override
    public Node moveTo(Node destination, boolean parents) throws FilesystemException {
        return NodeTransfer.move(this, destination, parents);
    }

    // --- Listing ---

    @Override
    public List<Node> ls(List<ListFilter> filters) throws FilesystemException {
        ListEvaluator evaluator = FilterEngine.compile(filters, fs.getConfiguration().isFollowLinks());
        return new NodeLister(fs, evaluator).list(this);
    }

    @Override
    public int count() throws FilesystemException {
        Adapter adapter = adapter();
        NodeMetadata metadata = requireStat(adapter);
        if (metadata.type() != NodeType.DIRECTORY) {
            throw new NotADirectoryException(pathname);
        }
        return adapter.readDirectory(pathname).size();
    }

    static FilesystemException wrap(Pathname pathname, String operation, IOException e) {
        if (e instanceof FilesystemException fe) {
            return fe;
        }
        return new NodeIOException(pathname, operation + " failed for " + pathname + ": " + e.getMessage(), e);
    }

    // --- Object Identity ---

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AdapterNode that = (AdapterNode) o;
        return fs == that.fs && pathname.equals(that.pathname);
    }

    @Override
    public int hashCode() {
        return pathname.hashCode();
    }

    @Override
    public String toString() {
        return pathname.toString();
    }
}
