package com.tyron.nanofs.core.vfs;

import com.tyron.nanofs.api.vfs.CyclicStructureException;
import com.tyron.nanofs.api.vfs.Filesystem;
import com.tyron.nanofs.api.vfs.FilesystemException;
import com.tyron.nanofs.api.vfs.InvalidPathnameException;
import com.tyron.nanofs.api.vfs.Node;
import com.tyron.nanofs.api.vfs.NodeAlreadyExistsException;
import com.tyron.nanofs.api.vfs.NodeNotFoundException;
import com.tyron.nanofs.api.vfs.NotADirectoryException;
import com.tyron.nanofs.api.vfs.PartialOperationException;
import com.tyron.nanofs.api.vfs.Pathname;
import com.tyron.nanofs.api.vfs.capability.MoveSupport;
import com.tyron.nanofs.core.config.FilesystemConfiguration;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Recursive copy and move between nodes, possibly of different filesystems.
 * <p>
 * If the destination is an existing directory the source is placed inside it under its
 * own basename. A failure below the top level is reported once, as a
 * {@link PartialOperationException} naming the first child that failed; whatever was
 * already copied stays where it is.
 */
final class NodeTransfer {

    private static final Logger LOG = Logger.getLogger(NodeTransfer.class.getName());

    private final String operation;
    private final int bufferSize;
    private final Set<Pathname> open = new HashSet<>();
    private int completed;

    private NodeTransfer(String operation, int bufferSize) {
        this.operation = operation;
        this.bufferSize = bufferSize;
    }

    static Node copy(Node source, Node destination, boolean parents) throws FilesystemException {
        requireExists(source);
        Node target = place(source, destination);
        requireNotInside(source, target);
        prepareParent(target, parents);

        NodeTransfer transfer = new NodeTransfer("copy", bufferSize(source));
        transfer.copyTree(source, target);

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Copied " + source.getPathname() + " to " + target.getPathname()
                    + " (" + transfer.completed + " entries)");
        }
        return target;
    }

    static Node move(Node source, Node destination, boolean parents) throws FilesystemException {
        requireExists(source);
        Node target = place(source, destination);
        requireNotInside(source, target);

        Filesystem fs = source.getFilesystem();
        if (fs == target.getFilesystem()) {
            MoveSupport mover = fs.getAdapter().getCapability(MoveSupport.class);
            if (mover != null) {
                prepareParent(target, parents);
                if (target.exists()) {
                    if (!source.isFile() || !target.isFile()) {
                        throw new NodeAlreadyExistsException(target.getPathname());
                    }
                    target.delete();
                }
                mover.move(source.getPathname(), target.getPathname());

                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Moved " + source.getPathname() + " to " + target.getPathname());
                }
                return target;
            }
        }

        prepareParent(target, parents);
        NodeTransfer transfer = new NodeTransfer("move", bufferSize(source));
        transfer.copyTree(source, target);
        try {
            source.delete(true, false);
        } catch (FilesystemException e) {
            LOG.log(Level.WARNING, "Copied " + source.getPathname() + " but could not remove it", e);
            throw new PartialOperationException("move", source.getPathname(), transfer.completed, e);
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Moved " + source.getPathname() + " to " + target.getPathname() + " by copying");
        }
        return target;
    }

    private static void requireExists(Node source) throws FilesystemException {
        if (!source.exists()) {
            throw new NodeNotFoundException(source.getPathname());
        }
    }

    private static Node place(Node source, Node destination) throws FilesystemException {
        if (destination.isDirectory() && !source.getPathname().isRoot()) {
            return destination.getChild(source.getBasename());
        }
        return destination;
    }

    private static void requireNotInside(Node source, Node target) throws FilesystemException {
        if (source.getFilesystem() == target.getFilesystem()
                && target.getPathname().startsWith(source.getPathname())) {
            throw new InvalidPathnameException(target.getPathname().toString(),
                    "is " + source.getPathname() + " or lies inside it");
        }
    }

    private static void prepareParent(Node target, boolean parents) throws FilesystemException {
        Node parent = target.getParent();
        if (parent == null) {
            return;
        }
        if (!parent.exists()) {
            if (!parents) {
                throw new NodeNotFoundException(parent.getPathname());
            }
            parent.createDirectory(true);
        } else if (!parent.isDirectory()) {
            throw new NotADirectoryException(parent.getPathname());
        }
    }

    private static int bufferSize(Node source) {
        if (source.getFilesystem() instanceof AdapterFilesystem adapterFs) {
            return adapterFs.getConfiguration().getBufferSize();
        }
        return FilesystemConfiguration.DEFAULT_BUFFER_SIZE;
    }

    private void copyTree(Node source, Node target) throws FilesystemException {
        if (!source.isDirectory()) {
            copyFile(source, target);
            return;
        }

        if (target.exists()) {
            if (!target.isDirectory()) {
                throw new NodeAlreadyExistsException(target.getPathname());
            }
        } else {
            target.createDirectory(false);
        }
        completed++;

        Pathname real = source.getRealPathname();
        if (!open.add(real)) {
            throw new CyclicStructureException(source.getPathname(), real);
        }
        try {
            for (Node child : source.getChildren()) {
                try {
                    copyTree(child, target.getChild(child.getBasename()));
                } catch (PartialOperationException e) {
                    throw e;
                } catch (FilesystemException e) {
                    LOG.log(Level.WARNING, operation + " failed at " + child.getPathname(), e);
                    throw new PartialOperationException(operation, child.getPathname(), completed, e);
                }
            }
        } finally {
            open.remove(real);
        }
    }

    private void copyFile(Node source, Node target) throws FilesystemException {
        if (target.isDirectory()) {
            throw new NodeAlreadyExistsException(target.getPathname());
        }
        try (InputStream in = source.openInputStream();
             OutputStream out = target.openOutputStream(false)) {
            byte[] buffer = new byte[bufferSize];
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
            }
        } catch (IOException e) {
            throw AdapterNode.wrap(target.getPathname(), operation, e);
        }
        completed++;
    }
}
