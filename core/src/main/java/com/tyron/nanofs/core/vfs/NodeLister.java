package com.tyron.nanofs.core.vfs;

import com.tyron.nanofs.api.vfs.Adapter;
import com.tyron.nanofs.api.vfs.CyclicStructureException;
import com.tyron.nanofs.api.vfs.DirectoryEntry;
import com.tyron.nanofs.api.vfs.FilesystemException;
import com.tyron.nanofs.api.vfs.Node;
import com.tyron.nanofs.api.vfs.NodeNotFoundException;
import com.tyron.nanofs.api.vfs.NotADirectoryException;
import com.tyron.nanofs.api.vfs.Pathname;
import com.tyron.nanofs.core.filter.ListEvaluator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pre-order, depth-first walk below one directory driven by a {@link ListEvaluator}.
 * <p>
 * The real pathnames of the directories currently open on the walk are kept in a set;
 * descending into one of them again means a link points back up the chain.
 */
final class NodeLister {

    private static final Logger LOG = Logger.getLogger(NodeLister.class.getName());

    private final AdapterFilesystem fs;
    private final ListEvaluator evaluator;
    private final Set<Pathname> open = new HashSet<>();

    NodeLister(AdapterFilesystem fs, ListEvaluator evaluator) {
        this.fs = fs;
        this.evaluator = evaluator;
    }

    List<Node> list(Node directory) throws FilesystemException {
        if (!directory.exists()) {
            throw new NodeNotFoundException(directory.getPathname());
        }
        if (!directory.isDirectory()) {
            throw new NotADirectoryException(directory.getPathname());
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Listing " + directory.getPathname() + " with " + evaluator);
        }

        List<Node> out = new ArrayList<>();
        open.add(directory.getRealPathname());
        walk(directory, out);
        return out;
    }

    private void walk(Node directory, List<Node> out) throws FilesystemException {
        Adapter adapter = fs.requireAdapter(directory.getPathname());
        List<DirectoryEntry> entries = adapter.readDirectory(directory.getPathname());

        for (DirectoryEntry entry : entries) {
            String name = entry.name();
            if (name.equals(".") || name.equals("..")) {
                continue;
            }
            Node child = fs.getNode(directory.getPathname().join(name));
            try {
                if (evaluator.accepts(child)) {
                    out.add(child);
                }
                if (!evaluator.recursesInto(child)) {
                    continue;
                }
                Pathname real = child.getRealPathname();
                if (!open.add(real)) {
                    LOG.warning("Link cycle while listing: " + child.getPathname() + " leads back to " + real);
                    throw new CyclicStructureException(child.getPathname(), real);
                }
                try {
                    walk(child, out);
                } finally {
                    open.remove(real);
                }
            } catch (NodeNotFoundException e) {
                if (child.exists()) {
                    // not about this entry, e.g. raised by a predicate
                    throw e;
                }
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Skipping vanished entry " + child.getPathname());
                }
            }
        }
    }
}
