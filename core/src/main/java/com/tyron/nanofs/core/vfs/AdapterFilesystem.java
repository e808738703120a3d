package com.tyron.nanofs.core.vfs;

import com.tyron.nanofs.api.vfs.Adapter;
import com.tyron.nanofs.api.vfs.Filesystem;
import com.tyron.nanofs.api.vfs.FilesystemClosedException;
import com.tyron.nanofs.api.vfs.InvalidPathnameException;
import com.tyron.nanofs.api.vfs.Node;
import com.tyron.nanofs.api.vfs.PathConventions;
import com.tyron.nanofs.api.vfs.Pathname;
import com.tyron.nanofs.core.config.FilesystemConfiguration;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link Filesystem} that runs every node operation against one {@link Adapter}.
 * <p>
 * Usage:
 * <pre>
 *     Filesystem fs = new AdapterFilesystem(adapter, FilesystemConfiguration.defaults());
 *     List&lt;Node&gt; docs = fs.getNode("/docs").ls(ListFilter.glob("*.md"), ListFilter.recursive());
 * </pre>
 */
public class AdapterFilesystem implements Filesystem {

    private static final Logger LOG = Logger.getLogger(AdapterFilesystem.class.getName());

    private final Adapter adapter;
    private final FilesystemConfiguration configuration;
    private final Pathname rootPathname;

    private volatile boolean closed;

    public AdapterFilesystem(Adapter adapter) {
        this(adapter, FilesystemConfiguration.defaults());
    }

    public AdapterFilesystem(Adapter adapter, FilesystemConfiguration configuration) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.rootPathname = Pathname.root(configuration.getConventions());

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Opened filesystem " + rootPathname + " on " + adapter.getClass().getSimpleName()
                    + " with " + configuration);
        }
    }

    public FilesystemConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public PathConventions getConventions() {
        return configuration.getConventions();
    }

    @Override
    public Adapter getAdapter() throws FilesystemClosedException {
        return requireAdapter(rootPathname);
    }

    Adapter requireAdapter(Pathname pathname) throws FilesystemClosedException {
        if (closed) {
            throw new FilesystemClosedException(pathname);
        }
        return adapter;
    }

    @Override
    public Pathname parse(String raw) throws InvalidPathnameException {
        return Pathname.normalize(raw, getConventions());
    }

    @Override
    public Node getRoot() {
        return new AdapterNode(this, rootPathname);
    }

    @Override
    public Node getNode(String path) throws InvalidPathnameException {
        return new AdapterNode(this, parse(path));
    }

    @Override
    public Node getNode(Pathname pathname) {
        Objects.requireNonNull(pathname, "pathname");
        return new AdapterNode(this, pathname);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            adapter.close();
        } finally {
            LOG.info("Closed filesystem " + rootPathname);
        }
    }

    @Override
    public String toString() {
        return "AdapterFilesystem{" + rootPathname + ", adapter=" + adapter.getClass().getSimpleName() + "}";
    }
}
