package com.tyron.nanofs.core.vfs;

import com.tyron.nanofs.api.vfs.Filesystem;
import com.tyron.nanofs.api.vfs.InvalidPathnameException;
import com.tyron.nanofs.api.vfs.Node;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Routes {@code scheme://authority/path} strings to the {@link Filesystem} registered for
 * the scheme.
 * <p>
 * Usage:
 * <pre>
 *     FilesystemRegistry registry = new FilesystemRegistry();
 *     registry.register("mem", new AdapterFilesystem(new MemoryAdapter()));
 *     registry.setDefaultScheme("mem");
 *     Node readme = registry.find("mem://scratch/docs/README.md");
 * </pre>
 */
public class FilesystemRegistry {

    private static final Logger LOG = Logger.getLogger(FilesystemRegistry.class.getName());

    private static final Pattern SCHEME_PREFIX = Pattern.compile("^([A-Za-z][A-Za-z0-9+.-]*)://");
    private static final Pattern DRIVE_PATH = Pattern.compile("^/[A-Za-z]:(/|$)");

    private final Map<String, Filesystem> registry = new ConcurrentHashMap<>();

    private volatile @Nullable String defaultScheme;

    /**
     * Registers a filesystem under the scheme of its own conventions.
     *
     * @throws IllegalArgumentException if its conventions carry no scheme
     */
    public void register(Filesystem fs) {
        Objects.requireNonNull(fs, "fs");
        String scheme = fs.getConventions().getScheme();
        if (scheme == null) {
            throw new IllegalArgumentException("Filesystem has no scheme of its own, register it by name: " + fs);
        }
        register(scheme, fs);
    }

    /**
     * Registers a filesystem. If another one was already registered for the same scheme,
     * it is replaced (not closed).
     */
    public void register(String scheme, Filesystem fs) {
        Objects.requireNonNull(fs, "fs");
        String key = normalizeScheme(scheme);
        Filesystem previous = registry.put(key, fs);

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Registered " + fs + " for '" + key + "'" + (previous != null ? ", replacing " + previous : ""));
        }
    }

    public @Nullable Filesystem unregister(String scheme) {
        String key = normalizeScheme(scheme);
        if (key.equals(defaultScheme)) {
            defaultScheme = null;
        }
        return registry.remove(key);
    }

    public @Nullable Filesystem getFilesystem(String scheme) {
        return registry.get(normalizeScheme(scheme));
    }

    public Set<String> getRegisteredSchemes() {
        return Collections.unmodifiableSet(registry.keySet());
    }

    /**
     * Plain paths (no {@code scheme://}) are looked up on this scheme's filesystem.
     */
    public void setDefaultScheme(@Nullable String scheme) {
        this.defaultScheme = scheme == null ? null : normalizeScheme(scheme);
    }

    public @Nullable String getDefaultScheme() {
        return defaultScheme;
    }

    /**
     * @throws InvalidPathnameException if no filesystem handles the scheme, or the path
     *                                  itself is invalid there
     */
    public Node find(String pathOrUri) throws InvalidPathnameException {
        Objects.requireNonNull(pathOrUri, "pathOrUri");

        Matcher matcher = SCHEME_PREFIX.matcher(pathOrUri);
        if (!matcher.find()) {
            String scheme = defaultScheme;
            if (scheme == null) {
                throw new InvalidPathnameException(pathOrUri, "no scheme given and no default scheme set");
            }
            return requireFilesystem(scheme, pathOrUri).getNode(pathOrUri);
        }

        String scheme = normalizeScheme(matcher.group(1));
        Filesystem fs = requireFilesystem(scheme, pathOrUri);
        if (fs.getConventions().getScheme() != null) {
            return fs.getNode(pathOrUri);
        }

        // The filesystem speaks plain paths: drop "scheme://authority".
        String rest = pathOrUri.substring(matcher.end());
        int slash = rest.indexOf('/');
        String path = slash < 0 ? "/" : rest.substring(slash);
        if (fs.getConventions().allowsDriveLetters() && DRIVE_PATH.matcher(path).find()) {
            // file:///C:/x names C:/x
            path = path.substring(1);
        }
        return fs.getNode(path);
    }

    private Filesystem requireFilesystem(String scheme, String pathOrUri) throws InvalidPathnameException {
        Filesystem fs = registry.get(scheme);
        if (fs == null) {
            throw new InvalidPathnameException(pathOrUri, "no filesystem registered for scheme '" + scheme + "'");
        }
        return fs;
    }

    /**
     * Closes and forgets every registered filesystem.
     */
    public void closeAll() {
        List<Filesystem> filesystems = new ArrayList<>(registry.values());
        registry.clear();
        defaultScheme = null;
        for (Filesystem fs : filesystems) {
            fs.close();
        }
    }

    private static String normalizeScheme(String scheme) {
        Objects.requireNonNull(scheme, "scheme");
        return scheme.toLowerCase(Locale.ROOT);
    }
}
