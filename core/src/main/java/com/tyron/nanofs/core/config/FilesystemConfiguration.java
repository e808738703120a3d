package com.tyron.nanofs.core.config;

import com.tyron.nanofs.api.vfs.PathConventions;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Settings of one {@link com.tyron.nanofs.core.vfs.AdapterFilesystem}.
 * <p>
 * Can be loaded from YAML:
 * <pre>
 * conventions: windows          # posix | windows | scheme://authority | mapping
 * hiddenMarker: "."
 * followLinks: true
 * maxLinkHops: 40
 * bufferSize: 8192
 * </pre>
 * A mapping under {@code conventions} may set {@code separators}, {@code driveLetters},
 * {@code scheme}, {@code authority} and {@code hiddenMarker}. Missing keys keep their
 * defaults.
 */
public final class FilesystemConfiguration {

    public static final int DEFAULT_BUFFER_SIZE = 8192;

    public static final int DEFAULT_MAX_LINK_HOPS = 40;

    private static final FilesystemConfiguration DEFAULTS =
            new FilesystemConfiguration(PathConventions.POSIX, true, DEFAULT_MAX_LINK_HOPS, DEFAULT_BUFFER_SIZE);

    private final PathConventions conventions;
    private final boolean followLinks;
    private final int maxLinkHops;
    private final int bufferSize;

    private FilesystemConfiguration(PathConventions conventions, boolean followLinks, int maxLinkHops, int bufferSize) {
        this.conventions = Objects.requireNonNull(conventions, "conventions");
        if (maxLinkHops < 1) {
            throw new IllegalArgumentException("maxLinkHops must be positive: " + maxLinkHops);
        }
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        }
        this.followLinks = followLinks;
        this.maxLinkHops = maxLinkHops;
        this.bufferSize = bufferSize;
    }

    public static FilesystemConfiguration defaults() {
        return DEFAULTS;
    }

    public static FilesystemConfiguration defaults(PathConventions conventions) {
        return DEFAULTS.withConventions(conventions);
    }

    /**
     * Reads a YAML document. An empty document yields the defaults.
     *
     * @throws IllegalArgumentException if a value has the wrong shape
     */
    public static FilesystemConfiguration load(InputStream in) {
        Object doc = new Yaml().load(in);
        if (doc == null) {
            return DEFAULTS;
        }
        if (!(doc instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Configuration must be a mapping, got " + doc.getClass().getSimpleName());
        }
        return fromMap(map);
    }

    public static FilesystemConfiguration fromMap(Map<?, ?> map) {
        PathConventions conventions = parseConventions(map.get("conventions"));

        Object hidden = map.get("hiddenMarker");
        if (hidden != null) {
            conventions = conventions.withHiddenMarker(toChar("hiddenMarker", hidden));
        }

        boolean followLinks = toBoolean("followLinks", map.get("followLinks"), DEFAULTS.followLinks);
        int maxLinkHops = toInt("maxLinkHops", map.get("maxLinkHops"), DEFAULTS.maxLinkHops);
        int bufferSize = toInt("bufferSize", map.get("bufferSize"), DEFAULTS.bufferSize);

        return new FilesystemConfiguration(conventions, followLinks, maxLinkHops, bufferSize);
    }

    private static PathConventions parseConventions(Object raw) {
        if (raw == null) {
            return DEFAULTS.conventions;
        }
        if (raw instanceof String name) {
            String v = name.trim();
            switch (v.toLowerCase(Locale.ROOT)) {
                case "posix":
                case "unix":
                    return PathConventions.POSIX;
                case "windows":
                    return PathConventions.WINDOWS;
                default:
                    break;
            }
            int idx = v.indexOf("://");
            if (idx > 0) {
                String authority = v.substring(idx + 3);
                if (authority.endsWith("/")) {
                    authority = authority.substring(0, authority.length() - 1);
                }
                return PathConventions.url(v.substring(0, idx), authority);
            }
            throw new IllegalArgumentException("Unknown conventions: " + v);
        }
        if (raw instanceof Map<?, ?> map) {
            Object separators = map.get("separators");
            Object scheme = map.get("scheme");
            Object authority = map.get("authority");
            Object hidden = map.get("hiddenMarker");
            return new PathConventions(
                    separators == null ? "/" : String.valueOf(separators),
                    toBoolean("driveLetters", map.get("driveLetters"), false),
                    scheme == null ? null : String.valueOf(scheme),
                    scheme == null ? null : (authority == null ? "" : String.valueOf(authority)),
                    hidden == null ? '.' : toChar("hiddenMarker", hidden)
            );
        }
        throw new IllegalArgumentException("conventions must be a name or a mapping, got " + raw);
    }

    private static boolean toBoolean(String key, Object raw, boolean fallback) {
        if (raw == null) return fallback;
        if (raw instanceof Boolean b) return b;
        throw new IllegalArgumentException(key + " must be a boolean, got " + raw);
    }

    private static int toInt(String key, Object raw, int fallback) {
        if (raw == null) return fallback;
        if (raw instanceof Integer i) return i;
        throw new IllegalArgumentException(key + " must be an integer, got " + raw);
    }

    private static char toChar(String key, Object raw) {
        String s = String.valueOf(raw);
        if (s.length() != 1) {
            throw new IllegalArgumentException(key + " must be a single character, got '" + s + "'");
        }
        return s.charAt(0);
    }

    public PathConventions getConventions() {
        return conventions;
    }

    /**
     * @return true if recursive listing descends into links that end at directories
     */
    public boolean isFollowLinks() {
        return followLinks;
    }

    /**
     * @return how many links one path resolution may pass before it counts as a cycle
     */
    public int getMaxLinkHops() {
        return maxLinkHops;
    }

    /**
     * @return chunk size for streaming copies and digests
     */
    public int getBufferSize() {
        return bufferSize;
    }

    public FilesystemConfiguration withConventions(PathConventions conventions) {
        return new FilesystemConfiguration(conventions, followLinks, maxLinkHops, bufferSize);
    }

    public FilesystemConfiguration withFollowLinks(boolean followLinks) {
        return new FilesystemConfiguration(conventions, followLinks, maxLinkHops, bufferSize);
    }

    public FilesystemConfiguration withMaxLinkHops(int maxLinkHops) {
        return new FilesystemConfiguration(conventions, followLinks, maxLinkHops, bufferSize);
    }

    public FilesystemConfiguration withBufferSize(int bufferSize) {
        return new FilesystemConfiguration(conventions, followLinks, maxLinkHops, bufferSize);
    }

    @Override
    public String toString() {
        return "FilesystemConfiguration{" +
                "conventions=" + conventions +
                ", followLinks=" + followLinks +
                ", maxLinkHops=" + maxLinkHops +
                ", bufferSize=" + bufferSize +
                '}';
    }
}
