package com.tyron.nanofs.api.vfs;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Canonical, immutable location inside one filesystem.
 * <p>
 * A pathname is a root marker ({@code /}, {@code C:/} or {@code scheme://authority/})
 * followed by zero or more segments. Segments are never empty, never {@code .} and never
 * {@code ..}; trying to climb above the root is an {@link InvalidPathnameException}.
 * <p>
 * Equality, hashing and ordering only look at {@link #toString() the canonical string},
 * so different spellings of the same location are interchangeable as map keys.
 */
public final class Pathname implements Comparable<Pathname> {

    public static final char SEPARATOR = '/';

    private static final Pattern SCHEME_PREFIX = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*://");

    private final PathConventions conventions;
    private final String root;
    private final List<String> segments;
    private final String canonical;

    private Pathname(PathConventions conventions, String root, List<String> segments) {
        this.conventions = conventions;
        this.root = root;
        this.segments = Collections.unmodifiableList(segments);
        this.canonical = root + String.join(String.valueOf(SEPARATOR), segments);
    }

    public static Pathname root(PathConventions conventions) {
        Objects.requireNonNull(conventions, "conventions");
        return new Pathname(conventions, conventions.getDefaultRoot(), List.of());
    }

    /**
     * Parses a raw, backend-specific path string.
     * <p>
     * Every separator the conventions accept splits segments; empty and {@code .}
     * segments are dropped, {@code ..} removes the previous segment. An empty string
     * denotes the root, a relative string is taken relative to the root.
     *
     * A {@code scheme://authority} prefix is only recognized when the conventions carry
     * a scheme; elsewhere {@code a://b} is an ordinary relative path.
     *
     * @throws InvalidPathnameException if the string escapes the root, carries a
     *                                  foreign scheme or authority, or contains NUL
     */
    public static Pathname normalize(String raw, PathConventions conventions) throws InvalidPathnameException {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(conventions, "conventions");

        String root = conventions.getDefaultRoot();
        String rest = raw;

        if (hasDriveLetter(raw, conventions)) {
            root = Character.toUpperCase(raw.charAt(0)) + ":" + SEPARATOR;
            rest = raw.substring(2);
        } else if (conventions.getScheme() != null && SCHEME_PREFIX.matcher(raw).find()) {
            rest = stripUrlRoot(raw, conventions);
        }

        List<String> segments = new ArrayList<>();
        appendSegments(raw, rest, conventions, segments);
        return new Pathname(conventions, root, segments);
    }

    private static boolean hasDriveLetter(String raw, PathConventions conventions) {
        return conventions.allowsDriveLetters()
                && raw.length() >= 2
                && raw.charAt(1) == ':'
                && isAsciiLetter(raw.charAt(0))
                && (raw.length() == 2 || conventions.isSeparator(raw.charAt(2)));
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static String stripUrlRoot(String raw, PathConventions conventions) throws InvalidPathnameException {
        int schemeEnd = raw.indexOf("://");
        String scheme = raw.substring(0, schemeEnd).toLowerCase(Locale.ROOT);
        if (!scheme.equals(conventions.getScheme())) {
            throw new InvalidPathnameException(raw, "scheme '" + scheme + "' is not handled here");
        }

        String afterScheme = raw.substring(schemeEnd + 3);
        int authorityEnd = 0;
        while (authorityEnd < afterScheme.length() && !conventions.isSeparator(afterScheme.charAt(authorityEnd))) {
            authorityEnd++;
        }
        String authority = afterScheme.substring(0, authorityEnd).toLowerCase(Locale.ROOT);
        if (!authority.equals(conventions.getAuthority())) {
            throw new InvalidPathnameException(raw, "authority '" + authority + "' is not handled here");
        }
        return afterScheme.substring(authorityEnd);
    }

    private static void appendSegments(String raw,
                                       String rest,
                                       PathConventions conventions,
                                       List<String> out) throws InvalidPathnameException {
        int start = 0;
        for (int i = 0; i <= rest.length(); i++) {
            if (i < rest.length() && !conventions.isSeparator(rest.charAt(i))) {
                continue;
            }
            String segment = rest.substring(start, i);
            start = i + 1;

            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (out.isEmpty()) {
                    throw new InvalidPathnameException(raw, "ascends above the root");
                }
                out.remove(out.size() - 1);
                continue;
            }
            if (segment.indexOf('\0') >= 0) {
                throw new InvalidPathnameException(raw, "contains a NUL character");
            }
            out.add(segment);
        }
    }

    /**
     * @return true if the raw string carries its own root marker under these conventions.
     */
    public static boolean isAbsolute(String raw, PathConventions conventions) {
        if (raw.isEmpty()) {
            return false;
        }
        return conventions.isSeparator(raw.charAt(0))
                || hasDriveLetter(raw, conventions)
                || (conventions.getScheme() != null && SCHEME_PREFIX.matcher(raw).find());
    }

    /**
     * Appends relative segments to this pathname. Leading separators in {@code relative}
     * are ignored; {@code ..} may climb back up to, but not above, the root.
     */
    public Pathname join(String relative) throws InvalidPathnameException {
        Objects.requireNonNull(relative, "relative");
        List<String> joined = new ArrayList<>(segments);
        appendSegments(canonical + SEPARATOR + relative, relative, conventions, joined);
        return new Pathname(conventions, root, joined);
    }

    /**
     * Resolves a raw path the way a link target is read: absolute strings stand on their
     * own, relative ones are joined to this pathname.
     */
    public Pathname resolve(String raw) throws InvalidPathnameException {
        if (isAbsolute(raw, conventions)) {
            return normalize(raw, conventions);
        }
        return join(raw);
    }

    /**
     * @return the parent pathname, or null if this is the root.
     */
    public @Nullable Pathname getParent() {
        if (segments.isEmpty()) {
            return null;
        }
        return new Pathname(conventions, root, new ArrayList<>(segments.subList(0, segments.size() - 1)));
    }

    /**
     * @return the root this pathname hangs from, without any segments.
     */
    public Pathname getRootPathname() {
        return segments.isEmpty() ? this : new Pathname(conventions, root, List.of());
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    /**
     * @return the last segment, or the empty string for the root.
     */
    public String getBasename() {
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    /**
     * Returns the basename with {@code suffix} cut off, but only if the basename ends with
     * it exactly and is longer than it ({@code "README.md"} with {@code ".md"} gives
     * {@code "README"}, {@code ".md"} stays {@code ".md"}).
     */
    public String getBasename(String suffix) {
        String name = getBasename();
        if (suffix != null && !suffix.isEmpty()
                && name.length() > suffix.length()
                && name.endsWith(suffix)) {
            return name.substring(0, name.length() - suffix.length());
        }
        return name;
    }

    /**
     * @return The extension without the dot (e.g., "java"), or empty string if none.
     */
    public String getExtension() {
        String name = getBasename();
        int lastDot = name.lastIndexOf('.');
        if (lastDot > 0 && lastDot < name.length() - 1) {
            return name.substring(lastDot + 1);
        }
        return "";
    }

    public boolean isHidden() {
        String name = getBasename();
        return !name.isEmpty() && name.charAt(0) == conventions.getHiddenMarker();
    }

    public List<String> getSegments() {
        return segments;
    }

    public int getDepth() {
        return segments.size();
    }

    public String getRoot() {
        return root;
    }

    public PathConventions getConventions() {
        return conventions;
    }

    /**
     * @return true if {@code other} is this pathname or one of its ancestors.
     */
    public boolean startsWith(Pathname other) {
        return root.equals(other.root)
                && other.segments.size() <= segments.size()
                && segments.subList(0, other.segments.size()).equals(other.segments);
    }

    /**
     * Gets the path of {@code descendant} relative to this pathname, using {@code '/'}.
     * Returns null if it is not inside this pathname; the empty string for itself.
     */
    public @Nullable String relativize(Pathname descendant) {
        if (!descendant.startsWith(this)) {
            return null;
        }
        return String.join(String.valueOf(SEPARATOR), descendant.segments.subList(segments.size(), descendant.segments.size()));
    }

    @Override
    public int compareTo(Pathname o) {
        return canonical.compareTo(o.canonical);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pathname that)) return false;
        return canonical.equals(that.canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @Override
    public String toString() {
        return canonical;
    }
}
