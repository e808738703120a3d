package com.tyron.nanofs.api.vfs;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Objects;

/**
 * Describes how a backend spells paths: which characters separate segments, whether a
 * drive letter may lead the path, which URL scheme/authority denotes the root and which
 * character marks a hidden entry.
 * <p>
 * Canonical {@link Pathname}s always use {@code '/'}, whatever the backend accepts.
 */
public final class PathConventions {

    public static final PathConventions POSIX = new PathConventions("/", false, null, null, '.');

    public static final PathConventions WINDOWS = new PathConventions("/\\", true, null, null, '.');

    private final String separators;
    private final boolean driveLetters;
    private final String scheme;
    private final String authority;
    private final char hiddenMarker;

    public PathConventions(String separators,
                           boolean driveLetters,
                           @Nullable String scheme,
                           @Nullable String authority,
                           char hiddenMarker) {
        Objects.requireNonNull(separators, "separators");
        if (separators.isEmpty()) {
            throw new IllegalArgumentException("At least one separator is required");
        }
        if (scheme == null && authority != null) {
            throw new IllegalArgumentException("An authority requires a scheme");
        }
        this.separators = separators;
        this.driveLetters = driveLetters;
        this.scheme = scheme == null ? null : scheme.toLowerCase(Locale.ROOT);
        this.authority = authority == null ? null : authority.toLowerCase(Locale.ROOT);
        this.hiddenMarker = hiddenMarker;
    }

    /**
     * Conventions of a URL-addressed backend, e.g. {@code url("mem", "scratch")} for
     * {@code mem://scratch/...}.
     */
    public static PathConventions url(String scheme, String authority) {
        Objects.requireNonNull(scheme, "scheme");
        return new PathConventions("/", false, scheme, authority == null ? "" : authority, '.');
    }

    public boolean isSeparator(char c) {
        return separators.indexOf(c) >= 0;
    }

    public boolean allowsDriveLetters() {
        return driveLetters;
    }

    public @Nullable String getScheme() {
        return scheme;
    }

    public @Nullable String getAuthority() {
        return authority;
    }

    public char getHiddenMarker() {
        return hiddenMarker;
    }

    /**
     * @return the root marker used when a raw path carries no drive letter.
     */
    public String getDefaultRoot() {
        if (scheme != null) {
            return scheme + "://" + authority + "/";
        }
        return "/";
    }

    public PathConventions withHiddenMarker(char marker) {
        return new PathConventions(separators, driveLetters, scheme, authority, marker);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PathConventions that)) return false;
        return driveLetters == that.driveLetters
                && hiddenMarker == that.hiddenMarker
                && separators.equals(that.separators)
                && Objects.equals(scheme, that.scheme)
                && Objects.equals(authority, that.authority);
    }

    @Override
    public int hashCode() {
        return Objects.hash(separators, driveLetters, scheme, authority, hiddenMarker);
    }

    @Override
    public String toString() {
        return "PathConventions{" +
                "separators='" + separators + '\'' +
                ", driveLetters=" + driveLetters +
                ", root='" + getDefaultRoot() + '\'' +
                ", hiddenMarker=" + hiddenMarker +
                '}';
    }
}
