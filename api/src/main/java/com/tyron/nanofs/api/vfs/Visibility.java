package com.tyron.nanofs.api.vfs;

/**
 * Whether a basename starts with the filesystem's hidden marker.
 */
public enum Visibility {
    HIDDEN,
    VISIBLE;

    public static Visibility of(Pathname pathname) {
        return pathname.isHidden() ? HIDDEN : VISIBLE;
    }
}
