package com.tyron.nanofs.api.vfs;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One criterion of a listing call.
 * <p>
 * Filters of the same declarative category ({@link TypeMask}, {@link VisibilityMask},
 * {@link GlobPattern}) are OR'ed together, different categories are AND'ed, and every
 * {@link Predicate} is a separate required condition. {@link Recursive} does not
 * select anything, it only decides whether directories are descended into.
 */
public interface ListFilter {

    record TypeMask(Set<NodeType> types) implements ListFilter {
        public TypeMask {
            if (types.isEmpty()) {
                throw new IllegalArgumentException("Type mask without types");
            }
            types = Set.copyOf(types);
        }
    }

    record VisibilityMask(Set<Visibility> visibilities) implements ListFilter {
        public VisibilityMask {
            if (visibilities.isEmpty()) {
                throw new IllegalArgumentException("Visibility mask without visibilities");
            }
            visibilities = Set.copyOf(visibilities);
        }
    }

    record GlobPattern(String pattern) implements ListFilter {
        public GlobPattern {
            Objects.requireNonNull(pattern, "pattern");
        }
    }

    record Predicate(NodePredicate predicate) implements ListFilter {
        public Predicate {
            Objects.requireNonNull(predicate, "predicate");
        }
    }

    record Recursive(boolean enabled) implements ListFilter {
    }

    static ListFilter types(NodeType first, NodeType... rest) {
        return new TypeMask(EnumSet.of(first, rest));
    }

    static ListFilter files() {
        return types(NodeType.FILE);
    }

    static ListFilter directories() {
        return types(NodeType.DIRECTORY);
    }

    static ListFilter links() {
        return types(NodeType.LINK);
    }

    /**
     * Everything that is not a link.
     */
    static ListFilter opaque() {
        return types(NodeType.FILE, NodeType.DIRECTORY, NodeType.UNKNOWN);
    }

    static ListFilter hidden() {
        return new VisibilityMask(EnumSet.of(Visibility.HIDDEN));
    }

    static ListFilter visible() {
        return new VisibilityMask(EnumSet.of(Visibility.VISIBLE));
    }

    static ListFilter glob(String pattern) {
        return new GlobPattern(pattern);
    }

    static ListFilter matching(NodePredicate predicate) {
        return new Predicate(predicate);
    }

    static ListFilter recursive() {
        return new Recursive(true);
    }

    static ListFilter recursive(boolean enabled) {
        return new Recursive(enabled);
    }
}
