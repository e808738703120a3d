package com.tyron.nanofs.core.filter;

import com.tyron.nanofs.api.vfs.ListFilter;
import com.tyron.nanofs.api.vfs.NodePredicate;
import com.tyron.nanofs.api.vfs.NodeType;
import com.tyron.nanofs.api.vfs.Visibility;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * Turns the filters of a listing call into one {@link ListEvaluator}.
 * <p>
 * Composition:
 * <ol>
 *     <li>all type masks are OR'ed; a node's own type must be in the union</li>
 *     <li>all visibility masks are OR'ed</li>
 *     <li>all glob patterns are OR'ed against the basename</li>
 *     <li>every predicate must hold</li>
 *     <li>the last {@link ListFilter.Recursive} decides recursion (default: off)</li>
 * </ol>
 * Categories that are absent do not restrict anything, and different categories are AND'ed.
 */
public final class FilterEngine {

    private FilterEngine() {
    }

    public static ListEvaluator compile(List<? extends ListFilter> filters) {
        return compile(filters, true);
    }

    /**
     * @param followLinks whether links that end at directories are descended into
     * @throws IllegalArgumentException on a malformed glob or an unknown filter type
     */
    public static ListEvaluator compile(List<? extends ListFilter> filters, boolean followLinks) {
        Objects.requireNonNull(filters, "filters");

        EnumSet<NodeType> types = null;
        EnumSet<Visibility> visibilities = null;
        List<GlobMatcher> globs = new ArrayList<>();
        List<NodePredicate> predicates = new ArrayList<>();
        boolean recursive = false;

        for (ListFilter filter : filters) {
            Objects.requireNonNull(filter, "filter");
            if (filter instanceof ListFilter.TypeMask mask) {
                if (types == null) types = EnumSet.noneOf(NodeType.class);
                types.addAll(mask.types());
            } else if (filter instanceof ListFilter.VisibilityMask mask) {
                if (visibilities == null) visibilities = EnumSet.noneOf(Visibility.class);
                visibilities.addAll(mask.visibilities());
            } else if (filter instanceof ListFilter.GlobPattern glob) {
                globs.add(GlobMatcher.compile(glob.pattern()));
            } else if (filter instanceof ListFilter.Predicate predicate) {
                predicates.add(predicate.predicate());
            } else if (filter instanceof ListFilter.Recursive flag) {
                recursive = flag.enabled();
            } else {
                throw new IllegalArgumentException("Unknown list filter: " + filter.getClass().getName());
            }
        }

        return new ListEvaluator(types, visibilities, globs, predicates, recursive, followLinks);
    }
}
