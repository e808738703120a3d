package com.tyron.nanofs.core.filter;

import com.tyron.nanofs.api.vfs.FilesystemException;
import com.tyron.nanofs.api.vfs.Node;
import com.tyron.nanofs.api.vfs.NodePredicate;
import com.tyron.nanofs.api.vfs.NodeType;
import com.tyron.nanofs.api.vfs.Visibility;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Set;

/**
 * Compiled form of a list of {@link com.tyron.nanofs.api.vfs.ListFilter}s.
 *
 * @see FilterEngine#compile(List)
 */
public final class ListEvaluator {

    private final Set<NodeType> types;
    private final Set<Visibility> visibilities;
    private final List<GlobMatcher> globs;
    private final List<NodePredicate> predicates;
    private final boolean recursive;
    private final boolean followLinks;

    ListEvaluator(@Nullable Set<NodeType> types,
                  @Nullable Set<Visibility> visibilities,
                  List<GlobMatcher> globs,
                  List<NodePredicate> predicates,
                  boolean recursive,
                  boolean followLinks) {
        this.types = types == null ? null : Set.copyOf(types);
        this.visibilities = visibilities == null ? null : Set.copyOf(visibilities);
        this.globs = List.copyOf(globs);
        this.predicates = List.copyOf(predicates);
        this.recursive = recursive;
        this.followLinks = followLinks;
    }

    /**
     * Decides whether {@code node} belongs in the listing. Cheap checks (name based) run
     * before the ones that hit the adapter.
     */
    public boolean accepts(Node node) throws FilesystemException {
        if (visibilities != null && !visibilities.contains(Visibility.of(node.getPathname()))) {
            return false;
        }
        if (!globs.isEmpty() && !matchesAnyGlob(node.getBasename())) {
            return false;
        }
        if (types != null && !types.contains(node.getType())) {
            return false;
        }
        for (NodePredicate predicate : predicates) {
            if (!predicate.test(node)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Independent of {@link #accepts(Node)}: a directory left out of the result is still
     * descended into.
     */
    public boolean recursesInto(Node node) throws FilesystemException {
        if (!recursive) {
            return false;
        }
        if (followLinks) {
            return node.isDirectory();
        }
        return node.getType() == NodeType.DIRECTORY;
    }

    public boolean isRecursive() {
        return recursive;
    }

    private boolean matchesAnyGlob(String basename) {
        for (GlobMatcher glob : globs) {
            if (glob.matches(basename)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ListEvaluator{" +
                "types=" + (types == null ? "*" : types) +
                ", visibilities=" + (visibilities == null ? "*" : visibilities) +
                ", globs=" + globs +
                ", predicates=" + predicates.size() +
                ", recursive=" + recursive +
                '}';
    }
}
