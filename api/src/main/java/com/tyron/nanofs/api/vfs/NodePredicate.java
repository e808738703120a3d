package com.tyron.nanofs.api.vfs;

/**
 * Arbitrary test used by {@link ListFilter#matching(NodePredicate)}.
 */
@FunctionalInterface
public interface NodePredicate {

    boolean test(Node node) throws FilesystemException;
}
