package com.tyron.nanofs.api.vfs;

/**
 * A chain of links leads back into itself.
 */
public class CyclicStructureException extends FilesystemException {

    private final Pathname target;

    public CyclicStructureException(Pathname pathname, Pathname target) {
        super(Kind.CYCLIC_STRUCTURE, pathname, "Link cycle at " + pathname + " (re-enters " + target + ")");
        this.target = target;
    }

    /**
     * @return the already visited location the link points back to.
     */
    public Pathname getTarget() {
        return target;
    }
}
