package com.tyron.nanofs.api.vfs.capability;

/**
 * Marker for optional adapter features, looked up with
 * {@link com.tyron.nanofs.api.vfs.Adapter#getCapability(Class)}.
 */
public interface AdapterCapability {
}
