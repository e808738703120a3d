package com.tyron.nanofs.api.vfs;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of {@link Adapter#stat(Pathname)}.
 * <p>
 * Timestamps the backend does not track are null; the node turns them into
 * {@link UnsupportedCapabilityException}s instead of inventing values.
 */
public record NodeMetadata(NodeType type,
                           long size,
                           @Nullable Instant modifyTime,
                           @Nullable Instant accessTime,
                           @Nullable Instant creationTime) {

    public NodeMetadata {
        Objects.requireNonNull(type, "type");
        if (size < 0) {
            throw new IllegalArgumentException("size < 0: " + size);
        }
    }

    public static NodeMetadata of(NodeType type) {
        return new NodeMetadata(type, 0, null, null, null);
    }
}
