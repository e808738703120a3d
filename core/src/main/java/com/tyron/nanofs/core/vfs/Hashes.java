package com.tyron.nanofs.core.vfs;

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;

import java.io.IOException;
import java.io.InputStream;

/**
 * Streaming digests; content is never held in memory beyond one buffer.
 */
final class Hashes {

    private Hashes() {
    }

    static HashCode hash(InputStream in, HashFunction function, int bufferSize) throws IOException {
        Hasher hasher = function.newHasher();
        byte[] buffer = new byte[bufferSize];
        int read;
        while ((read = in.read(buffer)) != -1) {
            hasher.putBytes(buffer, 0, read);
        }
        return hasher.hash();
    }
}
