package com.fixcraft.qrtransfer;

/**
 * Turns one chunk into its wire record. Called concurrently from pool threads.
 */
@FunctionalInterface
public interface ChunkEncoder {
    WireRecord encode(Chunk chunk);

    static ChunkEncoder plain(String fileHash) {
        return chunk -> ChunkCodec.seal(chunk, fileHash);
    }

    static ChunkEncoder encrypted(String fileHash, ChunkCipher cipher) {
        if (cipher == null) {
            throw new IllegalArgumentException("cipher required");
        }
        return chunk -> ChunkCodec.seal(chunk, fileHash, cipher);
    }
}
