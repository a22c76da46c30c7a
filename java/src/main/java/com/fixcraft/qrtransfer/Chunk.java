package com.fixcraft.qrtransfer;

/**
 * One plaintext slice of a file before framing. Bodies of indices 1..total,
 * joined in order, give back the source text.
 */
public final class Chunk {
    public final int index;
    public final int total;
    public final String filename;
    public final String body;

    public Chunk(int index, int total, String filename, String body) {
        if (total < 1 || index < 1 || index > total) {
            throw new IllegalArgumentException("index " + index + " out of range 1.." + total);
        }
        if (filename == null || filename.isEmpty()) {
            throw new IllegalArgumentException("filename required");
        }
        if (body == null) {
            throw new IllegalArgumentException("body required");
        }
        this.index = index;
        this.total = total;
        this.filename = filename;
        this.body = body;
    }
}
