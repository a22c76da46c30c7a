package com.fixcraft.qrtransfer;

import java.util.Objects;

/**
 * Parsed or freshly sealed wire record. {@code payload} is the plaintext body
 * for plain records and the base64 transport text for encrypted ones;
 * {@code chunkHash} always describes the plaintext.
 */
public final class WireRecord {
    public final int index;
    public final int total;
    public final String filename;
    public final String chunkHash;
    public final String fileHash;
    public final boolean encrypted;
    public final String payload;

    public WireRecord(int index, int total, String filename, String chunkHash, String fileHash,
                      boolean encrypted, String payload) {
        if (index < 1 || total < 1) {
            throw new IllegalArgumentException("index and total must be >= 1");
        }
        if (filename == null || filename.isEmpty()) {
            throw new IllegalArgumentException("filename required");
        }
        if (chunkHash == null || fileHash == null || payload == null) {
            throw new IllegalArgumentException("hashes and payload required");
        }
        this.index = index;
        this.total = total;
        this.filename = filename;
        this.chunkHash = chunkHash;
        this.fileHash = fileHash;
        this.encrypted = encrypted;
        this.payload = payload;
    }

    /** Record index lies beyond the total it declares. */
    public boolean isExtra() {
        return index > total;
    }

    public String render() {
        return ChunkCodec.render(this);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof WireRecord)) {
            return false;
        }
        WireRecord that = (WireRecord) other;
        return index == that.index
            && total == that.total
            && encrypted == that.encrypted
            && filename.equals(that.filename)
            && chunkHash.equals(that.chunkHash)
            && fileHash.equals(that.fileHash)
            && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, total, filename, chunkHash, fileHash, encrypted, payload);
    }

    @Override
    public String toString() {
        return String.format("%s part %02d/%02d%s [%s]", filename, index, total, encrypted ? " encrypted" : "", chunkHash);
    }
}
