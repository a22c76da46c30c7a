package com.fixcraft.qrtransfer;

/**
 * A record matches neither wire grammar, or its header and footer disagree.
 * Scoped to a single record; reassembly skips the record and carries on.
 */
public final class ChunkFormatException extends TransferException {
    public ChunkFormatException(String message) {
        super(message);
    }

    public ChunkFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
