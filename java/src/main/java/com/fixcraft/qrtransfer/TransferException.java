package com.fixcraft.qrtransfer;

/**
 * Base of every failure raised while chunking, framing or reassembling a file.
 */
public class TransferException extends RuntimeException {
    public TransferException(String message) {
        super(message);
    }

    public TransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
