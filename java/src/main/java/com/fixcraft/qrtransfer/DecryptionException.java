package com.fixcraft.qrtransfer;

/**
 * Wrong password or corrupted ciphertext. CBC carries no authentication tag, so
 * this is raised on bad padding or undecodable UTF-8 and cannot tell the two apart.
 */
public final class DecryptionException extends TransferException {
    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
