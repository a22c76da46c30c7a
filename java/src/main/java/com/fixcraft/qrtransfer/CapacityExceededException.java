package com.fixcraft.qrtransfer;

/**
 * Raised when a file needs more chunks than the configured warning threshold
 * and the operator did not confirm.
 */
public final class CapacityExceededException extends TransferException {
    private final int chunks;
    private final int threshold;

    public CapacityExceededException(int chunks, int threshold) {
        super(chunks + " chunks exceed the confirmation threshold of " + threshold);
        this.chunks = chunks;
        this.threshold = threshold;
    }

    public int chunks() {
        return chunks;
    }

    public int threshold() {
        return threshold;
    }
}
