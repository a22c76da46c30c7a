package com.fixcraft.qrtransfer;

/**
 * The joined plaintext does not hash to the declared file hash although every
 * chunk verified on its own. Unreachable while completeness and chunk checks hold.
 */
public final class FileIntegrityException extends TransferException {
    private final String filename;
    private final String expected;
    private final String actual;

    public FileIntegrityException(String filename, String expected, String actual) {
        super(filename + ": file hash mismatch (expected " + expected + ", got " + actual + ")");
        this.filename = filename;
        this.expected = expected;
        this.actual = actual;
    }

    public String filename() {
        return filename;
    }

    public String expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }
}
