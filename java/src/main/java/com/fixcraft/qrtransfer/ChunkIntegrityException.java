package com.fixcraft.qrtransfer;

public final class ChunkIntegrityException extends TransferException {
    private final String filename;
    private final int index;
    private final String expected;
    private final String actual;

    public ChunkIntegrityException(String filename, int index, String expected, String actual) {
        super(String.format("%s: part %02d hash mismatch (expected %s, got %s)", filename, index, expected, actual));
        this.filename = filename;
        this.index = index;
        this.expected = expected;
        this.actual = actual;
    }

    public String filename() {
        return filename;
    }

    public int index() {
        return index;
    }

    public String expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }
}
