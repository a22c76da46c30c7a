package com.fixcraft.qrtransfer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class MissingPartsException extends TransferException {
    private final String filename;
    private final int total;
    private final List<Integer> missingParts;

    public MissingPartsException(String filename, int total, List<Integer> missingParts) {
        super(filename + ": missing parts " + missingParts + " of " + total);
        this.filename = filename;
        this.total = total;
        this.missingParts = Collections.unmodifiableList(new ArrayList<>(missingParts));
    }

    public String filename() {
        return filename;
    }

    public int total() {
        return total;
    }

    /** Sorted ascending. */
    public List<Integer> missingParts() {
        return missingParts;
    }
}
