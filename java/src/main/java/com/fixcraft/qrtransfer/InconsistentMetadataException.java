package com.fixcraft.qrtransfer;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public final class InconsistentMetadataException extends TransferException {
    private final String filename;
    private final String field;
    private final Set<String> values;

    public InconsistentMetadataException(String filename, String field, Set<String> values) {
        super(filename + ": records disagree on " + field + " " + values);
        this.filename = filename;
        this.field = field;
        this.values = Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    public String filename() {
        return filename;
    }

    /** One of {@code total}, {@code file_hash} or {@code encrypted}. */
    public String field() {
        return field;
    }

    public Set<String> values() {
        return values;
    }
}
