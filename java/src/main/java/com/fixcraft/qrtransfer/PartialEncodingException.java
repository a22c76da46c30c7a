package com.fixcraft.qrtransfer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public final class PartialEncodingException extends TransferException {
    private final Map<Integer, Throwable> failures;

    public PartialEncodingException(Map<Integer, Throwable> failures) {
        super("Encoding failed for parts " + new ArrayList<>(new TreeMap<>(failures).keySet()));
        this.failures = Collections.unmodifiableMap(new TreeMap<>(failures));
        for (Throwable cause : this.failures.values()) {
            addSuppressed(cause);
        }
    }

    public List<Integer> failedIndices() {
        return new ArrayList<>(failures.keySet());
    }

    public Map<Integer, Throwable> failures() {
        return failures;
    }
}
