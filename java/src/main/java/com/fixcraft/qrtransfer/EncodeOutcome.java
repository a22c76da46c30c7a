package com.fixcraft.qrtransfer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Gathered result of a batch encode: the records that succeeded, in index
 * order, and the failure recorded against every index that did not.
 */
public final class EncodeOutcome {
    private final List<WireRecord> records;
    private final Map<Integer, Throwable> failures;

    EncodeOutcome(List<WireRecord> records, Map<Integer, Throwable> failures) {
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.failures = Collections.unmodifiableMap(new TreeMap<>(failures));
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }

    public List<WireRecord> records() {
        return records;
    }

    public List<Integer> failedIndices() {
        return new ArrayList<>(failures.keySet());
    }

    public Map<Integer, Throwable> failures() {
        return failures;
    }

    /**
     * @throws PartialEncodingException if any index failed
     */
    public List<WireRecord> recordsOrThrow() {
        if (!failures.isEmpty()) {
            throw new PartialEncodingException(failures);
        }
        return records;
    }
}
