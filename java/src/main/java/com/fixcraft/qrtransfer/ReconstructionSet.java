package com.fixcraft.qrtransfer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Records collected for one file name, keyed by part index. Records arrive in
 * any order; a repeated index replaces the earlier record. Parts beyond the
 * declared total are kept aside and never used.
 */
public final class ReconstructionSet {
    public enum State {
        COLLECTING,
        COMPLETE,
        VERIFIED,
        FAILED
    }

    private final String filename;
    private final Map<Integer, WireRecord> parts = new TreeMap<>();
    private final Map<Integer, WireRecord> extras = new TreeMap<>();
    private final Set<Integer> totals = new LinkedHashSet<>();
    private final Set<String> fileHashes = new LinkedHashSet<>();
    private final Set<Boolean> encryptedFlags = new LinkedHashSet<>();
    private State outcome;

    public ReconstructionSet(String filename) {
        if (filename == null || filename.isEmpty()) {
            throw new IllegalArgumentException("filename required");
        }
        this.filename = filename;
    }

    public String filename() {
        return filename;
    }

    /**
     * @return {@code true} when the record replaced one already held at its index
     */
    public boolean offer(WireRecord record) {
        if (record == null || !filename.equals(record.filename)) {
            throw new IllegalArgumentException("record does not belong to " + filename);
        }
        if (outcome != null) {
            throw new IllegalStateException(filename + " was already reconstructed");
        }
        totals.add(record.total);
        fileHashes.add(record.fileHash);
        encryptedFlags.add(record.encrypted);
        if (record.isExtra()) {
            RuntimeLog.part(RuntimeLog.Level.WARN, filename, record.index, record.total, "is beyond the declared total, ignored");
            return extras.put(record.index, record) != null;
        }
        WireRecord previous = parts.put(record.index, record);
        if (previous != null) {
            RuntimeLog.part(RuntimeLog.Level.WARN, filename, record.index, record.total, "seen again, keeping the latest copy");
        }
        return previous != null;
    }

    public State state() {
        if (outcome != null) {
            return outcome;
        }
        return isComplete() ? State.COMPLETE : State.COLLECTING;
    }

    /** Every index in 1..total is present and all records agree on the total. */
    public boolean isComplete() {
        return totals.size() == 1 && missingParts().isEmpty();
    }

    /**
     * @throws InconsistentMetadataException if records declare different totals
     */
    public int declaredTotal() {
        if (totals.size() != 1) {
            throw new InconsistentMetadataException(filename, "total", stringify(totals));
        }
        return totals.iterator().next();
    }

    /** Sorted list of absent indices, judged against the largest declared total. */
    public List<Integer> missingParts() {
        int total = 0;
        for (int t : totals) {
            total = Math.max(total, t);
        }
        List<Integer> missing = new ArrayList<>();
        for (int i = 1; i <= total; i++) {
            if (!parts.containsKey(i)) {
                missing.add(i);
            }
        }
        return missing;
    }

    /**
     * @throws InconsistentMetadataException on disagreement about total, file hash or encryption
     */
    public void checkConsistency() {
        declaredTotal();
        if (fileHashes.size() != 1) {
            throw new InconsistentMetadataException(filename, "file_hash", fileHashes);
        }
        if (encryptedFlags.size() != 1) {
            throw new InconsistentMetadataException(filename, "encrypted", stringify(encryptedFlags));
        }
    }

    public boolean isEncrypted() {
        return encryptedFlags.contains(Boolean.TRUE);
    }

    public String fileHash() {
        return fileHashes.isEmpty() ? null : fileHashes.iterator().next();
    }

    public int partCount() {
        return parts.size();
    }

    /** Held parts in index order, extras excluded. */
    public List<WireRecord> orderedParts() {
        return Collections.unmodifiableList(new ArrayList<>(parts.values()));
    }

    public List<WireRecord> extraParts() {
        return Collections.unmodifiableList(new ArrayList<>(extras.values()));
    }

    void markVerified() {
        outcome = State.VERIFIED;
    }

    void markFailed() {
        outcome = State.FAILED;
    }

    private static Set<String> stringify(Set<?> values) {
        Set<String> out = new LinkedHashSet<>();
        for (Object value : values) {
            out.add(String.valueOf(value));
        }
        return out;
    }
}
