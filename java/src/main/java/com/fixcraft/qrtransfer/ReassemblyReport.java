package com.fixcraft.qrtransfer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-file results of a batch reassembly. One failing file never hides the
 * others.
 */
public final class ReassemblyReport {
    public enum Status {
        WRITTEN,
        VERIFIED,
        FAILED
    }

    public static final class Outcome {
        public final String filename;
        public final Status status;
        public final int parts;
        public final Path output;
        public final TransferException error;

        Outcome(String filename, Status status, int parts, Path output, TransferException error) {
            this.filename = filename;
            this.status = status;
            this.parts = parts;
            this.output = output;
            this.error = error;
        }

        public boolean ok() {
            return status != Status.FAILED;
        }
    }

    private final List<Outcome> outcomes = new ArrayList<>();
    private final int rejectedRecords;

    ReassemblyReport(List<Outcome> outcomes, int rejectedRecords) {
        this.outcomes.addAll(outcomes);
        this.rejectedRecords = rejectedRecords;
    }

    public List<Outcome> outcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public Outcome outcome(String filename) {
        for (Outcome outcome : outcomes) {
            if (outcome.filename.equals(filename)) {
                return outcome;
            }
        }
        return null;
    }

    public List<Outcome> failures() {
        List<Outcome> out = new ArrayList<>();
        for (Outcome outcome : outcomes) {
            if (!outcome.ok()) {
                out.add(outcome);
            }
        }
        return out;
    }

    /** Records that could not be parsed and were skipped. */
    public int rejectedRecords() {
        return rejectedRecords;
    }

    /** At least one file was handled and none failed. */
    public boolean isSuccess() {
        return !outcomes.isEmpty() && failures().isEmpty();
    }

    public String summary() {
        int ok = outcomes.size() - failures().size();
        StringBuilder sb = new StringBuilder();
        sb.append(ok).append(" of ").append(outcomes.size()).append(" file(s) reconstructed");
        if (rejectedRecords > 0) {
            sb.append(", ").append(rejectedRecords).append(" unreadable record(s) skipped");
        }
        return sb.toString();
    }
}
