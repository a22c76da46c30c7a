package com.fixcraft.qrtransfer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects wire records from any source, groups them by file name and rebuilds
 * each file once its parts are all present. For every file: metadata must
 * agree, no part may be missing, every plaintext part must match its chunk
 * hash and the joined text must match the file hash. Only then is anything
 * written. Failures are scoped to the file they concern.
 *
 * <p>Single-threaded. One password serves every encrypted file of a run; it is
 * asked for lazily and re-asked only while the first encrypted part keeps
 * failing to decrypt. Once the attempts are used up the last password is kept
 * and tried on the remaining files without asking again. Malformed ciphertext
 * fails its own file and costs no attempt.
 */
public final class Reassembler implements AutoCloseable {
    private final PasswordSource passwords;
    private final CryptoBackend backend;
    private final int kdfIterations;
    private final Map<String, ReconstructionSet> sets = new LinkedHashMap<>();
    private final List<String> rejected = new ArrayList<>();

    private ChunkCipher cipher;
    private boolean passwordConfirmed;
    private boolean passwordAbandoned;
    private int passwordAttempts;

    public Reassembler() {
        this(PasswordSource.none());
    }

    public Reassembler(PasswordSource passwords) {
        this(passwords, CryptoBackends.get(), Constants.KDF_ITERATIONS);
    }

    public Reassembler(PasswordSource passwords, CryptoBackend backend, int kdfIterations) {
        if (backend == null) {
            throw new IllegalArgumentException("backend required");
        }
        if (kdfIterations <= 0) {
            throw new IllegalArgumentException("kdfIterations must be > 0");
        }
        this.passwords = passwords == null ? PasswordSource.none() : passwords;
        this.backend = backend;
        this.kdfIterations = kdfIterations;
    }

    public ReconstructionSet offer(WireRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record required");
        }
        ReconstructionSet set = sets.computeIfAbsent(record.filename, ReconstructionSet::new);
        boolean wasComplete = set.isComplete();
        set.offer(record);
        RuntimeLog.part(RuntimeLog.Level.DEBUG, record.filename, record.index, record.total, null);
        if (!wasComplete && set.isComplete()) {
            RuntimeLog.info(String.format("%s: all %d part(s) present", set.filename(), set.partCount()));
        }
        return set;
    }

    /**
     * Parses and offers one record. A malformed record is logged and skipped.
     *
     * @param source where the text came from, used in log lines
     * @return the parsed record, or {@code null} when it was rejected
     */
    public WireRecord offerText(String source, String text) {
        WireRecord record;
        try {
            record = ChunkCodec.decode(text);
        } catch (ChunkFormatException exc) {
            RuntimeLog.warn("Skipping unreadable record from " + source + ": " + exc.getMessage());
            RuntimeLog.debug("  " + ChunkCodec.describe(text));
            rejected.add(source);
            return null;
        }
        offer(record);
        return record;
    }

    public Map<String, ReconstructionSet> sets() {
        return Collections.unmodifiableMap(sets);
    }

    public ReconstructionSet set(String filename) {
        return sets.get(filename);
    }

    public List<String> rejectedSources() {
        return Collections.unmodifiableList(rejected);
    }

    /**
     * Runs every check for one file and returns its content without writing it.
     * The set stays held; use {@link #rebuildAll} for the batch path.
     */
    public String reconstruct(String filename) {
        ReconstructionSet set = sets.get(filename);
        if (set == null) {
            throw new IllegalArgumentException("No parts collected for " + filename);
        }
        return verify(set);
    }

    /** Checks every held file and writes nothing. */
    public ReassemblyReport verifyAll() {
        return finish(null, false);
    }

    /**
     * Checks and writes every held file into {@code outputDir}. Finished sets are
     * dropped whether they succeeded or failed.
     */
    public ReassemblyReport rebuildAll(Path outputDir, boolean overwrite) {
        if (outputDir == null) {
            throw new IllegalArgumentException("outputDir required");
        }
        return finish(outputDir, overwrite);
    }

    private ReassemblyReport finish(Path outputDir, boolean overwrite) {
        List<ReassemblyReport.Outcome> outcomes = new ArrayList<>();
        for (ReconstructionSet set : new ArrayList<>(sets.values())) {
            String name = set.filename();
            try {
                String content = verify(set);
                if (outputDir == null) {
                    RuntimeLog.info(name + ": verified " + set.partCount() + " part(s)");
                    outcomes.add(new ReassemblyReport.Outcome(name, ReassemblyReport.Status.VERIFIED,
                        set.partCount(), null, null));
                } else {
                    Path written = OutputWriter.write(outputDir, name, content, overwrite);
                    RuntimeLog.info(name + ": rebuilt from " + set.partCount() + " part(s) -> " + written);
                    outcomes.add(new ReassemblyReport.Outcome(name, ReassemblyReport.Status.WRITTEN,
                        set.partCount(), written, null));
                }
                set.markVerified();
            } catch (TransferException exc) {
                RuntimeLog.error(exc.getMessage());
                set.markFailed();
                outcomes.add(new ReassemblyReport.Outcome(name, ReassemblyReport.Status.FAILED,
                    set.partCount(), null, exc));
            }
            sets.remove(name);
        }
        return new ReassemblyReport(outcomes, rejected.size());
    }

    private String verify(ReconstructionSet set) {
        String name = set.filename();
        set.checkConsistency();
        List<Integer> missing = set.missingParts();
        if (!missing.isEmpty()) {
            throw new MissingPartsException(name, set.declaredTotal(), missing);
        }
        if (!set.extraParts().isEmpty()) {
            RuntimeLog.warn(name + ": " + set.extraParts().size() + " extra part(s) not used");
        }
        StringBuilder content = new StringBuilder();
        IntegrityHasher.Running fileHash = IntegrityHasher.running();
        for (WireRecord record : set.orderedParts()) {
            String body = record.encrypted ? decrypt(record) : record.payload;
            String actual = IntegrityHasher.chunkHash(body);
            if (!actual.equals(record.chunkHash)) {
                throw new ChunkIntegrityException(name, record.index, record.chunkHash, actual);
            }
            content.append(body);
            fileHash.update(body);
        }
        String actualFileHash = fileHash.hex();
        if (!actualFileHash.equals(set.fileHash())) {
            throw new FileIntegrityException(name, set.fileHash(), actualFileHash);
        }
        return content.toString();
    }

    private String decrypt(WireRecord record) {
        EncryptedPayload payload = ChunkCipher.fromTransport(record.payload);
        if (passwordConfirmed) {
            return cipher.decrypt(payload);
        }
        while (true) {
            ChunkCipher current = sessionCipher(record.filename);
            try {
                String body = current.decrypt(payload);
                passwordConfirmed = true;
                return body;
            } catch (DecryptionException exc) {
                if (passwordAbandoned || passwordAttempts >= Constants.PASSWORD_ATTEMPTS) {
                    // no more prompts; the last password is still tried on the remaining files
                    passwordAbandoned = true;
                    throw new DecryptionException(record.filename + ": could not decrypt with any of "
                        + passwordAttempts + " password attempt(s)", exc);
                }
                dropCipher();
                RuntimeLog.warn(record.filename + ": wrong password or corrupted data, try again");
            }
        }
    }

    private ChunkCipher sessionCipher(String filename) {
        if (cipher != null) {
            return cipher;
        }
        if (passwordAbandoned) {
            throw new DecryptionException(filename + ": no usable password for encrypted parts");
        }
        while (passwordAttempts < Constants.PASSWORD_ATTEMPTS) {
            passwordAttempts++;
            char[] password = passwords.password(filename, passwordAttempts);
            if (password == null) {
                passwordAbandoned = true;
                throw new DecryptionException(filename + ": encrypted parts need a password");
            }
            try {
                cipher = new ChunkCipher(password, backend, kdfIterations);
                return cipher;
            } catch (IllegalArgumentException exc) {
                RuntimeLog.warn(exc.getMessage());
            } finally {
                Arrays.fill(password, '\0');
            }
        }
        passwordAbandoned = true;
        throw new DecryptionException(filename + ": no usable password after " + passwordAttempts + " attempt(s)");
    }

    private void dropCipher() {
        if (cipher != null) {
            cipher.close();
            cipher = null;
        }
    }

    @Override
    public void close() {
        dropCipher();
        passwordConfirmed = false;
    }
}
