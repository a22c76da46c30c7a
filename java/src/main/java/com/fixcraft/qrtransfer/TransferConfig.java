package com.fixcraft.qrtransfer;

/**
 * Immutable settings for one transfer. Built from compiled defaults, then the
 * {@code QRTRANSFER_*} environment, then CLI flags through the {@code with*}
 * copies.
 */
public final class TransferConfig {
    public final int maxSymbolBytes;
    public final int safetyMarginPct;
    public final int capacityWarn;
    public final int workers;
    public final int parallelThreshold;
    public final int kdfIterations;
    public final CryptoBackend backend;
    public final SymbolOptions symbolOptions;

    public TransferConfig(int maxSymbolBytes, int safetyMarginPct, int capacityWarn, int workers,
                          int parallelThreshold, int kdfIterations, CryptoBackend backend,
                          SymbolOptions symbolOptions) {
        if (maxSymbolBytes < 1) {
            throw new IllegalArgumentException("maxSymbolBytes must be >= 1");
        }
        if (safetyMarginPct < 1 || safetyMarginPct > 100) {
            throw new IllegalArgumentException("safety margin must be 1..100 percent");
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1");
        }
        if (kdfIterations < 1) {
            throw new IllegalArgumentException("kdfIterations must be >= 1");
        }
        this.maxSymbolBytes = maxSymbolBytes;
        this.safetyMarginPct = safetyMarginPct;
        this.capacityWarn = capacityWarn;
        this.workers = workers;
        this.parallelThreshold = Math.max(0, parallelThreshold);
        this.kdfIterations = kdfIterations;
        this.backend = backend == null ? CryptoBackends.get() : backend;
        this.symbolOptions = symbolOptions == null ? SymbolOptions.defaults() : symbolOptions;
    }

    public static TransferConfig defaults() {
        return new TransferConfig(
            Constants.DEFAULT_MAX_SYMBOL_BYTES,
            Constants.DEFAULT_SAFETY_MARGIN_PCT,
            Constants.DEFAULT_CAPACITY_WARN,
            ParallelEncoder.defaultWorkers(),
            Constants.DEFAULT_PARALLEL_THRESHOLD,
            Constants.DEFAULT_KDF_ITERATIONS,
            CryptoBackends.get(),
            SymbolOptions.defaults());
    }

    public static TransferConfig fromEnvironment() {
        int workers = positive(Constants.envInt(Constants.ENV_WORKERS), ParallelEncoder.defaultWorkers());
        if (Constants.envTruthy(Constants.ENV_FORCE_SINGLE_THREAD)) {
            RuntimeLog.warn("Multi-threading disabled by " + Constants.ENV_FORCE_SINGLE_THREAD);
            workers = 1;
        }
        Integer threshold = Constants.envInt(Constants.ENV_PARALLEL_THRESHOLD);
        return new TransferConfig(
            positive(Constants.envInt(Constants.ENV_MAX_SYMBOL_BYTES), Constants.DEFAULT_MAX_SYMBOL_BYTES),
            percent(Constants.envInt(Constants.ENV_SAFETY_MARGIN_PCT)),
            positive(Constants.envInt(Constants.ENV_CAPACITY_WARN), Constants.DEFAULT_CAPACITY_WARN),
            workers,
            threshold != null && threshold >= 0 ? threshold : Constants.DEFAULT_PARALLEL_THRESHOLD,
            Constants.KDF_ITERATIONS,
            CryptoBackends.get(),
            SymbolOptions.defaults());
    }

    /** Byte cap for plaintext chunk bodies. */
    public int chunkCap() {
        return Math.max(1, (int) ((long) maxSymbolBytes * safetyMarginPct / 100));
    }

    /**
     * Byte cap for bodies that will be encrypted, sized so that
     * base64(salt || iv || padded ciphertext) stays within {@link #chunkCap()}.
     */
    public int encryptedChunkCap() {
        int rawBudget = chunkCap() / 4 * 3;
        int cipherBudget = rawBudget - Constants.SALT_LEN - Constants.IV_LEN;
        int bodyBudget = cipherBudget / Constants.BLOCK_LEN * Constants.BLOCK_LEN - 1;
        return Math.max(1, bodyBudget);
    }

    public int chunkCap(boolean encrypted) {
        return encrypted ? encryptedChunkCap() : chunkCap();
    }

    public ParallelEncoder parallelEncoder() {
        return new ParallelEncoder(workers, parallelThreshold);
    }

    public TransferConfig withWorkers(int value) {
        return new TransferConfig(maxSymbolBytes, safetyMarginPct, capacityWarn, value,
            parallelThreshold, kdfIterations, backend, symbolOptions);
    }

    public TransferConfig withMaxSymbolBytes(int value) {
        return new TransferConfig(value, safetyMarginPct, capacityWarn, workers,
            parallelThreshold, kdfIterations, backend, symbolOptions);
    }

    public TransferConfig withCapacityWarn(int value) {
        return new TransferConfig(maxSymbolBytes, safetyMarginPct, value, workers,
            parallelThreshold, kdfIterations, backend, symbolOptions);
    }

    public TransferConfig withParallelThreshold(int value) {
        return new TransferConfig(maxSymbolBytes, safetyMarginPct, capacityWarn, workers,
            value, kdfIterations, backend, symbolOptions);
    }

    public TransferConfig withKdfIterations(int value) {
        return new TransferConfig(maxSymbolBytes, safetyMarginPct, capacityWarn, workers,
            parallelThreshold, value, backend, symbolOptions);
    }

    public TransferConfig withBackend(CryptoBackend value) {
        return new TransferConfig(maxSymbolBytes, safetyMarginPct, capacityWarn, workers,
            parallelThreshold, kdfIterations, value, symbolOptions);
    }

    public TransferConfig withSymbolOptions(SymbolOptions value) {
        return new TransferConfig(maxSymbolBytes, safetyMarginPct, capacityWarn, workers,
            parallelThreshold, kdfIterations, backend, value);
    }

    /** Cipher bound to this config's backend and iteration count. */
    public ChunkCipher newCipher(char[] password) {
        return new ChunkCipher(password, backend, kdfIterations);
    }

    public Reassembler newReassembler(PasswordSource passwords) {
        return new Reassembler(passwords, backend, kdfIterations);
    }

    private static int positive(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private static int percent(Integer value) {
        return value != null && value >= 1 && value <= 100 ? value : Constants.DEFAULT_SAFETY_MARGIN_PCT;
    }
}
