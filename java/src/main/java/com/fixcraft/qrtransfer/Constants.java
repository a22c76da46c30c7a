package com.fixcraft.qrtransfer;

import java.util.Locale;

public final class Constants {
    private Constants() {}

    public static final String BEGIN_PREFIX = "--BEGIN ";
    public static final String END_PREFIX = "--END ";
    public static final String ENCRYPTED_MARKER = "ENCRYPTED ";
    public static final String PART_PREFIX = "part_";
    public static final String OF_SEPARATOR = "_of_";
    public static final String FILE_FIELD = " file: ";
    public static final String CHUNK_HASH_FIELD = " chunk_hash: ";
    public static final String FILE_HASH_FIELD = " file_hash: ";
    public static final String FRAME_CLOSE = "--";

    public static final int CHUNK_HASH_LEN = 16;
    public static final int FILE_HASH_LEN = 64;

    public static final int SALT_LEN = 16;
    public static final int IV_LEN = 16;
    public static final int KEY_LEN = 32;
    public static final int BLOCK_LEN = 16;
    public static final int DEFAULT_KDF_ITERATIONS = 100000;
    public static final int MIN_PASSWORD_LEN = 8;
    public static final int PASSWORD_ATTEMPTS = 3;

    // QR version 40 at error correction L, byte mode.
    public static final int DEFAULT_MAX_SYMBOL_BYTES = 2953;
    public static final int DEFAULT_SAFETY_MARGIN_PCT = 80;
    public static final int DEFAULT_CAPACITY_WARN = 100;
    public static final int DEFAULT_PARALLEL_THRESHOLD = 3;
    public static final int MAX_WORKERS = 8;

    public static final int DEFAULT_BOX_SIZE = 10;
    public static final int DEFAULT_BORDER = 4;

    public static final String CHUNK_FILE_EXT = ".txt";
    public static final String SYMBOL_FILE_EXT = ".png";
    public static final String ENCRYPTED_STEM_SUFFIX = "_encrypted";

    public static final String ENV_MAX_SYMBOL_BYTES = "QRTRANSFER_MAX_SYMBOL_BYTES";
    public static final String ENV_SAFETY_MARGIN_PCT = "QRTRANSFER_SAFETY_MARGIN_PCT";
    public static final String ENV_CAPACITY_WARN = "QRTRANSFER_CAPACITY_WARN";
    public static final String ENV_WORKERS = "QRTRANSFER_WORKERS";
    public static final String ENV_FORCE_SINGLE_THREAD = "QRTRANSFER_FORCE_SINGLE_THREAD";
    public static final String ENV_PARALLEL_THRESHOLD = "QRTRANSFER_PARALLEL_THRESHOLD";
    public static final String ENV_KDF_ITERS = "QRTRANSFER_KDF_ITERS";
    public static final String ENV_CRYPTO_BACKEND = "QRTRANSFER_CRYPTO_BACKEND";

    public static final int KDF_ITERATIONS = resolveKdfIterations();

    private static int resolveKdfIterations() {
        Integer env = envInt(ENV_KDF_ITERS);
        if (env != null && env > 0) {
            return env;
        }
        return DEFAULT_KDF_ITERATIONS;
    }

    static Integer envInt(String name) {
        String raw = System.getenv(name);
        if (raw == null) {
            return null;
        }
        raw = raw.trim();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException exc) {
            return null;
        }
    }

    static boolean envTruthy(String name) {
        return truthy(System.getenv(name));
    }

    static boolean truthy(String raw) {
        if (raw == null) {
            return false;
        }
        String value = raw.trim().toLowerCase(Locale.US);
        return "1".equals(value) || "true".equals(value) || "yes".equals(value) || "on".equals(value);
    }
}
