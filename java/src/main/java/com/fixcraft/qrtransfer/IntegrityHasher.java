package com.fixcraft.qrtransfer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 over the UTF-8 encoding of text. Chunk hashes keep the first 16 hex
 * characters, file hashes all 64.
 */
public final class IntegrityHasher {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final ThreadLocal<MessageDigest> SHA256_DIGEST = ThreadLocal.withInitial(IntegrityHasher::newDigest);

    private IntegrityHasher() {}

    public static String chunkHash(String body) {
        if (body == null) {
            throw new IllegalArgumentException("chunkHash expects text");
        }
        return sha256Hex(body).substring(0, Constants.CHUNK_HASH_LEN);
    }

    public static String fileHash(String content) {
        if (content == null) {
            throw new IllegalArgumentException("fileHash expects text");
        }
        return sha256Hex(content);
    }

    public static String fileHash(byte[] utf8) {
        if (utf8 == null) {
            throw new IllegalArgumentException("fileHash expects bytes");
        }
        MessageDigest md = SHA256_DIGEST.get();
        md.reset();
        return hexToString(md.digest(utf8));
    }

    /**
     * Incremental file hash for callers that never hold the whole text.
     */
    public static Running running() {
        return new Running();
    }

    public static final class Running {
        private final MessageDigest md = newDigest();

        private Running() {}

        public Running update(String text) {
            md.update(text.getBytes(StandardCharsets.UTF_8));
            return this;
        }

        public String hex() {
            return hexToString(md.digest());
        }
    }

    private static String sha256Hex(String text) {
        MessageDigest md = SHA256_DIGEST.get();
        md.reset();
        return hexToString(md.digest(text.getBytes(StandardCharsets.UTF_8)));
    }

    static String hexToString(byte[] input) {
        char[] out = new char[input.length * 2];
        for (int i = 0; i < input.length; i++) {
            int v = input[i] & 0xFF;
            out[i * 2] = HEX_CHARS[v >>> 4];
            out[i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(out);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException exc) {
            throw new IllegalStateException("SHA-256 unavailable", exc);
        }
    }
}
