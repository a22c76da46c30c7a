package com.fixcraft.qrtransfer;

import java.util.Arrays;

/**
 * Output of one chunk encryption. Transport layout is
 * {@code salt(16) || iv(16) || ciphertext}.
 */
public final class EncryptedPayload {
    private final byte[] ciphertext;
    private final byte[] salt;
    private final byte[] iv;

    public EncryptedPayload(byte[] ciphertext, byte[] salt, byte[] iv) {
        if (ciphertext == null || salt == null || iv == null) {
            throw new IllegalArgumentException("payload parts must not be null");
        }
        if (salt.length != Constants.SALT_LEN || iv.length != Constants.IV_LEN) {
            throw new IllegalArgumentException("salt and iv must be 16 bytes");
        }
        this.ciphertext = ciphertext.clone();
        this.salt = salt.clone();
        this.iv = iv.clone();
    }

    public byte[] ciphertext() {
        return ciphertext.clone();
    }

    public byte[] salt() {
        return salt.clone();
    }

    public byte[] iv() {
        return iv.clone();
    }

    public int ciphertextLength() {
        return ciphertext.length;
    }

    byte[] pack() {
        byte[] out = new byte[salt.length + iv.length + ciphertext.length];
        System.arraycopy(salt, 0, out, 0, salt.length);
        System.arraycopy(iv, 0, out, salt.length, iv.length);
        System.arraycopy(ciphertext, 0, out, salt.length + iv.length, ciphertext.length);
        return out;
    }

    static EncryptedPayload unpack(byte[] combined) {
        int head = Constants.SALT_LEN + Constants.IV_LEN;
        if (combined.length < head) {
            throw new ChunkFormatException("Invalid encrypted chunk format: " + combined.length + " bytes");
        }
        return new EncryptedPayload(
            Arrays.copyOfRange(combined, head, combined.length),
            Arrays.copyOfRange(combined, 0, Constants.SALT_LEN),
            Arrays.copyOfRange(combined, Constants.SALT_LEN, head));
    }
}
