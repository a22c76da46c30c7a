package com.fixcraft.qrtransfer;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import javax.crypto.BadPaddingException;

/**
 * Password-based encryption of single chunk bodies: PBKDF2-HMAC-SHA256 with a
 * fresh 16-byte salt per call, AES-256-CBC with a fresh 16-byte IV per call.
 * Holds a private copy of the password until {@link #close()}; derived keys
 * live only for the duration of one call. Safe for concurrent use.
 */
public final class ChunkCipher implements AutoCloseable {
    private static final SecureRandom RNG = new SecureRandom();

    private final CryptoBackend backend;
    private final int iterations;
    private volatile char[] password;

    public ChunkCipher(char[] password) {
        this(password, CryptoBackends.get(), Constants.KDF_ITERATIONS);
    }

    public ChunkCipher(char[] password, CryptoBackend backend, int iterations) {
        PasswordPolicy.requireValid(password);
        if (backend == null) {
            throw new IllegalArgumentException("backend required");
        }
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be > 0");
        }
        this.backend = backend;
        this.iterations = iterations;
        this.password = password.clone();
    }

    public CryptoBackend backend() {
        return backend;
    }

    public EncryptedPayload encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("encrypt expects text");
        }
        byte[] salt = randomBytes(Constants.SALT_LEN);
        byte[] iv = randomBytes(Constants.IV_LEN);
        byte[] data = plaintext.getBytes(StandardCharsets.UTF_8);
        byte[] key = null;
        try {
            key = backend.deriveKey(openPassword(), salt, iterations, Constants.KEY_LEN);
            return new EncryptedPayload(backend.encryptCbc(key, iv, data), salt, iv);
        } catch (GeneralSecurityException exc) {
            throw new IllegalStateException("Chunk encryption failed", exc);
        } finally {
            wipe(key);
            Arrays.fill(data, (byte) 0);
        }
    }

    public String decrypt(EncryptedPayload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("decrypt expects a payload");
        }
        int len = payload.ciphertextLength();
        if (len == 0 || len % Constants.BLOCK_LEN != 0) {
            throw new ChunkFormatException("Ciphertext length " + len + " is not a positive multiple of 16");
        }
        byte[] key = null;
        byte[] plain = null;
        try {
            key = backend.deriveKey(openPassword(), payload.salt(), iterations, Constants.KEY_LEN);
            plain = backend.decryptCbc(key, payload.iv(), payload.ciphertext());
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(plain))
                .toString();
        } catch (BadPaddingException exc) {
            throw new DecryptionException("Bad password or corrupted payload", exc);
        } catch (CharacterCodingException exc) {
            throw new DecryptionException("Bad password or corrupted payload (not UTF-8)", exc);
        } catch (GeneralSecurityException exc) {
            throw new DecryptionException("Chunk decryption failed", exc);
        } finally {
            wipe(key);
            wipe(plain);
        }
    }

    public String encryptToTransport(String plaintext) {
        return toTransport(encrypt(plaintext));
    }

    public String decryptFromTransport(String transport) {
        return decrypt(fromTransport(transport));
    }

    public static String toTransport(EncryptedPayload payload) {
        return Base64.getEncoder().encodeToString(payload.pack());
    }

    /**
     * Inverse of {@link #toTransport}. Whitespace inside the text is ignored
     * since scanners and editors may wrap long lines.
     *
     * @throws ChunkFormatException if the text is not base64 or decodes to
     *     fewer than 32 bytes
     */
    public static EncryptedPayload fromTransport(String transport) {
        if (transport == null) {
            throw new ChunkFormatException("Missing encrypted payload");
        }
        StringBuilder compact = new StringBuilder(transport.length());
        for (int i = 0; i < transport.length(); i++) {
            char ch = transport.charAt(i);
            if (!Character.isWhitespace(ch)) {
                compact.append(ch);
            }
        }
        byte[] combined;
        try {
            combined = Base64.getDecoder().decode(compact.toString());
        } catch (IllegalArgumentException exc) {
            throw new ChunkFormatException("Invalid base64 payload", exc);
        }
        return EncryptedPayload.unpack(combined);
    }

    @Override
    public void close() {
        char[] pw = password;
        password = null;
        if (pw != null) {
            Arrays.fill(pw, '\0');
        }
    }

    private char[] openPassword() {
        char[] pw = password;
        if (pw == null) {
            throw new IllegalStateException("ChunkCipher already closed");
        }
        return pw;
    }

    static byte[] randomBytes(int length) {
        byte[] out = new byte[length];
        if (length > 0) {
            RNG.nextBytes(out);
        }
        return out;
    }

    private static void wipe(byte[] data) {
        if (data != null) {
            Arrays.fill(data, (byte) 0);
        }
    }
}
