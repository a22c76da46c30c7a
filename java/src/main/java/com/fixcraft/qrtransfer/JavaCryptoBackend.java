package com.fixcraft.qrtransfer;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;

public final class JavaCryptoBackend implements CryptoBackend {
    // JCE names PKCS7 on a 16-byte block "PKCS5Padding"
    private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";
    private static final ThreadLocal<Cipher> AES_CBC = ThreadLocal.withInitial(JavaCryptoBackend::initCipher);
    private static final ThreadLocal<SecretKeyFactory> PBKDF2_FACTORY =
        ThreadLocal.withInitial(JavaCryptoBackend::initPbkdf2Factory);

    private JavaCryptoBackend() {}

    /**
     * Returns a JCE backend when the running JDK offers both algorithms and its
     * PBKDF2 agrees with Bouncy Castle's, else {@code null}.
     */
    public static JavaCryptoBackend tryCreate(CryptoBackend reference) {
        JavaCryptoBackend candidate = new JavaCryptoBackend();
        char[] pw = "password".toCharArray();
        byte[] salt = "salt".getBytes(StandardCharsets.UTF_8);
        try {
            if (initCipher() == null) {
                return null;
            }
            byte[] fast = candidate.deriveKey(pw, salt, 2, Constants.KEY_LEN);
            if (reference == null) {
                return candidate;
            }
            byte[] slow = reference.deriveKey(pw, salt, 2, Constants.KEY_LEN);
            return Arrays.equals(fast, slow) ? candidate : null;
        } catch (GeneralSecurityException | IllegalStateException exc) {
            RuntimeLog.debug("JCE crypto backend unavailable: " + exc.getMessage());
            return null;
        }
    }

    @Override
    public String name() {
        return "jce";
    }

    @Override
    public byte[] deriveKey(char[] password, byte[] salt, int iterations, int keyLen) throws GeneralSecurityException {
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be > 0");
        }
        SecretKeyFactory factory = PBKDF2_FACTORY.get();
        if (factory == null) {
            throw new GeneralSecurityException("PBKDF2WithHmacSHA256 unavailable");
        }
        PBEKeySpec spec = new PBEKeySpec(password, salt, iterations, keyLen * 8);
        try {
            return factory.generateSecret(spec).getEncoded();
        } finally {
            spec.clearPassword();
        }
    }

    @Override
    public byte[] encryptCbc(byte[] key, byte[] iv, byte[] plaintext) throws GeneralSecurityException {
        Cipher cipher = AES_CBC.get();
        cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));
        return cipher.doFinal(plaintext);
    }

    @Override
    public byte[] decryptCbc(byte[] key, byte[] iv, byte[] ciphertext) throws GeneralSecurityException {
        Cipher cipher = AES_CBC.get();
        cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));
        return cipher.doFinal(ciphertext);
    }

    private static Cipher initCipher() {
        try {
            return Cipher.getInstance(TRANSFORMATION);
        } catch (GeneralSecurityException exc) {
            throw new IllegalStateException("AES-CBC unavailable", exc);
        }
    }

    private static SecretKeyFactory initPbkdf2Factory() {
        try {
            return SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
        } catch (GeneralSecurityException exc) {
            return null;
        }
    }
}
