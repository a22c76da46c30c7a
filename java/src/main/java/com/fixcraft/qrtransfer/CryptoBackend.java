package com.fixcraft.qrtransfer;

import java.security.GeneralSecurityException;
import javax.crypto.BadPaddingException;

/**
 * The three primitives chunk encryption relies on. Implementations must agree
 * byte for byte so records written through one decrypt through the other.
 */
public interface CryptoBackend {
    String name();

    /** PBKDF2-HMAC-SHA256 over the UTF-8 bytes of {@code password}. */
    byte[] deriveKey(char[] password, byte[] salt, int iterations, int keyLen) throws GeneralSecurityException;

    /** AES-CBC with PKCS7 padding. */
    byte[] encryptCbc(byte[] key, byte[] iv, byte[] plaintext) throws GeneralSecurityException;

    /**
     * @throws BadPaddingException when the padding does not check out, the usual
     *     symptom of a wrong key
     */
    byte[] decryptCbc(byte[] key, byte[] iv, byte[] ciphertext) throws GeneralSecurityException;
}
