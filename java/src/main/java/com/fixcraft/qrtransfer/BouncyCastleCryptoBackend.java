package com.fixcraft.qrtransfer;

import java.security.GeneralSecurityException;
import java.util.Arrays;
import javax.crypto.BadPaddingException;
import javax.crypto.IllegalBlockSizeException;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.PBEParametersGenerator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.modes.CBCBlockCipher;
import org.bouncycastle.crypto.paddings.PKCS7Padding;
import org.bouncycastle.crypto.paddings.PaddedBufferedBlockCipher;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;

/**
 * Bouncy Castle lightweight API; needs no JCE provider registration.
 */
public final class BouncyCastleCryptoBackend implements CryptoBackend {

    @Override
    public String name() {
        return "bc";
    }

    @Override
    public byte[] deriveKey(char[] password, byte[] salt, int iterations, int keyLen) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be > 0");
        }
        byte[] pwBytes = PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(password);
        try {
            PKCS5S2ParametersGenerator gen = new PKCS5S2ParametersGenerator(new SHA256Digest());
            gen.init(pwBytes, salt, iterations);
            KeyParameter key = (KeyParameter) gen.generateDerivedParameters(keyLen * 8);
            return key.getKey();
        } finally {
            Arrays.fill(pwBytes, (byte) 0);
        }
    }

    @Override
    public byte[] encryptCbc(byte[] key, byte[] iv, byte[] plaintext) throws GeneralSecurityException {
        return run(true, key, iv, plaintext);
    }

    @Override
    public byte[] decryptCbc(byte[] key, byte[] iv, byte[] ciphertext) throws GeneralSecurityException {
        return run(false, key, iv, ciphertext);
    }

    private static byte[] run(boolean encrypt, byte[] key, byte[] iv, byte[] input) throws GeneralSecurityException {
        PaddedBufferedBlockCipher cipher = new PaddedBufferedBlockCipher(
            CBCBlockCipher.newInstance(AESEngine.newInstance()), new PKCS7Padding());
        cipher.init(encrypt, new ParametersWithIV(new KeyParameter(key), iv));
        byte[] out = new byte[cipher.getOutputSize(input.length)];
        try {
            int written = cipher.processBytes(input, 0, input.length, out, 0);
            written += cipher.doFinal(out, written);
            return written == out.length ? out : Arrays.copyOf(out, written);
        } catch (InvalidCipherTextException exc) {
            throw new BadPaddingException(exc.getMessage());
        } catch (DataLengthException exc) {
            throw new IllegalBlockSizeException(exc.getMessage());
        }
    }
}
