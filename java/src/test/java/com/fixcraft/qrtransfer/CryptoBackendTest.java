package com.fixcraft.qrtransfer;

import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.junit.Assume;
import org.junit.BeforeClass;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.security.Security;
import java.util.Arrays;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

import static org.junit.Assert.*;

/**
 * Both backends must agree byte for byte, and both must match the published
 * PBKDF2-HMAC-SHA256 and AES-256-CBC vectors.
 */
public class CryptoBackendTest {

    private static final byte[] AES_KEY = hex("603deb1015ca71be2b73aef0857d77811f352c073b6108d72d9810a30914dff4");
    private static final byte[] AES_IV = hex("000102030405060708090a0b0c0d0e0f");
    private static final byte[] AES_PLAIN = hex("6bc1bee22e409f96e93d7e117393172a");
    private static final byte[] AES_FIRST_BLOCK = hex("f58c4c04d6e5f1ba779eabfb5f7bfbd6");

    @BeforeClass
    public static void setup() {
        Security.addProvider(new BouncyCastleProvider());
    }

    private static byte[] hex(String s) {
        byte[] out = new byte[s.length() / 2];
        for (int i = 0; i < out.length; i++) {
            out[i] = (byte) Integer.parseInt(s.substring(i * 2, i * 2 + 2), 16);
        }
        return out;
    }

    private static CryptoBackend jce() {
        Assume.assumeTrue("JCE backend not available", CryptoBackends.jceAvailable());
        return CryptoBackends.byName("jce");
    }

    // ==================== Key derivation ====================

    @Test
    public void testPbkdf2KnownVectors() throws Exception {
        CryptoBackend bc = CryptoBackends.byName("bc");
        byte[] salt = "salt".getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(hex("120fb6cffcf8b32c43e7225256c4f837a86548c92ccc35480805987cb70be17b"),
            bc.deriveKey("password".toCharArray(), salt, 1, 32));
        assertArrayEquals(hex("ae4d0c95af6b46d32d0adff928f06dd02a303f8ef3c251dfd6e2d85a95474c43"),
            bc.deriveKey("password".toCharArray(), salt, 2, 32));
    }

    @Test
    public void testBackendsDeriveSameKey() throws Exception {
        CryptoBackend bc = CryptoBackends.byName("bc");
        CryptoBackend java = jce();
        byte[] salt = ChunkCipher.randomBytes(16);
        char[] pw = "pässwörd-with-ümlauts".toCharArray();
        assertArrayEquals(bc.deriveKey(pw, salt, 1000, 32), java.deriveKey(pw, salt, 1000, 32));
    }

    @Test
    public void testLightweightMatchesBcProvider() throws Exception {
        byte[] salt = ChunkCipher.randomBytes(16);
        char[] pw = "correct horse battery".toCharArray();
        SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256", "BC");
        byte[] viaProvider = factory.generateSecret(new PBEKeySpec(pw, salt, 500, 256)).getEncoded();
        assertArrayEquals(viaProvider, CryptoBackends.byName("bc").deriveKey(pw, salt, 500, 32));
    }

    // ==================== AES-256-CBC ====================

    @Test
    public void testAesCbcKnownVector() throws Exception {
        byte[] ct = CryptoBackends.byName("bc").encryptCbc(AES_KEY, AES_IV, AES_PLAIN);
        assertEquals("one data block plus one padding block", 32, ct.length);
        assertArrayEquals(AES_FIRST_BLOCK, Arrays.copyOf(ct, 16));
    }

    @Test
    public void testBackendsProduceIdenticalCiphertext() throws Exception {
        CryptoBackend bc = CryptoBackends.byName("bc");
        CryptoBackend java = jce();
        byte[] key = ChunkCipher.randomBytes(32);
        byte[] iv = ChunkCipher.randomBytes(16);
        for (int len : new int[] {0, 1, 15, 16, 17, 1000}) {
            byte[] plain = ChunkCipher.randomBytes(len);
            byte[] a = bc.encryptCbc(key, iv, plain);
            byte[] b = java.encryptCbc(key, iv, plain);
            assertArrayEquals("length " + len, a, b);
            assertArrayEquals(plain, java.decryptCbc(key, iv, a));
            assertArrayEquals(plain, bc.decryptCbc(key, iv, b));
        }
    }

    // ==================== Selection ====================

    @Test
    public void testByName() {
        assertEquals("bc", CryptoBackends.byName("bc").name());
        assertEquals("bc", CryptoBackends.byName(" BouncyCastle ").name());
        assertNotNull(CryptoBackends.get());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownBackendRejected() {
        CryptoBackends.byName("rot13");
    }
}
