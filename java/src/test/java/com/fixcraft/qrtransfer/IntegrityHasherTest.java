package com.fixcraft.qrtransfer;

import org.junit.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

public class IntegrityHasherTest {

    private static final String EMPTY_SHA256 = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";
    private static final String ABC_SHA256 = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @Test
    public void testKnownDigests() {
        assertEquals(EMPTY_SHA256, IntegrityHasher.fileHash(""));
        assertEquals(ABC_SHA256, IntegrityHasher.fileHash("abc"));
        assertEquals("ba7816bf8f01cfea", IntegrityHasher.chunkHash("abc"));
    }

    @Test
    public void testChunkHashIsPrefixOfFileHash() {
        String text = "line one\nline two é\n";
        String chunk = IntegrityHasher.chunkHash(text);
        assertEquals(16, chunk.length());
        assertEquals(64, IntegrityHasher.fileHash(text).length());
        assertTrue(IntegrityHasher.fileHash(text).startsWith(chunk));
    }

    @Test
    public void testSingleCharacterChangeChangesHash() {
        String original = "The quick brown fox\n";
        for (int i = 0; i < original.length(); i++) {
            char[] chars = original.toCharArray();
            chars[i] = (char) (chars[i] ^ 1);
            assertNotEquals("position " + i, IntegrityHasher.chunkHash(original),
                IntegrityHasher.chunkHash(new String(chars)));
        }
    }

    @Test
    public void testRunningMatchesWhole() {
        String a = "first part\n";
        String b = "second 😀 part\n";
        String running = IntegrityHasher.running().update(a).update(b).hex();
        assertEquals(IntegrityHasher.fileHash(a + b), running);
    }

    @Test
    public void testBytesAndTextAgree() {
        String text = "grüße\n";
        assertEquals(IntegrityHasher.fileHash(text), IntegrityHasher.fileHash(text.getBytes(StandardCharsets.UTF_8)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullRejected() {
        IntegrityHasher.chunkHash(null);
    }
}
