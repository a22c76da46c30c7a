package com.fixcraft.qrtransfer;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.Assert.*;

public class ParallelEncoderTest {

    private static List<Chunk> chunks(int count) {
        List<Chunk> out = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            out.add(new Chunk(i, count, "data.txt", "line " + i + "\n"));
        }
        return out;
    }

    private static final String FILE_HASH = IntegrityHasher.fileHash("data");

    // ==================== Determinism ====================

    @Test
    public void testParallelMatchesSequential() {
        List<Chunk> input = chunks(60);
        List<WireRecord> sequential = ParallelEncoder.sequential()
            .encodeAll(input, ChunkEncoder.plain(FILE_HASH)).recordsOrThrow();
        List<WireRecord> parallel = new ParallelEncoder(6, 3)
            .encodeAll(input, ChunkEncoder.plain(FILE_HASH)).recordsOrThrow();

        assertEquals(sequential, parallel);
        for (int i = 0; i < parallel.size(); i++) {
            assertEquals(i + 1, parallel.get(i).index);
        }
    }

    @Test
    public void testOrderRestoredFromShuffledInput() {
        List<Chunk> input = chunks(25);
        Collections.shuffle(input);
        List<WireRecord> records = new ParallelEncoder(4, 3)
            .encodeAll(input, ChunkEncoder.plain(FILE_HASH)).recordsOrThrow();
        for (int i = 0; i < records.size(); i++) {
            assertEquals(i + 1, records.get(i).index);
        }
    }

    @Test
    public void testEncryptedParallelKeepsOrder() {
        try (ChunkCipher cipher = new ChunkCipher("password123".toCharArray(), CryptoBackends.byName("bc"), 500)) {
            List<WireRecord> records = new ParallelEncoder(4, 3)
                .encodeAll(chunks(10), ChunkEncoder.encrypted(FILE_HASH, cipher)).recordsOrThrow();
            assertEquals(10, records.size());
            for (int i = 0; i < records.size(); i++) {
                WireRecord record = records.get(i);
                assertEquals(i + 1, record.index);
                assertTrue(record.encrypted);
                assertEquals("line " + (i + 1) + "\n", cipher.decryptFromTransport(record.payload));
            }
        }
    }

    // ==================== Threshold ====================

    @Test
    public void testThreshold() {
        ParallelEncoder encoder = new ParallelEncoder(4, 3);
        assertFalse(encoder.runsParallel(3));
        assertTrue(encoder.runsParallel(4));
        assertFalse(new ParallelEncoder(1, 3).runsParallel(100));
    }

    @Test
    public void testPoolThreadsUsedAboveThreshold() {
        Set<String> threads = ConcurrentHashMap.newKeySet();
        ChunkEncoder plain = ChunkEncoder.plain(FILE_HASH);
        new ParallelEncoder(4, 3).encodeAll(chunks(20), chunk -> {
            threads.add(Thread.currentThread().getName());
            return plain.encode(chunk);
        }).recordsOrThrow();
        for (String name : threads) {
            assertTrue(name, name.startsWith("qrtransfer-encode-"));
        }
    }

    @Test
    public void testCallerThreadUsedAtOrBelowThreshold() {
        String caller = Thread.currentThread().getName();
        Set<String> threads = ConcurrentHashMap.newKeySet();
        ChunkEncoder plain = ChunkEncoder.plain(FILE_HASH);
        new ParallelEncoder(4, 3).encodeAll(chunks(3), chunk -> {
            threads.add(Thread.currentThread().getName());
            return plain.encode(chunk);
        });
        assertEquals(Collections.singleton(caller), threads);
    }

    @Test
    public void testDefaultWorkersBounded() {
        int workers = ParallelEncoder.defaultWorkers();
        assertTrue(workers >= 1 && workers <= 8);
    }

    // ==================== Partial failure ====================

    @Test
    public void testFailuresCollectedPerIndex() {
        ChunkEncoder plain = ChunkEncoder.plain(FILE_HASH);
        ChunkEncoder flaky = chunk -> {
            if (chunk.index == 3 || chunk.index == 7) {
                throw new IllegalStateException("boom " + chunk.index);
            }
            return plain.encode(chunk);
        };
        for (ParallelEncoder encoder : Arrays.asList(ParallelEncoder.sequential(), new ParallelEncoder(4, 3))) {
            EncodeOutcome outcome = encoder.encodeAll(chunks(10), flaky);

            assertFalse(outcome.isComplete());
            assertEquals(Arrays.asList(3, 7), outcome.failedIndices());
            assertEquals(8, outcome.records().size());
            assertEquals("boom 3", outcome.failures().get(3).getMessage());
            try {
                outcome.recordsOrThrow();
                fail("incomplete outcome must throw");
            } catch (PartialEncodingException expected) {
                assertEquals(Arrays.asList(3, 7), expected.failedIndices());
                assertEquals(2, expected.getSuppressed().length);
            }
        }
    }

    @Test
    public void testMissingRecordCountsAsFailure() {
        EncodeOutcome outcome = new ParallelEncoder(2, 0).encodeAll(chunks(2), chunk -> null);
        assertEquals(Arrays.asList(1, 2), outcome.failedIndices());
    }
}
