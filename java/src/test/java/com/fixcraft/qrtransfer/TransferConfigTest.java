package com.fixcraft.qrtransfer;

import org.junit.Test;

import static org.junit.Assert.*;

public class TransferConfigTest {

    @Test
    public void testDefaults() {
        TransferConfig config = TransferConfig.defaults();
        assertEquals(2953, config.maxSymbolBytes);
        assertEquals(2362, config.chunkCap());
        assertEquals(1727, config.encryptedChunkCap());
        assertEquals(2362, config.chunkCap(false));
        assertEquals(1727, config.chunkCap(true));
        assertEquals(100, config.capacityWarn);
        assertEquals(Constants.DEFAULT_KDF_ITERATIONS, config.kdfIterations);
        assertTrue(config.workers >= 1 && config.workers <= Constants.MAX_WORKERS);
        assertEquals(SymbolOptions.ErrorCorrection.L, config.symbolOptions.errorCorrection);
    }

    @Test
    public void testCopies() {
        CryptoBackend bc = CryptoBackends.byName("bc");
        TransferConfig base = TransferConfig.defaults();
        TransferConfig changed = base.withWorkers(1)
            .withMaxSymbolBytes(1000)
            .withCapacityWarn(5)
            .withParallelThreshold(0)
            .withKdfIterations(10)
            .withBackend(bc)
            .withSymbolOptions(SymbolOptions.defaults().withBorder(1));

        assertEquals(800, changed.chunkCap());
        assertEquals(5, changed.capacityWarn);
        assertSame(bc, changed.backend);
        assertEquals(1, changed.symbolOptions.border);
        assertFalse(changed.parallelEncoder().runsParallel(100));
        assertTrue(changed.withWorkers(4).parallelEncoder().runsParallel(1));
        assertEquals(2953, base.maxSymbolBytes);
    }

    @Test
    public void testTinyCapsStayPositive() {
        TransferConfig config = new TransferConfig(6, 100, 100, 1, 3, 10, null, null);
        assertEquals(6, config.chunkCap());
        assertEquals(1, config.encryptedChunkCap());
        assertNotNull(config.backend);
        assertNotNull(config.symbolOptions);
    }

    @Test
    public void testRejectsBadValues() {
        TransferConfig base = TransferConfig.defaults();
        try {
            base.withWorkers(0);
            fail("zero workers");
        } catch (IllegalArgumentException expected) {
            assertTrue(expected.getMessage().contains("workers"));
        }
        try {
            new TransferConfig(2953, 0, 100, 1, 3, 10, null, null);
            fail("zero percent");
        } catch (IllegalArgumentException expected) {
            assertTrue(expected.getMessage().contains("percent"));
        }
        try {
            base.withKdfIterations(0);
            fail("no iterations");
        } catch (IllegalArgumentException expected) {
            assertTrue(expected.getMessage().contains("kdfIterations"));
        }
    }

    @Test
    public void testCipherAndReassemblerShareSettings() {
        TransferConfig config = TransferConfig.defaults().withKdfIterations(500).withBackend(CryptoBackends.byName("bc"));
        String transport;
        try (ChunkCipher cipher = config.newCipher("password123".toCharArray())) {
            transport = cipher.encryptToTransport("shared\n");
        }
        WireRecord record = new WireRecord(1, 1, "s.txt", IntegrityHasher.chunkHash("shared\n"),
            IntegrityHasher.fileHash("shared\n"), true, transport);
        try (Reassembler reassembler = config.newReassembler(PasswordSource.of("password123".toCharArray()))) {
            reassembler.offer(record);
            assertEquals("shared\n", reassembler.reconstruct("s.txt"));
        }
    }
}
