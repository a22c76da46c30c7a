package com.fixcraft.qrtransfer;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class ZxingSymbolCodecTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final ZxingSymbolCodec codec = new ZxingSymbolCodec();

    private static String record(String body) {
        Chunk chunk = new Chunk(1, 1, "note.txt", body);
        return ChunkCodec.encode(chunk, IntegrityHasher.fileHash(body), null);
    }

    // ==================== Encode ====================

    @Test
    public void testImageGeometry() {
        BufferedImage image = codec.encodeSymbol("hello", SymbolOptions.defaults());
        assertEquals(image.getWidth(), image.getHeight());
        assertEquals(0, image.getWidth() % Constants.DEFAULT_BOX_SIZE);
        // version 1 is 21 modules plus a 4-module border each side
        assertEquals((21 + 2 * 4) * 10, image.getWidth());
    }

    @Test
    public void testBorderAndBoxSize() {
        SymbolOptions options = SymbolOptions.defaults().withBoxSize(3).withBorder(0);
        BufferedImage image = codec.encodeSymbol("hello", options);
        assertEquals(21 * 3, image.getWidth());
    }

    @Test
    public void testOversizedPayloadRejected() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 3200; i++) {
            sb.append('x');
        }
        try {
            codec.encodeSymbol(sb.toString(), SymbolOptions.defaults());
            fail("payload larger than one symbol");
        } catch (IllegalArgumentException expected) {
            assertTrue(expected.getMessage().contains("QR"));
        }
    }

    // ==================== Round trips ====================

    @Test
    public void testRecordRoundTrip() {
        String payload = record("first line\nsecond ü 😀\n");
        BufferedImage image = codec.encodeSymbol(payload, SymbolOptions.defaults().withBoxSize(4));
        assertEquals(Collections.singletonList(payload), codec.decodeSymbols(image));
    }

    @Test
    public void testHighErrorCorrection() {
        String payload = record("error correction H\n");
        SymbolOptions options = SymbolOptions.defaults().withBoxSize(4)
            .withErrorCorrection(SymbolOptions.ErrorCorrection.H);
        BufferedImage image = codec.encodeSymbol(payload, options);
        assertEquals(Collections.singletonList(payload), codec.decodeSymbols(image));
        assertTrue(image.getWidth() > codec.encodeSymbol(payload, options.withErrorCorrection(
            SymbolOptions.ErrorCorrection.L)).getWidth());
    }

    @Test
    public void testLargePayload() {
        StringBuilder body = new StringBuilder();
        while (body.length() < 1200) {
            body.append("line ").append(body.length()).append('\n');
        }
        String payload = record(body.toString());
        BufferedImage image = codec.encodeSymbol(payload, SymbolOptions.defaults().withBoxSize(4));
        assertEquals(Collections.singletonList(payload), codec.decodeSymbols(image));
    }

    @Test
    public void testImageFileRoundTrip() throws Exception {
        String payload = record("on disk\n");
        Path file = tmp.getRoot().toPath().resolve("sub").resolve("note_part_01_of_01.png");
        assertEquals(file, codec.writeImage(payload, SymbolOptions.defaults().withBoxSize(4), file));
        assertTrue(Files.size(file) > 0);
        assertEquals(Collections.singletonList(payload), codec.readImage(file));
    }

    // ==================== No symbols ====================

    @Test
    public void testBlankImage() {
        BufferedImage image = new BufferedImage(200, 200, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, 200, 200);
        g.dispose();
        List<String> found = codec.decodeSymbols(image);
        assertTrue(found.isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnreadableFile() throws Exception {
        Path file = tmp.newFile("broken.png").toPath();
        Files.write(file, "not an image".getBytes("UTF-8"));
        codec.readImage(file);
    }

    @Test
    public void testErrorCorrectionParse() {
        assertEquals(SymbolOptions.ErrorCorrection.Q, SymbolOptions.ErrorCorrection.parse(" q "));
        try {
            SymbolOptions.ErrorCorrection.parse("X");
            fail("unknown level");
        } catch (IllegalArgumentException expected) {
            assertTrue(expected.getMessage().contains("X"));
        }
    }
}
