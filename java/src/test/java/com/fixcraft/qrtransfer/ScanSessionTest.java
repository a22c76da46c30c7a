package com.fixcraft.qrtransfer;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.Assert.*;

public class ScanSessionTest {

    private static final String CONTENT = "alpha\nbeta\ngamma\n";

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final ZxingSymbolCodec codec = new ZxingSymbolCodec();
    private final SymbolOptions options = SymbolOptions.defaults().withBoxSize(4);

    private File symbolFolder() throws Exception {
        File dir = tmp.newFolder("images");
        String fileHash = IntegrityHasher.fileHash(CONTENT);
        String[] bodies = {"alpha\n", "beta\n", "gamma\n"};
        // written in reverse so name order is not part order
        for (int i = bodies.length; i >= 1; i--) {
            WireRecord record = ChunkCodec.seal(new Chunk(i, 3, "greek.txt", bodies[i - 1]), fileHash);
            codec.writeImage(ChunkCodec.render(record), options, dir.toPath().resolve("shot_" + (4 - i) + ".png"));
        }
        codec.writeImage("https://example.com/not-a-record", options, dir.toPath().resolve("url.png"));
        Files.write(dir.toPath().resolve("garbage.png"), "definitely not png".getBytes(StandardCharsets.UTF_8));
        Files.write(dir.toPath().resolve("notes.txt"), "ignored".getBytes(StandardCharsets.UTF_8));
        return dir;
    }

    @Test
    public void testScanAndRebuild() throws Exception {
        File images = symbolFolder();
        ScanSession session = new ScanSession(codec, new Reassembler());

        assertEquals(3, session.scanDirectory(images.toPath()));
        assertEquals(5, session.imagesProcessed());
        assertEquals(4, session.symbolsFound());
        assertEquals(3, session.validChunks());
        assertEquals(2, session.errors());

        File out = tmp.newFolder("out");
        ReassemblyReport report = session.rebuild(out.toPath(), false);
        assertTrue(report.isSuccess());
        Path rebuilt = out.toPath().resolve("greek.txt");
        assertEquals(CONTENT, new String(Files.readAllBytes(rebuilt), StandardCharsets.UTF_8));
    }

    @Test
    public void testSavedChunksReload() throws Exception {
        File images = symbolFolder();
        ScanSession session = new ScanSession(codec, new Reassembler());
        session.scanDirectory(images.toPath());

        File chunks = tmp.newFolder("chunks");
        List<Path> saved = session.saveChunks(chunks.toPath());
        assertEquals(3, saved.size());
        assertTrue(Files.exists(chunks.toPath().resolve("greek_part_02_of_03.txt")));

        Reassembler reloaded = new Reassembler();
        assertEquals(3, ChunkFiles.load(chunks.toPath(), reloaded));
        assertEquals(CONTENT, reloaded.reconstruct("greek.txt"));
    }

    @Test
    public void testEmptyFolder() throws Exception {
        ScanSession session = new ScanSession(codec, new Reassembler());
        assertEquals(0, session.scanDirectory(tmp.newFolder("empty").toPath()));
        assertEquals(0, session.imagesProcessed());
        assertTrue(session.rebuild(tmp.newFolder("out").toPath(), false).outcomes().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingFolder() {
        new ScanSession(codec, new Reassembler()).scanDirectory(tmp.getRoot().toPath().resolve("nope"));
    }

    @Test
    public void testOfferDecodedPayload() {
        ScanSession session = new ScanSession(codec, new Reassembler());
        WireRecord record = ChunkCodec.seal(new Chunk(1, 1, "one.txt", "x"), IntegrityHasher.fileHash("x"));
        assertTrue(session.offer("camera", ChunkCodec.render(record)));
        assertFalse(session.offer("camera", "hello"));
        assertEquals(1, session.validChunks());
        assertEquals(1, session.errors());
        assertEquals("x", session.reassembler().reconstruct("one.txt"));
    }

    @Test
    public void testIsImage() {
        assertTrue(ScanSession.isImage(Paths.get("a.PNG")));
        assertTrue(ScanSession.isImage(Paths.get("dir", "photo.jpeg")));
        assertTrue(ScanSession.isImage(Paths.get("b.gif")));
        assertFalse(ScanSession.isImage(Paths.get("a.txt")));
        assertFalse(ScanSession.isImage(Paths.get("png")));
    }
}
