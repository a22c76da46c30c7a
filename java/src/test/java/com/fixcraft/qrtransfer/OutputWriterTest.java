package com.fixcraft.qrtransfer;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class OutputWriterTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    // ==================== Names ====================

    @Test
    public void testSafeNameKeepsLastElement() {
        assertEquals("notes.txt", OutputWriter.safeName("notes.txt"));
        assertEquals("passwd", OutputWriter.safeName("../../etc/passwd"));
        assertEquals("evil.txt", OutputWriter.safeName("C:\\temp\\evil.txt"));
        assertEquals("a b.txt", OutputWriter.safeName("dir/a b.txt"));
    }

    @Test
    public void testSafeNameKeepsSurroundingSpaces() {
        assertEquals(" notes.txt", OutputWriter.safeName(" notes.txt"));
        assertEquals("notes.txt ", OutputWriter.safeName("dir/notes.txt "));
    }

    @Test
    public void testSafeNameRejectsUnusable() {
        String[] bad = {null, "", "   ", ".", "..", " .. ", "dir/", "../..", "a\0b", "a\nb.txt", "a\rb.txt", "a.txt\r\n"};
        for (String name : bad) {
            try {
                OutputWriter.safeName(name);
                fail("accepted " + name);
            } catch (ChunkFormatException expected) {
                // expected
            }
        }
    }

    // ==================== Writing ====================

    @Test
    public void testWriteCreatesDirectory() throws Exception {
        Path dir = tmp.getRoot().toPath().resolve("a").resolve("b");
        Path written = OutputWriter.write(dir, "out.txt", "héllo\n", false);
        assertEquals(dir.resolve("out.txt"), written);
        assertEquals("héllo\n", new String(Files.readAllBytes(written), StandardCharsets.UTF_8));
        assertEquals(1, dir.toFile().list().length);
    }

    @Test
    public void testRefusesExisting() throws Exception {
        File dir = tmp.newFolder("out");
        Path target = dir.toPath().resolve("keep.txt");
        Files.write(target, "original".getBytes(StandardCharsets.UTF_8));
        try {
            OutputWriter.write(dir.toPath(), "keep.txt", "replacement", false);
            fail("target exists");
        } catch (OutputExistsException expected) {
            assertEquals(target, expected.target());
        }
        assertEquals("original", new String(Files.readAllBytes(target), StandardCharsets.UTF_8));
        assertEquals(1, dir.list().length);
    }

    @Test
    public void testOverwriteReplaces() throws Exception {
        File dir = tmp.newFolder("out");
        Path target = dir.toPath().resolve("keep.txt");
        Files.write(target, "original".getBytes(StandardCharsets.UTF_8));
        OutputWriter.write(dir.toPath(), "keep.txt", new byte[] {1, 2, 3}, true);
        assertArrayEquals(new byte[] {1, 2, 3}, Files.readAllBytes(target));
        assertEquals(1, dir.list().length);
    }

    @Test
    public void testEmptyContent() throws Exception {
        File dir = tmp.newFolder("out");
        Path written = OutputWriter.write(dir.toPath(), "empty.txt", "", false);
        assertEquals(0, Files.size(written));
    }
}
