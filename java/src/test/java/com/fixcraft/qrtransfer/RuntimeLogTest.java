package com.fixcraft.qrtransfer;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

public class RuntimeLogTest {

    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private PrintStream previous;

    @Before
    public void setUp() {
        previous = RuntimeLog.redirect(new PrintStream(captured, true));
    }

    @After
    public void tearDown() {
        RuntimeLog.redirect(previous);
        RuntimeLog.resetCli();
    }

    private String output() {
        return new String(captured.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Test
    public void testPrefixes() {
        RuntimeLog.configureFromCli(false, false);
        RuntimeLog.error("broken");
        RuntimeLog.warn("careful");
        RuntimeLog.info("plain");
        RuntimeLog.debug("hidden");
        assertEquals("ERROR: broken\nWARN: careful\nplain\n", output());
    }

    @Test
    public void testVerboseShowsDebug() {
        RuntimeLog.configureFromCli(true, false);
        assertTrue(RuntimeLog.isVerbose());
        RuntimeLog.debug("detail");
        assertEquals("   detail\n", output());
    }

    @Test
    public void testNoLogSilencesEverything() {
        RuntimeLog.configureFromCli(true, true);
        for (RuntimeLog.Level level : RuntimeLog.Level.values()) {
            assertFalse(RuntimeLog.enabled(level));
        }
        RuntimeLog.error("nothing");
        assertEquals("", output());
    }

    @Test
    public void testPartLine() {
        RuntimeLog.configureFromCli(false, false);
        RuntimeLog.part(RuntimeLog.Level.WARN, "notes.txt", 2, 10, "seen again");
        RuntimeLog.part(RuntimeLog.Level.INFO, "notes.txt", 100, 120, null);
        RuntimeLog.part(RuntimeLog.Level.DEBUG, "notes.txt", 1, 1, "hidden");
        assertEquals("WARN: notes.txt: part 02 of 10 seen again\nnotes.txt: part 100 of 120\n", output());
    }

    @Test
    public void testCliOverridesProperty() {
        RuntimeLog.resetCli();
        System.setProperty("qrtransfer.verbose", "yes");
        assertTrue(RuntimeLog.isVerbose());
        RuntimeLog.configureFromCli(false, false);
        assertFalse(RuntimeLog.isVerbose());
    }
}
