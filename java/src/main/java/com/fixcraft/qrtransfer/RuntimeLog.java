package com.fixcraft.qrtransfer;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Diagnostics on stderr. Switches are read from the CLI first, then the
 * {@code qrtransfer.*} system properties, then {@code QRTRANSFER_*} env vars.
 * Callers never pass passwords, keys or decrypted bodies here.
 */
public final class RuntimeLog {
    public enum Level {
        ERROR("ERROR: "),
        WARN("WARN: "),
        INFO(""),
        DEBUG("   ");

        final String prefix;

        Level(String prefix) {
            this.prefix = prefix;
        }
    }

    private static final String VERBOSE_PROPERTY = "qrtransfer.verbose";
    private static final String NO_LOG_PROPERTY = "qrtransfer.noLog";

    private static volatile Boolean cliVerbose = null;
    private static volatile Boolean cliNoLog = null;
    private static volatile PrintStream sink = null;

    private RuntimeLog() {}

    public static void configureFromCli(boolean verbose, boolean noLog) {
        cliVerbose = Boolean.valueOf(verbose);
        cliNoLog = Boolean.valueOf(noLog);
        System.setProperty(VERBOSE_PROPERTY, verbose ? "1" : "0");
        System.setProperty(NO_LOG_PROPERTY, noLog ? "1" : "0");
    }

    /** Drops CLI switches so properties and env apply again. */
    static void resetCli() {
        cliVerbose = null;
        cliNoLog = null;
        System.clearProperty(VERBOSE_PROPERTY);
        System.clearProperty(NO_LOG_PROPERTY);
    }

    /**
     * Sends log lines to {@code target} instead of stderr; {@code null} restores
     * stderr.
     *
     * @return the previous target, {@code null} meaning stderr
     */
    static PrintStream redirect(PrintStream target) {
        PrintStream previous = sink;
        sink = target;
        return previous;
    }

    public static boolean isVerbose() {
        return flag(cliVerbose, VERBOSE_PROPERTY, "QRTRANSFER_VERBOSE");
    }

    public static boolean isNoLog() {
        return flag(cliNoLog, NO_LOG_PROPERTY, "QRTRANSFER_NO_LOG");
    }

    public static boolean enabled(Level level) {
        if (isNoLog()) {
            return false;
        }
        return level != Level.DEBUG || isVerbose();
    }

    public static void log(Level level, String message) {
        if (!enabled(level)) {
            return;
        }
        PrintStream out = sink;
        (out != null ? out : System.err).println(level.prefix + message);
    }

    public static void error(String message) {
        log(Level.ERROR, message);
    }

    public static void warn(String message) {
        log(Level.WARN, message);
    }

    public static void info(String message) {
        log(Level.INFO, message);
    }

    public static void debug(String message) {
        log(Level.DEBUG, message);
    }

    /** One line about a single part, e.g. {@code notes.txt: part 02 of 10 duplicate}. */
    public static void part(Level level, String filename, int index, int total, String note) {
        if (!enabled(level)) {
            return;
        }
        String line = String.format(Locale.ROOT, "%s: part %02d of %02d", filename, index, total);
        log(level, note == null || note.isEmpty() ? line : line + " " + note);
    }

    private static boolean flag(Boolean cli, String property, String env) {
        if (cli != null) {
            return cli.booleanValue();
        }
        return Constants.truthy(System.getProperty(property)) || Constants.envTruthy(env);
    }
}
