package com.fixcraft.qrtransfer;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Splits text into bodies no larger than a byte cap, cutting only between lines.
 * A line ends after {@code \r\n}, a lone {@code \r} or any other Unicode line
 * boundary ({@code \n}, VT, FF, FS, GS, RS, NEL, LINE SEPARATOR, PARAGRAPH
 * SEPARATOR) and keeps its terminator. A single line longer than the cap becomes
 * an oversized body of its own; content is never truncated.
 */
public final class LineChunker {
    private LineChunker() {}

    public static List<String> split(CharSequence content, int maxBytes) {
        if (content == null) {
            throw new IllegalArgumentException("split expects text");
        }
        checkCap(maxBytes);
        List<String> bodies = new ArrayList<>();
        Accumulator acc = new Accumulator(maxBytes, bodies::add);
        int len = content.length();
        int start = 0;
        while (start < len) {
            int end = lineEnd(content, start, len);
            acc.offer(content.subSequence(start, end));
            start = end;
        }
        acc.finish();
        return bodies;
    }

    public static List<String> split(Reader reader, int maxBytes) {
        List<String> bodies = new ArrayList<>();
        split(reader, maxBytes, bodies::add);
        return bodies;
    }

    /**
     * Single forward pass over {@code reader}; each completed body is handed to
     * {@code sink} as soon as the next line would overflow it.
     *
     * @return number of bodies emitted
     */
    public static int split(Reader reader, int maxBytes, Consumer<String> sink) {
        if (reader == null || sink == null) {
            throw new IllegalArgumentException("split expects a reader and a sink");
        }
        checkCap(maxBytes);
        Accumulator acc = new Accumulator(maxBytes, sink);
        StringBuilder line = new StringBuilder();
        try {
            int pending = -1;
            while (true) {
                int ch = pending >= 0 ? pending : reader.read();
                pending = -1;
                if (ch < 0) {
                    break;
                }
                line.append((char) ch);
                if (isLineBreak((char) ch)) {
                    acc.offer(line);
                    line.setLength(0);
                } else if (ch == '\r') {
                    int next = reader.read();
                    if (next == '\n') {
                        line.append('\n');
                    } else {
                        pending = next;
                    }
                    acc.offer(line);
                    line.setLength(0);
                    if (next < 0) {
                        break;
                    }
                }
            }
        } catch (IOException exc) {
            throw new IllegalStateException("Failed to read source text", exc);
        }
        if (line.length() > 0) {
            acc.offer(line);
        }
        acc.finish();
        return acc.emitted;
    }

    /**
     * UTF-8 length of {@code text} as {@link String#getBytes} would produce it,
     * unpaired surrogates counting as the one-byte replacement.
     */
    public static int utf8Length(CharSequence text) {
        int bytes = 0;
        int len = text.length();
        for (int i = 0; i < len; i++) {
            char c = text.charAt(i);
            if (c < 0x80) {
                bytes += 1;
            } else if (c < 0x800) {
                bytes += 2;
            } else if (Character.isHighSurrogate(c)
                && i + 1 < len
                && Character.isLowSurrogate(text.charAt(i + 1))) {
                bytes += 4;
                i++;
            } else if (Character.isSurrogate(c)) {
                bytes += 1;
            } else {
                bytes += 3;
            }
        }
        return bytes;
    }

    private static int lineEnd(CharSequence content, int start, int len) {
        for (int i = start; i < len; i++) {
            char c = content.charAt(i);
            if (c == '\r') {
                return (i + 1 < len && content.charAt(i + 1) == '\n') ? i + 2 : i + 1;
            }
            if (isLineBreak(c)) {
                return i + 1;
            }
        }
        return len;
    }

    /** Single-character line boundaries other than {@code \r}. */
    static boolean isLineBreak(char c) {
        switch (c) {
            case '\n':
            case '\u000B':
            case '\u000C':
            case '\u001C':
            case '\u001D':
            case '\u001E':
            case '\u0085':
            case '\u2028':
            case '\u2029':
                return true;
            default:
                return false;
        }
    }

    private static void checkCap(int maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be > 0");
        }
    }

    private static final class Accumulator {
        private final int maxBytes;
        private final Consumer<String> sink;
        private final StringBuilder current = new StringBuilder();
        private int currentBytes;
        private int emitted;

        Accumulator(int maxBytes, Consumer<String> sink) {
            this.maxBytes = maxBytes;
            this.sink = sink;
        }

        void offer(CharSequence line) {
            int lineBytes = utf8Length(line);
            if ((long) currentBytes + lineBytes > maxBytes && current.length() > 0) {
                flush();
            }
            current.append(line);
            currentBytes += lineBytes;
        }

        void finish() {
            if (current.length() > 0) {
                flush();
            }
        }

        private void flush() {
            sink.accept(current.toString());
            emitted++;
            current.setLength(0);
            currentBytes = 0;
        }
    }
}
