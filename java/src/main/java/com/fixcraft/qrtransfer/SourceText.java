package com.fixcraft.qrtransfer;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Turns raw file bytes into the text that gets chunked: a leading UTF-8 BOM is
 * dropped and malformed sequences become U+FFFD instead of failing the read.
 */
public final class SourceText {
    private static final int READ_BUFFER = 1 << 16;

    private SourceText() {}

    public static String read(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Source file not found: " + file);
        }
        try {
            return decode(Files.readAllBytes(file));
        } catch (IOException exc) {
            throw new IllegalStateException("Failed to read " + file, exc);
        }
    }

    public static String decode(byte[] raw) {
        if (raw == null) {
            throw new IllegalArgumentException("decode expects bytes");
        }
        int offset = hasBom(raw) ? 3 : 0;
        try {
            CharBuffer chars = lenientDecoder().decode(ByteBuffer.wrap(raw, offset, raw.length - offset));
            return chars.toString();
        } catch (CharacterCodingException exc) {
            // REPLACE never reports, keep the compiler honest
            throw new IllegalStateException("UTF-8 decode failed", exc);
        }
    }

    /**
     * Opens the file for a single forward pass, BOM already skipped.
     */
    public static Reader openReader(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Source file not found: " + file);
        }
        InputStream in = null;
        try {
            in = new BufferedInputStream(Files.newInputStream(file), READ_BUFFER);
            in.mark(3);
            byte[] head = new byte[3];
            int read = in.readNBytes(head, 0, 3);
            if (!(read == 3 && hasBom(head))) {
                in.reset();
            }
            return new BufferedReader(new InputStreamReader(in, lenientDecoder()), READ_BUFFER);
        } catch (IOException exc) {
            if (in != null) {
                try {
                    in.close();
                } catch (IOException closeExc) {
                    exc.addSuppressed(closeExc);
                }
            }
            throw new IllegalStateException("Failed to open " + file, exc);
        }
    }

    private static boolean hasBom(byte[] raw) {
        return raw.length >= 3
            && (raw[0] & 0xFF) == 0xEF
            && (raw[1] & 0xFF) == 0xBB
            && (raw[2] & 0xFF) == 0xBF;
    }

    private static CharsetDecoder lenientDecoder() {
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    }
}
