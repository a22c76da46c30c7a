package com.fixcraft.qrtransfer;

import java.util.Locale;

/**
 * Wire grammar for chunk records. Two shapes exist:
 *
 * <pre>
 * --BEGIN part_NN_of_TT file: NAME chunk_hash: H16 file_hash: H64--\nBODY--END part_NN--
 * --BEGIN ENCRYPTED part_NN_of_TT file: NAME chunk_hash: H16 file_hash: H64--\nBASE64--END ENCRYPTED part_NN--
 * </pre>
 *
 * Indices are zero-padded to two digits and widen past 99. Decoding reads the
 * header from its right end, so a file name may contain any character except a
 * line break. Hashes are checked for shape only; content verification belongs
 * to reassembly.
 */
public final class ChunkCodec {
    private ChunkCodec() {}

    public static WireRecord seal(Chunk chunk, String fileHash) {
        requireChunk(chunk, fileHash);
        return new WireRecord(chunk.index, chunk.total, chunk.filename,
            IntegrityHasher.chunkHash(chunk.body), fileHash, false, chunk.body);
    }

    public static WireRecord seal(Chunk chunk, String fileHash, ChunkCipher cipher) {
        if (cipher == null) {
            return seal(chunk, fileHash);
        }
        requireChunk(chunk, fileHash);
        String transport = ChunkCipher.toTransport(cipher.encrypt(chunk.body));
        return new WireRecord(chunk.index, chunk.total, chunk.filename,
            IntegrityHasher.chunkHash(chunk.body), fileHash, true, transport);
    }

    public static String encode(Chunk chunk, String fileHash, ChunkCipher cipher) {
        return render(seal(chunk, fileHash, cipher));
    }

    public static String render(WireRecord record) {
        String marker = record.encrypted ? Constants.ENCRYPTED_MARKER : "";
        StringBuilder sb = new StringBuilder(record.payload.length() + record.filename.length() + 160);
        sb.append(Constants.BEGIN_PREFIX).append(marker)
            .append(Constants.PART_PREFIX).append(pad(record.index))
            .append(Constants.OF_SEPARATOR).append(pad(record.total))
            .append(Constants.FILE_FIELD).append(record.filename)
            .append(Constants.CHUNK_HASH_FIELD).append(record.chunkHash)
            .append(Constants.FILE_HASH_FIELD).append(record.fileHash)
            .append(Constants.FRAME_CLOSE).append('\n')
            .append(record.payload)
            .append(Constants.END_PREFIX).append(marker)
            .append(Constants.PART_PREFIX).append(pad(record.index))
            .append(Constants.FRAME_CLOSE);
        return sb.toString();
    }

    /**
     * Parses one record. Line terminators after the footer are ignored;
     * everything else must match the grammar exactly.
     *
     * @throws ChunkFormatException if the text is not a well-formed record
     */
    public static WireRecord decode(String text) {
        if (text == null) {
            throw new ChunkFormatException("No record text");
        }
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        if (!text.startsWith(Constants.BEGIN_PREFIX)) {
            throw new ChunkFormatException("Record does not start with " + Constants.BEGIN_PREFIX.trim());
        }
        int pos = Constants.BEGIN_PREFIX.length();
        boolean encrypted = text.startsWith(Constants.ENCRYPTED_MARKER, pos);
        if (encrypted) {
            pos += Constants.ENCRYPTED_MARKER.length();
        }
        int newline = text.indexOf('\n', pos);
        if (newline < 0 || newline >= end) {
            throw new ChunkFormatException("Record header is not terminated by a line break");
        }
        Header header = parseHeader(text.substring(pos, newline));

        String footerHead = Constants.END_PREFIX + (encrypted ? Constants.ENCRYPTED_MARKER : "") + Constants.PART_PREFIX;
        if (end - (newline + 1) < footerHead.length() + Constants.FRAME_CLOSE.length()
            || !text.startsWith(Constants.FRAME_CLOSE, end - Constants.FRAME_CLOSE.length())) {
            throw new ChunkFormatException("Record footer missing");
        }
        int digitsEnd = end - Constants.FRAME_CLOSE.length();
        int digitsStart = digitsEnd;
        while (digitsStart > newline + 1 && isDigit(text.charAt(digitsStart - 1))) {
            digitsStart--;
        }
        int footerStart = digitsStart - footerHead.length();
        if (digitsStart == digitsEnd || footerStart < newline + 1 || !text.startsWith(footerHead, footerStart)) {
            throw new ChunkFormatException(encrypted
                ? "Encrypted record lacks an encrypted footer"
                : "Plain record lacks a plain footer");
        }
        int footerIndex = parseNumber(text.substring(digitsStart, digitsEnd), "footer index");
        if (footerIndex != header.index) {
            throw new ChunkFormatException("Header part " + header.index + " does not match footer part " + footerIndex);
        }
        String payload = text.substring(newline + 1, footerStart);
        return new WireRecord(header.index, header.total, header.filename,
            header.chunkHash, header.fileHash, encrypted, payload);
    }

    /** Best-effort look at a record's header, for log lines about records that failed to parse. */
    public static String describe(String text) {
        if (text == null) {
            return "<null>";
        }
        int newline = text.indexOf('\n');
        String head = newline < 0 ? text : text.substring(0, newline);
        return head.length() > 120 ? head.substring(0, 120) + "..." : head;
    }

    private static Header parseHeader(String header) {
        // part_NN_of_TT file: NAME chunk_hash: H16 file_hash: H64--
        if (!header.endsWith(Constants.FRAME_CLOSE)) {
            throw new ChunkFormatException("Record header is not closed with --");
        }
        int cursor = header.length() - Constants.FRAME_CLOSE.length();

        int fileHashStart = cursor - Constants.FILE_HASH_LEN;
        String fileHash = hexAt(header, fileHashStart, cursor, "file_hash");
        cursor = expectBefore(header, fileHashStart, Constants.FILE_HASH_FIELD);

        int chunkHashStart = cursor - Constants.CHUNK_HASH_LEN;
        String chunkHash = hexAt(header, chunkHashStart, cursor, "chunk_hash");
        cursor = expectBefore(header, chunkHashStart, Constants.CHUNK_HASH_FIELD);

        String lead = header.substring(0, cursor);
        if (!lead.startsWith(Constants.PART_PREFIX)) {
            throw new ChunkFormatException("Record header lacks part_NN_of_TT");
        }
        int p = Constants.PART_PREFIX.length();
        int indexEnd = digitsFrom(lead, p);
        int index = parseNumber(lead.substring(p, indexEnd), "index");
        if (!lead.startsWith(Constants.OF_SEPARATOR, indexEnd)) {
            throw new ChunkFormatException("Record header lacks _of_ separator");
        }
        int totalStart = indexEnd + Constants.OF_SEPARATOR.length();
        int totalEnd = digitsFrom(lead, totalStart);
        int total = parseNumber(lead.substring(totalStart, totalEnd), "total");
        if (!lead.startsWith(Constants.FILE_FIELD, totalEnd)) {
            throw new ChunkFormatException("Record header lacks file field");
        }
        String filename = lead.substring(totalEnd + Constants.FILE_FIELD.length());
        if (filename.isEmpty()) {
            throw new ChunkFormatException("Record header has an empty file name");
        }
        if (index < 1 || total < 1) {
            throw new ChunkFormatException("Part numbers start at 1, got part " + index + " of " + total);
        }
        return new Header(index, total, filename, chunkHash, fileHash);
    }

    private static String hexAt(String text, int start, int end, String field) {
        if (start < 0) {
            throw new ChunkFormatException("Record header too short for " + field);
        }
        for (int i = start; i < end; i++) {
            char c = text.charAt(i);
            if (!(isDigit(c) || (c >= 'a' && c <= 'f'))) {
                throw new ChunkFormatException(field + " must be " + (end - start) + " lowercase hex characters");
            }
        }
        return text.substring(start, end);
    }

    private static int expectBefore(String text, int at, String field) {
        int start = at - field.length();
        if (start < 0 || !text.startsWith(field, start)) {
            throw new ChunkFormatException("Record header lacks " + field.trim());
        }
        return start;
    }

    private static int digitsFrom(String text, int start) {
        int i = start;
        while (i < text.length() && isDigit(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int parseNumber(String digits, String what) {
        if (digits.isEmpty() || digits.length() > 9) {
            throw new ChunkFormatException("Bad " + what + " '" + digits + "'");
        }
        return Integer.parseInt(digits);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static String pad(int value) {
        return String.format(Locale.ROOT, "%02d", value);
    }

    private static void requireChunk(Chunk chunk, String fileHash) {
        if (chunk == null) {
            throw new IllegalArgumentException("chunk required");
        }
        if (chunk.filename.indexOf('\n') >= 0 || chunk.filename.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("file name must not contain a line break");
        }
        if (fileHash == null || fileHash.length() != Constants.FILE_HASH_LEN) {
            throw new IllegalArgumentException("file hash must be " + Constants.FILE_HASH_LEN + " hex characters");
        }
    }

    private static final class Header {
        final int index;
        final int total;
        final String filename;
        final String chunkHash;
        final String fileHash;

        Header(int index, int total, String filename, String chunkHash, String fileHash) {
            this.index = index;
            this.total = total;
            this.filename = filename;
            this.chunkHash = chunkHash;
            this.fileHash = fileHash;
        }
    }
}
