package com.fixcraft.qrtransfer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Wire records persisted as UTF-8 text files, one record per file, written
 * verbatim with no trailing newline.
 */
public final class ChunkFiles {
    private ChunkFiles() {}

    /** File name without its last extension; a leading-dot name keeps its dot. */
    public static String stem(String filename) {
        String name = OutputWriter.safeName(filename);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public static String chunkFileName(String stem, int index, int total) {
        return String.format(Locale.ROOT, "%s_part_%02d_of_%02d%s", stem, index, total, Constants.CHUNK_FILE_EXT);
    }

    public static String symbolFileName(String stem, boolean encrypted, int index, int total) {
        String base = encrypted ? stem + Constants.ENCRYPTED_STEM_SUFFIX : stem;
        return String.format(Locale.ROOT, "%s_part_%02d_of_%02d%s", base, index, total, Constants.SYMBOL_FILE_EXT);
    }

    public static List<Path> write(Path directory, List<WireRecord> records) {
        if (directory == null || records == null) {
            throw new IllegalArgumentException("write expects a directory and records");
        }
        List<Path> written = new ArrayList<>(records.size());
        try {
            Files.createDirectories(directory);
            for (WireRecord record : records) {
                Path target = directory.resolve(chunkFileName(stem(record.filename), record.index, record.total));
                Files.write(target, ChunkCodec.render(record).getBytes(StandardCharsets.UTF_8));
                RuntimeLog.debug("Saved " + target.getFileName());
                written.add(target);
            }
        } catch (IOException exc) {
            throw new IllegalStateException("Failed to write chunk files to " + directory, exc);
        }
        return written;
    }

    /**
     * Every {@code *.txt} file in {@code directory}, keyed by file name in name
     * order.
     */
    public static Map<String, String> readTexts(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Chunk directory not found: " + directory);
        }
        Map<String, Path> files = new TreeMap<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + Constants.CHUNK_FILE_EXT)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.put(file.getFileName().toString(), file);
                }
            }
        } catch (IOException exc) {
            throw new IllegalStateException("Failed to list " + directory, exc);
        }
        Map<String, String> texts = new LinkedHashMap<>();
        for (Map.Entry<String, Path> entry : files.entrySet()) {
            texts.put(entry.getKey(), SourceText.read(entry.getValue()));
        }
        return texts;
    }

    /**
     * Offers every chunk file in {@code directory} to {@code reassembler}.
     *
     * @return number of files that parsed as records
     */
    public static int load(Path directory, Reassembler reassembler) {
        int accepted = 0;
        for (Map.Entry<String, String> entry : readTexts(directory).entrySet()) {
            if (reassembler.offerText(entry.getKey(), entry.getValue()) != null) {
                accepted++;
            }
        }
        RuntimeLog.info("Loaded " + accepted + " chunk file(s) from " + directory);
        return accepted;
    }
}
