package com.fixcraft.qrtransfer;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads a folder of images, decodes every symbol in them and feeds the
 * payloads to a {@link Reassembler}. Scan order carries no meaning; records
 * are grouped and ordered by the reassembler.
 */
public final class ScanSession {
    public static final List<String> IMAGE_EXTENSIONS =
        Collections.unmodifiableList(Arrays.asList(".png", ".jpg", ".jpeg", ".bmp", ".gif"));

    private final SymbolCodec symbols;
    private final Reassembler reassembler;
    private final List<WireRecord> validRecords = new ArrayList<>();
    private int imagesProcessed;
    private int symbolsFound;
    private int errors;

    public ScanSession(SymbolCodec symbols, Reassembler reassembler) {
        if (symbols == null || reassembler == null) {
            throw new IllegalArgumentException("ScanSession needs a symbol codec and a reassembler");
        }
        this.symbols = symbols;
        this.reassembler = reassembler;
    }

    public static boolean isImage(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.US);
        for (String ext : IMAGE_EXTENSIONS) {
            if (name.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Scans every supported image directly inside {@code directory}, in name order.
     *
     * @return number of valid records found in this call
     */
    public int scanDirectory(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Image directory not found: " + directory);
        }
        Map<String, Path> images = new TreeMap<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file) && isImage(file)) {
                    images.put(file.getFileName().toString(), file);
                }
            }
        } catch (IOException exc) {
            throw new IllegalStateException("Failed to list " + directory, exc);
        }
        if (images.isEmpty()) {
            RuntimeLog.warn("No images found in " + directory);
        }
        int before = validRecords.size();
        for (Path image : images.values()) {
            scanImage(image);
        }
        return validRecords.size() - before;
    }

    /** @return number of valid records found in this image */
    public int scanImage(Path image) {
        imagesProcessed++;
        String label = image.getFileName().toString();
        List<String> payloads;
        try {
            payloads = symbols.readImage(image);
        } catch (IllegalArgumentException | IllegalStateException exc) {
            errors++;
            RuntimeLog.warn("Could not read " + label + ": " + exc.getMessage());
            return 0;
        }
        if (payloads.isEmpty()) {
            RuntimeLog.debug(label + ": no symbols found");
        }
        int valid = 0;
        for (String payload : payloads) {
            if (offer(label, payload)) {
                valid++;
            }
        }
        return valid;
    }

    /** Feeds one already decoded payload, e.g. from a live camera reader. */
    public boolean offer(String source, String payload) {
        symbolsFound++;
        WireRecord record = reassembler.offerText(source, payload);
        if (record == null) {
            errors++;
            return false;
        }
        validRecords.add(record);
        RuntimeLog.part(RuntimeLog.Level.INFO, record.filename, record.index, record.total, "from " + source);
        return true;
    }

    /** Writes every valid record seen so far as a chunk file. */
    public List<Path> saveChunks(Path directory) {
        return ChunkFiles.write(directory, validRecords);
    }

    public ReassemblyReport rebuild(Path outputDir, boolean overwrite) {
        return reassembler.rebuildAll(outputDir, overwrite);
    }

    public Reassembler reassembler() {
        return reassembler;
    }

    public List<WireRecord> validRecords() {
        return Collections.unmodifiableList(validRecords);
    }

    public int imagesProcessed() {
        return imagesProcessed;
    }

    public int symbolsFound() {
        return symbolsFound;
    }

    public int validChunks() {
        return validRecords.size();
    }

    public int errors() {
        return errors;
    }

    public String summary() {
        return String.format("%d image(s), %d symbol(s), %d valid chunk(s), %d error(s)",
            imagesProcessed, symbolsFound, validRecords.size(), errors);
    }
}
