package com.fixcraft.qrtransfer;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Forward path: read the source once, hash and chunk it in the same pass,
 * check the chunk count against the confirmation threshold, seal every chunk
 * (optionally encrypted) and persist the records as chunk files and/or symbol
 * images.
 */
public final class TransferEncoder {
    /** Asked when a file needs more chunks than the configured threshold. */
    @FunctionalInterface
    public interface CapacityCheck {
        boolean confirm(int chunks, int threshold);
    }

    public static final CapacityCheck ALWAYS = (chunks, threshold) -> true;
    public static final CapacityCheck NEVER = (chunks, threshold) -> false;

    /** A source file split and hashed, ready to seal. */
    public static final class Prepared {
        public final String filename;
        public final String fileHash;
        public final List<Chunk> chunks;

        Prepared(String filename, String fileHash, List<Chunk> chunks) {
            this.filename = filename;
            this.fileHash = fileHash;
            this.chunks = Collections.unmodifiableList(chunks);
        }

        public int total() {
            return chunks.size();
        }
    }

    public static final class Result {
        public final Prepared prepared;
        public final List<WireRecord> records;
        public final List<Path> chunkFiles;
        public final List<Path> symbolFiles;

        Result(Prepared prepared, List<WireRecord> records, List<Path> chunkFiles, List<Path> symbolFiles) {
            this.prepared = prepared;
            this.records = Collections.unmodifiableList(records);
            this.chunkFiles = Collections.unmodifiableList(chunkFiles);
            this.symbolFiles = Collections.unmodifiableList(symbolFiles);
        }
    }

    private final TransferConfig config;
    private final SymbolCodec symbols;

    public TransferEncoder(TransferConfig config) {
        this(config, new ZxingSymbolCodec());
    }

    public TransferEncoder(TransferConfig config, SymbolCodec symbols) {
        if (config == null) {
            throw new IllegalArgumentException("config required");
        }
        this.config = config;
        this.symbols = symbols;
    }

    public TransferConfig config() {
        return config;
    }

    public Prepared prepare(Path source, boolean encrypted) {
        if (source == null || !Files.isRegularFile(source)) {
            throw new IllegalArgumentException("Source file not found: " + source);
        }
        String filename = source.getFileName().toString();
        try (Reader reader = SourceText.openReader(source)) {
            return prepare(filename, reader, encrypted);
        } catch (IOException exc) {
            throw new IllegalStateException("Failed to read " + source, exc);
        }
    }

    public Prepared prepare(String filename, String content, boolean encrypted) {
        if (content == null) {
            throw new IllegalArgumentException("prepare expects text");
        }
        return prepare(filename, new StringReader(content), encrypted);
    }

    private Prepared prepare(String filename, Reader reader, boolean encrypted) {
        String name = OutputWriter.safeName(filename);
        int cap = config.chunkCap(encrypted);
        IntegrityHasher.Running hash = IntegrityHasher.running();
        List<String> bodies = new ArrayList<>();
        LineChunker.split(reader, cap, body -> {
            hash.update(body);
            bodies.add(body);
        });
        if (bodies.isEmpty()) {
            bodies.add("");
        }
        String fileHash = hash.hex();
        int total = bodies.size();
        List<Chunk> chunks = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            String body = bodies.get(i);
            if (LineChunker.utf8Length(body) > cap) {
                RuntimeLog.warn(String.format("%s: part %02d holds a single %d-byte line above the %d-byte cap",
                    name, i + 1, LineChunker.utf8Length(body), cap));
            }
            chunks.add(new Chunk(i + 1, total, name, body));
        }
        RuntimeLog.debug(name + ": " + total + " chunk(s), cap " + cap + " bytes, file hash " + fileHash);
        return new Prepared(name, fileHash, chunks);
    }

    /**
     * @throws CapacityExceededException when the count is above the threshold
     *     and {@code check} declines
     */
    public void checkCapacity(Prepared prepared, CapacityCheck check) {
        int chunks = prepared.total();
        if (chunks <= config.capacityWarn) {
            return;
        }
        RuntimeLog.warn(prepared.filename + " needs " + chunks + " symbols (threshold " + config.capacityWarn + ")");
        if (check == null || !check.confirm(chunks, config.capacityWarn)) {
            throw new CapacityExceededException(chunks, config.capacityWarn);
        }
    }

    /**
     * Seals every chunk, encrypting when {@code cipher} is given.
     *
     * @throws PartialEncodingException listing each part that failed
     */
    public List<WireRecord> seal(Prepared prepared, ChunkCipher cipher) {
        ChunkEncoder encoder = cipher == null
            ? ChunkEncoder.plain(prepared.fileHash)
            : ChunkEncoder.encrypted(prepared.fileHash, cipher);
        return config.parallelEncoder().encodeAll(prepared.chunks, encoder).recordsOrThrow();
    }

    public List<Path> writeSymbols(Path directory, List<WireRecord> records) {
        if (symbols == null) {
            throw new IllegalStateException("No symbol codec configured");
        }
        List<Path> written = new ArrayList<>(records.size());
        Map<Integer, Throwable> failures = new HashMap<>();
        for (WireRecord record : records) {
            String name = ChunkFiles.symbolFileName(ChunkFiles.stem(record.filename), record.encrypted,
                record.index, record.total);
            try {
                written.add(symbols.writeImage(ChunkCodec.render(record), config.symbolOptions, directory.resolve(name)));
                RuntimeLog.debug("Saved " + name);
            } catch (RuntimeException exc) {
                RuntimeLog.error(String.format("Part %02d: %s", record.index, exc.getMessage()));
                failures.put(record.index, exc);
            }
        }
        if (!failures.isEmpty()) {
            throw new PartialEncodingException(failures);
        }
        return written;
    }

    /**
     * Full forward run for one file.
     *
     * @param cipher {@code null} for plain records
     */
    public Result encodeFile(Path source, Path outputDir, ChunkCipher cipher, boolean writeChunkFiles,
                             boolean writeSymbolFiles, CapacityCheck check) {
        if (outputDir == null) {
            throw new IllegalArgumentException("outputDir required");
        }
        Prepared prepared = prepare(source, cipher != null);
        checkCapacity(prepared, check);
        List<WireRecord> records = seal(prepared, cipher);
        List<Path> chunkFiles = writeChunkFiles ? ChunkFiles.write(outputDir, records) : Collections.emptyList();
        List<Path> symbolFiles = writeSymbolFiles ? writeSymbols(outputDir, records) : Collections.emptyList();
        RuntimeLog.info(String.format("%s: %d part(s)%s, file hash %s",
            prepared.filename, records.size(), cipher != null ? " encrypted" : "", prepared.fileHash));
        return new Result(prepared, records, chunkFiles, symbolFiles);
    }
}
