package com.fixcraft.qrtransfer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes reconstructed files. Content goes to a temp file next to the target
 * and is moved into place only once fully written, so the target never holds a
 * partial file.
 */
public final class OutputWriter {
    private static final String TEMP_PREFIX = ".qrtransfer-";
    private static final String TEMP_SUFFIX = ".part";

    private OutputWriter() {}

    /**
     * Reduces a file name to its last path element, otherwise unchanged.
     * Surrounding spaces are part of the name. A line break cannot be carried in
     * a record header and is rejected.
     *
     * @throws ChunkFormatException if nothing usable remains
     */
    public static String safeName(String filename) {
        if (filename == null) {
            throw new ChunkFormatException("Missing output file name");
        }
        if (filename.indexOf('\n') >= 0 || filename.indexOf('\r') >= 0) {
            String shown = filename.replace("\r", "\\r").replace("\n", "\\n");
            throw new ChunkFormatException("File name contains a line break: '" + shown + "'");
        }
        String name = filename;
        int cut = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (cut >= 0) {
            name = name.substring(cut + 1);
        }
        String bare = name.trim();
        if (bare.isEmpty() || ".".equals(bare) || "..".equals(bare) || name.indexOf('\0') >= 0) {
            throw new ChunkFormatException("Unusable output file name '" + filename + "'");
        }
        return name;
    }

    public static Path write(Path directory, String filename, String content, boolean overwrite) {
        return write(directory, filename, content.getBytes(StandardCharsets.UTF_8), overwrite);
    }

    public static Path write(Path directory, String filename, byte[] content, boolean overwrite) {
        if (directory == null || content == null) {
            throw new IllegalArgumentException("write expects a directory and content");
        }
        Path target = directory.resolve(safeName(filename));
        if (!overwrite && Files.exists(target)) {
            throw new OutputExistsException(target);
        }
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, TEMP_PREFIX, TEMP_SUFFIX);
            Files.write(temp, content);
            moveIntoPlace(temp, target, overwrite);
            temp = null;
            return target;
        } catch (IOException exc) {
            throw new OutputWriteException(target, exc);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    private static void moveIntoPlace(Path temp, Path target, boolean overwrite) throws IOException {
        try {
            if (overwrite) {
                try {
                    Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException exc) {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } else {
                Files.move(temp, target);
            }
        } catch (FileAlreadyExistsException exc) {
            throw new OutputExistsException(target);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException exc) {
            RuntimeLog.warn("Could not remove temp file " + temp + ": " + exc.getMessage());
        }
    }
}
