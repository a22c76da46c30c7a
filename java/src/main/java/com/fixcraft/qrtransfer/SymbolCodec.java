package com.fixcraft.qrtransfer;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import javax.imageio.ImageIO;

/**
 * Boundary to the optical transport. Payload text goes through unmodified in
 * both directions; decoded payloads come back in no particular order.
 */
public interface SymbolCodec {
    /**
     * @throws IllegalArgumentException if the payload does not fit one symbol
     */
    BufferedImage encodeSymbol(String payload, SymbolOptions options);

    /** Zero or more payloads found in {@code image}. */
    List<String> decodeSymbols(BufferedImage image);

    default Path writeImage(String payload, SymbolOptions options, Path target) {
        BufferedImage image = encodeSymbol(payload, options);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!ImageIO.write(image, "png", target.toFile())) {
                throw new IllegalStateException("No PNG writer available");
            }
            return target;
        } catch (IOException exc) {
            throw new IllegalStateException("Failed to write " + target, exc);
        }
    }

    /**
     * @throws IllegalArgumentException if no image reader understands the file
     */
    default List<String> readImage(Path file) {
        BufferedImage image;
        try {
            image = ImageIO.read(file.toFile());
        } catch (IOException exc) {
            throw new IllegalStateException("Failed to read image " + file, exc);
        }
        if (image == null) {
            throw new IllegalArgumentException("Not a readable image: " + file);
        }
        return decodeSymbols(image);
    }
}
