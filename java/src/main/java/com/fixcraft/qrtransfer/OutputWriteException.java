package com.fixcraft.qrtransfer;

import java.io.IOException;
import java.nio.file.Path;

/** A reconstructed file could not be written; the target is left as it was. */
public final class OutputWriteException extends TransferException {
    private final Path target;

    public OutputWriteException(Path target, IOException cause) {
        super("Failed to write " + target + ": " + cause.getMessage(), cause);
        this.target = target;
    }

    public Path target() {
        return target;
    }
}
