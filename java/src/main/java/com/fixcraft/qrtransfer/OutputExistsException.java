package com.fixcraft.qrtransfer;

import java.nio.file.Path;

public final class OutputExistsException extends TransferException {
    private final Path target;

    public OutputExistsException(Path target) {
        super("Refusing to overwrite existing file " + target);
        this.target = target;
    }

    public Path target() {
        return target;
    }
}
