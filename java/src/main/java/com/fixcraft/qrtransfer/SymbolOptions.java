package com.fixcraft.qrtransfer;

import java.util.Locale;

/**
 * Rendering options for one optical symbol: pixels per module, quiet-zone width
 * in modules, error correction level.
 */
public final class SymbolOptions {
    public enum ErrorCorrection {
        L,
        M,
        Q,
        H;

        public static ErrorCorrection parse(String raw) {
            if (raw == null) {
                throw new IllegalArgumentException("error correction level required");
            }
            try {
                return valueOf(raw.trim().toUpperCase(Locale.US));
            } catch (IllegalArgumentException exc) {
                throw new IllegalArgumentException("Unknown error correction level '" + raw + "' (use L, M, Q or H)", exc);
            }
        }
    }

    public final int boxSize;
    public final int border;
    public final ErrorCorrection errorCorrection;

    public SymbolOptions(int boxSize, int border, ErrorCorrection errorCorrection) {
        if (boxSize < 1) {
            throw new IllegalArgumentException("box size must be >= 1");
        }
        if (border < 0) {
            throw new IllegalArgumentException("border must be >= 0");
        }
        this.boxSize = boxSize;
        this.border = border;
        this.errorCorrection = errorCorrection == null ? ErrorCorrection.L : errorCorrection;
    }

    public static SymbolOptions defaults() {
        return new SymbolOptions(Constants.DEFAULT_BOX_SIZE, Constants.DEFAULT_BORDER, ErrorCorrection.L);
    }

    public SymbolOptions withBoxSize(int value) {
        return new SymbolOptions(value, border, errorCorrection);
    }

    public SymbolOptions withBorder(int value) {
        return new SymbolOptions(boxSize, value, errorCorrection);
    }

    public SymbolOptions withErrorCorrection(ErrorCorrection value) {
        return new SymbolOptions(boxSize, border, value);
    }
}
