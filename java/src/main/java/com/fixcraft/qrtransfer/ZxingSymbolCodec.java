package com.fixcraft.qrtransfer;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.DecodeHintType;
import com.google.zxing.EncodeHintType;
import com.google.zxing.LuminanceSource;
import com.google.zxing.NotFoundException;
import com.google.zxing.ReaderException;
import com.google.zxing.RGBLuminanceSource;
import com.google.zxing.Result;
import com.google.zxing.WriterException;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.common.HybridBinarizer;
import com.google.zxing.multi.qrcode.QRCodeMultiReader;
import com.google.zxing.qrcode.QRCodeReader;
import com.google.zxing.qrcode.QRCodeWriter;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * QR symbols through ZXing. Payloads are encoded in UTF-8 byte mode; the
 * image is drawn with one {@code boxSize}-pixel square per module.
 */
public final class ZxingSymbolCodec implements SymbolCodec {
    private static final String CHARSET = "UTF-8";
    private static final int BLACK = 0;
    private static final int WHITE = 0xFF;

    @Override
    public BufferedImage encodeSymbol(String payload, SymbolOptions options) {
        if (payload == null) {
            throw new IllegalArgumentException("encodeSymbol expects text");
        }
        SymbolOptions opts = options == null ? SymbolOptions.defaults() : options;
        Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
        hints.put(EncodeHintType.CHARACTER_SET, CHARSET);
        hints.put(EncodeHintType.ERROR_CORRECTION, level(opts.errorCorrection));
        hints.put(EncodeHintType.MARGIN, opts.border);
        BitMatrix matrix;
        try {
            matrix = new QRCodeWriter().encode(payload, BarcodeFormat.QR_CODE, 0, 0, hints);
        } catch (WriterException exc) {
            throw new IllegalArgumentException("Payload does not fit one QR symbol: " + exc.getMessage(), exc);
        }
        return render(matrix, opts.boxSize);
    }

    @Override
    public List<String> decodeSymbols(BufferedImage image) {
        if (image == null) {
            throw new IllegalArgumentException("decodeSymbols expects an image");
        }
        int width = image.getWidth();
        int height = image.getHeight();
        int[] pixels = image.getRGB(0, 0, width, height, null, 0, width);
        LuminanceSource source = new RGBLuminanceSource(width, height, pixels);
        BinaryBitmap bitmap = new BinaryBitmap(new HybridBinarizer(source));
        Map<DecodeHintType, Object> hints = new EnumMap<>(DecodeHintType.class);
        hints.put(DecodeHintType.TRY_HARDER, Boolean.TRUE);
        hints.put(DecodeHintType.CHARACTER_SET, CHARSET);

        Set<String> found = new LinkedHashSet<>();
        try {
            for (Result result : new QRCodeMultiReader().decodeMultiple(bitmap, hints)) {
                found.add(result.getText());
            }
        } catch (NotFoundException exc) {
            RuntimeLog.debug("Multi-symbol pass found nothing, trying single-symbol pass");
        }
        if (found.isEmpty()) {
            try {
                found.add(new QRCodeReader().decode(bitmap, hints).getText());
            } catch (ReaderException exc) {
                return Collections.emptyList();
            }
        }
        return new ArrayList<>(found);
    }

    private static BufferedImage render(BitMatrix matrix, int boxSize) {
        int modulesWide = matrix.getWidth();
        int modulesHigh = matrix.getHeight();
        BufferedImage image = new BufferedImage(modulesWide * boxSize, modulesHigh * boxSize, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = image.getRaster();
        for (int my = 0; my < modulesHigh; my++) {
            for (int mx = 0; mx < modulesWide; mx++) {
                int v = matrix.get(mx, my) ? BLACK : WHITE;
                int x0 = mx * boxSize;
                int y0 = my * boxSize;
                for (int y = y0; y < y0 + boxSize; y++) {
                    for (int x = x0; x < x0 + boxSize; x++) {
                        raster.setSample(x, y, 0, v);
                    }
                }
            }
        }
        return image;
    }

    private static ErrorCorrectionLevel level(SymbolOptions.ErrorCorrection ec) {
        switch (ec) {
            case M:
                return ErrorCorrectionLevel.M;
            case Q:
                return ErrorCorrectionLevel.Q;
            case H:
                return ErrorCorrectionLevel.H;
            case L:
            default:
                return ErrorCorrectionLevel.L;
        }
    }
}
