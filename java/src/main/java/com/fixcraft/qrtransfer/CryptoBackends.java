package com.fixcraft.qrtransfer;

import java.util.Locale;

public final class CryptoBackends {
    private static final CryptoBackend BOUNCY = new BouncyCastleCryptoBackend();
    private static final CryptoBackend JAVA = JavaCryptoBackend.tryCreate(BOUNCY);

    private CryptoBackends() {}

    /**
     * Backend named by {@code QRTRANSFER_CRYPTO_BACKEND}, otherwise JCE when it
     * passed its self-check, otherwise Bouncy Castle.
     */
    public static CryptoBackend get() {
        String raw = System.getenv(Constants.ENV_CRYPTO_BACKEND);
        if (raw != null && !raw.trim().isEmpty()) {
            return byName(raw);
        }
        return JAVA != null ? JAVA : BOUNCY;
    }

    public static CryptoBackend byName(String name) {
        String value = name == null ? "" : name.trim().toLowerCase(Locale.US);
        switch (value) {
            case "bc":
            case "bouncycastle":
                return BOUNCY;
            case "jce":
            case "java":
                if (JAVA == null) {
                    throw new IllegalStateException("JCE crypto backend unavailable on this JVM");
                }
                return JAVA;
            default:
                throw new IllegalArgumentException("Unknown crypto backend: " + name);
        }
    }

    public static boolean jceAvailable() {
        return JAVA != null;
    }
}
