package com.fixcraft.qrtransfer;

/**
 * Supplies the password for encrypted files during reassembly. Asked once per
 * run, and again only when the first encrypted part fails to decrypt. The
 * caller wipes the returned array once it has used it.
 */
@FunctionalInterface
public interface PasswordSource {
    /**
     * @param filename file whose parts need decrypting
     * @param attempt 1-based attempt number
     * @return the password, or {@code null} when none can be supplied
     */
    char[] password(String filename, int attempt);

    static PasswordSource of(char[] password) {
        char[] held = password == null ? null : password.clone();
        return (filename, attempt) -> held == null ? null : held.clone();
    }

    static PasswordSource none() {
        return (filename, attempt) -> null;
    }
}
