package com.fixcraft.qrtransfer;

import java.util.Arrays;

public final class PasswordPolicy {
    private PasswordPolicy() {}

    public static void requireValid(char[] password) {
        if (password == null || password.length == 0) {
            throw new IllegalArgumentException("Password required");
        }
        if (password.length < Constants.MIN_PASSWORD_LEN) {
            throw new IllegalArgumentException(
                "Password must be at least " + Constants.MIN_PASSWORD_LEN + " characters long");
        }
    }

    /**
     * Checks an interactively entered password and its confirmation.
     */
    public static void requireConfirmed(char[] password, char[] confirmation) {
        requireValid(password);
        if (!Arrays.equals(password, confirmation)) {
            throw new IllegalArgumentException("Passwords do not match");
        }
    }
}
