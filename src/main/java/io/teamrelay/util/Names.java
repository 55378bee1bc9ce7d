package io.teamrelay.util;

import io.teamrelay.storage.StoreException;

/**
 * Team and agent names double as file names, so they are restricted to a filesystem-safe alphabet.
 */
public final class Names {
    public static final int MAX_LENGTH = 64;

    private Names() {
    }

    public static boolean isValid(String raw) {
        if (raw == null || raw.isEmpty() || raw.length() > MAX_LENGTH) {
            return false;
        }
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-';
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    public static String requireValid(String raw, String what) {
        if (raw == null || raw.isEmpty()) {
            throw StoreException.invalidName(what + " name must not be empty");
        }
        if (raw.length() > MAX_LENGTH) {
            throw StoreException.invalidName(
                    what + " name too long (" + raw.length() + " chars, max " + MAX_LENGTH + ")");
        }
        if (!isValid(raw)) {
            throw StoreException.invalidName(
                    "Invalid " + what.toLowerCase() + " name: '" + raw + "'. Use only letters, numbers, hyphens, underscores.");
        }
        return raw;
    }
}
