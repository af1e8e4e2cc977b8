package it.insurapro.common.util;

/**
 * Helpers for free-form record fields that end up in the pipe-delimited data files.
 */
public final class FieldSanitizer {

    public static final char SEPARATOR = '|';

    private FieldSanitizer() {
        // Utility class - no instantiation
    }

    /**
     * Null becomes empty; everything else is returned as-is.
     */
    public static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /**
     * True if the value would be stored: not null and not empty.
     * Used by partial updates, where empty means "keep the current value".
     */
    public static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    /**
     * Values containing the separator (or a line break) would shift the field
     * count of the stored line and be dropped as malformed on the next load.
     */
    public static boolean isStorable(String value) {
        if (value == null) {
            return true;
        }
        return value.indexOf(SEPARATOR) < 0
                && value.indexOf('\n') < 0
                && value.indexOf('\r') < 0;
    }
}
