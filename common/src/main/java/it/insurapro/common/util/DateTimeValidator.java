package it.insurapro.common.util;

import java.util.regex.Pattern;

/**
 * Format checks for interaction dates and times.
 *
 * Only the shape is checked (digits and separators), not calendar validity:
 * "31/02/2024" passes, "1/2/2024" does not.
 */
public final class DateTimeValidator {

    private static final Pattern DATE_PATTERN = Pattern.compile("^\\d{2}/\\d{2}/\\d{4}$");
    private static final Pattern TIME_PATTERN = Pattern.compile("^\\d{2}:\\d{2}$");

    private DateTimeValidator() {
        // Utility class - no instantiation
    }

    /**
     * Check a DD/MM/YYYY date string.
     *
     * @param date value to check
     * @return true if exactly two digits, '/', two digits, '/', four digits
     */
    public static boolean isValidDate(String date) {
        return date != null && DATE_PATTERN.matcher(date).matches();
    }

    /**
     * Check an HH:MM time string.
     */
    public static boolean isValidTime(String time) {
        return time != null && TIME_PATTERN.matcher(time).matches();
    }
}
