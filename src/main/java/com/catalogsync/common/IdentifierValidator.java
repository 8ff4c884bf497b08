package com.catalogsync.common;

/**
 * Normalizes raw identifier cells (MMS IDs, OCLC numbers) read from input files.
 */
public final class IdentifierValidator {

    private IdentifierValidator() {
    }

    /**
     * Trims the raw value and checks that it is a non-empty string of digits.
     *
     * @param rawValue  value as read from the input row (may be null)
     * @param fieldName name used in the error message, e.g. "MMS ID"
     * @return the trimmed digit string
     * @throws ValidationException if the value is empty or contains a non-digit character
     */
    public static String validate(String rawValue, String fieldName) {
        String value = rawValue == null ? "" : rawValue.strip();
        if (value.isEmpty()) {
            throw new ValidationException("Invalid " + fieldName + ": '" + value + "' is empty");
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                throw new ValidationException("Invalid " + fieldName + ": '" + value
                        + "' contains at least one non-digit character");
            }
        }
        return value;
    }

    /**
     * Strips leading zeros from an already validated digit string. "000" becomes "0".
     */
    public static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }
}
