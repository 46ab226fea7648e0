package com.columnduck.format;

/**
 * Text encodings a value can be written in and read from.
 */
public enum TextFormat {

    /** Tab-separated escaping: special characters as backslash sequences. */
    ESCAPED("Escaped"),

    /** SQL literal form: strings single-quoted, NULL as {@code NULL}. */
    QUOTED("Quoted"),

    /** RFC 4180 style CSV field. */
    CSV("CSV"),

    /** Raw value with no escaping or quoting. */
    PLAIN("Text"),

    /** JSON value. */
    JSON("JSON"),

    /** XML element text. */
    XML("XML");

    private final String displayName;

    TextFormat(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns the name used in error messages.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }
}
