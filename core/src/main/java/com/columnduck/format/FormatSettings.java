package com.columnduck.format;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings controlling escaping and quoting of the text formats.
 *
 * <p>Settings are owned by the caller and passed by reference to every text
 * codec; codecs only read them. Instances are immutable: the {@code with*}
 * methods return modified copies.
 *
 * <p>Example usage:
 * <pre>
 *   FormatSettings settings = FormatSettings.defaults()
 *       .withCsvDelimiter(';')
 *       .withJsonQuote64bitIntegers(false);
 * </pre>
 */
public final class FormatSettings {

    private static final Logger logger = LoggerFactory.getLogger(FormatSettings.class);

    /** Classpath resource read by {@link #load()}. */
    public static final String RESOURCE_NAME = "columnduck-format.properties";

    public static final String CSV_DELIMITER = "format_csv_delimiter";
    public static final String CSV_ALLOW_SINGLE_QUOTES = "format_csv_allow_single_quotes";
    public static final String CSV_ALLOW_DOUBLE_QUOTES = "format_csv_allow_double_quotes";
    public static final String JSON_QUOTE_64BIT_INTEGERS = "output_format_json_quote_64bit_integers";
    public static final String JSON_QUOTE_DENORMALS = "output_format_json_quote_denormals";
    public static final String JSON_ESCAPE_FORWARD_SLASHES = "output_format_json_escape_forward_slashes";

    private static final FormatSettings DEFAULTS = new FormatSettings(',', true, true, true, false, true);

    private final char csvDelimiter;
    private final boolean csvAllowSingleQuotes;
    private final boolean csvAllowDoubleQuotes;
    private final boolean jsonQuote64bitIntegers;
    private final boolean jsonQuoteDenormals;
    private final boolean jsonEscapeForwardSlashes;

    private FormatSettings(char csvDelimiter, boolean csvAllowSingleQuotes, boolean csvAllowDoubleQuotes,
                           boolean jsonQuote64bitIntegers, boolean jsonQuoteDenormals,
                           boolean jsonEscapeForwardSlashes) {
        this.csvDelimiter = csvDelimiter;
        this.csvAllowSingleQuotes = csvAllowSingleQuotes;
        this.csvAllowDoubleQuotes = csvAllowDoubleQuotes;
        this.jsonQuote64bitIntegers = jsonQuote64bitIntegers;
        this.jsonQuoteDenormals = jsonQuoteDenormals;
        this.jsonEscapeForwardSlashes = jsonEscapeForwardSlashes;
    }

    /**
     * Returns the built-in defaults.
     *
     * @return the default settings
     */
    public static FormatSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Loads settings from the {@value #RESOURCE_NAME} classpath resource.
     *
     * <p>Falls back to {@link #defaults()} when the resource is missing or unreadable.
     *
     * @return the loaded settings
     */
    public static FormatSettings load() {
        try (InputStream in = FormatSettings.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                logger.debug("No {} on classpath, using default format settings", RESOURCE_NAME);
                return DEFAULTS;
            }
            Properties properties = new Properties();
            properties.load(in);
            FormatSettings settings = fromProperties(properties);
            logger.debug("Loaded format settings from {}: {}", RESOURCE_NAME, settings);
            return settings;
        } catch (IOException e) {
            logger.warn("Failed to read {}, using default format settings", RESOURCE_NAME, e);
            return DEFAULTS;
        }
    }

    /**
     * Creates settings from properties. Missing keys keep their defaults;
     * malformed values are logged and ignored.
     *
     * @param properties the properties
     * @return the settings
     */
    public static FormatSettings fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        FormatSettings settings = DEFAULTS;

        String delimiter = properties.getProperty(CSV_DELIMITER);
        if (delimiter != null) {
            if (delimiter.length() == 1) {
                try {
                    settings = settings.withCsvDelimiter(delimiter.charAt(0));
                } catch (IllegalArgumentException e) {
                    logger.warn("Ignoring {}='{}': {}", CSV_DELIMITER, delimiter, e.getMessage());
                }
            } else {
                logger.warn("Ignoring {}='{}': must be a single character", CSV_DELIMITER, delimiter);
            }
        }
        settings = settings.withCsvAllowSingleQuotes(
            parseBoolean(properties, CSV_ALLOW_SINGLE_QUOTES, settings.csvAllowSingleQuotes));
        settings = settings.withCsvAllowDoubleQuotes(
            parseBoolean(properties, CSV_ALLOW_DOUBLE_QUOTES, settings.csvAllowDoubleQuotes));
        settings = settings.withJsonQuote64bitIntegers(
            parseBoolean(properties, JSON_QUOTE_64BIT_INTEGERS, settings.jsonQuote64bitIntegers));
        settings = settings.withJsonQuoteDenormals(
            parseBoolean(properties, JSON_QUOTE_DENORMALS, settings.jsonQuoteDenormals));
        settings = settings.withJsonEscapeForwardSlashes(
            parseBoolean(properties, JSON_ESCAPE_FORWARD_SLASHES, settings.jsonEscapeForwardSlashes));
        return settings;
    }

    private static boolean parseBoolean(Properties properties, String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        switch (value.trim().toLowerCase()) {
            case "1":
            case "true":
                return true;
            case "0":
            case "false":
                return false;
            default:
                logger.warn("Ignoring {}='{}': expected true/false or 1/0", key, value);
                return defaultValue;
        }
    }

    public char csvDelimiter() {
        return csvDelimiter;
    }

    public boolean csvAllowSingleQuotes() {
        return csvAllowSingleQuotes;
    }

    public boolean csvAllowDoubleQuotes() {
        return csvAllowDoubleQuotes;
    }

    /**
     * Whether Int64 and UInt64 values are written as JSON strings.
     */
    public boolean jsonQuote64bitIntegers() {
        return jsonQuote64bitIntegers;
    }

    /**
     * Whether non-finite floating point values are written as quoted JSON strings instead of null.
     */
    public boolean jsonQuoteDenormals() {
        return jsonQuoteDenormals;
    }

    public boolean jsonEscapeForwardSlashes() {
        return jsonEscapeForwardSlashes;
    }

    public FormatSettings withCsvDelimiter(char delimiter) {
        if (delimiter == '"' || delimiter == '\'' || delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("Illegal CSV delimiter: " + delimiter);
        }
        return new FormatSettings(delimiter, csvAllowSingleQuotes, csvAllowDoubleQuotes,
            jsonQuote64bitIntegers, jsonQuoteDenormals, jsonEscapeForwardSlashes);
    }

    public FormatSettings withCsvAllowSingleQuotes(boolean allow) {
        return new FormatSettings(csvDelimiter, allow, csvAllowDoubleQuotes,
            jsonQuote64bitIntegers, jsonQuoteDenormals, jsonEscapeForwardSlashes);
    }

    public FormatSettings withCsvAllowDoubleQuotes(boolean allow) {
        return new FormatSettings(csvDelimiter, csvAllowSingleQuotes, allow,
            jsonQuote64bitIntegers, jsonQuoteDenormals, jsonEscapeForwardSlashes);
    }

    public FormatSettings withJsonQuote64bitIntegers(boolean quote) {
        return new FormatSettings(csvDelimiter, csvAllowSingleQuotes, csvAllowDoubleQuotes,
            quote, jsonQuoteDenormals, jsonEscapeForwardSlashes);
    }

    public FormatSettings withJsonQuoteDenormals(boolean quote) {
        return new FormatSettings(csvDelimiter, csvAllowSingleQuotes, csvAllowDoubleQuotes,
            jsonQuote64bitIntegers, quote, jsonEscapeForwardSlashes);
    }

    public FormatSettings withJsonEscapeForwardSlashes(boolean escape) {
        return new FormatSettings(csvDelimiter, csvAllowSingleQuotes, csvAllowDoubleQuotes,
            jsonQuote64bitIntegers, jsonQuoteDenormals, escape);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormatSettings)) return false;
        FormatSettings that = (FormatSettings) o;
        return csvDelimiter == that.csvDelimiter
            && csvAllowSingleQuotes == that.csvAllowSingleQuotes
            && csvAllowDoubleQuotes == that.csvAllowDoubleQuotes
            && jsonQuote64bitIntegers == that.jsonQuote64bitIntegers
            && jsonQuoteDenormals == that.jsonQuoteDenormals
            && jsonEscapeForwardSlashes == that.jsonEscapeForwardSlashes;
    }

    @Override
    public int hashCode() {
        return Objects.hash(csvDelimiter, csvAllowSingleQuotes, csvAllowDoubleQuotes,
            jsonQuote64bitIntegers, jsonQuoteDenormals, jsonEscapeForwardSlashes);
    }

    @Override
    public String toString() {
        return "FormatSettings(csvDelimiter='" + csvDelimiter + "'"
            + ", csvAllowSingleQuotes=" + csvAllowSingleQuotes
            + ", csvAllowDoubleQuotes=" + csvAllowDoubleQuotes
            + ", jsonQuote64bitIntegers=" + jsonQuote64bitIntegers
            + ", jsonQuoteDenormals=" + jsonQuoteDenormals
            + ", jsonEscapeForwardSlashes=" + jsonEscapeForwardSlashes + ")";
    }
}
