package io.valuation.error;

/**
 * A required input field is missing or invalid.
 */
public class ConfigException extends ValuationException {
    private final String field;

    public ConfigException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public ConfigException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    public String field() { return field; }
}
