package com.batonsystems.config;

/**
 * Exception thrown when a queue or pipeline is constructed with settings it cannot honour,
 * such as a non-positive capacity.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /** The name of the offending setting. */
    private final String setting;

    /**
     * Creates a new InvalidConfigurationException.
     *
     * @param setting the name of the offending setting
     * @param message the detail message
     */
    public InvalidConfigurationException(String setting, String message) {
        super(message);
        this.setting = setting;
    }

    /**
     * Returns the name of the setting that failed validation.
     *
     * @return the setting name
     */
    public String getSetting() {
        return setting;
    }

    /**
     * Fails unless the given value is at least 1.
     *
     * @param setting the name of the setting
     * @param value the value to check
     * @return the value
     * @throws InvalidConfigurationException if the value is zero or negative
     */
    public static int requirePositive(String setting, int value) {
        if (value <= 0) {
            throw new InvalidConfigurationException(setting, setting + " must be greater than 0, was " + value);
        }
        return value;
    }
}
