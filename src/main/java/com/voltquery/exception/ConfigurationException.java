package com.voltquery.exception;

/**
 * Missing or invalid settings. Fatal at startup.
 */
public class ConfigurationException extends VoltQueryException {

    public ConfigurationException(String message) {
        super(message);
    }
}
