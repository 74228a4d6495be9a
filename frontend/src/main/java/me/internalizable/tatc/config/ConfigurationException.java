package me.internalizable.tatc.config;

/**
 * Thrown when the front end configuration is invalid. Always fatal at startup.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
