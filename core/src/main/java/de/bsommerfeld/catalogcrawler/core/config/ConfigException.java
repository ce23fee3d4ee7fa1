package de.bsommerfeld.catalogcrawler.core.config;

/**
 * Thrown when the configuration cannot be read or is unusable. Fatal at
 * startup.
 */
public class ConfigException extends Exception {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
