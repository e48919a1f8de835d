package org.netpreserve.mapcrawl.config;

/**
 * The configuration is missing a required value or can't be read. Fatal at startup.
 */
public class ConfigException extends Exception {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
