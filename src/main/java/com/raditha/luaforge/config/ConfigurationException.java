package com.raditha.luaforge.config;

/**
 * A configuration that cannot be read or does not describe a valid pipeline.
 */
public class ConfigurationException extends Exception {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
