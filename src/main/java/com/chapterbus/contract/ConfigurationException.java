package com.chapterbus.contract;

/**
 * Thrown when the runtime is misconfigured: a referenced worker has no adapter, a
 * setting is out of range, or a chapter dependency cannot be satisfied. Fatal at startup.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
