package com.bank.payout.exception;

/**
 * Missing or inconsistent configuration. Fatal at startup.
 */
public class ConfigurationException extends PayoutException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
