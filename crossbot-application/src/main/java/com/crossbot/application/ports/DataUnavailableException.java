package com.crossbot.application.ports;

/**
 * Market data could not be fetched (network, API or parse error). Recoverable.
 */
public class DataUnavailableException extends Exception {

    public DataUnavailableException(String message) {
        super(message);
    }

    public DataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
