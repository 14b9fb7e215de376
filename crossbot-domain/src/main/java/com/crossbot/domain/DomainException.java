package com.crossbot.domain;

/**
 * Base class for rule violations raised by the trading core.
 */
public class DomainException extends RuntimeException {

    public DomainException(String message) {
        super(message);
    }

    public DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
