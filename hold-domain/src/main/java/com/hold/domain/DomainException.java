package com.hold.domain;

/**
 * Base type for rule violations raised by the hold invoice model.
 */
public class DomainException extends RuntimeException {

    public DomainException(String message) {
        super(message);
    }

    public DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
