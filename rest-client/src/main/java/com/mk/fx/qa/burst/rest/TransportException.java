package com.mk.fx.qa.burst.rest;

/**
 * Raised when a request could not produce any HTTP response: the connection was refused, the host
 * could not be resolved, the deadline expired or the calling thread was interrupted.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
