package com.acme.export.core;

/**
 * The identifier universe could not be enumerated. Fatal to the run.
 */
public class DiscoveryException extends RuntimeException {
    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
