package com.acme.export.core;

/**
 * A listing page past the end of the owner's listing (a not-found page after the first).
 * Ends the discovery walk instead of failing it.
 */
public class ListingEndException extends RuntimeException {
    public ListingEndException(String message) {
        super(message);
    }
}
