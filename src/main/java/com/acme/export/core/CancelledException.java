package com.acme.export.core;

public class CancelledException extends RuntimeException {
    public CancelledException(String message) {
        super(message);
    }
}
