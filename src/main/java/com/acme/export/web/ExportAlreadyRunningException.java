package com.acme.export.web;

public class ExportAlreadyRunningException extends RuntimeException {
    public ExportAlreadyRunningException(String ownerId) {
        super("An export is already running for owner " + ownerId);
    }
}
