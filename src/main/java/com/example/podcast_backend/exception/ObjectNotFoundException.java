package com.example.podcast_backend.exception;

public class ObjectNotFoundException extends StorageException {
    private final String locator;

    public ObjectNotFoundException(String locator) {
        super("Object not found: " + locator);
        this.locator = locator;
    }

    public String getLocator() {
        return locator;
    }
}
