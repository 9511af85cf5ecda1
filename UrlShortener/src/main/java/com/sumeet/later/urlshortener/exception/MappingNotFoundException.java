package com.sumeet.later.urlshortener.exception;

/**
 * No live mapping exists for the requested short code.
 */
public class MappingNotFoundException extends RuntimeException {

    private final String shortCode;

    public MappingNotFoundException(String shortCode) {
        super("URL not found or expired");
        this.shortCode = shortCode;
    }

    public String getShortCode() {
        return shortCode;
    }
}
