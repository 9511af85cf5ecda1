package com.sumeet.later.urlshortener.exception;

public class UnauthorizedAccessException extends RuntimeException {

    private final String shortCode;

    public UnauthorizedAccessException(String shortCode) {
        super("Unauthorized access to URL");
        this.shortCode = shortCode;
    }

    public String getShortCode() {
        return shortCode;
    }
}
