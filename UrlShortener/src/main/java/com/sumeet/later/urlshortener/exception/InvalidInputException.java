package com.sumeet.later.urlshortener.exception;

/**
 * Raised for a malformed URL, a missing owner id or bad paging arguments.
 * Always thrown before the store is touched.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
