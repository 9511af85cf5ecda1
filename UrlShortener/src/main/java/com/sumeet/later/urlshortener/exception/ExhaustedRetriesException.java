package com.sumeet.later.urlshortener.exception;

/**
 * Every candidate code produced within the attempt budget was already taken.
 */
public class ExhaustedRetriesException extends RuntimeException {

    private final int attempts;

    public ExhaustedRetriesException(int attempts) {
        super("Could not allocate a free short code after " + attempts + " attempts");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
