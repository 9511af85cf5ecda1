package com.sumeet.later.urlshortener.util;

/**
 * Produces candidate short codes. Candidates are not guaranteed to be unique.
 */
public interface ShortCodeGenerator {

    String generate();
}
