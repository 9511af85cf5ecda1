package com.sumeet.later.urlshortener.util;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Draws each character uniformly from the 62 symbol alphanumeric alphabet.
 */
@Component
public class RandomShortCodeGenerator implements ShortCodeGenerator {

    public static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    public static final int DEFAULT_LENGTH = 5;

    private final Random random;
    private final int length;

    @Autowired
    public RandomShortCodeGenerator(Random random,
                                    @Value("${urlshortener.code-length:" + DEFAULT_LENGTH + "}") int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Code length must be greater than 0");
        }
        this.random = random;
        this.length = length;
    }

    @Override
    public String generate() {
        StringBuilder code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }
}
