package com.sumeet.later.urlshortener.util;

import com.sumeet.later.urlshortener.exception.InvalidInputException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Accepts either a bare short code or a full short link of the form
 * {@code <base-url>/api/<code>} and returns the code.
 */
@Component
public class ShortCodeParser {

    private final String expectedOrigin;

    public ShortCodeParser(@Value("${urlshortener.base-url}") String baseUrl) {
        this.expectedOrigin = originOf(toUri(baseUrl));
    }

    public String parse(String input) {
        if (input == null || input.isBlank()) {
            throw new InvalidInputException("Short code is required");
        }
        String trimmed = input.trim();
        if (!trimmed.startsWith("http://") && !trimmed.startsWith("https://")) {
            return trimmed;
        }

        URI uri = toUri(trimmed);
        String origin = originOf(uri);
        if (!expectedOrigin.equals(origin)) {
            throw new InvalidInputException("Invalid host: expected " + expectedOrigin + ", got " + origin);
        }

        String path = uri.getPath() == null ? "" : uri.getPath();
        List<String> parts = Arrays.stream(path.split("/"))
                .filter(part -> !part.isEmpty())
                .collect(Collectors.toList());
        if (parts.size() != 2 || !"api".equals(parts.get(0))) {
            throw new InvalidInputException("Invalid URL format: expected /api/<shortCode>");
        }
        return parts.get(1);
    }

    private static URI toUri(String value) {
        try {
            URI uri = new URI(value);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new InvalidInputException("Invalid URL: " + value);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new InvalidInputException("Invalid URL: " + e.getMessage());
        }
    }

    // scheme://host[:port], default ports omitted
    private static String originOf(URI uri) {
        String scheme = uri.getScheme().toLowerCase();
        int port = uri.getPort();
        boolean defaultPort = port == -1
                || ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
        return scheme + "://" + uri.getHost().toLowerCase() + (defaultPort ? "" : ":" + port);
    }
}
