package com.sumeet.later.urlshortener.controller;

import com.sumeet.later.urlshortener.model.UrlMapping;
import com.sumeet.later.urlshortener.service.MappingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public redirect for short links. Every failure looks the same to the caller.
 */
@RestController
public class RedirectController {

    static final String NOT_FOUND_BODY = "URL not found or expired";

    private static final Logger logger = LoggerFactory.getLogger(RedirectController.class);

    private final MappingService mappingService;

    public RedirectController(MappingService mappingService) {
        this.mappingService = mappingService;
    }

    @GetMapping("/api/{shortCode}")
    public ResponseEntity<String> redirect(@PathVariable("shortCode") String shortCode) {
        try {
            UrlMapping mapping = mappingService.resolve(shortCode, null);
            return ResponseEntity.status(HttpStatus.FOUND)
                    .header(HttpHeaders.LOCATION, mapping.getLongUrl())
                    .build();
        } catch (RuntimeException e) {
            logger.debug("Redirect for {} failed: {}", shortCode, e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .contentType(MediaType.TEXT_PLAIN)
                    .body(NOT_FOUND_BODY);
        }
    }
}
