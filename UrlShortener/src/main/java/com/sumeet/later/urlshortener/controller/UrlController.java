package com.sumeet.later.urlshortener.controller;

import com.sumeet.later.urlshortener.dto.PaginatedMappingsResponse;
import com.sumeet.later.urlshortener.dto.RenewUrlResponse;
import com.sumeet.later.urlshortener.dto.ShortenUrlRequest;
import com.sumeet.later.urlshortener.dto.ShortenUrlResponse;
import com.sumeet.later.urlshortener.model.UrlMapping;
import com.sumeet.later.urlshortener.service.MappingService;
import com.sumeet.later.urlshortener.util.ShortCodeParser;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/urls")
public class UrlController {

    public static final String CLIENT_ID_HEADER = "X-Client-Id";

    private static final Logger logger = LoggerFactory.getLogger(UrlController.class);

    private final MappingService mappingService;
    private final ShortCodeParser shortCodeParser;

    public UrlController(MappingService mappingService, ShortCodeParser shortCodeParser) {
        this.mappingService = mappingService;
        this.shortCodeParser = shortCodeParser;
    }

    /**
     * Shortens a URL for the calling client.
     *
     * @param clientId opaque client identifier
     * @param request  the URL to shorten
     * @return 201 with the generated short code
     */
    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ShortenUrlResponse> shorten(@RequestHeader(CLIENT_ID_HEADER) String clientId,
                                                      @Valid @RequestBody ShortenUrlRequest request) {
        String shortCode = mappingService.create(request.getLongUrl(), clientId);
        logger.info("Shortened URL for client {} to {}", clientId, shortCode);
        return ResponseEntity.status(HttpStatus.CREATED).body(new ShortenUrlResponse(shortCode));
    }

    /**
     * Looks up a mapping by bare code or by full short link.
     * Without a client header the lookup is public and skips the ownership check.
     */
    @GetMapping(value = "/lookup", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<UrlMapping> lookup(@RequestHeader(value = CLIENT_ID_HEADER, required = false) String clientId,
                                             @RequestParam("q") String query) {
        String shortCode = shortCodeParser.parse(query);
        return ResponseEntity.ok(mappingService.resolve(shortCode, clientId));
    }

    @PostMapping(value = "/{shortCode}/renew", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RenewUrlResponse> renew(@RequestHeader(CLIENT_ID_HEADER) String clientId,
                                                  @PathVariable("shortCode") String shortCode) {
        mappingService.renew(shortCode, clientId);
        return ResponseEntity.ok(new RenewUrlResponse(true));
    }

    /**
     * Lists the client's live mappings, newest first.
     *
     * @param page     1-based page number
     * @param pageSize number of mappings per page
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PaginatedMappingsResponse> list(@RequestHeader(CLIENT_ID_HEADER) String clientId,
                                                          @RequestParam(value = "page", defaultValue = "1") int page,
                                                          @RequestParam(value = "pageSize", defaultValue = "10") int pageSize) {
        return ResponseEntity.ok(mappingService.list(clientId, page, pageSize));
    }
}
