package com.sumeet.later.urlshortener.service;

import com.sumeet.later.urlshortener.dto.PaginatedMappingsResponse;
import com.sumeet.later.urlshortener.model.UrlMapping;

public interface MappingService {

    /**
     * Stores a new mapping owned by {@code ownerId} and returns its short code.
     */
    String create(String longUrl, String ownerId);

    /**
     * Looks up a live mapping. When {@code ownerId} is null or blank the lookup is public and
     * skips the ownership check.
     */
    UrlMapping resolve(String shortCode, String ownerId);

    /**
     * Pushes the expiry of a live mapping one lifetime past its current deadline.
     */
    void renew(String shortCode, String ownerId);

    PaginatedMappingsResponse list(String ownerId, int page, int pageSize);
}
