package com.sumeet.later.urlshortener.service.impl;

import com.sumeet.later.urlshortener.dto.PaginatedMappingsResponse;
import com.sumeet.later.urlshortener.exception.ExhaustedRetriesException;
import com.sumeet.later.urlshortener.exception.InvalidInputException;
import com.sumeet.later.urlshortener.exception.MappingNotFoundException;
import com.sumeet.later.urlshortener.exception.UnauthorizedAccessException;
import com.sumeet.later.urlshortener.model.UrlMapping;
import com.sumeet.later.urlshortener.repository.MappingStoreClient;
import com.sumeet.later.urlshortener.service.MappingService;
import com.sumeet.later.urlshortener.util.ShortCodeGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Mapping lifecycle on top of {@link MappingStoreClient}. Holds no mutable state, so a
 * single instance serves all requests.
 *
 * <p>Expired records are removed when a read finds them (lazy expiration). The Redis TTL
 * only backs this up, since owner index sets carry no TTL and would otherwise keep stale codes.
 */
@Service
public class MappingServiceImpl implements MappingService {

    private static final Logger logger = LoggerFactory.getLogger(MappingServiceImpl.class);

    public static final int DEFAULT_MAX_GENERATION_ATTEMPTS = 10;
    public static final long DEFAULT_LIFETIME_HOURS = 48;

    private final MappingStoreClient storeClient;
    private final ShortCodeGenerator codeGenerator;
    private final Clock clock;
    private final int maxGenerationAttempts;
    private final Duration lifetime;

    @Autowired
    public MappingServiceImpl(MappingStoreClient storeClient,
                              ShortCodeGenerator codeGenerator,
                              Clock clock,
                              @Value("${urlshortener.max-generation-attempts:" + DEFAULT_MAX_GENERATION_ATTEMPTS + "}") int maxGenerationAttempts,
                              @Value("${urlshortener.lifetime-hours:" + DEFAULT_LIFETIME_HOURS + "}") long lifetimeHours) {
        if (maxGenerationAttempts <= 0) {
            throw new IllegalArgumentException("Max generation attempts must be greater than 0");
        }
        if (lifetimeHours <= 0) {
            throw new IllegalArgumentException("Lifetime must be greater than 0");
        }
        this.storeClient = storeClient;
        this.codeGenerator = codeGenerator;
        this.clock = clock;
        this.maxGenerationAttempts = maxGenerationAttempts;
        this.lifetime = Duration.ofHours(lifetimeHours);
    }

    @Override
    public String create(String longUrl, String ownerId) {
        requireOwner(ownerId);
        validateUrl(longUrl);

        Instant createdAt = clock.instant();
        Instant expiresAt = createdAt.plus(lifetime);

        for (int attempt = 1; attempt <= maxGenerationAttempts; attempt++) {
            String candidate = codeGenerator.generate();
            if (storeClient.exists(candidate)) {
                logger.debug("Short code {} is taken, attempt {} of {}", candidate, attempt, maxGenerationAttempts);
                continue;
            }

            UrlMapping mapping = UrlMapping.builder()
                    .shortUrl(candidate)
                    .longUrl(longUrl)
                    .createdAt(createdAt)
                    .expiresAt(expiresAt)
                    .ownerId(ownerId)
                    .build();

            // The existence check can race with a concurrent create; the write itself is conditional
            if (storeClient.saveIfAbsentAndIndex(mapping, ttlSecondsUntil(expiresAt))) {
                logger.info("Created short code {} for owner {}, expires at {}", candidate, ownerId, expiresAt);
                return candidate;
            }
            logger.debug("Short code {} was claimed concurrently, attempt {} of {}", candidate, attempt, maxGenerationAttempts);
        }

        throw new ExhaustedRetriesException(maxGenerationAttempts);
    }

    @Override
    public UrlMapping resolve(String shortCode, String ownerId) {
        logger.debug("Resolving short code {}", shortCode);
        return loadLive(shortCode, ownerId);
    }

    @Override
    public void renew(String shortCode, String ownerId) {
        requireOwner(ownerId);
        UrlMapping mapping = loadLive(shortCode, ownerId);

        Instant newExpiresAt = mapping.getExpiresAt().plus(lifetime);
        UrlMapping renewed = mapping.toBuilder().expiresAt(newExpiresAt).build();
        storeClient.setWithTtl(shortCode, renewed, ttlSecondsUntil(newExpiresAt));

        logger.info("Renewed short code {} until {}", shortCode, newExpiresAt);
    }

    @Override
    public PaginatedMappingsResponse list(String ownerId, int page, int pageSize) {
        requireOwner(ownerId);
        if (pageSize < 1) {
            throw new InvalidInputException("Page size must be greater than 0");
        }

        Instant now = clock.instant();
        List<UrlMapping> live = new ArrayList<>();

        for (String shortCode : storeClient.indexMembers(ownerId)) {
            Optional<UrlMapping> stored = storeClient.get(shortCode);
            if (stored.isEmpty()) {
                storeClient.indexRemove(ownerId, shortCode);
                continue;
            }
            UrlMapping mapping = stored.get();
            if (!ownerId.equals(mapping.getOwnerId())) {
                // Code was reused by another owner after ours expired; their record stays
                storeClient.indexRemove(ownerId, shortCode);
                continue;
            }
            if (!mapping.isLiveAt(now)) {
                expire(mapping);
                continue;
            }
            live.add(mapping);
        }

        // List.sort is stable, so equal timestamps keep index scan order
        live.sort(Comparator.comparing(UrlMapping::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())));

        int totalPages = Math.max(1, (live.size() + pageSize - 1) / pageSize);
        return new PaginatedMappingsResponse(slice(live, page, pageSize), totalPages);
    }

    /**
     * Fetches a record and enforces ownership and expiry. An expired record is deleted and
     * pruned from its owner's index before the not-found failure is raised.
     */
    private UrlMapping loadLive(String shortCode, String ownerId) {
        UrlMapping mapping = storeClient.get(shortCode)
                .orElseThrow(() -> new MappingNotFoundException(shortCode));

        if (ownerId != null && !ownerId.isBlank() && !ownerId.equals(mapping.getOwnerId())) {
            throw new UnauthorizedAccessException(shortCode);
        }

        if (!mapping.isLiveAt(clock.instant())) {
            expire(mapping);
            throw new MappingNotFoundException(shortCode);
        }
        return mapping;
    }

    // The stored owner id identifies the index to prune, even on public lookups
    private void expire(UrlMapping mapping) {
        storeClient.delete(mapping.getShortUrl());
        if (mapping.getOwnerId() != null) {
            storeClient.indexRemove(mapping.getOwnerId(), mapping.getShortUrl());
        }
        logger.info("Removed expired short code {} (expired at {})", mapping.getShortUrl(), mapping.getExpiresAt());
    }

    private long ttlSecondsUntil(Instant expiresAt) {
        long millis = Duration.between(clock.instant(), expiresAt).toMillis();
        return Math.max(1L, (millis + 999L) / 1000L);
    }

    private static List<UrlMapping> slice(List<UrlMapping> mappings, int page, int pageSize) {
        if (page < 1) {
            return Collections.emptyList();
        }
        long from = (long) (page - 1) * pageSize;
        if (from >= mappings.size()) {
            return Collections.emptyList();
        }
        int to = (int) Math.min(from + pageSize, mappings.size());
        return new ArrayList<>(mappings.subList((int) from, to));
    }

    private static void requireOwner(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new InvalidInputException("Client ID required");
        }
    }

    private static void validateUrl(String longUrl) {
        if (longUrl == null || longUrl.isBlank()) {
            throw new InvalidInputException("Invalid URL");
        }
        try {
            URI uri = new URI(longUrl);
            if (!uri.isAbsolute()) {
                throw new InvalidInputException("Invalid URL");
            }
        } catch (URISyntaxException e) {
            throw new InvalidInputException("Invalid URL");
        }
    }
}
