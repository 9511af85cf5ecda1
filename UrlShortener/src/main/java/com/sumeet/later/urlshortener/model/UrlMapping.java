package com.sumeet.later.urlshortener.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * A short code pointing at a long URL. Stored as JSON under {@code mapping:<shortUrl>}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class UrlMapping implements Serializable {

    private static final long serialVersionUID = 1L;

    private String shortUrl;
    private String longUrl;
    private Instant createdAt;
    private Instant expiresAt;
    private String ownerId;

    /**
     * @param now the instant to compare against
     * @return true while the expiry deadline lies strictly after {@code now}
     */
    public boolean isLiveAt(Instant now) {
        return expiresAt != null && expiresAt.isAfter(now);
    }
}
