package com.sumeet.later.urlshortener.repository;

import com.sumeet.later.urlshortener.model.UrlMapping;

import java.util.Optional;
import java.util.Set;

/**
 * Key-value access to mapping records ({@code mapping:<code>}) and per-owner
 * code sets ({@code owner:<ownerId>:codes}). Each call is atomic for a single key only.
 */
public interface MappingStoreClient {

    boolean exists(String shortCode);

    Optional<UrlMapping> get(String shortCode);

    void setWithTtl(String shortCode, UrlMapping mapping, long ttlSeconds);

    /**
     * Writes the record only if no record exists for its code, and on success adds the
     * code to the owner's index, both in one atomic step.
     *
     * @return false if the code was already taken, in which case nothing was written
     */
    boolean saveIfAbsentAndIndex(UrlMapping mapping, long ttlSeconds);

    void delete(String shortCode);

    void indexAdd(String ownerId, String shortCode);

    void indexRemove(String ownerId, String shortCode);

    Set<String> indexMembers(String ownerId);
}
