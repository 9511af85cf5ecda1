package com.sumeet.later.urlshortener.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sumeet.later.urlshortener.config.RedisRetryConfig.RedisRetryable;
import com.sumeet.later.urlshortener.model.UrlMapping;
import com.sumeet.later.urlshortener.repository.MappingStoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

@Repository
public class RedisMappingStoreClient implements MappingStoreClient {

    private static final Logger logger = LoggerFactory.getLogger(RedisMappingStoreClient.class);

    static final String MAPPING_KEY_PREFIX = "mapping:";
    static final String OWNER_KEY_PREFIX = "owner:";
    static final String OWNER_KEY_SUFFIX = ":codes";

    // KEYS[1] record key, KEYS[2] owner index; ARGV[1] record json, ARGV[2] ttl seconds, ARGV[3] code.
    // A stored value equal to ARGV[1] is this same write replayed after a timeout, so it counts as saved.
    static final String SAVE_IF_ABSENT_SCRIPT = ""
            + "if redis.call('SET', KEYS[1], ARGV[1], 'NX', 'EX', ARGV[2]) "
            + "    or redis.call('GET', KEYS[1]) == ARGV[1] then "
            + "  redis.call('SADD', KEYS[2], ARGV[3]); "
            + "  return 1; "
            + "else "
            + "  return 0; "
            + "end";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final DefaultRedisScript<Long> saveIfAbsentScript;

    @Autowired
    public RedisMappingStoreClient(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        this.saveIfAbsentScript = new DefaultRedisScript<>();
        this.saveIfAbsentScript.setScriptText(SAVE_IF_ABSENT_SCRIPT);
        this.saveIfAbsentScript.setResultType(Long.class);
    }

    static String mappingKey(String shortCode) {
        return MAPPING_KEY_PREFIX + shortCode;
    }

    static String ownerKey(String ownerId) {
        return OWNER_KEY_PREFIX + ownerId + OWNER_KEY_SUFFIX;
    }

    @Override
    @RedisRetryable
    public boolean exists(String shortCode) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(mappingKey(shortCode)));
    }

    /**
     * Reads a record. A value that is not a readable record is reported as absent.
     */
    @Override
    @RedisRetryable
    public Optional<UrlMapping> get(String shortCode) {
        String json = redisTemplate.opsForValue().get(mappingKey(shortCode));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, UrlMapping.class));
        } catch (JsonProcessingException e) {
            logger.warn("Unreadable mapping record for code {}: {}", shortCode, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    @RedisRetryable
    public void setWithTtl(String shortCode, UrlMapping mapping, long ttlSeconds) {
        redisTemplate.opsForValue().set(mappingKey(shortCode), toJson(mapping), Duration.ofSeconds(clampTtl(ttlSeconds)));
    }

    @Override
    @RedisRetryable
    public boolean saveIfAbsentAndIndex(UrlMapping mapping, long ttlSeconds) {
        Long result = redisTemplate.execute(
                saveIfAbsentScript,
                Arrays.asList(mappingKey(mapping.getShortUrl()), ownerKey(mapping.getOwnerId())),
                toJson(mapping),
                String.valueOf(clampTtl(ttlSeconds)),
                mapping.getShortUrl()
        );
        return result != null && result == 1L;
    }

    @Override
    @RedisRetryable
    public void delete(String shortCode) {
        redisTemplate.delete(mappingKey(shortCode));
    }

    @Override
    @RedisRetryable
    public void indexAdd(String ownerId, String shortCode) {
        redisTemplate.opsForSet().add(ownerKey(ownerId), shortCode);
    }

    @Override
    @RedisRetryable
    public void indexRemove(String ownerId, String shortCode) {
        redisTemplate.opsForSet().remove(ownerKey(ownerId), shortCode);
    }

    @Override
    @RedisRetryable
    public Set<String> indexMembers(String ownerId) {
        Set<String> members = redisTemplate.opsForSet().members(ownerKey(ownerId));
        if (members == null) {
            return Collections.emptySet();
        }
        return new LinkedHashSet<>(members);
    }

    private String toJson(UrlMapping mapping) {
        try {
            return objectMapper.writeValueAsString(mapping);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize mapping " + mapping.getShortUrl(), e);
        }
    }

    // Redis rejects EX 0 and negative expiries
    private static long clampTtl(long ttlSeconds) {
        return Math.max(1L, ttlSeconds);
    }
}
