package com.sumeet.later.urlshortener.repository.impl;

import com.sumeet.later.urlshortener.model.UrlMapping;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisMappingStoreClientTest {

    private static final String RECORD_JSON = "{\"shortUrl\":\"Ab3dE\",\"longUrl\":\"https://example.com/a\","
            + "\"createdAt\":\"2025-01-01T00:00:00Z\",\"expiresAt\":\"2025-01-03T00:00:00Z\",\"ownerId\":\"owner1\"}";

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private SetOperations<String, String> setOperations;

    private RedisMappingStoreClient storeClient;

    @BeforeEach
    void setUp() {
        storeClient = new RedisMappingStoreClient(redisTemplate);
    }

    @Test
    void testKeysAreNamespaced() {
        assertEquals("mapping:Ab3dE", RedisMappingStoreClient.mappingKey("Ab3dE"));
        assertEquals("owner:owner1:codes", RedisMappingStoreClient.ownerKey("owner1"));
    }

    @Test
    void testGet_ParsesIsoTimestamps() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("mapping:Ab3dE")).thenReturn(RECORD_JSON);

        Optional<UrlMapping> mapping = storeClient.get("Ab3dE");

        assertTrue(mapping.isPresent());
        assertEquals("https://example.com/a", mapping.get().getLongUrl());
        assertEquals("owner1", mapping.get().getOwnerId());
        assertEquals(Instant.parse("2025-01-01T00:00:00Z"), mapping.get().getCreatedAt());
        assertEquals(Instant.parse("2025-01-03T00:00:00Z"), mapping.get().getExpiresAt());
    }

    @Test
    void testGet_MissingOrUnreadableRecordIsAbsent() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("mapping:nope1")).thenReturn(null);
        when(valueOperations.get("mapping:junk1")).thenReturn("{not json");

        assertTrue(storeClient.get("nope1").isEmpty());
        assertTrue(storeClient.get("junk1").isEmpty());
    }

    @Test
    void testSetWithTtl_WritesJsonWithExpiry() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        UrlMapping mapping = mapping();

        storeClient.setWithTtl("Ab3dE", mapping, 3600);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("mapping:Ab3dE"), json.capture(), eq(Duration.ofSeconds(3600)));
        assertTrue(json.getValue().contains("\"createdAt\":\"2025-01-01T00:00:00Z\""));
        assertTrue(json.getValue().contains("\"expiresAt\":\"2025-01-03T00:00:00Z\""));
        assertTrue(json.getValue().contains("\"shortUrl\":\"Ab3dE\""));
        assertFalse(json.getValue().contains("liveAt"));
    }

    @Test
    void testSetWithTtl_NeverSendsNonPositiveExpiry() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        storeClient.setWithTtl("Ab3dE", mapping(), 0);

        verify(valueOperations).set(eq("mapping:Ab3dE"), anyString(), eq(Duration.ofSeconds(1)));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testSaveIfAbsentAndIndex_RunsScriptOnRecordAndIndexKeys() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), anyString(), anyString(), anyString())).thenReturn(1L);

        boolean saved = storeClient.saveIfAbsentAndIndex(mapping(), 172800);

        assertTrue(saved);
        verify(redisTemplate).execute(any(RedisScript.class),
                eq(List.of("mapping:Ab3dE", "owner:owner1:codes")),
                contains("\"ownerId\":\"owner1\""),
                eq("172800"),
                eq("Ab3dE"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testSaveIfAbsentAndIndex_ReportsTakenCode() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), anyString(), anyString(), anyString())).thenReturn(0L);

        assertFalse(storeClient.saveIfAbsentAndIndex(mapping(), 172800));
    }

    @Test
    void testSaveIfAbsentScript_ReplayOfSameWriteCountsAsSaved() {
        String script = RedisMappingStoreClient.SAVE_IF_ABSENT_SCRIPT;

        // A retried call after a client-side timeout finds its own record and must not report a collision
        assertTrue(script.contains("'NX'"));
        assertTrue(script.contains("or redis.call('GET', KEYS[1]) == ARGV[1]"));
        assertTrue(script.indexOf("redis.call('GET'") < script.indexOf("redis.call('SADD'"));
    }

    @Test
    void testExists() {
        when(redisTemplate.hasKey("mapping:Ab3dE")).thenReturn(true);
        when(redisTemplate.hasKey("mapping:zzzzz")).thenReturn(null);

        assertTrue(storeClient.exists("Ab3dE"));
        assertFalse(storeClient.exists("zzzzz"));
    }

    @Test
    void testIndexOperations() {
        when(redisTemplate.opsForSet()).thenReturn(setOperations);
        when(setOperations.members("owner:owner1:codes")).thenReturn(Set.of("Ab3dE"));
        when(setOperations.members("owner:owner2:codes")).thenReturn(null);

        storeClient.indexAdd("owner1", "Ab3dE");
        storeClient.indexRemove("owner1", "xxxxx");

        verify(setOperations).add("owner:owner1:codes", "Ab3dE");
        verify(setOperations).remove("owner:owner1:codes", "xxxxx");
        assertEquals(Set.of("Ab3dE"), storeClient.indexMembers("owner1"));
        assertTrue(storeClient.indexMembers("owner2").isEmpty());
    }

    @Test
    void testDelete() {
        storeClient.delete("Ab3dE");

        verify(redisTemplate).delete("mapping:Ab3dE");
    }

    private static UrlMapping mapping() {
        return UrlMapping.builder()
                .shortUrl("Ab3dE")
                .longUrl("https://example.com/a")
                .createdAt(Instant.parse("2025-01-01T00:00:00Z"))
                .expiresAt(Instant.parse("2025-01-03T00:00:00Z"))
                .ownerId("owner1")
                .build();
    }
}
