package com.sumeet.later.urlshortener.config;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import redis.embedded.RedisServer;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Runs a local Redis server alongside the application when {@code embedded.redis.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(name = "embedded.redis.enabled", havingValue = "true")
public class EmbeddedRedisConfig {

    private static final Logger logger = LoggerFactory.getLogger(EmbeddedRedisConfig.class);

    private RedisServer redisServer;

    @Value("${spring.redis.port}")
    private int redisPort;

    @PostConstruct
    public void startRedis() throws IOException {
        redisServer = new RedisServer(redisPort);
        redisServer.start();
        logger.info("Embedded Redis started on port {}", redisPort);
    }

    @PreDestroy
    public void stopRedis() {
        if (redisServer != null) {
            try {
                redisServer.stop();
                logger.info("Embedded Redis stopped");
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
