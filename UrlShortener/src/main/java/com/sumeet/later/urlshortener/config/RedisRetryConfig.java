package com.sumeet.later.urlshortener.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.AliasFor;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.retry.annotation.Retryable;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Configuration
@EnableRetry
public class RedisRetryConfig {

    /**
     * Retry policy for single Redis commands. Only transport level failures are retried;
     * a command that reached Redis and was rejected (script error, WRONGTYPE) surfaces as
     * {@code RedisSystemException} and is not.
     */
    @Target(ElementType.METHOD)
    @Retention(RetentionPolicy.RUNTIME)
    @Retryable(
            retryFor = {
                    RedisConnectionFailureException.class,
                    QueryTimeoutException.class,
                    TransientDataAccessException.class
            }
    )
    public @interface RedisRetryable {
        @AliasFor(annotation = Retryable.class, attribute = "maxAttempts")
        int maxAttempts() default 3;

        @AliasFor(annotation = Retryable.class, attribute = "backoff")
        Backoff backoff() default @Backoff(delay = 1000, multiplier = 2);
    }
}
