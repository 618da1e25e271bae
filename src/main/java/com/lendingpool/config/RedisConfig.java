package com.lendingpool.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lendingpool.model.LoanView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Redis Configuration for Caching and Request Idempotency
 *
 * DESIGN DECISIONS:
 * =================
 * 1. JSON serialization: readable with redis-cli, language-agnostic
 * 2. Only immutable data is cached. Pools and active loans change on every
 *    accrual, so they are always read from the database under lock.
 * 3. RedisTemplate: manual SET NX operations for idempotency keys
 *
 * CACHE REGIONS:
 * ==============
 * - closedLoans: LoanView of REPAID / LIQUIDATED loans (TTL: 24 hours).
 *   A terminal loan never changes again, so it never needs eviction.
 */
@Configuration
@EnableCaching
@Slf4j
public class RedisConfig {

    public static final String CLOSED_LOANS_CACHE = "closedLoans";

    /**
     * Shared ObjectMapper (outbox payloads, Redis values, REST bodies).
     * Java time types are written as ISO-8601 strings.
     */
    @Bean
    public ObjectMapper redisObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        log.info("Configured ObjectMapper with JavaTimeModule");
        return mapper;
    }

    /**
     * RedisTemplate for idempotency keys (String keys, JSON values).
     */
    @Bean
    public RedisTemplate<String, Object> redisTemplate(
            RedisConnectionFactory connectionFactory,
            ObjectMapper redisObjectMapper) {

        RedisTemplate<String, Object> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        StringRedisSerializer stringSerializer = new StringRedisSerializer();
        template.setKeySerializer(stringSerializer);
        template.setHashKeySerializer(stringSerializer);

        GenericJackson2JsonRedisSerializer jsonSerializer =
            new GenericJackson2JsonRedisSerializer(redisObjectMapper);
        template.setValueSerializer(jsonSerializer);
        template.setHashValueSerializer(jsonSerializer);

        template.afterPropertiesSet();

        log.info("Configured RedisTemplate with JSON serialization");
        return template;
    }

    @Bean
    public CacheManager cacheManager(
            RedisConnectionFactory connectionFactory,
            ObjectMapper redisObjectMapper) {

        RedisCacheConfiguration defaultConfig = RedisCacheConfiguration.defaultCacheConfig()
            .entryTtl(Duration.ofMinutes(30))
            .disableCachingNullValues()
            .serializeKeysWith(
                RedisSerializationContext.SerializationPair.fromSerializer(
                    new StringRedisSerializer()));

        Map<String, RedisCacheConfiguration> cacheConfigurations = new HashMap<>();

        // Typed serializer: the cached value is always a LoanView
        cacheConfigurations.put(CLOSED_LOANS_CACHE, defaultConfig
            .entryTtl(Duration.ofHours(24))
            .prefixCacheNameWith("loan:")
            .serializeValuesWith(
                RedisSerializationContext.SerializationPair.fromSerializer(
                    new Jackson2JsonRedisSerializer<>(redisObjectMapper, LoanView.class))));

        RedisCacheManager cacheManager = RedisCacheManager.builder(connectionFactory)
            .cacheDefaults(defaultConfig)
            .withInitialCacheConfigurations(cacheConfigurations)
            .transactionAware()  // Respect @Transactional boundaries
            .build();

        log.info("Configured RedisCacheManager with regions: {} (24h)", CLOSED_LOANS_CACHE);
        return cacheManager;
    }
}
