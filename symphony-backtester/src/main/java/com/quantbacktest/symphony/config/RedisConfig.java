package com.quantbacktest.symphony.config;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Redis job queue template and the price-series cache.
 */
@Configuration
@EnableCaching
public class RedisConfig {

        public static final String PRICE_SERIES_CACHE = "priceSeries";

        @Bean
        public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory connectionFactory) {
                RedisTemplate<String, Object> template = new RedisTemplate<>();
                template.setConnectionFactory(connectionFactory);

                template.setKeySerializer(new StringRedisSerializer());
                template.setHashKeySerializer(new StringRedisSerializer());

                template.setValueSerializer(jsonSerializer());
                template.setHashValueSerializer(jsonSerializer());

                template.afterPropertiesSet();
                return template;
        }

        @Bean
        public RedisCacheManager cacheManager(RedisConnectionFactory connectionFactory) {
                RedisCacheConfiguration defaultConfig = cacheConfig(Duration.ofHours(1));

                // price history changes only on ingestion
                RedisCacheConfiguration priceSeriesConfig = cacheConfig(Duration.ofMinutes(10));

                return RedisCacheManager.builder(connectionFactory)
                                .cacheDefaults(defaultConfig)
                                .withCacheConfiguration(PRICE_SERIES_CACHE, priceSeriesConfig)
                                .transactionAware()
                                .build();
        }

        private static RedisCacheConfiguration cacheConfig(Duration ttl) {
                return RedisCacheConfiguration.defaultCacheConfig()
                                .entryTtl(ttl)
                                .serializeKeysWith(
                                                RedisSerializationContext.SerializationPair
                                                                .fromSerializer(new StringRedisSerializer()))
                                .serializeValuesWith(
                                                RedisSerializationContext.SerializationPair
                                                                .fromSerializer(jsonSerializer()))
                                .disableCachingNullValues();
        }

        private static GenericJackson2JsonRedisSerializer jsonSerializer() {
                return new GenericJackson2JsonRedisSerializer().configure(mapper -> mapper
                                .registerModule(new JavaTimeModule())
                                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
        }
}
