package com.locplat.translation.config;

import com.locplat.translation.service.InMemoryKeyValueStore;
import com.locplat.translation.service.KeyValueStore;
import com.locplat.translation.service.RedisKeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Selects the cache backing store with {@code app.cache.backend} ({@code redis} or {@code memory}).
 */
@Configuration
public class CacheConfig {

    private static final Logger logger = LoggerFactory.getLogger(CacheConfig.class);

    @Bean
    @ConditionalOnProperty(name = "app.cache.backend", havingValue = "redis", matchIfMissing = true)
    public RedisTemplate<String, byte[]> cacheRedisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(StringRedisSerializer.UTF_8);
        template.setValueSerializer(RedisSerializer.byteArray());
        return template;
    }

    @Bean
    @ConditionalOnProperty(name = "app.cache.backend", havingValue = "redis", matchIfMissing = true)
    public KeyValueStore redisKeyValueStore(RedisTemplate<String, byte[]> cacheRedisTemplate) {
        logger.info("Using Redis as cache backing store");
        return new RedisKeyValueStore(cacheRedisTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "app.cache.backend", havingValue = "memory")
    public KeyValueStore inMemoryKeyValueStore() {
        logger.info("Using in-memory cache backing store");
        return new InMemoryKeyValueStore();
    }
}
