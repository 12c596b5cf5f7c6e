package com.reprise.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.repository.RedisTierStore;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Clock;
import java.time.Duration;

/**
 * Redis configuration for the persistent cache tier.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "reprise.cache.redis", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RedisConfiguration {

    /**
     * Configure Redis connection factory with timeouts and resilience.
     * A slow Redis must not hold up a request for longer than the command timeout,
     * the tier is skipped instead.
     */
    @Bean
    public LettuceConnectionFactory redisConnectionFactory(RedisProperties redisProperties) {
        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(Duration.ofSeconds(5))
                .keepAlive(true)
                .build();

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(true)
                .timeoutOptions(TimeoutOptions.enabled(Duration.ofSeconds(2)))
                .build();

        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .clientOptions(clientOptions)
                .commandTimeout(Duration.ofSeconds(2))
                .build();

        RedisStandaloneConfiguration serverConfig =
                new RedisStandaloneConfiguration(redisProperties.getHost(), redisProperties.getPort());
        if (redisProperties.getPassword() != null) {
            serverConfig.setPassword(redisProperties.getPassword());
        }
        serverConfig.setDatabase(redisProperties.getDatabase());

        LettuceConnectionFactory factory = new LettuceConnectionFactory(serverConfig, clientConfig);

        log.info("Configured Redis connection factory for {}:{}",
                redisProperties.getHost(), redisProperties.getPort());
        return factory;
    }

    /**
     * Redis template for byte array storage (compressed cache entries).
     */
    @Bean
    public RedisTemplate<String, byte[]> redisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        template.setKeySerializer(new StringRedisSerializer());
        template.setHashKeySerializer(new StringRedisSerializer());

        // Compression is handled by RedisTierStore
        template.setValueSerializer(RedisSerializer.byteArray());
        template.setHashValueSerializer(RedisSerializer.byteArray());

        template.afterPropertiesSet();

        log.info("Configured RedisTemplate for byte array storage");
        return template;
    }

    @Bean
    public RedisTierStore redisTierStore(RedisTemplate<String, byte[]> redisTemplate,
                                         ObjectMapper objectMapper,
                                         RepriseProperties properties,
                                         Clock clock) {
        return new RedisTierStore(redisTemplate, objectMapper, properties, clock);
    }
}
