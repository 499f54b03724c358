package org.areaflow.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.areaflow.engine.credential.AesGcmTokenCrypto;
import org.areaflow.engine.credential.CredentialStore;
import org.areaflow.engine.credential.KeyValueCredentialStore;
import org.areaflow.engine.credential.TokenCrypto;
import org.areaflow.engine.store.InMemoryKeyValueStore;
import org.areaflow.engine.store.KeyValueStore;
import org.areaflow.engine.store.RedisKeyValueStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Key/value store backing credentials and detection state, selected by {@code area.engine.store.type}.
 */
@Configuration
public class StoreConfig {

    @Bean
    @ConditionalOnProperty(name = "area.engine.store.type", havingValue = "redis", matchIfMissing = true)
    public KeyValueStore redisKeyValueStore(StringRedisTemplate redisTemplate) {
        return new RedisKeyValueStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "area.engine.store.type", havingValue = "memory")
    public KeyValueStore inMemoryKeyValueStore(Clock clock) {
        return new InMemoryKeyValueStore(clock);
    }

    @Bean
    public TokenCrypto tokenCrypto(@Value("${area.engine.crypto.secret}") String secret) {
        return new AesGcmTokenCrypto(secret);
    }

    @Bean
    public CredentialStore credentialStore(KeyValueStore keyValueStore, ObjectMapper objectMapper) {
        return new KeyValueCredentialStore(keyValueStore, objectMapper);
    }
}
