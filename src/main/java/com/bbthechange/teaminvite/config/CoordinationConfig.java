package com.bbthechange.teaminvite.config;

import com.bbthechange.teaminvite.coordination.Coordinator;
import com.bbthechange.teaminvite.coordination.InMemoryCoordinator;
import com.bbthechange.teaminvite.coordination.RedisCoordinator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Picks the coordination backend shared by the throttle, token buckets and job mutexes.
 */
@Configuration
public class CoordinationConfig {

    @Bean
    @ConditionalOnProperty(name = "team-invite.coordination", havingValue = "redis", matchIfMissing = true)
    public Coordinator redisCoordinator(StringRedisTemplate redisTemplate,
                                        @Value("${team-invite.redis.key-prefix:team-invite:}") String keyPrefix) {
        return new RedisCoordinator(redisTemplate, keyPrefix);
    }

    @Bean
    @ConditionalOnProperty(name = "team-invite.coordination", havingValue = "memory")
    public Coordinator inMemoryCoordinator() {
        return new InMemoryCoordinator();
    }
}
