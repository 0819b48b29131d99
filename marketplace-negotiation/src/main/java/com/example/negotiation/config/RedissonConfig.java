package com.example.negotiation.config;

import java.time.Duration;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Redisson is only used for the append and creation locks, so a single-server client built from the
 * standard {@code spring.data.redis} properties is enough.
 */
@Configuration
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedissonClient redissonClient(RedisProperties redisProperties, NegotiationProperties negotiationProperties) {
        NegotiationProperties.Redis lockSettings = negotiationProperties.getRedis();
        Config config = new Config();
        Duration watchdog = lockSettings.getLockWatchdogTimeout();
        if (watchdog != null && !watchdog.isNegative() && !watchdog.isZero()) {
            config.setLockWatchdogTimeout(watchdog.toMillis());
        }

        SingleServerConfig server = config.useSingleServer()
                .setAddress(lockServerAddress(redisProperties))
                .setDatabase(redisProperties.getDatabase())
                .setClientName(StringUtils.hasText(redisProperties.getClientName())
                        ? redisProperties.getClientName()
                        : lockSettings.getKeyPrefix());
        if (StringUtils.hasText(redisProperties.getUsername())) {
            server.setUsername(redisProperties.getUsername());
        }
        if (StringUtils.hasText(redisProperties.getPassword())) {
            server.setPassword(redisProperties.getPassword());
        }
        if (redisProperties.getTimeout() != null) {
            server.setTimeout((int) redisProperties.getTimeout().toMillis());
        }
        if (redisProperties.getConnectTimeout() != null) {
            server.setConnectTimeout((int) redisProperties.getConnectTimeout().toMillis());
        }
        return Redisson.create(config);
    }

    static String lockServerAddress(RedisProperties redisProperties) {
        if (StringUtils.hasText(redisProperties.getUrl())) {
            return redisProperties.getUrl();
        }
        boolean ssl = redisProperties.getSsl() != null && redisProperties.getSsl().isEnabled();
        return (ssl ? "rediss://" : "redis://") + redisProperties.getHost() + ":" + redisProperties.getPort();
    }
}
