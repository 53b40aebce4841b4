package com.shopledger.checkout.config;

import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 설정
 *
 * <p>checkout.reservation.lock-strategy=redisson 일 때만 Redis 에 연결한다.
 * 기본(database) 전략에서는 Redis 없이 DB 행 잠금만 사용한다.</p>
 */
@Configuration
@ConditionalOnProperty(prefix = "checkout.reservation", name = "lock-strategy", havingValue = "redisson")
@Slf4j
public class RedissonConfig {

    @Value("${checkout.redis.address:redis://localhost:6379}")
    private String address;

    @Value("${checkout.redis.password:}")
    private String password;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        log.info("Redisson 연결: {}", address);

        Config config = new Config();
        config.useSingleServer()
                .setAddress(address)
                .setPassword(password.isBlank() ? null : password);
        return Redisson.create(config);
    }
}
