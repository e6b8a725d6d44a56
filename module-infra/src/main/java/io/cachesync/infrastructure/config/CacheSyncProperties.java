package io.cachesync.infrastructure.config;

import io.cachesync.core.service.CacheService;
import io.cachesync.infrastructure.redis.RedisConnectionSettings;
import io.cachesync.infrastructure.redis.RetryStrategy;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * cache-sync 설정
 *
 * <h2>설정</h2>
 *
 * <pre>{@code
 * cache-sync:
 *   adapter: memory            # memory | redis
 *   origin-id: node-a          # 미지정 시 랜덤 UUID
 *   memory:
 *     capacity: 1000
 *     default-ttl: 0s          # 0이면 만료 없음
 *   redis:
 *     host: localhost
 *     port: 6379
 *     connect-timeout: 10s
 *     command-timeout: 5s
 *     retry:
 *       base-delay: 50ms
 *       max-delay: 2s
 *       max-attempts: 10
 *     circuit-breaker:
 *       failure-rate-threshold: 50
 *       sliding-window-size: 5
 *       wait-duration-in-open-state: 30s
 *   pubsub:
 *     enabled: false
 *     channel-pattern: cache-sync:events:*
 * }</pre>
 *
 * @see CacheSyncAutoConfiguration
 */
@ConfigurationProperties(prefix = "cache-sync")
public record CacheSyncProperties(
    @DefaultValue("memory") AdapterType adapter,
    String originId,
    @DefaultValue Memory memory,
    @DefaultValue Redis redis,
    @DefaultValue PubSub pubsub) {

  public enum AdapterType {
    MEMORY,
    REDIS
  }

  public record Memory(@DefaultValue("1000") int capacity, Duration defaultTtl) {

    public Memory {
      if (capacity <= 0) {
        throw new IllegalArgumentException(
            "cache-sync.memory.capacity must be positive, got: " + capacity);
      }
      if (defaultTtl != null && defaultTtl.isNegative()) {
        throw new IllegalArgumentException("cache-sync.memory.default-ttl must not be negative");
      }
    }

    /** 0은 만료 없음과 같으므로 null로 정규화 */
    Duration effectiveDefaultTtl() {
      return defaultTtl == null || defaultTtl.isZero() ? null : defaultTtl;
    }
  }

  public record Redis(
      @DefaultValue("localhost") String host,
      @DefaultValue("6379") int port,
      String username,
      String password,
      @DefaultValue("0") int database,
      @DefaultValue("10s") Duration connectTimeout,
      @DefaultValue("5s") Duration commandTimeout,
      Duration defaultTtl,
      @DefaultValue Retry retry,
      @DefaultValue CircuitBreaker circuitBreaker) {

    public RedisConnectionSettings toSettings() {
      return RedisConnectionSettings.builder()
          .host(host)
          .port(port)
          .username(username)
          .password(password)
          .database(database)
          .connectTimeout(connectTimeout)
          .commandTimeout(commandTimeout)
          .defaultTtl(defaultTtl == null || defaultTtl.isZero() ? null : defaultTtl)
          .retryStrategy(retry.toStrategy())
          .build();
    }
  }

  public record Retry(
      @DefaultValue("50ms") Duration baseDelay,
      @DefaultValue("2s") Duration maxDelay,
      @DefaultValue("10") int maxAttempts) {

    public Retry {
      if (maxAttempts < 0) {
        throw new IllegalArgumentException("cache-sync.redis.retry.max-attempts must not be negative");
      }
    }

    RetryStrategy toStrategy() {
      if (maxAttempts == 0) {
        return RetryStrategy.noRetry();
      }
      return RetryStrategy.exponentialBackoff(baseDelay, maxDelay, maxAttempts);
    }
  }

  public record CircuitBreaker(
      @DefaultValue("50") float failureRateThreshold,
      @DefaultValue("5") int slidingWindowSize,
      @DefaultValue("30s") Duration waitDurationInOpenState) {

    public CircuitBreaker {
      if (failureRateThreshold <= 0 || failureRateThreshold > 100) {
        throw new IllegalArgumentException(
            "cache-sync.redis.circuit-breaker.failure-rate-threshold must be in (0, 100]");
      }
      if (slidingWindowSize <= 0) {
        throw new IllegalArgumentException("sliding-window-size must be positive");
      }
    }
  }

  public record PubSub(
      @DefaultValue("false") boolean enabled,
      @DefaultValue(CacheService.DEFAULT_CHANNEL_PATTERN) String channelPattern) {}
}
