package io.cachesync.infrastructure.redis;

import java.time.Duration;
import lombok.Builder;

/**
 * Redis 연결 설정
 *
 * @param host 호스트 (기본 localhost)
 * @param port 포트 (기본 6379)
 * @param username ACL 사용자 (nullable)
 * @param password 비밀번호 (nullable)
 * @param database DB 인덱스 (기본 0)
 * @param connectTimeout 연결 타임아웃 (기본 10s)
 * @param commandTimeout 명령 타임아웃 (기본 5s)
 * @param defaultTtl TTL 미지정 set에 적용할 기본 TTL (nullable)
 * @param retryStrategy 연결/재연결 재시도 전략
 */
@Builder(toBuilder = true)
public record RedisConnectionSettings(
    String host,
    int port,
    String username,
    String password,
    int database,
    Duration connectTimeout,
    Duration commandTimeout,
    Duration defaultTtl,
    RetryStrategy retryStrategy) {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 6379;
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(5);

  private static final String REDIS_SCHEME = "redis://";

  public RedisConnectionSettings {
    if (host == null || host.isBlank()) {
      host = DEFAULT_HOST;
    }
    if (port == 0) {
      port = DEFAULT_PORT;
    }
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("port out of range: " + port);
    }
    if (database < 0) {
      throw new IllegalArgumentException("database index must not be negative: " + database);
    }
    connectTimeout = positiveOrDefault(connectTimeout, DEFAULT_CONNECT_TIMEOUT, "connectTimeout");
    commandTimeout = positiveOrDefault(commandTimeout, DEFAULT_COMMAND_TIMEOUT, "commandTimeout");
    if (defaultTtl != null && defaultTtl.isNegative()) {
      throw new IllegalArgumentException("defaultTtl must not be negative: " + defaultTtl);
    }
    if (retryStrategy == null) {
      retryStrategy = RetryStrategy.defaultStrategy();
    }
  }

  public static RedisConnectionSettings of(String host, int port) {
    return builder().host(host).port(port).build();
  }

  public String address() {
    return REDIS_SCHEME + host + ":" + port;
  }

  private static Duration positiveOrDefault(Duration value, Duration fallback, String name) {
    if (value == null) {
      return fallback;
    }
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive: " + value);
    }
    return value;
  }

  @Override
  public String toString() {
    return "RedisConnectionSettings[" + address() + "/" + database + "]";
  }
}
