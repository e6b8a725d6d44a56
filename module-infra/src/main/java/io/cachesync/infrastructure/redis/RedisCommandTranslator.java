package io.cachesync.infrastructure.redis;

import io.cachesync.common.executor.strategy.ExceptionTranslator;
import io.cachesync.error.exception.CacheConnectionException;
import io.cachesync.error.exception.CacheOperationException;
import io.cachesync.error.exception.base.BaseException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import java.time.Duration;
import org.redisson.client.RedisConnectionException;

/**
 * Redis 명령 예외 변환기
 *
 * <ul>
 *   <li>{@link BaseException} → 그대로 (재연결 실패 시 이미 CacheConnectionException)
 *   <li>{@link CallNotPermittedException} → CacheConnectionException ("circuit breaker open")
 *   <li>{@link RedisConnectionException} → CacheConnectionException
 *   <li>그 외 (타임아웃, WRONGTYPE 등) → CacheOperationException
 * </ul>
 */
record RedisCommandTranslator(String host, int port, String method, String key, Duration ttl)
    implements ExceptionTranslator {

  static RedisCommandTranslator of(
      RedisConnectionSettings settings, String method, String key, Duration ttl) {
    return new RedisCommandTranslator(settings.host(), settings.port(), method, key, ttl);
  }

  @Override
  public RuntimeException translate(Throwable e) {
    if (e instanceof BaseException be) {
      return be;
    }
    if (e instanceof CallNotPermittedException) {
      return new CacheConnectionException(host, port, "circuit breaker open", e);
    }
    if (e instanceof RedisConnectionException) {
      return new CacheConnectionException(host, port, e.getMessage(), e);
    }
    return new CacheOperationException(method, key, ttl, e);
  }
}
