package io.cachesync.core.domain;

import java.time.Duration;

/**
 * mset 입력 항목
 *
 * @param key 캐시 키
 * @param value 값
 * @param ttl TTL (null이면 어댑터 기본값, {@link Duration#ZERO}이면 만료 없음)
 */
public record CacheWrite(String key, String value, Duration ttl) {

  public static CacheWrite of(String key, String value) {
    return new CacheWrite(key, value, null);
  }

  public static CacheWrite of(String key, String value, Duration ttl) {
    return new CacheWrite(key, value, ttl);
  }
}
