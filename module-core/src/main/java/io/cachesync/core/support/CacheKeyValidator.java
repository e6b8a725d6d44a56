package io.cachesync.core.support;

import io.cachesync.core.domain.CacheWrite;
import io.cachesync.error.exception.CacheValidationException;
import java.time.Duration;
import java.util.List;

/** 캐시 키/TTL 입력 검증. 모든 검증은 I/O 이전에 수행됩니다. */
public final class CacheKeyValidator {

  private CacheKeyValidator() {}

  public static void validateKey(String key) {
    if (key == null || key.isBlank()) {
      throw CacheValidationException.emptyKey(key);
    }
  }

  public static void validateTtl(String key, Duration ttl) {
    if (ttl != null && ttl.isNegative()) {
      throw CacheValidationException.negativeTtl(key, ttl);
    }
  }

  public static void validateKeys(List<String> keys) {
    keys.forEach(CacheKeyValidator::validateKey);
  }

  public static void validateWrites(List<CacheWrite> entries) {
    for (CacheWrite entry : entries) {
      validateKey(entry.key());
      validateTtl(entry.key(), entry.ttl());
    }
  }
}
