package io.cachesync.error.exception;

import io.cachesync.error.CacheErrorCode;
import io.cachesync.error.exception.base.ClientBaseException;
import io.cachesync.error.exception.marker.CircuitBreakerIgnoreMarker;
import java.time.Duration;
import lombok.Getter;

/**
 * 캐시 키/TTL 계약 위반 예외 (ValidationError)
 *
 * <p>빈 키, 공백 키, 음수 TTL 등 호출자 입력이 잘못된 경우 I/O 이전에 동기적으로 던져집니다. 재시도 대상이 아니며 서킷 브레이커 집계에서도 제외됩니다.
 */
@Getter
public class CacheValidationException extends ClientBaseException
    implements CircuitBreakerIgnoreMarker {

  private final String field;
  private final String rejectedValue;

  private CacheValidationException(
      CacheErrorCode errorCode, String field, String rejectedValue, Object... args) {
    super(errorCode, args);
    this.field = field;
    this.rejectedValue = rejectedValue;
  }

  public static CacheValidationException emptyKey(String key) {
    return new CacheValidationException(
        CacheErrorCode.INVALID_KEY, "key", key, "Cache key cannot be empty");
  }

  public static CacheValidationException negativeTtl(String key, Duration ttl) {
    return new CacheValidationException(
        CacheErrorCode.INVALID_TTL, "ttl", String.valueOf(ttl), key, ttl);
  }

  public static CacheValidationException invalidPattern(String pattern, String reason) {
    return new CacheValidationException(
        CacheErrorCode.INVALID_PATTERN, "pattern", pattern, pattern + " (" + reason + ")");
  }
}
