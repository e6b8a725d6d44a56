package io.cachesync.error.exception;

import io.cachesync.error.CacheErrorCode;
import io.cachesync.error.exception.base.ServerBaseException;
import io.cachesync.error.exception.marker.CircuitBreakerRecordMarker;
import java.time.Duration;
import lombok.Getter;

/**
 * 살아있는 연결 위에서 단일 명령이 실패한 경우의 예외 (OperationError)
 *
 * <p>원본 예외를 cause로 보존하고 method/key/ttl 컨텍스트를 함께 기록합니다. 자동 재시도하지 않습니다.
 */
@Getter
public class CacheOperationException extends ServerBaseException
    implements CircuitBreakerRecordMarker {

  private final String method;
  private final String key;
  private final Duration ttl;

  public CacheOperationException(String method, String key, Duration ttl, Throwable cause) {
    super(CacheErrorCode.OPERATION_FAILED, cause, method, key, ttl);
    this.method = method;
    this.key = key;
    this.ttl = ttl;
  }
}
