package io.cachesync.error.exception;

import io.cachesync.error.CacheErrorCode;
import io.cachesync.error.exception.base.ServerBaseException;
import io.cachesync.error.exception.marker.CircuitBreakerRecordMarker;
import lombok.Getter;

/**
 * 캐시 서버 연결 실패 예외 (ConnectionError)
 *
 * <p>연결 수립 실패, 재연결 전략 소진, 서킷 오픈, 종료된 어댑터 사용 시 발생합니다. 재시도는 설정된 RetryStrategy에 따라서만 수행됩니다.
 */
@Getter
public class CacheConnectionException extends ServerBaseException
    implements CircuitBreakerRecordMarker {

  private final String host;
  private final int port;
  private final String reason;

  public CacheConnectionException(String host, int port, String reason) {
    super(CacheErrorCode.CONNECTION_FAILED, host, port, reason);
    this.host = host;
    this.port = port;
    this.reason = reason;
  }

  public CacheConnectionException(String host, int port, String reason, Throwable cause) {
    super(CacheErrorCode.CONNECTION_FAILED, cause, host, port, reason);
    this.host = host;
    this.port = port;
    this.reason = reason;
  }
}
