package io.cachesync.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 캐시 계층 에러 코드
 *
 * <ul>
 *   <li>C0xx: 호출자 입력 오류 (재시도 불가)
 *   <li>S0xx: 연결/명령/직렬화 등 서버 측 오류
 * </ul>
 */
@Getter
@AllArgsConstructor
public enum CacheErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_KEY("C001", "캐시 키가 올바르지 않습니다: %s", HttpStatus.BAD_REQUEST),
  INVALID_TTL("C002", "TTL 값이 올바르지 않습니다 (key: %s, ttl: %s)", HttpStatus.BAD_REQUEST),
  INVALID_PATTERN("C003", "패턴이 올바르지 않습니다: %s", HttpStatus.BAD_REQUEST),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  CONNECTION_FAILED(
      "S002", "캐시 서버 연결 실패 (%s:%s, 원인: %s)", HttpStatus.SERVICE_UNAVAILABLE),
  OPERATION_FAILED(
      "S003", "캐시 명령 실행 실패 (method: %s, key: %s, ttl: %s)", HttpStatus.INTERNAL_SERVER_ERROR),
  EVENT_CODEC_FAILED("S004", "캐시 이벤트 직렬화 실패 (%s)", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
