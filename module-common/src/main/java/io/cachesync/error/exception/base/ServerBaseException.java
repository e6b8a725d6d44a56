package io.cachesync.error.exception.base;

import io.cachesync.error.ErrorCode;

/**
 * ServerBaseException: 연결 장애나 명령 실패 등 시스템 측 원인으로 발생하는 5xx 계열 예외입니다. 장애 회고를 위해 원인(cause)을 함께 보존합니다.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  // 실제 에러(cause)를 포함하여 디버깅 정보 확보
  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  // 상세 메시지(args)와 실제 에러(cause)를 동시에 기록
  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
