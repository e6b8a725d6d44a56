package io.cachesync.error.exception.base;

import io.cachesync.error.ErrorCode;

/**
 * ClientBaseException: 호출자가 계약을 위반했을 때 발생하는 4xx 계열 예외입니다. I/O 이전에 동기적으로 던져지며 재시도 대상이 아닙니다.
 */
public abstract class ClientBaseException extends BaseException {

  // 기본 생성자: 고정된 에러 메시지를 사용할 때
  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // 동적 인자를 받는 생성자
  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
