package io.cachesync.common.executor.strategy;

import io.cachesync.error.exception.InternalSystemException;
import io.cachesync.error.exception.base.BaseException;

/**
 * 특정 예외를 도메인 예외로 변환하는 전략
 *
 * <p>다중 catch 블록을 if-else 체인으로 대체하여 코드 평탄화를 달성합니다.
 *
 * <ul>
 *   <li>{@link Error}는 변환 대상이 아님 (LogicExecutor가 먼저 전파)
 *   <li>{@link BaseException}은 그대로 pass-through
 *   <li>원본 예외를 cause로 보존하여 스택 트레이스 유지
 * </ul>
 */
@FunctionalInterface
public interface ExceptionTranslator {

  RuntimeException translate(Throwable e);

  /** BaseException은 그대로, 나머지는 InternalSystemException으로 규격화 */
  static ExceptionTranslator defaultTranslator(String taskName) {
    return e -> {
      if (e instanceof BaseException be) {
        return be;
      }
      return new InternalSystemException(taskName, e);
    };
  }
}
