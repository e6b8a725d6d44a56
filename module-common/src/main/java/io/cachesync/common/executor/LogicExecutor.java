package io.cachesync.common.executor;

import io.cachesync.common.executor.strategy.ExceptionTranslator;
import io.cachesync.common.function.ThrowingSupplier;

/**
 * 예외 처리/메트릭 수집을 일원화하는 작업 실행기
 *
 * <p>try-catch 블록을 호출부에서 제거하고, 작업 이름({@link TaskContext}) 단위로 예외 변환과 실행 시간 측정을 수행합니다.
 *
 * <h3>예외 정책</h3>
 *
 * <ul>
 *   <li>{@link Error}는 절대 캐치하지 않고 상위로 전파
 *   <li>{@code BaseException} 계층은 그대로 전파
 *   <li>그 외 예외는 {@code InternalSystemException} 또는 지정된 {@link ExceptionTranslator} 결과로 변환
 * </ul>
 */
public interface LogicExecutor {

  /** 작업을 실행하고 결과를 반환합니다. 실패 시 규격화된 예외를 던집니다. */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /**
   * 작업을 실행하고, 실패 시 기본값을 반환합니다.
   *
   * <p>Graceful Degradation 용도: 부가 기능(이벤트 발행, 핸들러 호출)의 실패가 주 흐름을 깨뜨리지 않아야 할 때 사용합니다.
   */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  /** 지정된 변환기로 예외를 도메인 예외로 변환하여 던집니다. */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
