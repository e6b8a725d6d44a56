package io.cachesync.common.executor;

import io.cachesync.common.executor.strategy.ExceptionTranslator;
import io.cachesync.common.function.ThrowingSupplier;
import io.cachesync.error.exception.base.ClientBaseException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * LogicExecutor 기본 구현체
 *
 * <ul>
 *   <li>Checked Exception → Runtime Exception 자동 변환
 *   <li>Micrometer 타이머 자동 수집 ({@code cache.executor})
 *   <li><b>Error 격리</b> - Error(OOM 등)는 절대 캐치하지 않고 상위로 전파
 *   <li><b>메트릭 카디널리티 통제</b> - 동적 값은 로그에만 기록
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  static final String TIMER_NAME = "cache.executor";

  private final MeterRegistry meterRegistry;

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithMetrics(task, context, null);
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    try {
      return executeWithMetrics(task, context, null);
    } catch (RuntimeException e) {
      log.debug("[{}] Falling back to default value: {}", context.toTaskName(), e.getMessage());
      return defaultValue;
    }
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context) {
    return executeWithMetrics(task, context, translator);
  }

  private <T> T executeWithMetrics(
      ThrowingSupplier<T> task, TaskContext context, ExceptionTranslator translator) {
    Timer.Sample sample = Timer.start(meterRegistry);

    try {
      T result = task.get();
      record(sample, context, "success", null);
      return result;
    } catch (Throwable t) {
      if (t instanceof Error error) {
        throw error;
      }
      record(sample, context, "failure", t);
      logFailure(context, t);
      throw translate(t, context, translator);
    }
  }

  private void record(Timer.Sample sample, TaskContext context, String result, Throwable t) {
    Timer.Builder builder =
        Timer.builder(TIMER_NAME)
            .tag("component", context.component())
            .tag("operation", context.operation())
            .tag("result", result);
    if (t != null) {
      builder.tag("exception", t.getClass().getSimpleName());
    }
    sample.stop(builder.register(meterRegistry));
  }

  // 호출자 입력 오류는 장애가 아니므로 WARN 이하로만 기록
  private void logFailure(TaskContext context, Throwable t) {
    if (t instanceof ClientBaseException) {
      log.debug("[{}] Rejected: {}", context.toTaskName(), t.getMessage());
      return;
    }
    log.warn("[{}] Task failed: {}", context.toTaskName(), t.toString());
  }

  private RuntimeException translate(
      Throwable t, TaskContext context, ExceptionTranslator translator) {
    if (translator != null) {
      return translator.translate(t);
    }
    return ExceptionTranslator.defaultTranslator(context.toTaskName()).translate(t);
  }
}
