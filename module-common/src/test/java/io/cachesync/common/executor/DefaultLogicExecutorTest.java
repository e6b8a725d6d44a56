package io.cachesync.common.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cachesync.error.exception.CacheValidationException;
import io.cachesync.error.exception.InternalSystemException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * {@link DefaultLogicExecutor} 단위 테스트
 *
 * <h3>검증 항목</h3>
 *
 * <ul>
 *   <li>성공/실패 타이머 기록 (동적 값은 태그에서 제외)
 *   <li>BaseException pass-through, 그 외 InternalSystemException 래핑
 *   <li>Error 격리
 *   <li>executeOrDefault 기본값 반환
 * </ul>
 */
@Tag("unit")
@DisplayName("DefaultLogicExecutor 단위 테스트")
class DefaultLogicExecutorTest {

  private SimpleMeterRegistry meterRegistry;
  private LogicExecutor executor;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    executor = new DefaultLogicExecutor(meterRegistry);
  }

  @Nested
  @DisplayName("execute")
  class Execute {

    @Test
    @DisplayName("성공 시 결과를 반환하고 success 타이머를 기록한다")
    void returnsResult() {
      String result = executor.execute(() -> "ok", TaskContext.of("Test", "run", "key-1"));

      assertThat(result).isEqualTo("ok");
      assertThat(
              meterRegistry
                  .get(DefaultLogicExecutor.TIMER_NAME)
                  .tag("component", "Test")
                  .tag("operation", "run")
                  .tag("result", "success")
                  .timer()
                  .count())
          .isEqualTo(1);
    }

    @Test
    @DisplayName("BaseException은 그대로 전파된다")
    void passesBaseException() {
      CacheValidationException original = CacheValidationException.emptyKey("");

      assertThatThrownBy(
              () ->
                  executor.execute(
                      () -> {
                        throw original;
                      },
                      TaskContext.of("Test", "run")))
          .isSameAs(original);
    }

    @Test
    @DisplayName("Checked Exception은 InternalSystemException으로 래핑된다")
    void wrapsCheckedException() {
      assertThatThrownBy(
              () ->
                  executor.execute(
                      () -> {
                        throw new IOException("disk");
                      },
                      TaskContext.of("Test", "io", "file")))
          .isInstanceOf(InternalSystemException.class)
          .hasCauseInstanceOf(IOException.class)
          .hasMessageContaining("Test:io:file");

      assertThat(
              meterRegistry
                  .get(DefaultLogicExecutor.TIMER_NAME)
                  .tag("result", "failure")
                  .tag("exception", "IOException")
                  .timer()
                  .count())
          .isEqualTo(1);
    }

    @Test
    @DisplayName("Error는 변환 없이 그대로 전파된다")
    void propagatesError() {
      assertThatThrownBy(
              () ->
                  executor.execute(
                      () -> {
                        throw new StackOverflowError();
                      },
                      TaskContext.of("Test", "error")))
          .isInstanceOf(StackOverflowError.class);
    }
  }

  @Nested
  @DisplayName("executeOrDefault / executeWithTranslation")
  class Fallbacks {

    @Test
    @DisplayName("실패 시 기본값을 반환한다")
    void returnsDefault() {
      Long value =
          executor.executeOrDefault(
              () -> {
                throw new IllegalStateException("boom");
              },
              -1L,
              TaskContext.of("Test", "fallback"));

      assertThat(value).isEqualTo(-1L);
    }

    @Test
    @DisplayName("지정된 변환기가 예외를 변환한다")
    void usesTranslator() {
      assertThatThrownBy(
              () ->
                  executor.executeWithTranslation(
                      () -> {
                        throw new IOException("x");
                      },
                      e -> new IllegalArgumentException("translated", e),
                      TaskContext.of("Test", "translate")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("translated");
    }
  }

  @Test
  @DisplayName("TaskContext는 동적 값이 없으면 component:operation 형식이다")
  void taskNameFormat() {
    assertThat(TaskContext.of("A", "b").toTaskName()).isEqualTo("A:b");
    assertThat(TaskContext.of("A", "b", "c").toTaskName()).isEqualTo("A:b:c");
    assertThat(new TaskContext("A", "b", null).dynamicValue()).isEmpty();
  }
}
