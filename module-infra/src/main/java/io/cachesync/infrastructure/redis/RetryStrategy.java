package io.cachesync.infrastructure.redis;

import java.time.Duration;

/**
 * 연결 재시도 전략: 시도 횟수 → 대기 시간(ms), {@code null}이면 재시도 중단
 *
 * <p>기본값은 50ms에서 시작해 2배씩 증가하고 2초에서 멈추는 지수 백오프이며, 10회 시도 후 중단합니다.
 */
@FunctionalInterface
public interface RetryStrategy {

  /**
   * @param attempt 1부터 시작하는 실패 횟수
   * @return 다음 시도까지 대기할 밀리초, 중단하려면 null
   */
  Long nextDelayMillis(int attempt);

  static RetryStrategy defaultStrategy() {
    return exponentialBackoff(Duration.ofMillis(50), Duration.ofSeconds(2), 10);
  }

  static RetryStrategy exponentialBackoff(Duration baseDelay, Duration maxDelay, int maxAttempts) {
    long base = baseDelay.toMillis();
    long cap = maxDelay.toMillis();
    return attempt -> {
      if (attempt > maxAttempts) {
        return null;
      }
      double delay = base * Math.pow(2, attempt - 1);
      return (long) Math.min(cap, delay);
    };
  }

  static RetryStrategy noRetry() {
    return attempt -> null;
  }
}
