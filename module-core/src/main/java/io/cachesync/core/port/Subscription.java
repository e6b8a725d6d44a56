package io.cachesync.core.port;

/**
 * 구독 해제 핸들
 *
 * <p>{@link #unsubscribe()}는 여러 번 호출해도 안전합니다. 두 번째 호출부터는 아무 일도 하지 않습니다.
 */
public interface Subscription extends AutoCloseable {

  void unsubscribe();

  boolean isActive();

  @Override
  default void close() {
    unsubscribe();
  }
}
