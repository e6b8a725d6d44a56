package io.cachesync.infrastructure.redis;

/**
 * Redis 어댑터 연결 상태
 *
 * <pre>
 * DISCONNECTED → CONNECTING → CONNECTED
 * CONNECTED → RECONNECTING → CONNECTED      (재연결 성공)
 * RECONNECTING → DISCONNECTED               (RetryStrategy가 중단 반환)
 * </pre>
 */
public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED,
  RECONNECTING
}
