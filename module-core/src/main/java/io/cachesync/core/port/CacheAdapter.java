package io.cachesync.core.port;

import io.cachesync.core.domain.CacheStats;
import io.cachesync.core.domain.CacheWrite;
import io.cachesync.core.domain.HealthStatus;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 캐시 저장소 어댑터 계약
 *
 * <p>메모리/Redis 등 저장소 구현을 동일한 API 뒤에 숨깁니다. 모든 연산은 단일 키 기준으로 원자적입니다.
 *
 * <h3>배치 연산</h3>
 *
 * <p>{@link #mget}/{@link #mset}은 키 간 원자성을 보장하지 않습니다. 예외가 발생하면 배치에 포함된 모든 키의 상태는 "알 수 없음"으로
 * 간주하고 다시 조회해야 합니다.
 *
 * <h3>TTL 규약</h3>
 *
 * <ul>
 *   <li>{@code null}: 어댑터 기본 TTL 적용 (없으면 만료 없음)
 *   <li>{@link Duration#ZERO}: 만료 없음
 *   <li>음수: {@code CacheValidationException}
 * </ul>
 */
public interface CacheAdapter {

  /**
   * @return 저장된 값, 없거나 만료되었으면 {@code null}
   */
  String get(String key);

  void set(String key, String value, Duration ttl);

  /**
   * @return 키가 존재해서 삭제되었으면 true
   */
  boolean delete(String key);

  /**
   * @return 입력 순서와 같은 위치의 값 목록 (없는 키는 {@code null})
   */
  List<String> mget(List<String> keys);

  void mset(List<CacheWrite> entries);

  /**
   * @param pattern glob 패턴 ({@code *}, {@code ?}, {@code [..]}). null이면 전체
   */
  List<String> keys(String pattern);

  /**
   * @param pattern glob 패턴. null이면 전체
   * @return 삭제된 엔트리 수
   */
  long clear(String pattern);

  CacheStats getStats();

  /**
   * 남은 TTL 조회
   *
   * @return 남은 시간. 키가 없거나 만료가 설정되지 않았으면 empty
   */
  Optional<Duration> ttl(String key);

  default void connect() {}

  default void disconnect() {}

  default HealthStatus healthCheck() {
    return HealthStatus.healthy("Adapter does not implement healthCheck", Map.of());
  }

  /** 용량 초과로 인한 제거를 통지받을 리스너 등록. 지원하지 않는 어댑터는 무시합니다. */
  default void setEvictionListener(EvictionListener listener) {}
}
