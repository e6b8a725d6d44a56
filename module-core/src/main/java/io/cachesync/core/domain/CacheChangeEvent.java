package io.cachesync.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * 캐시 변경 이벤트 (불변)
 *
 * <p>성공한 변경 1건당 정확히 한 번 생성되며, 로컬 watcher에 동기 전달된 뒤 PubSub으로 비동기 전파됩니다. 영속화되지 않습니다.
 *
 * <h3>필드</h3>
 *
 * <ul>
 *   <li>{@code value}: {@link ChangeType#SET}일 때만 존재
 *   <li>{@code originId}: 이벤트를 생성한 프로세스 식별자 (에코 억제용, 로컬 전용 모드에서는 없음)
 *   <li>{@code sequence}: 생성 프로세스 내에서 단조 증가하는 번호. 서로 다른 originId 간에는 의미 없음
 * </ul>
 *
 * @param type 변경 유형
 * @param key 캐시 키
 * @param value 저장된 값 (SET 전용, nullable)
 * @param timestamp 생성 시각
 * @param originId 생성 프로세스 ID (nullable)
 * @param sequence 생성 프로세스 내 순번 (nullable)
 */
public record CacheChangeEvent(
    ChangeType type, String key, String value, Instant timestamp, String originId, Long sequence) {

  public CacheChangeEvent {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(timestamp, "timestamp");
    if (type != ChangeType.SET) {
      value = null;
    }
  }

  public static CacheChangeEvent set(
      String key, String value, Instant timestamp, String originId, long sequence) {
    return new CacheChangeEvent(ChangeType.SET, key, value, timestamp, originId, sequence);
  }

  public static CacheChangeEvent delete(
      String key, Instant timestamp, String originId, long sequence) {
    return new CacheChangeEvent(ChangeType.DELETE, key, null, timestamp, originId, sequence);
  }

  public static CacheChangeEvent eviction(
      String key, Instant timestamp, String originId, long sequence) {
    return new CacheChangeEvent(ChangeType.EVICTION, key, null, timestamp, originId, sequence);
  }

  public boolean isFrom(String instanceId) {
    return originId != null && originId.equals(instanceId);
  }
}
