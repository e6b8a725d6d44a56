package io.cachesync.infrastructure.memory;

/**
 * 메모리 어댑터 엔트리. 교체만 가능하며 부분 수정하지 않습니다.
 *
 * @param value 값
 * @param expiresAt 만료 시각 (epoch millis), 0이면 만료 없음
 * @param approximateSize 보고용 추정 크기 (bytes)
 */
record CacheEntry(String value, long expiresAt, long approximateSize) {

  boolean isExpired(long nowMillis) {
    return expiresAt != 0 && nowMillis >= expiresAt;
  }
}
