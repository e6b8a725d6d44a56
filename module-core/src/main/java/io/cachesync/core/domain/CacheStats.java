package io.cachesync.core.domain;

import java.time.Duration;

/**
 * 어댑터 통계 스냅샷
 *
 * @param hits 적중 횟수
 * @param misses 미스 횟수 (만료로 인한 미스 포함)
 * @param evictions LRU 용량 초과로 제거된 엔트리 수 (Redis는 서버 보고값 포함)
 * @param memoryUsage 추정/보고 메모리 사용량 (bytes)
 * @param entryCount 현재 엔트리 수
 * @param uptime 어댑터 생성 이후 경과 시간
 */
public record CacheStats(
    long hits, long misses, long evictions, long memoryUsage, long entryCount, Duration uptime) {

  /** 적중률 (0.0 ~ 1.0). 조회가 없었으면 0 */
  public double hitRate() {
    long total = hits + misses;
    return total == 0 ? 0.0 : (double) hits / total;
  }
}
