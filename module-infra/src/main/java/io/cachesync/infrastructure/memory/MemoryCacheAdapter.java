package io.cachesync.infrastructure.memory;

import com.google.common.math.LongMath;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.cachesync.core.domain.CacheStats;
import io.cachesync.core.domain.CacheWrite;
import io.cachesync.core.domain.HealthStatus;
import io.cachesync.core.port.CacheAdapter;
import io.cachesync.core.port.EvictionListener;
import io.cachesync.core.support.CacheKeyValidator;
import io.cachesync.core.support.GlobPattern;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * 프로세스 내 LRU 캐시 어댑터
 *
 * <h3>저장 구조</h3>
 *
 * <p>{@link LinkedHashMap}의 삽입 순서를 최근 사용 순서로 유지합니다 (head = LRU, tail = MRU). 조회/저장 시 엔트리를 tail로
 * 옮깁니다. LRU 재정렬, 축출, 만료 타이머 취소는 모두 check-then-act 이므로 단일 {@link ReentrantLock}으로 직렬화합니다.
 *
 * <h3>이중 만료 경로</h3>
 *
 * <ul>
 *   <li>Passive: get 시점에 {@code now >= expiresAt}이면 삭제 후 miss
 *   <li>Active: TTL이 있는 엔트리마다 예약 삭제 작업 등록. 다시 읽히지 않는 키도 회수됩니다.
 * </ul>
 *
 * <p>두 경로 모두 "이미 없는 키 삭제"를 no-op으로 처리하므로 경쟁해도 안전합니다. 예약 작업은 자신이 등록한 엔트리와 동일한 인스턴스일 때만
 * 삭제합니다.
 *
 * <h3>용량</h3>
 *
 * <p>축출은 엔트리 수 기준 LRU입니다. {@link #estimateSize}는 통계 보고용이며 축출 판단에 쓰이지 않습니다.
 */
@Slf4j
public class MemoryCacheAdapter implements CacheAdapter {

  public static final int DEFAULT_CAPACITY = 1000;

  static final int ENTRY_OVERHEAD_BYTES = 40;

  private final int capacity;
  private final Duration defaultTtl;
  private final Clock clock;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;
  private final long startedAt;

  private final ReentrantLock lock = new ReentrantLock();
  private final LinkedHashMap<String, CacheEntry> store = new LinkedHashMap<>();
  private final Map<String, ScheduledFuture<?>> expiryTasks = new HashMap<>();
  private long hits;
  private long misses;
  private long evictions;
  private long memoryUsage;

  private volatile EvictionListener evictionListener;

  public MemoryCacheAdapter() {
    this(DEFAULT_CAPACITY, null);
  }

  public MemoryCacheAdapter(int capacity, Duration defaultTtl) {
    this(capacity, defaultTtl, Clock.systemUTC(), null);
  }

  /**
   * @param capacity 최대 엔트리 수 (1 이상)
   * @param defaultTtl TTL 미지정 시 적용할 기본 TTL (null이면 만료 없음)
   * @param clock passive 만료 판단용 시계
   * @param scheduler active 만료 스케줄러. null이면 내부 단일 스레드를 만들고 disconnect 시 종료합니다.
   */
  public MemoryCacheAdapter(
      int capacity, Duration defaultTtl, Clock clock, ScheduledExecutorService scheduler) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
    }
    if (defaultTtl != null && defaultTtl.isNegative()) {
      throw new IllegalArgumentException("defaultTtl must not be negative, got: " + defaultTtl);
    }
    this.capacity = capacity;
    this.defaultTtl = defaultTtl;
    this.clock = Objects.requireNonNull(clock, "clock");
    if (scheduler != null) {
      this.scheduler = scheduler;
      this.ownsScheduler = false;
    } else {
      this.scheduler = newExpiryScheduler();
      this.ownsScheduler = true;
    }
    this.startedAt = clock.millis();
  }

  private static ScheduledExecutorService newExpiryScheduler() {
    ScheduledThreadPoolExecutor executor =
        new ScheduledThreadPoolExecutor(
            1,
            new ThreadFactoryBuilder().setNameFormat("cache-sync-expiry-%d").setDaemon(true).build());
    executor.setRemoveOnCancelPolicy(true);
    return executor;
  }

  /** 보고용 크기 추정: UTF-16 2바이트 × 문자 수 + 엔트리 고정 오버헤드 */
  static long estimateSize(String key, String value) {
    return 2L * (key.length() + value.length()) + ENTRY_OVERHEAD_BYTES;
  }

  // ==================== Reads ====================

  @Override
  public String get(String key) {
    CacheKeyValidator.validateKey(key);
    lock.lock();
    try {
      return getLocked(key);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<String> mget(List<String> keys) {
    CacheKeyValidator.validateKeys(keys);
    List<String> values = new ArrayList<>(keys.size());
    lock.lock();
    try {
      for (String key : keys) {
        values.add(getLocked(key));
      }
    } finally {
      lock.unlock();
    }
    return values;
  }

  @Override
  public List<String> keys(String pattern) {
    GlobPattern glob = GlobPattern.compile(pattern);
    lock.lock();
    try {
      purgeExpiredLocked();
      return store.keySet().stream().filter(glob::matches).toList();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<Duration> ttl(String key) {
    CacheKeyValidator.validateKey(key);
    lock.lock();
    try {
      CacheEntry entry = store.get(key);
      long now = clock.millis();
      if (entry == null || entry.isExpired(now) || entry.expiresAt() == 0) {
        return Optional.empty();
      }
      return Optional.of(Duration.ofMillis(entry.expiresAt() - now));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public CacheStats getStats() {
    lock.lock();
    try {
      return new CacheStats(
          hits,
          misses,
          evictions,
          memoryUsage,
          store.size(),
          Duration.ofMillis(clock.millis() - startedAt));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public HealthStatus healthCheck() {
    CacheStats stats = getStats();
    return HealthStatus.healthy(
        "In-memory adapter operational",
        Map.of(
            "entryCount", stats.entryCount(),
            "capacity", capacity,
            "memoryUsage", stats.memoryUsage()));
  }

  // ==================== Mutations ====================

  @Override
  public void set(String key, String value, Duration ttl) {
    CacheKeyValidator.validateKey(key);
    CacheKeyValidator.validateTtl(key, ttl);
    Objects.requireNonNull(value, "value");

    List<String> evicted = new ArrayList<>(1);
    lock.lock();
    try {
      putLocked(key, value, ttl, evicted);
    } finally {
      lock.unlock();
    }
    notifyEvicted(evicted);
  }

  @Override
  public void mset(List<CacheWrite> entries) {
    CacheKeyValidator.validateWrites(entries);
    entries.forEach(e -> Objects.requireNonNull(e.value(), "value"));

    List<String> evicted = new ArrayList<>();
    lock.lock();
    try {
      for (CacheWrite entry : entries) {
        putLocked(entry.key(), entry.value(), entry.ttl(), evicted);
      }
    } finally {
      lock.unlock();
    }
    notifyEvicted(evicted);
  }

  /** 만료되었지만 아직 회수되지 않은 엔트리는 없는 것으로 보고 false를 반환합니다. */
  @Override
  public boolean delete(String key) {
    CacheKeyValidator.validateKey(key);
    lock.lock();
    try {
      CacheEntry removed = removeLocked(key);
      return removed != null && !removed.isExpired(clock.millis());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public long clear(String pattern) {
    GlobPattern glob = GlobPattern.compile(pattern);
    lock.lock();
    try {
      purgeExpiredLocked();
      List<String> matched = store.keySet().stream().filter(glob::matches).toList();
      matched.forEach(this::removeLocked);
      log.debug("[MemoryCache] Cleared {} entries: pattern={}", matched.size(), glob);
      return matched.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void setEvictionListener(EvictionListener listener) {
    this.evictionListener = listener;
  }

  /** 모든 만료 예약을 취소하고 저장소를 비웁니다. 내부 스케줄러는 종료됩니다. */
  @Override
  public void disconnect() {
    lock.lock();
    try {
      expiryTasks.values().forEach(task -> task.cancel(false));
      expiryTasks.clear();
      store.clear();
      memoryUsage = 0;
    } finally {
      lock.unlock();
    }
    if (ownsScheduler) {
      scheduler.shutdownNow();
    }
    log.info("[MemoryCache] Disconnected");
  }

  // ==================== Internals (lock held) ====================

  private String getLocked(String key) {
    CacheEntry entry = store.get(key);
    if (entry == null) {
      misses++;
      return null;
    }
    if (entry.isExpired(clock.millis())) {
      removeLocked(key);
      misses++;
      return null;
    }
    // tail로 이동 (MRU)
    store.remove(key);
    store.put(key, entry);
    hits++;
    return entry.value();
  }

  private void putLocked(String key, String value, Duration ttl, List<String> evicted) {
    removeLocked(key);
    while (store.size() >= capacity) {
      evicted.add(evictEldestLocked());
    }

    Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
    boolean expires = effectiveTtl != null && !effectiveTtl.isZero();
    long ttlMillis = expires ? saturatedMillis(effectiveTtl) : 0L;
    long expiresAt = expires ? LongMath.saturatedAdd(clock.millis(), ttlMillis) : 0L;

    CacheEntry entry = new CacheEntry(value, expiresAt, estimateSize(key, value));
    store.put(key, entry);
    memoryUsage += entry.approximateSize();

    // Long.MAX_VALUE로 포화된 만료 시각은 사실상 만료되지 않음
    if (expires && expiresAt != Long.MAX_VALUE) {
      scheduleExpiry(key, entry, ttlMillis);
    }
  }

  private String evictEldestLocked() {
    Iterator<String> it = store.keySet().iterator();
    String eldest = it.next();
    removeLocked(eldest);
    evictions++;
    log.debug("[MemoryCache] Evicted LRU entry: key={}, capacity={}", eldest, capacity);
    return eldest;
  }

  private CacheEntry removeLocked(String key) {
    ScheduledFuture<?> task = expiryTasks.remove(key);
    if (task != null) {
      task.cancel(false);
    }
    CacheEntry removed = store.remove(key);
    if (removed != null) {
      memoryUsage -= removed.approximateSize();
    }
    return removed;
  }

  private void purgeExpiredLocked() {
    long now = clock.millis();
    List<String> expired =
        store.entrySet().stream()
            .filter(e -> e.getValue().isExpired(now))
            .map(Map.Entry::getKey)
            .toList();
    expired.forEach(this::removeLocked);
  }

  private void scheduleExpiry(String key, CacheEntry entry, long delayMillis) {
    try {
      ScheduledFuture<?> task =
          scheduler.schedule(() -> expire(key, entry), delayMillis, TimeUnit.MILLISECONDS);
      expiryTasks.put(key, task);
    } catch (RejectedExecutionException e) {
      log.debug("[MemoryCache] Expiry scheduler unavailable, relying on read-time expiry: key={}", key);
    }
  }

  private void expire(String key, CacheEntry entry) {
    lock.lock();
    try {
      if (store.get(key) != entry) {
        return;
      }
      expiryTasks.remove(key);
      store.remove(key);
      memoryUsage -= entry.approximateSize();
      log.trace("[MemoryCache] Expired: key={}", key);
    } finally {
      lock.unlock();
    }
  }

  private static long saturatedMillis(Duration ttl) {
    try {
      return ttl.toMillis();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  private void notifyEvicted(List<String> evicted) {
    EvictionListener listener = evictionListener;
    if (listener == null || evicted.isEmpty()) {
      return;
    }
    evicted.forEach(listener::onEviction);
  }
}
