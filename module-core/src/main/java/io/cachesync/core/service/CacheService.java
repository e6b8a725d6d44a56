package io.cachesync.core.service;

import com.google.common.util.concurrent.Striped;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.cachesync.common.executor.LogicExecutor;
import io.cachesync.common.executor.TaskContext;
import io.cachesync.core.domain.CacheChangeEvent;
import io.cachesync.core.domain.CacheStats;
import io.cachesync.core.domain.CacheWrite;
import io.cachesync.core.domain.HealthStatus;
import io.cachesync.core.port.CacheAdapter;
import io.cachesync.core.port.CachePubSub;
import io.cachesync.core.port.Subscription;
import io.cachesync.core.support.CacheKeyValidator;
import io.cachesync.core.watch.CacheWatchHandler;
import io.cachesync.core.watch.KeyMatcher;
import io.cachesync.core.watch.WatchRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongFunction;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * 캐시 코디네이터
 *
 * <p>하나의 {@link CacheAdapter}와 선택적인 {@link CachePubSub}를 조합하여 공개 캐시 API를 제공합니다.
 *
 * <h3>이벤트 흐름</h3>
 *
 * <ol>
 *   <li>변경 연산(set/delete/mset/clear)은 어댑터에 먼저 반영
 *   <li>성공한 경우에만 다음 sequence를 부여한 {@link CacheChangeEvent} 생성 (키 잠금 안에서)
 *   <li>키 잠금을 푼 뒤 로컬 watcher에 동기 전달 (원격 피어보다 항상 먼저 관찰)
 *   <li>PubSub이 있으면 sequence 순서대로 단일 발행 스레드에 넘겨 비동기 발행 (fire-and-forget, 실패는 로그만)
 * </ol>
 *
 * <p>직접 지정한 {@code publishExecutor}가 여러 스레드를 쓰면 전송 순서는 보장되지 않습니다.
 *
 * <h3>원격 이벤트 수신</h3>
 *
 * <ul>
 *   <li>{@code originId}가 자신과 같으면 즉시 폐기 (에코 억제)
 *   <li>그 외에는 로컬 watcher 전달 경로만 사용하며 절대 재발행하지 않음
 * </ul>
 *
 * <p>읽기 연산(get/mget/keys/getStats/ttl)은 어댑터에 그대로 위임하며 이벤트를 만들지 않습니다.
 */
@Slf4j
public class CacheService implements AutoCloseable {

  public static final String DEFAULT_CHANNEL_PATTERN = "cache-sync:events:*";

  private static final String COMPONENT = "CacheService";

  private final CacheAdapter adapter;
  private final CachePubSub pubSub;
  private final String originId;
  private final String channelPattern;
  private final LogicExecutor executor;
  private final ExecutorService publishExecutor;
  private final boolean ownsPublishExecutor;
  private final Clock clock;
  private final WatchRegistry watchers;

  private final AtomicLong sequence = new AtomicLong();
  private final Striped<Lock> keyLocks = Striped.lock(64);
  private final ReentrantLock sequenceLock = new ReentrantLock();
  private final ArrayDeque<StagedEvent> outbox = new ArrayDeque<>();
  private final ThreadLocal<List<StagedEvent>> inFlight = new ThreadLocal<>();
  private final AtomicReference<Subscription> remoteSubscription = new AtomicReference<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private final Counter receivedCounter;
  private final Counter echoSkippedCounter;
  private final Counter publishRejectedCounter;

  private CacheService(Builder builder) {
    this.adapter = Objects.requireNonNull(builder.adapter, "adapter");
    this.executor = Objects.requireNonNull(builder.executor, "executor");
    this.pubSub = builder.pubSub;
    this.originId = builder.originId;
    this.channelPattern = builder.channelPattern;
    this.clock = builder.clock;
    this.watchers = new WatchRegistry(executor);

    if (pubSub != null && (originId == null || originId.isBlank())) {
      throw new IllegalArgumentException("originId is required when a pub/sub channel is configured");
    }

    if (builder.publishExecutor != null) {
      this.publishExecutor = builder.publishExecutor;
      this.ownsPublishExecutor = false;
    } else if (pubSub != null) {
      this.publishExecutor =
          Executors.newSingleThreadExecutor(
              new ThreadFactoryBuilder()
                  .setNameFormat("cache-sync-publisher-%d")
                  .setDaemon(true)
                  .build());
      this.ownsPublishExecutor = true;
    } else {
      this.publishExecutor = null;
      this.ownsPublishExecutor = false;
    }

    MeterRegistry meterRegistry = builder.meterRegistry;
    this.receivedCounter = meterRegistry.counter("cache.events.received");
    this.echoSkippedCounter = meterRegistry.counter("cache.events.echo_skipped");
    this.publishRejectedCounter = meterRegistry.counter("cache.events.publish_rejected");

    adapter.setEvictionListener(this::onEviction);
  }

  public static Builder builder() {
    return new Builder();
  }

  // ==================== Lifecycle ====================

  /** 어댑터/PubSub 연결 후 이벤트 채널 패턴을 구독합니다. */
  public void start() {
    adapter.connect();
    if (pubSub == null) {
      log.info("[CacheService] Started in local mode");
      return;
    }
    pubSub.connect();
    remoteSubscription.set(pubSub.subscribe(channelPattern, this::onRemoteEvent));
    log.info(
        "[CacheService] Started: originId={}, channelPattern={}", originId, channelPattern);
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    Subscription subscription = remoteSubscription.getAndSet(null);
    if (subscription != null) {
      subscription.unsubscribe();
    }
    if (ownsPublishExecutor) {
      shutdownPublisher();
    }
    if (pubSub != null) {
      pubSub.disconnect();
    }
    adapter.disconnect();
    log.info("[CacheService] Closed: originId={}", originId);
  }

  // ==================== Reads ====================

  public String get(String key) {
    return adapter.get(key);
  }

  public List<String> mget(List<String> keys) {
    return adapter.mget(keys);
  }

  public List<String> keys(String pattern) {
    return adapter.keys(pattern);
  }

  public CacheStats getStats() {
    return adapter.getStats();
  }

  public Optional<Duration> ttl(String key) {
    return adapter.ttl(key);
  }

  public HealthStatus healthCheck() {
    return adapter.healthCheck();
  }

  // ==================== Mutations ====================

  public void set(String key, String value) {
    set(key, value, null);
  }

  public void set(String key, String value, Duration ttl) {
    CacheKeyValidator.validateKey(key);
    mutate(
        List.of(key),
        staged -> {
          adapter.set(key, value, ttl);
          stage(staged, seq -> CacheChangeEvent.set(key, value, now(), originId, seq));
          return null;
        });
  }

  public boolean delete(String key) {
    CacheKeyValidator.validateKey(key);
    return mutate(
        List.of(key),
        staged -> {
          boolean existed = adapter.delete(key);
          if (existed) {
            stage(staged, seq -> CacheChangeEvent.delete(key, now(), originId, seq));
          }
          return existed;
        });
  }

  /** 항목마다 SET 이벤트 1건. 같은 배치의 이벤트는 timestamp를 공유하고 sequence는 연속으로 증가합니다. */
  public void mset(List<CacheWrite> entries) {
    CacheKeyValidator.validateWrites(entries);
    List<String> keys = entries.stream().map(CacheWrite::key).toList();
    mutate(
        keys,
        staged -> {
          adapter.mset(entries);
          Instant timestamp = now();
          sequenceLock.lock();
          try {
            for (CacheWrite entry : entries) {
              stage(
                  staged,
                  seq -> CacheChangeEvent.set(entry.key(), entry.value(), timestamp, originId, seq));
            }
          } finally {
            sequenceLock.unlock();
          }
          return null;
        });
  }

  /**
   * 패턴에 맞는 키 삭제
   *
   * <p>삭제 전 {@code keys(pattern)} 스냅샷을 잡고, 1건 이상 삭제되었으면 스냅샷의 키마다 DELETE 이벤트를 발생시킵니다.
   *
   * @return 삭제된 엔트리 수
   */
  public long clear(String pattern) {
    List<String> snapshot = adapter.keys(pattern);
    return mutate(
        snapshot,
        staged -> {
          long removed = adapter.clear(pattern);
          if (removed > 0) {
            Instant timestamp = now();
            sequenceLock.lock();
            try {
              for (String key : snapshot) {
                stage(staged, seq -> CacheChangeEvent.delete(key, timestamp, originId, seq));
              }
            } finally {
              sequenceLock.unlock();
            }
          }
          return removed;
        });
  }

  // ==================== Watch ====================

  /** 정확히 일치하는 키의 변경만 수신합니다. */
  public Subscription watch(String key, CacheWatchHandler handler) {
    return watchers.register(KeyMatcher.exact(key), handler);
  }

  /** 정규식에 매칭되는(find) 키의 변경을 수신합니다. */
  public Subscription watch(Pattern pattern, CacheWatchHandler handler) {
    return watchers.register(KeyMatcher.pattern(pattern), handler);
  }

  public String getOriginId() {
    return originId;
  }

  // ==================== Internals ====================

  void onRemoteEvent(CacheChangeEvent event) {
    if (event.isFrom(originId)) {
      echoSkippedCounter.increment();
      log.trace("[CacheService] Skipping self-published event: key={}", event.key());
      return;
    }
    receivedCounter.increment();
    log.debug(
        "[CacheService] Remote event: type={}, key={}, origin={}, seq={}",
        event.type(),
        event.key(),
        event.originId(),
        event.sequence());
    watchers.dispatch(event);
  }

  private void onEviction(String key) {
    List<StagedEvent> current = inFlight.get();
    if (current != null) {
      stage(current, seq -> CacheChangeEvent.eviction(key, now(), originId, seq));
      return;
    }
    List<StagedEvent> staged = new ArrayList<>(1);
    stage(staged, seq -> CacheChangeEvent.eviction(key, now(), originId, seq));
    deliver(staged);
  }

  /**
   * 키 잠금 아래에서 변경을 적용하고, 잠금을 푼 뒤 로컬 watcher에 전달합니다.
   *
   * <p>같은 키에 대한 변경은 키 잠금으로 직렬화되므로 sequence 순서가 어댑터 적용 순서와 같습니다. 핸들러는 잠금 밖에서 실행되어 다른 키를
   * 변경해도 교착되지 않습니다.
   */
  private <T> T mutate(List<String> keys, Mutation<T> mutation) {
    List<Lock> locks = new ArrayList<>();
    keyLocks.bulkGet(keys).forEach(locks::add);
    List<StagedEvent> staged = new ArrayList<>();
    List<StagedEvent> outer = inFlight.get();
    locks.forEach(Lock::lock);
    inFlight.set(staged);
    try {
      return mutation.apply(staged);
    } finally {
      if (outer == null) {
        inFlight.remove();
      } else {
        inFlight.set(outer);
      }
      for (int i = locks.size() - 1; i >= 0; i--) {
        locks.get(i).unlock();
      }
      deliver(staged);
    }
  }

  /** sequence 부여와 발행 대기열 등록을 하나의 잠금 아래에서 수행합니다. */
  private void stage(List<StagedEvent> staged, LongFunction<CacheChangeEvent> factory) {
    sequenceLock.lock();
    try {
      StagedEvent event = new StagedEvent(factory.apply(nextSequence()));
      if (pubSub != null && !closed.get()) {
        outbox.addLast(event);
      }
      staged.add(event);
    } finally {
      sequenceLock.unlock();
    }
  }

  private void deliver(List<StagedEvent> staged) {
    if (staged.isEmpty()) {
      return;
    }
    try {
      for (StagedEvent event : staged) {
        watchers.dispatch(event.event);
        event.dispatched = true;
      }
    } finally {
      staged.forEach(event -> event.dispatched = true);
      drainOutbox();
    }
  }

  /**
   * 로컬 전달이 끝난 이벤트를 sequence 순서대로 발행 스레드에 넘깁니다.
   *
   * <p>앞선 이벤트의 로컬 전달이 끝나지 않았으면 뒤의 이벤트도 대기합니다.
   */
  private void drainOutbox() {
    if (pubSub == null) {
      return;
    }
    sequenceLock.lock();
    try {
      while (!outbox.isEmpty() && outbox.peekFirst().dispatched) {
        publishAsync(outbox.pollFirst().event);
      }
    } finally {
      sequenceLock.unlock();
    }
  }

  private void publishAsync(CacheChangeEvent event) {
    if (closed.get()) {
      return;
    }
    try {
      publishExecutor.execute(
          () ->
              executor.executeOrDefault(
                  () -> {
                    pubSub.publish(channelPattern, event);
                    return Boolean.TRUE;
                  },
                  Boolean.FALSE,
                  TaskContext.of(COMPONENT, "publish", event.key())));
    } catch (RejectedExecutionException e) {
      publishRejectedCounter.increment();
      log.warn("[CacheService] Publish rejected: key={}, seq={}", event.key(), event.sequence());
    }
  }

  private void shutdownPublisher() {
    publishExecutor.shutdown();
    try {
      if (!publishExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("[CacheService] Publisher did not drain in time, dropping pending events");
        publishExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      publishExecutor.shutdownNow();
    }
  }

  private long nextSequence() {
    return sequence.incrementAndGet();
  }

  @FunctionalInterface
  private interface Mutation<T> {
    T apply(List<StagedEvent> staged);
  }

  private static final class StagedEvent {
    private final CacheChangeEvent event;
    private volatile boolean dispatched;

    private StagedEvent(CacheChangeEvent event) {
      this.event = event;
    }
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  /** {@link CacheService} 조립기. adapter와 executor는 필수, PubSub을 지정하면 originId도 필수입니다. */
  public static final class Builder {
    private CacheAdapter adapter;
    private CachePubSub pubSub;
    private String originId;
    private String channelPattern = DEFAULT_CHANNEL_PATTERN;
    private LogicExecutor executor;
    private ExecutorService publishExecutor;
    private MeterRegistry meterRegistry = new SimpleMeterRegistry();
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    public Builder adapter(CacheAdapter adapter) {
      this.adapter = adapter;
      return this;
    }

    public Builder pubSub(CachePubSub pubSub) {
      this.pubSub = pubSub;
      return this;
    }

    public Builder originId(String originId) {
      this.originId = originId;
      return this;
    }

    public Builder channelPattern(String channelPattern) {
      this.channelPattern = Objects.requireNonNull(channelPattern, "channelPattern");
      return this;
    }

    public Builder executor(LogicExecutor executor) {
      this.executor = executor;
      return this;
    }

    /** 발행 스레드. 지정하지 않으면 내부 단일 스레드를 만들고 close 시 종료합니다. */
    public Builder publishExecutor(ExecutorService publishExecutor) {
      this.publishExecutor = publishExecutor;
      return this;
    }

    public Builder meterRegistry(MeterRegistry meterRegistry) {
      this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public CacheService build() {
      return new CacheService(this);
    }
  }
}
