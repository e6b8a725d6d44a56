package io.cachesync.infrastructure.redis;

import io.cachesync.common.executor.LogicExecutor;
import io.cachesync.common.executor.TaskContext;
import io.cachesync.core.domain.CacheStats;
import io.cachesync.core.domain.CacheWrite;
import io.cachesync.core.domain.HealthStatus;
import io.cachesync.core.port.CacheAdapter;
import io.cachesync.core.support.CacheKeyValidator;
import io.cachesync.error.exception.CacheConnectionException;
import io.cachesync.error.exception.marker.CircuitBreakerIgnoreMarker;
import io.cachesync.error.exception.marker.CircuitBreakerRecordMarker;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.BatchOptions;
import org.redisson.api.RBatch;
import org.redisson.api.RBucket;
import org.redisson.api.RBucketAsync;
import org.redisson.api.RedissonClient;
import org.redisson.api.redisnode.RedisMaster;
import org.redisson.api.redisnode.RedisNode;
import org.redisson.api.redisnode.RedisNodes;
import org.redisson.client.RedisConnectionException;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;
import org.redisson.config.Config;

/**
 * Redis 캐시 어댑터 (Redisson)
 *
 * <h3>검증</h3>
 *
 * <p>모든 네트워크 호출 전에 키(빈 문자열/공백 불가)와 TTL(음수 불가)을 검증합니다. 위반 시 {@code CacheValidationException}.
 *
 * <h3>연결 상태 머신</h3>
 *
 * <ul>
 *   <li>{@link #connect()}: DISCONNECTED → CONNECTING → CONNECTED. 실패 시 RetryStrategy에 따라 재시도
 *   <li>명령 중 전송 오류({@link RedisConnectionException}): CONNECTED → RECONNECTING, 재연결 성공 시 명령 1회 재실행
 *   <li>RetryStrategy가 중단을 반환하면 DISCONNECTED, 진행 중인 호출자에게 {@code CacheConnectionException}
 *   <li>{@link #disconnect()}: 종료 상태이며 여러 번 호출해도 안전
 * </ul>
 *
 * <h3>장애 격리</h3>
 *
 * <p>명령은 Resilience4j {@link CircuitBreaker}를 거칩니다. 서킷이 열리면 즉시 {@code CacheConnectionException}으로
 * 실패합니다.
 */
@Slf4j
public class RedisCacheAdapter implements CacheAdapter {

  private static final String COMPONENT = "RedisCache";
  private static final String CLIENT_NAME = "cache-sync-adapter";
  private static final long MAX_TTL_MILLIS = Long.MAX_VALUE / 2;

  private final RedisConnectionSettings settings;
  private final RedissonClientFactory clientFactory;
  private final LogicExecutor executor;
  private final CircuitBreaker circuitBreaker;
  private final Clock clock;
  private final long startedAt;

  private final AtomicReference<ConnectionState> state =
      new AtomicReference<>(ConnectionState.DISCONNECTED);
  private final AtomicBoolean terminated = new AtomicBoolean(false);
  private final ReentrantLock connectionLock = new ReentrantLock();
  private volatile RedissonClient client;

  private final LongAdder hits = new LongAdder();
  private final LongAdder misses = new LongAdder();

  public RedisCacheAdapter(RedisConnectionSettings settings, LogicExecutor executor) {
    this(
        settings,
        RedissonClientFactory.defaultFactory(),
        executor,
        defaultCircuitBreaker(),
        Clock.systemUTC());
  }

  public RedisCacheAdapter(
      RedisConnectionSettings settings,
      RedissonClientFactory clientFactory,
      LogicExecutor executor,
      CircuitBreaker circuitBreaker,
      Clock clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.startedAt = clock.millis();
  }

  /** 연속 5회 호출 중 50% 이상 실패 시 30초간 오픈. */
  public static CircuitBreaker defaultCircuitBreaker() {
    return circuitBreaker(50, 5, Duration.ofSeconds(30));
  }

  /**
   * Redis 명령용 서킷 브레이커
   *
   * <p>Redisson 예외와 {@link CircuitBreakerRecordMarker} 예외만 실패로 기록하고, {@link
   * CircuitBreakerIgnoreMarker} 예외(호출자 입력 오류)는 집계에서 제외합니다. 그 외 예외는 성공으로 집계됩니다.
   */
  public static CircuitBreaker circuitBreaker(
      float failureRateThreshold, int slidingWindowSize, Duration waitDurationInOpenState) {
    return CircuitBreaker.of(
        "redisCache",
        CircuitBreakerConfig.custom()
            .failureRateThreshold(failureRateThreshold)
            .slidingWindowSize(slidingWindowSize)
            .minimumNumberOfCalls(slidingWindowSize)
            .waitDurationInOpenState(waitDurationInOpenState)
            .permittedNumberOfCallsInHalfOpenState(1)
            .recordException(e -> e instanceof CircuitBreakerRecordMarker || e instanceof RedisException)
            .ignoreException(e -> e instanceof CircuitBreakerIgnoreMarker)
            .build());
  }

  public ConnectionState getState() {
    return state.get();
  }

  // ==================== Lifecycle ====================

  @Override
  public void connect() {
    ensureNotTerminated();
    connectionLock.lock();
    try {
      if (state.get() == ConnectionState.CONNECTED) {
        return;
      }
      state.set(ConnectionState.CONNECTING);
      log.info("[RedisCache] Connecting: {}", settings);
      establish("Connect");
      state.set(ConnectionState.CONNECTED);
      log.info("[RedisCache] Connected: {}", settings);
    } finally {
      connectionLock.unlock();
    }
  }

  @Override
  public void disconnect() {
    if (!terminated.compareAndSet(false, true)) {
      return;
    }
    connectionLock.lock();
    try {
      RedissonClient current = client;
      client = null;
      if (current != null && !current.isShutdown()) {
        current.shutdown();
      }
      state.set(ConnectionState.DISCONNECTED);
      log.info("[RedisCache] Disconnected: {}", settings);
    } finally {
      connectionLock.unlock();
    }
  }

  // ==================== Reads ====================

  @Override
  public String get(String key) {
    CacheKeyValidator.validateKey(key);
    String value = execute("get", key, null, () -> bucket(key).get());
    record(value);
    return value;
  }

  @Override
  public List<String> mget(List<String> keys) {
    CacheKeyValidator.validateKeys(keys);
    if (keys.isEmpty()) {
      return List.of();
    }
    Map<String, String> found =
        execute(
            "mget",
            String.join(",", keys),
            null,
            () -> client().getBuckets(StringCodec.INSTANCE).get(keys.toArray(new String[0])));

    List<String> values = new ArrayList<>(keys.size());
    for (String key : keys) {
      String value = found.get(key);
      record(value);
      values.add(value);
    }
    return values;
  }

  @Override
  public List<String> keys(String pattern) {
    String glob = pattern == null || pattern.isEmpty() ? "*" : pattern;
    return execute(
        "keys",
        glob,
        null,
        () -> {
          List<String> result = new ArrayList<>();
          client().getKeys().getKeysByPattern(glob).forEach(result::add);
          return result;
        });
  }

  @Override
  public Optional<Duration> ttl(String key) {
    CacheKeyValidator.validateKey(key);
    long remaining = execute("ttl", key, null, () -> bucket(key).remainTimeToLive());
    // -2: 키 없음, -1: 만료 없음
    return remaining < 0 ? Optional.empty() : Optional.of(Duration.ofMillis(remaining));
  }

  /** 로컬 hit/miss 카운터와 INFO(memory/stats/keyspace) 보고값을 합칩니다. */
  @Override
  public CacheStats getStats() {
    return execute(
        "getStats",
        null,
        null,
        () -> {
          RedisMaster node = client().getRedisNodes(RedisNodes.SINGLE).getInstance();
          Map<String, String> memory = node.info(RedisNode.InfoSection.MEMORY);
          Map<String, String> stats = node.info(RedisNode.InfoSection.STATS);
          Map<String, String> keyspace = node.info(RedisNode.InfoSection.KEYSPACE);
          return new CacheStats(
              hits.sum(),
              misses.sum(),
              RedisInfoParser.evictedKeys(stats),
              RedisInfoParser.usedMemory(memory),
              RedisInfoParser.keyCount(keyspace, settings.database()),
              Duration.ofMillis(clock.millis() - startedAt));
        });
  }

  @Override
  public HealthStatus healthCheck() {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("host", settings.host());
    details.put("port", settings.port());
    details.put("database", settings.database());
    details.put("state", state.get().name());

    RedissonClient current = client;
    if (terminated.get() || current == null) {
      details.put("connected", false);
      return HealthStatus.unhealthy("Redis adapter is not connected", details);
    }

    long start = System.nanoTime();
    boolean pong =
        executor.executeOrDefault(
            () -> ping(current), false, TaskContext.of(COMPONENT, "healthCheck"));
    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    details.put("connected", pong);
    details.put("latencyMs", latencyMs);
    return pong
        ? HealthStatus.healthy("Redis connection healthy", details)
        : HealthStatus.unhealthy("Redis did not answer PING", details);
  }

  // ==================== Mutations ====================

  @Override
  public void set(String key, String value, Duration ttl) {
    CacheKeyValidator.validateKey(key);
    CacheKeyValidator.validateTtl(key, ttl);
    Objects.requireNonNull(value, "value");
    Duration effectiveTtl = effectiveTtl(ttl);

    execute(
        "set",
        key,
        effectiveTtl,
        () -> {
          RBucket<String> bucket = bucket(key);
          if (expires(effectiveTtl)) {
            bucket.set(value, ttlMillis(effectiveTtl), TimeUnit.MILLISECONDS);
          } else {
            bucket.set(value);
          }
          return null;
        });
  }

  @Override
  public boolean delete(String key) {
    CacheKeyValidator.validateKey(key);
    long removed = execute("delete", key, null, () -> client().getKeys().delete(key));
    return removed > 0;
  }

  /** 파이프라인(RBatch)으로 전송합니다. 키 간 원자성은 없습니다. */
  @Override
  public void mset(List<CacheWrite> entries) {
    CacheKeyValidator.validateWrites(entries);
    entries.forEach(e -> Objects.requireNonNull(e.value(), "value"));
    if (entries.isEmpty()) {
      return;
    }

    execute(
        "mset",
        entries.size() + " entries",
        null,
        () -> {
          RBatch batch = client().createBatch(BatchOptions.defaults());
          for (CacheWrite entry : entries) {
            RBucketAsync<String> bucket = batch.getBucket(entry.key(), StringCodec.INSTANCE);
            Duration ttl = effectiveTtl(entry.ttl());
            if (expires(ttl)) {
              bucket.setAsync(entry.value(), ttlMillis(ttl), TimeUnit.MILLISECONDS);
            } else {
              bucket.setAsync(entry.value());
            }
          }
          batch.execute();
          return null;
        });
  }

  @Override
  public long clear(String pattern) {
    String glob = pattern == null || pattern.isEmpty() ? "*" : pattern;
    long removed = execute("clear", glob, null, () -> client().getKeys().deleteByPattern(glob));
    log.debug("[RedisCache] Cleared {} keys: pattern={}", removed, glob);
    return removed;
  }

  // ==================== Command execution ====================

  private <T> T execute(String method, String key, Duration ttl, Supplier<T> command) {
    ensureConnected();
    return executor.executeWithTranslation(
        () -> invokeWithReconnect(command),
        RedisCommandTranslator.of(settings, method, key, ttl),
        TaskContext.of(COMPONENT, method, key));
  }

  private <T> T invokeWithReconnect(Supplier<T> command) {
    try {
      return circuitBreaker.executeSupplier(command);
    } catch (RedisConnectionException e) {
      reconnect(e);
      return circuitBreaker.executeSupplier(command);
    }
  }

  private void ensureConnected() {
    ensureNotTerminated();
    if (state.get() != ConnectionState.CONNECTED) {
      connect();
    }
  }

  private void ensureNotTerminated() {
    if (terminated.get()) {
      throw new CacheConnectionException(
          settings.host(), settings.port(), "adapter has been disconnected");
    }
  }

  private void reconnect(RedisConnectionException cause) {
    connectionLock.lock();
    try {
      ensureNotTerminated();
      state.set(ConnectionState.RECONNECTING);
      log.warn("[RedisCache] Transport error, reconnecting: {}", cause.getMessage());
      establish("Reconnect");
      state.set(ConnectionState.CONNECTED);
      log.info("[RedisCache] Reconnected: {}", settings);
    } finally {
      connectionLock.unlock();
    }
  }

  /**
   * PING이 성공할 때까지 RetryStrategy에 따라 시도합니다. 클라이언트가 이미 있으면 재사용합니다 (Redisson이 내부적으로 재연결).
   *
   * @throws CacheConnectionException 전략이 중단을 반환한 경우. 상태는 DISCONNECTED
   */
  private void establish(String phase) {
    int attempt = 0;
    while (true) {
      attempt++;
      RuntimeException failure = null;
      String reason;
      try {
        RedissonClient candidate = currentOrCreate();
        if (ping(candidate)) {
          client = candidate;
          return;
        }
        reason = "PING did not return PONG";
      } catch (RuntimeException e) {
        failure = e;
        reason = e.getMessage();
      }

      Long delay = settings.retryStrategy().nextDelayMillis(attempt);
      if (delay == null || terminated.get()) {
        state.set(ConnectionState.DISCONNECTED);
        log.error(
            "[RedisCache] {} failed after {} attempts: {} ({})", phase, attempt, settings, reason);
        throw new CacheConnectionException(settings.host(), settings.port(), reason, failure);
      }
      log.warn(
          "[RedisCache] {} attempt {} failed, retrying in {}ms: {}", phase, attempt, delay, reason);
      sleep(delay);
    }
  }

  private RedissonClient currentOrCreate() {
    RedissonClient current = client;
    if (current != null && !current.isShutdown()) {
      return current;
    }
    Config config = RedissonClientFactory.singleServerConfig(settings, CLIENT_NAME);
    RedissonClient created = clientFactory.create(config);
    client = created;
    return created;
  }

  private boolean ping(RedissonClient target) {
    return target
        .getRedisNodes(RedisNodes.SINGLE)
        .getInstance()
        .ping(settings.commandTimeout().toMillis(), TimeUnit.MILLISECONDS);
  }

  private void sleep(long delayMillis) {
    try {
      TimeUnit.MILLISECONDS.sleep(delayMillis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      state.set(ConnectionState.DISCONNECTED);
      throw new CacheConnectionException(
          settings.host(), settings.port(), "interrupted while waiting to retry", e);
    }
  }

  // ==================== Helpers ====================

  private RedissonClient client() {
    RedissonClient current = client;
    if (current == null) {
      throw new CacheConnectionException(settings.host(), settings.port(), "not connected");
    }
    return current;
  }

  private RBucket<String> bucket(String key) {
    return client().getBucket(key, StringCodec.INSTANCE);
  }

  private Duration effectiveTtl(Duration ttl) {
    return ttl != null ? ttl : settings.defaultTtl();
  }

  // PSETEX는 1ms 미만, 그리고 현재 시각 + ttl이 long 범위를 넘는 값을 거부
  static long ttlMillis(Duration ttl) {
    long millis;
    try {
      millis = ttl.toMillis();
    } catch (ArithmeticException e) {
      millis = MAX_TTL_MILLIS;
    }
    return Math.max(1L, Math.min(millis, MAX_TTL_MILLIS));
  }

  private static boolean expires(Duration ttl) {
    return ttl != null && !ttl.isZero();
  }

  private void record(String value) {
    if (value == null) {
      misses.increment();
    } else {
      hits.increment();
    }
  }
}
