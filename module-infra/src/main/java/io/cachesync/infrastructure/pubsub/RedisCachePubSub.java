package io.cachesync.infrastructure.pubsub;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.cachesync.common.executor.LogicExecutor;
import io.cachesync.common.executor.TaskContext;
import io.cachesync.common.executor.strategy.ExceptionTranslator;
import io.cachesync.core.domain.CacheChangeEvent;
import io.cachesync.core.port.CachePubSub;
import io.cachesync.core.port.Subscription;
import io.cachesync.error.exception.CacheConnectionException;
import io.cachesync.error.exception.CacheEventCodecException;
import io.cachesync.error.exception.CacheOperationException;
import io.cachesync.error.exception.base.BaseException;
import io.cachesync.infrastructure.redis.RedisConnectionSettings;
import io.cachesync.infrastructure.redis.RedissonClientFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RPatternTopic;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisConnectionException;
import org.redisson.client.codec.StringCodec;
import org.redisson.config.Config;
import org.redisson.connection.ConnectionListener;

/**
 * Redis Pub/Sub 기반 캐시 이벤트 채널 (Redisson)
 *
 * <h3>연결 분리</h3>
 *
 * <p>구독 중인 연결은 일반 명령을 보낼 수 없으므로 발행용/구독용 RedissonClient를 각각 생성합니다.
 *
 * <h3>구독 관리</h3>
 *
 * <ul>
 *   <li>패턴별 핸들러 목록을 유지. 첫 핸들러 등록 시에만 PSUBSCRIBE
 *   <li>마지막 핸들러가 해제되면 PUNSUBSCRIBE 후 패턴 제거
 *   <li>구독 연결이 끊겼다가 다시 연결되면 활성 패턴 전체를 다시 구독
 * </ul>
 *
 * <h3>수신</h3>
 *
 * <p>역직렬화 실패 메시지는 WARN 로그 후 폐기합니다. 핸들러 호출은 {@link LogicExecutor#executeOrDefault}로 각각 격리합니다.
 *
 * <h3>메트릭</h3>
 *
 * <ul>
 *   <li>{@code cache.pubsub.published{status=success|failure}}
 *   <li>{@code cache.pubsub.received}, {@code cache.pubsub.dropped}
 * </ul>
 */
@Slf4j
public class RedisCachePubSub implements CachePubSub {

  private static final String COMPONENT = "CachePubSub";
  static final String PUBLISHER_NAME = "cache-sync-publisher";
  static final String SUBSCRIBER_NAME = "cache-sync-subscriber";

  private final RedisConnectionSettings settings;
  private final RedissonClientFactory clientFactory;
  private final CacheEventCodec codec;
  private final LogicExecutor executor;

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, PatternSubscription> subscriptions = new LinkedHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final ExecutorService resubscribeExecutor;

  private volatile RedissonClient publisher;
  private volatile RedissonClient subscriber;

  private final Counter publishSuccessCounter;
  private final Counter publishFailureCounter;
  private final Counter receivedCounter;
  private final Counter droppedCounter;

  public RedisCachePubSub(
      RedisConnectionSettings settings,
      RedissonClientFactory clientFactory,
      CacheEventCodec codec,
      LogicExecutor executor,
      MeterRegistry meterRegistry) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.resubscribeExecutor =
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("cache-sync-resubscribe-%d")
                .setDaemon(true)
                .build());

    this.publishSuccessCounter =
        Counter.builder("cache.pubsub.published").tag("status", "success").register(meterRegistry);
    this.publishFailureCounter =
        Counter.builder("cache.pubsub.published").tag("status", "failure").register(meterRegistry);
    this.receivedCounter = meterRegistry.counter("cache.pubsub.received");
    this.droppedCounter = meterRegistry.counter("cache.pubsub.dropped");
  }

  // ==================== Lifecycle ====================

  @Override
  public void connect() {
    ensureOpen();
    lock.lock();
    try {
      if (subscriber != null) {
        return;
      }
      int attempt = 0;
      while (true) {
        attempt++;
        try {
          executor.executeWithTranslation(
              () -> {
                createClients();
                return null;
              },
              connectionTranslator("connect failed"),
              TaskContext.of(COMPONENT, "connect", settings.address()));
          break;
        } catch (CacheConnectionException e) {
          Long delay = settings.retryStrategy().nextDelayMillis(attempt);
          if (delay == null || closed.get()) {
            log.error(
                "[CachePubSub] Connect failed after {} attempts: {} ({})",
                attempt,
                settings,
                e.getMessage());
            throw e;
          }
          log.warn(
              "[CachePubSub] Connect attempt {} failed, retrying in {}ms: {}",
              attempt,
              delay,
              e.getMessage());
          sleep(delay);
        }
      }

      subscriptions.values().forEach(ps -> ps.attach(subscriber));
      log.info(
          "[CachePubSub] Connected: {}, patterns={}", settings, subscriptions.keySet());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void disconnect() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    lock.lock();
    try {
      subscriptions.values().forEach(PatternSubscription::detach);
      subscriptions.clear();
      shutdown(subscriber);
      shutdown(publisher);
      subscriber = null;
      publisher = null;
    } finally {
      lock.unlock();
    }
    resubscribeExecutor.shutdownNow();
    log.info("[CachePubSub] Disconnected: {}", settings);
  }

  // ==================== Publish ====================

  /**
   * 패턴에서 파생된 구체 채널로 JSON 메시지를 발행합니다.
   *
   * @throws CacheConnectionException 연결되지 않았거나 전송 오류
   * @throws CacheOperationException 발행 명령 실패
   */
  @Override
  public void publish(String pattern, CacheChangeEvent event) {
    String channel = ChannelNames.forPattern(pattern);
    try {
      long receivers =
          executor.executeWithTranslation(
              () -> {
                String message = codec.encode(event);
                return requirePublisher().getTopic(channel, StringCodec.INSTANCE).publish(message);
              },
              commandTranslator("publish", channel),
              TaskContext.of(COMPONENT, "publish", channel));
      publishSuccessCounter.increment();
      log.debug(
          "[CachePubSub] Published: channel={}, type={}, key={}, receivers={}",
          channel,
          event.type(),
          event.key(),
          receivers);
    } catch (RuntimeException e) {
      publishFailureCounter.increment();
      throw e;
    }
  }

  // ==================== Subscribe ====================

  @Override
  public Subscription subscribe(String pattern, Consumer<CacheChangeEvent> handler) {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(handler, "handler");
    ensureOpen();

    lock.lock();
    try {
      PatternSubscription ps = subscriptions.get(pattern);
      if (ps == null) {
        ps = new PatternSubscription(pattern);
        subscriptions.put(pattern, ps);
        if (subscriber != null) {
          ps.attach(subscriber);
        }
      }
      HandlerRegistration registration = new HandlerRegistration(ps, handler);
      ps.handlers.add(registration);
      return registration;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Set<String> activePatterns() {
    lock.lock();
    try {
      return Set.copyOf(subscriptions.keySet());
    } finally {
      lock.unlock();
    }
  }

  /** 구독 연결 복구 후 활성 패턴 전체를 다시 PSUBSCRIBE 합니다. */
  void resubscribeActivePatterns() {
    lock.lock();
    try {
      if (closed.get() || subscriber == null) {
        return;
      }
      for (PatternSubscription ps : subscriptions.values()) {
        ps.detach();
        ps.attach(subscriber);
      }
      log.info("[CachePubSub] Resubscribed patterns: {}", subscriptions.keySet());
    } finally {
      lock.unlock();
    }
  }

  private void onMessage(PatternSubscription ps, CharSequence channel, String message) {
    CacheChangeEvent event;
    try {
      event = codec.decode(message);
    } catch (CacheEventCodecException e) {
      droppedCounter.increment();
      log.warn(
          "[CachePubSub] Dropping undecodable message: channel={}, reason={}",
          channel,
          e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
      return;
    }

    receivedCounter.increment();
    for (HandlerRegistration registration : ps.handlers) {
      executor.executeOrDefault(
          () -> {
            registration.handler.accept(event);
            return Boolean.TRUE;
          },
          Boolean.FALSE,
          TaskContext.of(COMPONENT, "deliver", String.valueOf(channel)));
    }
  }

  // ==================== Helpers ====================

  private RedissonClient requirePublisher() {
    RedissonClient current = publisher;
    if (current == null) {
      throw new CacheConnectionException(settings.host(), settings.port(), "publisher not connected");
    }
    return current;
  }

  /** 발행/구독 클라이언트를 함께 생성합니다. 구독 클라이언트 생성이 실패하면 먼저 만든 발행 클라이언트를 종료합니다. */
  private void createClients() {
    RedissonClient createdPublisher =
        clientFactory.create(RedissonClientFactory.singleServerConfig(settings, PUBLISHER_NAME));
    RedissonClient createdSubscriber;
    try {
      Config subscriberConfig = RedissonClientFactory.singleServerConfig(settings, SUBSCRIBER_NAME);
      subscriberConfig.setConnectionListener(new ResubscribeOnReconnect());
      createdSubscriber = clientFactory.create(subscriberConfig);
    } catch (RuntimeException e) {
      shutdown(createdPublisher);
      throw e;
    }
    publisher = createdPublisher;
    subscriber = createdSubscriber;
  }

  private void sleep(long delayMillis) {
    try {
      TimeUnit.MILLISECONDS.sleep(delayMillis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CacheConnectionException(
          settings.host(), settings.port(), "interrupted while waiting to retry", e);
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new CacheConnectionException(
          settings.host(), settings.port(), "pub/sub channel has been disconnected");
    }
  }

  private ExceptionTranslator connectionTranslator(String reason) {
    return e -> {
      if (e instanceof BaseException be) {
        return be;
      }
      return new CacheConnectionException(
          settings.host(), settings.port(), reason + ": " + e.getMessage(), e);
    };
  }

  private ExceptionTranslator commandTranslator(String method, String channel) {
    return e -> {
      if (e instanceof BaseException be) {
        return be;
      }
      if (e instanceof RedisConnectionException) {
        return new CacheConnectionException(settings.host(), settings.port(), e.getMessage(), e);
      }
      return new CacheOperationException(method, channel, null, e);
    };
  }

  private void shutdown(RedissonClient client) {
    if (client != null && !client.isShutdown()) {
      client.shutdown();
    }
  }

  /** 패턴 하나에 대한 Redis 구독과 핸들러 목록 */
  private final class PatternSubscription {
    private final String pattern;
    private final List<HandlerRegistration> handlers = new CopyOnWriteArrayList<>();
    private RPatternTopic topic;
    private Integer listenerId;

    private PatternSubscription(String pattern) {
      this.pattern = pattern;
    }

    private void attach(RedissonClient client) {
      topic = client.getPatternTopic(pattern, StringCodec.INSTANCE);
      listenerId =
          topic.addListener(
              String.class, (matched, channel, message) -> onMessage(this, channel, message));
      log.debug("[CachePubSub] PSUBSCRIBE {}", pattern);
    }

    private void detach() {
      if (topic == null || listenerId == null) {
        return;
      }
      topic.removeListener(listenerId);
      log.debug("[CachePubSub] PUNSUBSCRIBE {}", pattern);
      topic = null;
      listenerId = null;
    }
  }

  private final class HandlerRegistration implements Subscription {
    private final PatternSubscription owner;
    private final Consumer<CacheChangeEvent> handler;
    private final AtomicBoolean active = new AtomicBoolean(true);

    private HandlerRegistration(PatternSubscription owner, Consumer<CacheChangeEvent> handler) {
      this.owner = owner;
      this.handler = handler;
    }

    @Override
    public void unsubscribe() {
      if (!active.compareAndSet(true, false)) {
        return;
      }
      lock.lock();
      try {
        owner.handlers.remove(this);
        if (owner.handlers.isEmpty() && subscriptions.get(owner.pattern) == owner) {
          subscriptions.remove(owner.pattern);
          owner.detach();
        }
      } finally {
        lock.unlock();
      }
    }

    @Override
    public boolean isActive() {
      return active.get();
    }
  }

  /** Redisson 이벤트 루프에서 호출되므로 재구독은 별도 스레드에서 수행합니다. */
  private final class ResubscribeOnReconnect implements ConnectionListener {
    private final AtomicBoolean lostConnection = new AtomicBoolean(false);

    @Override
    public void onConnect(InetSocketAddress addr) {
      if (!lostConnection.compareAndSet(true, false)) {
        return;
      }
      log.info("[CachePubSub] Subscriber reconnected to {}, scheduling resubscribe", addr);
      try {
        resubscribeExecutor.execute(RedisCachePubSub.this::resubscribeActivePatterns);
      } catch (RejectedExecutionException e) {
        log.debug("[CachePubSub] Resubscribe skipped, channel closed");
      }
    }

    @Override
    public void onDisconnect(InetSocketAddress addr) {
      lostConnection.set(true);
      log.warn("[CachePubSub] Subscriber connection lost: {}", addr);
    }
  }
}
