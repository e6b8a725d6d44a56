package io.cachesync.core.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.google.common.util.concurrent.MoreExecutors;
import io.cachesync.common.executor.DefaultLogicExecutor;
import io.cachesync.core.domain.CacheChangeEvent;
import io.cachesync.core.domain.CacheWrite;
import io.cachesync.core.domain.ChangeType;
import io.cachesync.core.fixture.StubCacheAdapter;
import io.cachesync.core.port.CachePubSub;
import io.cachesync.core.port.Subscription;
import io.cachesync.error.exception.CacheOperationException;
import io.cachesync.error.exception.CacheValidationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * {@link CacheService} 단위 테스트
 *
 * <h3>검증 항목</h3>
 *
 * <ul>
 *   <li>어댑터 위임 및 round-trip
 *   <li>성공한 변경에만 이벤트 발생 (delete 부재 키, 실패한 set)
 *   <li>mset 배치 이벤트: timestamp 공유, sequence 증가
 *   <li>watch 매칭/해제/핸들러 장애 격리
 *   <li>PubSub 발행: 로컬 전달 후 발행, 발행 실패 무시
 *   <li>원격 이벤트: 에코 억제, 재발행 금지
 * </ul>
 */
@Tag("unit")
@DisplayName("CacheService 단위 테스트")
class CacheServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:15:30.123Z");

  private StubCacheAdapter adapter;
  private SimpleMeterRegistry meterRegistry;
  private CacheService cacheService;
  private List<CacheChangeEvent> received;

  @BeforeEach
  void setUp() {
    adapter = new StubCacheAdapter();
    meterRegistry = new SimpleMeterRegistry();
    cacheService = localService();
    received = new CopyOnWriteArrayList<>();
  }

  @AfterEach
  void tearDown() {
    cacheService.close();
  }

  private CacheService localService() {
    return CacheService.builder()
        .adapter(adapter)
        .executor(new DefaultLogicExecutor(meterRegistry))
        .meterRegistry(meterRegistry)
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
        .build();
  }

  private CacheService distributedService(CachePubSub pubSub, String originId) {
    return CacheService.builder()
        .adapter(adapter)
        .pubSub(pubSub)
        .originId(originId)
        .channelPattern("cache:*")
        .executor(new DefaultLogicExecutor(meterRegistry))
        .publishExecutor(MoreExecutors.newDirectExecutorService())
        .meterRegistry(meterRegistry)
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
        .build();
  }

  @Nested
  @DisplayName("읽기/쓰기 위임")
  class Delegation {

    @Test
    @DisplayName("set 후 get은 같은 값을 반환한다")
    void roundTrip() {
      cacheService.set("user:1", "alice");

      assertThat(cacheService.get("user:1")).isEqualTo("alice");
    }

    @Test
    @DisplayName("mget은 입력 순서대로 값을 반환하고 없는 키는 null이다")
    void mgetKeepsOrder() {
      cacheService.set("a", "1");
      cacheService.set("c", "3");

      assertThat(cacheService.mget(List.of("a", "b", "c"))).containsExactly("1", null, "3");
    }

    @Test
    @DisplayName("읽기 연산은 이벤트를 만들지 않는다")
    void readsDoNotEmit() {
      cacheService.set("a", "1");
      cacheService.watch(Pattern.compile(".*"), received::add);

      cacheService.get("a");
      cacheService.mget(List.of("a"));
      cacheService.keys("*");
      cacheService.getStats();
      cacheService.ttl("a");

      assertThat(received).isEmpty();
    }

    @Test
    @DisplayName("healthCheck는 어댑터 기본 구현으로 healthy를 보고한다")
    void healthFallsBackToAdapterDefault() {
      assertThat(cacheService.healthCheck().healthy()).isTrue();
      assertThat(cacheService.healthCheck().message())
          .isEqualTo("Adapter does not implement healthCheck");
    }

    @Test
    @DisplayName("start/close는 어댑터 연결을 위임한다")
    void lifecycleDelegates() {
      cacheService.start();
      assertThat(adapter.isConnected()).isTrue();

      cacheService.close();
      assertThat(adapter.isConnected()).isFalse();
    }
  }

  @Nested
  @DisplayName("변경 이벤트")
  class Events {

    @Test
    @DisplayName("set은 값과 sequence를 담은 SET 이벤트 1건을 발생시킨다")
    void setEmitsEvent() {
      cacheService.watch("user:1", received::add);

      cacheService.set("user:1", "alice", Duration.ofSeconds(30));

      assertThat(received).hasSize(1);
      CacheChangeEvent event = received.get(0);
      assertThat(event.type()).isEqualTo(ChangeType.SET);
      assertThat(event.value()).isEqualTo("alice");
      assertThat(event.timestamp()).isEqualTo(NOW);
      assertThat(event.sequence()).isEqualTo(1L);
      assertThat(event.originId()).isNull();
    }

    @Test
    @DisplayName("없는 키 delete는 false를 반환하고 이벤트가 없다")
    void deleteAbsent() {
      cacheService.watch(Pattern.compile(".*"), received::add);

      assertThat(cacheService.delete("missing")).isFalse();
      assertThat(received).isEmpty();
    }

    @Test
    @DisplayName("있는 키 delete는 true를 반환하고 DELETE 이벤트 1건을 발생시킨다")
    void deletePresent() {
      cacheService.set("k", "v");
      cacheService.watch("k", received::add);

      assertThat(cacheService.delete("k")).isTrue();

      assertThat(received).singleElement().satisfies(e -> {
        assertThat(e.type()).isEqualTo(ChangeType.DELETE);
        assertThat(e.value()).isNull();
      });
    }

    @Test
    @DisplayName("mset은 항목 수만큼 SET 이벤트를 같은 timestamp, 증가하는 sequence로 발생시킨다")
    void msetEmitsBatch() {
      cacheService.watch(Pattern.compile(".*"), received::add);

      cacheService.mset(
          List.of(CacheWrite.of("k1", "v1"), CacheWrite.of("k2", "v2"), CacheWrite.of("k3", "v3")));

      assertThat(received).hasSize(3);
      assertThat(received).extracting(CacheChangeEvent::key).containsExactly("k1", "k2", "k3");
      assertThat(received).extracting(CacheChangeEvent::timestamp).containsOnly(NOW);
      assertThat(received)
          .extracting(CacheChangeEvent::sequence)
          .isSortedAccordingTo(Long::compare)
          .doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("어댑터 변경이 실패하면 이벤트가 없고 예외가 그대로 전파된다")
    void failedMutationDoesNotEmit() {
      cacheService.watch(Pattern.compile(".*"), received::add);
      CacheOperationException failure =
          new CacheOperationException("set", "k", null, new IllegalStateException("down"));
      adapter.failWith(failure);

      assertThatThrownBy(() -> cacheService.set("k", "v")).isSameAs(failure);
      assertThat(received).isEmpty();
    }

    @Test
    @DisplayName("검증 실패는 이벤트 없이 전파된다")
    void validationFailureDoesNotEmit() {
      cacheService.watch(Pattern.compile(".*"), received::add);

      assertThatThrownBy(() -> cacheService.set(" ", "v"))
          .isInstanceOf(CacheValidationException.class);
      assertThatThrownBy(() -> cacheService.set("k", "v", Duration.ofSeconds(-1)))
          .isInstanceOf(CacheValidationException.class);
      assertThat(received).isEmpty();
    }

    @Test
    @DisplayName("clear는 삭제된 키마다 DELETE 이벤트를 발생시킨다")
    void clearEmitsDeletes() {
      cacheService.set("user:1", "a");
      cacheService.set("user:2", "b");
      cacheService.set("order:1", "c");
      cacheService.watch(Pattern.compile(".*"), received::add);

      long removed = cacheService.clear("user:*");

      assertThat(removed).isEqualTo(2);
      assertThat(received)
          .extracting(CacheChangeEvent::key)
          .containsExactlyInAnyOrder("user:1", "user:2");
      assertThat(received).extracting(CacheChangeEvent::type).containsOnly(ChangeType.DELETE);
      assertThat(cacheService.get("order:1")).isEqualTo("c");
    }

    @Test
    @DisplayName("어댑터 eviction 통지는 EVICTION 이벤트가 된다")
    void evictionBecomesEvent() {
      cacheService.set("old", "v");
      cacheService.watch("old", received::add);

      adapter.evict("old");

      assertThat(received).singleElement().extracting(CacheChangeEvent::type)
          .isEqualTo(ChangeType.EVICTION);
    }
  }

  @Nested
  @DisplayName("watch")
  class Watch {

    @Test
    @DisplayName("정확한 키 watch는 해당 키 이벤트만 받는다")
    void exactMatch() {
      cacheService.watch("user:123", received::add);

      cacheService.set("user:123", "a");
      cacheService.set("user:1234", "b");
      cacheService.set("user:12", "c");

      assertThat(received).extracting(CacheChangeEvent::key).containsExactly("user:123");
    }

    @Test
    @DisplayName("정규식 watch는 매칭되는 키의 이벤트만 받는다")
    void regexMatch() {
      cacheService.watch(Pattern.compile("^user:"), received::add);

      cacheService.set("user:1", "a");
      cacheService.set("order:1", "b");
      cacheService.set("user:2", "c");

      assertThat(received).extracting(CacheChangeEvent::key).containsExactly("user:1", "user:2");
    }

    @Test
    @DisplayName("구독 해제는 해당 핸들러만 멈추고 여러 번 호출해도 안전하다")
    void unsubscribeIsolation() {
      List<CacheChangeEvent> other = new CopyOnWriteArrayList<>();
      Subscription first = cacheService.watch("k", received::add);
      cacheService.watch("k", other::add);

      cacheService.set("k", "1");
      first.unsubscribe();
      first.unsubscribe();
      cacheService.set("k", "2");

      assertThat(first.isActive()).isFalse();
      assertThat(received).hasSize(1);
      assertThat(other).hasSize(2);
    }

    @Test
    @DisplayName("예외를 던지는 핸들러는 다른 핸들러와 변경 호출에 영향을 주지 않는다")
    void handlerFaultIsolation() {
      cacheService.watch(
          "k",
          e -> {
            throw new IllegalStateException("handler bug");
          });
      cacheService.watch("k", received::add);

      assertThatNoException().isThrownBy(() -> cacheService.set("k", "v"));
      assertThat(received).hasSize(1);
      assertThat(cacheService.get("k")).isEqualTo("v");
    }

    @Test
    @DisplayName("핸들러 안에서 구독 해제/추가해도 교착되지 않는다")
    void reentrantRegistration() {
      Subscription[] self = new Subscription[1];
      self[0] =
          cacheService.watch(
              "k",
              e -> {
                self[0].unsubscribe();
                cacheService.watch("k", received::add);
              });

      cacheService.set("k", "1");
      cacheService.set("k", "2");

      assertThat(received).extracting(CacheChangeEvent::value).containsExactly("2");
    }
  }

  @Nested
  @DisplayName("다중 프로세스 전파")
  class Propagation {

    private CachePubSub pubSub;

    @BeforeEach
    void setUp() {
      pubSub = mock(CachePubSub.class);
      given(pubSub.subscribe(anyString(), any())).willReturn(mock(Subscription.class));
    }

    @Test
    @DisplayName("PubSub이 있으면 originId가 필수다")
    void originIdRequired() {
      assertThatThrownBy(() -> distributedService(pubSub, null))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("로컬 watcher 전달이 발행보다 먼저 일어난다")
    void localBeforePublish() {
      List<String> order = new CopyOnWriteArrayList<>();
      willAnswer(
              inv -> {
                order.add("publish");
                return null;
              })
          .given(pubSub)
          .publish(anyString(), any());
      CacheService service = distributedService(pubSub, "A");
      service.watch("k", e -> order.add("local"));

      service.set("k", "v");

      assertThat(order).containsExactly("local", "publish");
      ArgumentCaptor<CacheChangeEvent> captor = ArgumentCaptor.forClass(CacheChangeEvent.class);
      verify(pubSub).publish(eq("cache:*"), captor.capture());
      assertThat(captor.getValue().originId()).isEqualTo("A");
      assertThat(captor.getValue().sequence()).isEqualTo(1L);
    }

    @Test
    @DisplayName("발행 실패는 로그만 남기고 변경을 실패시키지 않는다")
    void publishFailureSwallowed() {
      willThrow(new IllegalStateException("redis down")).given(pubSub).publish(anyString(), any());
      CacheService service = distributedService(pubSub, "A");
      service.watch("k", received::add);

      assertThatNoException().isThrownBy(() -> service.set("k", "v"));
      assertThat(service.get("k")).isEqualTo("v");
      assertThat(received).hasSize(1);
    }

    @Test
    @DisplayName("start는 채널 패턴을 구독하고 원격 이벤트를 로컬 watcher에 전달한다")
    void remoteEventsDispatchedLocally() {
      CacheService service = distributedService(pubSub, "A");
      service.watch(Pattern.compile(".*"), received::add);
      service.start();

      @SuppressWarnings("unchecked")
      ArgumentCaptor<Consumer<CacheChangeEvent>> handler = ArgumentCaptor.forClass(Consumer.class);
      verify(pubSub).subscribe(eq("cache:*"), handler.capture());

      handler.getValue().accept(CacheChangeEvent.set("x", "1", NOW, "B", 7));

      assertThat(received).singleElement().satisfies(e -> {
        assertThat(e.originId()).isEqualTo("B");
        assertThat(e.sequence()).isEqualTo(7L);
      });
      verify(pubSub, never()).publish(anyString(), any());
      assertThat(meterRegistry.counter("cache.events.received").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("자신이 발행한 이벤트는 폐기된다")
    void echoSuppressed() {
      CacheService service = distributedService(pubSub, "A");
      service.watch(Pattern.compile(".*"), received::add);

      service.onRemoteEvent(CacheChangeEvent.set("x", "1", NOW, "A", 1));

      assertThat(received).isEmpty();
      assertThat(meterRegistry.counter("cache.events.echo_skipped").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("close는 구독을 해제하고 PubSub/어댑터 연결을 끊는다")
    void closeReleasesResources() {
      Subscription subscription = mock(Subscription.class);
      given(pubSub.subscribe(anyString(), any())).willReturn(subscription);
      CacheService service = distributedService(pubSub, "A");
      service.start();

      service.close();
      service.close();

      verify(subscription).unsubscribe();
      verify(pubSub).disconnect();
      assertThat(adapter.isConnected()).isFalse();
    }
  }
}
