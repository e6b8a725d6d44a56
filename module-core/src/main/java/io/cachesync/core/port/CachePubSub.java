package io.cachesync.core.port;

import io.cachesync.core.domain.CacheChangeEvent;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 프로세스 간 캐시 이벤트 전파 채널
 *
 * <h3>계약</h3>
 *
 * <ul>
 *   <li>발행 전용 연결과 구독 전용 연결을 분리해서 사용
 *   <li>{@link #publish}는 패턴마다 서로 다른 구체 채널로 발행 (와일드카드 패턴끼리 같은 채널로 합쳐지지 않음)
 *   <li>핸들러 호출은 각각 독립된 실패 경계 안에서 수행
 *   <li>역직렬화 실패 메시지는 로그 후 폐기 (재시도 없음)
 *   <li>구독 연결이 재연결되면 활성 패턴을 자동으로 다시 구독
 * </ul>
 *
 * <p>전달은 best-effort입니다. ACK, 재발행, 서로 다른 발행자 간 순서 보장이 없습니다.
 */
public interface CachePubSub {

  void connect();

  void disconnect();

  void publish(String pattern, CacheChangeEvent event);

  /**
   * 패턴 구독. 해당 패턴의 첫 핸들러일 때만 실제 패턴 구독 명령을 보냅니다.
   *
   * @return 이 핸들러만 제거하는 구독 해제 핸들. 패턴의 마지막 핸들러가 제거되면 패턴 구독도 해제됩니다.
   */
  Subscription subscribe(String pattern, Consumer<CacheChangeEvent> handler);

  /** 현재 구독 중인 패턴 */
  Set<String> activePatterns();
}
