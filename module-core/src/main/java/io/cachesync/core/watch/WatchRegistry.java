package io.cachesync.core.watch;

import io.cachesync.common.executor.LogicExecutor;
import io.cachesync.common.executor.TaskContext;
import io.cachesync.core.domain.CacheChangeEvent;
import io.cachesync.core.port.Subscription;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * watch 구독 레지스트리
 *
 * <p>등록 목록은 잠금으로 보호하고, 전달 시에는 잠금 아래에서 스냅샷을 복사한 뒤 잠금 밖에서 핸들러를 호출합니다. 핸들러가 다시 watch/unsubscribe를
 * 호출해도 교착되지 않습니다.
 *
 * <p>핸들러 예외는 {@link LogicExecutor#executeOrDefault}로 격리되어 로그만 남습니다. {@link Error}는 격리하지 않습니다.
 */
@Slf4j
@RequiredArgsConstructor
public class WatchRegistry {

  private static final String COMPONENT = "CacheWatch";

  private final LogicExecutor executor;
  private final ReentrantLock lock = new ReentrantLock();
  private final List<Registration> registrations = new ArrayList<>();

  public Subscription register(KeyMatcher matcher, CacheWatchHandler handler) {
    Registration registration = new Registration(matcher, handler);
    lock.lock();
    try {
      registrations.add(registration);
    } finally {
      lock.unlock();
    }
    return registration;
  }

  public void dispatch(CacheChangeEvent event) {
    List<Registration> snapshot;
    lock.lock();
    try {
      snapshot = List.copyOf(registrations);
    } finally {
      lock.unlock();
    }

    for (Registration registration : snapshot) {
      if (registration.isActive() && registration.matcher.matches(event.key())) {
        invoke(registration, event);
      }
    }
  }

  public int size() {
    lock.lock();
    try {
      return registrations.size();
    } finally {
      lock.unlock();
    }
  }

  private void invoke(Registration registration, CacheChangeEvent event) {
    executor.executeOrDefault(
        () -> {
          registration.handler.onChange(event);
          return Boolean.TRUE;
        },
        Boolean.FALSE,
        TaskContext.of(COMPONENT, "dispatch", event.key()));
  }

  private void remove(Registration registration) {
    lock.lock();
    try {
      registrations.remove(registration);
    } finally {
      lock.unlock();
    }
  }

  private final class Registration implements Subscription {
    private final KeyMatcher matcher;
    private final CacheWatchHandler handler;
    private final AtomicBoolean active = new AtomicBoolean(true);

    private Registration(KeyMatcher matcher, CacheWatchHandler handler) {
      this.matcher = matcher;
      this.handler = handler;
    }

    @Override
    public void unsubscribe() {
      if (active.compareAndSet(true, false)) {
        remove(this);
        log.debug("[CacheWatch] Unsubscribed: matcher={}", matcher);
      }
    }

    @Override
    public boolean isActive() {
      return active.get();
    }
  }
}
