package io.cachesync.core.watch;

import io.cachesync.core.domain.CacheChangeEvent;

/**
 * watch 구독 콜백
 *
 * <p>던진 {@link Exception}은 로그로만 남고 변경 호출이나 다른 핸들러에 영향을 주지 않습니다. {@link Error}는 격리하지 않고 변경
 * 호출자에게 전파되며, 남은 핸들러에는 전달되지 않습니다.
 */
@FunctionalInterface
public interface CacheWatchHandler {
  void onChange(CacheChangeEvent event) throws Exception;
}
