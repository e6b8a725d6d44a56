package io.cachesync.core.port;

/** LRU 용량 초과로 엔트리가 제거될 때 호출됩니다. 어댑터 잠금을 해제한 뒤 호출됩니다. */
@FunctionalInterface
public interface EvictionListener {
  void onEviction(String key);
}
