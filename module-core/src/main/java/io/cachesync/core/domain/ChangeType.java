package io.cachesync.core.domain;

import java.util.Arrays;

/** 캐시 변경 이벤트 유형 */
public enum ChangeType {
  SET("set"),
  DELETE("delete"),
  EVICTION("eviction");

  private final String wireName;

  ChangeType(String wireName) {
    this.wireName = wireName;
  }

  /** 전파 포맷(JSON)에서 사용하는 소문자 이름 */
  public String wireName() {
    return wireName;
  }

  public static ChangeType fromWireName(String wireName) {
    return Arrays.stream(values())
        .filter(t -> t.wireName.equals(wireName))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown change type: " + wireName));
  }
}
