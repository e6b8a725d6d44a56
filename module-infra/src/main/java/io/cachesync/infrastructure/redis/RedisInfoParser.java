package io.cachesync.infrastructure.redis;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** INFO 명령 결과(섹션별 key → value 맵) 파싱 */
final class RedisInfoParser {

  private static final Pattern KEYSPACE_KEYS = Pattern.compile("keys=(\\d+)");

  private RedisInfoParser() {}

  static long usedMemory(Map<String, String> memorySection) {
    return parseLong(memorySection.get("used_memory"));
  }

  static long evictedKeys(Map<String, String> statsSection) {
    return parseLong(statsSection.get("evicted_keys"));
  }

  /** keyspace 섹션의 {@code db<N>:keys=..,expires=..} 항목에서 키 개수 추출 */
  static long keyCount(Map<String, String> keyspaceSection, int database) {
    String entry = keyspaceSection.get("db" + database);
    if (entry == null) {
      return 0;
    }
    Matcher matcher = KEYSPACE_KEYS.matcher(entry);
    return matcher.find() ? Long.parseLong(matcher.group(1)) : 0;
  }

  private static long parseLong(String value) {
    if (value == null || value.isBlank()) {
      return 0;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return 0;
    }
  }
}
