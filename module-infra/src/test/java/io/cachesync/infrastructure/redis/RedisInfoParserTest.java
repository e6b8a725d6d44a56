package io.cachesync.infrastructure.redis;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("RedisInfoParser")
class RedisInfoParserTest {

  @Test
  @DisplayName("INFO 섹션에서 메모리와 축출 수를 읽는다")
  void readsCounters() {
    assertThat(RedisInfoParser.usedMemory(Map.of("used_memory", "1048576"))).isEqualTo(1_048_576L);
    assertThat(RedisInfoParser.evictedKeys(Map.of("evicted_keys", " 12 "))).isEqualTo(12L);
  }

  @Test
  @DisplayName("keyspace 항목에서 DB별 키 수를 추출한다")
  void keyspace() {
    Map<String, String> keyspace =
        Map.of("db0", "keys=42,expires=3,avg_ttl=0", "db2", "keys=7,expires=0,avg_ttl=0");

    assertThat(RedisInfoParser.keyCount(keyspace, 0)).isEqualTo(42L);
    assertThat(RedisInfoParser.keyCount(keyspace, 2)).isEqualTo(7L);
    assertThat(RedisInfoParser.keyCount(keyspace, 1)).isZero();
  }

  @Test
  @DisplayName("누락되거나 잘못된 값은 0으로 처리한다")
  void missingOrMalformed() {
    assertThat(RedisInfoParser.usedMemory(Map.of())).isZero();
    assertThat(RedisInfoParser.evictedKeys(Map.of("evicted_keys", "n/a"))).isZero();
    assertThat(RedisInfoParser.keyCount(Map.of("db0", "expires=1"), 0)).isZero();
  }
}
