package io.cachesync.infrastructure.pubsub;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cachesync.core.support.GlobPattern;
import io.cachesync.error.exception.CacheValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@Tag("unit")
@DisplayName("ChannelNames")
class ChannelNamesTest {

  @ParameterizedTest
  @ValueSource(
      strings = {
        "cache-sync:events:*",
        "cache:*",
        "cache:user:*",
        "a?c*",
        "user:[abc]:*",
        "x[^0-9]*",
        "cache:\\*",
        "cache:\\?:*"
      })
  @DisplayName("파생된 채널은 원래 패턴에 매칭된다")
  void channelMatchesOwnPattern(String pattern) {
    String channel = ChannelNames.forPattern(pattern);

    assertThat(GlobPattern.compile(pattern).matches(channel)).isTrue();
  }

  @Test
  @DisplayName("서로 다른 패턴은 서로 다른 채널로 매핑된다")
  void distinctPatternsDistinctChannels() {
    String broad = ChannelNames.forPattern("cache:*");
    String narrow = ChannelNames.forPattern("cache:user:*");

    assertThat(broad).isNotEqualTo(narrow);
    assertThat(GlobPattern.compile("cache:user:*").matches(broad)).isFalse();
    assertThat(ChannelNames.forPattern("a*b")).isNotEqualTo(ChannelNames.forPattern("a*c"));
  }

  @Test
  @DisplayName("같은 패턴은 항상 같은 채널로 매핑된다")
  void deterministic() {
    assertThat(ChannelNames.forPattern("cache:*")).isEqualTo(ChannelNames.forPattern("cache:*"));
    assertThat(ChannelNames.forPattern("cache:*")).startsWith("cache:evt-");
  }

  @Test
  @DisplayName("와일드카드가 없으면 패턴 자체가 채널이다")
  void literalPattern() {
    assertThat(ChannelNames.forPattern("cache:events")).isEqualTo("cache:events");
  }

  @Test
  @DisplayName("? 와 문자 클래스만 다른 패턴도 서로 다른 채널로 매핑된다")
  void singleCharWildcardsStayDistinct() {
    String anyChar = ChannelNames.forPattern("cache:?*");
    String classX = ChannelNames.forPattern("cache:[_x]*");
    String classY = ChannelNames.forPattern("cache:[_y]*");

    assertThat(anyChar).isNotEqualTo(classX).isNotEqualTo(classY);
    assertThat(classX).isNotEqualTo(classY);
  }

  @ParameterizedTest
  @ValueSource(strings = {"cache:?", "cache:[_x]", "cache:[_y]", "a?c", "x[^0-9]"})
  @DisplayName("* 없이 ? 나 문자 클래스만 있는 패턴은 채널을 구분할 수 없어 거부된다")
  void fixedLengthWildcardRejected(String pattern) {
    assertThatThrownBy(() -> ChannelNames.forPattern(pattern))
        .isInstanceOf(CacheValidationException.class)
        .hasMessageContaining(pattern);
  }

  @Test
  @DisplayName("이스케이프된 리터럴 패턴은 이스케이프를 푼 채널을 쓴다")
  void escapedLiteralIsUnescaped() {
    String channel = ChannelNames.forPattern("cache:\\*");

    assertThat(channel).isEqualTo("cache:*");
    assertThat(GlobPattern.compile("cache:\\*").matches(channel)).isTrue();
  }

  @Test
  @DisplayName("닫히지 않은 [ 는 리터럴로 취급된다")
  void unterminatedBracketIsLiteral() {
    assertThat(ChannelNames.forPattern("cache:[x")).isEqualTo("cache:[x");
  }

  @Test
  @DisplayName("빈 패턴은 검증 예외")
  void emptyPatternRejected() {
    assertThatThrownBy(() -> ChannelNames.forPattern(""))
        .isInstanceOf(CacheValidationException.class);
  }
}
