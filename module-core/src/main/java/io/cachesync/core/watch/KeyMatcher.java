package io.cachesync.core.watch;

import java.util.Objects;
import java.util.regex.Pattern;

/** watch 구독의 키 매처: 정확히 일치하는 키 또는 정규식 */
public interface KeyMatcher {

  boolean matches(String key);

  static KeyMatcher exact(String key) {
    return new Exact(key);
  }

  static KeyMatcher pattern(Pattern pattern) {
    return new Regex(pattern);
  }

  record Exact(String key) implements KeyMatcher {
    public Exact {
      Objects.requireNonNull(key, "key");
    }

    @Override
    public boolean matches(String candidate) {
      return key.equals(candidate);
    }
  }

  /** 부분 일치(find) 기준. 전체 일치가 필요하면 {@code ^...$}로 앵커를 지정합니다. */
  record Regex(Pattern pattern) implements KeyMatcher {
    public Regex {
      Objects.requireNonNull(pattern, "pattern");
    }

    @Override
    public boolean matches(String candidate) {
      return pattern.matcher(candidate).find();
    }
  }
}
