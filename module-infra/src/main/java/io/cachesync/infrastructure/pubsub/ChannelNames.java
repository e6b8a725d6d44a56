package io.cachesync.infrastructure.pubsub;

import com.google.common.hash.Hashing;
import io.cachesync.core.support.GlobPattern;
import io.cachesync.error.exception.CacheValidationException;
import java.nio.charset.StandardCharsets;

/**
 * 구독 패턴 → 발행 채널 이름 매핑
 *
 * <p>발행은 PUBLISH가 받는 구체 채널로만 가능하므로 와일드카드 패턴을 채널 이름으로 바꿔야 합니다. 생성된 채널은
 *
 * <ul>
 *   <li>원래 패턴과 매칭되고 (같은 패턴을 PSUBSCRIBE한 피어가 수신)
 *   <li>패턴마다 결정적으로 서로 다릅니다 ({@code *} 자리에 패턴 해시 토큰 삽입)
 * </ul>
 *
 * <p>{@code *} 없이 {@code ?}나 문자 클래스만 가진 패턴은 매칭 문자열 길이가 고정되어 해시 토큰을 넣을 자리가 없으므로 거부합니다.
 * 와일드카드가 없는 패턴은 이스케이프를 풀어 그대로 채널로 씁니다.
 *
 * <pre>
 * cache:*       → cache:evt-3f2a9c01d4e7
 * cache:user:*  → cache:user:evt-81b0c2ee5a19
 * cache:events  → cache:events
 * cache:\*      → cache:*
 * cache:?       → CacheValidationException
 * </pre>
 */
public final class ChannelNames {

  private static final String TOKEN_PREFIX = "evt-";
  private static final String CLASS_CANDIDATES = "_0aAzZ9-~";

  private ChannelNames() {}

  public static String forPattern(String pattern) {
    if (pattern == null || pattern.isEmpty()) {
      throw CacheValidationException.invalidPattern(String.valueOf(pattern), "empty pattern");
    }

    String token = TOKEN_PREFIX + hash(pattern);
    StringBuilder channel = new StringBuilder(pattern.length() + token.length());
    boolean wildcard = false;
    boolean tokenInserted = false;
    int i = 0;
    while (i < pattern.length()) {
      char c = pattern.charAt(i);
      switch (c) {
        case '*' -> {
          channel.append(token);
          wildcard = true;
          tokenInserted = true;
        }
        case '?' -> {
          channel.append('_');
          wildcard = true;
        }
        case '\\' -> {
          if (i + 1 < pattern.length()) {
            i++;
          }
          channel.append(pattern.charAt(i));
        }
        case '[' -> {
          int end = pattern.indexOf(']', i + 2);
          if (end < 0) {
            channel.append(c);
          } else {
            channel.append(pickClassMember(pattern, pattern.substring(i, end + 1)));
            wildcard = true;
            i = end;
          }
        }
        default -> channel.append(c);
      }
      i++;
    }

    if (wildcard && !tokenInserted) {
      throw CacheValidationException.invalidPattern(
          pattern, "a wildcard pattern needs at least one '*' to derive a distinct channel");
    }
    return channel.toString();
  }

  private static char pickClassMember(String pattern, String characterClass) {
    GlobPattern glob = GlobPattern.compile(characterClass);
    for (char candidate : CLASS_CANDIDATES.toCharArray()) {
      if (glob.matches(String.valueOf(candidate))) {
        return candidate;
      }
    }
    String first = characterClass.substring(1, 2);
    if (!"^".equals(first) && glob.matches(first)) {
      return first.charAt(0);
    }
    throw CacheValidationException.invalidPattern(
        pattern, "cannot derive a channel for character class " + characterClass);
  }

  private static String hash(String pattern) {
    return Hashing.sha256().hashString(pattern, StandardCharsets.UTF_8).toString().substring(0, 12);
  }
}
