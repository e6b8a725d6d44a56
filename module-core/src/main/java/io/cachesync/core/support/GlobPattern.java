package io.cachesync.core.support;

import java.util.regex.Pattern;

/**
 * Redis KEYS 스타일 glob 패턴
 *
 * <ul>
 *   <li>{@code *}: 임의 길이 문자열
 *   <li>{@code ?}: 임의 한 글자
 *   <li>{@code [abc]}, {@code [a-z]}, {@code [^a]}: 문자 클래스
 *   <li>{@code \x}: x 문자 그대로
 * </ul>
 */
public final class GlobPattern {

  private static final String REGEX_META = "\\.[]{}()<>*+-=!?^$|&";

  private final String glob;
  private final Pattern regex;

  private GlobPattern(String glob) {
    this.glob = glob;
    this.regex = Pattern.compile(toRegex(glob), Pattern.DOTALL);
  }

  /** null 또는 빈 문자열은 전체 매칭 {@code *}로 취급 */
  public static GlobPattern compile(String glob) {
    return new GlobPattern(glob == null || glob.isEmpty() ? "*" : glob);
  }

  public boolean matches(String key) {
    return regex.matcher(key).matches();
  }

  public String glob() {
    return glob;
  }

  public static boolean hasWildcard(String glob) {
    for (int i = 0; i < glob.length(); i++) {
      char c = glob.charAt(i);
      if (c == '\\') {
        i++;
      } else if (c == '*' || c == '?' || c == '[') {
        return true;
      }
    }
    return false;
  }

  static String toRegex(String glob) {
    StringBuilder sb = new StringBuilder(glob.length() * 2);
    int i = 0;
    while (i < glob.length()) {
      char c = glob.charAt(i);
      switch (c) {
        case '*' -> sb.append(".*");
        case '?' -> sb.append('.');
        case '\\' -> {
          if (i + 1 < glob.length()) {
            i++;
          }
          appendLiteral(sb, glob.charAt(i));
        }
        case '[' -> {
          int end = glob.indexOf(']', i + 2);
          if (end < 0) {
            appendLiteral(sb, c);
          } else {
            appendClass(sb, glob.substring(i + 1, end));
            i = end;
          }
        }
        default -> appendLiteral(sb, c);
      }
      i++;
    }
    return sb.toString();
  }

  private static void appendClass(StringBuilder sb, String body) {
    sb.append('[');
    int start = 0;
    if (body.startsWith("^")) {
      sb.append('^');
      start = 1;
    }
    for (int j = start; j < body.length(); j++) {
      char c = body.charAt(j);
      if (c == '-' && j > start && j < body.length() - 1) {
        sb.append('-');
      } else if (c == '\\' || c == '[' || c == ']' || c == '&' || c == '^' || c == '-') {
        sb.append('\\').append(c);
      } else {
        sb.append(c);
      }
    }
    sb.append(']');
  }

  private static void appendLiteral(StringBuilder sb, char c) {
    if (REGEX_META.indexOf(c) >= 0) {
      sb.append('\\');
    }
    sb.append(c);
  }

  @Override
  public String toString() {
    return glob;
  }
}
