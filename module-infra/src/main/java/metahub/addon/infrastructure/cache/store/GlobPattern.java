package metahub.addon.infrastructure.cache.store;

import java.util.regex.Pattern;

/**
 * Redis 스타일 glob 패턴을 정규식으로 변환
 *
 * <p>지원: {@code *}, {@code ?}, {@code [abc]}, {@code [^a]}, {@code [a-z]}, {@code \x} 이스케이프
 */
final class GlobPattern {

  private GlobPattern() {}

  static Pattern compile(String glob) {
    StringBuilder regex = new StringBuilder(glob.length() + 8);
    int i = 0;
    while (i < glob.length()) {
      char c = glob.charAt(i);
      switch (c) {
        case '*' -> regex.append(".*");
        case '?' -> regex.append('.');
        case '\\' -> {
          if (i + 1 < glob.length()) {
            i++;
            regex.append(Pattern.quote(String.valueOf(glob.charAt(i))));
          } else {
            regex.append(Pattern.quote("\\"));
          }
        }
        case '[' -> {
          int end = glob.indexOf(']', i + 1);
          if (end < 0) {
            regex.append(Pattern.quote("["));
          } else {
            regex.append(charClass(glob.substring(i + 1, end)));
            i = end;
          }
        }
        default -> regex.append(Pattern.quote(String.valueOf(c)));
      }
      i++;
    }
    return Pattern.compile(regex.toString(), Pattern.DOTALL);
  }

  private static String charClass(String body) {
    StringBuilder cls = new StringBuilder("[");
    int start = 0;
    if (body.startsWith("^")) {
      cls.append('^');
      start = 1;
    }
    for (int j = start; j < body.length(); j++) {
      char c = body.charAt(j);
      if (c == '-' && j > start && j < body.length() - 1) {
        cls.append('-');
      } else if (Character.isLetterOrDigit(c)) {
        cls.append(c);
      } else {
        cls.append('\\').append(c);
      }
    }
    return cls.append(']').toString();
  }
}
