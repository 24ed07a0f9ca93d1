package metahub.addon.core.domain.cache;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Namespaced cache key: {@code scope:version:category:qualifiers...}.
 *
 * <p>Each segment is escaped so that a separator or glob character inside an identifier (for
 * example {@code mal:1535} or {@code tt0903747:1:2}) can never shift segments. Two keys render to
 * the same string only if all their parts are equal.
 *
 * @param scope {@code global} or a caller-supplied per-user identifier
 * @param version software version; an upgrade changes every key
 * @param category cache category
 * @param qualifiers resource type, resource id, parameter fingerprint, ...
 */
public record CacheKey(String scope, String version, CacheCategory category, List<String> qualifiers) {

  public static final String GLOBAL_SCOPE = "global";
  static final char SEPARATOR = ':';

  public CacheKey {
    requireText(scope, "scope");
    requireText(version, "version");
    Objects.requireNonNull(category, "category");
    qualifiers = List.copyOf(Objects.requireNonNull(qualifiers, "qualifiers"));
    qualifiers.forEach(q -> requireText(q, "qualifier"));
  }

  public static CacheKey global(String version, CacheCategory category, String... qualifiers) {
    return new CacheKey(GLOBAL_SCOPE, version, category, Arrays.asList(qualifiers));
  }

  public static CacheKey of(
      String scope, String version, CacheCategory category, String... qualifiers) {
    return new CacheKey(scope, version, category, Arrays.asList(qualifiers));
  }

  /** Key of a sub-resource, e.g. a meta component under its parent meta key. */
  public CacheKey child(String... more) {
    List<String> merged = new ArrayList<>(qualifiers);
    merged.addAll(Arrays.asList(more));
    return new CacheKey(scope, version, category, merged);
  }

  /** Glob pattern matching this key and every key derived from it via {@link #child}. */
  public String descendantsPattern() {
    return asString() + SEPARATOR + "*";
  }

  public String asString() {
    StringBuilder sb = new StringBuilder();
    sb.append(escape(scope)).append(SEPARATOR).append(escape(version)).append(SEPARATOR);
    sb.append(category.key());
    for (String q : qualifiers) {
      sb.append(SEPARATOR).append(escape(q));
    }
    return sb.toString();
  }

  /**
   * Glob pattern over one scope/version/category. {@code qualifierGlob} is used raw so that callers
   * can pass {@code *} or {@code component:artwork*}.
   */
  public static String pattern(
      String scope, String version, CacheCategory category, String qualifierGlob) {
    return escape(scope)
        + SEPARATOR
        + escape(version)
        + SEPARATOR
        + category.key()
        + SEPARATOR
        + qualifierGlob;
  }

  /** Escapes a single segment. Also usable on raw identifiers placed in a {@link #pattern}. */
  public static String escape(String segment) {
    StringBuilder sb = new StringBuilder(segment.length());
    for (char c : segment.toCharArray()) {
      switch (c) {
        case '%' -> sb.append("%25");
        case ':' -> sb.append("%3A");
        case '*' -> sb.append("%2A");
        case '?' -> sb.append("%3F");
        case '[' -> sb.append("%5B");
        case ']' -> sb.append("%5D");
        case '\\' -> sb.append("%5C");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
  }

  @Override
  public String toString() {
    return asString();
  }
}
