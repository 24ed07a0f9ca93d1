package metahub.addon.core.domain.meta;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Independently cached parts of a meta record.
 *
 * <p>Each non-core component claims a fixed set of top-level fields. {@link #CORE} owns every
 * field not claimed by another component, so decomposition never loses data.
 */
public enum MetaComponentType {
  CORE(TtlClass.LONG, Set.of()),
  CAST(TtlClass.MEDIUM, Set.of("cast", "director", "writer", "app_extras")),
  ARTWORK(TtlClass.LONG, Set.of("poster", "background", "logo", "posterShape")),
  EPISODES(TtlClass.MEDIUM, Set.of("videos")),
  LINKS(TtlClass.MEDIUM, Set.of("links", "trailers", "trailerStreams"));

  private final TtlClass ttlClass;
  private final Set<String> fields;

  MetaComponentType(TtlClass ttlClass, Set<String> fields) {
    this.ttlClass = ttlClass;
    this.fields = fields;
  }

  public TtlClass ttlClass() {
    return ttlClass;
  }

  /** Key segment of the component, e.g. {@code artwork}. */
  public String componentName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Component that owns the given top-level field. */
  public static MetaComponentType owning(String field) {
    return Arrays.stream(values())
        .filter(type -> type.fields.contains(field))
        .findFirst()
        .orElse(CORE);
  }

  public static Optional<MetaComponentType> fromName(String name) {
    return Arrays.stream(values()).filter(t -> t.componentName().equalsIgnoreCase(name)).findFirst();
  }
}
