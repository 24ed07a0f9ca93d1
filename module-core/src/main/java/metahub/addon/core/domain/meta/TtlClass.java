package metahub.addon.core.domain.meta;

/** Volatility class of a meta component; mapped to a concrete TTL by configuration. */
public enum TtlClass {
  /** Identity data and artwork: rarely changes. */
  LONG,
  /** Relational data such as cast, episodes and links. */
  MEDIUM,
  SHORT
}
