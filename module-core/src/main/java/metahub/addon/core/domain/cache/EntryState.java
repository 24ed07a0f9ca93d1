package metahub.addon.core.domain.cache;

/** Logical state of a stored entry at a given instant. */
public enum EntryState {
  FRESH,
  STALE,
  EXPIRED
}
