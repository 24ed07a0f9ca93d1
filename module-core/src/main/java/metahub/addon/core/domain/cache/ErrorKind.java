package metahub.addon.core.domain.cache;

/** Failure classes that may be stored as error markers. Internal compute errors are never cached. */
public enum ErrorKind {
  TRANSIENT,
  RATE_LIMITED,
  NOT_FOUND
}
