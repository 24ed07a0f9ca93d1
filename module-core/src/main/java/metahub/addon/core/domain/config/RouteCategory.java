package metahub.addon.core.domain.config;

/** Route families that get their own HTTP validator. */
public enum RouteCategory {
  MANIFEST,
  CATALOG,
  META,
  SEARCH
}
