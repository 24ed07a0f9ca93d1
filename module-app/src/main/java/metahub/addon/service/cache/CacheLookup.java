package metahub.addon.service.cache;

import metahub.addon.core.domain.cache.CacheEntry;

/** Result of one store read, classified against the current time. */
record CacheLookup(State state, CacheEntry entry) {

  enum State {
    FRESH,
    STALE,
    ERROR_CACHED,
    MISS
  }

  static final CacheLookup MISS = new CacheLookup(State.MISS, null);

  static CacheLookup classify(CacheEntry entry, long nowMillis) {
    return switch (entry.stateAt(nowMillis)) {
      case FRESH -> new CacheLookup(entry.errorMarker() ? State.ERROR_CACHED : State.FRESH, entry);
      // 마커는 stale 구간이 없으므로 여기에 오지 않음
      case STALE -> entry.errorMarker() ? MISS : new CacheLookup(State.STALE, entry);
      case EXPIRED -> MISS;
    };
  }
}
