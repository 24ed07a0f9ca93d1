package metahub.addon.infrastructure.cache.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import metahub.addon.core.domain.cache.CacheEntry;
import metahub.addon.core.port.out.CacheStore;

/**
 * 단일 프로세스용 Caffeine 캐시 저장소
 *
 * <p>Redis가 없는 로컬/테스트 환경의 기본 저장소입니다. 항목마다 다른 TTL을 {@link Expiry}로 적용하며, {@code setIfNewer}는
 * {@code asMap().compute}로 원자적으로 비교 후 기록합니다.
 */
@Slf4j
public class CaffeineCacheStore implements CacheStore {

  private record Slot(CacheEntry entry, long ttlNanos) {}

  private final Cache<String, Slot> cache;

  public CaffeineCacheStore(long maximumSize) {
    this(maximumSize, Ticker.systemTicker());
  }

  public CaffeineCacheStore(long maximumSize, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .ticker(ticker)
            .expireAfter(new SlotExpiry())
            .build();
  }

  @Override
  public Optional<CacheEntry> get(String key) {
    return Optional.ofNullable(cache.getIfPresent(key)).map(Slot::entry);
  }

  @Override
  public void set(CacheEntry entry, Duration ttl) {
    cache.put(entry.key(), new Slot(entry, ttl.toNanos()));
  }

  @Override
  public boolean setIfNewer(CacheEntry entry, Duration ttl) {
    AtomicBoolean written = new AtomicBoolean(false);
    cache
        .asMap()
        .compute(
            entry.key(),
            (key, current) -> {
              if (current != null && current.entry().createdAt() > entry.createdAt()) {
                return current;
              }
              written.set(true);
              return new Slot(entry, ttl.toNanos());
            });
    if (!written.get()) {
      log.debug("[CaffeineCacheStore] Newer entry kept: key={}", entry.key());
    }
    return written.get();
  }

  @Override
  public boolean delete(String key) {
    return cache.asMap().remove(key) != null;
  }

  @Override
  public boolean exists(String key) {
    return cache.getIfPresent(key) != null;
  }

  @Override
  public List<String> keysMatching(String pattern) {
    Pattern regex = GlobPattern.compile(pattern);
    return cache.asMap().keySet().stream().filter(k -> regex.matcher(k).matches()).toList();
  }

  @Override
  public long deleteMatching(String pattern) {
    List<String> keys = keysMatching(pattern);
    cache.invalidateAll(keys);
    return keys.size();
  }

  private static final class SlotExpiry implements Expiry<String, Slot> {

    @Override
    public long expireAfterCreate(String key, Slot value, long currentTime) {
      return value.ttlNanos();
    }

    @Override
    public long expireAfterUpdate(String key, Slot value, long currentTime, long currentDuration) {
      return value.ttlNanos();
    }

    @Override
    public long expireAfterRead(String key, Slot value, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
