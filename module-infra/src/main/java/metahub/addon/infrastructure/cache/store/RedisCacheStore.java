package metahub.addon.infrastructure.cache.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.StreamSupport;
import lombok.extern.slf4j.Slf4j;
import metahub.addon.core.domain.cache.CacheEntry;
import metahub.addon.core.port.out.CacheStore;
import metahub.addon.infrastructure.cache.codec.CacheEntryCodec;
import metahub.addon.infrastructure.executor.LogicExecutor;
import metahub.addon.infrastructure.executor.TaskContext;
import metahub.addon.infrastructure.executor.strategy.ExceptionTranslator;
import org.redisson.api.RBucket;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

/**
 * Redisson 기반 캐시 저장소
 *
 * <h4>저장 구조</h4>
 *
 * <pre>
 * Key:   {scope}:{version}:{category}:{qualifiers...}
 * Type:  String (CacheEntry JSON)
 * TTL:   ttl + staleWindow (에러 마커는 마커 TTL)
 * </pre>
 *
 * <h4>기록 순서 보장</h4>
 *
 * <p>{@link #setIfNewer}는 Lua 스크립트로 저장된 항목의 {@code createdAt}과 비교한 뒤 원자적으로 기록합니다. 워밍 결과가 더 최근에
 * 직접 계산된 항목을 덮어쓰지 않습니다. 손상된 기존 값은 덮어씁니다.
 *
 * <h4>NOSCRIPT 복구</h4>
 *
 * <p>스크립트 SHA를 캐싱하고, Redis 재시작으로 NOSCRIPT 에러가 나면 재로드 후 1회 재시도합니다.
 */
@Slf4j
public class RedisCacheStore implements CacheStore {

  static final String SET_IF_NEWER_SCRIPT =
      """
      local current = redis.call('GET', KEYS[1])
      if current then
        local ok, decoded = pcall(cjson.decode, current)
        if ok and type(decoded) == 'table' and tonumber(decoded['createdAt']) ~= nil
            and tonumber(decoded['createdAt']) > tonumber(ARGV[2]) then
          return 0
        end
      end
      redis.call('SET', KEYS[1], ARGV[1], 'PX', ARGV[3])
      return 1
      """;

  private static final String NOSCRIPT_ERROR_PREFIX = "NOSCRIPT";

  private final RedissonClient redissonClient;
  private final CacheEntryCodec codec;
  private final LogicExecutor executor;
  private final AtomicReference<String> setIfNewerSha = new AtomicReference<>();

  public RedisCacheStore(
      RedissonClient redissonClient, CacheEntryCodec codec, LogicExecutor executor) {
    this.redissonClient = redissonClient;
    this.codec = codec;
    this.executor = executor;
  }

  @Override
  public Optional<CacheEntry> get(String key) {
    String raw =
        executor.executeWithTranslation(
            () -> bucket(key).get(),
            ExceptionTranslator.forCacheStore(),
            TaskContext.of("RedisCacheStore", "Get", key));
    return Optional.ofNullable(raw).map(value -> codec.decode(key, value));
  }

  @Override
  public void set(CacheEntry entry, Duration ttl) {
    String raw = codec.encode(entry);
    executor.executeWithTranslation(
        () -> {
          bucket(entry.key()).set(raw, ttl.toMillis(), TimeUnit.MILLISECONDS);
          return null;
        },
        ExceptionTranslator.forCacheStore(),
        TaskContext.of("RedisCacheStore", "Set", entry.key()));
  }

  @Override
  public boolean setIfNewer(CacheEntry entry, Duration ttl) {
    String raw = codec.encode(entry);
    Long result =
        executor.executeWithTranslation(
            () -> evalSetIfNewer(entry, raw, ttl),
            ExceptionTranslator.forRedisScript(),
            TaskContext.of("RedisCacheStore", "SetIfNewer", entry.key()));
    boolean written = result != null && result == 1L;
    if (!written) {
      log.debug("[RedisCacheStore] Newer entry kept: key={}", entry.key());
    }
    return written;
  }

  @Override
  public boolean delete(String key) {
    return executor.executeWithTranslation(
        () -> redissonClient.getKeys().delete(key) > 0,
        ExceptionTranslator.forCacheStore(),
        TaskContext.of("RedisCacheStore", "Delete", key));
  }

  @Override
  public boolean exists(String key) {
    return executor.executeWithTranslation(
        () -> bucket(key).isExists(),
        ExceptionTranslator.forCacheStore(),
        TaskContext.of("RedisCacheStore", "Exists", key));
  }

  @Override
  public List<String> keysMatching(String pattern) {
    return executor.executeWithTranslation(
        () ->
            StreamSupport.stream(
                    redissonClient.getKeys().getKeysByPattern(pattern).spliterator(), false)
                .toList(),
        ExceptionTranslator.forCacheStore(),
        TaskContext.of("RedisCacheStore", "KeysMatching", pattern));
  }

  @Override
  public long deleteMatching(String pattern) {
    return executor.executeWithTranslation(
        () -> redissonClient.getKeys().deleteByPattern(pattern),
        ExceptionTranslator.forCacheStore(),
        TaskContext.of("RedisCacheStore", "DeleteMatching", pattern));
  }

  private RBucket<String> bucket(String key) {
    return redissonClient.getBucket(key, StringCodec.INSTANCE);
  }

  private Long evalSetIfNewer(CacheEntry entry, String raw, Duration ttl) {
    try {
      return evalSha(currentSha(), entry, raw, ttl);
    } catch (RuntimeException e) {
      if (!isNoscriptError(e)) {
        throw e;
      }
      log.warn("[RedisCacheStore] NOSCRIPT - 스크립트 재로드: key={}", entry.key());
      setIfNewerSha.set(null);
      return evalSha(currentSha(), entry, raw, ttl);
    }
  }

  private Long evalSha(String sha, CacheEntry entry, String raw, Duration ttl) {
    RScript script = redissonClient.getScript(StringCodec.INSTANCE);
    return script.evalSha(
        RScript.Mode.READ_WRITE,
        sha,
        RScript.ReturnType.INTEGER,
        List.of(entry.key()),
        raw,
        String.valueOf(entry.createdAt()),
        String.valueOf(Math.max(ttl.toMillis(), 1L)));
  }

  private String currentSha() {
    return setIfNewerSha.updateAndGet(
        current ->
            current != null
                ? current
                : redissonClient.getScript(StringCodec.INSTANCE).scriptLoad(SET_IF_NEWER_SCRIPT));
  }

  private boolean isNoscriptError(Throwable e) {
    String message = e.getMessage();
    if (message != null && message.contains(NOSCRIPT_ERROR_PREFIX)) {
      return true;
    }
    Throwable cause = e.getCause();
    return cause != null && cause != e && isNoscriptError(cause);
  }
}
