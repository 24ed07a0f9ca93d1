package metahub.addon.config;

import lombok.extern.slf4j.Slf4j;
import metahub.addon.core.port.out.CacheStore;
import metahub.addon.infrastructure.cache.codec.CacheEntryCodec;
import metahub.addon.infrastructure.cache.store.CaffeineCacheStore;
import metahub.addon.infrastructure.cache.store.RedisCacheStore;
import metahub.addon.infrastructure.executor.LogicExecutor;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 캐시 저장소 선택
 *
 * <ul>
 *   <li>{@code cache.store.type=memory} (기본): 프로세스 내 Caffeine 저장소
 *   <li>{@code cache.store.type=redis}: Redisson 기반 Redis 저장소 (RedissonClient도 이 경우에만 생성)
 * </ul>
 */
@Slf4j
@Configuration
public class CacheStoreConfig {

  private static final String STORE_TYPE = "cache.store.type";

  @Bean
  @ConditionalOnProperty(name = STORE_TYPE, havingValue = "memory", matchIfMissing = true)
  public CacheStore memoryCacheStore(CacheProperties properties) {
    long maximumSize = properties.getStore().getMemoryMaximumSize();
    log.info("[CacheStore] Using in-process store (maximumSize={})", maximumSize);
    return new CaffeineCacheStore(maximumSize);
  }

  @Configuration
  @ConditionalOnProperty(name = STORE_TYPE, havingValue = "redis")
  static class RedisStoreConfig {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedissonClient redissonClient(CacheProperties properties) {
      CacheProperties.Store store = properties.getStore();
      Config config = new Config();
      config
          .useSingleServer()
          .setAddress(store.getRedisAddress())
          .setConnectionPoolSize(store.getRedisConnectionPoolSize())
          .setConnectionMinimumIdleSize(Math.min(8, store.getRedisConnectionPoolSize()))
          .setRetryAttempts(3)
          .setRetryInterval(1500)
          .setTimeout(8000)
          .setConnectTimeout(5000);
      return Redisson.create(config);
    }

    @Bean
    public CacheStore redisCacheStore(
        RedissonClient redissonClient, CacheEntryCodec codec, LogicExecutor executor) {
      log.info("[CacheStore] Using Redis store");
      return new RedisCacheStore(redissonClient, codec, executor);
    }
  }
}
