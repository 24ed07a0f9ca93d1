package metahub.addon.core.domain.warming;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import metahub.addon.core.domain.cache.CacheKey;
import metahub.addon.core.domain.cache.CachePolicy;

/**
 * One entry a warming pass should populate.
 *
 * @param key cache key to populate
 * @param policy policy passed to the cache wrapper
 * @param compute upstream computation producing the value
 */
public record WarmupTarget(
    CacheKey key, CachePolicy policy, Supplier<CompletableFuture<Object>> compute) {

  public WarmupTarget {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(compute, "compute");
  }

  public static WarmupTarget of(
      CacheKey key, CachePolicy policy, Supplier<? extends CompletableFuture<?>> compute) {
    return new WarmupTarget(key, policy, () -> compute.get().thenApply(value -> (Object) value));
  }
}
