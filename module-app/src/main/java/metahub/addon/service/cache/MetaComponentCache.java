package metahub.addon.service.cache;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import metahub.addon.core.domain.cache.CacheKey;
import metahub.addon.core.domain.cache.CachePolicy;
import metahub.addon.core.domain.meta.MetaComponentType;
import metahub.addon.core.domain.meta.MetaDecomposer;
import metahub.addon.core.port.out.CacheStore;
import metahub.addon.infrastructure.cache.codec.CacheEntryCodec;
import metahub.addon.infrastructure.executor.LogicExecutor;
import metahub.addon.infrastructure.executor.TaskContext;
import metahub.addon.service.cache.CacheWrapper.Cached;
import metahub.addon.service.health.CacheHealthMonitor;
import org.springframework.stereotype.Component;

/**
 * 메타 컴포넌트 캐시
 *
 * <p>메타 레코드를 core / cast / artwork / episodes / links 컴포넌트로 나눠 각자의 TTL 클래스로 저장하고, 읽을 때 다시
 * 조립합니다. 부모 메타 객체는 통째로 저장하지 않습니다.
 *
 * <h4>조립 규칙</h4>
 *
 * <ul>
 *   <li>필수 컴포넌트가 모두 fresh: 조립 결과 반환 (hit)
 *   <li>하나라도 없음/만료/손상: "값 없음" (일부 존재 시 partial hit, 전부 없으면 miss)
 *   <li>살아있는 컴포넌트와 만료된 컴포넌트를 섞은 결과는 절대 반환하지 않음
 * </ul>
 *
 * <p>컴포넌트 키: {@code {parentKey}:component:{name}}
 */
@Slf4j
@Component
public class MetaComponentCache {

  public static final Set<MetaComponentType> ALL_COMPONENTS =
      Collections.unmodifiableSet(EnumSet.allOf(MetaComponentType.class));

  private static final String COMPONENT_SEGMENT = "component";

  private final CacheWrapper wrapper;
  private final CacheStore store;
  private final CacheEntryCodec codec;
  private final CachePolicies policies;
  private final CacheHealthMonitor healthMonitor;
  private final LogicExecutor executor;
  private final JavaType nodeType;

  public MetaComponentCache(
      CacheWrapper wrapper,
      CacheStore store,
      CacheEntryCodec codec,
      CachePolicies policies,
      CacheHealthMonitor healthMonitor,
      LogicExecutor executor) {
    this.wrapper = wrapper;
    this.store = store;
    this.codec = codec;
    this.policies = policies;
    this.healthMonitor = healthMonitor;
    this.executor = executor;
    this.nodeType = codec.typeOf(JsonNode.class);
  }

  public static CacheKey componentKey(CacheKey parentKey, MetaComponentType type) {
    return parentKey.child(COMPONENT_SEGMENT, type.componentName());
  }

  /** 컴포넌트 분해 (데이터 없는 컴포넌트는 빈 객체) */
  public Map<MetaComponentType, ObjectNode> decompose(Object value) {
    JsonNode tree = value instanceof JsonNode node ? node : codec.toTree(value);
    if (!(tree instanceof ObjectNode meta)) {
      throw new IllegalArgumentException(
          "composite value must be a JSON object: " + (tree == null ? "null" : tree.getNodeType()));
    }
    return MetaDecomposer.decompose(meta);
  }

  /**
   * 모든 컴포넌트를 각자의 TTL로 기록합니다. 쓰기는 createdAt 비교 기록이므로 더 최신 컴포넌트를 덮어쓰지 않습니다.
   *
   * @return 기록된 컴포넌트 수
   */
  public int store(CacheKey parentKey, Object value, long createdAt) {
    Map<MetaComponentType, ObjectNode> components = decompose(value);
    int written = 0;
    for (Map.Entry<MetaComponentType, ObjectNode> component : components.entrySet()) {
      MetaComponentType type = component.getKey();
      Duration ttl = policies.componentTtl(type);
      if (wrapper.writeTree(
          componentKey(parentKey, type), component.getValue(), createdAt, ttl, Duration.ZERO)) {
        written++;
      }
    }
    log.debug("[MetaComponentCache] Stored components: key={} written={}", parentKey, written);
    return written;
  }

  /**
   * 저장된 컴포넌트로 메타를 조립합니다. 재계산은 하지 않습니다.
   *
   * @param parentKey 부모 메타 키
   * @param required 조립에 필요한 컴포넌트
   * @return 모두 fresh이면 조립 결과, 아니면 empty
   */
  public Optional<ObjectNode> reconstruct(CacheKey parentKey, Set<MetaComponentType> required) {
    Reconstruction result = collect(parentKey, required);
    recordLookup(parentKey, result);
    return result.assembled();
  }

  public <T> CompletableFuture<T> wrapComposite(
      CacheKey parentKey,
      Set<MetaComponentType> required,
      Class<T> type,
      Supplier<CompletableFuture<T>> compute,
      CachePolicy policy) {
    return wrapComposite(parentKey, required, codec.typeOf(type), compute, policy);
  }

  /**
   * 조립을 먼저 시도하고, 실패하면 Single-flight 전체 계산 후 컴포넌트로 분해해 저장합니다.
   *
   * <p>Stale-while-revalidate는 적용하지 않습니다. 부모 키의 에러 마커가 살아있으면 계산 없이 실패를 반환합니다.
   */
  public <T> CompletableFuture<T> wrapComposite(
      CacheKey parentKey,
      Set<MetaComponentType> required,
      JavaType type,
      Supplier<CompletableFuture<T>> compute,
      CachePolicy policy) {
    Reconstruction result = collect(parentKey, required);
    if (result.complete()) {
      Optional<Cached<T>> decoded = decodeAssembled(parentKey, result.assembled().get(), type);
      if (decoded.isPresent()) {
        healthMonitor.recordHit(parentKey.category());
        return CompletableFuture.completedFuture(decoded.get().value());
      }
    }

    CacheLookup parent = wrapper.lookup(parentKey);
    if (parent.state() == CacheLookup.State.ERROR_CACHED) {
      healthMonitor.recordErrorCacheHit(parentKey.category());
      return CompletableFuture.failedFuture(CacheWrapper.cachedFailure(parent.entry()));
    }
    if (result.complete()) {
      // 조립은 됐지만 요청 타입으로 변환 불가
      healthMonitor.recordMiss(parentKey.category());
    } else {
      recordLookup(parentKey, result);
    }

    return wrapper.load(
        parentKey,
        compute,
        policy,
        LoadMode.COMPOSITE,
        () ->
            collect(parentKey, required)
                .assembled()
                .flatMap(node -> this.<T>decodeAssembled(parentKey, node, type)),
        (value, createdAt) -> storeComputed(parentKey, value, createdAt));
  }

  private record Reconstruction(Optional<ObjectNode> assembled, int present, int required) {

    boolean complete() {
      return assembled.isPresent();
    }
  }

  private Reconstruction collect(CacheKey parentKey, Set<MetaComponentType> required) {
    Map<MetaComponentType, JsonNode> found = new EnumMap<>(MetaComponentType.class);
    for (MetaComponentType type : required) {
      CacheKey key = componentKey(parentKey, type);
      CacheLookup lookup = wrapper.lookup(key);
      if (lookup.state() != CacheLookup.State.FRESH) {
        continue;
      }
      Optional<Cached<JsonNode>> decoded = wrapper.decode(key, lookup.entry(), nodeType);
      if (decoded.isEmpty()) {
        continue;
      }
      JsonNode node = decoded.get().value();
      if (node == null || !node.isObject()) {
        wrapper.discardCorrupted(key, new IllegalStateException("component is not an object"));
        continue;
      }
      found.put(type, node);
    }
    Optional<ObjectNode> assembled =
        !required.isEmpty() && found.size() == required.size()
            ? Optional.of(MetaDecomposer.assemble(found))
            : Optional.empty();
    return new Reconstruction(assembled, found.size(), required.size());
  }

  private void recordLookup(CacheKey parentKey, Reconstruction result) {
    if (result.complete()) {
      healthMonitor.recordHit(parentKey.category());
    } else if (result.present() > 0) {
      log.debug(
          "[MetaComponentCache] Partial hit: key={} present={}/{}",
          parentKey,
          result.present(),
          result.required());
      healthMonitor.recordPartialHit(parentKey.category());
    } else {
      healthMonitor.recordMiss(parentKey.category());
    }
  }

  private <T> Optional<Cached<T>> decodeAssembled(
      CacheKey parentKey, ObjectNode node, JavaType type) {
    String rendered = parentKey.asString();
    return executor.executeOrCatch(
        () -> Optional.of(new Cached<T>(codec.<T>fromTree(rendered, node, type))),
        e -> {
          log.warn(
              "[MetaComponentCache] Assembled meta not convertible, recomputing: key={} cause={}",
              rendered,
              e.getMessage());
          return Optional.empty();
        },
        TaskContext.of("MetaComponentCache", "Decode", rendered));
  }

  // 계산 성공 시 컴포넌트 저장 후 부모 키의 에러 마커 제거
  private void storeComputed(CacheKey parentKey, Object value, long createdAt) {
    String rendered = parentKey.asString();
    executor.executeOrCatch(
        () -> {
          store(parentKey, value, createdAt);
          return store.delete(rendered);
        },
        e -> {
          log.warn(
              "[MetaComponentCache] Component store failed: key={} cause={}", rendered, e.getMessage());
          return false;
        },
        TaskContext.of("MetaComponentCache", "Store", rendered));
  }
}
