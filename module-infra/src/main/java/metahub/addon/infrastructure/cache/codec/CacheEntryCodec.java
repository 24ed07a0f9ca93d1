package metahub.addon.infrastructure.cache.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import metahub.addon.core.domain.cache.CacheEntry;
import metahub.addon.error.exception.CacheCodecException;
import metahub.addon.infrastructure.executor.LogicExecutor;
import metahub.addon.infrastructure.executor.TaskContext;
import metahub.addon.infrastructure.executor.strategy.ExceptionTranslator;
import org.springframework.stereotype.Component;

/**
 * 캐시 항목 JSON 코덱
 *
 * <p>저장 포맷은 {@link CacheEntry} 전체를 담은 JSON 문자열입니다. Redis Lua 스크립트가 {@code createdAt}을 직접 읽을 수 있도록
 * 평문 JSON을 유지합니다.
 *
 * <h4>손상 판정</h4>
 *
 * <ul>
 *   <li>JSON 파싱 실패
 *   <li>저장된 키와 요청한 키 불일치
 *   <li>요청 타입으로 변환 불가
 * </ul>
 *
 * <p>모두 {@link CacheCodecException}으로 변환되며, 호출자는 해당 항목을 삭제하고 miss로 처리합니다.
 */
@Slf4j
@Component
public class CacheEntryCodec {

  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;

  public CacheEntryCodec(ObjectMapper objectMapper, LogicExecutor executor) {
    this.objectMapper =
        objectMapper
            .copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    this.executor = executor;
  }

  public String encode(CacheEntry entry) {
    return executor.executeWithTranslation(
        () -> objectMapper.writeValueAsString(entry),
        ExceptionTranslator.forJson(),
        TaskContext.of("CacheCodec", "Encode", entry.key()));
  }

  public CacheEntry decode(String key, String raw) {
    CacheEntry entry =
        executor.executeWithTranslation(
            () -> objectMapper.readValue(raw, CacheEntry.class),
            ExceptionTranslator.forJson(),
            TaskContext.of("CacheCodec", "Decode", key));
    if (!key.equals(entry.key())) {
      throw new CacheCodecException("key mismatch: " + key, null);
    }
    return entry;
  }

  public JsonNode toTree(Object value) {
    return executor.executeWithTranslation(
        () -> objectMapper.valueToTree(value),
        ExceptionTranslator.forJson(),
        TaskContext.of("CacheCodec", "ToTree", value == null ? "null" : value.getClass().getName()));
  }

  public <T> T fromTree(String key, JsonNode node, JavaType type) {
    return executor.executeWithTranslation(
        () -> objectMapper.<T>convertValue(node, type),
        ExceptionTranslator.forJson(),
        TaskContext.of("CacheCodec", "FromTree", key));
  }

  public JavaType typeOf(Class<?> type) {
    return objectMapper.constructType(type);
  }

  public JavaType typeOf(TypeReference<?> type) {
    return objectMapper.getTypeFactory().constructType(type);
  }

  /** Canonical JSON bytes, used by fingerprinting. Map keys are sorted. */
  public byte[] canonicalBytes(Object value) {
    return executor.executeWithTranslation(
        () ->
            objectMapper
                .writer()
                .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .writeValueAsBytes(canonicalTree(value)),
        ExceptionTranslator.forJson(),
        TaskContext.of("CacheCodec", "Canonical"));
  }

  // POJO/JsonNode 필드 순서를 정렬하기 위해 Map/List 트리로 변환
  private Object canonicalTree(Object value) {
    return value == null ? null : objectMapper.convertValue(value, Object.class);
  }
}
