package metahub.addon.service.cache;

import com.fasterxml.jackson.databind.JsonNode;
import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * 빈 계산 결과 판별기
 *
 * <p>null, {@code false}, 빈 문자열/컬렉션/맵/배열/Optional, 빈 JSON 컨테이너를 빈 값으로 봅니다. JSON 객체는 카탈로그
 * 응답({@code metas}가 빈 배열)과 메타 응답({@code meta}가 null 또는 빈 객체)도 빈 값으로 판정합니다.
 */
public final class EmptyResultDetector {

  private EmptyResultDetector() {}

  public static boolean isEmpty(Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof Boolean bool) {
      return !bool;
    }
    if (value instanceof CharSequence text) {
      return text.length() == 0;
    }
    if (value instanceof Collection<?> collection) {
      return collection.isEmpty();
    }
    if (value instanceof Map<?, ?> map) {
      return map.isEmpty() || isEmptyEnvelope(map);
    }
    if (value instanceof Optional<?> optional) {
      return optional.isEmpty();
    }
    if (value instanceof JsonNode node) {
      return isEmptyNode(node);
    }
    if (value.getClass().isArray()) {
      return Array.getLength(value) == 0;
    }
    return false;
  }

  private static boolean isEmptyNode(JsonNode node) {
    if (node.isNull() || node.isMissingNode()) {
      return true;
    }
    if (node.isBoolean()) {
      return !node.booleanValue();
    }
    if (node.isTextual()) {
      return node.textValue().isEmpty();
    }
    if (node.isContainerNode() && node.isEmpty()) {
      return true;
    }
    if (node.isObject()) {
      JsonNode metas = node.get("metas");
      if (metas != null && metas.isArray() && metas.isEmpty()) {
        return true;
      }
      if (node.has("meta")) {
        JsonNode meta = node.get("meta");
        return meta.isNull() || (meta.isContainerNode() && meta.isEmpty());
      }
    }
    return false;
  }

  private static boolean isEmptyEnvelope(Map<?, ?> map) {
    if (map.containsKey("metas") && map.get("metas") instanceof Collection<?> metas) {
      return metas.isEmpty();
    }
    if (map.containsKey("meta")) {
      Object meta = map.get("meta");
      return meta == null || (meta instanceof Map<?, ?> inner && inner.isEmpty());
    }
    return false;
  }
}
