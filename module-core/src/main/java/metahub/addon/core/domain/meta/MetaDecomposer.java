package metahub.addon.core.domain.meta;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Splits a meta record into its components and joins them back.
 *
 * <p>Every top-level field goes to exactly one component, chosen by {@link
 * MetaComponentType#owning(String)}. A component without fields is returned as an empty object so
 * that "known to be empty" can be stored and told apart from "missing".
 */
public final class MetaDecomposer {

  private MetaDecomposer() {}

  public static Map<MetaComponentType, ObjectNode> decompose(ObjectNode meta) {
    Objects.requireNonNull(meta, "meta");
    Map<MetaComponentType, ObjectNode> components = new EnumMap<>(MetaComponentType.class);
    for (MetaComponentType type : MetaComponentType.values()) {
      components.put(type, JsonNodeFactory.instance.objectNode());
    }
    Iterator<Map.Entry<String, JsonNode>> fields = meta.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      components.get(MetaComponentType.owning(field.getKey())).set(field.getKey(), field.getValue());
    }
    return components;
  }

  /**
   * Joins components into one record. Fields are taken only from the component that owns them, so
   * a stray field in another component cannot shadow the owner's value.
   */
  public static ObjectNode assemble(Map<MetaComponentType, ? extends JsonNode> components) {
    ObjectNode meta = JsonNodeFactory.instance.objectNode();
    components.forEach(
        (type, node) -> {
          Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
          while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (MetaComponentType.owning(field.getKey()) == type) {
              meta.set(field.getKey(), field.getValue());
            }
          }
        });
    return meta;
  }
}
