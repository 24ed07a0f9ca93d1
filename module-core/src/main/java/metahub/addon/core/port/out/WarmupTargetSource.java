package metahub.addon.core.port.out;

import java.util.List;
import metahub.addon.core.domain.config.UserConfig;
import metahub.addon.core.domain.warming.WarmupTarget;

/**
 * Port supplying warming targets together with their upstream computations.
 *
 * <p>Implemented by provider adapters. Every method may return an empty list.
 */
public interface WarmupTargetSource {

  /** User-independent, high-traffic entries such as genre lists and provider catalogs. */
  List<WarmupTarget> essentialTargets();

  /** Content likely to be requested after the given item, e.g. its collection or episodes. */
  default List<WarmupTarget> relatedTargets(String id, String type) {
    return List.of();
  }

  /** First page of a catalog rendered for a specific user configuration. */
  default List<WarmupTarget> catalogTargets(UserConfig config, String catalogId, String type) {
    return List.of();
  }
}
