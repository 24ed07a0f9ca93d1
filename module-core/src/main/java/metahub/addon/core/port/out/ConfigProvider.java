package metahub.addon.core.port.out;

import java.util.Optional;
import metahub.addon.core.domain.config.UserConfig;

/**
 * Port for loading per-user configuration.
 *
 * <p>Implemented outside this repository by the configuration database adapter.
 */
public interface ConfigProvider {

  /**
   * @param userId user identifier
   * @return the configuration, or empty if the user is unknown
   */
  Optional<UserConfig> findByUserId(String userId);
}
