package metahub.addon.core.domain.warming;

public enum WarmingStatus {
  NEVER,
  SUCCESS,
  PARTIAL,
  FAILED
}
