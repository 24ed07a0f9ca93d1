package metahub.addon.service.cache;

/** Why a single-flight load runs; decides which health outcomes it reports. */
enum LoadMode {
  /** Caller found no usable entry. Success counts as miss, failure as error. */
  FOREGROUND,
  /** Background refresh after a stale hit. Only failures are counted; no error marker. */
  REFRESH,
  /** Full recompute of a composite after reconstruction failed; the lookup already counted. */
  COMPOSITE
}
