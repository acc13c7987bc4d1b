package tools.visualalign.domain.setting;

/**
 * Every tunable of the library, with its default. Keys double as property names.
 */
public enum Setting {
  WHITE_THRESHOLD("white-threshold", 250),
  LOW_OVERLAP_RATIO("low-overlap-ratio", 0.15),
  DIFF_RATE_ALERT_THRESHOLD("diff-rate-alert-threshold", 0.005),
  MAX_FEATURES("max-features", 5000),
  MATCH_RATIO("match-ratio", 0.75),
  RANSAC_REPROJECTION_THRESHOLD("ransac-reprojection-threshold", 5.0),
  ECC_MAX_ITERATIONS("ecc-max-iterations", 5000),
  ECC_EPSILON("ecc-epsilon", 1e-6),
  ECC_GAUSSIAN_KERNEL_SIZE("ecc-gaussian-kernel-size", 5),
  DEFAULT_COLOR_SCHEME("default-color-scheme", "eye-care-light");

  private final String key;
  private final Object defaultValue;

  Setting(String key, Object defaultValue) {
    this.key = key;
    this.defaultValue = defaultValue;
  }

  public String getKey() {
    return key;
  }

  public Object getDefaultValue() {
    return defaultValue;
  }
}
