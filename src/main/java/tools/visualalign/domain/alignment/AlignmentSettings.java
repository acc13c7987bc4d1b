package tools.visualalign.domain.alignment;

import java.util.Objects;
import tools.visualalign.domain.setting.Setting;
import tools.visualalign.domain.setting.SettingRepository;

/**
 * Immutable parameters of a single alignment call. Use {@link #defaults()} or
 * {@link #from(SettingRepository)}, then the {@code with...} methods for per-call overrides.
 */
public final class AlignmentSettings {
  private final int whiteThreshold;
  private final int maxFeatures;
  private final double matchRatio;
  private final double ransacReprojectionThreshold;
  private final int eccMaxIterations;
  private final double eccEpsilon;
  private final int eccGaussianKernelSize;

  private AlignmentSettings(int whiteThreshold, int maxFeatures, double matchRatio,
      double ransacReprojectionThreshold, int eccMaxIterations, double eccEpsilon,
      int eccGaussianKernelSize) {
    if (whiteThreshold < 0 || whiteThreshold > 256) {
      throw new IllegalArgumentException("White threshold must be in [0, 256]: " + whiteThreshold);
    }
    if (maxFeatures < 1) {
      throw new IllegalArgumentException("Max features must be positive: " + maxFeatures);
    }
    if (!(matchRatio > 0.0 && matchRatio <= 1.0)) {
      throw new IllegalArgumentException("Match ratio must be in (0, 1]: " + matchRatio);
    }
    if (!(ransacReprojectionThreshold > 0.0)) {
      throw new IllegalArgumentException(
          "RANSAC reprojection threshold must be positive: " + ransacReprojectionThreshold);
    }
    if (eccMaxIterations < 1) {
      throw new IllegalArgumentException("ECC iterations must be positive: " + eccMaxIterations);
    }
    if (!(eccEpsilon >= 0.0)) {
      throw new IllegalArgumentException("ECC epsilon must not be negative: " + eccEpsilon);
    }
    if (eccGaussianKernelSize < 1 || eccGaussianKernelSize % 2 == 0) {
      throw new IllegalArgumentException(
          "ECC Gaussian kernel size must be odd and positive: " + eccGaussianKernelSize);
    }

    this.whiteThreshold = whiteThreshold;
    this.maxFeatures = maxFeatures;
    this.matchRatio = matchRatio;
    this.ransacReprojectionThreshold = ransacReprojectionThreshold;
    this.eccMaxIterations = eccMaxIterations;
    this.eccEpsilon = eccEpsilon;
    this.eccGaussianKernelSize = eccGaussianKernelSize;
  }

  public static AlignmentSettings defaults() {
    return new AlignmentSettings((Integer) Setting.WHITE_THRESHOLD.getDefaultValue(),
        (Integer) Setting.MAX_FEATURES.getDefaultValue(),
        (Double) Setting.MATCH_RATIO.getDefaultValue(),
        (Double) Setting.RANSAC_REPROJECTION_THRESHOLD.getDefaultValue(),
        (Integer) Setting.ECC_MAX_ITERATIONS.getDefaultValue(),
        (Double) Setting.ECC_EPSILON.getDefaultValue(),
        (Integer) Setting.ECC_GAUSSIAN_KERNEL_SIZE.getDefaultValue());
  }

  /**
   * Reads every alignment setting from a repository, falling back to the defaults.
   *
   * @param settings The repository to read from.
   * @return The settings.
   */
  public static AlignmentSettings from(SettingRepository settings) {
    Objects.requireNonNull(settings, "settings");
    AlignmentSettings defaults = defaults();

    return new AlignmentSettings(
        settings.get(Setting.WHITE_THRESHOLD, defaults.whiteThreshold),
        settings.get(Setting.MAX_FEATURES, defaults.maxFeatures),
        settings.get(Setting.MATCH_RATIO, defaults.matchRatio),
        settings.get(Setting.RANSAC_REPROJECTION_THRESHOLD, defaults.ransacReprojectionThreshold),
        settings.get(Setting.ECC_MAX_ITERATIONS, defaults.eccMaxIterations),
        settings.get(Setting.ECC_EPSILON, defaults.eccEpsilon),
        settings.get(Setting.ECC_GAUSSIAN_KERNEL_SIZE, defaults.eccGaussianKernelSize));
  }

  public AlignmentSettings withWhiteThreshold(int value) {
    return new AlignmentSettings(value, maxFeatures, matchRatio, ransacReprojectionThreshold,
        eccMaxIterations, eccEpsilon, eccGaussianKernelSize);
  }

  public AlignmentSettings withMaxFeatures(int value) {
    return new AlignmentSettings(whiteThreshold, value, matchRatio, ransacReprojectionThreshold,
        eccMaxIterations, eccEpsilon, eccGaussianKernelSize);
  }

  public AlignmentSettings withMatchRatio(double value) {
    return new AlignmentSettings(whiteThreshold, maxFeatures, value, ransacReprojectionThreshold,
        eccMaxIterations, eccEpsilon, eccGaussianKernelSize);
  }

  public AlignmentSettings withRansacReprojectionThreshold(double value) {
    return new AlignmentSettings(whiteThreshold, maxFeatures, matchRatio, value, eccMaxIterations,
        eccEpsilon, eccGaussianKernelSize);
  }

  public AlignmentSettings withEccMaxIterations(int value) {
    return new AlignmentSettings(whiteThreshold, maxFeatures, matchRatio,
        ransacReprojectionThreshold, value, eccEpsilon, eccGaussianKernelSize);
  }

  public AlignmentSettings withEccEpsilon(double value) {
    return new AlignmentSettings(whiteThreshold, maxFeatures, matchRatio,
        ransacReprojectionThreshold, eccMaxIterations, value, eccGaussianKernelSize);
  }

  public AlignmentSettings withEccGaussianKernelSize(int value) {
    return new AlignmentSettings(whiteThreshold, maxFeatures, matchRatio,
        ransacReprojectionThreshold, eccMaxIterations, eccEpsilon, value);
  }

  public int getWhiteThreshold() {
    return whiteThreshold;
  }

  public int getMaxFeatures() {
    return maxFeatures;
  }

  public double getMatchRatio() {
    return matchRatio;
  }

  public double getRansacReprojectionThreshold() {
    return ransacReprojectionThreshold;
  }

  public int getEccMaxIterations() {
    return eccMaxIterations;
  }

  public double getEccEpsilon() {
    return eccEpsilon;
  }

  public int getEccGaussianKernelSize() {
    return eccGaussianKernelSize;
  }

  @Override
  public String toString() {
    return "AlignmentSettings[whiteThreshold=" + whiteThreshold + ", maxFeatures=" + maxFeatures
        + ", matchRatio=" + matchRatio + ", ransacReprojectionThreshold="
        + ransacReprojectionThreshold + ", eccMaxIterations=" + eccMaxIterations
        + ", eccEpsilon=" + eccEpsilon + ", eccGaussianKernelSize=" + eccGaussianKernelSize + "]";
  }
}
