package tools.visualalign.domain.alignment;

import java.util.Objects;
import tools.visualalign.domain.image.GrayscaleImage;
import tools.visualalign.domain.mask.OverlapScorer;

/**
 * The comparison page warped onto the reference page's grid, with its overlap score and the
 * transform that produced it.
 */
public final class AlignmentResult {
  private final GrayscaleImage alignedImage;
  private final double overlapRatio;
  private final AffineTransform transform;
  private final String strategyName;

  public AlignmentResult(GrayscaleImage alignedImage, double overlapRatio,
      AffineTransform transform, String strategyName) {
    if (!(overlapRatio >= 0.0 && overlapRatio <= 1.0)) {
      throw new IllegalArgumentException("Overlap ratio must be in [0, 1]: " + overlapRatio);
    }
    this.alignedImage = Objects.requireNonNull(alignedImage, "alignedImage");
    this.overlapRatio = overlapRatio;
    this.transform = Objects.requireNonNull(transform, "transform");
    this.strategyName = Objects.requireNonNull(strategyName, "strategyName");
  }

  public GrayscaleImage getAlignedImage() {
    return alignedImage;
  }

  public double getOverlapRatio() {
    return overlapRatio;
  }

  public double getDifferenceRate() {
    return OverlapScorer.differenceRate(overlapRatio);
  }

  /**
   * @param threshold The low-overlap threshold, usually 0.15.
   * @return {@code true} when the pages may not depict the same content.
   */
  public boolean isLowOverlap(double threshold) {
    return overlapRatio < threshold;
  }

  public AffineTransform getTransform() {
    return transform;
  }

  public String getStrategyName() {
    return strategyName;
  }

  @Override
  public String toString() {
    return String.format("AlignmentResult[overlap=%.4f, strategy=%s, transform=%s]", overlapRatio,
        strategyName, transform);
  }
}
