package tools.visualalign.domain.mask;

import tools.visualalign.domain.image.GrayscaleImage;

/**
 * Scores how much of a reference page's content is still present, at the same location, in an
 * aligned comparison page.
 */
public class OverlapScorer {
  private OverlapScorer() {}

  /**
   * Computes {@code |reference AND comparison| / |reference|}.
   *
   * @param reference The reference mask.
   * @param comparison The comparison mask, same dimensions.
   * @return The overlap ratio in [0, 1], or 0 when the reference has no content.
   * @throws tools.visualalign.exceptions.DimensionMismatchException When the masks differ in
   *         size.
   */
  public static double overlapRatio(ContentMask reference, ContentMask comparison) {
    reference.requireSameDimensions(comparison);
    int referenceContent = reference.count();
    if (referenceContent == 0) {
      return 0.0;
    }

    return (double) reference.countIntersection(comparison) / referenceContent;
  }

  /**
   * Thresholds both images and computes their overlap ratio.
   *
   * @param reference The reference image.
   * @param alignedComparison The comparison image, already on the reference's grid.
   * @param whiteThreshold Intensities below this value are content.
   * @return The overlap ratio in [0, 1].
   */
  public static double overlapRatio(GrayscaleImage reference, GrayscaleImage alignedComparison,
      int whiteThreshold) {
    return overlapRatio(ContentMask.of(reference, whiteThreshold),
        ContentMask.of(alignedComparison, whiteThreshold));
  }

  /**
   * The complement of the overlap ratio, shown per page in outlines and summaries.
   *
   * @param overlapRatio An overlap ratio in [0, 1].
   * @return {@code 1 - overlapRatio}.
   */
  public static double differenceRate(double overlapRatio) {
    return 1.0 - overlapRatio;
  }
}
