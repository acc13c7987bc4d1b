package tools.visualalign.domain.diff;

/**
 * The four classes a pixel of a diff image falls into. Exactly one applies to every pixel.
 */
public enum PixelCategory {
  BACKGROUND,
  OVERLAP,
  REFERENCE_ONLY,
  COMPARISON_ONLY;

  /**
   * @param referenceContent Whether the reference pixel is content.
   * @param comparisonContent Whether the aligned comparison pixel is content.
   * @return The category.
   */
  public static PixelCategory classify(boolean referenceContent, boolean comparisonContent) {
    if (referenceContent) {
      return comparisonContent ? OVERLAP : REFERENCE_ONLY;
    }
    return comparisonContent ? COMPARISON_ONLY : BACKGROUND;
  }
}
