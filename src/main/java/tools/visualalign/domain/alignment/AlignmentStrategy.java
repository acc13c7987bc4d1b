package tools.visualalign.domain.alignment;

import tools.visualalign.domain.image.GrayscaleImage;

/**
 * One way of estimating the transform that maps a comparison page onto a reference page.
 * Implementations must be stateless and must not throw for any image content; they report
 * {@link AlignmentOutcome#notApplicable(String, String)} instead.
 */
public interface AlignmentStrategy {
  String name();

  /**
   * @param reference The reference page.
   * @param comparison The comparison page. May differ in size from the reference.
   * @return The outcome.
   */
  AlignmentOutcome estimate(GrayscaleImage reference, GrayscaleImage comparison);
}
