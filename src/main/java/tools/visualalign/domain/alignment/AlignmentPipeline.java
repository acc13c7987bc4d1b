package tools.visualalign.domain.alignment;

import java.awt.image.BufferedImage;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.visualalign.domain.image.GrayscaleImage;
import tools.visualalign.domain.image.manipulations.ResizeToDimensions;
import tools.visualalign.domain.mask.OverlapScorer;
import tools.visualalign.exceptions.ImageProcessingException;
import tools.visualalign.utils.ImageUtil;

/**
 * Entry point for aligning a comparison page onto a reference page.
 *
 * <p>
 * The comparison page is resized to the reference's dimensions, a transform is estimated by the
 * configured strategy (by default features, then correlation, then identity), the resized page is
 * warped onto the reference grid with a white border, and the overlap of the two content masks is
 * scored. No exception escapes for any image content: the worst case is the identity transform.
 *
 * <p>
 * Instances hold no mutable state and may be shared between threads.
 */
public class AlignmentPipeline {
  private static final Logger logger = LoggerFactory.getLogger(AlignmentPipeline.class);

  private final AlignmentSettings settings;
  private final AlignmentStrategy aligner;

  public AlignmentPipeline() {
    this(AlignmentSettings.defaults());
  }

  public AlignmentPipeline(AlignmentSettings settings) {
    this(settings, BestEffortAligner.withDefaultChain(settings));
  }

  /**
   * @param settings Settings; only the white threshold is read here.
   * @param aligner The strategy estimating the transform. Outcomes that are not successful are
   *        replaced by the identity.
   */
  public AlignmentPipeline(AlignmentSettings settings, AlignmentStrategy aligner) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.aligner = Objects.requireNonNull(aligner, "aligner");
  }

  /**
   * Aligns two pages. Multi-channel images are collapsed to greyscale first.
   *
   * @param reference The reference page.
   * @param comparison The comparison page.
   * @return The aligned comparison page and its overlap ratio.
   */
  public AlignmentResult align(BufferedImage reference, BufferedImage comparison) {
    return align(GrayscaleImage.fromBufferedImage(reference),
        GrayscaleImage.fromBufferedImage(comparison));
  }

  /**
   * Aligns two pages with per-call settings, using the default strategy chain built from them.
   *
   * @param reference The reference page.
   * @param comparison The comparison page.
   * @param callSettings Settings for this call only.
   * @return The aligned comparison page and its overlap ratio.
   */
  public AlignmentResult align(GrayscaleImage reference, GrayscaleImage comparison,
      AlignmentSettings callSettings) {
    return new AlignmentPipeline(callSettings).align(reference, comparison);
  }

  /**
   * Aligns two pages.
   *
   * @param reference The reference page.
   * @param comparison The comparison page. Any dimensions.
   * @return The aligned comparison page, with the reference's dimensions, and its overlap ratio.
   */
  public AlignmentResult align(GrayscaleImage reference, GrayscaleImage comparison) {
    Objects.requireNonNull(reference, "reference");
    Objects.requireNonNull(comparison, "comparison");
    logger.trace("Aligning {} onto {} with {}", comparison, reference, settings);

    GrayscaleImage resized = resizeOrKeep(reference, comparison);
    AlignmentOutcome outcome = estimate(reference, resized);
    AffineTransform transform = outcome.getTransform().orElse(AffineTransform.identity());
    String strategyName =
        outcome.isSuccess() ? outcome.getStrategyName() : BestEffortAligner.IDENTITY;

    GrayscaleImage aligned;
    try {
      aligned = ImageUtil.warpAffine(resized, transform, reference.getWidth(),
          reference.getHeight());
    } catch (ImageProcessingException e) {
      logger.warn("Could not warp with {}, keeping the unwarped page", transform, e);
      aligned = resized;
      transform = AffineTransform.identity();
      strategyName = BestEffortAligner.IDENTITY;
    }

    double overlapRatio =
        OverlapScorer.overlapRatio(reference, aligned, settings.getWhiteThreshold());
    logger.debug("Overlap {} using {}", overlapRatio, strategyName);

    return new AlignmentResult(aligned, overlapRatio, transform, strategyName);
  }

  private GrayscaleImage resizeOrKeep(GrayscaleImage reference, GrayscaleImage comparison) {
    try {
      return ResizeToDimensions.of(reference).manipulate(comparison);
    } catch (ImageProcessingException e) {
      logger.warn("Could not resize {} to {}, using a blank page", comparison, reference, e);
      return GrayscaleImage.filled(reference.getWidth(), reference.getHeight(),
          GrayscaleImage.WHITE);
    }
  }

  private AlignmentOutcome estimate(GrayscaleImage reference, GrayscaleImage resized) {
    String alignerName = String.valueOf(aligner.name());
    try {
      AlignmentOutcome outcome = aligner.estimate(reference, resized);
      return outcome != null ? outcome
          : AlignmentOutcome.notApplicable(alignerName, "no outcome");
    } catch (RuntimeException e) {
      logger.warn("Aligner {} failed, using the identity", alignerName, e);
      return AlignmentOutcome.notApplicable(alignerName, e.toString());
    }
  }

  public AlignmentSettings getSettings() {
    return settings;
  }
}
