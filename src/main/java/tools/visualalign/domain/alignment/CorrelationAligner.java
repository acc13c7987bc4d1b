package tools.visualalign.domain.alignment;

import org.opencv.core.CvException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.TermCriteria;
import org.opencv.video.Video;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.visualalign.domain.image.GrayscaleImage;
import tools.visualalign.domain.image.ImageManipulation;
import tools.visualalign.domain.image.manipulations.GaussianSmoothing;
import tools.visualalign.domain.image.manipulations.ResizeToDimensions;
import tools.visualalign.exceptions.ImageProcessingException;
import tools.visualalign.utils.ImageUtil;

/**
 * Dense fallback for pages with too few distinctive marks. Both pages are smoothed, then the
 * enhanced correlation coefficient is maximised over a Euclidean motion (rotation and
 * translation) seeded at the identity.
 *
 * <p>
 * OpenCV failures (no convergence, constant images, degenerate Hessian) are logged and reported as
 * not applicable, so the caller ends up with the identity transform.
 */
public class CorrelationAligner implements AlignmentStrategy {
  public static final String NAME = "correlation";

  private static final Logger logger = LoggerFactory.getLogger(CorrelationAligner.class);

  private final int maxIterations;
  private final double epsilon;
  private final int kernelSize;
  private final ImageManipulation smoothing;

  public CorrelationAligner() {
    this(AlignmentSettings.defaults());
  }

  public CorrelationAligner(AlignmentSettings settings) {
    this.maxIterations = settings.getEccMaxIterations();
    this.epsilon = settings.getEccEpsilon();
    this.kernelSize = settings.getEccGaussianKernelSize();
    this.smoothing = new GaussianSmoothing(kernelSize);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public AlignmentOutcome estimate(GrayscaleImage reference, GrayscaleImage comparison) {
    Mat template = null;
    Mat input = null;
    Mat warp = null;
    Mat inputMask = null;

    try {
      GrayscaleImage resized = ResizeToDimensions.of(reference).manipulate(comparison);
      template = ImageUtil.toMat(smoothing.manipulate(reference));
      input = ImageUtil.toMat(smoothing.manipulate(resized));
      warp = Mat.eye(2, 3, CvType.CV_32F);
      inputMask = new Mat();

      TermCriteria criteria =
          new TermCriteria(TermCriteria.COUNT + TermCriteria.EPS, maxIterations, epsilon);
      double correlation = Video.findTransformECC(template, input, warp, Video.MOTION_EUCLIDEAN,
          criteria, inputMask, kernelSize);

      // ECC maps reference coordinates into the comparison page; invert it so every strategy
      // yields comparison -> reference.
      AffineTransform referenceToComparison = AffineTransform.fromMat(warp);
      if (!Double.isFinite(correlation) || !referenceToComparison.isWellFormed()) {
        logger.warn("Correlation alignment produced a degenerate result (cc={}, warp={})",
            correlation, referenceToComparison);
        return AlignmentOutcome.notApplicable(NAME, "degenerate warp");
      }

      AffineTransform transform = referenceToComparison.inverse();
      logger.debug("Correlation alignment converged to {} (cc={})", transform, correlation);
      return AlignmentOutcome.success(NAME, transform);
    } catch (CvException | ImageProcessingException e) {
      logger.warn("Correlation alignment failed, falling back", e);
      return AlignmentOutcome.notApplicable(NAME, "OpenCV error: " + e.getMessage());
    } finally {
      ImageUtil.release(template, input, warp, inputMask);
    }
  }
}
