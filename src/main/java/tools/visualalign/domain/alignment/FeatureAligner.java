package tools.visualalign.domain.alignment;

import java.util.ArrayList;
import java.util.List;
import org.opencv.calib3d.Calib3d;
import org.opencv.core.Core;
import org.opencv.core.CvException;
import org.opencv.core.DMatch;
import org.opencv.core.KeyPoint;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDMatch;
import org.opencv.core.MatOfKeyPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.features2d.DescriptorMatcher;
import org.opencv.features2d.ORB;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.visualalign.domain.image.GrayscaleImage;
import tools.visualalign.domain.image.manipulations.ResizeToDimensions;
import tools.visualalign.exceptions.ImageProcessingException;
import tools.visualalign.utils.ImageUtil;

/**
 * Estimates a similarity transform from sparse keypoint correspondences. ORB keypoints are
 * detected on both pages, matched by Hamming distance with a nearest/second-nearest ratio test,
 * and a partial affine model (rotation, uniform scale, translation) is fitted with RANSAC.
 *
 * <p>
 * Not applicable when either page has fewer than {@value #MIN_CORRESPONDENCES} keypoints or no
 * descriptors, when fewer than {@value #MIN_CORRESPONDENCES} matches pass the ratio test, or when
 * RANSAC finds no usable model.
 */
public class FeatureAligner implements AlignmentStrategy {
  public static final String NAME = "feature";
  static final int MIN_CORRESPONDENCES = 4;

  private static final Logger logger = LoggerFactory.getLogger(FeatureAligner.class);

  private final int maxFeatures;
  private final double matchRatio;
  private final double ransacReprojectionThreshold;

  public FeatureAligner() {
    this(AlignmentSettings.defaults());
  }

  public FeatureAligner(AlignmentSettings settings) {
    this.maxFeatures = settings.getMaxFeatures();
    this.matchRatio = settings.getMatchRatio();
    this.ransacReprojectionThreshold = settings.getRansacReprojectionThreshold();
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public AlignmentOutcome estimate(GrayscaleImage reference, GrayscaleImage comparison) {
    Mat refMat = null;
    Mat cmpMat = null;
    Mat emptyMask = null;
    MatOfKeyPoint keypoints1 = null;
    MatOfKeyPoint keypoints2 = null;
    Mat descriptors1 = null;
    Mat descriptors2 = null;
    List<MatOfDMatch> knnMatches = new ArrayList<>();
    MatOfPoint2f referencePoints = null;
    MatOfPoint2f comparisonPoints = null;
    Mat inliers = null;
    Mat model = null;

    try {
      GrayscaleImage resized = ResizeToDimensions.of(reference).manipulate(comparison);
      refMat = ImageUtil.toMat(reference);
      cmpMat = ImageUtil.toMat(resized);

      ORB orb = ORB.create(maxFeatures);
      keypoints1 = new MatOfKeyPoint();
      keypoints2 = new MatOfKeyPoint();
      descriptors1 = new Mat();
      descriptors2 = new Mat();
      emptyMask = new Mat();
      orb.detectAndCompute(refMat, emptyMask, keypoints1, descriptors1);
      orb.detectAndCompute(cmpMat, emptyMask, keypoints2, descriptors2);

      KeyPoint[] referenceKeypoints = keypoints1.toArray();
      KeyPoint[] comparisonKeypoints = keypoints2.toArray();
      logger.debug("Detected {} reference and {} comparison keypoints",
          referenceKeypoints.length, comparisonKeypoints.length);

      if (referenceKeypoints.length < MIN_CORRESPONDENCES
          || comparisonKeypoints.length < MIN_CORRESPONDENCES || descriptors1.empty()
          || descriptors2.empty()) {
        return AlignmentOutcome.notApplicable(NAME, "insufficient keypoints");
      }

      DescriptorMatcher matcher = DescriptorMatcher.create(DescriptorMatcher.BRUTEFORCE_HAMMING);
      matcher.knnMatch(descriptors1, descriptors2, knnMatches, 2);

      List<Point> points1 = new ArrayList<>();
      List<Point> points2 = new ArrayList<>();
      for (MatOfDMatch candidates : knnMatches) {
        DMatch[] pair = candidates.toArray();
        if (pair.length < 2) {
          continue;
        }
        if (pair[0].distance < matchRatio * pair[1].distance) {
          points1.add(referenceKeypoints[pair[0].queryIdx].pt);
          points2.add(comparisonKeypoints[pair[0].trainIdx].pt);
        }
      }
      logger.debug("{} of {} matches passed the ratio test", points1.size(), knnMatches.size());

      if (points1.size() < MIN_CORRESPONDENCES) {
        return AlignmentOutcome.notApplicable(NAME, "insufficient matches");
      }

      referencePoints = new MatOfPoint2f();
      comparisonPoints = new MatOfPoint2f();
      referencePoints.fromList(points1);
      comparisonPoints.fromList(points2);

      // Comparison -> reference, so the result warps the comparison page directly
      inliers = new Mat();
      model = Calib3d.estimateAffinePartial2D(comparisonPoints, referencePoints, inliers,
          Calib3d.RANSAC, ransacReprojectionThreshold);

      if (model.empty()) {
        return AlignmentOutcome.notApplicable(NAME, "no RANSAC model");
      }

      AffineTransform transform = AffineTransform.fromMat(model);
      if (!transform.isWellFormed()) {
        return AlignmentOutcome.notApplicable(NAME, "degenerate model " + transform);
      }

      logger.debug("Fitted {} with {} of {} inliers", transform, Core.countNonZero(inliers),
          points1.size());
      return AlignmentOutcome.success(NAME, transform);
    } catch (CvException | ImageProcessingException e) {
      logger.debug("Feature alignment failed", e);
      return AlignmentOutcome.notApplicable(NAME, "OpenCV error: " + e.getMessage());
    } finally {
      for (MatOfDMatch candidates : knnMatches) {
        candidates.release();
      }
      ImageUtil.release(refMat, cmpMat, emptyMask, keypoints1, keypoints2, descriptors1,
          descriptors2, referencePoints, comparisonPoints, inliers, model);
    }
  }
}
