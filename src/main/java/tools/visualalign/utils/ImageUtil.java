package tools.visualalign.utils;

import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.opencv.core.CvException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import tools.visualalign.domain.alignment.AffineTransform;
import tools.visualalign.domain.image.GrayscaleImage;
import tools.visualalign.exceptions.ImageProcessingException;

/**
 * Utility class bridging {@link GrayscaleImage} and OpenCV.
 */
public class ImageUtil {
  private ImageUtil() {}

  /**
   * Loads the bundled OpenCV natives. Safe to call repeatedly.
   */
  public static void loadOpenCv() {
    OpenCV.loadLocally();
  }

  /**
   * Copies an image into a new single-channel 8-bit {@link Mat}. The caller owns the result and
   * must release it.
   *
   * @param image The image to copy.
   * @return A {@code CV_8UC1} mat with the same samples.
   */
  public static Mat toMat(GrayscaleImage image) {
    loadOpenCv();

    Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC1);
    mat.put(0, 0, image.toByteArray());

    return mat;
  }

  /**
   * Copies a single-channel 8-bit {@link Mat} into a new image. The mat is untouched.
   *
   * @param mat The mat to copy.
   * @return The image.
   */
  public static GrayscaleImage toGrayscaleImage(Mat mat) {
    if (mat.empty() || mat.type() != CvType.CV_8UC1) {
      throw new ImageProcessingException(
          "Expected a non-empty CV_8UC1 mat, got " + CvType.typeToString(mat.type()));
    }

    byte[] samples = new byte[mat.rows() * mat.cols()];
    mat.get(0, 0, samples);

    return new GrayscaleImage(mat.cols(), mat.rows(), samples);
  }

  /**
   * Resizes an image with area-weighted resampling. Returns the input itself when it already has
   * the requested dimensions.
   *
   * @param image The image to resize.
   * @param width Target width.
   * @param height Target height.
   * @return The resized image.
   */
  public static GrayscaleImage resizeArea(GrayscaleImage image, int width, int height) {
    if (image.getWidth() == width && image.getHeight() == height) {
      return image;
    }

    Mat original = null;
    Mat processed = null;

    try {
      original = toMat(image);
      processed = new Mat();
      Imgproc.resize(original, processed, new Size(width, height), 0, 0, Imgproc.INTER_AREA);

      return toGrayscaleImage(processed);
    } catch (CvException e) {
      throw new ImageProcessingException(e);
    } finally {
      release(original, processed);
    }
  }

  /**
   * Apply a Gaussian blur to an image. The standard deviation is derived from the kernel size.
   *
   * @param image The image to blur.
   * @param kernelSize The size of the square kernel, odd and positive.
   * @return The blurred image.
   */
  public static GrayscaleImage applyGaussianBlur(GrayscaleImage image, int kernelSize) {
    Mat original = null;
    Mat processed = null;

    try {
      original = toMat(image);
      processed = new Mat();
      Imgproc.GaussianBlur(original, processed, new Size(kernelSize, kernelSize), 0);

      return toGrayscaleImage(processed);
    } catch (CvException e) {
      throw new ImageProcessingException(e);
    } finally {
      release(original, processed);
    }
  }

  /**
   * Warps an image by an affine transform into a grid of the given size. Pixels that map from
   * outside the source are filled with white so they read as blank paper.
   *
   * @param image The image to warp.
   * @param transform Maps source coordinates to destination coordinates.
   * @param width Width of the destination grid.
   * @param height Height of the destination grid.
   * @return The warped image.
   */
  public static GrayscaleImage warpAffine(GrayscaleImage image, AffineTransform transform,
      int width, int height) {
    Mat original = null;
    Mat matrix = null;
    Mat processed = null;

    try {
      original = toMat(image);
      matrix = transform.toMat();
      processed = new Mat();
      Imgproc.warpAffine(original, processed, matrix, new Size(width, height),
          Imgproc.INTER_LINEAR, Core.BORDER_CONSTANT, new Scalar(GrayscaleImage.WHITE));

      return toGrayscaleImage(processed);
    } catch (CvException e) {
      throw new ImageProcessingException(e);
    } finally {
      release(original, matrix, processed);
    }
  }

  /**
   * Releases native memory of every non-null mat.
   *
   * @param mats The mats to release.
   */
  public static void release(Mat... mats) {
    for (Mat mat : mats) {
      if (mat != null) {
        mat.release();
      }
    }
  }
}
