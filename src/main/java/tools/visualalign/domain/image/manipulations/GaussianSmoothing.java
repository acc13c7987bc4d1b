package tools.visualalign.domain.image.manipulations;

import tools.visualalign.domain.image.GrayscaleImage;
import tools.visualalign.domain.image.ImageManipulation;
import tools.visualalign.utils.ImageUtil;

/**
 * Suppresses high-frequency scan noise with a square Gaussian kernel.
 */
public class GaussianSmoothing implements ImageManipulation {
  private final int kernelSize;

  /**
   * @param kernelSize Side of the square kernel. Must be odd and positive.
   */
  public GaussianSmoothing(int kernelSize) {
    if (kernelSize < 1 || kernelSize % 2 == 0) {
      throw new IllegalArgumentException("Kernel size must be odd and positive: " + kernelSize);
    }
    this.kernelSize = kernelSize;
  }

  @Override
  public GrayscaleImage manipulate(GrayscaleImage image) {
    return ImageUtil.applyGaussianBlur(image, kernelSize);
  }

  public int getKernelSize() {
    return kernelSize;
  }
}
