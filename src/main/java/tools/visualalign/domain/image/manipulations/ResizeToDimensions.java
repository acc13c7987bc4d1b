package tools.visualalign.domain.image.manipulations;

import tools.visualalign.domain.image.GrayscaleImage;
import tools.visualalign.domain.image.ImageManipulation;
import tools.visualalign.utils.ImageUtil;

/**
 * Resamples an image onto a fixed pixel grid with an area-weighted filter. Images that already
 * match are returned as they are.
 */
public class ResizeToDimensions implements ImageManipulation {
  private final int width;
  private final int height;

  public ResizeToDimensions(int width, int height) {
    if (width < 1 || height < 1) {
      throw new IllegalArgumentException(
          String.format("Target dimensions must be positive, got %dx%d", width, height));
    }
    this.width = width;
    this.height = height;
  }

  /**
   * @param reference The image whose dimensions become the target.
   * @return A manipulation resizing to the reference's grid.
   */
  public static ResizeToDimensions of(GrayscaleImage reference) {
    return new ResizeToDimensions(reference.getWidth(), reference.getHeight());
  }

  @Override
  public GrayscaleImage manipulate(GrayscaleImage image) {
    return ImageUtil.resizeArea(image, width, height);
  }
}
