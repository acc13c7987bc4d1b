package tools.visualalign.domain.mask;

import java.util.BitSet;
import tools.visualalign.domain.image.GrayscaleImage;
import tools.visualalign.exceptions.DimensionMismatchException;

/**
 * Boolean classification of each pixel as content (ink) or background (paper). A pixel is content
 * when its intensity is strictly below the white threshold; values at or above it are background.
 */
public final class ContentMask {
  public static final int DEFAULT_WHITE_THRESHOLD = 250;

  private final int width;
  private final int height;
  private final BitSet content;

  private ContentMask(int width, int height, BitSet content) {
    this.width = width;
    this.height = height;
    this.content = content;
  }

  /**
   * Thresholds an image with the default white threshold.
   *
   * @param image The source image.
   * @return The mask.
   */
  public static ContentMask of(GrayscaleImage image) {
    return of(image, DEFAULT_WHITE_THRESHOLD);
  }

  /**
   * Thresholds an image.
   *
   * @param image The source image.
   * @param whiteThreshold Intensities below this value are content. 0 yields an empty mask, 256 a
   *        full one.
   * @return The mask.
   */
  public static ContentMask of(GrayscaleImage image, int whiteThreshold) {
    int pixelCount = image.getPixelCount();
    BitSet content = new BitSet(pixelCount);

    for (int i = 0; i < pixelCount; i++) {
      if (image.get(i) < whiteThreshold) {
        content.set(i);
      }
    }

    return new ContentMask(image.getWidth(), image.getHeight(), content);
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public boolean isContent(int x, int y) {
    return content.get(y * width + x);
  }

  public boolean isContent(int index) {
    return content.get(index);
  }

  /**
   * @return The number of content pixels.
   */
  public int count() {
    return content.cardinality();
  }

  public boolean isEmpty() {
    return content.isEmpty();
  }

  /**
   * @param other A mask on the same pixel grid.
   * @return The number of pixels that are content in both masks.
   */
  public int countIntersection(ContentMask other) {
    requireSameDimensions(other);
    BitSet both = (BitSet) content.clone();
    both.and(other.content);

    return both.cardinality();
  }

  void requireSameDimensions(ContentMask other) {
    if (width != other.width || height != other.height) {
      throw new DimensionMismatchException(width, height, other.width, other.height);
    }
  }
}
