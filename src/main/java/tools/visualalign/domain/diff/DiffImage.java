package tools.visualalign.domain.diff;

import java.awt.image.BufferedImage;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * An RGB rendering of the per-pixel classification of two aligned pages, with the number of
 * pixels in each {@link PixelCategory}.
 */
public final class DiffImage {
  private final BufferedImage image;
  private final Map<PixelCategory, Integer> counts;
  private final ColorScheme scheme;

  DiffImage(BufferedImage image, Map<PixelCategory, Integer> counts, ColorScheme scheme) {
    this.image = image;
    this.counts = Collections.unmodifiableMap(new EnumMap<>(counts));
    this.scheme = scheme;
  }

  /**
   * @return A copy of the {@link BufferedImage#TYPE_INT_RGB} rendering.
   */
  public BufferedImage toBufferedImage() {
    BufferedImage copy =
        new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
    copy.setData(image.getRaster());

    return copy;
  }

  public int getWidth() {
    return image.getWidth();
  }

  public int getHeight() {
    return image.getHeight();
  }

  /**
   * @return The packed 0xRRGGBB color at {@code (x, y)}.
   */
  public int getRgb(int x, int y) {
    return image.getRGB(x, y) & 0xFFFFFF;
  }

  /**
   * @return The packed 0xRRGGBB colors, row-major.
   */
  public int[] toRgbArray() {
    int[] rgb = image.getRGB(0, 0, getWidth(), getHeight(), null, 0, getWidth());
    for (int i = 0; i < rgb.length; i++) {
      rgb[i] &= 0xFFFFFF;
    }
    return rgb;
  }

  public int count(PixelCategory category) {
    return counts.getOrDefault(category, 0);
  }

  public Map<PixelCategory, Integer> getCounts() {
    return counts;
  }

  public ColorScheme getScheme() {
    return scheme;
  }
}
