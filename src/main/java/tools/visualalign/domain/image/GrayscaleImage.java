package tools.visualalign.domain.image;

import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.util.Arrays;
import java.util.Objects;

/**
 * An immutable grid of 8-bit intensity samples, stored row-major. 0 is ink, 255 is paper.
 *
 * <p>
 * Every operation of the library treats instances as read-only input and returns new instances.
 */
public final class GrayscaleImage {
  public static final int WHITE = 255;

  private final int width;
  private final int height;
  private final byte[] pixels;

  /**
   * Creates an image from raw samples. The array is copied.
   *
   * @param width Width in pixels, at least 1.
   * @param height Height in pixels, at least 1.
   * @param pixels Row-major samples, exactly {@code width * height} of them.
   */
  public GrayscaleImage(int width, int height, byte[] pixels) {
    this(Objects.requireNonNull(pixels, "pixels").clone(), width, height);
  }

  private GrayscaleImage(byte[] pixels, int width, int height) {
    if (width < 1 || height < 1) {
      throw new IllegalArgumentException(
          String.format("Image dimensions must be positive, got %dx%d", width, height));
    }
    if (pixels.length != (long) width * height) {
      throw new IllegalArgumentException(String.format(
          "Expected %d samples for a %dx%d image, got %d", (long) width * height, width, height,
          pixels.length));
    }

    this.width = width;
    this.height = height;
    this.pixels = pixels;
  }

  /**
   * Creates an image where every sample has the same value.
   *
   * @param width Width in pixels.
   * @param height Height in pixels.
   * @param value Intensity, clamped to [0, 255].
   * @return The new image.
   */
  public static GrayscaleImage filled(int width, int height, int value) {
    if (width < 1 || height < 1) {
      throw new IllegalArgumentException(
          String.format("Image dimensions must be positive, got %dx%d", width, height));
    }
    byte[] samples = new byte[width * height];
    Arrays.fill(samples, (byte) clamp(value));

    return new GrayscaleImage(samples, width, height);
  }

  /**
   * Builds a single-channel copy of any {@link BufferedImage}. Single-band rasters are read as
   * they are; multi-channel images are collapsed with an unweighted average of red, green and
   * blue, so a grey picture stored as three identical channels yields the same samples as its
   * single-channel version. Alpha is ignored.
   *
   * @param image The source image, untouched.
   * @return A greyscale copy.
   */
  public static GrayscaleImage fromBufferedImage(BufferedImage image) {
    Objects.requireNonNull(image, "image");
    int w = image.getWidth();
    int h = image.getHeight();
    byte[] samples = new byte[w * h];
    Raster raster = image.getRaster();

    if (raster.getNumBands() == 1 && raster.getSampleModel().getSampleSize(0) == 8) {
      int[] row = new int[w];
      for (int y = 0; y < h; y++) {
        raster.getSamples(0, y, w, 1, 0, row);
        for (int x = 0; x < w; x++) {
          samples[y * w + x] = (byte) row[x];
        }
      }
    } else {
      int[] row = new int[w];
      for (int y = 0; y < h; y++) {
        image.getRGB(0, y, w, 1, row, 0, w);
        for (int x = 0; x < w; x++) {
          int rgb = row[x];
          int sum = ((rgb >> 16) & 0xFF) + ((rgb >> 8) & 0xFF) + (rgb & 0xFF);
          samples[y * w + x] = (byte) (sum / 3);
        }
      }
    }

    return new GrayscaleImage(samples, w, h);
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public int getPixelCount() {
    return pixels.length;
  }

  /**
   * @return The intensity at column {@code x}, row {@code y}, in [0, 255].
   */
  public int get(int x, int y) {
    if (x < 0 || x >= width || y < 0 || y >= height) {
      throw new IndexOutOfBoundsException(
          String.format("(%d, %d) is outside a %dx%d image", x, y, width, height));
    }
    return pixels[y * width + x] & 0xFF;
  }

  /**
   * @return The intensity of the sample at a row-major index, in [0, 255].
   */
  public int get(int index) {
    return pixels[index] & 0xFF;
  }

  public boolean hasSameDimensionsAs(GrayscaleImage other) {
    return width == other.width && height == other.height;
  }

  /**
   * @return A copy of the row-major samples.
   */
  public byte[] toByteArray() {
    return pixels.clone();
  }

  /**
   * @return A new {@link BufferedImage#TYPE_BYTE_GRAY} image holding the same samples.
   */
  public BufferedImage toBufferedImage() {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
    image.getRaster().setDataElements(0, 0, width, height, pixels.clone());

    return image;
  }

  private static int clamp(int value) {
    return Math.max(0, Math.min(WHITE, value));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GrayscaleImage)) {
      return false;
    }
    GrayscaleImage other = (GrayscaleImage) o;
    return width == other.width && height == other.height && Arrays.equals(pixels, other.pixels);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(width, height) + Arrays.hashCode(pixels);
  }

  @Override
  public String toString() {
    return "GrayscaleImage[" + width + "x" + height + "]";
  }
}
