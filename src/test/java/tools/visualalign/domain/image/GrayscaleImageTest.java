package tools.visualalign.domain.image;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.awt.image.BufferedImage;
import org.junit.jupiter.api.Test;
import tools.visualalign.TestImages;

class GrayscaleImageTest {
  @Test
  void whenCollapsingThreeIdenticalChannelsThenMatchesSingleChannelImage() {
    GrayscaleImage page = TestImages.page(200, 150, 0, 0, 7L);

    GrayscaleImage collapsed = GrayscaleImage.fromBufferedImage(TestImages.toRgb(page));

    assertEquals(page, collapsed);
  }

  @Test
  void whenCollapsingColorPixelThenAveragesChannels() {
    BufferedImage image = new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);
    image.setRGB(0, 0, (30 << 16) | (60 << 8) | 90);

    GrayscaleImage collapsed = GrayscaleImage.fromBufferedImage(image);

    assertEquals(60, collapsed.get(0, 0));
  }

  @Test
  void whenMutatingSourceArrayThenImageIsUnchanged() {
    byte[] samples = {0, 10, 20, 30};
    GrayscaleImage image = new GrayscaleImage(2, 2, samples);

    samples[0] = (byte) 200;
    image.toByteArray()[1] = (byte) 200;

    assertEquals(0, image.get(0, 0));
    assertEquals(10, image.get(1, 0));
  }

  @Test
  void whenSampleCountDoesNotMatchDimensionsThenThrows() {
    assertThrows(IllegalArgumentException.class, () -> new GrayscaleImage(3, 3, new byte[8]));
  }

  @Test
  void whenDimensionsAreNotPositiveThenThrows() {
    assertThrows(IllegalArgumentException.class, () -> GrayscaleImage.filled(0, 5, 255));
  }

  @Test
  void whenReadingOutsideImageThenThrows() {
    GrayscaleImage image = GrayscaleImage.filled(4, 4, 255);

    assertThrows(IndexOutOfBoundsException.class, () -> image.get(4, 0));
  }

  @Test
  void whenConvertingToBufferedImageThenSamplesArePreserved() {
    byte[] samples = {0, (byte) 128, (byte) 250, (byte) 255, 1, 2};
    GrayscaleImage image = new GrayscaleImage(3, 2, samples);

    GrayscaleImage copy = GrayscaleImage.fromBufferedImage(image.toBufferedImage());

    assertArrayEquals(samples, copy.toByteArray());
  }
}
