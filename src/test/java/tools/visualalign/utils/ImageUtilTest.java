package tools.visualalign.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Random;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import tools.visualalign.TestImages;
import tools.visualalign.domain.alignment.AffineTransform;
import tools.visualalign.domain.image.GrayscaleImage;
import tools.visualalign.exceptions.ImageProcessingException;

class ImageUtilTest {
  @BeforeAll
  static void loadOpenCv() {
    ImageUtil.loadOpenCv();
  }

  @Test
  void whenCopyingThroughMatThenSamplesAreUnchanged() {
    byte[] samples = new byte[64 * 48];
    new Random(3L).nextBytes(samples);
    GrayscaleImage image = new GrayscaleImage(64, 48, samples);
    Mat mat = ImageUtil.toMat(image);

    try {
      assertEquals(image, ImageUtil.toGrayscaleImage(mat));
    } finally {
      ImageUtil.release(mat);
    }
  }

  @Test
  void whenMatHasSeveralChannelsThenConversionThrows() {
    Mat mat = Mat.zeros(4, 4, CvType.CV_8UC3);

    try {
      assertThrows(ImageProcessingException.class, () -> ImageUtil.toGrayscaleImage(mat));
    } finally {
      ImageUtil.release(mat);
    }
  }

  @Test
  void whenSizeAlreadyMatchesThenResizeReturnsSameImage() {
    GrayscaleImage image = TestImages.blank(30, 20);

    assertSame(image, ImageUtil.resizeArea(image, 30, 20));
  }

  @Test
  void whenShrinkingThenAreaAveragesSamples() {
    GrayscaleImage image = new GrayscaleImage(2, 2, new byte[] {0, 100, (byte) 200, 100});

    GrayscaleImage resized = ImageUtil.resizeArea(image, 1, 1);

    assertEquals(100, resized.get(0, 0));
  }

  @Test
  void whenWarpingByIdentityThenImageIsUnchanged() {
    GrayscaleImage page = TestImages.page(120, 90, 0, 0, 5L);

    assertEquals(page, ImageUtil.warpAffine(page, AffineTransform.identity(), 120, 90));
  }

  @Test
  void whenWarpingByTranslationThenUncoveredBorderIsWhite() {
    GrayscaleImage black = GrayscaleImage.filled(20, 20, 0);

    GrayscaleImage warped = ImageUtil.warpAffine(black, AffineTransform.translation(5, 5), 20, 20);

    assertEquals(GrayscaleImage.WHITE, warped.get(0, 0));
    assertEquals(GrayscaleImage.WHITE, warped.get(19, 4));
    assertEquals(0, warped.get(10, 10));
  }

  @Test
  void whenWarpingIntoLargerGridThenOutputHasGridDimensions() {
    GrayscaleImage warped =
        ImageUtil.warpAffine(TestImages.blank(10, 10), AffineTransform.identity(), 40, 25);

    assertEquals(40, warped.getWidth());
    assertEquals(25, warped.getHeight());
  }
}
