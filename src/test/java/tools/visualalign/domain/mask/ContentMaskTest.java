package tools.visualalign.domain.mask;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import tools.visualalign.TestImages;
import tools.visualalign.domain.image.GrayscaleImage;
import tools.visualalign.exceptions.DimensionMismatchException;

class ContentMaskTest {
  @Test
  void whenIntensityIsBelowThresholdThenPixelIsContent() {
    GrayscaleImage image = new GrayscaleImage(3, 1, new byte[] {(byte) 249, (byte) 250, 0});

    ContentMask mask = ContentMask.of(image);

    assertTrue(mask.isContent(0, 0));
    assertFalse(mask.isContent(1, 0));
    assertTrue(mask.isContent(2, 0));
    assertEquals(2, mask.count());
  }

  @Test
  void whenThresholdIsZeroThenMaskIsEmpty() {
    GrayscaleImage image = GrayscaleImage.filled(10, 10, 0);

    assertTrue(ContentMask.of(image, 0).isEmpty());
  }

  @Test
  void whenThresholdIs256ThenEveryPixelIsContent() {
    GrayscaleImage image = GrayscaleImage.filled(10, 10, 255);

    assertEquals(100, ContentMask.of(image, 256).count());
  }

  @Test
  void whenPageIsBlankThenMaskIsEmpty() {
    assertTrue(ContentMask.of(TestImages.blank(50, 40)).isEmpty());
  }

  @Test
  void whenIntersectingSquaresThenCountsSharedPixels() {
    ContentMask first = ContentMask.of(TestImages.square(100, 100, 40, 40, 10));
    ContentMask second = ContentMask.of(TestImages.square(100, 100, 45, 45, 10));

    assertEquals(25, first.countIntersection(second));
  }

  @Test
  void whenIntersectingMasksOfDifferentSizesThenThrows() {
    ContentMask first = ContentMask.of(TestImages.blank(10, 10));
    ContentMask second = ContentMask.of(TestImages.blank(10, 11));

    assertThrows(DimensionMismatchException.class, () -> first.countIntersection(second));
  }
}
