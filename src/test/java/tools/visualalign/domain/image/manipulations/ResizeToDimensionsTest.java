package tools.visualalign.domain.image.manipulations;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import tools.visualalign.TestImages;
import tools.visualalign.domain.image.GrayscaleImage;

class ResizeToDimensionsTest {
  @Test
  void whenResizingToReferenceThenTakesReferenceDimensions() {
    GrayscaleImage reference = TestImages.blank(200, 100);
    GrayscaleImage comparison = TestImages.page(317, 411, 0, 0, 2L);

    GrayscaleImage resized = ResizeToDimensions.of(reference).manipulate(comparison);

    assertEquals(200, resized.getWidth());
    assertEquals(100, resized.getHeight());
  }

  @Test
  void whenEnlargingSinglePixelThenFillsGridWithItsValue() {
    GrayscaleImage pixel = GrayscaleImage.filled(1, 1, 42);

    GrayscaleImage resized = new ResizeToDimensions(8, 6).manipulate(pixel);

    assertEquals(GrayscaleImage.filled(8, 6, 42), resized);
  }

  @Test
  void whenTargetIsNotPositiveThenThrows() {
    assertThrows(IllegalArgumentException.class, () -> new ResizeToDimensions(0, 10));
  }
}
