package tools.visualalign.domain.image.manipulations;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import tools.visualalign.TestImages;
import tools.visualalign.domain.image.GrayscaleImage;

class GaussianSmoothingTest {
  @Test
  void whenSmoothingUniformImageThenItIsUnchanged() {
    GrayscaleImage grey = GrayscaleImage.filled(30, 30, 128);

    assertEquals(grey, new GaussianSmoothing(5).manipulate(grey));
  }

  @Test
  void whenSmoothingEdgeThenIntermediateValuesAppear() {
    GrayscaleImage square = TestImages.square(50, 50, 20, 20, 10);

    GrayscaleImage smoothed = new GaussianSmoothing(5).manipulate(square);

    int edge = smoothed.get(20, 25);
    assertTrue(edge > 0 && edge < GrayscaleImage.WHITE);
  }

  @Test
  void whenKernelSizeIsEvenThenThrows() {
    assertThrows(IllegalArgumentException.class, () -> new GaussianSmoothing(4));
  }
}
