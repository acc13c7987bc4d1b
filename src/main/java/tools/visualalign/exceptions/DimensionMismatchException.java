package tools.visualalign.exceptions;

/**
 * Raised when two images (or masks) that must share a pixel grid do not.
 */
public class DimensionMismatchException extends ImageProcessingException {
  private static final long serialVersionUID = -2830584021679035590L;

  public DimensionMismatchException(int expectedWidth, int expectedHeight, int actualWidth,
      int actualHeight) {
    super(String.format("Expected %dx%d but got %dx%d", expectedWidth, expectedHeight, actualWidth,
        actualHeight));
  }
}
