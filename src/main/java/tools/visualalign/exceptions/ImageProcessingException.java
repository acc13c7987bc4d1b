package tools.visualalign.exceptions;

/**
 * Raised when an image cannot be processed. This is the root of every exception the library
 * throws on its own.
 */
public class ImageProcessingException extends RuntimeException {
  private static final long serialVersionUID = 4170951286023394213L;

  public ImageProcessingException(String message) {
    super(message);
  }

  public ImageProcessingException(Throwable cause) {
    super(cause);
  }

  public ImageProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
