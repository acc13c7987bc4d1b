package tools.visualalign.domain.image;

/**
 * A transformation from one greyscale image to a new one. Implementations never modify their
 * input.
 */
public interface ImageManipulation {
  GrayscaleImage manipulate(GrayscaleImage image);
}
