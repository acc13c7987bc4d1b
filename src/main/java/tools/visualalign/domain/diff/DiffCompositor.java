package tools.visualalign.domain.diff;

import java.awt.image.BufferedImage;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import tools.visualalign.domain.image.GrayscaleImage;
import tools.visualalign.domain.mask.ContentMask;
import tools.visualalign.exceptions.DimensionMismatchException;

/**
 * Renders two aligned pages as a hard per-pixel classification: background, overlap,
 * reference-only or comparison-only, each painted with its scheme color. There is no blending
 * across category boundaries.
 */
public class DiffCompositor {
  private final ColorSchemeRegistry registry;
  private final int whiteThreshold;

  public DiffCompositor() {
    this(ColorSchemeRegistry.builtIn(), ContentMask.DEFAULT_WHITE_THRESHOLD);
  }

  /**
   * @param registry Where scheme names are looked up.
   * @param whiteThreshold Intensities below this value are content.
   */
  public DiffCompositor(ColorSchemeRegistry registry, int whiteThreshold) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.whiteThreshold = whiteThreshold;
  }

  /**
   * @param reference The reference page.
   * @param alignedComparison The comparison page on the reference's grid.
   * @param schemeName A scheme name; unknown names use the registry default.
   * @return The diff image.
   * @throws DimensionMismatchException When the pages differ in size.
   */
  public DiffImage composite(GrayscaleImage reference, GrayscaleImage alignedComparison,
      String schemeName) {
    return composite(reference, alignedComparison, registry.get(schemeName));
  }

  /**
   * Overload for the legacy light/dark switch.
   */
  public DiffImage composite(GrayscaleImage reference, GrayscaleImage alignedComparison,
      boolean light) {
    return composite(reference, alignedComparison, registry.resolve(light));
  }

  /**
   * Overload for AWT images of any type; multi-channel images are collapsed to greyscale first.
   */
  public DiffImage composite(BufferedImage reference, BufferedImage alignedComparison,
      String schemeName) {
    return composite(GrayscaleImage.fromBufferedImage(reference),
        GrayscaleImage.fromBufferedImage(alignedComparison), schemeName);
  }

  /**
   * @param reference The reference page.
   * @param alignedComparison The comparison page on the reference's grid.
   * @param scheme The palette.
   * @return The diff image.
   */
  public DiffImage composite(GrayscaleImage reference, GrayscaleImage alignedComparison,
      ColorScheme scheme) {
    if (!reference.hasSameDimensionsAs(alignedComparison)) {
      throw new DimensionMismatchException(reference.getWidth(), reference.getHeight(),
          alignedComparison.getWidth(), alignedComparison.getHeight());
    }

    ContentMask referenceMask = ContentMask.of(reference, whiteThreshold);
    ContentMask comparisonMask = ContentMask.of(alignedComparison, whiteThreshold);

    PixelCategory[] categories = PixelCategory.values();
    int[] palette = new int[categories.length];
    for (PixelCategory category : categories) {
      palette[category.ordinal()] = scheme.colorOf(category).getRGB();
    }

    int width = reference.getWidth();
    int height = reference.getHeight();
    int[] rgb = new int[width * height];
    int[] tally = new int[categories.length];
    for (int i = 0; i < rgb.length; i++) {
      int ordinal =
          PixelCategory.classify(referenceMask.isContent(i), comparisonMask.isContent(i)).ordinal();
      rgb[i] = palette[ordinal];
      tally[ordinal]++;
    }

    Map<PixelCategory, Integer> counts = new EnumMap<>(PixelCategory.class);
    for (PixelCategory category : categories) {
      counts.put(category, tally[category.ordinal()]);
    }

    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    image.setRGB(0, 0, width, height, rgb, 0, width);

    return new DiffImage(image, counts, scheme);
  }

  public ColorSchemeRegistry getRegistry() {
    return registry;
  }
}
