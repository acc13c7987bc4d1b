package tools.visualalign.domain.diff;

import java.awt.Color;
import java.util.Objects;

/**
 * A named palette for diff images. By convention reference-only pixels use a cool color and
 * comparison-only pixels a warm one.
 */
public final class ColorScheme {
  private final String name;
  private final Color background;
  private final Color overlap;
  private final Color referenceOnly;
  private final Color comparisonOnly;

  public ColorScheme(String name, Color background, Color overlap, Color referenceOnly,
      Color comparisonOnly) {
    this.name = Objects.requireNonNull(name, "name");
    this.background = Objects.requireNonNull(background, "background");
    this.overlap = Objects.requireNonNull(overlap, "overlap");
    this.referenceOnly = Objects.requireNonNull(referenceOnly, "referenceOnly");
    this.comparisonOnly = Objects.requireNonNull(comparisonOnly, "comparisonOnly");
  }

  public String getName() {
    return name;
  }

  public Color getBackground() {
    return background;
  }

  public Color getOverlap() {
    return overlap;
  }

  public Color getReferenceOnly() {
    return referenceOnly;
  }

  public Color getComparisonOnly() {
    return comparisonOnly;
  }

  public Color colorOf(PixelCategory category) {
    switch (category) {
      case OVERLAP:
        return overlap;
      case REFERENCE_ONLY:
        return referenceOnly;
      case COMPARISON_ONLY:
        return comparisonOnly;
      case BACKGROUND:
      default:
        return background;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColorScheme)) {
      return false;
    }
    ColorScheme other = (ColorScheme) o;
    return name.equals(other.name) && background.equals(other.background)
        && overlap.equals(other.overlap) && referenceOnly.equals(other.referenceOnly)
        && comparisonOnly.equals(other.comparisonOnly);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, background, overlap, referenceOnly, comparisonOnly);
  }

  @Override
  public String toString() {
    return "ColorScheme[" + name + "]";
  }
}
