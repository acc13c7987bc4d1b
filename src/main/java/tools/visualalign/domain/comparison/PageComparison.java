package tools.visualalign.domain.comparison;

import tools.visualalign.domain.alignment.AlignmentResult;
import tools.visualalign.domain.diff.DiffImage;

/**
 * Everything a viewer shows for one displayed page pair.
 */
public final class PageComparison {
  private final int displayIndex;
  private final PagePair pair;
  private final AlignmentResult alignment;
  private final DiffImage diffImage;
  private final boolean lowOverlap;

  PageComparison(int displayIndex, PagePair pair, AlignmentResult alignment, DiffImage diffImage,
      double lowOverlapRatio) {
    this.displayIndex = displayIndex;
    this.pair = pair;
    this.alignment = alignment;
    this.diffImage = diffImage;
    double overlap = alignment.getOverlapRatio();
    this.lowOverlap = overlap > 0.0 && overlap < lowOverlapRatio;
  }

  public int getDisplayIndex() {
    return displayIndex;
  }

  public PagePair getPair() {
    return pair;
  }

  public AlignmentResult getAlignment() {
    return alignment;
  }

  public DiffImage getDiffImage() {
    return diffImage;
  }

  public double getOverlapRatio() {
    return alignment.getOverlapRatio();
  }

  public double getDifferenceRate() {
    return alignment.getDifferenceRate();
  }

  /**
   * A blank reference page (overlap exactly 0) does not count as low overlap.
   *
   * @return {@code true} when the user should be warned the pages may not match.
   */
  public boolean isLowOverlap() {
    return lowOverlap;
  }
}
