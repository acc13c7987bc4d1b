package tools.visualalign.domain.comparison;

/**
 * A reference page index matched with a comparison page index, both zero-based.
 */
public final class PagePair {
  private final int referenceIndex;
  private final int comparisonIndex;

  public PagePair(int referenceIndex, int comparisonIndex) {
    if (referenceIndex < 0 || comparisonIndex < 0) {
      throw new IllegalArgumentException(
          "Page indexes must not be negative: " + referenceIndex + ", " + comparisonIndex);
    }
    this.referenceIndex = referenceIndex;
    this.comparisonIndex = comparisonIndex;
  }

  public int getReferenceIndex() {
    return referenceIndex;
  }

  public int getComparisonIndex() {
    return comparisonIndex;
  }

  /**
   * @return The same pair seen from the other document.
   */
  public PagePair swapped() {
    return new PagePair(comparisonIndex, referenceIndex);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PagePair)) {
      return false;
    }
    PagePair other = (PagePair) o;
    return referenceIndex == other.referenceIndex && comparisonIndex == other.comparisonIndex;
  }

  @Override
  public int hashCode() {
    return 31 * referenceIndex + comparisonIndex;
  }

  @Override
  public String toString() {
    return "(" + referenceIndex + " -> " + comparisonIndex + ")";
  }
}
