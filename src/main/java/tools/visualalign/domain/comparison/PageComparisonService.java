package tools.visualalign.domain.comparison;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.visualalign.domain.alignment.AlignmentPipeline;
import tools.visualalign.domain.alignment.AlignmentResult;
import tools.visualalign.domain.diff.DiffCompositor;
import tools.visualalign.domain.diff.DiffImage;
import tools.visualalign.domain.image.GrayscaleImage;
import tools.visualalign.domain.setting.Setting;
import tools.visualalign.domain.setting.SettingRepository;

/**
 * Session state for comparing two rasterized documents page by page: the two page lists, the
 * page pairing, cached alignments and the difference rate recorded for every compared page.
 *
 * <p>
 * Alignments are cached per display index. Changing pages, pairing or swapping the documents
 * clears the cache and the rates; a different color scheme only re-renders the diff.
 *
 * <p>
 * Not thread-safe. The pipeline it drives is.
 */
public class PageComparisonService {
  private static final Logger logger = LoggerFactory.getLogger(PageComparisonService.class);

  private final AlignmentPipeline pipeline;
  private final DiffCompositor compositor;
  private final SettingRepository settings;

  private List<GrayscaleImage> referencePages = List.of();
  private List<GrayscaleImage> comparisonPages = List.of();
  private List<PagePair> mapping = List.of();
  private final Map<Integer, AlignmentResult> alignments = new HashMap<>();
  private final Map<Integer, Double> differenceRates = new TreeMap<>();

  /**
   * @param pipeline Aligns each page pair.
   * @param compositor Renders the diff images.
   * @param settings Supplies the low-overlap ratio, alert threshold and default scheme.
   */
  public PageComparisonService(AlignmentPipeline pipeline, DiffCompositor compositor,
      SettingRepository settings) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.compositor = Objects.requireNonNull(compositor, "compositor");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public void setReferencePages(List<GrayscaleImage> pages) {
    referencePages = List.copyOf(pages);
    invalidate();
  }

  public void setComparisonPages(List<GrayscaleImage> pages) {
    comparisonPages = List.copyOf(pages);
    invalidate();
  }

  /**
   * Replaces the page pairing. Pairs pointing past the end of either document are dropped.
   *
   * @param pairs Explicit pairs in display order, or {@code null}/empty for one-to-one pairing.
   */
  public void setMapping(List<PagePair> pairs) {
    mapping = pairs == null ? List.of() : List.copyOf(pairs);
    invalidate();
  }

  /**
   * @return The pairs shown, in display order: the explicit mapping when set, otherwise page i
   *         against page i for every index both documents have.
   */
  public List<PagePair> displayOrder() {
    List<PagePair> order = new ArrayList<>();
    if (!mapping.isEmpty()) {
      for (PagePair pair : mapping) {
        if (pair.getReferenceIndex() < referencePages.size()
            && pair.getComparisonIndex() < comparisonPages.size()) {
          order.add(pair);
        }
      }
    } else {
      int count = Math.min(referencePages.size(), comparisonPages.size());
      for (int i = 0; i < count; i++) {
        order.add(new PagePair(i, i));
      }
    }
    return Collections.unmodifiableList(order);
  }

  public int pageCount() {
    return displayOrder().size();
  }

  /**
   * Exchanges the reference and comparison documents, mirroring any explicit mapping.
   */
  public void swap() {
    List<GrayscaleImage> previousReference = referencePages;
    referencePages = comparisonPages;
    comparisonPages = previousReference;

    List<PagePair> mirrored = new ArrayList<>();
    for (PagePair pair : mapping) {
      mirrored.add(pair.swapped());
    }
    mapping = List.copyOf(mirrored);
    invalidate();
  }

  /**
   * Compares a displayed page pair with the default color scheme.
   *
   * @param displayIndex Zero-based index into {@link #displayOrder()}.
   * @return The comparison.
   */
  public PageComparison compare(int displayIndex) {
    return compare(displayIndex,
        settings.get(Setting.DEFAULT_COLOR_SCHEME, (String) Setting.DEFAULT_COLOR_SCHEME
            .getDefaultValue()));
  }

  /**
   * Compares a displayed page pair, reusing the cached alignment when there is one, and records
   * its difference rate.
   *
   * @param displayIndex Zero-based index into {@link #displayOrder()}.
   * @param schemeName Color scheme for the diff image.
   * @return The comparison.
   * @throws IndexOutOfBoundsException When no pair is displayed at that index.
   */
  public PageComparison compare(int displayIndex, String schemeName) {
    List<PagePair> order = displayOrder();
    Objects.checkIndex(displayIndex, order.size());
    PagePair pair = order.get(displayIndex);
    GrayscaleImage reference = referencePages.get(pair.getReferenceIndex());

    AlignmentResult alignment = alignments.computeIfAbsent(displayIndex,
        index -> pipeline.align(reference, comparisonPages.get(pair.getComparisonIndex())));
    differenceRates.put(displayIndex, alignment.getDifferenceRate());

    DiffImage diffImage = compositor.composite(reference, alignment.getAlignedImage(), schemeName);
    PageComparison comparison =
        new PageComparison(displayIndex, pair, alignment, diffImage, lowOverlapRatio());

    if (comparison.isLowOverlap()) {
      logger.warn("Page {} overlaps only {}, the pages may not match", pair,
          DifferenceRates.format(alignment.getOverlapRatio()));
    }
    return comparison;
  }

  /**
   * @return Difference rates recorded so far, by display index.
   */
  public Map<Integer, Double> differenceRates() {
    return Collections.unmodifiableMap(new TreeMap<>(differenceRates));
  }

  /**
   * @param displayIndex A display index.
   * @return {@code true} when the page was compared and its rate is above the alert threshold.
   */
  public boolean isAlert(int displayIndex) {
    return DifferenceRates.isAlert(differenceRates.get(displayIndex), settings.get(
        Setting.DIFF_RATE_ALERT_THRESHOLD,
        (Double) Setting.DIFF_RATE_ALERT_THRESHOLD.getDefaultValue()));
  }

  private double lowOverlapRatio() {
    return settings.get(Setting.LOW_OVERLAP_RATIO,
        (Double) Setting.LOW_OVERLAP_RATIO.getDefaultValue());
  }

  private void invalidate() {
    alignments.clear();
    differenceRates.clear();
  }
}
