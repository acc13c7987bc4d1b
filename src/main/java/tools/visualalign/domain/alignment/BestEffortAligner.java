package tools.visualalign.domain.alignment;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.visualalign.domain.image.GrayscaleImage;

/**
 * Tries an ordered chain of strategies and keeps the first transform one of them produces. When
 * none applies, the identity transform is used, so this strategy always succeeds.
 */
public class BestEffortAligner implements AlignmentStrategy {
  public static final String IDENTITY = "identity";

  private static final Logger logger = LoggerFactory.getLogger(BestEffortAligner.class);

  private final List<AlignmentStrategy> strategies;

  /**
   * @param strategies Strategies in order of preference.
   */
  public BestEffortAligner(List<AlignmentStrategy> strategies) {
    this.strategies = List.copyOf(Objects.requireNonNull(strategies, "strategies"));
  }

  /**
   * @param settings Settings shared by every strategy.
   * @return Features first, then dense correlation.
   */
  public static BestEffortAligner withDefaultChain(AlignmentSettings settings) {
    return new BestEffortAligner(
        List.of(new FeatureAligner(settings), new CorrelationAligner(settings)));
  }

  @Override
  public String name() {
    return "best-effort";
  }

  @Override
  public AlignmentOutcome estimate(GrayscaleImage reference, GrayscaleImage comparison) {
    for (AlignmentStrategy strategy : strategies) {
      AlignmentOutcome outcome;
      try {
        outcome = strategy.estimate(reference, comparison);
      } catch (RuntimeException e) {
        logger.warn("Strategy {} failed unexpectedly, trying the next one", strategy.name(), e);
        continue;
      }

      if (outcome != null && outcome.isSuccess()) {
        logger.debug("Aligned with {}", outcome);
        return outcome;
      }
      logger.debug("{}", outcome);
    }

    return AlignmentOutcome.success(IDENTITY, AffineTransform.identity());
  }

  public List<AlignmentStrategy> getStrategies() {
    return strategies;
  }
}
