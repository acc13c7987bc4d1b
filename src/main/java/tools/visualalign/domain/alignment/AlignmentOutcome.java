package tools.visualalign.domain.alignment;

import java.util.Objects;
import java.util.Optional;

/**
 * What a single {@link AlignmentStrategy} produced: either a transform, or the reason the
 * strategy does not apply to the given pair of images.
 */
public final class AlignmentOutcome {
  private final String strategyName;
  private final AffineTransform transform;
  private final String reason;

  private AlignmentOutcome(String strategyName, AffineTransform transform, String reason) {
    this.strategyName = Objects.requireNonNull(strategyName, "strategyName");
    this.transform = transform;
    this.reason = reason;
  }

  /**
   * @param strategyName The strategy that produced the transform.
   * @param transform A well-formed transform from comparison to reference coordinates.
   * @return A successful outcome.
   */
  public static AlignmentOutcome success(String strategyName, AffineTransform transform) {
    Objects.requireNonNull(transform, "transform");
    if (!transform.isWellFormed()) {
      throw new IllegalArgumentException("Refusing a degenerate transform: " + transform);
    }
    return new AlignmentOutcome(strategyName, transform, null);
  }

  /**
   * @param strategyName The strategy that gave up.
   * @param reason Why it gave up, for logs.
   * @return An outcome telling the caller to try the next strategy.
   */
  public static AlignmentOutcome notApplicable(String strategyName, String reason) {
    return new AlignmentOutcome(strategyName, null, Objects.requireNonNull(reason, "reason"));
  }

  public boolean isSuccess() {
    return transform != null;
  }

  public String getStrategyName() {
    return strategyName;
  }

  public Optional<AffineTransform> getTransform() {
    return Optional.ofNullable(transform);
  }

  public Optional<String> getReason() {
    return Optional.ofNullable(reason);
  }

  @Override
  public String toString() {
    return isSuccess() ? strategyName + " -> " + transform
        : strategyName + " not applicable: " + reason;
  }
}
