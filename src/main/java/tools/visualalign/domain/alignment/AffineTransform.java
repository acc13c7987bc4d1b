package tools.visualalign.domain.alignment;

import java.util.Arrays;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import tools.visualalign.exceptions.ImageProcessingException;
import tools.visualalign.utils.ImageUtil;

/**
 * Immutable 2x3 affine matrix mapping a point {@code (x, y)} to
 * {@code (a*x + b*y + tx, c*x + d*y + ty)}. The estimators of this package only produce
 * similarity motions (rotation, uniform scale and translation), but the type accepts any affine
 * matrix.
 */
public final class AffineTransform {
  private static final double SINGULARITY_TOLERANCE = 1e-9;
  private static final AffineTransform IDENTITY = new AffineTransform(1, 0, 0, 0, 1, 0);

  private final double a;
  private final double b;
  private final double tx;
  private final double c;
  private final double d;
  private final double ty;

  /**
   * Creates a transform from its matrix entries, row by row.
   */
  public AffineTransform(double a, double b, double tx, double c, double d, double ty) {
    this.a = a;
    this.b = b;
    this.tx = tx;
    this.c = c;
    this.d = d;
    this.ty = ty;
  }

  public static AffineTransform identity() {
    return IDENTITY;
  }

  public static AffineTransform translation(double tx, double ty) {
    return new AffineTransform(1, 0, tx, 0, 1, ty);
  }

  /**
   * @param scale Uniform scale factor.
   * @param angle Counter-clockwise rotation in radians, in image coordinates (y pointing down this
   *        appears clockwise on screen).
   * @param tx Horizontal translation applied after rotation and scale.
   * @param ty Vertical translation applied after rotation and scale.
   * @return The similarity transform.
   */
  public static AffineTransform similarity(double scale, double angle, double tx, double ty) {
    double cos = scale * Math.cos(angle);
    double sin = scale * Math.sin(angle);

    return new AffineTransform(cos, -sin, tx, sin, cos, ty);
  }

  /**
   * Reads a 2x3 matrix of any floating-point depth, as produced by OpenCV estimators.
   *
   * @param mat The matrix.
   * @return The transform.
   */
  public static AffineTransform fromMat(Mat mat) {
    if (mat == null || mat.empty() || mat.rows() != 2 || mat.cols() != 3) {
      throw new ImageProcessingException("Expected a 2x3 matrix");
    }

    double[] entries = new double[6];
    for (int row = 0; row < 2; row++) {
      for (int col = 0; col < 3; col++) {
        entries[row * 3 + col] = mat.get(row, col)[0];
      }
    }

    return new AffineTransform(entries[0], entries[1], entries[2], entries[3], entries[4],
        entries[5]);
  }

  /**
   * @return A new {@code CV_64F} 2x3 mat. The caller must release it.
   */
  public Mat toMat() {
    ImageUtil.loadOpenCv();
    Mat mat = new Mat(2, 3, CvType.CV_64F);
    mat.put(0, 0, a, b, tx, c, d, ty);

    return mat;
  }

  /**
   * @return The image of {@code (x, y)} as {@code {x', y'}}.
   */
  public double[] apply(double x, double y) {
    return new double[] {a * x + b * y + tx, c * x + d * y + ty};
  }

  /**
   * @return The inverse transform.
   * @throws ImageProcessingException When the matrix is not invertible.
   */
  public AffineTransform inverse() {
    double determinant = determinant();
    if (!isWellFormed()) {
      throw new ImageProcessingException("Cannot invert a degenerate transform: " + this);
    }

    double ia = d / determinant;
    double ib = -b / determinant;
    double ic = -c / determinant;
    double id = a / determinant;

    return new AffineTransform(ia, ib, -(ia * tx + ib * ty), ic, id, -(ic * tx + id * ty));
  }

  public double determinant() {
    return a * d - b * c;
  }

  /**
   * @return {@code true} when every entry is finite and the linear part is invertible.
   */
  public boolean isWellFormed() {
    for (double entry : toArray()) {
      if (!Double.isFinite(entry)) {
        return false;
      }
    }
    return Math.abs(determinant()) > SINGULARITY_TOLERANCE;
  }

  public boolean isIdentity() {
    return equals(IDENTITY);
  }

  /**
   * @return Average scale of the linear part, {@code sqrt(|det|)}.
   */
  public double scale() {
    return Math.sqrt(Math.abs(determinant()));
  }

  /**
   * @return Rotation angle in radians, as read from the first column.
   */
  public double rotation() {
    return Math.atan2(c, a);
  }

  public double getTranslationX() {
    return tx;
  }

  public double getTranslationY() {
    return ty;
  }

  /**
   * @return The entries row by row: {@code a, b, tx, c, d, ty}.
   */
  public double[] toArray() {
    return new double[] {a, b, tx, c, d, ty};
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AffineTransform)) {
      return false;
    }
    return Arrays.equals(toArray(), ((AffineTransform) o).toArray());
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(toArray());
  }

  @Override
  public String toString() {
    return String.format("[[%.4f, %.4f, %.2f], [%.4f, %.4f, %.2f]]", a, b, tx, c, d, ty);
  }
}
