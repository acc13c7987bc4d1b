package tools.visualalign.domain.diff;

import java.awt.Color;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable lookup of color schemes by name. Unknown names resolve to the default scheme.
 */
public final class ColorSchemeRegistry {
  public static final String EYE_CARE_LIGHT = "eye-care-light";
  public static final String STANDARD_DARK = "standard-dark";
  public static final String PAPER = "paper";
  public static final String SOFT_DARK = "soft-dark";

  private static final ColorSchemeRegistry BUILT_IN = new ColorSchemeRegistry(List.of(
      new ColorScheme(EYE_CARE_LIGHT, Color.WHITE, Color.BLACK, new Color(0x99CCFF),
          new Color(0xE69999)),
      new ColorScheme(STANDARD_DARK, Color.BLACK, Color.WHITE, Color.CYAN, Color.RED),
      new ColorScheme(PAPER, new Color(0xF5F1E6), new Color(0x2C3E50), new Color(0x5E8B95),
          new Color(0xC06C5A)),
      new ColorScheme(SOFT_DARK, new Color(0x1E1E1E), new Color(0xD4D4D4), new Color(0x569CD6),
          new Color(0xD16969))), EYE_CARE_LIGHT);

  private final Map<String, ColorScheme> schemes;
  private final String defaultName;

  private ColorSchemeRegistry(List<ColorScheme> schemes, String defaultName) {
    Map<String, ColorScheme> byName = new LinkedHashMap<>();
    for (ColorScheme scheme : schemes) {
      byName.put(scheme.getName(), scheme);
    }
    if (!byName.containsKey(defaultName)) {
      throw new IllegalArgumentException("Unknown default scheme: " + defaultName);
    }

    this.schemes = Collections.unmodifiableMap(byName);
    this.defaultName = defaultName;
  }

  /**
   * @return The four schemes that ship with the library, defaulting to {@value #EYE_CARE_LIGHT}.
   */
  public static ColorSchemeRegistry builtIn() {
    return BUILT_IN;
  }

  /**
   * @param name A scheme name, possibly unknown or {@code null}.
   * @return The named scheme, or the default one.
   */
  public ColorScheme get(String name) {
    ColorScheme scheme = name == null ? null : schemes.get(name);
    return scheme != null ? scheme : getDefault();
  }

  /**
   * Normalizes the legacy on/off switch of the diff view.
   *
   * @param light {@code true} for the light scheme, {@code false} for the standard dark one.
   * @return The scheme.
   */
  public ColorScheme resolve(boolean light) {
    return get(light ? EYE_CARE_LIGHT : STANDARD_DARK);
  }

  public ColorScheme getDefault() {
    return schemes.get(defaultName);
  }

  public boolean contains(String name) {
    return schemes.containsKey(name);
  }

  /**
   * @return Scheme names in registration order.
   */
  public List<String> names() {
    return List.copyOf(schemes.keySet());
  }

  /**
   * @param scheme A scheme to add, replacing any scheme of the same name.
   * @return A new registry; this one is unchanged.
   */
  public ColorSchemeRegistry withScheme(ColorScheme scheme) {
    Objects.requireNonNull(scheme, "scheme");
    List<ColorScheme> extended = new ArrayList<>(schemes.values());
    extended.removeIf(existing -> existing.getName().equals(scheme.getName()));
    extended.add(scheme);

    return new ColorSchemeRegistry(extended, defaultName);
  }

  /**
   * @param name A registered scheme name.
   * @return A new registry with another default.
   */
  public ColorSchemeRegistry withDefault(String name) {
    return new ColorSchemeRegistry(new ArrayList<>(schemes.values()), name);
  }
}
