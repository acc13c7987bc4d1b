package tools.visualalign.domain.setting;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Properties;
import org.junit.jupiter.api.Test;

class PropertiesSettingRepositoryTest {
  @Test
  void whenKeyIsAbsentThenDefaultIsReturned() {
    SettingRepository settings = new PropertiesSettingRepository(new Properties());

    double ratio = settings.get(Setting.LOW_OVERLAP_RATIO, 0.15);

    assertEquals(0.15, ratio);
  }

  @Test
  void whenValueIsSetThenItIsParsedAsTheDefaultsType() {
    Properties properties = new Properties();
    properties.setProperty("ecc-max-iterations", " 200 ");
    properties.setProperty("diff-rate-alert-threshold", "0.01");
    SettingRepository settings = new PropertiesSettingRepository(properties);

    int iterations = settings.get(Setting.ECC_MAX_ITERATIONS, 5000);
    double alertThreshold = settings.get(Setting.DIFF_RATE_ALERT_THRESHOLD, 0.005);

    assertEquals(200, iterations);
    assertEquals(0.01, alertThreshold);
  }

  @Test
  void whenLoadingFromClasspathThenOverridesApplyAndUnparsableValuesFallBack() {
    SettingRepository settings =
        PropertiesSettingRepository.fromClasspath("/settings/override.properties");

    int whiteThreshold = settings.get(Setting.WHITE_THRESHOLD, 250);
    double matchRatio = settings.get(Setting.MATCH_RATIO, 0.75);
    int maxFeatures = settings.get(Setting.MAX_FEATURES, 5000);
    String scheme = settings.get(Setting.DEFAULT_COLOR_SCHEME, "eye-care-light");

    assertEquals(200, whiteThreshold);
    assertEquals(0.8, matchRatio);
    assertEquals(5000, maxFeatures);
    assertEquals("paper", scheme);
  }

  @Test
  void whenResourceIsMissingThenEverySettingKeepsItsDefault() {
    SettingRepository settings =
        PropertiesSettingRepository.fromClasspath("/settings/missing.properties");

    for (Setting setting : Setting.values()) {
      assertEquals(setting.getDefaultValue(), settings.get(setting));
    }
  }

  @Test
  void whenLoadingBundledResourceThenValuesAreTheDefaults() {
    SettingRepository settings = PropertiesSettingRepository.fromClasspath();

    int whiteThreshold = settings.get(Setting.WHITE_THRESHOLD, 250);
    String scheme = settings.get(Setting.DEFAULT_COLOR_SCHEME, "eye-care-light");

    assertEquals(250, whiteThreshold);
    assertEquals("eye-care-light", scheme);
  }
}
