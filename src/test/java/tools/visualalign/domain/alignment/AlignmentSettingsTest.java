package tools.visualalign.domain.alignment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tools.visualalign.domain.setting.Setting;
import tools.visualalign.domain.setting.SettingRepository;

@ExtendWith(MockitoExtension.class)
class AlignmentSettingsTest {
  @Mock
  private SettingRepository mockSettingRepository;

  @Test
  void whenUsingDefaultsThenMatchesDocumentedValues() {
    AlignmentSettings settings = AlignmentSettings.defaults();

    assertEquals(250, settings.getWhiteThreshold());
    assertEquals(5000, settings.getMaxFeatures());
    assertEquals(0.75, settings.getMatchRatio());
    assertEquals(5.0, settings.getRansacReprojectionThreshold());
    assertEquals(5000, settings.getEccMaxIterations());
    assertEquals(1e-6, settings.getEccEpsilon());
    assertEquals(5, settings.getEccGaussianKernelSize());
  }

  @Test
  void whenRepositoryOverridesValueThenSettingsUseIt() {
    when(mockSettingRepository.get(any(Setting.class), any()))
        .thenAnswer(invocation -> invocation.getArgument(1));
    when(mockSettingRepository.get(eq(Setting.MATCH_RATIO), any())).thenReturn(0.6);

    AlignmentSettings settings = AlignmentSettings.from(mockSettingRepository);

    assertEquals(0.6, settings.getMatchRatio());
    assertEquals(250, settings.getWhiteThreshold());
  }

  @Test
  void whenRepositoryHoldsInvalidValueThenThrows() {
    when(mockSettingRepository.get(any(Setting.class), any()))
        .thenAnswer(invocation -> invocation.getArgument(1));
    when(mockSettingRepository.get(eq(Setting.ECC_GAUSSIAN_KERNEL_SIZE), any())).thenReturn(4);

    assertThrows(IllegalArgumentException.class,
        () -> AlignmentSettings.from(mockSettingRepository));
  }

  @Test
  void whenOverridingOneValueThenOthersAreKept() {
    AlignmentSettings settings = AlignmentSettings.defaults().withWhiteThreshold(200);

    assertEquals(200, settings.getWhiteThreshold());
    assertEquals(0.75, settings.getMatchRatio());
  }

  @Test
  void whenMatchRatioIsOutOfRangeThenThrows() {
    assertThrows(IllegalArgumentException.class,
        () -> AlignmentSettings.defaults().withMatchRatio(1.5));
  }
}
