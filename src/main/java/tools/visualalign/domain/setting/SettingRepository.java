package tools.visualalign.domain.setting;

/**
 * Read access to configured values.
 */
public interface SettingRepository {
  /**
   * @param setting The setting to read.
   * @param defaultValue Returned when nothing is configured. Its type decides how a configured
   *        value is parsed.
   * @return The configured value, or the default.
   */
  <T> T get(Setting setting, T defaultValue);

  /**
   * @param setting The setting to read.
   * @return The configured value, or {@link Setting#getDefaultValue()}.
   */
  default Object get(Setting setting) {
    return get(setting, setting.getDefaultValue());
  }
}
