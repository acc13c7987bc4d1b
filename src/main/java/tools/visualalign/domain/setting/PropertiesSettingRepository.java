package tools.visualalign.domain.setting;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.visualalign.exceptions.ImageProcessingException;

/**
 * Settings backed by a {@link Properties} object, usually loaded from the classpath. Missing or
 * unparsable entries fall back to the caller's default.
 */
public class PropertiesSettingRepository implements SettingRepository {
  public static final String DEFAULT_RESOURCE = "/visualalign.properties";

  private static final Logger logger = LoggerFactory.getLogger(PropertiesSettingRepository.class);

  private final Properties properties;

  public PropertiesSettingRepository(Properties properties) {
    this.properties = new Properties();
    this.properties.putAll(properties);
  }

  /**
   * Loads {@value #DEFAULT_RESOURCE} from the classpath. An absent resource means every setting
   * keeps its default.
   *
   * @return The repository.
   */
  public static PropertiesSettingRepository fromClasspath() {
    return fromClasspath(DEFAULT_RESOURCE);
  }

  /**
   * @param resourcePath The path to the resource, starting with a slash.
   * @return The repository; empty when the resource does not exist.
   */
  public static PropertiesSettingRepository fromClasspath(String resourcePath) {
    Properties properties = new Properties();

    try (InputStream is = PropertiesSettingRepository.class.getResourceAsStream(resourcePath)) {
      if (is == null) {
        logger.debug("No settings resource at {}, using defaults", resourcePath);
      } else {
        properties.load(is);
      }
    } catch (IOException e) {
      throw new ImageProcessingException("Could not read settings from " + resourcePath, e);
    }

    return new PropertiesSettingRepository(properties);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T get(Setting setting, T defaultValue) {
    String raw = properties.getProperty(setting.getKey());
    if (raw == null || raw.isBlank() || defaultValue == null) {
      return defaultValue;
    }

    String value = raw.trim();
    try {
      if (defaultValue instanceof Integer) {
        return (T) Integer.valueOf(value);
      }
      if (defaultValue instanceof Double) {
        return (T) Double.valueOf(value);
      }
      if (defaultValue instanceof Boolean) {
        return (T) Boolean.valueOf(value);
      }
      if (defaultValue instanceof String) {
        return (T) value;
      }
    } catch (NumberFormatException e) {
      logger.warn("Ignoring unparsable value '{}' for {}", value, setting.getKey());
      return defaultValue;
    }

    logger.warn("Unsupported setting type {} for {}", defaultValue.getClass().getSimpleName(),
        setting.getKey());
    return defaultValue;
  }
}
