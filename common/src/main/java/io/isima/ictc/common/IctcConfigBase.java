/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.isima.ictc.common;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.function.Function;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed access to configuration properties.
 *
 * <p>Each run owns its own instance built from the properties it was started with; there is no
 * process-wide configuration state. The getters throw {@link IllegalArgumentException} when a value
 * cannot be parsed or is out of the allowed range.
 */
public class IctcConfigBase {
  private static final Logger logger = LoggerFactory.getLogger(IctcConfigBase.class);

  public static final String HOME_VARIABLE = "ICTC_HOME";

  private final Properties properties;
  private final Function<String, String> environment;

  public IctcConfigBase(Properties properties) {
    this(properties, System::getenv);
  }

  /**
   * Builds a configuration base that resolves environment variables through the given lookup.
   *
   * @param properties configuration properties
   * @param environment environment variable lookup, returns null for unset variables
   */
  public IctcConfigBase(Properties properties, Function<String, String> environment) {
    this.properties = new Properties();
    this.properties.putAll(properties);
    this.environment = environment;
  }

  /**
   * Builds a configuration where the given properties override system properties.
   *
   * @param overrides properties that take precedence
   * @return the configuration base
   */
  public static IctcConfigBase withSystemProperties(Properties overrides) {
    final var merged = new Properties();
    merged.putAll(System.getProperties());
    merged.putAll(overrides);
    return new IctcConfigBase(merged);
  }

  /**
   * Generic method to get property as string.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return property as a string.
   */
  public String getString(String key, String defaultValue) {
    String value = properties.getProperty(key);
    return value != null ? value.trim() : defaultValue;
  }

  /**
   * Generic method to get property as integer.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @param minimumValue allowed minimum value
   * @param maximumValue allowed maximum value
   * @return property as an integer.
   */
  public int getInt(String key, int defaultValue, int minimumValue, int maximumValue) {
    String value = properties.getProperty(key);
    if (StringUtils.isBlank(value)) {
      return defaultValue;
    }
    final int intValue;
    try {
      intValue = Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("Value of parameter %s is not an integer: %s", key, value), e);
    }
    if (intValue < minimumValue || intValue > maximumValue) {
      throw new IllegalArgumentException(
          String.format(
              "Value of parameter %s is out of allowed range [%d : %d]: %d",
              key, minimumValue, maximumValue, intValue));
    }
    return intValue;
  }

  /**
   * Generic method to get property as double.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @param minimumValue allowed minimum value, inclusive
   * @param maximumValue allowed maximum value, inclusive
   * @return property as a double.
   */
  public double getDouble(
      String key, double defaultValue, double minimumValue, double maximumValue) {
    String value = properties.getProperty(key);
    if (StringUtils.isBlank(value)) {
      return defaultValue;
    }
    final double doubleValue;
    try {
      doubleValue = Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("Value of parameter %s is not a number: %s", key, value), e);
    }
    if (!(doubleValue >= minimumValue && doubleValue <= maximumValue)) {
      throw new IllegalArgumentException(
          String.format(
              "Value of parameter %s is out of allowed range [%s : %s]: %s",
              key, minimumValue, maximumValue, doubleValue));
    }
    return doubleValue;
  }

  /**
   * Generic method to get property as boolean.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return property as a boolean.
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    String value = properties.getProperty(key);
    if (StringUtils.isBlank(value)) {
      return defaultValue;
    }
    final var trimmed = value.trim();
    if (trimmed.equalsIgnoreCase("true")) {
      return true;
    }
    if (trimmed.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(
        String.format("Value of parameter %s is not a boolean: %s", key, value));
  }

  /**
   * Generic method to get property as list of string.
   *
   * @param key the property key
   * @param delimiter delimiter that splits the property
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return property as a list of non-blank strings.
   */
  public List<String> getStringList(String key, String delimiter, String defaultValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      value = defaultValue;
    }
    final var result = new ArrayList<String>();
    for (String element : value.split(delimiter)) {
      if (!element.isBlank()) {
        result.add(element.trim());
      }
    }
    return result;
  }

  /**
   * Method to get a property as a file system path.
   *
   * <p>The string ${ICTC_HOME} in the value is replaced by the ICTC_HOME environment variable, or
   * by the current working directory when the variable is not set.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return the path, or null if the property is missing and the default value is null
   */
  public Path getPath(String key, String defaultValue) {
    final var value = getString(key, defaultValue);
    if (StringUtils.isBlank(value)) {
      return null;
    }
    final var resolved = value.replace("${" + HOME_VARIABLE + "}", getHome());
    logger.debug("{}={}", key, resolved);
    return Paths.get(resolved);
  }

  /**
   * Returns the home directory used for ${ICTC_HOME} substitution.
   *
   * @return the ICTC_HOME environment variable, or the working directory if it is unset or blank
   */
  public String getHome() {
    final var home = environment.apply(HOME_VARIABLE);
    return StringUtils.isBlank(home) ? System.getProperty("user.dir") : home.trim();
  }
}
