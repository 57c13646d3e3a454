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

import io.isima.ictc.errors.exception.InvalidConfigurationException;
import io.isima.ictc.models.TimeWindow;
import io.isima.ictc.train.BoosterParameters;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/** Pipeline configuration value provider. */
public class IctcConfig {

  // Data locations
  public static final String SOURCE_DIR = "io.isima.ictc.source.dir";
  public static final String WORK_DIR = "io.isima.ictc.work.dir";
  public static final String OUTPUT_DIR = "io.isima.ictc.output.dir";
  public static final String BUNDLE_NAME = "io.isima.ictc.bundle.name";
  public static final String ALLOW_UNVERIFIED_BUNDLE = "io.isima.ictc.bundle.allowUnverified";

  // Dataset
  public static final String WINDOWS = "io.isima.ictc.dataset.windows";
  public static final String LABEL_COLUMN = "io.isima.ictc.dataset.labelColumn";
  public static final String BENIGN_LABEL = "io.isima.ictc.dataset.benignLabel";
  public static final String SCHEMA_FILE = "io.isima.ictc.dataset.schemaFile";
  public static final String STRICT_SCHEMA = "io.isima.ictc.dataset.strictSchema";

  // Split
  public static final String TRAIN_FRACTION = "io.isima.ictc.split.train";
  public static final String VALIDATION_FRACTION = "io.isima.ictc.split.validation";
  public static final String SPLIT_SEED = "io.isima.ictc.split.seed";

  // Feature transforms
  public static final String SKEW_THRESHOLD = "io.isima.ictc.transform.skewThreshold";
  public static final String SCALER_CENTERING = "io.isima.ictc.transform.center";

  // Training
  public static final String LEARNING_RATE = "io.isima.ictc.train.learningRate";
  public static final String MAX_LEAVES = "io.isima.ictc.train.maxLeaves";
  public static final String FEATURE_FRACTION = "io.isima.ictc.train.featureFraction";
  public static final String BAGGING_FRACTION = "io.isima.ictc.train.baggingFraction";
  public static final String EARLY_STOPPING_PATIENCE = "io.isima.ictc.train.patience";
  public static final String MAX_ROUNDS = "io.isima.ictc.train.maxRounds";
  public static final String TRAINING_SEED = "io.isima.ictc.train.seed";
  public static final String NUM_THREADS = "io.isima.ictc.train.numThreads";

  public static final String DEFAULT_BUNDLE_NAME = "all_attack_benign_samples.tar.xz";

  private final IctcConfigBase base;

  public IctcConfig(IctcConfigBase base) {
    this.base = base;
  }

  public IctcConfig(Properties properties) {
    this(new IctcConfigBase(properties));
  }

  /**
   * Loads configuration from a properties file; the file's values override system properties.
   *
   * @param propertiesFile path to the properties file
   * @return validated configuration
   * @throws InvalidConfigurationException when the file cannot be read or a value is invalid
   */
  public static IctcConfig load(Path propertiesFile) throws InvalidConfigurationException {
    final var properties = new Properties();
    try (InputStream stream = Files.newInputStream(propertiesFile)) {
      properties.load(stream);
    } catch (IOException e) {
      throw new InvalidConfigurationException(
          "Failed to read configuration file " + propertiesFile, e);
    }
    final var config = new IctcConfig(IctcConfigBase.withSystemProperties(properties));
    config.validate();
    return config;
  }

  /**
   * Reads every value once so that invalid settings fail before the pipeline starts.
   *
   * @throws InvalidConfigurationException when any value is invalid
   */
  public void validate() throws InvalidConfigurationException {
    try {
      sourceDir();
      workDir();
      outputDir();
      bundleName();
      allowUnverifiedBundle();
      windows();
      labelColumn();
      benignLabel();
      schemaFile();
      strictSchema();
      splitSeed();
      skewThreshold();
      scalerCentering();
      if (trainFraction() + validationFraction() >= 1.0) {
        throw new IllegalArgumentException(
            String.format(
                "%s + %s must leave room for the test split", TRAIN_FRACTION, VALIDATION_FRACTION));
      }
    } catch (IllegalArgumentException e) {
      throw new InvalidConfigurationException(e.getMessage(), e);
    }
    boosterParameters().validate();
  }

  public Path sourceDir() {
    return base.getPath(SOURCE_DIR, "${ICTC_HOME}/data");
  }

  public Path workDir() {
    return base.getPath(WORK_DIR, "${ICTC_HOME}/work");
  }

  public Path outputDir() {
    return base.getPath(OUTPUT_DIR, "${ICTC_HOME}/output");
  }

  public String bundleName() {
    return base.getString(BUNDLE_NAME, DEFAULT_BUNDLE_NAME);
  }

  public boolean allowUnverifiedBundle() {
    return base.getBoolean(ALLOW_UNVERIFIED_BUNDLE, false);
  }

  public List<TimeWindow> windows() {
    final var windows = new ArrayList<TimeWindow>();
    for (var element : base.getStringList(WINDOWS, ",", "1")) {
      final var window = TimeWindow.parse(element);
      if (!windows.contains(window)) {
        windows.add(window);
      }
    }
    if (windows.isEmpty()) {
      throw new IllegalArgumentException(WINDOWS + " must name at least one time window");
    }
    return windows;
  }

  public String labelColumn() {
    return base.getString(LABEL_COLUMN, "label");
  }

  public String benignLabel() {
    return base.getString(BENIGN_LABEL, "benign").toLowerCase();
  }

  /** Returns the JSON feature schema file, or null to infer the schema at load time. */
  public Path schemaFile() {
    return base.getPath(SCHEMA_FILE, null);
  }

  public boolean strictSchema() {
    return base.getBoolean(STRICT_SCHEMA, true);
  }

  public double trainFraction() {
    return base.getDouble(TRAIN_FRACTION, 0.70, 0.01, 0.98);
  }

  public double validationFraction() {
    return base.getDouble(VALIDATION_FRACTION, 0.15, 0.01, 0.98);
  }

  public long splitSeed() {
    return base.getInt(SPLIT_SEED, 42, 0, Integer.MAX_VALUE);
  }

  public double skewThreshold() {
    return base.getDouble(SKEW_THRESHOLD, 0.75, 0.0, Double.MAX_VALUE);
  }

  public boolean scalerCentering() {
    return base.getBoolean(SCALER_CENTERING, true);
  }

  /**
   * Builds the booster hyperparameters.
   *
   * @return the parameters, not validated yet
   * @throws InvalidConfigurationException when a value cannot be parsed
   */
  public BoosterParameters boosterParameters() throws InvalidConfigurationException {
    try {
      final var params = new BoosterParameters();
      params.setLearningRate(base.getDouble(LEARNING_RATE, params.getLearningRate(), 0, 1));
      params.setMaxLeaves(base.getInt(MAX_LEAVES, params.getMaxLeaves(), 2, 1 << 16));
      params.setFeatureFraction(
          base.getDouble(FEATURE_FRACTION, params.getFeatureFraction(), 0, 1));
      params.setBaggingFraction(
          base.getDouble(BAGGING_FRACTION, params.getBaggingFraction(), 0, 1));
      params.setPatience(
          base.getInt(EARLY_STOPPING_PATIENCE, params.getPatience(), 1, Integer.MAX_VALUE));
      params.setMaxRounds(base.getInt(MAX_ROUNDS, params.getMaxRounds(), 1, Integer.MAX_VALUE));
      params.setSeed(base.getInt(TRAINING_SEED, params.getSeed(), 0, Integer.MAX_VALUE));
      params.setNumThreads(base.getInt(NUM_THREADS, params.getNumThreads(), 0, 1024));
      return params;
    } catch (IllegalArgumentException e) {
      throw new InvalidConfigurationException(e.getMessage(), e);
    }
  }
}
