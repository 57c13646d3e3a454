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
package io.isima.ictc.study;

import io.isima.ictc.common.IctcConfig;
import io.isima.ictc.dataset.DatasetLoader;
import io.isima.ictc.dataset.DatasetSplitter;
import io.isima.ictc.errors.GenericError;
import io.isima.ictc.errors.IngestError;
import io.isima.ictc.errors.exception.DatasetIncompleteException;
import io.isima.ictc.errors.exception.EmptyColumnException;
import io.isima.ictc.errors.exception.IctcException;
import io.isima.ictc.errors.exception.SchemaMismatchException;
import io.isima.ictc.evaluate.Evaluator;
import io.isima.ictc.extract.BundleUnpacker;
import io.isima.ictc.extract.ExtractionReport;
import io.isima.ictc.integrity.ArchiveVerifier;
import io.isima.ictc.models.FeatureSchema;
import io.isima.ictc.models.LabelSet;
import io.isima.ictc.models.TimeWindow;
import io.isima.ictc.output.ArtifactWriter;
import io.isima.ictc.train.BoostingBackend;
import io.isima.ictc.train.Trainer;
import io.isima.ictc.train.TrainingDivergedException;
import io.isima.ictc.transform.ColumnFilter;
import io.isima.ictc.transform.FeaturePipeline;
import io.isima.ictc.utils.IctcObjectMapperProvider;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the whole pipeline for the configured time windows.
 *
 * <p>The source directory may hold the distribution bundle, a flat directory of per-window
 * archives, or tables that were extracted already. An integrity failure halts the study before any
 * archive is extracted. An incomplete dataset, an empty feature or a diverged training run fails
 * only the window concerned. All windows of a study must have the same label set.
 */
public class StudyRunner {
  private static final Logger logger = LoggerFactory.getLogger(StudyRunner.class);

  private final IctcConfig config;
  private final BoostingBackend backend;

  public StudyRunner(IctcConfig config, BoostingBackend backend) {
    this.config = config;
    this.backend = backend;
  }

  /**
   * Runs the study.
   *
   * @return the study summary, also written to the output directory
   * @throws IctcException when verification fails, label sets differ between windows, or any other
   *     failure that is not limited to one window happens
   */
  public StudyResult run() throws IctcException {
    final var result = new StudyResult();
    final var dataDirectories = prepareData(result);

    final var loader =
        new DatasetLoader(
            config.labelColumn(),
            config.benignLabel(),
            loadDeclaredSchema(),
            config.strictSchema());
    final var writer = new ArtifactWriter(config.outputDir());
    for (TimeWindow window : config.windows()) {
      final var outcome = new WindowOutcome(window);
      result.getWindows().add(outcome);
      try {
        runWindow(window, dataDirectories, loader, writer, result, outcome);
      } catch (DatasetIncompleteException e) {
        logger.warn("Window {} skipped: {}", window, e.getMessage());
        fail(outcome, WindowStatus.INCOMPLETE, e);
      } catch (EmptyColumnException e) {
        logger.error("Window {} failed: {}", window, e.getMessage());
        fail(outcome, WindowStatus.EMPTY_COLUMN, e);
      } catch (TrainingDivergedException e) {
        logger.error("Window {} diverged: {}", window, e.getMessage());
        fail(outcome, WindowStatus.DIVERGED, e);
        if (e.hasRecoverableEnsemble()) {
          writer.writeModel(window, e.getBestEnsemble(), true);
          outcome.setBestRound(e.getBestEnsemble().getBestRound());
        }
      }
    }
    writer.writeSummary(result);
    logger.info("Study done: {}", result.getWindows());
    return result;
  }

  private void runWindow(
      TimeWindow window,
      List<Path> dataDirectories,
      DatasetLoader loader,
      ArtifactWriter writer,
      StudyResult result,
      WindowOutcome outcome)
      throws IctcException {
    logger.info("Processing window {}", window);
    final var dataset = loader.load(dataDirectories, window);
    checkLabelSet(result, dataset.getLabelSet(), window);
    outcome.setRows(dataset.getTable().getRowCount());

    final var splits =
        new DatasetSplitter(config.trainFraction(), config.validationFraction(), config.splitSeed())
            .split(dataset.getTable());
    outcome.setTrainRows(splits.getTrain().getRowCount());
    outcome.setValidationRows(splits.getValidation().getRowCount());
    outcome.setTestRows(splits.getTest().getRowCount());

    final var labelSet = dataset.getLabelSet();
    final var filter = new ColumnFilter();
    final var transform =
        new FeaturePipeline(config.skewThreshold(), config.scalerCentering())
            .fit(filter.apply(splits.getTrain(), labelSet));
    final var train = transform.transform(splits.getTrain(), labelSet);
    final var validation = transform.transform(splits.getValidation(), labelSet);
    final var test = transform.transform(splits.getTest(), labelSet);
    writer.writeTransform(window, transform);

    final var ensemble =
        new Trainer(backend).train(train, validation, labelSet, config.boosterParameters());
    writer.writeModel(window, ensemble, false);
    outcome.setBestRound(ensemble.getBestRound());
    outcome.setRoundsTrained(ensemble.getRoundsTrained());

    final var report = new Evaluator(backend).evaluate(window, ensemble, test);
    writer.writeEvaluation(report);
    outcome.setAccuracy(report.getAccuracy());
    outcome.setMacroF1(report.getMacroF1());
    outcome.setStatus(WindowStatus.COMPLETED);
  }

  private List<Path> prepareData(StudyResult result) throws IctcException {
    final var sourceDir = config.sourceDir();
    final var workDir = config.workDir();
    final var unpacker =
        new BundleUnpacker(new ArchiveVerifier(), config.allowUnverifiedBundle());
    final BundleUnpacker.UnpackResult unpacked;
    if (Files.isRegularFile(sourceDir.resolve(config.bundleName()))) {
      unpacked = unpacker.unpackBundle(sourceDir, config.bundleName(), workDir);
    } else if (hasArchives(sourceDir)) {
      unpacked = unpacker.unpackDirectory(sourceDir, workDir);
    } else {
      logger.info("No archives in {}, loading tables from it directly", sourceDir);
      return List.of(sourceDir);
    }
    final ExtractionReport report = unpacked.getReport();
    result.setExtractedArchives(report.getResults().size());
    report.getFailures().forEach((name, e) -> result.getFailedArchives().put(name, e.getMessage()));
    return unpacked.getDataDirectories();
  }

  private FeatureSchema loadDeclaredSchema() throws IctcException {
    final var schemaFile = config.schemaFile();
    if (schemaFile == null) {
      return null;
    }
    try {
      final var schema =
          IctcObjectMapperProvider.get().readValue(schemaFile.toFile(), FeatureSchema.class);
      if (!schema.getLabelColumn().equals(config.labelColumn())) {
        throw new SchemaMismatchException(
            IngestError.INVALID_SCHEMA,
            String.format(
                "schema label column %s differs from configured %s",
                schema.getLabelColumn(), config.labelColumn()));
      }
      logger.info(
          "Using declared schema {} with {} columns", schemaFile, schema.getColumns().size());
      return schema;
    } catch (IOException | IllegalArgumentException e) {
      throw new SchemaMismatchException(
          IngestError.INVALID_SCHEMA, schemaFile + ": " + e.getMessage());
    }
  }

  private static void checkLabelSet(StudyResult result, LabelSet labelSet, TimeWindow window)
      throws SchemaMismatchException {
    if (result.getLabelSet() == null) {
      result.setLabelSet(labelSet);
      return;
    }
    if (!result.getLabelSet().equals(labelSet)) {
      throw new SchemaMismatchException(
          IngestError.LABEL_SET_MISMATCH,
          String.format(
              "window=%s; labels=%s, study labels=%s",
              window, labelSet.getLabels(), result.getLabelSet().getLabels()));
    }
  }

  private static void fail(WindowOutcome outcome, WindowStatus status, IctcException e) {
    outcome.setStatus(status);
    outcome.setErrorCode(e.getErrorCode());
    outcome.setMessage(e.getMessage());
  }

  private static boolean hasArchives(Path directory) throws IctcException {
    if (!Files.isDirectory(directory)) {
      throw new IctcException(
          GenericError.INVALID_CONFIGURATION, "source directory does not exist: " + directory);
    }
    try (Stream<Path> list = Files.list(directory)) {
      return list.anyMatch(path -> path.getFileName().toString().endsWith(".tar.xz"));
    } catch (IOException e) {
      throw new IctcException(GenericError.IO_ERROR, "listing " + directory, e);
    }
  }
}
