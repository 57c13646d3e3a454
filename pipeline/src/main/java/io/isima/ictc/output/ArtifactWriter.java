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
package io.isima.ictc.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.isima.ictc.errors.GenericError;
import io.isima.ictc.errors.exception.IctcException;
import io.isima.ictc.evaluate.EvaluationReport;
import io.isima.ictc.evaluate.FeatureImportance;
import io.isima.ictc.models.TimeWindow;
import io.isima.ictc.train.TrainedEnsemble;
import io.isima.ictc.transform.FittedFeaturePipeline;
import io.isima.ictc.utils.IctcObjectMapperProvider;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the artifacts of a trained window into the output directory.
 *
 * <p>Every file is written to a hidden temporary file first and renamed into place, so a reader
 * never sees a partially written artifact.
 */
public class ArtifactWriter {
  private static final Logger logger = LoggerFactory.getLogger(ArtifactWriter.class);

  public static final String SUMMARY_FILE = "study-summary.json";

  private static final String[] IMPORTANCE_HEADER = {
    "rank", "feature", "gain", "gain_share", "splits"
  };

  private final Path outputDirectory;
  private final ObjectMapper mapper;

  public ArtifactWriter(Path outputDirectory) {
    this.outputDirectory = outputDirectory;
    this.mapper = IctcObjectMapperProvider.get();
  }

  public Path getOutputDirectory() {
    return outputDirectory;
  }

  public static String modelFileName(TimeWindow window) {
    return "model-" + window.getSuffix() + ".bin";
  }

  public static String modelMetadataFileName(TimeWindow window) {
    return "model-" + window.getSuffix() + ".json";
  }

  public static String transformFileName(TimeWindow window) {
    return "transform-" + window.getSuffix() + ".json";
  }

  public static String evaluationFileName(TimeWindow window) {
    return "evaluation-" + window.getSuffix() + ".json";
  }

  public static String importanceFileName(TimeWindow window) {
    return "feature-importance-" + window.getSuffix() + ".csv";
  }

  /**
   * Writes the ensemble blob and its metadata.
   *
   * @param window the time window
   * @param ensemble the ensemble
   * @param recovered whether the ensemble was recovered from a diverged training run
   * @return the written files
   * @throws IctcException when writing fails
   */
  public List<Path> writeModel(TimeWindow window, TrainedEnsemble ensemble, boolean recovered)
      throws IctcException {
    final var files = new ArrayList<Path>();
    files.add(writeAtomically(modelFileName(window), ensemble.getBlob()));
    final ObjectNode metadata = mapper.createObjectNode();
    metadata.put("window", window.getSeconds());
    metadata.put("recovered", recovered);
    metadata.setAll((ObjectNode) mapper.valueToTree(ensemble));
    files.add(writeJson(modelMetadataFileName(window), metadata));
    return files;
  }

  public Path writeTransform(TimeWindow window, FittedFeaturePipeline transform)
      throws IctcException {
    return writeJson(transformFileName(window), transform);
  }

  /**
   * Writes the evaluation report and the feature importance table.
   *
   * @param report the report
   * @return the written files
   * @throws IctcException when writing fails
   */
  public List<Path> writeEvaluation(EvaluationReport report) throws IctcException {
    final var window = report.getWindow();
    final var files = new ArrayList<Path>();
    files.add(writeJson(evaluationFileName(window), report));
    files.add(writeImportance(window, report.getFeatureImportance()));
    return files;
  }

  Path writeImportance(TimeWindow window, List<FeatureImportance> ranking) throws IctcException {
    final var target = outputDirectory.resolve(importanceFileName(window));
    final var temp = prepareTemp(target);
    try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
        CSVPrinter printer = new CSVPrinter(writer, CSVFormat.RFC4180)) {
      printer.printRecord((Object[]) IMPORTANCE_HEADER);
      for (var entry : ranking) {
        printer.printRecord(
            entry.getRank(),
            entry.getFeature(),
            entry.getGain(),
            entry.getGainShare(),
            entry.getSplits());
      }
    } catch (IOException e) {
      throw new IctcException(GenericError.IO_ERROR, "writing " + target, e);
    }
    return publish(temp, target);
  }

  public Path writeSummary(Object summary) throws IctcException {
    return writeJson(SUMMARY_FILE, summary);
  }

  private Path writeJson(String fileName, Object value) throws IctcException {
    final byte[] content;
    try {
      content = mapper.writeValueAsBytes(value);
    } catch (JsonProcessingException e) {
      throw new IctcException(GenericError.IO_ERROR, "serializing " + fileName, e);
    }
    return writeAtomically(fileName, content);
  }

  private Path writeAtomically(String fileName, byte[] content) throws IctcException {
    final var target = outputDirectory.resolve(fileName);
    final var temp = prepareTemp(target);
    try {
      Files.write(temp, content);
    } catch (IOException e) {
      throw new IctcException(GenericError.IO_ERROR, "writing " + target, e);
    }
    return publish(temp, target);
  }

  private Path prepareTemp(Path target) throws IctcException {
    try {
      Files.createDirectories(outputDirectory);
    } catch (IOException e) {
      throw new IctcException(GenericError.IO_ERROR, "creating " + outputDirectory, e);
    }
    return target.resolveSibling("." + target.getFileName() + ".tmp");
  }

  private Path publish(Path temp, Path target) throws IctcException {
    try {
      Files.move(
          temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new IctcException(GenericError.IO_ERROR, "publishing " + target, e);
    }
    logger.debug("Wrote {}", target);
    return target;
  }
}
