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
package io.isima.ictc.dataset;

import io.isima.ictc.errors.GenericError;
import io.isima.ictc.errors.IngestError;
import io.isima.ictc.errors.exception.DatasetIncompleteException;
import io.isima.ictc.errors.exception.IctcException;
import io.isima.ictc.errors.exception.SchemaMismatchException;
import io.isima.ictc.models.ColumnSpec;
import io.isima.ictc.models.ColumnType;
import io.isima.ictc.models.FeatureSchema;
import io.isima.ictc.models.LabelSet;
import io.isima.ictc.models.TimeWindow;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the sample tables of one time window and merges them into one labeled table.
 *
 * <p>The label of a row comes from the file name of its table. A label column in the table content
 * is never used as the label and never becomes a feature. The merged column set is the union of
 * the columns of all tables; a column absent from a table is missing in its rows.
 *
 * <p>The feature schema is either declared up front or inferred once from the tables of the
 * window: a column is numeric iff every non-missing cell in every table parses as a number.
 */
public class DatasetLoader {
  private static final Logger logger = LoggerFactory.getLogger(DatasetLoader.class);

  private final String labelColumn;
  private final String benignLabel;
  private final FeatureSchema declaredSchema;
  private final boolean strictSchema;
  private final CsvTableReader reader;

  /**
   * Constructor.
   *
   * @param labelColumn name of the label column that may appear in table content
   * @param benignLabel label of the benign class
   * @param declaredSchema declared feature schema, or null to infer it from the tables
   * @param strictSchema whether undeclared columns are an error rather than dropped
   */
  public DatasetLoader(
      String labelColumn, String benignLabel, FeatureSchema declaredSchema, boolean strictSchema) {
    this.labelColumn = labelColumn;
    this.benignLabel = benignLabel;
    this.declaredSchema = declaredSchema;
    this.strictSchema = strictSchema;
    this.reader = new CsvTableReader();
  }

  /**
   * Finds the sample table files in data directories.
   *
   * <p>Hidden files and everything under hidden directories, e.g. extraction staging directories,
   * are ignored.
   *
   * @param dataDirectories directories to search recursively
   * @return table files keyed by path, in path order
   * @throws IctcException when a directory cannot be read
   */
  public Map<Path, SampleFileName> discover(List<Path> dataDirectories)
      throws IctcException {
    final var found = new LinkedHashMap<Path, SampleFileName>();
    for (Path directory : dataDirectories) {
      if (!Files.isDirectory(directory)) {
        logger.warn("Data directory {} does not exist", directory);
        continue;
      }
      final List<Path> files;
      try (Stream<Path> walk = Files.walk(directory)) {
        files =
            walk.filter(Files::isRegularFile)
                .filter(path -> !isHidden(directory.relativize(path)))
                .sorted()
                .collect(Collectors.toList());
      } catch (IOException e) {
        throw new IctcException(GenericError.IO_ERROR, "scanning " + directory, e);
      }
      for (Path file : files) {
        SampleFileName.parse(file.getFileName().toString())
            .ifPresent(name -> found.put(file, name));
      }
    }
    return found;
  }

  /**
   * Loads and merges the tables of a time window.
   *
   * @param dataDirectories directories that hold the extracted tables
   * @param window the time window
   * @return the merged dataset
   * @throws DatasetIncompleteException when the window has no benign table or no attack table
   * @throws SchemaMismatchException when a table does not conform to the feature schema
   * @throws IctcException when a table cannot be read
   */
  public MergedDataset load(List<Path> dataDirectories, TimeWindow window) throws IctcException {
    final var files =
        discover(dataDirectories).entrySet().stream()
            .filter(entry -> entry.getValue().getWindow().equals(window))
            .collect(Collectors.toList());
    final boolean hasBenign =
        files.stream().anyMatch(entry -> entry.getValue().getLabel().equals(benignLabel));
    final boolean hasAttack =
        files.stream().anyMatch(entry -> !entry.getValue().getLabel().equals(benignLabel));
    if (!hasBenign) {
      throw new DatasetIncompleteException(window, "no table for label " + benignLabel);
    }
    if (!hasAttack) {
      throw new DatasetIncompleteException(window, "no attack table");
    }

    final var tables = new ArrayList<RawTable>();
    for (var entry : files) {
      tables.add(reader.read(entry.getKey(), entry.getValue()));
    }
    // benign first, then attacks by label; table name breaks ties
    tables.sort(
        Comparator.comparing((RawTable table) -> !table.getLabel().equals(benignLabel))
            .thenComparing(RawTable::getLabel)
            .thenComparing(RawTable::getName));
    return merge(window, tables);
  }

  /**
   * Merges tables that were read already.
   *
   * @param window the time window of the tables
   * @param tables the tables, in row order of the result
   * @return the merged dataset
   * @throws SchemaMismatchException when a table does not conform to the feature schema
   */
  public MergedDataset merge(TimeWindow window, List<RawTable> tables)
      throws SchemaMismatchException {
    final var schema = declaredSchema != null ? declaredSchema : inferSchema(tables);
    for (var table : tables) {
      checkColumns(schema, table);
    }

    int total = 0;
    for (var table : tables) {
      total += table.getRowCount();
    }
    final var labels = new String[total];
    final var rowIds = new ArrayList<RowId>(total);
    final var numeric = new HashMap<String, double[]>();
    final var categorical = new HashMap<String, String[]>();
    for (var column : schema.getColumns()) {
      if (column.getType() == ColumnType.NUMERIC) {
        numeric.put(column.getName(), new double[total]);
      } else {
        categorical.put(column.getName(), new String[total]);
      }
    }

    final var sources = new ArrayList<SourceTable>();
    final var observedLabels = new LinkedHashSet<String>();
    int offset = 0;
    for (var table : tables) {
      for (int row = 0; row < table.getRowCount(); ++row) {
        final int target = offset + row;
        labels[target] = table.getLabel();
        rowIds.add(new RowId(table.getName(), row));
        for (var column : schema.getColumns()) {
          final var cell = table.cell(row, column.getName());
          if (column.getType() == ColumnType.NUMERIC) {
            numeric.get(column.getName())[target] = parseCell(table, row, column, cell);
          } else {
            categorical.get(column.getName())[target] =
                MissingValues.isMissing(cell) ? null : cell;
          }
        }
      }
      offset += table.getRowCount();
      observedLabels.add(table.getLabel());
      sources.add(new SourceTable(table.getName(), table.getLabel(), table.getRowCount()));
    }

    final var labelSet = LabelSet.of(benignLabel, observedLabels);
    final var merged =
        new MergedDataset(
            window,
            schema,
            labelSet,
            new DataTable(schema, numeric, categorical, labels, rowIds),
            sources);
    logger.info(
        "Merged {} table(s) for window {}: rows={}, columns={}, labels={}",
        tables.size(),
        window,
        total,
        schema.getColumns().size(),
        labelSet.getLabels());
    return merged;
  }

  /**
   * Infers the feature schema from a set of tables.
   *
   * @param tables the tables
   * @return the schema, columns in order of first appearance
   */
  FeatureSchema inferSchema(List<RawTable> tables) {
    final var numericFlags = new LinkedHashMap<String, Boolean>();
    for (var table : tables) {
      for (var column : table.getHeader()) {
        if (column.equals(labelColumn)) {
          continue;
        }
        boolean numeric = numericFlags.getOrDefault(column, true);
        for (int row = 0; numeric && row < table.getRowCount(); ++row) {
          numeric = MissingValues.isNumeric(table.cell(row, column));
        }
        numericFlags.put(column, numeric);
      }
    }
    final var columns = new ArrayList<ColumnSpec>();
    numericFlags.forEach(
        (name, numeric) -> {
          final var type = numeric ? ColumnType.NUMERIC : ColumnType.CATEGORICAL;
          columns.add(new ColumnSpec(name, type));
        });
    logger.debug("Inferred schema: {}", columns);
    return new FeatureSchema(labelColumn, columns);
  }

  private void checkColumns(FeatureSchema schema, RawTable table) throws SchemaMismatchException {
    for (var column : table.getHeader()) {
      if (column.equals(labelColumn) || schema.isDeclared(column)) {
        continue;
      }
      if (strictSchema) {
        throw new SchemaMismatchException(
            IngestError.UNDECLARED_COLUMN,
            String.format("table=%s; column=%s", table.getName(), column));
      }
      logger.warn("Dropping undeclared column {} of table {}", column, table.getName());
    }
  }

  private static double parseCell(RawTable table, int row, ColumnSpec column, String cell)
      throws SchemaMismatchException {
    try {
      return MissingValues.parseNumeric(cell);
    } catch (NumberFormatException e) {
      throw new SchemaMismatchException(
          IngestError.INVALID_SCHEMA,
          String.format(
              "table=%s; row[%d]: column %s is declared numeric but has value '%s'",
              table.getName(), row, column.getName(), cell));
    }
  }

  private static boolean isHidden(Path relative) {
    for (Path component : relative) {
      if (component.toString().startsWith(".")) {
        return true;
      }
    }
    return false;
  }
}
