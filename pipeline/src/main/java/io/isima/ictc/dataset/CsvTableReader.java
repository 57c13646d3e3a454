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
import io.isima.ictc.errors.exception.IctcException;
import io.isima.ictc.errors.exception.SchemaMismatchException;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads a sample table from a CSV file whose first record is the header. */
public class CsvTableReader {
  private static final Logger logger = LoggerFactory.getLogger(CsvTableReader.class);

  private static final CSVFormat format = CSVFormat.RFC4180;

  /**
   * Reads a table.
   *
   * @param path the CSV file
   * @param fileName label and window parsed from the file name
   * @return the table
   * @throws SchemaMismatchException when the file is not well-formed CSV or rows are inconsistent
   *     with the header
   * @throws IctcException when the file cannot be read
   */
  public RawTable read(Path path, SampleFileName fileName) throws IctcException {
    final var tableName = fileName.getFileName();
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        CSVParser csvParser = format.parse(reader)) {
      final var header = new ArrayList<String>();
      final var rows = new ArrayList<String[]>();
      for (CSVRecord record : csvParser) {
        if (header.isEmpty()) {
          readHeader(tableName, record, header);
          continue;
        }
        if (header.size() > 1 && record.size() == 1 && record.get(0).isEmpty()) {
          // blank line; in a single-column table this is a row with a missing value
          continue;
        }
        if (record.size() != header.size()) {
          throw new SchemaMismatchException(
              IngestError.CSV_SYNTAX_ERROR,
              String.format(
                  "table=%s; row[%d]: Inconsistent number of columns, expected %d, got %d",
                  tableName, rows.size(), header.size(), record.size()));
        }
        final var row = new String[record.size()];
        for (int i = 0; i < row.length; ++i) {
          row[i] = record.get(i);
        }
        rows.add(row);
      }
      if (header.isEmpty()) {
        throw new SchemaMismatchException(
            IngestError.CSV_SYNTAX_ERROR, String.format("table=%s; no header row", tableName));
      }
      logger.debug("Read {} rows, {} columns from {}", rows.size(), header.size(), path);
      return new RawTable(tableName, fileName.getLabel(), fileName.getWindow(), header, rows);
    } catch (UncheckedIOException e) {
      throw new SchemaMismatchException(
          IngestError.CSV_SYNTAX_ERROR,
          String.format("table=%s; %s", tableName, e.getCause().getMessage()));
    } catch (IOException e) {
      throw new IctcException(GenericError.IO_ERROR, "reading " + path, e);
    }
  }

  private void readHeader(String tableName, CSVRecord record, List<String> header)
      throws SchemaMismatchException {
    final var seen = new HashSet<String>();
    for (String name : record) {
      final var trimmed = name.trim();
      if (trimmed.isEmpty()) {
        throw new SchemaMismatchException(
            IngestError.CSV_SYNTAX_ERROR,
            String.format("table=%s; header has an empty column name", tableName));
      }
      if (!seen.add(trimmed)) {
        throw new SchemaMismatchException(
            IngestError.CSV_SYNTAX_ERROR,
            String.format("table=%s; duplicate column %s", tableName, trimmed));
      }
      header.add(trimmed);
    }
  }
}
