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
package io.isima.ictc.extract;

import io.isima.ictc.errors.GenericError;
import io.isima.ictc.errors.IngestError;
import io.isima.ictc.errors.exception.ExtractionException;
import io.isima.ictc.errors.exception.IctcException;
import io.isima.ictc.integrity.VerifiedArchive;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorInputStream;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts verified {@code .tar.xz} archives into a destination directory.
 *
 * <p>Each archive is first decompressed into a hidden staging directory inside the destination.
 * Its files are moved into place only after the whole archive decompressed without error, so a
 * corrupt or interrupted archive never leaves a half-written table behind. Files that already
 * exist in the destination must have identical content; extraction is then a no-op for them.
 *
 * <p>The destination directory is owned by a single extractor during a run.
 */
public class ArchiveExtractor {
  private static final Logger logger = LoggerFactory.getLogger(ArchiveExtractor.class);

  static final String STAGING_PREFIX = ".staging-";

  // enough to cover the tar header magic at offset 257
  private static final int SIGNATURE_LENGTH = 512;

  private final Path destination;

  public ArchiveExtractor(Path destination) {
    this.destination = destination.toAbsolutePath().normalize();
  }

  public Path getDestination() {
    return destination;
  }

  /**
   * Extracts a list of archives, continuing after per-archive failures.
   *
   * @param archives verified archives
   * @return report of extracted and failed archives
   * @throws IctcException when the destination cannot be prepared or the thread is interrupted
   */
  public ExtractionReport extractAll(List<VerifiedArchive> archives) throws IctcException {
    prepareDestination();
    final var report = new ExtractionReport();
    for (var archive : archives) {
      if (Thread.currentThread().isInterrupted()) {
        throw new IctcException(GenericError.OPERATION_CANCELED, "extraction interrupted");
      }
      try {
        report.addResult(extract(archive));
      } catch (ExtractionException e) {
        logger.error("[{}] extract error: {} -> SKIP", archive.getName(), e.getMessage());
        report.addFailure(e);
      }
    }
    logger.info(
        "Done extracting into {}. Extracted {}/{} archives",
        destination,
        report.getResults().size(),
        archives.size());
    return report;
  }

  /**
   * Extracts one archive.
   *
   * @param archive the verified archive
   * @return the extraction result
   * @throws ExtractionException when the payload is corrupt, an entry escapes the destination or a
   *     target exists with different content
   */
  public ExtractionResult extract(VerifiedArchive archive) throws ExtractionException {
    final var archiveName = archive.getName();
    final var staging = destination.resolve(STAGING_PREFIX + archiveName);
    try {
      Files.createDirectories(destination);
      if (Files.exists(staging)) {
        FileUtils.deleteDirectory(staging.toFile());
      }
      Files.createDirectories(staging);
    } catch (IOException e) {
      throw new ExtractionException(IngestError.ARCHIVE_UNREADABLE, archiveName, e);
    }
    try {
      final var kind = decompress(archive.getPath(), archiveName, staging);
      final var result = publish(archiveName, kind, staging);
      logger.info(
          "[{}] extracted ({}) to {}: {} new, {} unchanged",
          archiveName,
          kind,
          destination,
          result.getPublishedFiles().size(),
          result.getUnchangedFiles().size());
      return result;
    } finally {
      removeStaging(staging);
    }
  }

  private PayloadKind decompress(Path archivePath, String archiveName, Path staging)
      throws ExtractionException {
    try (InputStream file = new BufferedInputStream(Files.newInputStream(archivePath));
        XZCompressorInputStream xz = new XZCompressorInputStream(file);
        BufferedInputStream payload = new BufferedInputStream(xz)) {
      payload.mark(SIGNATURE_LENGTH);
      final byte[] signature = new byte[SIGNATURE_LENGTH];
      final int length = IOUtils.read(payload, signature);
      payload.reset();
      if (TarArchiveInputStream.matches(signature, length)) {
        untar(payload, archiveName, staging);
        // read to the end of the xz stream so that its index and checks are verified
        IOUtils.consume(payload);
        return PayloadKind.TAR;
      }
      final var target = staging.resolve(rawOutputName(archiveName));
      Files.copy(payload, target);
      return PayloadKind.RAW_XZ;
    } catch (IOException e) {
      throw new ExtractionException(IngestError.CORRUPT_ARCHIVE, archiveName, e);
    }
  }

  private void untar(InputStream payload, String archiveName, Path staging)
      throws IOException, ExtractionException {
    // not closed here; closing would close the payload stream as well
    final var tar = new TarArchiveInputStream(payload);
    TarArchiveEntry entry;
    while ((entry = tar.getNextTarEntry()) != null) {
      final var target = staging.resolve(entry.getName()).normalize();
      if (!target.startsWith(staging) || target.equals(staging)) {
        throw new ExtractionException(
            IngestError.PATH_TRAVERSAL,
            archiveName,
            "blocked path traversal attempt: " + entry.getName());
      }
      if (entry.isDirectory()) {
        Files.createDirectories(target);
      } else if (entry.isFile()) {
        Files.createDirectories(target.getParent());
        Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
      } else {
        logger.warn("[{}] skipping non-regular entry {}", archiveName, entry.getName());
      }
    }
  }

  private ExtractionResult publish(String archiveName, PayloadKind kind, Path staging)
      throws ExtractionException {
    final List<Path> staged;
    try (Stream<Path> walk = Files.walk(staging)) {
      staged = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
    } catch (IOException e) {
      throw new ExtractionException(IngestError.CORRUPT_ARCHIVE, archiveName, e);
    }

    final var toMove = new ArrayList<Path>();
    final var unchanged = new ArrayList<Path>();
    for (Path source : staged) {
      final var target = destination.resolve(staging.relativize(source));
      if (!Files.exists(target)) {
        toMove.add(source);
        continue;
      }
      final boolean identical;
      try {
        identical =
            Files.isRegularFile(target)
                && FileUtils.contentEquals(source.toFile(), target.toFile());
      } catch (IOException e) {
        throw new ExtractionException(IngestError.CONFLICTING_TARGET, archiveName, e);
      }
      if (!identical) {
        throw new ExtractionException(
            IngestError.CONFLICTING_TARGET,
            archiveName,
            "target exists with different content: " + destination.relativize(target));
      }
      unchanged.add(target);
    }

    final var published = new ArrayList<Path>();
    for (Path source : toMove) {
      final var target = destination.resolve(staging.relativize(source));
      try {
        Files.createDirectories(target.getParent());
        Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
      } catch (IOException e) {
        throw new ExtractionException(IngestError.CONFLICTING_TARGET, archiveName, e);
      }
      published.add(target);
    }
    return new ExtractionResult(archiveName, kind, published, unchanged);
  }

  private void prepareDestination() throws IctcException {
    try {
      Files.createDirectories(destination);
      try (var stream = Files.newDirectoryStream(destination, STAGING_PREFIX + "*")) {
        for (Path stale : stream) {
          logger.warn("Removing stale staging directory {}", stale);
          FileUtils.deleteDirectory(stale.toFile());
        }
      }
    } catch (IOException e) {
      throw new IctcException(GenericError.IO_ERROR, "preparing " + destination, e);
    }
  }

  private void removeStaging(Path staging) {
    try {
      FileUtils.deleteDirectory(staging.toFile());
    } catch (IOException e) {
      // left for the next run to clean up
      logger.warn("Failed to remove staging directory {}: {}", staging, e.toString());
    }
  }

  /** Output file name of a raw xz payload: the archive name minus .tar.xz or .xz. */
  static String rawOutputName(String archiveName) {
    return StringUtils.removeEnd(StringUtils.removeEnd(archiveName, ".xz"), ".tar");
  }
}
