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
import io.isima.ictc.errors.exception.IctcException;
import io.isima.ictc.errors.exception.IntegrityException;
import io.isima.ictc.integrity.ArchiveVerifier;
import io.isima.ictc.integrity.ChecksumManifest;
import io.isima.ictc.integrity.VerifiedArchive;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unpacks the distribution layout of the sample dataset.
 *
 * <p>The dataset is shipped as a top-level bundle that contains {@code attack_data/} and {@code
 * benign_data/}. Each of them holds per-window {@code .tar.xz} archives and a {@code checksums/}
 * directory of sidecar files. The nested archives are extracted into {@code
 * extracted_attack_data/} and {@code extracted_benign_data/} next to them.
 *
 * <p>All nested archives are verified before any of them is extracted.
 */
public class BundleUnpacker {
  private static final Logger logger = LoggerFactory.getLogger(BundleUnpacker.class);

  public static final String ATTACK_DATA = "attack_data";
  public static final String BENIGN_DATA = "benign_data";
  public static final String EXTRACTED_PREFIX = "extracted_";

  static final String ARCHIVE_SUFFIX = ".tar.xz";

  private final ArchiveVerifier verifier;
  private final boolean allowUnverifiedBundle;

  public BundleUnpacker(ArchiveVerifier verifier, boolean allowUnverifiedBundle) {
    this.verifier = verifier;
    this.allowUnverifiedBundle = allowUnverifiedBundle;
  }

  /** Outcome of unpacking. */
  @Getter
  public static class UnpackResult {
    /** Directories that hold the extracted sample tables. */
    private final List<Path> dataDirectories;

    private final ExtractionReport report;

    /** The top-level bundle with its computed digest, null when no bundle was unpacked. */
    private final VerifiedArchive bundle;

    UnpackResult(List<Path> dataDirectories, ExtractionReport report, VerifiedArchive bundle) {
      this.dataDirectories = List.copyOf(dataDirectories);
      this.report = report;
      this.bundle = bundle;
    }
  }

  /**
   * Unpacks the top-level bundle and the archives nested in it.
   *
   * @param sourceDirectory directory that holds the bundle and optionally its checksums
   * @param bundleName file name of the bundle
   * @param workDirectory directory to unpack into
   * @return the extracted data directories and the extraction report of the nested archives
   * @throws IntegrityException when the bundle or any nested archive fails verification
   * @throws IctcException when the bundle cannot be extracted or the run is interrupted
   */
  public UnpackResult unpackBundle(Path sourceDirectory, String bundleName, Path workDirectory)
      throws IctcException {
    final var bundle = sourceDirectory.resolve(bundleName);
    if (!Files.isRegularFile(bundle)) {
      throw new IntegrityException(
          IngestError.ARCHIVE_UNREADABLE,
          bundleName,
          "top-level archive not found in " + sourceDirectory);
    }
    final var manifest = ChecksumManifest.locate(sourceDirectory);
    final VerifiedArchive verifiedBundle;
    if (manifest.contains(bundleName) || !allowUnverifiedBundle) {
      verifiedBundle = verifier.verify(bundle, manifest.expectedFor(bundleName));
    } else {
      verifiedBundle = verifier.acceptUnverified(bundle);
    }
    // the bundle itself is all or nothing
    new ArchiveExtractor(workDirectory).extract(verifiedBundle);

    final var groups = new LinkedHashMap<Path, List<Path>>();
    for (String name : List.of(ATTACK_DATA, BENIGN_DATA)) {
      final var directory = workDirectory.resolve(name);
      if (Files.isDirectory(directory)) {
        groups.put(directory, listArchives(directory));
      } else {
        logger.warn("Bundle {} has no {} directory", bundleName, name);
      }
    }
    return unpackGroups(groups, workDirectory, verifiedBundle);
  }

  /**
   * Unpacks the archives found directly in a directory into {@code extracted_<dir name>/} next to
   * it.
   *
   * @param archiveDirectory directory of {@code .tar.xz} archives with their checksums
   * @param workDirectory directory to extract into
   * @return the extracted data directory and the extraction report
   * @throws IntegrityException when any archive fails verification
   * @throws IctcException when the run is interrupted or a directory cannot be read
   */
  public UnpackResult unpackDirectory(Path archiveDirectory, Path workDirectory)
      throws IctcException {
    final var groups = new LinkedHashMap<Path, List<Path>>();
    groups.put(archiveDirectory, listArchives(archiveDirectory));
    return unpackGroups(groups, workDirectory, null);
  }

  private UnpackResult unpackGroups(
      Map<Path, List<Path>> groups, Path workDirectory, VerifiedArchive bundle)
      throws IctcException {
    final var verified = new LinkedHashMap<Path, List<VerifiedArchive>>();
    for (var entry : groups.entrySet()) {
      final var manifest = ChecksumManifest.locate(entry.getKey());
      verified.put(entry.getKey(), verifier.verifyAll(entry.getValue(), manifest));
    }

    final var report = new ExtractionReport();
    final var dataDirectories = new ArrayList<Path>();
    for (var entry : verified.entrySet()) {
      final var target =
          workDirectory.resolve(EXTRACTED_PREFIX + entry.getKey().getFileName().toString());
      report.merge(new ArchiveExtractor(target).extractAll(entry.getValue()));
      dataDirectories.add(target);
    }
    logger.info("Unpacked {} archive group(s): {}", groups.size(), report);
    return new UnpackResult(dataDirectories, report, bundle);
  }

  static List<Path> listArchives(Path directory) throws IctcException {
    try (Stream<Path> list = Files.list(directory)) {
      final var archives =
          list.filter(Files::isRegularFile)
              .filter(path -> path.getFileName().toString().endsWith(ARCHIVE_SUFFIX))
              .sorted()
              .collect(Collectors.toList());
      if (archives.isEmpty()) {
        logger.warn("No {} files found in {}", ARCHIVE_SUFFIX, directory);
      }
      return archives;
    } catch (IOException e) {
      throw new IctcException(GenericError.IO_ERROR, "listing " + directory, e);
    }
  }
}
