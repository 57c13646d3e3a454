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
package io.isima.ictc.integrity;

import com.google.common.hash.HashCode;
import com.google.common.io.MoreFiles;
import io.isima.ictc.errors.GenericError;
import io.isima.ictc.errors.IngestError;
import io.isima.ictc.errors.exception.IctcException;
import io.isima.ictc.errors.exception.IntegrityException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expected SHA-256 digests of a set of archives, keyed by archive file name.
 *
 * <p>Two layouts are supported:
 *
 * <ul>
 *   <li>A directory of sidecar files {@code <archive>.sha256}, each holding one entry
 *   <li>A single manifest file with one entry per line, as written by {@code sha256sum}
 * </ul>
 *
 * <p>An entry is {@code <hash>  <file>}, {@code <hash> *<file>} or a bare {@code <hash>} (sidecar
 * files only). Entries that are not 64 hex digits are kept as malformed and reported when the
 * archive is looked up, so that one broken entry does not hide the others. Checksum files are
 * decoded as UTF-8 with malformed bytes replaced, so undecodable bytes in a digest make only that
 * entry malformed.
 */
public class ChecksumManifest {
  private static final Logger logger = LoggerFactory.getLogger(ChecksumManifest.class);

  public static final String SIDECAR_DIRECTORY = "checksums";
  public static final String SIDECAR_SUFFIX = ".sha256";
  public static final String MANIFEST_FILE = "SHA256SUMS";

  private static final Pattern DIGEST_PATTERN = Pattern.compile("^[0-9a-fA-F]{64}$");

  private final Map<String, HashCode> digests;
  private final Map<String, String> malformed;

  private ChecksumManifest(Map<String, HashCode> digests, Map<String, String> malformed) {
    this.digests = Collections.unmodifiableMap(digests);
    this.malformed = Collections.unmodifiableMap(malformed);
  }

  /**
   * Locates the checksums of the archives in a directory.
   *
   * <p>The sidecar directory {@code checksums/} takes precedence over a {@code SHA256SUMS} manifest
   * file. When neither exists, the manifest is empty and every lookup fails.
   *
   * @param archiveDirectory directory that holds the archives
   * @return the manifest
   * @throws IctcException when a checksum file cannot be read
   */
  public static ChecksumManifest locate(Path archiveDirectory) throws IctcException {
    final var sidecars = archiveDirectory.resolve(SIDECAR_DIRECTORY);
    if (Files.isDirectory(sidecars)) {
      return fromSidecarDirectory(sidecars);
    }
    final var manifest = archiveDirectory.resolve(MANIFEST_FILE);
    if (Files.isRegularFile(manifest)) {
      return fromManifestFile(manifest);
    }
    logger.warn("No checksums found in {}", archiveDirectory);
    return new ChecksumManifest(Map.of(), Map.of());
  }

  /**
   * Loads a directory of {@code <archive>.sha256} sidecar files.
   *
   * @param directory the sidecar directory
   * @return the manifest
   * @throws IctcException when the directory cannot be read
   */
  public static ChecksumManifest fromSidecarDirectory(Path directory) throws IctcException {
    final var digests = new HashMap<String, HashCode>();
    final var malformed = new HashMap<String, String>();
    try (var stream = Files.newDirectoryStream(directory, "*" + SIDECAR_SUFFIX)) {
      for (Path sidecar : stream) {
        final var fileName = sidecar.getFileName().toString();
        final var archiveName =
            fileName.substring(0, fileName.length() - SIDECAR_SUFFIX.length());
        final var lines = readLines(sidecar);
        final var firstLine = lines.stream().filter(line -> !line.isBlank()).findFirst();
        if (firstLine.isEmpty()) {
          malformed.put(archiveName, "empty checksum file " + fileName);
          continue;
        }
        final var digest = parseDigest(firstLine.get());
        if (digest.isPresent()) {
          digests.put(archiveName, digest.get());
        } else {
          malformed.put(archiveName, "invalid checksum file format: " + fileName);
        }
      }
    } catch (IOException e) {
      throw new IctcException(GenericError.IO_ERROR, "reading checksums in " + directory, e);
    }
    logger.debug("Loaded {} checksum sidecar(s) from {}", digests.size(), directory);
    return new ChecksumManifest(digests, malformed);
  }

  /**
   * Loads a multi-line manifest file where each line names its archive.
   *
   * @param manifestFile the manifest file
   * @return the manifest
   * @throws IctcException when the file cannot be read
   */
  public static ChecksumManifest fromManifestFile(Path manifestFile) throws IctcException {
    final List<String> lines;
    try {
      lines = readLines(manifestFile);
    } catch (IOException e) {
      throw new IctcException(GenericError.IO_ERROR, "reading " + manifestFile, e);
    }
    final var digests = new HashMap<String, HashCode>();
    final var malformed = new HashMap<String, String>();
    for (int i = 0; i < lines.size(); ++i) {
      final var line = lines.get(i).trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      final var archiveName = parseFileName(line);
      if (archiveName == null) {
        logger.warn("{}:{} has no file name, ignored", manifestFile.getFileName(), i + 1);
        continue;
      }
      final var digest = parseDigest(line);
      if (digest.isPresent()) {
        digests.put(archiveName, digest.get());
      } else {
        malformed.put(
            archiveName,
            String.format("invalid checksum entry at %s:%d", manifestFile.getFileName(), i + 1));
      }
    }
    return new ChecksumManifest(digests, malformed);
  }

  /**
   * Returns the expected digest of an archive.
   *
   * @param archiveName archive file name
   * @return the expected digest
   * @throws IntegrityException when the entry is missing or malformed
   */
  public HashCode expectedFor(String archiveName) throws IntegrityException {
    final var digest = digests.get(archiveName);
    if (digest != null) {
      return digest;
    }
    final var reason = malformed.get(archiveName);
    if (reason != null) {
      throw new IntegrityException(IngestError.CHECKSUM_MALFORMED, archiveName, reason);
    }
    throw new IntegrityException(
        IngestError.CHECKSUM_MISSING, archiveName, "no entry in the checksum manifest");
  }

  public boolean contains(String archiveName) {
    return digests.containsKey(archiveName) || malformed.containsKey(archiveName);
  }

  public int size() {
    return digests.size() + malformed.size();
  }

  private static List<String> readLines(Path file) throws IOException {
    return MoreFiles.asCharSource(file, StandardCharsets.UTF_8).readLines();
  }

  /**
   * Parses the digest token of a checksum line.
   *
   * @param line the line
   * @return the digest if the first token is 64 hex digits, empty otherwise
   */
  static Optional<HashCode> parseDigest(String line) {
    final var tokens = line.trim().split("\\s+", 2);
    final var token = tokens[0];
    if (!DIGEST_PATTERN.matcher(token).matches()) {
      return Optional.empty();
    }
    return Optional.of(HashCode.fromString(token.toLowerCase()));
  }

  static String parseFileName(String line) {
    final var tokens = line.trim().split("\\s+", 2);
    if (tokens.length < 2) {
      return null;
    }
    var name = tokens[1].trim();
    if (name.startsWith("*")) {
      name = name.substring(1);
    }
    // entries may carry a relative directory
    final int slash = name.lastIndexOf('/');
    return slash >= 0 ? name.substring(slash + 1) : name;
  }
}
