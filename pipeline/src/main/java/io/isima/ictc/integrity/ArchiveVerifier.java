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
import com.google.common.hash.Hashing;
import com.google.common.io.Files;
import io.isima.ictc.errors.GenericError;
import io.isima.ictc.errors.IngestError;
import io.isima.ictc.errors.exception.IctcException;
import io.isima.ictc.errors.exception.IntegrityException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Verifies archives against their expected SHA-256 digests. */
public class ArchiveVerifier {
  private static final Logger logger = LoggerFactory.getLogger(ArchiveVerifier.class);

  /**
   * Computes the SHA-256 digest of a file.
   *
   * @param path the file
   * @return the digest
   * @throws IOException when the file cannot be read
   */
  public static HashCode sha256(Path path) throws IOException {
    return Files.asByteSource(path.toFile()).hash(Hashing.sha256());
  }

  /**
   * Verifies one archive.
   *
   * @param archive the archive path
   * @param expected expected digest as hex text, case-insensitive
   * @return the verified archive
   * @throws IntegrityException when the digest does not match, the expected value is not a SHA-256
   *     hex digest or the archive cannot be read
   */
  public VerifiedArchive verify(Path archive, String expected) throws IntegrityException {
    final var archiveName = archive.getFileName().toString();
    final var parsed = expected == null ? null : ChecksumManifest.parseDigest(expected);
    if (parsed == null || parsed.isEmpty()) {
      throw new IntegrityException(
          IngestError.CHECKSUM_MALFORMED, archiveName, "expected=" + expected);
    }
    return verify(archive, parsed.get());
  }

  /**
   * Verifies one archive.
   *
   * @param archive the archive path
   * @param expected expected digest
   * @return the verified archive
   * @throws IntegrityException when the digest does not match or the archive cannot be read
   */
  public VerifiedArchive verify(Path archive, HashCode expected) throws IntegrityException {
    final var archiveName = archive.getFileName().toString();
    final HashCode actual;
    try {
      actual = sha256(archive);
    } catch (IOException e) {
      throw new IntegrityException(IngestError.ARCHIVE_UNREADABLE, archiveName, e);
    }
    // HashCode.equals compares the digest bytes
    if (!actual.equals(expected)) {
      logger.error("[{}] checksum FAILED (expected {}, got {})", archiveName, expected, actual);
      throw new IntegrityException(
          IngestError.CHECKSUM_MISMATCH,
          archiveName,
          String.format("expected=%s, actual=%s", expected, actual));
    }
    logger.info("[{}] checksum passed", archiveName);
    return new VerifiedArchive(archive, actual);
  }

  /**
   * Accepts an archive that has no checksum entry.
   *
   * <p>Used only for the top-level bundle when the configuration explicitly allows it. The digest
   * is still computed and logged so that the run can be traced back to the bundle it used.
   *
   * @param archive the archive path
   * @return the archive, marked as verified
   * @throws IntegrityException when the archive cannot be read
   */
  public VerifiedArchive acceptUnverified(Path archive) throws IntegrityException {
    final var archiveName = archive.getFileName().toString();
    final HashCode actual;
    try {
      actual = sha256(archive);
    } catch (IOException e) {
      throw new IntegrityException(IngestError.ARCHIVE_UNREADABLE, archiveName, e);
    }
    logger.warn("[{}] no checksum available, accepted unverified (sha256={})", archiveName, actual);
    return new VerifiedArchive(archive, actual);
  }

  /**
   * Verifies every archive before returning any of them.
   *
   * <p>The first failure halts verification, so that no archive of a partially verified set is
   * ever extracted.
   *
   * @param archives archives to verify, in order
   * @param manifest expected digests
   * @return the verified archives in the same order
   * @throws IntegrityException when any archive fails verification
   * @throws IctcException when the thread is interrupted between archives
   */
  public List<VerifiedArchive> verifyAll(List<Path> archives, ChecksumManifest manifest)
      throws IctcException {
    final var verified = new ArrayList<VerifiedArchive>(archives.size());
    for (Path archive : archives) {
      if (Thread.currentThread().isInterrupted()) {
        throw new IctcException(GenericError.OPERATION_CANCELED, "verification interrupted");
      }
      final var expected = manifest.expectedFor(archive.getFileName().toString());
      verified.add(verify(archive, expected));
    }
    return verified;
  }
}
