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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import io.isima.ictc.errors.IngestError;
import io.isima.ictc.errors.exception.IntegrityException;
import io.isima.ictc.integrity.ArchiveVerifier;
import io.isima.ictc.integrity.ChecksumManifest;
import io.isima.ictc.testutils.TestArchives;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class BundleUnpackerTest {
  private static final String BUNDLE = "all_attack_benign_samples.tar.xz";
  private static final String CSV = "pkt_count,mean_iat\n10,0.5\n";

  @Rule public TemporaryFolder folder = new TemporaryFolder();

  private Path source;
  private Path work;

  @Before
  public void setUp() throws Exception {
    source = folder.newFolder("source").toPath();
    work = folder.getRoot().toPath().resolve("work");
  }

  private static BundleUnpacker unpacker(boolean allowUnverifiedBundle) {
    return new BundleUnpacker(new ArchiveVerifier(), allowUnverifiedBundle);
  }

  /** Builds the bundle; nested archives get sidecars unless listed in {@code badDigests}. */
  private byte[] bundle(Map<String, String> badDigests) throws Exception {
    final var entries = new LinkedHashMap<String, byte[]>();
    final var names =
        new String[] {
          "attack_data/dos_samples_1sec.tar.xz", "benign_data/benign_samples_1sec.tar.xz"
        };
    for (String name : names) {
      final var fileName = Path.of(name).getFileName().toString();
      final var nested = TestArchives.tarXzOfText(Map.of(fileName.replace(".tar.xz", ".csv"), CSV));
      entries.put(name, nested);
      final var digest = badDigests.getOrDefault(fileName, TestArchives.sha256Hex(nested));
      final var group = Path.of(name).getParent().toString();
      entries.put(
          group + "/checksums/" + fileName + ".sha256",
          TestArchives.sidecarContent(digest, fileName));
    }
    return TestArchives.tarXz(entries);
  }

  private static long countFiles(Path dir) throws Exception {
    if (!Files.exists(dir)) {
      return 0;
    }
    try (Stream<Path> walk = Files.walk(dir)) {
      return walk.filter(Files::isRegularFile).count();
    }
  }

  @Test
  public void testUnpackBundle() throws Exception {
    final var bundle = TestArchives.write(source.resolve(BUNDLE), bundle(Map.of()));
    TestArchives.writeSidecar(bundle);

    final var result = unpacker(false).unpackBundle(source, BUNDLE, work);
    assertThat(
        result.getDataDirectories(),
        contains(work.resolve("extracted_attack_data"), work.resolve("extracted_benign_data")));
    assertFalse(result.getReport().hasFailures());
    assertEquals(2, result.getReport().getResults().size());
    assertEquals(bundle, result.getBundle().getPath());
    assertTrue(Files.isRegularFile(work.resolve("extracted_attack_data/dos_samples_1sec.csv")));
    assertTrue(
        Files.isRegularFile(work.resolve("extracted_benign_data/benign_samples_1sec.csv")));

    // a second run is a no-op
    final var again = unpacker(false).unpackBundle(source, BUNDLE, work);
    assertTrue(again.getReport().getResults().stream().allMatch(ExtractionResult::isNoOp));
  }

  @Test
  public void testNestedMismatchExtractsNothing() throws Exception {
    final var wrong = TestArchives.sha256Hex("something else".getBytes(StandardCharsets.UTF_8));
    final var bundle =
        TestArchives.write(
            source.resolve(BUNDLE), bundle(Map.of("benign_samples_1sec.tar.xz", wrong)));
    TestArchives.writeSidecar(bundle);

    final var e =
        assertThrows(
            IntegrityException.class,
            () -> unpacker(false).unpackBundle(source, BUNDLE, work));
    assertThat(e.getInfo(), is(IngestError.CHECKSUM_MISMATCH));
    assertThat(e.getArchiveName(), is("benign_samples_1sec.tar.xz"));
    assertEquals(0, countFiles(work.resolve("extracted_attack_data")));
    assertEquals(0, countFiles(work.resolve("extracted_benign_data")));
  }

  @Test
  public void testBundleWithoutChecksumRejected() throws Exception {
    TestArchives.write(source.resolve(BUNDLE), bundle(Map.of()));

    final var e =
        assertThrows(
            IntegrityException.class,
            () -> unpacker(false).unpackBundle(source, BUNDLE, work));
    assertThat(e.getInfo(), is(IngestError.CHECKSUM_MISSING));
    assertEquals(0, countFiles(work));
  }

  @Test
  public void testBundleWithoutChecksumAllowed() throws Exception {
    final var content = bundle(Map.of());
    TestArchives.write(source.resolve(BUNDLE), content);

    final var result = unpacker(true).unpackBundle(source, BUNDLE, work);
    assertEquals(2, result.getReport().getResults().size());
    assertEquals(BUNDLE, result.getBundle().getName());
    assertEquals(TestArchives.sha256Hex(content), result.getBundle().getDigest().toString());
  }

  @Test
  public void testAllowUnverifiedDoesNotBypassMismatch() throws Exception {
    final var bundle = TestArchives.write(source.resolve(BUNDLE), bundle(Map.of()));
    TestArchives.writeSidecar(bundle, TestArchives.sha256Hex(new byte[] {1}));

    final var e =
        assertThrows(
            IntegrityException.class,
            () -> unpacker(true).unpackBundle(source, BUNDLE, work));
    assertThat(e.getInfo(), is(IngestError.CHECKSUM_MISMATCH));
    assertEquals(0, countFiles(work));
  }

  @Test
  public void testMissingBundle() {
    final var e =
        assertThrows(
            IntegrityException.class,
            () -> unpacker(true).unpackBundle(source, BUNDLE, work));
    assertThat(e.getInfo(), is(IngestError.ARCHIVE_UNREADABLE));
  }

  @Test
  public void testUnpackDirectory() throws Exception {
    final var archives = source.resolve("archives");
    for (String name : new String[] {"benign_samples_2sec", "dos_samples_2sec"}) {
      final var archive =
          TestArchives.write(
              archives.resolve(name + ".tar.xz"),
              TestArchives.tarXzOfText(Map.of(name + ".csv", CSV)));
      TestArchives.writeSidecar(archive);
    }
    Files.writeString(archives.resolve("README.txt"), "not an archive");

    final var result = unpacker(false).unpackDirectory(archives, work);
    assertThat(result.getDataDirectories(), contains(work.resolve("extracted_archives")));
    assertNull(result.getBundle());
    assertEquals(2, countFiles(work.resolve("extracted_archives")));
  }

  @Test
  public void testUnpackDirectoryWithoutChecksums() throws Exception {
    final var archives = source.resolve("archives");
    TestArchives.write(
        archives.resolve("dos_samples_2sec.tar.xz"),
        TestArchives.tarXzOfText(Map.of("dos_samples_2sec.csv", CSV)));
    assertEquals(0, ChecksumManifest.locate(archives).size());

    final var e =
        assertThrows(
            IntegrityException.class,
            () -> unpacker(true).unpackDirectory(archives, work));
    assertThat(e.getInfo(), is(IngestError.CHECKSUM_MISSING));
    assertEquals(0, countFiles(work));
  }
}
