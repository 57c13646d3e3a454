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
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import io.isima.ictc.errors.IngestError;
import io.isima.ictc.errors.exception.ExtractionException;
import io.isima.ictc.integrity.ArchiveVerifier;
import io.isima.ictc.integrity.VerifiedArchive;
import io.isima.ictc.testutils.TestArchives;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ArchiveExtractorTest {
  private static final String BENIGN_CSV = "pkt_count,mean_iat\n10,0.5\n12,0.25\n";
  private static final String DOS_CSV = "pkt_count,mean_iat\n900,0.001\n";

  @Rule public TemporaryFolder folder = new TemporaryFolder();

  private Path sources;
  private Path destination;
  private ArchiveVerifier verifier;

  @Before
  public void setUp() throws Exception {
    sources = folder.newFolder("sources").toPath();
    destination = folder.getRoot().toPath().resolve("extracted");
    verifier = new ArchiveVerifier();
  }

  private VerifiedArchive archive(String name, byte[] content) throws Exception {
    final var path = TestArchives.write(sources.resolve(name), content);
    return verifier.verify(path, TestArchives.sha256Hex(content));
  }

  private VerifiedArchive tarArchive(String name, Map<String, String> entries) throws Exception {
    return archive(name, TestArchives.tarXzOfText(entries));
  }

  private List<String> listDestination() throws Exception {
    try (Stream<Path> walk = Files.walk(destination)) {
      return walk.filter(Files::isRegularFile)
          .map(path -> destination.relativize(path).toString())
          .sorted()
          .collect(Collectors.toList());
    }
  }

  @Test
  public void testExtractTar() throws Exception {
    final var archive =
        tarArchive(
            "benign_samples_1sec.tar.xz",
            Map.of("benign_samples_1sec.csv", BENIGN_CSV));
    final var result = new ArchiveExtractor(destination).extract(archive);

    assertThat(result.getPayloadKind(), is(PayloadKind.TAR));
    assertThat(result.getArchiveName(), is("benign_samples_1sec.tar.xz"));
    assertFalse(result.isNoOp());
    assertThat(listDestination(), contains("benign_samples_1sec.csv"));
    assertEquals(
        BENIGN_CSV,
        Files.readString(destination.resolve("benign_samples_1sec.csv"), StandardCharsets.UTF_8));
  }

  @Test
  public void testNestedDirectories() throws Exception {
    final var entries = new LinkedHashMap<String, String>();
    entries.put("attack_data/", "");
    entries.put("attack_data/dos_samples_1sec.csv", DOS_CSV);
    entries.put("benign_data/benign_samples_1sec.csv", BENIGN_CSV);
    new ArchiveExtractor(destination).extract(tarArchive("bundle.tar.xz", entries));

    assertThat(
        listDestination(),
        contains("attack_data/dos_samples_1sec.csv", "benign_data/benign_samples_1sec.csv"));
  }

  @Test
  public void testExtractionIsIdempotent() throws Exception {
    final var archive =
        tarArchive("dos_samples_2sec.tar.xz", Map.of("dos_samples_2sec.csv", DOS_CSV));
    final var extractor = new ArchiveExtractor(destination);
    final var first = extractor.extract(archive);
    final var before = Files.getLastModifiedTime(destination.resolve("dos_samples_2sec.csv"));

    final var second = extractor.extract(archive);
    assertTrue(second.isNoOp());
    assertThat(second.getUnchangedFiles(), is(first.getPublishedFiles()));
    assertThat(second.getAllFiles(), is(first.getAllFiles()));
    assertEquals(before, Files.getLastModifiedTime(destination.resolve("dos_samples_2sec.csv")));
    assertThat(listDestination(), contains("dos_samples_2sec.csv"));
  }

  @Test
  public void testConflictingTarget() throws Exception {
    Files.createDirectories(destination);
    Files.writeString(destination.resolve("dos_samples_1sec.csv"), "something else\n");
    final var archive =
        tarArchive(
            "dos_samples_1sec.tar.xz",
            Map.of("dos_samples_1sec.csv", DOS_CSV, "dos_extra_1sec.csv", DOS_CSV));

    final var e =
        assertThrows(
            ExtractionException.class, () -> new ArchiveExtractor(destination).extract(archive));
    assertThat(e.getInfo(), is(IngestError.CONFLICTING_TARGET));
    // nothing from the archive is published, the existing file is untouched
    assertThat(listDestination(), contains("dos_samples_1sec.csv"));
    assertEquals("something else\n", Files.readString(destination.resolve("dos_samples_1sec.csv")));
  }

  @Test
  public void testTruncatedArchive() throws Exception {
    final var complete =
        TestArchives.tarXzOfText(Map.of("mitm_samples_1sec.csv", DOS_CSV.repeat(200)));
    final var archive =
        archive("mitm_samples_1sec.tar.xz", Arrays.copyOf(complete, complete.length / 2));

    final var e =
        assertThrows(
            ExtractionException.class, () -> new ArchiveExtractor(destination).extract(archive));
    assertThat(e.getInfo(), is(IngestError.CORRUPT_ARCHIVE));
    assertThat(listDestination(), is(empty()));
  }

  @Test
  public void testMissingStreamFooter() throws Exception {
    final var complete = TestArchives.tarXzOfText(Map.of("scan_samples_1sec.csv", DOS_CSV));
    final var archive =
        archive("scan_samples_1sec.tar.xz", Arrays.copyOf(complete, complete.length - 12));

    final var e =
        assertThrows(
            ExtractionException.class, () -> new ArchiveExtractor(destination).extract(archive));
    assertThat(e.getInfo(), is(IngestError.CORRUPT_ARCHIVE));
    assertThat(listDestination(), is(empty()));
  }

  @Test
  public void testNotXz() throws Exception {
    final var archive =
        archive("plain_1sec.tar.xz", "not compressed at all".getBytes(StandardCharsets.UTF_8));
    final var e =
        assertThrows(
            ExtractionException.class, () -> new ArchiveExtractor(destination).extract(archive));
    assertThat(e.getInfo(), is(IngestError.CORRUPT_ARCHIVE));
  }

  @Test
  public void testPathTraversalBlocked() throws Exception {
    final var entries = new LinkedHashMap<String, String>();
    entries.put("good_1sec.csv", DOS_CSV);
    entries.put("../evil_1sec.csv", DOS_CSV);
    final var archive = tarArchive("evil_1sec.tar.xz", entries);

    final var e =
        assertThrows(
            ExtractionException.class, () -> new ArchiveExtractor(destination).extract(archive));
    assertThat(e.getInfo(), is(IngestError.PATH_TRAVERSAL));
    assertThat(listDestination(), is(empty()));
    assertFalse(Files.exists(destination.resolveSibling("evil_1sec.csv")));
    assertFalse(Files.exists(destination.resolve("../evil_1sec.csv")));
  }

  @Test
  public void testRawXzPayload() throws Exception {
    final var content = DOS_CSV.getBytes(StandardCharsets.UTF_8);
    final var archive = archive("dos_samples_3sec.tar.xz", TestArchives.rawXz(content));

    final var result = new ArchiveExtractor(destination).extract(archive);
    assertThat(result.getPayloadKind(), is(PayloadKind.RAW_XZ));
    assertThat(listDestination(), contains("dos_samples_3sec"));
    assertArrayEquals(content, Files.readAllBytes(destination.resolve("dos_samples_3sec")));
  }

  @Test
  public void testRawOutputName() {
    assertEquals("a_1sec", ArchiveExtractor.rawOutputName("a_1sec.tar.xz"));
    assertEquals("a_1sec.csv", ArchiveExtractor.rawOutputName("a_1sec.csv.xz"));
    assertEquals("a_1sec", ArchiveExtractor.rawOutputName("a_1sec"));
  }

  @Test
  public void testExtractAllContinuesAfterFailure() throws Exception {
    final var broken =
        archive("a_broken_1sec.tar.xz", "garbage".getBytes(StandardCharsets.UTF_8));
    final var good =
        tarArchive("b_good_1sec.tar.xz", Map.of("b_good_1sec.csv", DOS_CSV));

    final var report = new ArchiveExtractor(destination).extractAll(List.of(broken, good));
    assertTrue(report.hasFailures());
    assertThat(report.getFailures().keySet(), contains("a_broken_1sec.tar.xz"));
    assertThat(
        report.getFailures().get("a_broken_1sec.tar.xz").getInfo(),
        is(IngestError.CORRUPT_ARCHIVE));
    assertEquals(1, report.getResults().size());
    assertThat(listDestination(), contains("b_good_1sec.csv"));
  }

  @Test
  public void testStaleStagingRemoved() throws Exception {
    final var stale = destination.resolve(ArchiveExtractor.STAGING_PREFIX + "old_1sec.tar.xz");
    Files.createDirectories(stale);
    Files.writeString(stale.resolve("half_written.csv"), "pkt_count\n1");
    final var good = tarArchive("c_1sec.tar.xz", Map.of("c_1sec.csv", DOS_CSV));

    new ArchiveExtractor(destination).extractAll(List.of(good));
    assertFalse(Files.exists(stale));
    assertThat(listDestination(), containsInAnyOrder("c_1sec.csv"));
  }
}
