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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import io.isima.ictc.errors.IngestError;
import io.isima.ictc.errors.exception.IntegrityException;
import io.isima.ictc.testutils.TestArchives;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ArchiveVerifierTest {

  @Rule public TemporaryFolder folder = new TemporaryFolder();

  private ArchiveVerifier verifier;
  private byte[] content;
  private Path archive;
  private String digest;

  @Before
  public void setUp() throws Exception {
    verifier = new ArchiveVerifier();
    content = "pkt_count,mean_iat\n1,0.5\n2,0.25\n".getBytes(StandardCharsets.UTF_8);
    archive = folder.getRoot().toPath().resolve("benign_samples_1sec.tar.xz");
    Files.write(archive, content);
    digest = TestArchives.sha256Hex(content);
  }

  @Test
  public void testMatchingDigest() throws Exception {
    final var verified = verifier.verify(archive, digest);
    assertEquals(archive, verified.getPath());
    assertEquals("benign_samples_1sec.tar.xz", verified.getName());
    assertEquals(digest, verified.getDigest().toString());
  }

  @Test
  public void testDigestComparisonIgnoresHexCase() throws Exception {
    verifier.verify(archive, digest.toUpperCase());
  }

  @Test
  public void testEverySingleByteMutationFails() throws Exception {
    final var mutated = folder.getRoot().toPath().resolve("mutated.tar.xz");
    for (int i = 0; i < content.length; ++i) {
      final var bytes = content.clone();
      bytes[i] ^= 0x01;
      Files.write(mutated, bytes);
      final var e = assertThrows(IntegrityException.class, () -> verifier.verify(mutated, digest));
      assertThat(e.getInfo(), is(IngestError.CHECKSUM_MISMATCH));
    }
  }

  @Test
  public void testMalformedExpectedDigest() {
    final var e =
        assertThrows(
            IntegrityException.class, () -> verifier.verify(archive, digest.substring(0, 63)));
    assertThat(e.getInfo(), is(IngestError.CHECKSUM_MALFORMED));
    assertThrows(IntegrityException.class, () -> verifier.verify(archive, (String) null));
  }

  @Test
  public void testAcceptUnverifiedComputesDigest() throws Exception {
    final var accepted = verifier.acceptUnverified(archive);
    assertEquals(archive, accepted.getPath());
    assertEquals(digest, accepted.getDigest().toString());

    final var missing = folder.getRoot().toPath().resolve("missing_1sec.tar.xz");
    final var e = assertThrows(IntegrityException.class, () -> verifier.acceptUnverified(missing));
    assertThat(e.getInfo(), is(IngestError.ARCHIVE_UNREADABLE));
  }

  @Test
  public void testUnreadableArchive() {
    final var missing = folder.getRoot().toPath().resolve("missing_1sec.tar.xz");
    final var e = assertThrows(IntegrityException.class, () -> verifier.verify(missing, digest));
    assertThat(e.getInfo(), is(IngestError.ARCHIVE_UNREADABLE));
    assertThat(e.getArchiveName(), is("missing_1sec.tar.xz"));
  }

  @Test
  public void testVerifyAllStopsAtFirstFailure() throws Exception {
    final var good = archive;
    final var bad = folder.getRoot().toPath().resolve("dos_samples_1sec.tar.xz");
    Files.write(bad, "tampered".getBytes(StandardCharsets.UTF_8));
    TestArchives.writeSidecar(good);
    TestArchives.writeSidecar(bad, digest);
    final var manifest = ChecksumManifest.locate(folder.getRoot().toPath());

    final var e =
        assertThrows(
            IntegrityException.class, () -> verifier.verifyAll(List.of(good, bad), manifest));
    assertThat(e.getArchiveName(), is("dos_samples_1sec.tar.xz"));

    final var verified = verifier.verifyAll(List.of(good), manifest);
    assertEquals(1, verified.size());
  }
}
