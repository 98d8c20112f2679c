package com.flamingo.ai.beoarchive.intake;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.beoarchive.exception.ConfigurationException;
import com.flamingo.ai.beoarchive.pipeline.model.Attachment;
import com.flamingo.ai.beoarchive.pipeline.model.AttachmentBundle;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DirectoryBundleSource")
class DirectoryBundleSourceTest {

  @TempDir Path tempDir;

  @Test
  @DisplayName("should read each sub-directory as one bundle with sorted attachments")
  void shouldReadBundles() throws IOException {
    Path first = Files.createDirectories(tempDir.resolve("bundle-a"));
    Files.write(first.resolve("b.pdf"), new byte[] {2});
    Files.write(first.resolve("a.pdf"), new byte[] {1});
    Files.writeString(first.resolve("notes.txt"), "ignore me");
    Path second = Files.createDirectories(tempDir.resolve("bundle-b"));
    Files.write(second.resolve("BEO.PDF"), new byte[] {3});
    Files.writeString(tempDir.resolve("stray.pdf"), "not in a bundle");

    List<AttachmentBundle> bundles = new DirectoryBundleSource(tempDir).fetchBundles();

    assertThat(bundles)
        .extracting(AttachmentBundle::bundleId)
        .containsExactly("bundle-a", "bundle-b");
    AttachmentBundle bundleA = bundles.get(0);
    assertThat(bundleA.attachments())
        .extracting(Attachment::fileName)
        .containsExactly("a.pdf", "b.pdf", "notes.txt");
    assertThat(bundleA.pdfAttachments()).hasSize(2);
    assertThat(bundleA.attachments().get(2).contentType()).isEqualTo("application/octet-stream");
    assertThat(bundles.get(1).attachments().get(0).contentType()).isEqualTo("application/pdf");
    assertThat(bundleA.receivedAt()).isNotNull();
  }

  @Test
  @DisplayName("should return no bundles for an empty directory")
  void shouldHandleEmptyDirectory() {
    assertThat(new DirectoryBundleSource(tempDir).fetchBundles()).isEmpty();
  }

  @Test
  @DisplayName("should fail with a configuration error when the directory is missing")
  void shouldFailForMissingDirectory() {
    DirectoryBundleSource source = new DirectoryBundleSource(tempDir.resolve("missing"));

    assertThatThrownBy(source::fetchBundles)
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("missing");
    assertThat(source.sourceName()).isEqualTo("directory");
  }
}
