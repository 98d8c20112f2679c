package com.flamingo.ai.beoarchive.intake;

import com.flamingo.ai.beoarchive.exception.BundleIntakeException;
import com.flamingo.ai.beoarchive.exception.ConfigurationException;
import com.flamingo.ai.beoarchive.pipeline.model.Attachment;
import com.flamingo.ai.beoarchive.pipeline.model.AttachmentBundle;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads bundles from a local directory: each sub-directory is one bundle, and the files directly
 * inside it are its attachments.
 */
@Slf4j
public class DirectoryBundleSource implements BundleSource {

  private final Path root;

  public DirectoryBundleSource(Path root) {
    this.root = root;
  }

  @Override
  public List<AttachmentBundle> fetchBundles() {
    if (!Files.isDirectory(root)) {
      throw new ConfigurationException("Bundle directory does not exist: " + root.toAbsolutePath());
    }

    List<AttachmentBundle> bundles = new ArrayList<>();
    try (Stream<Path> entries = Files.list(root)) {
      List<Path> bundleDirs =
          entries.filter(Files::isDirectory).sorted(Comparator.comparing(Path::toString)).toList();
      for (Path dir : bundleDirs) {
        bundles.add(readBundle(dir));
      }
    } catch (IOException e) {
      throw new BundleIntakeException("Failed to list bundle directory " + root, e);
    }

    log.info("Found {} bundle(s) in {}", bundles.size(), root.toAbsolutePath());
    return bundles;
  }

  @Override
  public String sourceName() {
    return "directory";
  }

  private AttachmentBundle readBundle(Path dir) throws IOException {
    List<Attachment> attachments = new ArrayList<>();
    try (Stream<Path> files = Files.list(dir)) {
      List<Path> sorted =
          files.filter(Files::isRegularFile).sorted(Comparator.comparing(Path::toString)).toList();
      for (Path file : sorted) {
        String name = file.getFileName().toString();
        attachments.add(new Attachment(name, Files.readAllBytes(file), contentTypeOf(name)));
      }
    }
    String name = dir.getFileName().toString();
    return new AttachmentBundle(
        name, name, Files.getLastModifiedTime(dir).toInstant(), attachments);
  }

  private String contentTypeOf(String fileName) {
    return fileName.toLowerCase(Locale.ROOT).endsWith(".pdf")
        ? "application/pdf"
        : "application/octet-stream";
  }
}
