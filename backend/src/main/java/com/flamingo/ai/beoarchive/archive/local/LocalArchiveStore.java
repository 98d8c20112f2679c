package com.flamingo.ai.beoarchive.archive.local;

import com.flamingo.ai.beoarchive.archive.ArchiveStore;
import com.flamingo.ai.beoarchive.archive.FolderHandle;
import com.flamingo.ai.beoarchive.archive.WriteResult;
import com.flamingo.ai.beoarchive.exception.ArchiveStorageException;
import com.flamingo.ai.beoarchive.exception.ConfigurationException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link ArchiveStore} on the local filesystem under a base directory.
 *
 * <p>Files are opened with {@link StandardOpenOption#CREATE_NEW}, so the existence check and the
 * creation are a single filesystem operation and two writers of the same file cannot both win.
 */
@Slf4j
public class LocalArchiveStore implements ArchiveStore {

  private final Path basePath;

  public LocalArchiveStore(Path basePath) {
    this.basePath = basePath.toAbsolutePath().normalize();
  }

  @Override
  public FolderHandle ensureFolder(List<String> segments) {
    Path dir = basePath;
    for (String segment : segments) {
      dir = dir.resolve(segment);
    }
    dir = dir.normalize();
    if (!dir.startsWith(basePath)) {
      throw new ArchiveStorageException("Folder escapes archive root: " + segments, false);
    }

    try {
      Files.createDirectories(dir);
    } catch (FileAlreadyExistsException e) {
      throw new ArchiveStorageException(
          "A file blocks the archive folder " + e.getFile(), false, e);
    } catch (AccessDeniedException e) {
      throw new ArchiveStorageException("Permission denied creating " + dir, false, e);
    } catch (IOException e) {
      throw new ArchiveStorageException(
          "Failed to create folder " + dir + ": " + e.getMessage(), true, e);
    }
    return new FolderHandle(segments, dir.toString());
  }

  @Override
  public WriteResult writeFileIfAbsent(FolderHandle folder, String fileName, byte[] content) {
    Path target = Path.of(folder.location()).resolve(fileName).normalize();
    if (!target.getParent().equals(Path.of(folder.location()).normalize())) {
      throw new ArchiveStorageException("Invalid file name: " + fileName, false);
    }

    OutputStream out;
    try {
      out = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    } catch (FileAlreadyExistsException e) {
      log.debug("File already archived, skipping write: {}", target);
      return WriteResult.alreadyPresent(target.toString());
    } catch (AccessDeniedException e) {
      throw new ArchiveStorageException("Permission denied writing " + target, false, e);
    } catch (IOException e) {
      throw new ArchiveStorageException(
          "Failed to create " + target + ": " + e.getMessage(), true, e);
    }

    try (out) {
      out.write(content);
    } catch (IOException e) {
      deletePartial(target);
      throw new ArchiveStorageException(
          "Failed to write " + target + ": " + e.getMessage(), true, e);
    }

    log.debug("Wrote {} bytes to {}", content.length, target);
    return WriteResult.created(target.toString());
  }

  @Override
  public void verifyAccess() {
    try {
      Files.createDirectories(basePath);
    } catch (IOException e) {
      throw new ConfigurationException("Cannot create archive directory " + basePath, e);
    }
    if (!Files.isWritable(basePath)) {
      throw new ConfigurationException("Archive directory is not writable: " + basePath);
    }
    log.info("Archiving to local directory {}", basePath);
  }

  @Override
  public String backendName() {
    return "local";
  }

  public Path getBasePath() {
    return basePath;
  }

  private void deletePartial(Path target) {
    try {
      Files.deleteIfExists(target);
    } catch (IOException e) {
      log.warn("Could not remove partially written file {}: {}", target, e.getMessage());
    }
  }
}
