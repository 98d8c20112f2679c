package com.flamingo.ai.beoarchive.archive;

import com.flamingo.ai.beoarchive.exception.ArchiveStorageException;
import com.flamingo.ai.beoarchive.exception.ConfigurationException;
import java.util.List;

/**
 * Storage backend for archived BEO documents.
 *
 * <p>Implementations must be safe for concurrent callers targeting the same folder or file
 * without client-side locking: folder creation treats "already exists" as success, and file
 * writes rely on the backend's own create-only-if-absent operation.
 */
public interface ArchiveStore {

  /**
   * Creates every missing folder in the chain.
   *
   * @param segments folder names from the archive root downwards
   * @return handle to the deepest folder
   * @throws ArchiveStorageException on I/O, network or permission failure
   */
  FolderHandle ensureFolder(List<String> segments);

  /**
   * Writes a file unless one with the same name already exists in the folder.
   *
   * @return {@code created=false} and the existing location when the file was already there
   * @throws ArchiveStorageException on I/O, network or permission failure
   */
  WriteResult writeFileIfAbsent(FolderHandle folder, String fileName, byte[] content);

  /**
   * Checks that the backend is reachable with the configured credentials before any bundle is
   * processed.
   *
   * @throws ConfigurationException when the archive cannot be used at all
   */
  void verifyAccess();

  /** Short backend name for logs and metrics. */
  String backendName();
}
