package com.flamingo.ai.beoarchive.archive.local;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.beoarchive.archive.FolderHandle;
import com.flamingo.ai.beoarchive.archive.WriteResult;
import com.flamingo.ai.beoarchive.exception.ArchiveStorageException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("LocalArchiveStore")
class LocalArchiveStoreTest {

  private static final List<String> EVENT_FOLDER = List.of("2026", "1", "1", "12345 - Acme Corp");

  @TempDir Path tempDir;

  private LocalArchiveStore store;

  @BeforeEach
  void setUp() {
    store = new LocalArchiveStore(tempDir.resolve("archive"));
  }

  @Test
  @DisplayName("should create the whole folder chain and tolerate repeats")
  void shouldEnsureFolderIdempotently() {
    FolderHandle first = store.ensureFolder(EVENT_FOLDER);
    FolderHandle second = store.ensureFolder(EVENT_FOLDER);

    Path expected = tempDir.resolve("archive/2026/1/1/12345 - Acme Corp").toAbsolutePath();
    assertThat(Path.of(first.location())).isEqualTo(expected);
    assertThat(expected).isDirectory();
    assertThat(second).isEqualTo(first);
    assertThat(first.relativePath()).isEqualTo("2026/1/1/12345 - Acme Corp");
  }

  @Test
  @DisplayName("should write once and report the existing file afterwards")
  void shouldWriteFileOnce() throws IOException {
    FolderHandle folder = store.ensureFolder(EVENT_FOLDER);

    WriteResult first = store.writeFileIfAbsent(folder, "beo.pdf", bytes("original"));
    WriteResult second = store.writeFileIfAbsent(folder, "beo.pdf", bytes("replacement"));

    assertThat(first.created()).isTrue();
    assertThat(second.created()).isFalse();
    assertThat(second.location()).isEqualTo(first.location());
    assertThat(Files.readString(Path.of(first.location()))).isEqualTo("original");
  }

  @Test
  @DisplayName("should let exactly one of many concurrent writers create the file")
  void shouldCreateOnceUnderConcurrency() throws Exception {
    FolderHandle folder = store.ensureFolder(EVENT_FOLDER);
    int writers = 8;
    ExecutorService pool = Executors.newFixedThreadPool(writers);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<WriteResult>> futures = new ArrayList<>();
      for (int i = 0; i < writers; i++) {
        byte[] content = bytes("writer-" + i);
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  store.ensureFolder(EVENT_FOLDER);
                  return store.writeFileIfAbsent(folder, "beo.pdf", content);
                }));
      }
      start.countDown();

      int created = 0;
      for (Future<WriteResult> future : futures) {
        if (future.get(10, TimeUnit.SECONDS).created()) {
          created++;
        }
      }
      assertThat(created).isEqualTo(1);
      assertThat(Files.readString(Path.of(folder.location()).resolve("beo.pdf")))
          .startsWith("writer-");
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  @DisplayName("should refuse folders that escape the archive root")
  void shouldRejectEscapingFolder() {
    assertThatThrownBy(() -> store.ensureFolder(List.of("..", "..", "elsewhere")))
        .isInstanceOf(ArchiveStorageException.class)
        .satisfies(e -> assertThat(((ArchiveStorageException) e).isTransientFailure()).isFalse());
  }

  @Test
  @DisplayName("should refuse file names that leave the folder")
  void shouldRejectEscapingFileName() {
    FolderHandle folder = store.ensureFolder(EVENT_FOLDER);

    assertThatThrownBy(() -> store.writeFileIfAbsent(folder, "../beo.pdf", bytes("x")))
        .isInstanceOf(ArchiveStorageException.class);
  }

  @Test
  @DisplayName("should report a file in place of a folder as a permanent failure")
  void shouldFailWhenFileBlocksFolder() throws IOException {
    Files.createDirectories(tempDir.resolve("archive"));
    Files.writeString(tempDir.resolve("archive/2026"), "not a folder");

    assertThatThrownBy(() -> store.ensureFolder(EVENT_FOLDER))
        .isInstanceOf(ArchiveStorageException.class)
        .satisfies(e -> assertThat(((ArchiveStorageException) e).isTransientFailure()).isFalse());
  }

  @Test
  @DisplayName("should create the base directory during the access check")
  void shouldVerifyAccess() {
    store.verifyAccess();

    assertThat(store.getBasePath()).isDirectory();
    assertThat(store.backendName()).isEqualTo("local");
  }

  private static byte[] bytes(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }
}
