package org.qbitspark.fileboxstorage.files_mng_service.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.qbitspark.fileboxstorage.files_mng_service.entity.FileEntity;
import org.qbitspark.fileboxstorage.files_mng_service.entity.FileVersionEntity;
import org.qbitspark.fileboxstorage.files_mng_service.enums.FileKind;
import org.qbitspark.fileboxstorage.files_mng_service.payload.PruneResult;
import org.qbitspark.fileboxstorage.files_mng_service.payload.RecordVersionRequest;
import org.qbitspark.fileboxstorage.files_mng_service.payload.VersionContent;
import org.qbitspark.fileboxstorage.files_mng_service.repo.FileVersionRepository;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.CorruptionException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.DeleteFailedException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.InvalidOperationException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.fileboxstorage.storage_service.service.impl.LocalStorageBackend;
import org.qbitspark.fileboxstorage.storage_service.utils.StorageKeys;
import org.qbitspark.fileboxstorage.support.InMemoryRepositories;
import org.springframework.dao.DataIntegrityViolationException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class VersionManagerImplTest {

    @TempDir
    Path root;

    private InMemoryRepositories store;
    private FileVersionRepository fileVersionRepository;
    private LocalStorageBackend backend;
    private VersionManagerImpl versionManager;
    private UUID userId;
    private FileEntity file;

    @BeforeEach
    void setUp() {
        store = new InMemoryRepositories();
        fileVersionRepository = store.fileVersionRepository();
        backend = spy(new LocalStorageBackend(root, 4));
        versionManager = new VersionManagerImpl(store.fileRepository(), fileVersionRepository, backend,
                InMemoryRepositories.transactionTemplate());
        userId = UUID.randomUUID();
        file = store.addFile(userId, null, "report.txt", FileKind.FILE);
    }

    @Test
    void stagedContentIsPromotedToTheVersionKey() {
        String tempKey = stage("first draft");

        FileVersionEntity version = versionManager.recordVersion(request(tempKey, "first draft"));

        String versionKey = StorageKeys.versionKey(userId, file.getFileId(), 1);
        assertEquals(1, version.getVersionNumber());
        assertEquals(versionKey, version.getStoragePath());
        assertTrue(backend.exists(versionKey));
        assertFalse(backend.exists(tempKey));
        assertEquals(1, file.getCurrentVersion());
        assertEquals("first draft".length(), file.getSize());
        assertEquals("text/plain", version.getMimeType());
    }

    @Test
    void concurrentWritersGetContiguousVersionNumbers() throws Exception {
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<FileVersionEntity>> results = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                String content = "edit " + i;
                String tempKey = stage(content);
                results.add(pool.submit(() -> {
                    start.await();
                    return versionManager.recordVersion(request(tempKey, content));
                }));
            }
            start.countDown();
            List<Integer> numbers = new ArrayList<>();
            for (Future<FileVersionEntity> result : results) {
                numbers.add(result.get().getVersionNumber());
            }

            assertEquals(IntStream.rangeClosed(1, writers).boxed().collect(Collectors.toSet()),
                    numbers.stream().collect(Collectors.toSet()));
            assertEquals(writers, file.getCurrentVersion());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void rollbackOnlyMovesTheCurrentPointer() throws IOException {
        record("one");
        record("two");

        FileEntity rolledBack = versionManager.rollback(file.getFileId(), 1);

        assertEquals(1, rolledBack.getCurrentVersion());
        assertEquals(2, versionManager.listVersions(file.getFileId()).size());
        assertEquals("one", read(versionManager.openCurrentVersion(file.getFileId())));
        assertEquals("two", read(versionManager.openVersion(file.getFileId(), 2)));
    }

    @Test
    void rollbackToMissingVersionIsNotFound() {
        record("one");

        assertThrows(ItemNotFoundException.class, () -> versionManager.rollback(file.getFileId(), 7));
        assertEquals(1, file.getCurrentVersion());
    }

    @Test
    void tamperedContentIsReportedAsCorruption() {
        record("original");
        backend.save(StorageKeys.versionKey(userId, file.getFileId(), 1),
                new ByteArrayInputStream("tampered".getBytes(StandardCharsets.UTF_8)), 8);

        assertThrows(CorruptionException.class, () -> versionManager.openVersion(file.getFileId(), 1));
    }

    @Test
    void currentVersionOfTombstonedFileIsNotFound() throws IOException {
        record("kept");
        file.tombstone(LocalDateTime.now());

        assertThrows(ItemNotFoundException.class, () -> versionManager.openCurrentVersion(file.getFileId()));
        assertEquals("kept", read(versionManager.openVersion(file.getFileId(), 1)));
    }

    @Test
    void fileWithoutVersionsHasNoCurrentContent() {
        assertThrows(ItemNotFoundException.class, () -> versionManager.openCurrentVersion(file.getFileId()));
    }

    @Test
    void versionsAreListedNewestFirst() {
        record("a");
        record("b");
        record("c");

        List<Integer> numbers = versionManager.listVersions(file.getFileId()).stream()
                .map(FileVersionEntity::getVersionNumber)
                .toList();

        assertEquals(List.of(3, 2, 1), numbers);
    }

    @Test
    void pruneKeepsNewestAndCurrentVersions() {
        record("v1");
        record("v2");
        record("v3");
        record("v4");
        versionManager.rollback(file.getFileId(), 1);

        PruneResult result = versionManager.pruneVersions(file.getFileId(), 2);

        assertEquals(List.of(2), result.getRemovedVersions());
        assertEquals(2, result.getReleasedBytes());
        assertTrue(result.getOrphanedKeys().isEmpty());
        assertFalse(backend.exists(StorageKeys.versionKey(userId, file.getFileId(), 2)));
        assertTrue(backend.exists(StorageKeys.versionKey(userId, file.getFileId(), 1)));
        assertEquals(3, versionManager.listVersions(file.getFileId()).size());
    }

    @Test
    void pruneMustKeepAtLeastOneVersion() {
        assertThrows(InvalidOperationException.class, () -> versionManager.pruneVersions(file.getFileId(), 0));
    }

    @Test
    void contentThatCannotBeDeletedIsReportedAsOrphaned() {
        record("v1");
        record("v2");
        String stuckKey = StorageKeys.versionKey(userId, file.getFileId(), 1);
        doThrow(new DeleteFailedException("disk busy", "delete", stuckKey, null)).when(backend).delete(stuckKey);

        PruneResult result = versionManager.purgeVersions(file.getFileId());

        assertEquals(List.of(1, 2), result.getRemovedVersions());
        assertEquals(List.of(stuckKey), result.getOrphanedKeys());
        assertTrue(versionManager.listVersions(file.getFileId()).isEmpty());
    }

    @Test
    void storageKeyBackingAnotherVersionIsRejected() {
        backend.save("shared/blob.bin", new ByteArrayInputStream(new byte[3]), 3);
        versionManager.recordVersion(request("shared/blob.bin", "abc"));

        assertThrows(InvalidOperationException.class,
                () -> versionManager.recordVersion(request("shared/blob.bin", "abc")));
    }

    @Test
    void failedMetadataWriteMovesStagedContentBack() {
        String tempKey = stage("draft");
        doThrow(new DataIntegrityViolationException("constraint violated"))
                .when(fileVersionRepository).saveAndFlush(any(FileVersionEntity.class));

        assertThrows(DataIntegrityViolationException.class,
                () -> versionManager.recordVersion(request(tempKey, "draft")));

        assertTrue(backend.exists(tempKey));
        assertFalse(backend.exists(StorageKeys.versionKey(userId, file.getFileId(), 1)));
        assertEquals(0, file.getCurrentVersion());
    }

    @Test
    void deletedFilesTakeNoNewVersions() {
        file.tombstone(LocalDateTime.now());
        String tempKey = stage("late");

        assertThrows(InvalidOperationException.class, () -> versionManager.recordVersion(request(tempKey, "late")));
    }

    private void record(String content) {
        versionManager.recordVersion(request(stage(content), content));
    }

    private String stage(String content) {
        String key = StorageKeys.tempKey(userId, "report.txt");
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        backend.save(key, new ByteArrayInputStream(bytes), bytes.length);
        return key;
    }

    private RecordVersionRequest request(String storageKey, String content) {
        return RecordVersionRequest.builder()
                .fileId(file.getFileId())
                .size(content.length())
                .contentHash("sha-" + content)
                .storageKey(storageKey)
                .author(userId)
                .build();
    }

    private static String read(VersionContent content) throws IOException {
        try (content) {
            return new String(content.getStream().readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
