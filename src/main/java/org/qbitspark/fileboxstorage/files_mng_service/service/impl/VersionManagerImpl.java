package org.qbitspark.fileboxstorage.files_mng_service.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.fileboxstorage.files_mng_service.entity.FileEntity;
import org.qbitspark.fileboxstorage.files_mng_service.entity.FileVersionEntity;
import org.qbitspark.fileboxstorage.files_mng_service.enums.FileLifecycle;
import org.qbitspark.fileboxstorage.files_mng_service.payload.PruneResult;
import org.qbitspark.fileboxstorage.files_mng_service.payload.RecordVersionRequest;
import org.qbitspark.fileboxstorage.files_mng_service.payload.VersionContent;
import org.qbitspark.fileboxstorage.files_mng_service.repo.FileRepository;
import org.qbitspark.fileboxstorage.files_mng_service.repo.FileVersionRepository;
import org.qbitspark.fileboxstorage.files_mng_service.service.VersionManager;
import org.qbitspark.fileboxstorage.globe_utils.Digests;
import org.qbitspark.fileboxstorage.globe_utils.KeyedLocks;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.CorruptionException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.InvalidOperationException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.StorageException;
import org.qbitspark.fileboxstorage.storage_service.payload.StorageObjectInfo;
import org.qbitspark.fileboxstorage.storage_service.service.StorageBackend;
import org.qbitspark.fileboxstorage.storage_service.utils.StorageKeys;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class VersionManagerImpl implements VersionManager {

    private final FileRepository fileRepository;
    private final FileVersionRepository fileVersionRepository;
    private final StorageBackend storageBackend;
    private final TransactionTemplate transactionTemplate;
    private final KeyedLocks fileLocks = new KeyedLocks(512);

    @Override
    public FileVersionEntity recordVersion(RecordVersionRequest request)
            throws ItemNotFoundException, InvalidOperationException {
        Objects.requireNonNull(request.getFileId(), "fileId");
        Objects.requireNonNull(request.getAuthor(), "author");
        if (request.getSize() < 0) {
            throw new IllegalArgumentException("version size must not be negative");
        }
        StorageKeys.requireSafe(request.getStorageKey(), "recordVersion");
        return fileLocks.withLock(request.getFileId(),
                () -> transactionTemplate.execute(status -> appendVersion(request)));
    }

    private FileVersionEntity appendVersion(RecordVersionRequest request) {
        UUID fileId = request.getFileId();
        FileEntity file = fileRepository.findByIdForUpdate(fileId)
                .orElseThrow(() -> new ItemNotFoundException("file " + fileId + " not found"));
        if (!file.isActive()) {
            throw new InvalidOperationException("file " + fileId + " is deleted");
        }
        if (file.isDirectory()) {
            throw new InvalidOperationException("directories have no versions");
        }

        int versionNumber = fileVersionRepository.findMaxVersionNumber(fileId).orElse(0) + 1;
        String sourceKey = request.getStorageKey();
        String storageKey = placeContent(file, versionNumber, sourceKey);
        try {
            StorageObjectInfo stored = storageBackend.stat(storageKey);
            String mimeType = request.getMimeType() != null
                    ? request.getMimeType()
                    : StorageKeys.mimeTypeOf(file.getName());

            FileVersionEntity version = FileVersionEntity.builder()
                    .fileId(fileId)
                    .versionNumber(versionNumber)
                    .fileSize(request.getSize())
                    .fileHash(request.getContentHash())
                    .storagePath(storageKey)
                    .storageEtag(stored.getEtag())
                    .mimeType(mimeType)
                    .changeNote(request.getChangeNote())
                    .createdBy(request.getAuthor())
                    .build();
            FileVersionEntity saved = fileVersionRepository.saveAndFlush(version);

            file.setCurrentVersion(versionNumber);
            file.setSize(request.getSize());
            file.setContentHash(request.getContentHash());
            file.setMimeType(mimeType);
            fileRepository.save(file);

            log.info("Recorded version {} of file {} at {}", versionNumber, fileId, storageKey);
            return saved;
        } catch (RuntimeException e) {
            if (!storageKey.equals(sourceKey)) {
                undoPromotion(storageKey, sourceKey, e);
            }
            throw e;
        }
    }

    private String placeContent(FileEntity file, int versionNumber, String sourceKey) {
        if (StorageKeys.isTempKey(sourceKey)) {
            String versionKey = StorageKeys.versionKey(file.getUserId(), file.getFileId(), versionNumber);
            storageBackend.move(sourceKey, versionKey);
            return versionKey;
        }
        if (fileVersionRepository.existsByStoragePath(sourceKey)) {
            throw new InvalidOperationException("storage key " + sourceKey + " already backs another version");
        }
        return sourceKey;
    }

    private void undoPromotion(String versionKey, String tempKey, RuntimeException failure) {
        try {
            storageBackend.move(versionKey, tempKey);
        } catch (StorageException undo) {
            log.error("Could not move {} back to {} after a failed version write", versionKey, tempKey, undo);
            failure.addSuppressed(undo);
        }
    }

    @Override
    public FileEntity rollback(UUID fileId, int versionNumber) throws ItemNotFoundException, InvalidOperationException {
        return fileLocks.withLock(fileId, () -> transactionTemplate.execute(status -> {
            FileEntity file = fileRepository.findByIdForUpdate(fileId)
                    .orElseThrow(() -> new ItemNotFoundException("file " + fileId + " not found"));
            if (!file.isActive()) {
                throw new InvalidOperationException("file " + fileId + " is deleted");
            }
            FileVersionEntity version = requireVersion(fileId, versionNumber);
            file.setCurrentVersion(version.getVersionNumber());
            file.setSize(version.getFileSize());
            file.setContentHash(version.getFileHash());
            file.setMimeType(version.getMimeType());
            fileRepository.save(file);
            log.info("File {} rolled back to version {}", fileId, versionNumber);
            return file;
        }));
    }

    @Override
    public VersionContent openVersion(UUID fileId, int versionNumber)
            throws ItemNotFoundException, CorruptionException {
        FileVersionEntity version = requireVersion(fileId, versionNumber);
        verifyIntegrity(version);
        return new VersionContent(version, storageBackend.get(version.getStoragePath()));
    }

    @Override
    public VersionContent openCurrentVersion(UUID fileId) throws ItemNotFoundException, CorruptionException {
        FileEntity file = fileRepository.findByFileIdAndLifecycle(fileId, FileLifecycle.ACTIVE)
                .orElseThrow(() -> new ItemNotFoundException("file " + fileId + " not found"));
        if (file.getCurrentVersion() < 1) {
            throw new ItemNotFoundException("file " + fileId + " has no content yet");
        }
        return openVersion(fileId, file.getCurrentVersion());
    }

    private void verifyIntegrity(FileVersionEntity version) {
        String key = version.getStoragePath();
        StorageObjectInfo stored = storageBackend.stat(key);
        String expected = version.getStorageEtag() != null ? version.getStorageEtag() : version.getFileHash();
        if (!Digests.sameEtag(expected, stored.getEtag())) {
            log.error("Integrity check failed for version {} of file {}: expected etag {}, found {}",
                    version.getVersionNumber(), version.getFileId(), expected, stored.getEtag());
            throw new CorruptionException("content of version " + version.getVersionNumber() + " of file "
                    + version.getFileId() + " no longer matches its recorded hash", "openVersion", key, null);
        }
    }

    @Override
    public List<FileVersionEntity> listVersions(UUID fileId) {
        return fileVersionRepository.findByFileIdOrderByVersionNumberDesc(fileId);
    }

    @Override
    public FileVersionEntity getVersion(UUID fileId, int versionNumber) throws ItemNotFoundException {
        return requireVersion(fileId, versionNumber);
    }

    @Override
    public PruneResult pruneVersions(UUID fileId, int keepLast) throws InvalidOperationException {
        if (keepLast < 1) {
            throw new InvalidOperationException("at least one version must be kept");
        }
        List<FileVersionEntity> removed = fileLocks.withLock(fileId, () -> transactionTemplate.execute(status -> {
            FileEntity file = fileRepository.findByIdForUpdate(fileId)
                    .orElseThrow(() -> new ItemNotFoundException("file " + fileId + " not found"));
            List<FileVersionEntity> newestFirst = fileVersionRepository.findByFileIdOrderByVersionNumberDesc(fileId);
            List<FileVersionEntity> doomed = new ArrayList<>();
            for (int i = keepLast; i < newestFirst.size(); i++) {
                FileVersionEntity candidate = newestFirst.get(i);
                if (candidate.getVersionNumber() != file.getCurrentVersion()) {
                    doomed.add(candidate);
                }
            }
            fileVersionRepository.deleteAll(doomed);
            return doomed;
        }));
        return deleteContent(fileId, removed);
    }

    @Override
    public PruneResult purgeVersions(UUID fileId) {
        List<FileVersionEntity> removed = fileLocks.withLock(fileId, () -> transactionTemplate.execute(status -> {
            List<FileVersionEntity> versions = fileVersionRepository.findByFileIdOrderByVersionNumberAsc(fileId);
            fileVersionRepository.deleteAll(versions);
            return versions;
        }));
        return deleteContent(fileId, removed);
    }

    // Metadata is already gone; a content delete that fails leaves an orphan, never a dangling row
    private PruneResult deleteContent(UUID fileId, List<FileVersionEntity> removed) {
        List<Integer> removedVersions = new ArrayList<>();
        List<String> orphanedKeys = new ArrayList<>();
        long releasedBytes = 0;
        for (FileVersionEntity version : removed) {
            removedVersions.add(version.getVersionNumber());
            releasedBytes += version.getFileSize();
            try {
                storageBackend.delete(version.getStoragePath());
            } catch (StorageException e) {
                log.error("Version {} of file {} was removed but its content at {} could not be deleted",
                        version.getVersionNumber(), fileId, version.getStoragePath(), e);
                orphanedKeys.add(version.getStoragePath());
            }
        }
        if (!removedVersions.isEmpty()) {
            log.info("Removed versions {} of file {} ({} bytes)", removedVersions, fileId, releasedBytes);
        }
        return PruneResult.builder()
                .removedVersions(removedVersions)
                .releasedBytes(releasedBytes)
                .orphanedKeys(orphanedKeys)
                .build();
    }

    private FileVersionEntity requireVersion(UUID fileId, int versionNumber) {
        return fileVersionRepository.findByFileIdAndVersionNumber(fileId, versionNumber)
                .orElseThrow(() -> new ItemNotFoundException("version " + versionNumber + " of file " + fileId + " not found"));
    }
}
