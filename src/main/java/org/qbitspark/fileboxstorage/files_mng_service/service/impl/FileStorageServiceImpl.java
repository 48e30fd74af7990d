package org.qbitspark.fileboxstorage.files_mng_service.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.fileboxstorage.files_mng_service.entity.FileEntity;
import org.qbitspark.fileboxstorage.files_mng_service.entity.FileVersionEntity;
import org.qbitspark.fileboxstorage.files_mng_service.enums.FileLifecycle;
import org.qbitspark.fileboxstorage.files_mng_service.payload.DeletionResult;
import org.qbitspark.fileboxstorage.files_mng_service.payload.MultipartUploadTicket;
import org.qbitspark.fileboxstorage.files_mng_service.payload.PruneResult;
import org.qbitspark.fileboxstorage.files_mng_service.payload.RecordVersionRequest;
import org.qbitspark.fileboxstorage.files_mng_service.payload.SharedDownloadResult;
import org.qbitspark.fileboxstorage.files_mng_service.payload.VersionContent;
import org.qbitspark.fileboxstorage.files_mng_service.repo.FileRepository;
import org.qbitspark.fileboxstorage.files_mng_service.service.FileStorageService;
import org.qbitspark.fileboxstorage.files_mng_service.service.FileTreeService;
import org.qbitspark.fileboxstorage.files_mng_service.service.VersionManager;
import org.qbitspark.fileboxstorage.globe_utils.Digests;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.CorruptionException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.DownloadFailedException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.InvalidOperationException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.PermissionDeniedException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ShareExhaustedException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ShareExpiredException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ShareForbiddenException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ShareRevokedException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.StorageErrorCode;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.StorageException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.StorageFullException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.UploadFailedException;
import org.qbitspark.fileboxstorage.globesecurity.StorageUser;
import org.qbitspark.fileboxstorage.multipart_service.payload.CompletedUpload;
import org.qbitspark.fileboxstorage.multipart_service.payload.UploadSessionInfo;
import org.qbitspark.fileboxstorage.multipart_service.service.MultipartCoordinator;
import org.qbitspark.fileboxstorage.quota_service.payload.QuotaReservation;
import org.qbitspark.fileboxstorage.quota_service.service.QuotaTracker;
import org.qbitspark.fileboxstorage.share_service.payload.ShareAccessGrant;
import org.qbitspark.fileboxstorage.share_service.service.ShareTokenManager;
import org.qbitspark.fileboxstorage.storage_service.payload.UploadedPart;
import org.qbitspark.fileboxstorage.storage_service.service.StorageBackend;
import org.qbitspark.fileboxstorage.storage_service.utils.CancellableInputStream;
import org.qbitspark.fileboxstorage.storage_service.utils.StorageFailures;
import org.qbitspark.fileboxstorage.storage_service.utils.StorageKeys;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class FileStorageServiceImpl implements FileStorageService {

    private final FileRepository fileRepository;
    private final FileTreeService fileTreeService;
    private final VersionManager versionManager;
    private final QuotaTracker quotaTracker;
    private final MultipartCoordinator multipartCoordinator;
    private final ShareTokenManager shareTokenManager;
    private final StorageBackend storageBackend;
    private final Clock clock;

    @Override
    public FileVersionEntity uploadVersion(StorageUser user, UUID fileId, InputStream data, long size,
                                           String mimeType, String changeNote)
            throws ItemNotFoundException, PermissionDeniedException, StorageFullException, UploadFailedException {
        if (size < 0) {
            throw new InvalidOperationException("upload size must be known");
        }
        FileEntity file = loadOwnedFile(user, fileId);
        QuotaReservation reservation = quotaTracker.reserve(user, size);
        String tempKey = StorageKeys.tempKey(user.getId(), file.getName());
        MessageDigest sha256 = Digests.sha256();
        try {
            storageBackend.save(tempKey, new DigestInputStream(data, sha256), size);
            quotaTracker.commit(reservation, size);
        } catch (RuntimeException e) {
            log.warn("Upload of file {} failed, releasing {} reserved bytes", fileId, size);
            quotaTracker.release(reservation);
            discardStaged(tempKey, e);
            throw e;
        }
        return recordStaged(user, file, tempKey, size, Digests.toHex(sha256.digest()), mimeType, changeNote);
    }

    @Override
    public MultipartUploadTicket beginMultipartUpload(StorageUser user, UUID fileId, long expectedSize)
            throws ItemNotFoundException, PermissionDeniedException, StorageFullException {
        if (expectedSize < 0) {
            throw new InvalidOperationException("expected upload size must be known");
        }
        FileEntity file = loadOwnedFile(user, fileId);
        QuotaReservation reservation = quotaTracker.reserve(user, expectedSize);
        String tempKey = StorageKeys.tempKey(user.getId(), file.getName());
        String uploadId;
        try {
            uploadId = multipartCoordinator.initiate(tempKey, fileId, reservation);
        } catch (RuntimeException e) {
            quotaTracker.release(reservation);
            throw e;
        }
        UploadSessionInfo session = multipartCoordinator.findSession(uploadId)
                .orElseThrow(() -> new ItemNotFoundException("multipart upload " + uploadId + " not found"));
        return MultipartUploadTicket.builder()
                .uploadId(uploadId)
                .fileId(fileId)
                .expiresAt(session.getExpiresAt())
                .minimumPartSize(storageBackend.minimumPartSize())
                .build();
    }

    @Override
    public UploadedPart uploadPart(StorageUser user, String uploadId, int partNumber, InputStream data, long size)
            throws ItemNotFoundException, PermissionDeniedException, UploadFailedException {
        requireOwnedSession(user, uploadId);
        return multipartCoordinator.uploadPart(uploadId, partNumber, data, size);
    }

    @Override
    public FileVersionEntity completeMultipartUpload(StorageUser user, UUID fileId, String uploadId,
                                                     List<UploadedPart> parts, String mimeType, String changeNote)
            throws ItemNotFoundException, PermissionDeniedException, InvalidOperationException, StorageFullException,
            UploadFailedException {
        FileEntity file = loadOwnedFile(user, fileId);
        UploadSessionInfo session = requireOwnedSession(user, uploadId);
        if (!fileId.equals(session.getFileId())) {
            throw new InvalidOperationException("multipart upload " + uploadId + " was not started for file " + fileId);
        }

        CompletedUpload completed = multipartCoordinator.complete(uploadId, parts);
        String tempKey = completed.getKey();
        String contentHash;
        try {
            contentHash = storageBackend.stat(tempKey).getEtag();
            if (completed.getReservation() != null) {
                quotaTracker.commit(completed.getReservation(), completed.getTotalSize());
            }
        } catch (RuntimeException e) {
            if (completed.getReservation() != null) {
                quotaTracker.release(completed.getReservation());
            }
            discardStaged(tempKey, e);
            throw e;
        }
        return recordStaged(user, file, tempKey, completed.getTotalSize(), contentHash, mimeType, changeNote);
    }

    @Override
    public void abortMultipartUpload(StorageUser user, String uploadId) throws PermissionDeniedException {
        if (multipartCoordinator.findSession(uploadId).isEmpty()) {
            return;
        }
        requireOwnedSession(user, uploadId);
        multipartCoordinator.abort(uploadId);
    }

    @Override
    public VersionContent openDownload(StorageUser user, UUID fileId, Integer versionNumber)
            throws ItemNotFoundException, PermissionDeniedException, CorruptionException {
        loadOwnedFile(user, fileId);
        return versionNumber == null
                ? versionManager.openCurrentVersion(fileId)
                : versionManager.openVersion(fileId, versionNumber);
    }

    @Override
    public String getDownloadUrl(StorageUser user, UUID fileId)
            throws ItemNotFoundException, PermissionDeniedException {
        FileEntity file = loadOwnedFile(user, fileId);
        if (file.getCurrentVersion() < 1) {
            throw new ItemNotFoundException("file " + fileId + " has no content yet");
        }
        FileVersionEntity current = versionManager.getVersion(fileId, file.getCurrentVersion());
        return storageBackend.getDownloadUrl(current.getStoragePath(), file.getName());
    }

    @Override
    public SharedDownloadResult downloadShared(String token, String password, OutputStream out)
            throws ItemNotFoundException, PermissionDeniedException, DownloadFailedException,
            ShareExhaustedException, ShareRevokedException, ShareExpiredException, ShareForbiddenException {
        ShareAccessGrant grant = shareTokenManager.validate(token, password);
        if (!grant.canDownload()) {
            throw new PermissionDeniedException("share does not allow downloads");
        }
        FileEntity file = fileRepository.findByFileIdAndLifecycle(grant.getFileId(), FileLifecycle.ACTIVE)
                .orElseThrow(() -> new ItemNotFoundException("shared file is no longer available"));

        long transferred;
        try (VersionContent content = versionManager.openCurrentVersion(file.getFileId())) {
            transferred = CancellableInputStream.of(content.getStream()).transferTo(out);
        } catch (IOException e) {
            log.error("Streaming shared file {} failed", file.getFileId(), e);
            throw StorageFailures.translate(StorageErrorCode.DOWNLOAD_FAILED, "downloadShared",
                    file.getLogicalPath(), e);
        }

        int downloadCount = shareTokenManager.recordDownload(token);
        log.info("Shared download of file {} ({} bytes), share count {}", file.getFileId(), transferred, downloadCount);
        return SharedDownloadResult.builder()
                .fileId(file.getFileId())
                .fileName(file.getName())
                .mimeType(file.getMimeType())
                .bytesTransferred(transferred)
                .downloadCount(downloadCount)
                .build();
    }

    @Override
    public DeletionResult deletePermanently(StorageUser user, UUID fileId)
            throws ItemNotFoundException, PermissionDeniedException {
        FileEntity root = fileRepository.findById(fileId)
                .orElseThrow(() -> new ItemNotFoundException("item " + fileId + " not found"));
        requireOwner(user, root);

        DeletionResult result = purgeSubtree(root);
        quotaTracker.releaseBytes(user.getId(), result.getReleasedBytes());
        log.info("Permanently deleted {} item(s) under {}, released {} bytes",
                result.getDeletedItems(), root.getLogicalPath(), result.getReleasedBytes());
        return result;
    }

    @Override
    public FileEntity copyItem(StorageUser user, UUID sourceId, UUID targetParentId, String newName)
            throws ItemNotFoundException, PermissionDeniedException, InvalidOperationException, StorageFullException {
        FileEntity source = fileRepository.findByFileIdAndLifecycle(sourceId, FileLifecycle.ACTIVE)
                .orElseThrow(() -> new ItemNotFoundException("item " + sourceId + " not found"));
        requireOwner(user, source);
        List<FileEntity> subtree = collectSubtree(source, FileLifecycle.ACTIVE);
        if (targetParentId != null && subtree.stream().anyMatch(node -> node.getFileId().equals(targetParentId))) {
            throw new InvalidOperationException("cannot copy " + source.getLogicalPath() + " into itself");
        }

        Map<UUID, FileVersionEntity> contents = new HashMap<>();
        long totalBytes = 0;
        for (FileEntity node : subtree) {
            if (!node.isDirectory() && node.getCurrentVersion() > 0) {
                FileVersionEntity current = versionManager.getVersion(node.getFileId(), node.getCurrentVersion());
                contents.put(node.getFileId(), current);
                totalBytes += current.getFileSize();
            }
        }
        QuotaReservation reservation = quotaTracker.reserve(user, totalBytes);

        String name = newName != null ? newName : source.getName();
        FileEntity copyRoot = null;
        try {
            copyRoot = createCopy(user, source, targetParentId, name);
            Map<UUID, FileEntity> copies = new HashMap<>();
            copies.put(source.getFileId(), copyRoot);
            // BFS order guarantees a parent's copy exists before its children are copied
            for (FileEntity node : subtree) {
                FileEntity copy = node == source ? copyRoot
                        : createCopy(user, node, copies.get(node.getParentId()).getFileId(), node.getName());
                copies.put(node.getFileId(), copy);
                FileVersionEntity content = contents.get(node.getFileId());
                if (content != null) {
                    copyContent(user, content, copy);
                }
            }
            quotaTracker.commit(reservation, totalBytes);
        } catch (RuntimeException e) {
            log.warn("Copy of {} failed, releasing {} reserved bytes", source.getLogicalPath(), totalBytes);
            quotaTracker.release(reservation);
            if (copyRoot != null) {
                discardCopy(copyRoot, e);
            }
            throw e;
        }
        log.info("Copied {} to {} ({} item(s), {} bytes)", source.getLogicalPath(), copyRoot.getLogicalPath(),
                subtree.size(), totalBytes);
        return copyRoot;
    }

    @Override
    public DeletionResult cleanupRecycleBin(StorageUser user, Duration olderThan) throws InvalidOperationException {
        if (olderThan == null || olderThan.isNegative()) {
            throw new InvalidOperationException("retention must not be negative");
        }
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(olderThan);
        List<FileEntity> expired = fileRepository.findByUserIdAndLifecycleAndDeletedAtBefore(
                user.getId(), FileLifecycle.TOMBSTONED, cutoff);
        Set<UUID> expiredIds = new HashSet<>();
        expired.forEach(node -> expiredIds.add(node.getFileId()));

        int deletedItems = 0;
        long releasedBytes = 0;
        List<String> orphanedKeys = new ArrayList<>();
        for (FileEntity node : expired) {
            // Descendants go with the expired ancestor that is purged
            if (node.getParentId() != null && expiredIds.contains(node.getParentId())) {
                continue;
            }
            try {
                DeletionResult result = deletePermanently(user, node.getFileId());
                deletedItems += result.getDeletedItems();
                releasedBytes += result.getReleasedBytes();
                orphanedKeys.addAll(result.getOrphanedKeys());
            } catch (StorageException e) {
                log.warn("Could not purge {} from the recycle bin, leaving it for the next run",
                        node.getLogicalPath(), e);
            }
        }
        log.info("Recycle bin cleanup for user {} removed {} item(s), released {} bytes",
                user.getId(), deletedItems, releasedBytes);
        return DeletionResult.builder()
                .deletedItems(deletedItems)
                .releasedBytes(releasedBytes)
                .orphanedKeys(orphanedKeys)
                .build();
    }

    @Override
    public PruneResult pruneVersions(StorageUser user, UUID fileId, int keepLast)
            throws ItemNotFoundException, PermissionDeniedException, InvalidOperationException {
        loadOwnedFile(user, fileId);
        PruneResult result = versionManager.pruneVersions(fileId, keepLast);
        quotaTracker.releaseBytes(user.getId(), result.getReleasedBytes());
        return result;
    }

    private FileVersionEntity recordStaged(StorageUser user, FileEntity file, String tempKey, long size,
                                           String contentHash, String mimeType, String changeNote) {
        try {
            return versionManager.recordVersion(RecordVersionRequest.builder()
                    .fileId(file.getFileId())
                    .size(size)
                    .contentHash(contentHash)
                    .storageKey(tempKey)
                    .mimeType(mimeType)
                    .author(user.getId())
                    .changeNote(changeNote)
                    .build());
        } catch (RuntimeException e) {
            log.warn("Recording a version of file {} failed, returning {} bytes", file.getFileId(), size);
            quotaTracker.releaseBytes(user.getId(), size);
            discardStaged(tempKey, e);
            throw e;
        }
    }

    private FileEntity createCopy(StorageUser user, FileEntity source, UUID parentId, String name) {
        return source.isDirectory()
                ? fileTreeService.createDirectory(user.getId(), parentId, name)
                : fileTreeService.createFile(user.getId(), parentId, name, source.getMimeType());
    }

    private void copyContent(StorageUser user, FileVersionEntity content, FileEntity copy) {
        String tempKey = StorageKeys.tempKey(user.getId(), copy.getName());
        storageBackend.copy(content.getStoragePath(), tempKey);
        try {
            versionManager.recordVersion(RecordVersionRequest.builder()
                    .fileId(copy.getFileId())
                    .size(content.getFileSize())
                    .contentHash(content.getFileHash())
                    .storageKey(tempKey)
                    .mimeType(content.getMimeType())
                    .author(user.getId())
                    .changeNote("copied from version " + content.getVersionNumber())
                    .build());
        } catch (RuntimeException e) {
            discardStaged(tempKey, e);
            throw e;
        }
    }

    // The copy's bytes were never committed, so nothing is returned to the quota here
    private void discardCopy(FileEntity copyRoot, RuntimeException failure) {
        try {
            purgeSubtree(copyRoot);
        } catch (StorageException cleanup) {
            log.warn("Could not remove partial copy {}", copyRoot.getLogicalPath(), cleanup);
            failure.addSuppressed(cleanup);
        }
    }

    private DeletionResult purgeSubtree(FileEntity root) {
        long releasedBytes = 0;
        List<String> orphanedKeys = new ArrayList<>();
        List<FileEntity> doomed = collectSubtree(root, null);
        // Children go first so no row ever points at a deleted parent
        Collections.reverse(doomed);
        for (FileEntity node : doomed) {
            shareTokenManager.deactivateSharesForFile(node.getFileId());
            if (!node.isDirectory()) {
                PruneResult purged = versionManager.purgeVersions(node.getFileId());
                releasedBytes += purged.getReleasedBytes();
                orphanedKeys.addAll(purged.getOrphanedKeys());
            }
            fileRepository.delete(node);
        }
        return DeletionResult.builder()
                .deletedItems(doomed.size())
                .releasedBytes(releasedBytes)
                .orphanedKeys(orphanedKeys)
                .build();
    }

    private void discardStaged(String tempKey, RuntimeException failure) {
        try {
            storageBackend.delete(tempKey);
        } catch (StorageException cleanup) {
            log.warn("Could not delete staged upload {}", tempKey, cleanup);
            failure.addSuppressed(cleanup);
        }
    }

    /**
     * Breadth-first walk from {@code root}; a null lifecycle includes tombstoned descendants.
     */
    private List<FileEntity> collectSubtree(FileEntity root, FileLifecycle lifecycle) {
        List<FileEntity> ordered = new ArrayList<>();
        Deque<FileEntity> pending = new ArrayDeque<>();
        pending.add(root);
        while (!pending.isEmpty()) {
            FileEntity node = pending.poll();
            ordered.add(node);
            if (node.isDirectory()) {
                pending.addAll(lifecycle == null
                        ? fileRepository.findByParent_FileId(node.getFileId())
                        : fileRepository.findByParent_FileIdAndLifecycle(node.getFileId(), lifecycle));
            }
        }
        return ordered;
    }

    private FileEntity loadOwnedFile(StorageUser user, UUID fileId) {
        FileEntity file = fileRepository.findByFileIdAndLifecycle(fileId, FileLifecycle.ACTIVE)
                .orElseThrow(() -> new ItemNotFoundException("file " + fileId + " not found"));
        requireOwner(user, file);
        if (file.isDirectory()) {
            throw new InvalidOperationException(file.getLogicalPath() + " is a folder");
        }
        return file;
    }

    private void requireOwner(StorageUser user, FileEntity file) {
        if (!file.getUserId().equals(user.getId())) {
            throw new PermissionDeniedException("item " + file.getFileId() + " belongs to another user");
        }
    }

    // Staged keys embed the owner, so the session key alone proves ownership
    private UploadSessionInfo requireOwnedSession(StorageUser user, String uploadId) {
        UploadSessionInfo session = multipartCoordinator.findSession(uploadId)
                .orElseThrow(() -> new ItemNotFoundException("multipart upload " + uploadId + " not found"));
        if (!session.getKey().startsWith(StorageKeys.tempPrefix(user.getId()))) {
            throw new PermissionDeniedException("multipart upload " + uploadId + " belongs to another user");
        }
        return session;
    }
}
