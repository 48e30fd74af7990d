package org.qbitspark.fileboxstorage.multipart_service.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.InvalidOperationException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.OperationCancelledException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.StorageException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.UploadFailedException;
import org.qbitspark.fileboxstorage.multipart_service.enums.UploadSessionState;
import org.qbitspark.fileboxstorage.multipart_service.payload.CompletedUpload;
import org.qbitspark.fileboxstorage.multipart_service.payload.UploadSession;
import org.qbitspark.fileboxstorage.multipart_service.payload.UploadSessionInfo;
import org.qbitspark.fileboxstorage.multipart_service.service.MultipartCoordinator;
import org.qbitspark.fileboxstorage.quota_service.payload.QuotaReservation;
import org.qbitspark.fileboxstorage.quota_service.service.QuotaTracker;
import org.qbitspark.fileboxstorage.storage_service.config.StorageProperties;
import org.qbitspark.fileboxstorage.storage_service.payload.UploadedPart;
import org.qbitspark.fileboxstorage.storage_service.service.StorageBackend;
import org.qbitspark.fileboxstorage.storage_service.utils.CancellableInputStream;
import org.qbitspark.fileboxstorage.storage_service.utils.StorageKeys;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Service
@RequiredArgsConstructor
@Slf4j
public class MultipartCoordinatorImpl implements MultipartCoordinator {

    static final int MAX_PART_NUMBER = 10_000;

    private final StorageBackend storageBackend;
    private final QuotaTracker quotaTracker;
    private final StorageProperties storageProperties;
    private final Clock clock;
    private final Map<String, UploadSession> sessions = new ConcurrentHashMap<>();

    @Override
    public String initiate(String key) {
        return initiate(key, null);
    }

    @Override
    public String initiate(String key, QuotaReservation reservation) {
        return initiate(key, null, reservation);
    }

    @Override
    public String initiate(String key, UUID fileId, QuotaReservation reservation) {
        StorageKeys.requireSafe(key, "initiateMultipartUpload");
        String uploadId = storageBackend.initiateMultipartUpload(key);
        Instant now = clock.instant();
        UploadSession session = new UploadSession(uploadId, key, fileId, now,
                now.plus(storageProperties.getMultipart().getSessionTtl()), reservation);
        sessions.put(uploadId, session);
        log.info("Multipart upload {} started for {}", uploadId, key);
        return uploadId;
    }

    @Override
    public UploadedPart uploadPart(String uploadId, int partNumber, InputStream data, long size)
            throws ItemNotFoundException, InvalidOperationException, UploadFailedException {
        UploadSession session = requireSession(uploadId, "uploadPart");
        if (partNumber < 1 || partNumber > MAX_PART_NUMBER) {
            throw new UploadFailedException("part number must be between 1 and " + MAX_PART_NUMBER
                    + ", got " + partNumber, "uploadPart", session.getKey(), null);
        }
        try {
            return storePart(session, partNumber, data, size);
        } catch (OperationCancelledException e) {
            log.warn("Part {} of upload {} was cancelled, aborting the session", partNumber, uploadId);
            try {
                abort(uploadId);
            } catch (StorageException abortFailure) {
                e.addSuppressed(abortFailure);
            }
            throw e;
        }
    }

    private UploadedPart storePart(UploadSession session, int partNumber, InputStream data, long size) {
        session.getLock().readLock().lock();
        try {
            if (session.getState().isTerminal()) {
                throw new InvalidOperationException("upload " + session.getUploadId() + " is already "
                        + session.getState());
            }
            session.transitionTo(UploadSessionState.PARTS_UPLOADING);
            InputStream guarded = CancellableInputStream.withTimeout(data,
                    storageProperties.getTransferTimeout(), clock);
            UploadedPart part = storageBackend.uploadPart(session.getKey(), session.getUploadId(),
                    partNumber, guarded, size);
            session.getParts().put(partNumber, part);
            return part;
        } finally {
            session.getLock().readLock().unlock();
        }
    }

    @Override
    public CompletedUpload complete(String uploadId, List<UploadedPart> parts)
            throws ItemNotFoundException, InvalidOperationException, UploadFailedException {
        UploadSession session = requireSession(uploadId, "completeMultipartUpload");
        session.getLock().writeLock().lock();
        try {
            if (session.getState().isTerminal()) {
                throw new InvalidOperationException("upload " + uploadId + " is already " + session.getState());
            }
            List<UploadedPart> ordered = validateParts(session, parts);
            storageBackend.completeMultipartUpload(session.getKey(), uploadId, ordered);
            session.transitionTo(UploadSessionState.COMPLETED);
            sessions.remove(uploadId);

            long totalSize = ordered.stream().mapToLong(UploadedPart::getSize).sum();
            log.info("Multipart upload {} completed: {} parts, {} bytes into {}",
                    uploadId, ordered.size(), totalSize, session.getKey());
            return CompletedUpload.builder()
                    .uploadId(uploadId)
                    .key(session.getKey())
                    .totalSize(totalSize)
                    .partCount(ordered.size())
                    .reservation(session.getReservation())
                    .build();
        } finally {
            session.getLock().writeLock().unlock();
        }
    }

    /**
     * Returns the recorded parts matching the caller's list, which must be exactly 1..N.
     */
    private List<UploadedPart> validateParts(UploadSession session, List<UploadedPart> parts) {
        String key = session.getKey();
        if (parts == null || parts.isEmpty()) {
            throw new UploadFailedException("no parts listed", "completeMultipartUpload", key, null);
        }
        long minimumPartSize = storageBackend.minimumPartSize();
        List<UploadedPart> recordedParts = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size(); i++) {
            int expected = i + 1;
            UploadedPart supplied = parts.get(i);
            if (supplied == null || supplied.getPartNumber() != expected) {
                throw new UploadFailedException("parts must be numbered 1.." + parts.size()
                        + " in order; position " + expected + " holds "
                        + (supplied == null ? "nothing" : "part " + supplied.getPartNumber()),
                        "completeMultipartUpload", key, null);
            }
            UploadedPart recorded = session.getParts().get(expected);
            if (recorded == null) {
                throw new UploadFailedException("part " + expected + " was never uploaded",
                        "completeMultipartUpload", key, null);
            }
            if (supplied.getEtag() == null || !supplied.getEtag().equals(recorded.getEtag())) {
                throw new UploadFailedException("part " + expected + " does not match the uploaded part",
                        "completeMultipartUpload", key, null);
            }
            if (expected < parts.size() && recorded.getSize() < minimumPartSize) {
                throw new UploadFailedException("part " + expected + " is " + recorded.getSize()
                        + " bytes, below the minimum part size of " + minimumPartSize,
                        "completeMultipartUpload", key, null);
            }
            recordedParts.add(recorded);
        }
        return recordedParts;
    }

    @Override
    public void abort(String uploadId) {
        UploadSession session = sessions.get(uploadId);
        if (session == null) {
            log.debug("Abort of unknown or finished upload {} ignored", uploadId);
            return;
        }
        session.getLock().writeLock().lock();
        try {
            if (session.getState().isTerminal()) {
                return;
            }
            try {
                storageBackend.abortMultipartUpload(session.getKey(), uploadId);
            } finally {
                releaseReservation(session);
            }
            session.transitionTo(UploadSessionState.ABORTED);
            sessions.remove(uploadId);
            log.info("Multipart upload {} aborted", uploadId);
        } finally {
            session.getLock().writeLock().unlock();
        }
    }

    @Override
    public Optional<UploadSessionInfo> findSession(String uploadId) {
        return Optional.ofNullable(uploadId)
                .map(sessions::get)
                .map(UploadSession::toInfo);
    }

    @Override
    public List<UploadSessionInfo> listStaleSessions() {
        Instant now = clock.instant();
        return sessions.values().stream()
                .filter(session -> session.isStale(now))
                .sorted(Comparator.comparing(UploadSession::getCreatedAt))
                .map(UploadSession::toInfo)
                .toList();
    }

    @Override
    public int reclaimStaleSessions() {
        int reclaimed = 0;
        for (UploadSessionInfo stale : listStaleSessions()) {
            try {
                abort(stale.getUploadId());
                reclaimed++;
            } catch (StorageException e) {
                log.error("Could not reclaim stale upload {} for {}, will retry on the next sweep",
                        stale.getUploadId(), stale.getKey(), e);
            }
        }
        if (reclaimed > 0) {
            log.info("Reclaimed {} stale multipart upload(s)", reclaimed);
        }
        return reclaimed;
    }

    private UploadSession requireSession(String uploadId, String operation) {
        UploadSession session = uploadId != null ? sessions.get(uploadId) : null;
        if (session == null) {
            throw new ItemNotFoundException("multipart upload " + uploadId + " not found", operation, null, null);
        }
        return session;
    }

    private void releaseReservation(UploadSession session) {
        if (session.getReservation() != null) {
            quotaTracker.release(session.getReservation());
        }
    }
}
