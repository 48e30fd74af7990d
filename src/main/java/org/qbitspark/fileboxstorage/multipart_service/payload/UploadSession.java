package org.qbitspark.fileboxstorage.multipart_service.payload;

import lombok.Getter;
import org.qbitspark.fileboxstorage.multipart_service.enums.UploadSessionState;
import org.qbitspark.fileboxstorage.quota_service.payload.QuotaReservation;
import org.qbitspark.fileboxstorage.storage_service.payload.UploadedPart;

import java.time.Instant;
import java.util.ArrayList;
import java.util.UUID;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory state of one multipart upload. Part uploads share the read lock; completion and abort
 * take the write lock, so neither runs while a part is still streaming.
 */
@Getter
public class UploadSession {

    private final String uploadId;
    private final String key;
    // File the upload will become a version of; null for sessions not bound to a file
    private final UUID fileId;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final QuotaReservation reservation;
    private final ConcurrentSkipListMap<Integer, UploadedPart> parts = new ConcurrentSkipListMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile UploadSessionState state = UploadSessionState.INITIATED;

    public UploadSession(String uploadId, String key, UUID fileId, Instant createdAt, Instant expiresAt,
                         QuotaReservation reservation) {
        this.uploadId = uploadId;
        this.key = key;
        this.fileId = fileId;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.reservation = reservation;
    }

    public void transitionTo(UploadSessionState next) {
        this.state = next;
    }

    public boolean isStale(Instant now) {
        return !state.isTerminal() && now.isAfter(expiresAt);
    }

    public UploadSessionInfo toInfo() {
        return UploadSessionInfo.builder()
                .uploadId(uploadId)
                .key(key)
                .fileId(fileId)
                .state(state)
                .createdAt(createdAt)
                .expiresAt(expiresAt)
                .parts(new ArrayList<>(parts.values()))
                .build();
    }
}
