package org.qbitspark.fileboxstorage.quota_service.payload;

import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * Bytes admitted against a user's quota before the write happens. Settled exactly once, by either
 * a commit or a release; later settlements are no-ops.
 */
@Getter
public class QuotaReservation {

    private final UUID reservationId;
    private final UUID userId;
    private final long bytes;
    private final Instant createdAt;
    private volatile boolean settled;

    public QuotaReservation(UUID reservationId, UUID userId, long bytes, Instant createdAt) {
        this.reservationId = reservationId;
        this.userId = userId;
        this.bytes = bytes;
        this.createdAt = createdAt;
    }

    public void markSettled() {
        this.settled = true;
    }
}
