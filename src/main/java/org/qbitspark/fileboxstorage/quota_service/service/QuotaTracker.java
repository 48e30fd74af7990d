package org.qbitspark.fileboxstorage.quota_service.service;

import org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.StorageFullException;
import org.qbitspark.fileboxstorage.globesecurity.StorageUser;
import org.qbitspark.fileboxstorage.quota_service.payload.QuotaReservation;
import org.qbitspark.fileboxstorage.quota_service.payload.QuotaUsage;

import java.util.UUID;

/**
 * Admits writes against per-user storage ceilings. All mutations for one user are serialized.
 */
public interface QuotaTracker {

    /**
     * @throws org.qbitspark.fileboxstorage.globeadvice.exceptions.StorageFullException when used,
     *         reserved and incoming bytes together would exceed the ceiling
     */
    QuotaReservation reserve(StorageUser user, long incomingSize) throws StorageFullException;

    /**
     * Converts the reservation into consumed bytes. Growing past the reserved amount is checked
     * against the ceiling again.
     */
    void commit(QuotaReservation reservation, long actualBytes) throws ItemNotFoundException, StorageFullException;

    void release(QuotaReservation reservation) throws ItemNotFoundException;

    /**
     * Gives back bytes of content that has been deleted. Consumption never drops below zero.
     */
    void releaseBytes(UUID userId, long amount) throws ItemNotFoundException;

    QuotaUsage usage(UUID userId) throws ItemNotFoundException;
}
