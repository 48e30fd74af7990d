package org.qbitspark.fileboxstorage.quota_service.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.fileboxstorage.globe_utils.KeyedLocks;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.StorageFullException;
import org.qbitspark.fileboxstorage.globesecurity.StorageUser;
import org.qbitspark.fileboxstorage.quota_service.entity.UserQuotaEntity;
import org.qbitspark.fileboxstorage.quota_service.payload.QuotaReservation;
import org.qbitspark.fileboxstorage.quota_service.payload.QuotaUsage;
import org.qbitspark.fileboxstorage.quota_service.repo.UserQuotaRepository;
import org.qbitspark.fileboxstorage.quota_service.service.QuotaTracker;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class QuotaTrackerImpl implements QuotaTracker {

    private final UserQuotaRepository userQuotaRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final KeyedLocks userLocks = new KeyedLocks(256);

    @Override
    public QuotaReservation reserve(StorageUser user, long incomingSize) throws StorageFullException {
        Objects.requireNonNull(user, "user");
        if (incomingSize < 0) {
            throw new IllegalArgumentException("incoming size must not be negative");
        }
        return userLocks.withLock(user.getId(), () -> transactionTemplate.execute(status -> {
            UserQuotaEntity quota = loadForUpdate(user);
            // Compared against the room left so huge sizes cannot overflow past the ceiling
            if (incomingSize > quota.getAvailableStorage()) {
                log.info("Rejected {} bytes for user {}: {} used, {} reserved, ceiling {}",
                        incomingSize, user.getId(), quota.getUsedStorage(), quota.getReservedStorage(),
                        quota.getStorageQuota());
                throw new StorageFullException(String.format(
                        "storage quota exceeded: %d bytes used, %d reserved, %d requested, ceiling %d",
                        quota.getUsedStorage(), quota.getReservedStorage(), incomingSize, quota.getStorageQuota()));
            }
            quota.setReservedStorage(quota.getReservedStorage() + incomingSize);
            userQuotaRepository.save(quota);
            return new QuotaReservation(UUID.randomUUID(), user.getId(), incomingSize, clock.instant());
        }));
    }

    @Override
    public void commit(QuotaReservation reservation, long actualBytes)
            throws ItemNotFoundException, StorageFullException {
        Objects.requireNonNull(reservation, "reservation");
        if (actualBytes < 0) {
            throw new IllegalArgumentException("committed bytes must not be negative");
        }
        Boolean admitted = userLocks.withLock(reservation.getUserId(), () -> {
            if (reservation.isSettled()) {
                log.debug("Reservation {} already settled", reservation.getReservationId());
                return Boolean.TRUE;
            }
            Boolean fits = transactionTemplate.execute(status -> {
                UserQuotaEntity quota = requireForUpdate(reservation.getUserId());
                quota.setReservedStorage(Math.max(0, quota.getReservedStorage() - reservation.getBytes()));
                if (actualBytes > reservation.getBytes() && actualBytes > quota.getAvailableStorage()) {
                    userQuotaRepository.save(quota);
                    return Boolean.FALSE;
                }
                quota.setUsedStorage(quota.getUsedStorage() + actualBytes);
                userQuotaRepository.save(quota);
                return Boolean.TRUE;
            });
            reservation.markSettled();
            return fits;
        });
        if (!Boolean.TRUE.equals(admitted)) {
            throw new StorageFullException("upload grew to " + actualBytes + " bytes, beyond the "
                    + reservation.getBytes() + " reserved and the remaining quota");
        }
        log.debug("Committed {} bytes for user {}", actualBytes, reservation.getUserId());
    }

    @Override
    public void release(QuotaReservation reservation) throws ItemNotFoundException {
        Objects.requireNonNull(reservation, "reservation");
        userLocks.runWithLock(reservation.getUserId(), () -> {
            if (reservation.isSettled()) {
                return;
            }
            transactionTemplate.executeWithoutResult(status -> {
                UserQuotaEntity quota = requireForUpdate(reservation.getUserId());
                quota.setReservedStorage(Math.max(0, quota.getReservedStorage() - reservation.getBytes()));
                userQuotaRepository.save(quota);
            });
            reservation.markSettled();
            log.debug("Released reservation {} of {} bytes", reservation.getReservationId(), reservation.getBytes());
        });
    }

    @Override
    public void releaseBytes(UUID userId, long amount) throws ItemNotFoundException {
        if (amount <= 0) {
            return;
        }
        userLocks.runWithLock(userId, () -> transactionTemplate.executeWithoutResult(status -> {
            UserQuotaEntity quota = requireForUpdate(userId);
            quota.setUsedStorage(Math.max(0, quota.getUsedStorage() - amount));
            userQuotaRepository.save(quota);
        }));
        log.info("Released {} bytes of storage for user {}", amount, userId);
    }

    @Override
    public QuotaUsage usage(UUID userId) throws ItemNotFoundException {
        UserQuotaEntity quota = userQuotaRepository.findById(userId)
                .orElseThrow(() -> new ItemNotFoundException("no quota recorded for user " + userId));
        return QuotaUsage.builder()
                .userId(userId)
                .storageQuota(quota.getStorageQuota())
                .usedStorage(quota.getUsedStorage())
                .reservedStorage(quota.getReservedStorage())
                .availableStorage(quota.getAvailableStorage())
                .build();
    }

    // The ceiling on record follows the identity, which is the source of truth for it
    private UserQuotaEntity loadForUpdate(StorageUser user) {
        UserQuotaEntity quota = userQuotaRepository.findByUserIdForUpdate(user.getId())
                .orElseGet(() -> UserQuotaEntity.builder()
                        .userId(user.getId())
                        .build());
        quota.setStorageQuota(user.getStorageQuota());
        return quota;
    }

    private UserQuotaEntity requireForUpdate(UUID userId) {
        return userQuotaRepository.findByUserIdForUpdate(userId)
                .orElseThrow(() -> new ItemNotFoundException("no quota recorded for user " + userId));
    }
}
