package org.qbitspark.fileboxstorage.quota_service.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.StorageErrorCode;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.StorageFullException;
import org.qbitspark.fileboxstorage.globesecurity.StorageUser;
import org.qbitspark.fileboxstorage.quota_service.payload.QuotaReservation;
import org.qbitspark.fileboxstorage.quota_service.payload.QuotaUsage;
import org.qbitspark.fileboxstorage.support.InMemoryRepositories;
import org.qbitspark.fileboxstorage.support.MutableClock;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuotaTrackerImplTest {

    private InMemoryRepositories store;
    private QuotaTrackerImpl quotaTracker;
    private StorageUser user;

    @BeforeEach
    void setUp() {
        store = new InMemoryRepositories();
        quotaTracker = new QuotaTrackerImpl(store.userQuotaRepository(), InMemoryRepositories.transactionTemplate(),
                new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
        user = StorageUser.builder().id(UUID.randomUUID()).storageQuota(1000).build();
    }

    @Test
    void uploadBeyondRemainingQuotaIsRejectedWithoutChangingConsumption() {
        QuotaReservation first = quotaTracker.reserve(user, 600);
        quotaTracker.commit(first, 600);

        StorageFullException error = assertThrows(StorageFullException.class, () -> quotaTracker.reserve(user, 500));

        assertEquals(StorageErrorCode.STORAGE_FULL, error.getCode());
        QuotaUsage usage = quotaTracker.usage(user.getId());
        assertEquals(600, usage.getUsedStorage());
        assertEquals(0, usage.getReservedStorage());
        assertEquals(400, usage.getAvailableStorage());
    }

    @Test
    void hugeReservationCannotWrapPastTheCeiling() {
        QuotaReservation first = quotaTracker.reserve(user, 600);
        quotaTracker.commit(first, 600);

        assertThrows(StorageFullException.class, () -> quotaTracker.reserve(user, Long.MAX_VALUE));

        QuotaUsage usage = quotaTracker.usage(user.getId());
        assertEquals(600, usage.getUsedStorage());
        assertEquals(0, usage.getReservedStorage());
    }

    @Test
    void hugeCommitCannotWrapPastTheCeiling() {
        QuotaReservation held = quotaTracker.reserve(user, 300);
        QuotaReservation reservation = quotaTracker.reserve(user, 100);

        assertThrows(StorageFullException.class, () -> quotaTracker.commit(reservation, Long.MAX_VALUE));

        QuotaUsage usage = quotaTracker.usage(user.getId());
        assertEquals(0, usage.getUsedStorage());
        assertEquals(held.getBytes(), usage.getReservedStorage());
    }

    @Test
    void openReservationsCountAgainstTheCeiling() {
        quotaTracker.reserve(user, 700);

        assertThrows(StorageFullException.class, () -> quotaTracker.reserve(user, 301));
        QuotaReservation fits = quotaTracker.reserve(user, 300);

        assertEquals(300, fits.getBytes());
        assertEquals(1000, quotaTracker.usage(user.getId()).getReservedStorage());
    }

    @Test
    void reservationAtExactlyTheCeilingIsAdmitted() {
        QuotaReservation reservation = quotaTracker.reserve(user, 1000);
        quotaTracker.commit(reservation, 1000);

        assertEquals(0, quotaTracker.usage(user.getId()).getAvailableStorage());
    }

    @Test
    void commitOfFewerBytesThanReservedFreesTheDifference() {
        QuotaReservation reservation = quotaTracker.reserve(user, 800);
        quotaTracker.commit(reservation, 300);

        QuotaUsage usage = quotaTracker.usage(user.getId());
        assertEquals(300, usage.getUsedStorage());
        assertEquals(0, usage.getReservedStorage());
    }

    @Test
    void commitThatOutgrowsTheQuotaIsRejected() {
        QuotaReservation other = quotaTracker.reserve(user, 500);
        QuotaReservation reservation = quotaTracker.reserve(user, 400);

        assertThrows(StorageFullException.class, () -> quotaTracker.commit(reservation, 700));

        QuotaUsage usage = quotaTracker.usage(user.getId());
        assertEquals(0, usage.getUsedStorage());
        assertEquals(other.getBytes(), usage.getReservedStorage());
        assertTrue(reservation.isSettled());
    }

    @Test
    void commitAndReleaseSettleOnlyOnce() {
        QuotaReservation reservation = quotaTracker.reserve(user, 200);
        quotaTracker.commit(reservation, 200);
        quotaTracker.commit(reservation, 200);
        quotaTracker.release(reservation);

        QuotaUsage usage = quotaTracker.usage(user.getId());
        assertEquals(200, usage.getUsedStorage());
        assertEquals(0, usage.getReservedStorage());
    }

    @Test
    void releaseReturnsReservedBytesOnce() {
        QuotaReservation kept = quotaTracker.reserve(user, 100);
        QuotaReservation dropped = quotaTracker.reserve(user, 400);

        quotaTracker.release(dropped);
        quotaTracker.release(dropped);

        assertEquals(kept.getBytes(), quotaTracker.usage(user.getId()).getReservedStorage());
    }

    @Test
    void releasedBytesNeverDriveConsumptionNegative() {
        quotaTracker.commit(quotaTracker.reserve(user, 250), 250);

        quotaTracker.releaseBytes(user.getId(), 100);
        assertEquals(150, quotaTracker.usage(user.getId()).getUsedStorage());

        quotaTracker.releaseBytes(user.getId(), 10_000);
        assertEquals(0, quotaTracker.usage(user.getId()).getUsedStorage());
    }

    @Test
    void ceilingFollowsTheIdentity() {
        quotaTracker.commit(quotaTracker.reserve(user, 900), 900);
        StorageUser upgraded = StorageUser.builder().id(user.getId()).storageQuota(5000).build();

        quotaTracker.reserve(upgraded, 2000);

        assertEquals(5000, quotaTracker.usage(user.getId()).getStorageQuota());
    }

    @Test
    void usageOfUnknownUserIsNotFound() {
        assertThrows(ItemNotFoundException.class, () -> quotaTracker.usage(UUID.randomUUID()));
    }

    @Test
    void negativeSizesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> quotaTracker.reserve(user, -1));
    }

    @Test
    void concurrentReservationsNeverOvercommit() throws Exception {
        int workers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < workers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        quotaTracker.reserve(user, 150);
                        return true;
                    } catch (StorageFullException e) {
                        return false;
                    }
                }));
            }
            start.countDown();
            int admitted = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    admitted++;
                }
            }

            assertEquals(6, admitted);
            assertEquals(900, quotaTracker.usage(user.getId()).getReservedStorage());
        } finally {
            pool.shutdownNow();
        }
    }
}
