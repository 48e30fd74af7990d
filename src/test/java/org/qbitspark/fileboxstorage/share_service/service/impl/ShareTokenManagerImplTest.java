package org.qbitspark.fileboxstorage.share_service.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.qbitspark.fileboxstorage.files_mng_service.entity.FileEntity;
import org.qbitspark.fileboxstorage.files_mng_service.enums.FileKind;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.PermissionDeniedException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ShareExhaustedException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ShareExpiredException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ShareForbiddenException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ShareRevokedException;
import org.qbitspark.fileboxstorage.share_service.entity.ShareEntity;
import org.qbitspark.fileboxstorage.share_service.enums.ShareAccessType;
import org.qbitspark.fileboxstorage.share_service.payload.IssueShareRequest;
import org.qbitspark.fileboxstorage.share_service.payload.ShareAccessGrant;
import org.qbitspark.fileboxstorage.share_service.payload.UpdateShareRequest;
import org.qbitspark.fileboxstorage.support.InMemoryRepositories;
import org.qbitspark.fileboxstorage.support.MutableClock;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

class ShareTokenManagerImplTest {

    private InMemoryRepositories store;
    private MutableClock clock;
    private ShareTokenManagerImpl shareTokenManager;
    private UUID ownerId;
    private FileEntity file;

    @BeforeEach
    void setUp() {
        store = new InMemoryRepositories();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        shareTokenManager = new ShareTokenManagerImpl(store.shareRepository(), store.fileRepository(),
                new BCryptPasswordEncoder(4), InMemoryRepositories.transactionTemplate(), clock);
        ownerId = UUID.randomUUID();
        file = store.addFile(ownerId, null, "report.pdf", FileKind.FILE);
    }

    @Test
    void issuedTokensAreThirtyTwoUrlSafeCharacters() {
        ShareEntity share = shareTokenManager.issue(request(ShareAccessType.DOWNLOAD).build());

        assertEquals(32, share.getShareToken().length());
        assertTrue(share.getShareToken().matches("[A-Za-z0-9_-]{32}"));
        assertEquals(share.getShareToken(), file.getShareToken());
        assertTrue(share.isActive());
        assertEquals(0, share.getDownloadCount());
    }

    @Test
    void tokenCollisionIsRegenerated() {
        String taken = "a".repeat(32);
        String fresh = "b".repeat(32);
        store.shares.put(UUID.randomUUID(), ShareEntity.builder()
                .fileId(file.getFileId())
                .userId(ownerId)
                .shareToken(taken)
                .accessType(ShareAccessType.VIEW)
                .createdAt(LocalDateTime.now(clock))
                .updatedAt(LocalDateTime.now(clock))
                .build());
        ShareTokenManagerImpl colliding = spy(shareTokenManager);
        doReturn(taken, fresh).when(colliding).newToken();

        ShareEntity share = colliding.issue(request(ShareAccessType.VIEW).build());

        assertEquals(fresh, share.getShareToken());
    }

    @Test
    void passwordsAreStoredHashed() {
        ShareEntity share = shareTokenManager.issue(request(ShareAccessType.DOWNLOAD).password("s3cret").build());

        assertNotEquals("s3cret", share.getPasswordHash());
        assertTrue(share.getPasswordHash().startsWith("$2"));
    }

    @Test
    void onlyTheOwnerCanShare() {
        IssueShareRequest foreign = request(ShareAccessType.VIEW).userId(UUID.randomUUID()).build();

        assertThrows(PermissionDeniedException.class, () -> shareTokenManager.issue(foreign));
    }

    @Test
    void deletedFilesCannotBeShared() {
        file.tombstone(LocalDateTime.now(clock));

        assertThrows(ItemNotFoundException.class, () -> shareTokenManager.issue(request(ShareAccessType.VIEW).build()));
    }

    @Test
    void validShareGrantsItsAccessType() {
        ShareEntity share = shareTokenManager.issue(request(ShareAccessType.VIEW).build());

        ShareAccessGrant grant = shareTokenManager.validate(share.getShareToken(), null);

        assertEquals(file.getFileId(), grant.getFileId());
        assertFalse(grant.canDownload());
    }

    @Test
    void unknownTokenIsNotFound() {
        assertThrows(ItemNotFoundException.class, () -> shareTokenManager.validate("nope", null));
        assertThrows(ItemNotFoundException.class, () -> shareTokenManager.validate("", null));
    }

    @Test
    void expiredShareIsRejected() {
        ShareEntity share = shareTokenManager.issue(request(ShareAccessType.DOWNLOAD)
                .expiresAt(LocalDateTime.now(clock).plusHours(1))
                .build());
        clock.advance(Duration.ofHours(2));

        assertThrows(ShareExpiredException.class, () -> shareTokenManager.validate(share.getShareToken(), null));
    }

    @Test
    void shareIssuedAlreadyExpiredIsRejected() {
        ShareEntity share = shareTokenManager.issue(request(ShareAccessType.DOWNLOAD)
                .expiresAt(LocalDateTime.now(clock).minusMinutes(1))
                .build());

        assertThrows(ShareExpiredException.class, () -> shareTokenManager.validate(share.getShareToken(), null));
    }

    @Test
    void revokedShareIsRejected() {
        ShareEntity share = shareTokenManager.issue(request(ShareAccessType.DOWNLOAD).build());

        shareTokenManager.revoke(share.getId(), ownerId);

        assertThrows(ShareRevokedException.class, () -> shareTokenManager.validate(share.getShareToken(), null));
    }

    @Test
    void exhaustionIsReportedBeforeRevocationAndExpiry() {
        ShareEntity share = shareTokenManager.issue(request(ShareAccessType.DOWNLOAD)
                .maxDownloads(1)
                .expiresAt(LocalDateTime.now(clock).plusMinutes(5))
                .build());
        shareTokenManager.recordDownload(share.getShareToken());
        shareTokenManager.revoke(share.getId(), ownerId);
        clock.advance(Duration.ofHours(1));

        assertThrows(ShareExhaustedException.class, () -> shareTokenManager.validate(share.getShareToken(), null));
    }

    @Test
    void revocationIsReportedBeforeExpiry() {
        ShareEntity share = shareTokenManager.issue(request(ShareAccessType.DOWNLOAD)
                .expiresAt(LocalDateTime.now(clock).plusMinutes(5))
                .build());
        shareTokenManager.revoke(share.getId(), ownerId);
        clock.advance(Duration.ofHours(1));

        assertThrows(ShareRevokedException.class, () -> shareTokenManager.validate(share.getShareToken(), null));
    }

    @Test
    void passwordProtectedShareNeedsTheRightPassword() {
        ShareEntity share = shareTokenManager.issue(request(ShareAccessType.DOWNLOAD).password("s3cret").build());
        String token = share.getShareToken();

        assertThrows(ShareForbiddenException.class, () -> shareTokenManager.validate(token, null));
        assertThrows(ShareForbiddenException.class, () -> shareTokenManager.validate(token, "guess"));
        assertTrue(shareTokenManager.validate(token, "s3cret").canDownload());
    }

    @Test
    void concurrentDownloadsNeverExceedTheLimit() throws Exception {
        int limit = 3;
        int clients = 12;
        String token = shareTokenManager.issue(request(ShareAccessType.DOWNLOAD).maxDownloads(limit).build())
                .getShareToken();
        ExecutorService pool = Executors.newFixedThreadPool(clients);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < clients; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        shareTokenManager.recordDownload(token);
                        return true;
                    } catch (ShareExhaustedException e) {
                        return false;
                    }
                }));
            }
            start.countDown();
            int succeeded = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    succeeded++;
                }
            }

            assertEquals(limit, succeeded);
            assertThrows(ShareExhaustedException.class, () -> shareTokenManager.validate(token, null));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void updateChangesOnlyTheGivenFields() {
        ShareEntity share = shareTokenManager.issue(request(ShareAccessType.VIEW).password("old").build());

        ShareEntity updated = shareTokenManager.update(share.getId(), ownerId,
                UpdateShareRequest.builder().accessType(ShareAccessType.DOWNLOAD).password("").build());

        assertEquals(ShareAccessType.DOWNLOAD, updated.getAccessType());
        assertNull(updated.getPasswordHash());
        assertTrue(shareTokenManager.validate(share.getShareToken(), null).canDownload());
    }

    @Test
    void revokedShareCannotBeUpdated() {
        ShareEntity share = shareTokenManager.issue(request(ShareAccessType.VIEW).build());
        shareTokenManager.revoke(share.getId(), ownerId);

        assertThrows(ShareRevokedException.class, () -> shareTokenManager.update(share.getId(), ownerId,
                UpdateShareRequest.builder().maxDownloads(5).build()));
    }

    @Test
    void sharesOfAnotherUserCannotBeRevoked() {
        ShareEntity share = shareTokenManager.issue(request(ShareAccessType.VIEW).build());

        assertThrows(ItemNotFoundException.class, () -> shareTokenManager.revoke(share.getId(), UUID.randomUUID()));
    }

    @Test
    void deactivatingAFileRevokesEveryActiveShare() {
        ShareEntity first = shareTokenManager.issue(request(ShareAccessType.VIEW).build());
        ShareEntity second = shareTokenManager.issue(request(ShareAccessType.DOWNLOAD).build());

        assertEquals(2, shareTokenManager.deactivateSharesForFile(file.getFileId()));

        assertThrows(ShareRevokedException.class, () -> shareTokenManager.validate(first.getShareToken(), null));
        assertThrows(ShareRevokedException.class, () -> shareTokenManager.validate(second.getShareToken(), null));
        assertEquals(2, shareTokenManager.listShares(ownerId).size());
    }

    private IssueShareRequest.IssueShareRequestBuilder request(ShareAccessType accessType) {
        return IssueShareRequest.builder()
                .fileId(file.getFileId())
                .userId(ownerId)
                .accessType(accessType);
    }
}
