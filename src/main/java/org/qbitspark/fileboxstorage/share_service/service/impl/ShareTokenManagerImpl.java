package org.qbitspark.fileboxstorage.share_service.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.fileboxstorage.files_mng_service.entity.FileEntity;
import org.qbitspark.fileboxstorage.files_mng_service.enums.FileLifecycle;
import org.qbitspark.fileboxstorage.files_mng_service.repo.FileRepository;
import org.qbitspark.fileboxstorage.globe_utils.KeyedLocks;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.InvalidOperationException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.PermissionDeniedException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ShareExhaustedException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ShareExpiredException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ShareForbiddenException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ShareRevokedException;
import org.qbitspark.fileboxstorage.share_service.entity.ShareEntity;
import org.qbitspark.fileboxstorage.share_service.payload.IssueShareRequest;
import org.qbitspark.fileboxstorage.share_service.payload.ShareAccessGrant;
import org.qbitspark.fileboxstorage.share_service.payload.UpdateShareRequest;
import org.qbitspark.fileboxstorage.share_service.repo.ShareRepository;
import org.qbitspark.fileboxstorage.share_service.service.ShareTokenManager;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.validation.annotation.Validated;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class ShareTokenManagerImpl implements ShareTokenManager {

    // 24 random bytes encode to exactly 32 URL-safe characters
    private static final int TOKEN_BYTES = 24;
    private static final int MAX_TOKEN_ATTEMPTS = 5;

    private final ShareRepository shareRepository;
    private final FileRepository fileRepository;
    private final PasswordEncoder passwordEncoder;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();
    private final KeyedLocks shareLocks = new KeyedLocks(256);

    @Override
    public ShareEntity issue(IssueShareRequest request)
            throws ItemNotFoundException, PermissionDeniedException, InvalidOperationException {
        Objects.requireNonNull(request.getFileId(), "fileId");
        Objects.requireNonNull(request.getUserId(), "userId");
        Objects.requireNonNull(request.getAccessType(), "accessType");
        if (request.getMaxDownloads() != null && request.getMaxDownloads() < 1) {
            throw new InvalidOperationException("max downloads must be at least 1");
        }

        FileEntity file = fileRepository.findByFileIdAndLifecycle(request.getFileId(), FileLifecycle.ACTIVE)
                .orElseThrow(() -> new ItemNotFoundException("file " + request.getFileId() + " not found"));
        if (!file.getUserId().equals(request.getUserId())) {
            throw new PermissionDeniedException("only the owner can share file " + file.getFileId());
        }

        String passwordHash = hashPassword(request.getPassword());
        LocalDateTime now = LocalDateTime.now(clock);
        ShareEntity share = ShareEntity.builder()
                .fileId(file.getFileId())
                .userId(request.getUserId())
                .shareToken(generateUniqueToken())
                .passwordHash(passwordHash)
                .accessType(request.getAccessType())
                .expiresAt(request.getExpiresAt())
                .maxDownloads(request.getMaxDownloads())
                .downloadCount(0)
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
        ShareEntity saved = shareRepository.save(share);
        file.setShareToken(saved.getShareToken());
        fileRepository.save(file);
        log.info("Issued {} share {} for file {}", saved.getAccessType(), saved.getId(), saved.getFileId());
        return saved;
    }

    @Override
    public ShareAccessGrant validate(String token, String password)
            throws ItemNotFoundException, ShareExhaustedException, ShareRevokedException, ShareExpiredException,
            ShareForbiddenException {
        ShareEntity share = findByToken(token);
        ensureUsable(share, LocalDateTime.now(clock));
        ensurePassword(share, password);
        return ShareAccessGrant.from(share);
    }

    @Override
    public int recordDownload(String token)
            throws ItemNotFoundException, ShareExhaustedException, ShareRevokedException, ShareExpiredException,
            ShareForbiddenException {
        if (token == null || token.isEmpty()) {
            throw new ItemNotFoundException("share not found");
        }
        Integer count = shareLocks.withLock(token, () -> transactionTemplate.execute(status -> {
            ShareEntity share = shareRepository.findByShareTokenForUpdate(token)
                    .orElseThrow(() -> new ItemNotFoundException("share not found"));
            LocalDateTime now = LocalDateTime.now(clock);
            ensureUsable(share, now);
            share.setDownloadCount(share.getDownloadCount() + 1);
            share.setUpdatedAt(now);
            shareRepository.save(share);
            return share.getDownloadCount();
        }));
        log.debug("Share download recorded, count now {}", count);
        return count;
    }

    @Override
    public void revoke(UUID shareId, UUID userId) throws ItemNotFoundException {
        ShareEntity owned = findOwned(shareId, userId);
        shareLocks.runWithLock(owned.getShareToken(), () -> transactionTemplate.executeWithoutResult(status -> {
            ShareEntity share = shareRepository.findByShareTokenForUpdate(owned.getShareToken())
                    .orElseThrow(() -> new ItemNotFoundException("share " + shareId + " not found"));
            share.setActive(false);
            share.setUpdatedAt(LocalDateTime.now(clock));
            shareRepository.save(share);
        }));
        log.info("Revoked share {}", shareId);
    }

    @Override
    public ShareEntity update(UUID shareId, UUID userId, UpdateShareRequest request)
            throws ItemNotFoundException, InvalidOperationException, ShareRevokedException {
        ShareEntity owned = findOwned(shareId, userId);
        if (request.getMaxDownloads() != null && request.getMaxDownloads() < 1) {
            throw new InvalidOperationException("max downloads must be at least 1");
        }
        String newPasswordHash = request.getPassword() != null ? hashPassword(request.getPassword()) : null;
        return shareLocks.withLock(owned.getShareToken(), () -> transactionTemplate.execute(status -> {
            ShareEntity share = shareRepository.findByShareTokenForUpdate(owned.getShareToken())
                    .orElseThrow(() -> new ItemNotFoundException("share " + shareId + " not found"));
            if (!share.isActive()) {
                throw new ShareRevokedException("share " + shareId + " has been revoked");
            }
            if (request.getAccessType() != null) {
                share.setAccessType(request.getAccessType());
            }
            if (request.getPassword() != null) {
                share.setPasswordHash(newPasswordHash);
            }
            if (request.getExpiresAt() != null) {
                share.setExpiresAt(request.getExpiresAt());
            }
            if (request.getMaxDownloads() != null) {
                share.setMaxDownloads(request.getMaxDownloads());
            }
            share.setUpdatedAt(LocalDateTime.now(clock));
            ShareEntity saved = shareRepository.save(share);
            log.info("Updated share {}", shareId);
            return saved;
        }));
    }

    @Override
    public List<ShareEntity> listShares(UUID userId) {
        return shareRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    @Override
    public int deactivateSharesForFile(UUID fileId) {
        List<ShareEntity> shares = shareRepository.findByFileIdAndActiveTrue(fileId);
        for (ShareEntity share : shares) {
            shareLocks.runWithLock(share.getShareToken(), () -> transactionTemplate.executeWithoutResult(status -> {
                shareRepository.findByShareTokenForUpdate(share.getShareToken()).ifPresent(locked -> {
                    locked.setActive(false);
                    locked.setUpdatedAt(LocalDateTime.now(clock));
                    shareRepository.save(locked);
                });
            }));
        }
        if (!shares.isEmpty()) {
            log.info("Deactivated {} share(s) of file {}", shares.size(), fileId);
        }
        return shares.size();
    }

    private void ensureUsable(ShareEntity share, LocalDateTime now) {
        if (share.isExhausted()) {
            throw new ShareExhaustedException("share has reached its download limit of " + share.getMaxDownloads());
        }
        if (!share.isActive()) {
            throw new ShareRevokedException("share has been revoked");
        }
        if (share.isExpired(now)) {
            throw new ShareExpiredException("share expired at " + share.getExpiresAt());
        }
    }

    private void ensurePassword(ShareEntity share, String password) {
        if (!share.hasPassword()) {
            return;
        }
        if (password == null || password.isEmpty()) {
            throw new ShareForbiddenException("share requires a password");
        }
        if (!passwordEncoder.matches(password, share.getPasswordHash())) {
            throw new ShareForbiddenException("incorrect share password");
        }
    }

    private String hashPassword(String password) {
        if (password == null || password.isEmpty()) {
            return null;
        }
        return passwordEncoder.encode(password);
    }

    private String generateUniqueToken() {
        for (int attempt = 1; attempt <= MAX_TOKEN_ATTEMPTS; attempt++) {
            String token = newToken();
            if (!shareRepository.existsByShareToken(token)) {
                return token;
            }
            log.warn("Share token collision on attempt {}, regenerating", attempt);
        }
        throw new IllegalStateException("could not generate a unique share token after "
                + MAX_TOKEN_ATTEMPTS + " attempts");
    }

    String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private ShareEntity findByToken(String token) {
        if (token == null || token.isEmpty()) {
            throw new ItemNotFoundException("share not found");
        }
        return shareRepository.findByShareToken(token)
                .orElseThrow(() -> new ItemNotFoundException("share not found"));
    }

    private ShareEntity findOwned(UUID shareId, UUID userId) {
        return shareRepository.findByIdAndUserId(shareId, userId)
                .orElseThrow(() -> new ItemNotFoundException("share " + shareId + " not found"));
    }
}
