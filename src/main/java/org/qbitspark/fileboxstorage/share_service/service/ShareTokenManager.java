package org.qbitspark.fileboxstorage.share_service.service;

import jakarta.validation.Valid;
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

import java.util.List;
import java.util.UUID;

/**
 * Issues share tokens and decides whether a presented token grants access.
 *
 * <p>Validation reports the first failing condition in this order: unknown token, exhausted,
 * revoked, expired, wrong or missing password.
 */
public interface ShareTokenManager {

    ShareEntity issue(@Valid IssueShareRequest request)
            throws ItemNotFoundException, PermissionDeniedException, InvalidOperationException;

    ShareAccessGrant validate(String token, String password)
            throws ItemNotFoundException, ShareExhaustedException, ShareRevokedException, ShareExpiredException,
            ShareForbiddenException;

    /**
     * Counts one download against the share. Never lets more than {@code maxDownloads} succeed.
     *
     * @return the download count after this download
     */
    int recordDownload(String token)
            throws ItemNotFoundException, ShareExhaustedException, ShareRevokedException, ShareExpiredException,
            ShareForbiddenException;

    void revoke(UUID shareId, UUID userId) throws ItemNotFoundException;

    ShareEntity update(UUID shareId, UUID userId, @Valid UpdateShareRequest request)
            throws ItemNotFoundException, InvalidOperationException, ShareRevokedException;

    List<ShareEntity> listShares(UUID userId);

    /**
     * @return how many shares were deactivated
     */
    int deactivateSharesForFile(UUID fileId);
}
