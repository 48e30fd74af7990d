package org.qbitspark.fileboxstorage.multipart_service.service;

import org.qbitspark.fileboxstorage.globeadvice.exceptions.InvalidOperationException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.UploadFailedException;
import org.qbitspark.fileboxstorage.multipart_service.payload.CompletedUpload;
import org.qbitspark.fileboxstorage.multipart_service.payload.UploadSessionInfo;
import org.qbitspark.fileboxstorage.quota_service.payload.QuotaReservation;
import org.qbitspark.fileboxstorage.storage_service.payload.UploadedPart;

import java.io.InputStream;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Tracks multipart upload sessions from initiation to completion or abort.
 *
 * <p>A session moves INITIATED, PARTS_UPLOADING, then COMPLETED or ABORTED; the last two are
 * terminal and the session is forgotten once it reaches either.
 */
public interface MultipartCoordinator {

    String initiate(String key);

    /**
     * Starts a session that owns {@code reservation}; aborting the session releases it.
     */
    String initiate(String key, QuotaReservation reservation);

    /**
     * Starts a session bound to {@code fileId} that owns {@code reservation}.
     */
    String initiate(String key, UUID fileId, QuotaReservation reservation);

    /**
     * Parts may arrive in any order and concurrently. Re-uploading a part number replaces it.
     *
     * @throws org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException for an unknown upload id
     */
    UploadedPart uploadPart(String uploadId, int partNumber, InputStream data, long size)
            throws ItemNotFoundException, InvalidOperationException, UploadFailedException;

    /**
     * @param parts the parts to join, numbered 1..N in order, each carrying the etag returned when
     *              it was uploaded. Uploaded parts not listed are discarded.
     * @throws org.qbitspark.fileboxstorage.globeadvice.exceptions.UploadFailedException on gaps,
     *         duplicates, etag mismatches or undersized non-final parts
     */
    CompletedUpload complete(String uploadId, List<UploadedPart> parts)
            throws ItemNotFoundException, InvalidOperationException, UploadFailedException;

    /**
     * Discards the session and its parts. Unknown or finished uploads are ignored.
     */
    void abort(String uploadId);

    Optional<UploadSessionInfo> findSession(String uploadId);

    List<UploadSessionInfo> listStaleSessions();

    /**
     * Aborts every stale session.
     *
     * @return how many sessions were reclaimed
     */
    int reclaimStaleSessions();
}
