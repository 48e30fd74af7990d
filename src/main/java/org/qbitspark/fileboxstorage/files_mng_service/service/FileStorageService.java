package org.qbitspark.fileboxstorage.files_mng_service.service;

import org.qbitspark.fileboxstorage.files_mng_service.entity.FileEntity;
import org.qbitspark.fileboxstorage.files_mng_service.entity.FileVersionEntity;
import org.qbitspark.fileboxstorage.files_mng_service.payload.DeletionResult;
import org.qbitspark.fileboxstorage.files_mng_service.payload.MultipartUploadTicket;
import org.qbitspark.fileboxstorage.files_mng_service.payload.PruneResult;
import org.qbitspark.fileboxstorage.files_mng_service.payload.SharedDownloadResult;
import org.qbitspark.fileboxstorage.files_mng_service.payload.VersionContent;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.CorruptionException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.DownloadFailedException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.InvalidOperationException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.PermissionDeniedException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ShareExhaustedException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ShareExpiredException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ShareForbiddenException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ShareRevokedException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.StorageFullException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.UploadFailedException;
import org.qbitspark.fileboxstorage.globesecurity.StorageUser;
import org.qbitspark.fileboxstorage.storage_service.payload.UploadedPart;

import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Runs whole storage flows: quota admission, byte transfer and version bookkeeping. A failed upload
 * releases its reservation and removes whatever it staged.
 */
public interface FileStorageService {

    FileVersionEntity uploadVersion(StorageUser user, UUID fileId, InputStream data, long size,
                                    String mimeType, String changeNote)
            throws ItemNotFoundException, PermissionDeniedException, StorageFullException, UploadFailedException;

    MultipartUploadTicket beginMultipartUpload(StorageUser user, UUID fileId, long expectedSize)
            throws ItemNotFoundException, PermissionDeniedException, StorageFullException;

    UploadedPart uploadPart(StorageUser user, String uploadId, int partNumber, InputStream data, long size)
            throws ItemNotFoundException, PermissionDeniedException, UploadFailedException;

    FileVersionEntity completeMultipartUpload(StorageUser user, UUID fileId, String uploadId,
                                              List<UploadedPart> parts, String mimeType, String changeNote)
            throws ItemNotFoundException, PermissionDeniedException, InvalidOperationException, StorageFullException,
            UploadFailedException;

    void abortMultipartUpload(StorageUser user, String uploadId) throws PermissionDeniedException;

    /**
     * @param versionNumber null for the current version
     */
    VersionContent openDownload(StorageUser user, UUID fileId, Integer versionNumber)
            throws ItemNotFoundException, PermissionDeniedException, CorruptionException;

    String getDownloadUrl(StorageUser user, UUID fileId) throws ItemNotFoundException, PermissionDeniedException;

    /**
     * Streams the shared file into {@code out} and counts the download once the copy finished.
     */
    SharedDownloadResult downloadShared(String token, String password, OutputStream out)
            throws ItemNotFoundException, PermissionDeniedException, DownloadFailedException,
            ShareExhaustedException, ShareRevokedException, ShareExpiredException, ShareForbiddenException;

    DeletionResult deletePermanently(StorageUser user, UUID fileId)
            throws ItemNotFoundException, PermissionDeniedException;

    /**
     * Copies a file, or a folder with its active contents, under {@code targetParentId} (null for
     * the root). Only current versions are copied and each copy starts its own history at version 1.
     * The copied bytes are admitted against the quota up front.
     *
     * @param newName null keeps the source name
     */
    FileEntity copyItem(StorageUser user, UUID sourceId, UUID targetParentId, String newName)
            throws ItemNotFoundException, PermissionDeniedException, InvalidOperationException, StorageFullException;

    /**
     * Permanently deletes everything the user trashed more than {@code olderThan} ago. Items that
     * fail to purge are logged and left for a later run.
     */
    DeletionResult cleanupRecycleBin(StorageUser user, Duration olderThan) throws InvalidOperationException;

    PruneResult pruneVersions(StorageUser user, UUID fileId, int keepLast)
            throws ItemNotFoundException, PermissionDeniedException, InvalidOperationException;
}
