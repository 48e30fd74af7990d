package org.qbitspark.fileboxstorage.storage_service.service;

import org.qbitspark.fileboxstorage.storage_service.enums.StorageBackendType;
import org.qbitspark.fileboxstorage.storage_service.payload.StorageObjectInfo;
import org.qbitspark.fileboxstorage.storage_service.payload.UploadedPart;

import java.io.InputStream;
import java.util.List;

/**
 * Uniform key/blob contract over local disk and S3-compatible object stores.
 *
 * <p>Every method validates its keys before touching storage and fails with
 * {@link org.qbitspark.fileboxstorage.globeadvice.exceptions.InvalidStorageKeyException} on an
 * unsafe key. Streams are copied in bounded chunks; callers own the streams they pass in and must
 * close the streams they get back.
 */
public interface StorageBackend {

    /**
     * Writes {@code size} bytes under {@code key}, replacing any existing object. A negative size
     * means the length is unknown.
     */
    void save(String key, InputStream data, long size);

    /**
     * @throws org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException if nothing is stored under the key
     */
    InputStream get(String key);

    /**
     * Removes the object. Deleting a missing key succeeds.
     */
    void delete(String key);

    boolean exists(String key);

    StorageObjectInfo stat(String key);

    void copy(String sourceKey, String destinationKey);

    void move(String sourceKey, String destinationKey);

    /**
     * Lists the immediate children of {@code prefix}; deeper prefixes come back as directories.
     * An empty prefix lists the root.
     */
    List<StorageObjectInfo> list(String prefix);

    void createDir(String path);

    void deleteDir(String path);

    /**
     * @return an opaque upload id, unique per call
     */
    String initiateMultipartUpload(String key);

    /**
     * Stores one part. Uploading the same part number again replaces the earlier part.
     */
    UploadedPart uploadPart(String key, String uploadId, int partNumber, InputStream data, long size);

    /**
     * Joins the listed parts, in list order, into the object at {@code key} and discards every
     * staged part of the upload.
     */
    void completeMultipartUpload(String key, String uploadId, List<UploadedPart> parts);

    void abortMultipartUpload(String key, String uploadId);

    String getUrl(String key);

    String getDownloadUrl(String key, String filename);

    /**
     * Smallest size, in bytes, every part but the last must reach.
     */
    long minimumPartSize();

    StorageBackendType type();
}
