package org.qbitspark.fileboxstorage.storage_service.service.impl;

import io.minio.BucketExistsArgs;
import io.minio.ComposeObjectArgs;
import io.minio.ComposeSource;
import io.minio.CopyObjectArgs;
import io.minio.CopySource;
import io.minio.GetObjectArgs;
import io.minio.GetPresignedObjectUrlArgs;
import io.minio.ListObjectsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.ObjectWriteResponse;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.RemoveObjectsArgs;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.StatObjectResponse;
import io.minio.errors.ErrorResponseException;
import io.minio.errors.ServerException;
import io.minio.http.Method;
import io.minio.messages.DeleteError;
import io.minio.messages.DeleteObject;
import io.minio.messages.Item;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.fileboxstorage.globe_utils.Digests;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.DeleteFailedException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.InvalidStorageKeyException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.OperationCancelledException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.StorageErrorCode;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.StorageException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.UploadFailedException;
import org.qbitspark.fileboxstorage.storage_service.config.StorageProperties;
import org.qbitspark.fileboxstorage.storage_service.enums.StorageBackendType;
import org.qbitspark.fileboxstorage.storage_service.payload.StorageObjectInfo;
import org.qbitspark.fileboxstorage.storage_service.payload.UploadedPart;
import org.qbitspark.fileboxstorage.storage_service.service.StorageBackend;
import org.qbitspark.fileboxstorage.storage_service.utils.CancellableInputStream;
import org.qbitspark.fileboxstorage.storage_service.utils.StorageFailures;
import org.qbitspark.fileboxstorage.storage_service.utils.StorageKeys;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * S3 and MinIO backend over the MinIO Java SDK, bound to one bucket.
 *
 * <p>Multipart parts are staged as ordinary objects under {@code .multipart/<uploadId>/} and
 * joined server side with {@code composeObject}, which applies the same 5 MiB minimum part size
 * as native S3 multipart uploads.
 */
@Slf4j
public class ObjectStoreStorageBackend implements StorageBackend {

    static final String MULTIPART_PREFIX = StorageKeys.MULTIPART_NAMESPACE + "/";
    static final long MINIMUM_PART_SIZE = 5L * 1024 * 1024;
    private static final long UNKNOWN_SIZE_PART = 10L * 1024 * 1024;
    private static final Set<String> NOT_FOUND_CODES = Set.of("NoSuchKey", "NoSuchObject", "NotFound");
    private static final Set<String> TRANSIENT_CODES = Set.of("SlowDown", "InternalError", "ServiceUnavailable", "RequestTimeout");

    private final StorageBackendType type;
    private final MinioClient minioClient;
    private final String bucket;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration presignExpiry;

    public ObjectStoreStorageBackend(StorageBackendType type, MinioClient minioClient, StorageProperties properties) {
        this.type = type;
        this.minioClient = minioClient;
        this.bucket = properties.getObjectStore().getBucket();
        this.maxAttempts = Math.max(1, properties.getRetry().getMaxAttempts());
        this.initialBackoff = properties.getRetry().getInitialBackoff();
        this.presignExpiry = properties.getObjectStore().getPresignExpiry();
        ensureBucket();
    }

    private void ensureBucket() {
        try {
            boolean exists = minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build());
            if (!exists) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
                log.info("Created bucket: {}", bucket);
            }
        } catch (Exception e) {
            log.error("Error preparing bucket {}", bucket, e);
            throw StorageFailures.translate(StorageErrorCode.UPLOAD_FAILED, "ensureBucket", bucket, e);
        }
    }

    @Override
    public void save(String key, InputStream data, long size) {
        StorageKeys.requireCallerKey(key, "save");
        putObject("save", key, CancellableInputStream.of(data), size);
        log.info("Uploaded object {} to bucket {}", key, bucket);
    }

    @Override
    public InputStream get(String key) {
        StorageKeys.requireCallerKey(key, "get");
        InputStream stream = withRetry("get", key, StorageErrorCode.DOWNLOAD_FAILED, () ->
                minioClient.getObject(GetObjectArgs.builder()
                        .bucket(bucket)
                        .object(key)
                        .build()));
        return CancellableInputStream.of(stream);
    }

    @Override
    public void delete(String key) {
        StorageKeys.requireCallerKey(key, "delete");
        withRetry("delete", key, StorageErrorCode.DELETE_FAILED, () -> {
            minioClient.removeObject(RemoveObjectArgs.builder()
                    .bucket(bucket)
                    .object(key)
                    .build());
            return null;
        });
        log.debug("Deleted object {}", key);
    }

    @Override
    public boolean exists(String key) {
        StorageKeys.requireCallerKey(key, "exists");
        try {
            statObject("exists", key);
            return true;
        } catch (ItemNotFoundException e) {
            return false;
        }
    }

    @Override
    public StorageObjectInfo stat(String key) {
        StorageKeys.requireCallerKey(key, "stat");
        StatObjectResponse stat = statObject("stat", key);
        return StorageObjectInfo.builder()
                .key(key)
                .size(stat.size())
                .lastModified(stat.lastModified() != null ? stat.lastModified().toInstant() : null)
                .mimeType(stat.contentType())
                .etag(Digests.normalizeEtag(stat.etag()))
                .build();
    }

    @Override
    public void copy(String sourceKey, String destinationKey) {
        StorageKeys.requireCallerKey(sourceKey, "copy");
        StorageKeys.requireCallerKey(destinationKey, "copy");
        copyObject(sourceKey, destinationKey);
        log.debug("Copied {} to {}", sourceKey, destinationKey);
    }

    /**
     * Copy then delete. If the source cannot be removed and the destination did not exist before,
     * the copy is rolled back so the object does not end up under both keys. An object that was
     * already at the destination has been overwritten by then and is left in place.
     */
    @Override
    public void move(String sourceKey, String destinationKey) {
        StorageKeys.requireCallerKey(sourceKey, "move");
        StorageKeys.requireCallerKey(destinationKey, "move");
        boolean destinationExisted = exists(destinationKey);
        copyObject(sourceKey, destinationKey);
        try {
            delete(sourceKey);
        } catch (StorageException e) {
            if (destinationExisted) {
                log.error("Move of {} to {} failed while removing the source; destination was replaced, not rolled back",
                        sourceKey, destinationKey, e);
                throw e;
            }
            log.error("Move of {} to {} failed while removing the source, rolling back", sourceKey, destinationKey, e);
            try {
                delete(destinationKey);
            } catch (StorageException rollback) {
                e.addSuppressed(rollback);
            }
            throw e;
        }
        log.debug("Moved {} to {}", sourceKey, destinationKey);
    }

    @Override
    public List<StorageObjectInfo> list(String prefix) {
        boolean atRoot = prefix == null || prefix.isEmpty();
        if (!atRoot) {
            StorageKeys.requireCallerKey(prefix, "list");
        }
        String listPrefix = atRoot ? "" : prefix + "/";
        return withRetry("list", prefix, StorageErrorCode.DOWNLOAD_FAILED, () -> {
            List<StorageObjectInfo> entries = new ArrayList<>();
            Iterable<Result<Item>> results = minioClient.listObjects(ListObjectsArgs.builder()
                    .bucket(bucket)
                    .prefix(listPrefix)
                    .recursive(false)
                    .build());
            for (Result<Item> result : results) {
                Item item = result.get();
                String name = item.objectName();
                if (name.equals(listPrefix) || (atRoot && name.startsWith(MULTIPART_PREFIX))) {
                    continue;
                }
                entries.add(describe(name, item));
            }
            return entries;
        });
    }

    @Override
    public void createDir(String path) {
        StorageKeys.requireCallerKey(path, "createDir");
        putObject("createDir", path + "/", new ByteArrayInputStream(new byte[0]), 0);
        log.debug("Created directory marker {}", path);
    }

    @Override
    public void deleteDir(String path) {
        StorageKeys.requireCallerKey(path, "deleteDir");
        removePrefix("deleteDir", path + "/");
        log.info("Deleted directory {}", path);
    }

    /**
     * Parts are plain objects, so there is no remote session to open.
     */
    @Override
    public String initiateMultipartUpload(String key) {
        StorageKeys.requireCallerKey(key, "initiateMultipartUpload");
        String uploadId = UUID.randomUUID().toString();
        log.info("Initiated multipart upload {} for {}", uploadId, key);
        return uploadId;
    }

    @Override
    public UploadedPart uploadPart(String key, String uploadId, int partNumber, InputStream data, long size) {
        StorageKeys.requireCallerKey(key, "uploadPart");
        if (size < 0) {
            throw new UploadFailedException("part size must be known", "uploadPart", key, null);
        }
        ObjectWriteResponse response = putObject("uploadPart", partKey(uploadId, partNumber),
                CancellableInputStream.of(data), size);
        log.debug("Stored part {} of upload {} ({} bytes)", partNumber, uploadId, size);
        return new UploadedPart(partNumber, Digests.normalizeEtag(response.etag()), size);
    }

    @Override
    public void completeMultipartUpload(String key, String uploadId, List<UploadedPart> parts) {
        StorageKeys.requireCallerKey(key, "completeMultipartUpload");
        List<ComposeSource> sources = new ArrayList<>();
        for (UploadedPart part : parts) {
            sources.add(ComposeSource.builder()
                    .bucket(bucket)
                    .object(partKey(uploadId, part.getPartNumber()))
                    .matchETag(part.getEtag())
                    .build());
        }
        try {
            minioClient.composeObject(ComposeObjectArgs.builder()
                    .bucket(bucket)
                    .object(key)
                    .sources(sources)
                    .build());
        } catch (Exception e) {
            log.error("Error completing multipart upload {} into {}", uploadId, key, e);
            throw StorageFailures.translate(StorageErrorCode.UPLOAD_FAILED, "completeMultipartUpload", key, e);
        }
        removePrefix("completeMultipartUpload", uploadPrefix(uploadId));
        log.info("Completed multipart upload {} into {} ({} parts)", uploadId, key, parts.size());
    }

    @Override
    public void abortMultipartUpload(String key, String uploadId) {
        removePrefix("abortMultipartUpload", uploadPrefix(uploadId));
        log.info("Aborted multipart upload {} for {}", uploadId, key);
    }

    @Override
    public String getUrl(String key) {
        StorageKeys.requireCallerKey(key, "getUrl");
        return presign("getUrl", key, Map.of());
    }

    @Override
    public String getDownloadUrl(String key, String filename) {
        StorageKeys.requireCallerKey(key, "getDownloadUrl");
        String safeName = StorageKeys.baseName(filename).replace("\"", "");
        return presign("getDownloadUrl", key,
                Map.of("response-content-disposition", "attachment; filename=\"" + safeName + "\""));
    }

    @Override
    public long minimumPartSize() {
        return MINIMUM_PART_SIZE;
    }

    @Override
    public StorageBackendType type() {
        return type;
    }

    private ObjectWriteResponse putObject(String operation, String objectKey, InputStream data, long size) {
        try {
            return minioClient.putObject(PutObjectArgs.builder()
                    .bucket(bucket)
                    .object(objectKey)
                    .stream(data, size, size < 0 ? UNKNOWN_SIZE_PART : -1)
                    .contentType(StorageKeys.mimeTypeOf(objectKey))
                    .build());
        } catch (Exception e) {
            log.error("Error writing object {} during {}", objectKey, operation, e);
            throw StorageFailures.translate(StorageErrorCode.UPLOAD_FAILED, operation, objectKey, e);
        }
    }

    private StatObjectResponse statObject(String operation, String key) {
        return withRetry(operation, key, StorageErrorCode.DOWNLOAD_FAILED, () ->
                minioClient.statObject(StatObjectArgs.builder()
                        .bucket(bucket)
                        .object(key)
                        .build()));
    }

    private void copyObject(String sourceKey, String destinationKey) {
        withRetry("copy", sourceKey, StorageErrorCode.UPLOAD_FAILED, () ->
                minioClient.copyObject(CopyObjectArgs.builder()
                        .bucket(bucket)
                        .object(destinationKey)
                        .source(CopySource.builder()
                                .bucket(bucket)
                                .object(sourceKey)
                                .build())
                        .build()));
    }

    private void removePrefix(String operation, String prefix) {
        withRetry(operation, prefix, StorageErrorCode.DELETE_FAILED, () -> {
            List<DeleteObject> objectsToDelete = new ArrayList<>();
            for (Result<Item> result : minioClient.listObjects(ListObjectsArgs.builder()
                    .bucket(bucket)
                    .prefix(prefix)
                    .recursive(true)
                    .build())) {
                objectsToDelete.add(new DeleteObject(result.get().objectName()));
            }
            if (objectsToDelete.isEmpty()) {
                return null;
            }
            Iterable<Result<DeleteError>> errors = minioClient.removeObjects(RemoveObjectsArgs.builder()
                    .bucket(bucket)
                    .objects(objectsToDelete)
                    .build());
            for (Result<DeleteError> error : errors) {
                DeleteError deleteError = error.get();
                throw new DeleteFailedException("could not delete " + deleteError.objectName() + ": "
                        + deleteError.message(), operation, prefix, null);
            }
            return null;
        });
    }

    private String presign(String operation, String key, Map<String, String> extraQueryParams) {
        try {
            return minioClient.getPresignedObjectUrl(GetPresignedObjectUrlArgs.builder()
                    .method(Method.GET)
                    .bucket(bucket)
                    .object(key)
                    .expiry((int) presignExpiry.toSeconds())
                    .extraQueryParams(extraQueryParams)
                    .build());
        } catch (Exception e) {
            log.error("Error generating presigned URL for {}", key, e);
            throw StorageFailures.translate(StorageErrorCode.DOWNLOAD_FAILED, operation, key, e);
        }
    }

    private StorageObjectInfo describe(String name, Item item) {
        if (item.isDir()) {
            String dirKey = name.endsWith("/") ? name.substring(0, name.length() - 1) : name;
            return StorageObjectInfo.builder()
                    .key(dirKey)
                    .directory(true)
                    .build();
        }
        Instant lastModified = item.lastModified() != null ? item.lastModified().toInstant() : null;
        return StorageObjectInfo.builder()
                .key(name)
                .size(item.size())
                .lastModified(lastModified)
                .mimeType(StorageKeys.mimeTypeOf(name))
                .etag(Digests.normalizeEtag(item.etag()))
                .build();
    }

    /**
     * Runs an idempotent call, retrying transport and 5xx failures with exponential backoff.
     * Missing objects surface immediately as {@link ItemNotFoundException}.
     */
    private <T> T withRetry(String operation, String key, StorageErrorCode failure, ObjectStoreCall<T> call) {
        long backoffMillis = initialBackoff.toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                return call.execute();
            } catch (StorageException e) {
                throw e;
            } catch (Exception e) {
                if (isNotFound(e)) {
                    throw new ItemNotFoundException("object not found", operation, key, e);
                }
                if (attempt >= maxAttempts || !isTransient(e)) {
                    log.error("Object store {} failed for {} after {} attempt(s)", operation, key, attempt, e);
                    throw StorageFailures.translate(failure, operation, key, e);
                }
                log.warn("Transient failure during {} of {} (attempt {}/{}): {}",
                        operation, key, attempt, maxAttempts, e.getMessage());
                pause(backoffMillis, operation, key);
                backoffMillis *= 2;
            }
        }
    }

    private void pause(long millis, String operation, String key) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("interrupted while waiting to retry", operation, key, e);
        }
    }

    static boolean isNotFound(Exception e) {
        return e instanceof ErrorResponseException
                && NOT_FOUND_CODES.contains(((ErrorResponseException) e).errorResponse().code());
    }

    private static boolean isTransient(Exception e) {
        if (StorageFailures.isCancellation(e)) {
            return false;
        }
        if (e instanceof ErrorResponseException) {
            return TRANSIENT_CODES.contains(((ErrorResponseException) e).errorResponse().code());
        }
        return e instanceof IOException || e instanceof ServerException;
    }

    private static String uploadPrefix(String uploadId) {
        if (uploadId == null || uploadId.contains("/") || !StorageKeys.isSafe(uploadId)) {
            throw new InvalidStorageKeyException("invalid upload id", "multipart", uploadId, null);
        }
        return MULTIPART_PREFIX + uploadId + "/";
    }

    private static String partKey(String uploadId, int partNumber) {
        return uploadPrefix(uploadId) + "part-" + partNumber;
    }

    @FunctionalInterface
    private interface ObjectStoreCall<T> {
        T execute() throws Exception;
    }
}
