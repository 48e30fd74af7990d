package org.qbitspark.fileboxstorage.storage_service.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.qbitspark.fileboxstorage.globe_utils.Digests;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.DeleteFailedException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.InvalidStorageKeyException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.StorageErrorCode;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.UploadFailedException;
import org.qbitspark.fileboxstorage.storage_service.enums.StorageBackendType;
import org.qbitspark.fileboxstorage.storage_service.payload.StorageObjectInfo;
import org.qbitspark.fileboxstorage.storage_service.payload.UploadedPart;
import org.qbitspark.fileboxstorage.storage_service.service.StorageBackend;
import org.qbitspark.fileboxstorage.storage_service.utils.CancellableInputStream;
import org.qbitspark.fileboxstorage.storage_service.utils.StorageFailures;
import org.qbitspark.fileboxstorage.storage_service.utils.StorageKeys;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Stores objects as files under a root directory. Every write lands in {@code .staging} first and
 * is renamed into place atomically, so readers never observe a half-written object.
 */
@Slf4j
public class LocalStorageBackend implements StorageBackend {

    static final String STAGING_DIR = StorageKeys.STAGING_NAMESPACE;
    static final String MULTIPART_DIR = StorageKeys.MULTIPART_NAMESPACE;
    private static final Set<String> RESERVED_DIRS = Set.of(STAGING_DIR, MULTIPART_DIR);
    private static final int BUFFER_SIZE = 64 * 1024;

    private final Path root;
    private final long minimumPartSize;

    public LocalStorageBackend(Path root, long minimumPartSize) {
        this.root = root.toAbsolutePath().normalize();
        this.minimumPartSize = minimumPartSize;
        try {
            Files.createDirectories(this.root.resolve(STAGING_DIR));
            Files.createDirectories(this.root.resolve(MULTIPART_DIR));
        } catch (IOException e) {
            log.error("Failed to prepare storage root {}", this.root, e);
            throw new UploadFailedException("cannot prepare storage root", "init", this.root.toString(), e);
        }
        log.info("Local storage backend rooted at {}", this.root);
    }

    @Override
    public void save(String key, InputStream data, long size) {
        Path target = resolve(key, "save");
        Path staging = newStagingFile();
        try {
            Files.createDirectories(target.getParent());
            long written = writeStaged(staging, CancellableInputStream.of(data));
            if (size >= 0 && written != size) {
                throw new UploadFailedException("size mismatch: expected " + size + " bytes, received " + written,
                        "save", key, null);
            }
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Saved {} ({} bytes)", key, written);
        } catch (IOException e) {
            log.error("Error saving object {}", key, e);
            throw StorageFailures.translate(StorageErrorCode.UPLOAD_FAILED, "save", key, e);
        } finally {
            discardStaging(staging);
        }
    }

    @Override
    public InputStream get(String key) {
        Path path = resolve(key, "get");
        if (!Files.isRegularFile(path)) {
            throw new ItemNotFoundException("object not found", "get", key, null);
        }
        try {
            return CancellableInputStream.of(Files.newInputStream(path));
        } catch (NoSuchFileException e) {
            throw new ItemNotFoundException("object not found", "get", key, e);
        } catch (IOException e) {
            log.error("Error opening object {}", key, e);
            throw StorageFailures.translate(StorageErrorCode.DOWNLOAD_FAILED, "get", key, e);
        }
    }

    @Override
    public void delete(String key) {
        Path path = resolve(key, "delete");
        try {
            if (Files.isDirectory(path)) {
                throw new DeleteFailedException("key names a directory, use deleteDir", "delete", key, null);
            }
            if (Files.deleteIfExists(path)) {
                log.debug("Deleted {}", key);
                pruneEmptyParents(path.getParent());
            }
        } catch (IOException e) {
            log.error("Error deleting object {}", key, e);
            throw StorageFailures.translate(StorageErrorCode.DELETE_FAILED, "delete", key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        return Files.exists(resolve(key, "exists"));
    }

    @Override
    public StorageObjectInfo stat(String key) {
        Path path = resolve(key, "stat");
        try {
            return describe(key, path);
        } catch (NoSuchFileException e) {
            throw new ItemNotFoundException("object not found", "stat", key, e);
        } catch (IOException e) {
            log.error("Error reading attributes of {}", key, e);
            throw StorageFailures.translate(StorageErrorCode.DOWNLOAD_FAILED, "stat", key, e);
        }
    }

    @Override
    public void copy(String sourceKey, String destinationKey) {
        Path source = resolve(sourceKey, "copy");
        Path target = resolve(destinationKey, "copy");
        if (!Files.isRegularFile(source)) {
            throw new ItemNotFoundException("source object not found", "copy", sourceKey, null);
        }
        Path staging = newStagingFile();
        try {
            Files.createDirectories(target.getParent());
            Files.copy(source, staging, StandardCopyOption.REPLACE_EXISTING);
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Copied {} to {}", sourceKey, destinationKey);
        } catch (NoSuchFileException e) {
            throw new ItemNotFoundException("source object not found", "copy", sourceKey, e);
        } catch (IOException e) {
            log.error("Error copying {} to {}", sourceKey, destinationKey, e);
            throw StorageFailures.translate(StorageErrorCode.UPLOAD_FAILED, "copy", destinationKey, e);
        } finally {
            discardStaging(staging);
        }
    }

    @Override
    public void move(String sourceKey, String destinationKey) {
        Path source = resolve(sourceKey, "move");
        Path target = resolve(destinationKey, "move");
        if (!Files.isRegularFile(source)) {
            throw new ItemNotFoundException("source object not found", "move", sourceKey, null);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Moved {} to {}", sourceKey, destinationKey);
            pruneEmptyParents(source.getParent());
        } catch (NoSuchFileException e) {
            throw new ItemNotFoundException("source object not found", "move", sourceKey, e);
        } catch (IOException e) {
            log.error("Error moving {} to {}", sourceKey, destinationKey, e);
            throw StorageFailures.translate(StorageErrorCode.UPLOAD_FAILED, "move", destinationKey, e);
        }
    }

    @Override
    public List<StorageObjectInfo> list(String prefix) {
        boolean atRoot = prefix == null || prefix.isEmpty();
        Path dir = atRoot ? root : resolve(prefix, "list");
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<StorageObjectInfo> entries = new ArrayList<>();
        try (Stream<Path> children = Files.list(dir)) {
            for (Path child : children.toList()) {
                String name = child.getFileName().toString();
                if (atRoot && RESERVED_DIRS.contains(name)) {
                    continue;
                }
                String childKey = atRoot ? name : prefix + "/" + name;
                entries.add(describe(childKey, child));
            }
        } catch (IOException e) {
            log.error("Error listing {}", prefix, e);
            throw StorageFailures.translate(StorageErrorCode.DOWNLOAD_FAILED, "list", prefix, e);
        }
        entries.sort(Comparator.comparing(StorageObjectInfo::getKey));
        return entries;
    }

    @Override
    public void createDir(String path) {
        Path dir = resolve(path, "createDir");
        if (Files.isRegularFile(dir)) {
            throw new UploadFailedException("an object already exists at this path", "createDir", path, null);
        }
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.error("Error creating directory {}", path, e);
            throw StorageFailures.translate(StorageErrorCode.UPLOAD_FAILED, "createDir", path, e);
        }
    }

    @Override
    public void deleteDir(String path) {
        Path dir = resolve(path, "deleteDir");
        if (!Files.exists(dir)) {
            return;
        }
        try {
            deleteRecursively(dir);
            log.info("Deleted directory {}", path);
            pruneEmptyParents(dir.getParent());
        } catch (IOException e) {
            log.error("Error deleting directory {}", path, e);
            throw StorageFailures.translate(StorageErrorCode.DELETE_FAILED, "deleteDir", path, e);
        }
    }

    @Override
    public String initiateMultipartUpload(String key) {
        resolve(key, "initiateMultipartUpload");
        String uploadId = UUID.randomUUID().toString();
        try {
            Files.createDirectories(uploadDir(uploadId));
        } catch (IOException e) {
            log.error("Error initiating multipart upload for {}", key, e);
            throw StorageFailures.translate(StorageErrorCode.UPLOAD_FAILED, "initiateMultipartUpload", key, e);
        }
        log.info("Initiated multipart upload {} for {}", uploadId, key);
        return uploadId;
    }

    @Override
    public UploadedPart uploadPart(String key, String uploadId, int partNumber, InputStream data, long size) {
        resolve(key, "uploadPart");
        Path dir = existingUploadDir(key, uploadId, "uploadPart");
        Path staging = newStagingFile();
        MessageDigest md5 = Digests.md5();
        try {
            long written = writeStaged(staging, new DigestInputStream(CancellableInputStream.of(data), md5));
            if (size >= 0 && written != size) {
                throw new UploadFailedException("part " + partNumber + " size mismatch: expected " + size
                        + " bytes, received " + written, "uploadPart", key, null);
            }
            Files.move(staging, dir.resolve(partFileName(partNumber)),
                    StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Stored part {} of upload {} ({} bytes)", partNumber, uploadId, written);
            return new UploadedPart(partNumber, Digests.toHex(md5.digest()), written);
        } catch (IOException e) {
            log.error("Error storing part {} of upload {}", partNumber, uploadId, e);
            throw StorageFailures.translate(StorageErrorCode.UPLOAD_FAILED, "uploadPart", key, e);
        } finally {
            discardStaging(staging);
        }
    }

    @Override
    public void completeMultipartUpload(String key, String uploadId, List<UploadedPart> parts) {
        Path target = resolve(key, "completeMultipartUpload");
        Path dir = existingUploadDir(key, uploadId, "completeMultipartUpload");
        Path staging = newStagingFile();
        try {
            try (OutputStream out = Files.newOutputStream(staging)) {
                for (UploadedPart part : parts) {
                    appendPart(key, dir, part, out);
                }
            }
            Files.createDirectories(target.getParent());
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            deleteRecursively(dir);
            log.info("Completed multipart upload {} into {} ({} parts)", uploadId, key, parts.size());
        } catch (IOException e) {
            log.error("Error completing multipart upload {}", uploadId, e);
            throw StorageFailures.translate(StorageErrorCode.UPLOAD_FAILED, "completeMultipartUpload", key, e);
        } finally {
            discardStaging(staging);
        }
    }

    @Override
    public void abortMultipartUpload(String key, String uploadId) {
        Path dir = uploadDir(uploadId);
        if (!Files.exists(dir)) {
            return;
        }
        try {
            deleteRecursively(dir);
            log.info("Aborted multipart upload {} for {}", uploadId, key);
        } catch (IOException e) {
            log.error("Error aborting multipart upload {}", uploadId, e);
            throw StorageFailures.translate(StorageErrorCode.DELETE_FAILED, "abortMultipartUpload", key, e);
        }
    }

    @Override
    public String getUrl(String key) {
        return resolve(key, "getUrl").toUri().toString();
    }

    /**
     * Local files have no response headers to carry the filename, so this is the plain file URI.
     */
    @Override
    public String getDownloadUrl(String key, String filename) {
        return getUrl(key);
    }

    @Override
    public long minimumPartSize() {
        return minimumPartSize;
    }

    @Override
    public StorageBackendType type() {
        return StorageBackendType.LOCAL;
    }

    private Path resolve(String key, String operation) {
        StorageKeys.requireCallerKey(key, operation);
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new InvalidStorageKeyException("key escapes the storage root", operation, key, null);
        }
        return path;
    }

    private StorageObjectInfo describe(String key, Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
        if (attrs.isDirectory()) {
            return StorageObjectInfo.builder()
                    .key(key)
                    .directory(true)
                    .lastModified(attrs.lastModifiedTime().toInstant())
                    .build();
        }
        return StorageObjectInfo.builder()
                .key(key)
                .size(attrs.size())
                .lastModified(attrs.lastModifiedTime().toInstant())
                .mimeType(StorageKeys.mimeTypeOf(path.getFileName().toString()))
                .etag(Digests.md5Hex(path))
                .build();
    }

    private long writeStaged(Path staging, InputStream in) throws IOException {
        long written = 0;
        byte[] buffer = new byte[BUFFER_SIZE];
        try (OutputStream out = Files.newOutputStream(staging)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                written += read;
            }
        }
        return written;
    }

    private void appendPart(String key, Path dir, UploadedPart part, OutputStream out) throws IOException {
        Path partFile = dir.resolve(partFileName(part.getPartNumber()));
        if (!Files.isRegularFile(partFile)) {
            throw new UploadFailedException("part " + part.getPartNumber() + " was never uploaded",
                    "completeMultipartUpload", key, null);
        }
        MessageDigest md5 = Digests.md5();
        try (InputStream in = new DigestInputStream(CancellableInputStream.of(Files.newInputStream(partFile)), md5)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
            }
        }
        if (!Digests.sameEtag(part.getEtag(), Digests.toHex(md5.digest()))) {
            throw new UploadFailedException("part " + part.getPartNumber() + " does not match its etag",
                    "completeMultipartUpload", key, null);
        }
    }

    private Path existingUploadDir(String key, String uploadId, String operation) {
        Path dir = uploadDir(uploadId);
        if (!Files.isDirectory(dir)) {
            throw new ItemNotFoundException("multipart upload " + uploadId + " not found", operation, key, null);
        }
        return dir;
    }

    private Path uploadDir(String uploadId) {
        if (uploadId == null || !StorageKeys.isSafe(uploadId) || uploadId.contains("/")) {
            throw new InvalidStorageKeyException("invalid upload id", "multipart", uploadId, null);
        }
        return root.resolve(MULTIPART_DIR).resolve(uploadId);
    }

    private static String partFileName(int partNumber) {
        return "part-" + partNumber;
    }

    private Path newStagingFile() {
        return root.resolve(STAGING_DIR).resolve(UUID.randomUUID() + ".tmp");
    }

    private void discardStaging(Path staging) {
        try {
            Files.deleteIfExists(staging);
        } catch (IOException e) {
            log.warn("Could not remove staging file {}: {}", staging, e.getMessage());
        }
    }

    private void deleteRecursively(Path dir) throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
        }
    }

    // Only the single-use directories below temp/<user> are pruned; temp/<user> itself stays so
    // concurrent saves for the same user never lose the parent they just created
    private void pruneEmptyParents(Path dir) {
        Path tempRoot = root.resolve(StorageKeys.TEMP_NAMESPACE);
        int userDepth = tempRoot.getNameCount() + 1;
        Path current = dir;
        while (current != null && current.startsWith(tempRoot) && current.getNameCount() > userDepth) {
            try {
                Files.delete(current);
            } catch (DirectoryNotEmptyException e) {
                return;
            } catch (IOException e) {
                log.debug("Stopped pruning empty directories at {}: {}", current, e.getMessage());
                return;
            }
            current = current.getParent();
        }
    }
}
