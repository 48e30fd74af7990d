package org.qbitspark.fileboxstorage.storage_service.config;

import io.minio.MinioClient;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.UnsupportedBackendException;
import org.qbitspark.fileboxstorage.storage_service.enums.StorageBackendType;
import org.qbitspark.fileboxstorage.storage_service.service.StorageBackend;
import org.qbitspark.fileboxstorage.storage_service.service.impl.LocalStorageBackend;
import org.qbitspark.fileboxstorage.storage_service.service.impl.ObjectStoreStorageBackend;

import java.nio.file.Path;

/**
 * Picks the backend variant named by {@code app.storage.type}. This is the only place the variant
 * is inspected.
 */
@Slf4j
public final class StorageBackendFactory {

    private StorageBackendFactory() {
    }

    public static StorageBackend create(StorageProperties properties) {
        StorageBackendType type = StorageBackendType.fromConfig(properties.getType());
        log.info("Using {} storage backend", type);
        switch (type) {
            case LOCAL:
                return new LocalStorageBackend(Path.of(properties.getLocal().getRoot()),
                        properties.getLocal().getMinimumPartSize());
            case S3:
            case MINIO:
                return new ObjectStoreStorageBackend(type, minioClient(type, properties.getObjectStore()), properties);
            default:
                throw new UnsupportedBackendException("unsupported storage type: " + type);
        }
    }

    static MinioClient minioClient(StorageBackendType type, StorageProperties.ObjectStore config) {
        String endpoint = config.getEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            if (type == StorageBackendType.MINIO) {
                throw new UnsupportedBackendException("minio storage requires app.storage.object-store.endpoint");
            }
            endpoint = "https://s3." + config.getRegion() + ".amazonaws.com";
        }
        return MinioClient.builder()
                .endpoint(endpoint)
                .region(config.getRegion())
                .credentials(config.getAccessKey(), config.getSecretKey())
                .build();
    }
}
