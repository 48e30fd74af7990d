package org.qbitspark.fileboxstorage.storage_service.config;

import org.qbitspark.fileboxstorage.storage_service.service.StorageBackend;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StorageBackendConfig {

    @Bean
    public StorageBackend storageBackend(StorageProperties storageProperties) {
        return StorageBackendFactory.create(storageProperties);
    }
}
