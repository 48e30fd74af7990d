package org.qbitspark.fileboxstorage.storage_service.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@Data
@ConfigurationProperties(prefix = "app.storage")
@EnableConfigurationProperties
public class StorageProperties {

    private String type = "local";

    // Applied to part uploads; null means no deadline
    private Duration transferTimeout;

    private Local local = new Local();
    private ObjectStore objectStore = new ObjectStore();
    private Multipart multipart = new Multipart();
    private Retry retry = new Retry();

    @Data
    public static class Local {
        private String root = "./data/storage";
        private long minimumPartSize = 5L * 1024 * 1024;
    }

    @Data
    public static class ObjectStore {
        // Leave blank for AWS S3, the regional endpoint is derived
        private String endpoint;
        private String region = "us-east-1";
        private String bucket = "filebox";
        private String accessKey;
        private String secretKey;
        private Duration presignExpiry = Duration.ofMinutes(15);
    }

    @Data
    public static class Multipart {
        private Duration sessionTtl = Duration.ofHours(24);
        // Read by MultipartReclaimJob through its @Scheduled placeholder
        private Duration reclaimInterval = Duration.ofMinutes(15);
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
    }
}
