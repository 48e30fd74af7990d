package org.qbitspark.fileboxstorage.share_service.payload;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.qbitspark.fileboxstorage.share_service.enums.ShareAccessType;

import java.time.LocalDateTime;

/**
 * Null fields are left unchanged. An empty password removes the password.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateShareRequest {

    private ShareAccessType accessType;

    private String password;

    private LocalDateTime expiresAt;

    @Min(value = 1, message = "Max downloads must be at least 1")
    private Integer maxDownloads;
}
