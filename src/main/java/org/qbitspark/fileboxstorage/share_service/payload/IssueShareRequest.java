package org.qbitspark.fileboxstorage.share_service.payload;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.qbitspark.fileboxstorage.share_service.enums.ShareAccessType;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssueShareRequest {

    @NotNull(message = "File id is required")
    private UUID fileId;

    @NotNull(message = "Issuing user is required")
    private UUID userId;

    @NotNull(message = "Access type is required")
    private ShareAccessType accessType;

    // Plain text; hashed before anything is stored
    private String password;

    private LocalDateTime expiresAt;

    @Min(value = 1, message = "Max downloads must be at least 1")
    private Integer maxDownloads;
}
