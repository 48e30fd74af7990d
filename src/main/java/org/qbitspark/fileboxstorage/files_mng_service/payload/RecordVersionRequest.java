package org.qbitspark.fileboxstorage.files_mng_service.payload;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordVersionRequest {

    @NotNull(message = "File id is required")
    private UUID fileId;

    @PositiveOrZero
    private long size;

    private String contentHash;

    // A temp/ key is promoted to the version key; any other key is recorded as is
    @NotBlank(message = "Storage key is required")
    private String storageKey;

    private String mimeType;

    @NotNull(message = "Author is required")
    private UUID author;

    private String changeNote;
}
