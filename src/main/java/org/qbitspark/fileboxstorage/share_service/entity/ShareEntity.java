package org.qbitspark.fileboxstorage.share_service.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.qbitspark.fileboxstorage.share_service.enums.ShareAccessType;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "shares", indexes = {
        @Index(name = "idx_shares_token", columnList = "shareToken", unique = true),
        @Index(name = "idx_shares_file", columnList = "fileId"),
        @Index(name = "idx_shares_user", columnList = "userId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShareEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private UUID fileId;

    @Column(nullable = false)
    private UUID userId;

    @Column(nullable = false, unique = true, length = 32)
    private String shareToken;

    // BCrypt hash, null when the share has no password
    @Column(columnDefinition = "TEXT")
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ShareAccessType accessType;

    private LocalDateTime expiresAt;

    private Integer maxDownloads;

    @Builder.Default
    @Column(nullable = false)
    private int downloadCount = 0;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public boolean isExpired(LocalDateTime now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public boolean isExhausted() {
        return maxDownloads != null && downloadCount >= maxDownloads;
    }

    public boolean hasPassword() {
        return passwordHash != null;
    }
}
