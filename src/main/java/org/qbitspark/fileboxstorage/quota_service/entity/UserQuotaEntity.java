package org.qbitspark.fileboxstorage.quota_service.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "user_quotas")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserQuotaEntity {

    @Id
    private UUID userId;

    @Column(nullable = false)
    private long storageQuota;

    @Column(nullable = false)
    private long usedStorage;

    // Bytes admitted by reservations that are neither committed nor released yet
    @Column(nullable = false)
    private long reservedStorage;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public long getAvailableStorage() {
        return Math.max(0, storageQuota - usedStorage - reservedStorage);
    }
}
