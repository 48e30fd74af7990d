package org.qbitspark.fileboxstorage.files_mng_service.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.qbitspark.fileboxstorage.files_mng_service.enums.FileKind;
import org.qbitspark.fileboxstorage.files_mng_service.enums.FileLifecycle;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "files", indexes = {
        @Index(name = "idx_files_user_parent", columnList = "user_id, parent_id"),
        @Index(name = "idx_files_lifecycle", columnList = "lifecycle")
})
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class FileEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID fileId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    // null means the owner's root
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_id")
    private FileEntity parent;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String logicalPath;

    @Column(nullable = false)
    private long size;

    @Column
    private String mimeType;

    @Column(length = 64)
    private String contentHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FileKind kind = FileKind.FILE;

    @Column(name = "is_public", nullable = false)
    private boolean publicAccess;

    @Column
    private String shareToken;

    // 0 until the first version is recorded
    @Column(nullable = false)
    private int currentVersion;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FileLifecycle lifecycle = FileLifecycle.ACTIVE;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public boolean isDirectory() {
        return kind == FileKind.DIRECTORY;
    }

    public boolean isActive() {
        return lifecycle == FileLifecycle.ACTIVE;
    }

    public UUID getParentId() {
        return parent != null ? parent.getFileId() : null;
    }

    public void tombstone(LocalDateTime when) {
        this.lifecycle = FileLifecycle.TOMBSTONED;
        this.deletedAt = when;
    }

    public void revive() {
        this.lifecycle = FileLifecycle.ACTIVE;
        this.deletedAt = null;
    }
}
