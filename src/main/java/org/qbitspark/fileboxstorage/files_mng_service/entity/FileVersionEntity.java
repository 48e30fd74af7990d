package org.qbitspark.fileboxstorage.files_mng_service.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "file_versions",
        uniqueConstraints = @UniqueConstraint(name = "uk_file_versions_number", columnNames = {"file_id", "version_number"}),
        indexes = @Index(name = "idx_file_versions_file", columnList = "file_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FileVersionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "file_id", nullable = false)
    private UUID fileId;

    @Column(name = "version_number", nullable = false)
    private int versionNumber;

    @Column(nullable = false)
    private long fileSize;

    @Column(length = 64)
    private String fileHash;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String storagePath;

    // Backend etag observed right after the content was placed; reads compare against it
    @Column
    private String storageEtag;

    @Column
    private String mimeType;

    @Column(columnDefinition = "TEXT")
    private String changeNote;

    @Column(nullable = false)
    private UUID createdBy;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
