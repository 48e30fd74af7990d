package org.qbitspark.fileboxstorage.files_mng_service.repo;

import org.qbitspark.fileboxstorage.files_mng_service.entity.FileVersionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FileVersionRepository extends JpaRepository<FileVersionEntity, UUID> {

    @Query("select max(v.versionNumber) from FileVersionEntity v where v.fileId = :fileId")
    Optional<Integer> findMaxVersionNumber(@Param("fileId") UUID fileId);

    Optional<FileVersionEntity> findByFileIdAndVersionNumber(UUID fileId, int versionNumber);

    List<FileVersionEntity> findByFileIdOrderByVersionNumberAsc(UUID fileId);

    List<FileVersionEntity> findByFileIdOrderByVersionNumberDesc(UUID fileId);

    boolean existsByStoragePath(String storagePath);
}
