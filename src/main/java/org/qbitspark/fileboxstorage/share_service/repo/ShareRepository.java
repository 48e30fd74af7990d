package org.qbitspark.fileboxstorage.share_service.repo;

import jakarta.persistence.LockModeType;
import org.qbitspark.fileboxstorage.share_service.entity.ShareEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ShareRepository extends JpaRepository<ShareEntity, UUID> {

    Optional<ShareEntity> findByShareToken(String shareToken);

    boolean existsByShareToken(String shareToken);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from ShareEntity s where s.shareToken = :shareToken")
    Optional<ShareEntity> findByShareTokenForUpdate(@Param("shareToken") String shareToken);

    Optional<ShareEntity> findByIdAndUserId(UUID id, UUID userId);

    List<ShareEntity> findByUserIdOrderByCreatedAtDesc(UUID userId);

    List<ShareEntity> findByFileIdAndActiveTrue(UUID fileId);
}
