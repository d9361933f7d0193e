package com.example.khaznati_backend.repository;

import com.example.khaznati_backend.model.ShareLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ShareLinkRepository extends JpaRepository<ShareLink, UUID> {
    Optional<ShareLink> findByToken(String token);

    List<ShareLink> findByFileIdOrderByCreatedAtDesc(UUID fileId);

    /**
     * Counts one download unless the link is inactive or already used up.
     *
     * @return 1 when counted, 0 when the limit was reached or the link was revoked
     */
    @Modifying
    @Transactional
    @Query("""
        update ShareLink s
           set s.downloadCount = s.downloadCount + 1,
               s.lastAccessedAt = :now
         where s.id = :id
           and s.active = true
           and (s.maxDownloads is null or s.downloadCount < s.maxDownloads)
        """)
    int registerDownload(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying
    @Transactional
    @Query("update ShareLink s set s.downloadCount = s.downloadCount - 1 where s.id = :id and s.downloadCount > 0")
    int releaseDownload(@Param("id") UUID id);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("delete from ShareLink s where s.file.id = :fileId")
    int deleteByFileId(@Param("fileId") UUID fileId);
}
