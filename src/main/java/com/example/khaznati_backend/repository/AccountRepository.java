package com.example.khaznati_backend.repository;

import com.example.khaznati_backend.model.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface AccountRepository extends JpaRepository<Account, UUID> {
    Optional<Account> findByExternalSubject(String externalSubject);

    /**
     * Adds {@code delta} bytes in a single statement unless that would cross the quota.
     *
     * @return 1 when applied, 0 when the account is missing or the quota would be exceeded
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        update Account a
           set a.storageUsedBytes = a.storageUsedBytes + :delta
         where a.id = :id
           and (a.storageQuotaBytes < 0 or a.storageUsedBytes + :delta <= a.storageQuotaBytes)
        """)
    int incrementUsageWithinQuota(@Param("id") UUID id, @Param("delta") long delta);

    /** Subtracts {@code bytes}, clamping at zero. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        update Account a
           set a.storageUsedBytes = case when a.storageUsedBytes >= :bytes
                                         then a.storageUsedBytes - :bytes
                                         else 0 end
         where a.id = :id
        """)
    int decrementUsage(@Param("id") UUID id, @Param("bytes") long bytes);
}
