package com.example.khaznati_backend.service;

import com.example.khaznati_backend.config.StorageProperties;
import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.exception.QuotaExceededException;
import com.example.khaznati_backend.model.Account;
import com.example.khaznati_backend.repository.AccountRepository;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Owners and their storage usage.
 */
@Service
public class AccountService {
    private static final Logger LOGGER = LoggerFactory.getLogger(AccountService.class);
    private final AccountRepository accountRepo;
    private final StorageProperties storageProperties;

    public AccountService(AccountRepository accountRepo, StorageProperties storageProperties) {
        this.accountRepo = accountRepo;
        this.storageProperties = storageProperties;
    }

    @Transactional
    public Account ensureByExternalSubject(String externalSubject, @Nullable String displayName) {
        if (externalSubject == null || externalSubject.isBlank()) {
            throw new IllegalArgumentException("owner is required");
        }
        var normalized = externalSubject.trim();
        return accountRepo.findByExternalSubject(normalized)
                .orElseGet(() -> {
                    LOGGER.info("Creating new Account for externalSubject={}", normalized);
                    return accountRepo.save(new Account(
                            normalized,
                            displayName != null ? displayName : normalized,
                            storageProperties.getDefaultQuotaBytes()));
                });
    }

    @Transactional(readOnly = true)
    public Account getByExternalSubjectOrThrow(String externalSubject) {
        return accountRepo.findByExternalSubject(externalSubject == null ? "" : externalSubject.trim())
                .orElseThrow(() -> new NotFoundException("Owner not found: " + externalSubject));
    }

    @Transactional(readOnly = true)
    public OwnerUsage getOwner(UUID ownerId) {
        Account account = accountRepo.findById(ownerId)
                .orElseThrow(() -> new NotFoundException("Owner not found: " + ownerId));
        return new OwnerUsage(account.getId(), account.getStorageUsedBytes(), account.getStorageQuotaBytes());
    }

    /**
     * Fails when adding {@code bytes} would cross the owner's quota. Nothing is reserved.
     */
    @Transactional(readOnly = true)
    public void checkQuota(UUID ownerId, long bytes) {
        OwnerUsage usage = getOwner(ownerId);
        if (!usage.allows(bytes)) {
            throw new QuotaExceededException(ownerId, bytes, usage.usedBytes(), usage.quotaBytes());
        }
    }

    /**
     * Adjusts the owner's used bytes in a single statement. Positive deltas are only applied while they fit
     * the quota; negative deltas clamp at zero.
     */
    @Transactional
    public void applyUsageDelta(UUID ownerId, long delta) {
        if (delta == 0) {
            return;
        }
        if (delta < 0) {
            if (accountRepo.decrementUsage(ownerId, -delta) == 0) {
                throw new NotFoundException("Owner not found: " + ownerId);
            }
            LOGGER.debug("Usage released owner={} bytes={}", ownerId, -delta);
            return;
        }
        if (accountRepo.incrementUsageWithinQuota(ownerId, delta) == 0) {
            OwnerUsage usage = getOwner(ownerId);
            throw new QuotaExceededException(ownerId, delta, usage.usedBytes(), usage.quotaBytes());
        }
        LOGGER.debug("Usage added owner={} bytes={}", ownerId, delta);
    }

    /**
     * @param quotaBytes {@link Account#UNLIMITED_QUOTA} for no limit
     */
    public record OwnerUsage(UUID ownerId, long usedBytes, long quotaBytes) {
        public boolean isUnlimited() {
            return quotaBytes < 0;
        }

        public boolean allows(long additionalBytes) {
            return isUnlimited() || usedBytes + additionalBytes <= quotaBytes;
        }

        public long remainingBytes() {
            return isUnlimited() ? Long.MAX_VALUE : Math.max(0, quotaBytes - usedBytes);
        }
    }
}
