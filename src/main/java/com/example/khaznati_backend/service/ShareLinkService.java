package com.example.khaznati_backend.service;

import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.model.ShareLink;
import com.example.khaznati_backend.model.StoredFile;
import com.example.khaznati_backend.repository.ShareLinkRepository;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

/**
 * Public download links for single files.
 */
@Service
public class ShareLinkService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShareLinkService.class);
    private static final int TOKEN_BYTES = 16;

    private final ShareLinkRepository shareRepo;
    private final FileService fileService;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public ShareLinkService(ShareLinkRepository shareRepo, FileService fileService, Clock clock) {
        this.shareRepo = shareRepo;
        this.fileService = fileService;
        this.clock = clock;
    }

    @Transactional
    public ShareLink create(UUID ownerId, UUID fileId, @Nullable Duration validFor, @Nullable Integer maxDownloads) {
        StoredFile file = fileService.getOwned(fileId, ownerId);
        if (maxDownloads != null && maxDownloads < 1) {
            throw new IllegalArgumentException("maxDownloads must be >= 1");
        }
        if (validFor != null && (validFor.isZero() || validFor.isNegative())) {
            throw new IllegalArgumentException("expiry must be in the future");
        }
        ShareLink link = new ShareLink(file, newToken());
        if (validFor != null) {
            link.setExpiresAt(clock.instant().plus(validFor));
        }
        link.setMaxDownloads(maxDownloads);
        link = shareRepo.save(link);
        LOGGER.info("SHARE CREATE owner={} file={} link={} expiresAt={} maxDownloads={}",
                ownerId, fileId, link.getId(), link.getExpiresAt(), maxDownloads);
        return link;
    }

    /**
     * @throws NotFoundException for unknown, revoked, expired or exhausted links and for trashed files
     */
    @Transactional(readOnly = true)
    public ShareLink resolve(String token) {
        ShareLink link = shareRepo.findByToken(token == null ? "" : token)
                .orElseThrow(() -> new NotFoundException("Share link not found"));
        if (!link.isUsableAt(clock.instant()) || link.getFile().isTrashed()) {
            throw new NotFoundException("Share link not found");
        }
        return link;
    }

    /**
     * Takes one download slot of the link.
     *
     * @throws NotFoundException when a concurrent download took the last slot or the link was revoked
     */
    @Transactional
    public void registerDownload(ShareLink link) {
        if (shareRepo.registerDownload(link.getId(), clock.instant()) == 0) {
            throw new NotFoundException("Share link not found");
        }
    }

    /** Gives back a slot taken by {@link #registerDownload} for a download that did not go through. */
    @Transactional
    public void releaseDownload(ShareLink link) {
        shareRepo.releaseDownload(link.getId());
        LOGGER.debug("SHARE RELEASE link={}", link.getId());
    }

    @Transactional(readOnly = true)
    public List<ShareLink> listForFile(UUID ownerId, UUID fileId) {
        fileService.getOwned(fileId, ownerId);
        return shareRepo.findByFileIdOrderByCreatedAtDesc(fileId);
    }

    @Transactional
    public void revoke(UUID ownerId, UUID linkId) {
        ShareLink link = shareRepo.findById(linkId)
                .filter(l -> l.getFile().getOwnerId().equals(ownerId))
                .orElseThrow(() -> new NotFoundException("Share link not found: " + linkId));
        link.setActive(false);
        shareRepo.save(link);
        LOGGER.info("SHARE REVOKE owner={} link={}", ownerId, linkId);
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
