package com.example.khaznati_backend.service;

import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.model.StoredFile;
import com.example.khaznati_backend.repository.ShareLinkRepository;
import com.example.khaznati_backend.repository.StoredFileRepository;
import com.example.khaznati_backend.service.Interfaces.ChunkIndex;
import com.example.khaznati_backend.util.NameRules;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Metadata operations on completed files. Content lives behind {@link ChunkIndex}.
 */
@Service
public class FileService {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileService.class);

    private final StoredFileRepository fileRepo;
    private final ShareLinkRepository shareRepo;
    private final ChunkIndex chunkIndex;
    private final FolderService folderService;
    private final AccountService accountService;

    public FileService(StoredFileRepository fileRepo, ShareLinkRepository shareRepo, ChunkIndex chunkIndex,
                       FolderService folderService, AccountService accountService) {
        this.fileRepo = fileRepo;
        this.shareRepo = shareRepo;
        this.chunkIndex = chunkIndex;
        this.folderService = folderService;
        this.accountService = accountService;
    }

    /** Owned file in any state, trashed included. */
    @Transactional(readOnly = true)
    public StoredFile getOwned(UUID fileId, UUID ownerId) {
        return fileRepo.findByIdAndOwnerId(fileId, ownerId)
                .orElseThrow(() -> new NotFoundException("File not found: " + fileId));
    }

    /** Owned file that is not in the trash. */
    @Transactional(readOnly = true)
    public StoredFile getActive(UUID fileId, UUID ownerId) {
        StoredFile file = getOwned(fileId, ownerId);
        if (file.isTrashed()) {
            throw new NotFoundException("File not found: " + fileId);
        }
        return file;
    }

    @Transactional(readOnly = true)
    public List<StoredFile> listFolder(UUID ownerId, @Nullable UUID folderId) {
        if (folderId == null) {
            return fileRepo.findByOwnerIdAndFolderIdIsNullAndTrashedFalseOrderByNameAsc(ownerId);
        }
        if (!folderService.folderExists(folderId, ownerId)) {
            throw new NotFoundException("Folder not found: " + folderId);
        }
        return fileRepo.findByOwnerIdAndFolderIdAndTrashedFalseOrderByNameAsc(ownerId, folderId);
    }

    @Transactional(readOnly = true)
    public List<StoredFile> listTrash(UUID ownerId) {
        return fileRepo.findByOwnerIdAndTrashedTrueOrderByTrashedAtDesc(ownerId);
    }

    @Transactional
    public StoredFile rename(UUID fileId, UUID ownerId, String newName) {
        StoredFile file = getActive(fileId, ownerId);
        file.setName(NameRules.requireValidName(newName, "File"));
        return fileRepo.save(file);
    }

    @Transactional
    public StoredFile move(UUID fileId, UUID ownerId, @Nullable UUID folderId) {
        StoredFile file = getActive(fileId, ownerId);
        if (folderId != null && !folderService.folderExists(folderId, ownerId)) {
            throw new NotFoundException("Folder not found: " + folderId);
        }
        file.setFolderId(folderId);
        LOGGER.info("FILE MOVE owner={} file={} folder={}", ownerId, fileId, folderId);
        return fileRepo.save(file);
    }

    @Transactional
    public StoredFile save(StoredFile file) {
        return fileRepo.save(file);
    }

    /**
     * Removes the metadata of a file whose chunks were already handed to the backend for deletion: chunk
     * records, share links, the file row and its share of the owner's usage.
     */
    @Transactional
    public void purgeRecord(StoredFile file) {
        UUID fileId = file.getId();
        UUID ownerId = file.getOwnerId();
        long size = file.getSizeBytes();
        chunkIndex.deleteAll(fileId);
        shareRepo.deleteByFileId(fileId);
        fileRepo.deleteById(fileId);
        accountService.applyUsageDelta(ownerId, -size);
        LOGGER.info("FILE PURGE owner={} file={} bytes={}", ownerId, fileId, size);
    }
}
