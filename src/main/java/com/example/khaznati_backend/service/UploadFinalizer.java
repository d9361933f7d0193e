package com.example.khaznati_backend.service;

import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.model.Account;
import com.example.khaznati_backend.model.StoredFile;
import com.example.khaznati_backend.repository.AccountRepository;
import com.example.khaznati_backend.repository.StoredFileRepository;
import com.example.khaznati_backend.service.Interfaces.ChunkIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Makes a fully stored upload visible: usage, file row and chunk records commit together or not at all.
 */
@Service
public class UploadFinalizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(UploadFinalizer.class);

    private final AccountService accountService;
    private final AccountRepository accountRepo;
    private final StoredFileRepository fileRepo;
    private final FolderService folderService;
    private final ChunkIndex chunkIndex;

    public UploadFinalizer(AccountService accountService, AccountRepository accountRepo, StoredFileRepository fileRepo,
                           FolderService folderService, ChunkIndex chunkIndex) {
        this.accountService = accountService;
        this.accountRepo = accountRepo;
        this.fileRepo = fileRepo;
        this.folderService = folderService;
        this.chunkIndex = chunkIndex;
    }

    @Transactional
    public StoredFile finalizeUpload(UploadSession session, String backendName) {
        // usage first: a quota failure must not leave a row behind
        accountService.applyUsageDelta(session.getOwnerId(), session.getSizeBytes());

        if (session.getFolderId() != null && !folderService.folderExists(session.getFolderId(), session.getOwnerId())) {
            throw new NotFoundException("Folder not found: " + session.getFolderId());
        }
        Account owner = accountRepo.getReferenceById(session.getOwnerId());
        StoredFile file = new StoredFile(owner, session.getName(), session.getSizeBytes());
        file.setFolderId(session.getFolderId());
        file.setMimeType(session.getMimeType());
        file.setChecksum(session.getChecksum());
        file.setBackend(backendName);
        file.setChunkCount(session.getExpectedChunks());
        file = fileRepo.saveAndFlush(file);

        for (UploadSession.StoredChunk chunk : session.storedChunks()) {
            chunkIndex.append(file.getId(), chunk.sequenceIndex(), chunk.locator(), chunk.size());
        }
        LOGGER.info("UPLOAD FINALIZE handle={} file={} owner={} size={} chunks={}",
                session.getId(), file.getId(), session.getOwnerId(), session.getSizeBytes(), session.getExpectedChunks());
        return file;
    }
}
