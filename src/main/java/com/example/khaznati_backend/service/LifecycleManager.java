package com.example.khaznati_backend.service;

import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.model.StoredFile;
import com.example.khaznati_backend.service.Interfaces.ChunkIndex;
import com.example.khaznati_backend.service.Interfaces.ObjectBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Trash, restore and permanent deletion of files, and recursive deletion of folders.
 * <p>
 * Trash and restore only touch metadata. Permanent deletion removes the chunks from the backend first and
 * keeps going past individual failures; the metadata is removed afterwards in one transaction, so any
 * chunk that could not be deleted is reported as an orphan instead of blocking the delete.
 */
@Service
public class LifecycleManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(LifecycleManager.class);

    private final FileService fileService;
    private final FolderService folderService;
    private final ChunkIndex chunkIndex;
    private final ObjectBackend backend;
    private final Clock clock;

    public LifecycleManager(FileService fileService, FolderService folderService, ChunkIndex chunkIndex,
                            ObjectBackend backend, Clock clock) {
        this.fileService = fileService;
        this.folderService = folderService;
        this.chunkIndex = chunkIndex;
        this.backend = backend;
        this.clock = clock;
    }

    /** Moves a file to the trash. Already trashed files are left as they are. */
    @Transactional
    public StoredFile trash(UUID fileId, UUID ownerId) {
        StoredFile file = fileService.getOwned(fileId, ownerId);
        if (!file.moveToTrash(clock.instant())) {
            LOGGER.debug("TRASH skip file={} already trashed", fileId);
            return file;
        }
        LOGGER.info("TRASH owner={} file={} folder={}", ownerId, fileId, file.getOriginalFolderId());
        return fileService.save(file);
    }

    /**
     * Takes a file out of the trash, back into its original folder or into the root when that folder is gone.
     */
    @Transactional
    public StoredFile restore(UUID fileId, UUID ownerId) {
        StoredFile file = fileService.getOwned(fileId, ownerId);
        if (!file.isTrashed()) {
            throw new NotFoundException("File " + fileId + " is not in the trash");
        }
        UUID original = file.getOriginalFolderId();
        UUID target = original != null && folderService.folderExists(original, ownerId) ? original : null;
        file.restoreTo(target);
        LOGGER.info("RESTORE owner={} file={} folder={}", ownerId, fileId, target);
        return fileService.save(file);
    }

    public DeleteReport permanentDelete(UUID fileId, UUID ownerId) {
        StoredFile file = fileService.getOwned(fileId, ownerId);
        List<ChunkIndex.ChunkRecord> chunks = chunkIndex.listAll(fileId);
        List<ChunkFailure> failures = new ArrayList<>();

        for (ChunkIndex.ChunkRecord chunk : chunks) {
            try {
                backend.delete(chunk.locator());
            } catch (RuntimeException e) {
                LOGGER.warn("DELETE chunk failed file={} seq={} locator={} err={}",
                        fileId, chunk.sequenceIndex(), chunk.locator(), e.toString());
                failures.add(new ChunkFailure(chunk.sequenceIndex(), chunk.locator(), e.getMessage()));
            }
        }

        fileService.purgeRecord(file);
        DeleteReport report = new DeleteReport(fileId, chunks.size(), chunks.size() - failures.size(), failures);
        if (report.isClean()) {
            LOGGER.info("DELETE owner={} file={} chunks={}", ownerId, fileId, chunks.size());
        } else {
            LOGGER.warn("DELETE owner={} file={} chunks={} orphaned={}", ownerId, fileId, chunks.size(), failures.size());
        }
        return report;
    }

    /**
     * Permanently deletes every trashed file of the owner. A file that fails is logged and skipped.
     *
     * @return number of files removed
     */
    public int emptyTrash(UUID ownerId) {
        List<StoredFile> trashed = fileService.listTrash(ownerId);
        int removed = 0;
        for (StoredFile file : trashed) {
            try {
                permanentDelete(file.getId(), ownerId);
                removed++;
            } catch (RuntimeException e) {
                LOGGER.error("EMPTY TRASH failed owner={} file={} err={}", ownerId, file.getId(), e.toString(), e);
            }
        }
        LOGGER.info("EMPTY TRASH owner={} removed={} of={}", ownerId, removed, trashed.size());
        return removed;
    }

    /**
     * Deletes a folder together with every sub folder and file below it. Files go through
     * {@link #permanentDelete} so their chunks leave the backend before their rows; each folder is removed once
     * it is empty, deepest first. A file that cannot be removed stops the walk and leaves its folder in place.
     */
    public FolderDeleteReport deleteFolderRecursive(UUID ownerId, UUID folderId) {
        List<UUID> folders = folderService.subtreeDeepestFirst(ownerId, folderId);
        List<DeleteReport> files = new ArrayList<>();
        for (UUID id : folders) {
            for (StoredFile file : fileService.listFolder(ownerId, id)) {
                files.add(permanentDelete(file.getId(), ownerId));
            }
            folderService.delete(ownerId, id);
        }
        FolderDeleteReport report = new FolderDeleteReport(folderId, folders.size(), files);
        LOGGER.info("FOLDER DELETE RECURSIVE owner={} folder={} folders={} files={} orphaned={}",
                ownerId, folderId, folders.size(), files.size(), report.orphanedChunks());
        return report;
    }

    public List<StoredFile> listTrash(UUID ownerId) {
        return fileService.listTrash(ownerId);
    }

    public record DeleteReport(UUID fileId, int chunksTotal, int chunksDeleted, List<ChunkFailure> failures) {
        public boolean isClean() {
            return failures.isEmpty();
        }
    }

    public record FolderDeleteReport(UUID folderId, int foldersDeleted, List<DeleteReport> files) {
        public int orphanedChunks() {
            return files.stream().mapToInt(f -> f.failures().size()).sum();
        }
    }

    public record ChunkFailure(int sequenceIndex, String locator, String error) {
    }
}
