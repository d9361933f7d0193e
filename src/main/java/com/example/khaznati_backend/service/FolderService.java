package com.example.khaznati_backend.service;

import com.example.khaznati_backend.exception.ConflictException;
import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.model.Account;
import com.example.khaznati_backend.model.Folder;
import com.example.khaznati_backend.repository.AccountRepository;
import com.example.khaznati_backend.repository.FolderRepository;
import com.example.khaznati_backend.repository.StoredFileRepository;
import com.example.khaznati_backend.util.NameRules;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

@Service
public class FolderService {
    private static final Logger LOGGER = LoggerFactory.getLogger(FolderService.class);

    private final FolderRepository folderRepo;
    private final AccountRepository accountRepo;
    private final StoredFileRepository fileRepo;

    public FolderService(FolderRepository folderRepo, AccountRepository accountRepo, StoredFileRepository fileRepo) {
        this.folderRepo = folderRepo;
        this.accountRepo = accountRepo;
        this.fileRepo = fileRepo;
    }

    @Transactional(readOnly = true)
    public boolean folderExists(UUID folderId, UUID ownerId) {
        return folderId != null && folderRepo.existsByIdAndOwnerId(folderId, ownerId);
    }

    @Transactional(readOnly = true)
    public Folder getOwned(UUID folderId, UUID ownerId) {
        return folderRepo.findByIdAndOwnerId(folderId, ownerId)
                .orElseThrow(() -> new NotFoundException("Folder not found: " + folderId));
    }

    @Transactional
    public Folder create(UUID ownerId, @Nullable UUID parentId, String name) {
        String cleanName = NameRules.requireValidName(name, "Folder");
        Account owner = accountRepo.findById(ownerId)
                .orElseThrow(() -> new NotFoundException("Owner not found: " + ownerId));
        Folder parent = parentId == null ? null : getOwned(parentId, ownerId);
        ensureNameFree(ownerId, parentId, cleanName);
        Folder folder = saveUnique(new Folder(owner, parent, cleanName));
        LOGGER.info("FOLDER CREATE owner={} folder={} parent={}", ownerId, folder.getId(), parentId);
        return folder;
    }

    @Transactional(readOnly = true)
    public List<Folder> listChildren(UUID ownerId, @Nullable UUID parentId) {
        if (parentId == null) {
            return folderRepo.findByOwnerIdAndParentIsNullOrderByNameAsc(ownerId);
        }
        getOwned(parentId, ownerId);
        return folderRepo.findByOwnerIdAndParentIdOrderByNameAsc(ownerId, parentId);
    }

    @Transactional
    public Folder rename(UUID ownerId, UUID folderId, String newName) {
        String cleanName = NameRules.requireValidName(newName, "Folder");
        Folder folder = getOwned(folderId, ownerId);
        if (cleanName.equals(folder.getName())) {
            return folder;
        }
        ensureNameFree(ownerId, folder.getParentId(), cleanName);
        folder.setName(cleanName);
        return saveUnique(folder);
    }

    /**
     * Moves a folder below {@code newParentId} ({@code null} = root).
     *
     * @throws ConflictException when the target is the folder itself or one of its descendants
     */
    @Transactional
    public Folder move(UUID ownerId, UUID folderId, @Nullable UUID newParentId) {
        Folder folder = getOwned(folderId, ownerId);
        if (Objects.equals(folder.getParentId(), newParentId)) {
            return folder;
        }
        Folder newParent = null;
        if (newParentId != null) {
            newParent = getOwned(newParentId, ownerId);
            for (Folder cursor = newParent; cursor != null; cursor = cursor.getParent()) {
                if (cursor.getId().equals(folderId)) {
                    throw new ConflictException("Cannot move folder " + folderId + " into itself or a descendant");
                }
            }
        }
        ensureNameFree(ownerId, newParentId, folder.getName());
        folder.setParent(newParent);
        LOGGER.info("FOLDER MOVE owner={} folder={} parent={}", ownerId, folderId, newParentId);
        return saveUnique(folder);
    }

    /** Path from the root down to (and including) the folder. */
    @Transactional(readOnly = true)
    public List<Folder> breadcrumbs(UUID ownerId, UUID folderId) {
        List<Folder> path = new ArrayList<>();
        Set<UUID> seen = new HashSet<>();
        for (Folder cursor = getOwned(folderId, ownerId); cursor != null; cursor = cursor.getParent()) {
            if (!seen.add(cursor.getId())) {
                throw new ConflictException("Folder hierarchy contains a cycle at " + cursor.getId());
            }
            path.add(cursor);
        }
        Collections.reverse(path);
        return path;
    }

    /** Deletes an empty folder; folders that still hold files or sub folders are a conflict. */
    @Transactional
    public void delete(UUID ownerId, UUID folderId) {
        Folder folder = getOwned(folderId, ownerId);
        if (folderRepo.countByParentId(folderId) > 0 || fileRepo.countByFolderIdAndTrashedFalse(folderId) > 0) {
            throw new ConflictException("Folder " + folderId + " is not empty");
        }
        folderRepo.delete(folder);
        LOGGER.info("FOLDER DELETE owner={} folder={}", ownerId, folderId);
    }

    /**
     * Ids of the folder and every folder below it, deepest first, so that deleting them in order never
     * removes a parent before its children.
     */
    @Transactional(readOnly = true)
    public List<UUID> subtreeDeepestFirst(UUID ownerId, UUID folderId) {
        getOwned(folderId, ownerId);
        List<UUID> order = new ArrayList<>();
        collectSubtree(ownerId, folderId, order, new HashSet<>());
        return order;
    }

    private void collectSubtree(UUID ownerId, UUID folderId, List<UUID> order, Set<UUID> seen) {
        if (!seen.add(folderId)) {
            throw new ConflictException("Folder hierarchy contains a cycle at " + folderId);
        }
        for (Folder child : folderRepo.findByOwnerIdAndParentIdOrderByNameAsc(ownerId, folderId)) {
            collectSubtree(ownerId, child.getId(), order, seen);
        }
        order.add(folderId);
    }

    // the unique index on (owner, parent, name) catches a sibling created between the check and the insert
    private Folder saveUnique(Folder folder) {
        try {
            return folderRepo.saveAndFlush(folder);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("A folder named '" + folder.getName() + "' already exists here");
        }
    }

    private void ensureNameFree(UUID ownerId, @Nullable UUID parentId, String name) {
        boolean taken = parentId == null
                ? folderRepo.existsByOwnerIdAndParentIsNullAndName(ownerId, name)
                : folderRepo.existsByOwnerIdAndParentIdAndName(ownerId, parentId, name);
        if (taken) {
            throw new ConflictException("A folder named '" + name + "' already exists here");
        }
    }
}
