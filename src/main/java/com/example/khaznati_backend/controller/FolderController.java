package com.example.khaznati_backend.controller;

import com.example.khaznati_backend.dto.web.FolderCreateRequest;
import com.example.khaznati_backend.dto.web.FolderDeleteResponse;
import com.example.khaznati_backend.dto.web.FolderPatchRequest;
import com.example.khaznati_backend.dto.web.FolderResponse;
import com.example.khaznati_backend.model.Folder;
import com.example.khaznati_backend.service.FolderService;
import com.example.khaznati_backend.service.LifecycleManager;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/folders")
public class FolderController {
    private final FolderService folders;
    private final LifecycleManager lifecycle;
    private final OwnerResolver owners;

    public FolderController(FolderService folders, LifecycleManager lifecycle, OwnerResolver owners) {
        this.folders = folders;
        this.lifecycle = lifecycle;
        this.owners = owners;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public FolderResponse create(@RequestParam("owner") String owner, @Valid @RequestBody FolderCreateRequest request) {
        return FolderResponse.from(folders.create(owners.ensure(owner), request.parentId(), request.name()));
    }

    @GetMapping
    public List<FolderResponse> children(@RequestParam("owner") String owner,
                                         @RequestParam(value = "parentId", required = false) UUID parentId) {
        return folders.listChildren(owners.existing(owner), parentId).stream().map(FolderResponse::from).toList();
    }

    @GetMapping("/{folderId}/breadcrumbs")
    public List<FolderResponse> breadcrumbs(@PathVariable UUID folderId, @RequestParam("owner") String owner) {
        return folders.breadcrumbs(owners.existing(owner), folderId).stream().map(FolderResponse::from).toList();
    }

    @PatchMapping("/{folderId}")
    public FolderResponse patch(@PathVariable UUID folderId, @RequestParam("owner") String owner,
                                @RequestBody FolderPatchRequest request) {
        UUID ownerId = owners.existing(owner);
        Folder folder = folders.getOwned(folderId, ownerId);
        if (request.name() != null) {
            folder = folders.rename(ownerId, folderId, request.name());
        }
        if (Boolean.TRUE.equals(request.moveToRoot())) {
            folder = folders.move(ownerId, folderId, null);
        } else if (request.parentId() != null) {
            folder = folders.move(ownerId, folderId, request.parentId());
        }
        return FolderResponse.from(folder);
    }

    @DeleteMapping("/{folderId}")
    @Operation(summary = "Delete a folder; with recursive=true its sub folders and files are deleted for good")
    public ResponseEntity<FolderDeleteResponse> delete(@PathVariable UUID folderId, @RequestParam("owner") String owner,
                                                       @RequestParam(value = "recursive", defaultValue = "false") boolean recursive) {
        UUID ownerId = owners.existing(owner);
        if (!recursive) {
            folders.delete(ownerId, folderId);
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(FolderDeleteResponse.from(lifecycle.deleteFolderRecursive(ownerId, folderId)));
    }
}
