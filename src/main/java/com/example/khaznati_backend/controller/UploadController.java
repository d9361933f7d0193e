package com.example.khaznati_backend.controller;

import com.example.khaznati_backend.config.StorageProperties;
import com.example.khaznati_backend.dto.web.FileResponse;
import com.example.khaznati_backend.dto.web.UploadInitRequest;
import com.example.khaznati_backend.dto.web.UploadInitResponse;
import com.example.khaznati_backend.dto.web.UploadStatusResponse;
import com.example.khaznati_backend.service.UploadCoordinator;
import com.example.khaznati_backend.service.UploadHandle;
import com.example.khaznati_backend.util.UploadState;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.UUID;

@RestController
@RequestMapping("/v1/uploads")
public class UploadController {
    private static final Logger LOGGER = LoggerFactory.getLogger(UploadController.class);
    private final UploadCoordinator uploads;
    private final OwnerResolver owners;
    private final StorageProperties storageProperties;

    public UploadController(UploadCoordinator uploads, OwnerResolver owners, StorageProperties storageProperties) {
        this.uploads = uploads;
        this.owners = owners;
        this.storageProperties = storageProperties;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Register an upload; the size hint is checked against the quota right away")
    public UploadInitResponse init(@RequestParam("owner") String owner, @Valid @RequestBody UploadInitRequest request) {
        UUID ownerId = owners.ensure(owner);
        UploadHandle handle = uploads.initUpload(ownerId, request.name(), request.size(), request.folderId(),
                request.mimeType(), request.checksum());
        return new UploadInitResponse(handle.id(), UploadState.INITIATED.name(), storageProperties.getChunkSizeBytes());
    }

    @PutMapping(value = "/{uploadId}/content", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.ACCEPTED)
    public UploadStatusResponse content(@PathVariable UUID uploadId,
                                        @RequestParam("owner") String owner,
                                        @RequestPart("file") MultipartFile file) throws IOException {
        UploadHandle handle = owners.ownedUpload(uploads, uploadId, owner);
        uploads.receive(handle, file.getInputStream());
        return UploadStatusResponse.from(uploads.status(handle));
    }

    @PostMapping("/{uploadId}/complete")
    @Operation(summary = "Wait until the upload is finalized and return the stored file")
    public FileResponse complete(@PathVariable UUID uploadId, @RequestParam("owner") String owner) {
        UploadHandle handle = owners.ownedUpload(uploads, uploadId, owner);
        return FileResponse.from(uploads.completeUpload(handle));
    }

    @GetMapping("/{uploadId}")
    public UploadStatusResponse status(@PathVariable UUID uploadId, @RequestParam("owner") String owner) {
        UploadHandle handle = owners.ownedUpload(uploads, uploadId, owner);
        return UploadStatusResponse.from(uploads.status(handle));
    }

    @DeleteMapping("/{uploadId}")
    public UploadStatusResponse cancel(@PathVariable UUID uploadId, @RequestParam("owner") String owner) {
        UploadHandle handle = owners.ownedUpload(uploads, uploadId, owner);
        uploads.cancel(handle);
        return UploadStatusResponse.from(uploads.status(handle));
    }

    @PostMapping(value = "/direct", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Upload a whole file in one request")
    public FileResponse direct(@RequestParam("owner") String owner,
                               @RequestPart("file") MultipartFile file,
                               @RequestParam(value = "folderId", required = false) UUID folderId,
                               @RequestParam(value = "checksum", required = false) String checksum) throws IOException {
        UUID ownerId = owners.ensure(owner);
        String name = file.getOriginalFilename() == null || file.getOriginalFilename().isBlank()
                ? "upload-" + UUID.randomUUID() : file.getOriginalFilename();
        LOGGER.info("UploadController direct owner={} name={} size={}", ownerId, name, file.getSize());
        return FileResponse.from(uploads.upload(ownerId, name, folderId, file.getContentType(), checksum, file.getInputStream()));
    }
}
