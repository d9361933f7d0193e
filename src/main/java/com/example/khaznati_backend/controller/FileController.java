package com.example.khaznati_backend.controller;

import com.example.khaznati_backend.dto.web.FilePatchRequest;
import com.example.khaznati_backend.dto.web.FileResponse;
import com.example.khaznati_backend.dto.web.ShareLinkRequest;
import com.example.khaznati_backend.dto.web.ShareLinkResponse;
import com.example.khaznati_backend.model.StoredFile;
import com.example.khaznati_backend.service.DownloadCoordinator;
import com.example.khaznati_backend.service.FileService;
import com.example.khaznati_backend.service.LifecycleManager;
import com.example.khaznati_backend.service.ShareLinkService;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/files")
public class FileController {

    private final FileService files;
    private final DownloadCoordinator downloads;
    private final LifecycleManager lifecycle;
    private final ShareLinkService shares;
    private final OwnerResolver owners;

    public FileController(FileService files, DownloadCoordinator downloads, LifecycleManager lifecycle,
                          ShareLinkService shares, OwnerResolver owners) {
        this.files = files;
        this.downloads = downloads;
        this.lifecycle = lifecycle;
        this.shares = shares;
        this.owners = owners;
    }

    @GetMapping
    public List<FileResponse> list(@RequestParam("owner") String owner,
                                   @RequestParam(value = "folderId", required = false) UUID folderId) {
        return files.listFolder(owners.existing(owner), folderId).stream().map(FileResponse::from).toList();
    }

    @GetMapping("/{fileId}")
    public FileResponse get(@PathVariable UUID fileId, @RequestParam("owner") String owner) {
        return FileResponse.from(files.getActive(fileId, owners.existing(owner)));
    }

    @GetMapping(value = "/{fileId}/content", produces = MediaType.ALL_VALUE)
    @Operation(summary = "Download the reassembled file")
    public ResponseEntity<StreamingResponseBody> content(@PathVariable UUID fileId, @RequestParam("owner") String owner) {
        UUID ownerId = owners.existing(owner);
        StoredFile file = files.getActive(fileId, ownerId);
        StreamingResponseBody body = out -> downloads.download(fileId, ownerId, out);
        return ResponseEntity.ok()
                .headers(downloadHeaders(file))
                .body(body);
    }

    @PatchMapping("/{fileId}")
    public FileResponse patch(@PathVariable UUID fileId, @RequestParam("owner") String owner,
                              @RequestBody FilePatchRequest request) {
        UUID ownerId = owners.existing(owner);
        StoredFile file = files.getActive(fileId, ownerId);
        if (request.name() != null) {
            file = files.rename(fileId, ownerId, request.name());
        }
        if (Boolean.TRUE.equals(request.moveToRoot())) {
            file = files.move(fileId, ownerId, null);
        } else if (request.folderId() != null) {
            file = files.move(fileId, ownerId, request.folderId());
        }
        return FileResponse.from(file);
    }

    @DeleteMapping("/{fileId}")
    @Operation(summary = "Move a file to the trash")
    public FileResponse trash(@PathVariable UUID fileId, @RequestParam("owner") String owner) {
        return FileResponse.from(lifecycle.trash(fileId, owners.existing(owner)));
    }

    @PostMapping("/{fileId}/shares")
    @ResponseStatus(HttpStatus.CREATED)
    public ShareLinkResponse share(@PathVariable UUID fileId, @RequestParam("owner") String owner,
                                   @Valid @RequestBody(required = false) ShareLinkRequest request) {
        Duration validFor = request == null || request.expiresInHours() == null ? null : Duration.ofHours(request.expiresInHours());
        Integer maxDownloads = request == null ? null : request.maxDownloads();
        return ShareLinkResponse.from(shares.create(owners.existing(owner), fileId, validFor, maxDownloads));
    }

    @GetMapping("/{fileId}/shares")
    public List<ShareLinkResponse> shares(@PathVariable UUID fileId, @RequestParam("owner") String owner) {
        return shares.listForFile(owners.existing(owner), fileId).stream().map(ShareLinkResponse::from).toList();
    }

    static HttpHeaders downloadHeaders(StoredFile file) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(file.getMimeType() == null || file.getMimeType().isBlank()
                ? MediaType.APPLICATION_OCTET_STREAM : MediaType.parseMediaType(file.getMimeType()));
        headers.setContentLength(file.getSizeBytes());
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename(file.getName(), StandardCharsets.UTF_8)
                .build());
        return headers;
    }
}
