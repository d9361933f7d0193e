package com.example.khaznati_backend.controller;

import com.example.khaznati_backend.dto.web.SharedFileResponse;
import com.example.khaznati_backend.model.ShareLink;
import com.example.khaznati_backend.model.StoredFile;
import com.example.khaznati_backend.service.DownloadCoordinator;
import com.example.khaznati_backend.service.ShareLinkService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.util.UUID;

/**
 * Public access through share links; no owner parameter except for revoking.
 */
@RestController
@RequestMapping("/v1/share")
public class ShareController {
    private final ShareLinkService shares;
    private final DownloadCoordinator downloads;
    private final OwnerResolver owners;

    public ShareController(ShareLinkService shares, DownloadCoordinator downloads, OwnerResolver owners) {
        this.shares = shares;
        this.downloads = downloads;
        this.owners = owners;
    }

    @GetMapping("/{token}")
    public SharedFileResponse info(@PathVariable String token) {
        StoredFile file = shares.resolve(token).getFile();
        return new SharedFileResponse(file.getName(), file.getSizeBytes(), file.getMimeType());
    }

    @GetMapping(value = "/{token}/content", produces = MediaType.ALL_VALUE)
    public ResponseEntity<StreamingResponseBody> content(@PathVariable String token) {
        ShareLink link = shares.resolve(token);
        StreamingResponseBody body = out -> downloads.downloadShared(token, out);
        return ResponseEntity.ok()
                .headers(FileController.downloadHeaders(link.getFile()))
                .body(body);
    }

    @DeleteMapping("/links/{linkId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void revoke(@PathVariable UUID linkId, @RequestParam("owner") String owner) {
        shares.revoke(owners.existing(owner), linkId);
    }
}
