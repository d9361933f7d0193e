package com.example.khaznati_backend.controller;

import com.example.khaznati_backend.dto.web.DeleteReportResponse;
import com.example.khaznati_backend.dto.web.EmptyTrashResponse;
import com.example.khaznati_backend.dto.web.FileResponse;
import com.example.khaznati_backend.service.LifecycleManager;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/trash")
public class TrashController {
    private final LifecycleManager lifecycle;
    private final OwnerResolver owners;

    public TrashController(LifecycleManager lifecycle, OwnerResolver owners) {
        this.lifecycle = lifecycle;
        this.owners = owners;
    }

    @GetMapping
    public List<FileResponse> list(@RequestParam("owner") String owner) {
        return lifecycle.listTrash(owners.existing(owner)).stream().map(FileResponse::from).toList();
    }

    @PostMapping("/{fileId}/restore")
    public FileResponse restore(@PathVariable UUID fileId, @RequestParam("owner") String owner) {
        return FileResponse.from(lifecycle.restore(fileId, owners.existing(owner)));
    }

    @DeleteMapping("/{fileId}")
    @Operation(summary = "Delete a file and its chunks for good")
    public DeleteReportResponse delete(@PathVariable UUID fileId, @RequestParam("owner") String owner) {
        return DeleteReportResponse.from(lifecycle.permanentDelete(fileId, owners.existing(owner)));
    }

    @DeleteMapping
    public EmptyTrashResponse empty(@RequestParam("owner") String owner) {
        return new EmptyTrashResponse(lifecycle.emptyTrash(owners.existing(owner)));
    }
}
