package com.example.khaznati_backend;

import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.exception.QuotaExceededException;
import com.example.khaznati_backend.model.Account;
import com.example.khaznati_backend.model.ShareLink;
import com.example.khaznati_backend.model.StoredFile;
import com.example.khaznati_backend.repository.AccountRepository;
import com.example.khaznati_backend.repository.ShareLinkRepository;
import com.example.khaznati_backend.repository.StoredFileRepository;
import com.example.khaznati_backend.service.AccountService;
import com.example.khaznati_backend.service.DownloadCoordinator;
import com.example.khaznati_backend.service.FolderService;
import com.example.khaznati_backend.service.Interfaces.ChunkIndex;
import com.example.khaznati_backend.service.Interfaces.ObjectBackend;
import com.example.khaznati_backend.service.LifecycleManager;
import com.example.khaznati_backend.service.ShareLinkService;
import com.example.khaznati_backend.service.UploadCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.Random;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = {
        "storage.chunk-size-bytes=16",
        "storage.local.chunk-prefix=it-chunks"
})
class StoragePipelineIntegrationTest {

    @Autowired
    private AccountService accountService;
    @Autowired
    private AccountRepository accountRepository;
    @Autowired
    private StoredFileRepository fileRepository;
    @Autowired
    private ShareLinkRepository shareLinkRepository;
    @Autowired
    private UploadCoordinator uploads;
    @Autowired
    private DownloadCoordinator downloads;
    @Autowired
    private LifecycleManager lifecycle;
    @Autowired
    private FolderService folders;
    @Autowired
    private ShareLinkService shares;
    @Autowired
    private ChunkIndex chunkIndex;
    @Autowired
    private ObjectBackend backend;

    private UUID ownerId;

    @BeforeEach
    void setUp() {
        ownerId = accountService.ensureByExternalSubject("it-" + UUID.randomUUID(), null).getId();
    }

    private static byte[] content(int size) {
        byte[] data = new byte[size];
        new Random(size).nextBytes(data);
        return data;
    }

    private long usedBytes() {
        return accountRepository.findById(ownerId).orElseThrow().getStorageUsedBytes();
    }

    @Test
    void uploadDownloadTrashAndDeleteRoundTrip() {
        byte[] data = content(100);
        UUID folderId = folders.create(ownerId, null, "Documents").getId();

        StoredFile file = uploads.upload(ownerId, "notes.bin", folderId, "application/octet-stream", null,
                new ByteArrayInputStream(data));

        assertThat(file.getChunkCount()).isEqualTo(7);
        assertThat(file.getBackend()).isEqualTo("local");
        assertThat(chunkIndex.listOrdered(file.getId())).hasSize(7);
        assertThat(usedBytes()).isEqualTo(100);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertThat(downloads.download(file.getId(), ownerId, out)).isEqualTo(100);
        assertThat(out.toByteArray()).isEqualTo(data);

        lifecycle.trash(file.getId(), ownerId);
        assertThatThrownBy(() -> downloads.download(file.getId(), ownerId, new ByteArrayOutputStream()))
                .isInstanceOf(NotFoundException.class);
        assertThat(usedBytes()).isEqualTo(100);

        StoredFile restored = lifecycle.restore(file.getId(), ownerId);
        assertThat(restored.getFolderId()).isEqualTo(folderId);

        String firstLocator = chunkIndex.listOrdered(file.getId()).get(0).locator();
        LifecycleManager.DeleteReport report = lifecycle.permanentDelete(file.getId(), ownerId);

        assertThat(report.isClean()).isTrue();
        assertThat(report.chunksDeleted()).isEqualTo(7);
        assertThat(fileRepository.findById(file.getId())).isEmpty();
        assertThat(chunkIndex.listAll(file.getId())).isEmpty();
        assertThat(usedBytes()).isZero();
        assertThatThrownBy(() -> backend.get(firstLocator)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void shareLinkDownloadsAreCounted() {
        byte[] data = content(40);
        StoredFile file = uploads.upload(ownerId, "shared.bin", null, null, null, new ByteArrayInputStream(data));
        ShareLink link = shares.create(ownerId, file.getId(), null, 1);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        downloads.downloadShared(link.getToken(), out);

        assertThat(out.toByteArray()).isEqualTo(data);
        assertThat(shareLinkRepository.findById(link.getId()).orElseThrow().getDownloadCount()).isEqualTo(1);
        assertThatThrownBy(() -> downloads.downloadShared(link.getToken(), new ByteArrayOutputStream()))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void uploadOverQuotaStoresNothing() {
        Account account = accountRepository.findById(ownerId).orElseThrow();
        account.setStorageQuotaBytes(50);
        accountRepository.saveAndFlush(account);

        assertThatThrownBy(() -> uploads.upload(ownerId, "big.bin", null, null, null,
                new ByteArrayInputStream(content(80))))
                .isInstanceOf(QuotaExceededException.class);

        assertThat(usedBytes()).isZero();
        assertThat(fileRepository.findByOwnerIdAndFolderIdIsNullAndTrashedFalseOrderByNameAsc(ownerId)).isEmpty();
    }

    @Test
    void emptyFileRoundTrips() {
        StoredFile file = uploads.upload(ownerId, "empty.txt", null, "text/plain", null,
                new ByteArrayInputStream(new byte[0]));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertThat(downloads.download(file.getId(), ownerId, out)).isZero();
        assertThat(file.getChunkCount()).isZero();
        assertThat(out.size()).isZero();
    }
}
