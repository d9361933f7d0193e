package com.example.khaznati_backend.service;

import com.example.khaznati_backend.config.StorageProperties;
import com.example.khaznati_backend.exception.BackendUnavailableException;
import com.example.khaznati_backend.exception.IncompleteException;
import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.model.Account;
import com.example.khaznati_backend.model.ShareLink;
import com.example.khaznati_backend.model.StoredFile;
import com.example.khaznati_backend.service.Interfaces.ChunkIndex;
import com.example.khaznati_backend.support.InMemoryObjectBackend;
import com.example.khaznati_backend.support.ManualClock;
import com.example.khaznati_backend.util.Digests;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DownloadCoordinatorTest {

    private static final int CHUNK = 8;

    @Mock
    private FileService fileService;
    @Mock
    private ShareLinkService shareLinkService;
    @Mock
    private ChunkIndex chunkIndex;

    @TempDir
    Path tmp;

    private ExecutorService executor;
    private InMemoryObjectBackend backend;
    private DownloadCoordinator coordinator;
    private Account owner;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        ManualClock clock = new ManualClock(Instant.parse("2026-03-01T10:00:00Z"));
        backend = new InMemoryObjectBackend("memory", clock);
        StorageProperties props = new StorageProperties();
        props.setTempDir(tmp.toString());
        ChunkTransferPolicy policy = new ChunkTransferPolicy(executor, 3, 3, 5, clock, clock::advance);
        coordinator = new DownloadCoordinator(fileService, shareLinkService, chunkIndex, backend, policy, props, clock);
        owner = new Account("user-1", "User One", -1);
        owner.setId(UUID.randomUUID());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private StoredFile storedFile(byte[] data) {
        StoredFile file = new StoredFile(owner, "movie.mkv", data.length);
        file.setId(UUID.randomUUID());
        file.setBackend("memory");
        MessageDigest digest = Digests.sha256();
        digest.update(data);
        file.setChecksum(Digests.hex(digest));
        return file;
    }

    private List<ChunkIndex.ChunkRecord> seedChunks(StoredFile file, byte[] data) {
        List<ChunkIndex.ChunkRecord> records = new ArrayList<>();
        for (int seq = 0, offset = 0; offset < data.length; seq++, offset += CHUNK) {
            byte[] chunk = Arrays.copyOfRange(data, offset, Math.min(data.length, offset + CHUNK));
            records.add(new ChunkIndex.ChunkRecord(file.getId(), seq, backend.seed(chunk), chunk.length));
        }
        return records;
    }

    private static byte[] content(int size) {
        byte[] data = new byte[size];
        for (int i = 0; i < size; i++) {
            data[i] = (byte) (i * 7);
        }
        return data;
    }

    @Test
    void reassemblesChunksInSequenceOrderWhateverOrderTheyArrive() {
        byte[] data = content(60);
        StoredFile file = storedFile(data);
        List<ChunkIndex.ChunkRecord> records = seedChunks(file, data);
        String slowLocator = records.get(0).locator();
        backend.onGet(locator -> {
            if (locator.equals(slowLocator)) {
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });
        when(fileService.getActive(file.getId(), owner.getId())).thenReturn(file);
        when(chunkIndex.listOrdered(file.getId())).thenReturn(records);

        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        long written = coordinator.download(file.getId(), owner.getId(), sink);

        assertThat(written).isEqualTo(60);
        assertThat(sink.toByteArray()).isEqualTo(data);
        assertThat(backend.getCalls()).hasSize(8);
    }

    @Test
    void missingChunkRecordsMeanNotFound() {
        StoredFile file = storedFile(content(20));
        when(fileService.getActive(file.getId(), owner.getId())).thenReturn(file);
        when(chunkIndex.listOrdered(file.getId())).thenReturn(List.of());

        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        assertThatThrownBy(() -> coordinator.download(file.getId(), owner.getId(), sink))
                .isInstanceOf(NotFoundException.class);
        assertThat(sink.size()).isZero();
    }

    @Test
    void chunkGapSurfacesAsIncomplete() {
        StoredFile file = storedFile(content(20));
        when(fileService.getActive(file.getId(), owner.getId())).thenReturn(file);
        when(chunkIndex.listOrdered(file.getId())).thenThrow(new IncompleteException("gap at 1"));

        assertThatThrownBy(() -> coordinator.download(file.getId(), owner.getId(), new ByteArrayOutputStream()))
                .isInstanceOf(IncompleteException.class);
        assertThat(backend.getCalls()).isEmpty();
    }

    @Test
    void chunkSizesThatDoNotAddUpAreRejectedBeforeFetching() {
        byte[] data = content(20);
        StoredFile file = storedFile(data);
        List<ChunkIndex.ChunkRecord> records = new ArrayList<>(seedChunks(file, data));
        records.remove(records.size() - 1);
        when(fileService.getActive(file.getId(), owner.getId())).thenReturn(file);
        when(chunkIndex.listOrdered(file.getId())).thenReturn(records);

        assertThatThrownBy(() -> coordinator.download(file.getId(), owner.getId(), new ByteArrayOutputStream()))
                .isInstanceOf(IncompleteException.class);
        assertThat(backend.getCalls()).isEmpty();
    }

    @Test
    void lostBackendObjectFailsWithoutPartialOutput() {
        byte[] data = content(40);
        StoredFile file = storedFile(data);
        List<ChunkIndex.ChunkRecord> records = seedChunks(file, data);
        backend.objects().remove(records.get(3).locator());
        when(fileService.getActive(file.getId(), owner.getId())).thenReturn(file);
        when(chunkIndex.listOrdered(file.getId())).thenReturn(records);

        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        assertThatThrownBy(() -> coordinator.download(file.getId(), owner.getId(), sink))
                .isInstanceOf(NotFoundException.class);
        assertThat(sink.size()).isZero();
    }

    @Test
    void checksumMismatchIsReported() {
        byte[] data = content(16);
        StoredFile file = storedFile(data);
        file.setChecksum("f".repeat(64));
        when(fileService.getActive(file.getId(), owner.getId())).thenReturn(file);
        when(chunkIndex.listOrdered(file.getId())).thenReturn(seedChunks(file, data));

        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        assertThatThrownBy(() -> coordinator.download(file.getId(), owner.getId(), sink))
                .isInstanceOf(IncompleteException.class)
                .hasMessageContaining("Checksum");
        assertThat(sink.size()).isZero();
    }

    @Test
    void fileOnAnotherBackendIsUnavailable() {
        byte[] data = content(16);
        StoredFile file = storedFile(data);
        file.setBackend("telegram");
        when(fileService.getActive(file.getId(), owner.getId())).thenReturn(file);
        when(chunkIndex.listOrdered(file.getId())).thenReturn(seedChunks(file, data));

        assertThatThrownBy(() -> coordinator.download(file.getId(), owner.getId(), new ByteArrayOutputStream()))
                .isInstanceOf(BackendUnavailableException.class);
    }

    @Test
    void emptyFileDownloadsAsNothing() {
        StoredFile file = storedFile(new byte[0]);
        when(fileService.getActive(file.getId(), owner.getId())).thenReturn(file);
        when(chunkIndex.listOrdered(file.getId())).thenReturn(List.of());

        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        assertThat(coordinator.download(file.getId(), owner.getId(), sink)).isZero();
        assertThat(sink.size()).isZero();
    }

    @Test
    void sharedDownloadTakesOneSlotAndKeepsIt() throws Exception {
        byte[] data = content(24);
        StoredFile file = storedFile(data);
        ShareLink link = new ShareLink(file, "tok");
        when(shareLinkService.resolve("tok")).thenReturn(link);
        when(chunkIndex.listOrdered(file.getId())).thenReturn(seedChunks(file, data));

        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        coordinator.downloadShared("tok", sink);

        assertThat(sink.toByteArray()).isEqualTo(data);
        verify(shareLinkService).registerDownload(link);
        verify(shareLinkService, never()).releaseDownload(link);
        try (var leftovers = Files.list(tmp)) {
            assertThat(leftovers).isEmpty();
        }
    }

    @Test
    void failedSharedDownloadGivesItsSlotBack() {
        byte[] data = content(24);
        StoredFile file = storedFile(data);
        file.setChecksum("0".repeat(64));
        ShareLink link = new ShareLink(file, "tok");
        when(shareLinkService.resolve("tok")).thenReturn(link);
        when(chunkIndex.listOrdered(file.getId())).thenReturn(seedChunks(file, data));

        assertThatThrownBy(() -> coordinator.downloadShared("tok", new ByteArrayOutputStream()))
                .isInstanceOf(IncompleteException.class);
        InOrder order = inOrder(shareLinkService);
        order.verify(shareLinkService).registerDownload(link);
        order.verify(shareLinkService).releaseDownload(link);
    }

    @Test
    void sharedDownloadWithoutASlotMovesNoBytes() {
        byte[] data = content(24);
        StoredFile file = storedFile(data);
        ShareLink link = new ShareLink(file, "tok");
        when(shareLinkService.resolve("tok")).thenReturn(link);
        doThrow(new NotFoundException("Share link not found")).when(shareLinkService).registerDownload(link);

        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        assertThatThrownBy(() -> coordinator.downloadShared("tok", sink))
                .isInstanceOf(NotFoundException.class);
        assertThat(sink.size()).isZero();
        assertThat(backend.getCalls()).isEmpty();
        verify(shareLinkService, never()).releaseDownload(link);
    }
}
