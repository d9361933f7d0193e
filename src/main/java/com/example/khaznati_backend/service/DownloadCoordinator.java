package com.example.khaznati_backend.service;

import com.example.khaznati_backend.config.StorageProperties;
import com.example.khaznati_backend.exception.BackendUnavailableException;
import com.example.khaznati_backend.exception.IncompleteException;
import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.exception.StorageException;
import com.example.khaznati_backend.model.ShareLink;
import com.example.khaznati_backend.model.StoredFile;
import com.example.khaznati_backend.service.Interfaces.ChunkIndex;
import com.example.khaznati_backend.service.Interfaces.ObjectBackend;
import com.example.khaznati_backend.util.Digests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Reassembles files from their chunks. The file is rebuilt in a temp file and verified before the first
 * byte reaches the caller's sink, so a failed download never hands out a partial file.
 */
@Service
public class DownloadCoordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(DownloadCoordinator.class);

    private final FileService fileService;
    private final ShareLinkService shareLinkService;
    private final ChunkIndex chunkIndex;
    private final ObjectBackend backend;
    private final ChunkTransferPolicy transferPolicy;
    private final StorageProperties props;
    private final Clock clock;

    public DownloadCoordinator(FileService fileService, ShareLinkService shareLinkService, ChunkIndex chunkIndex,
                               ObjectBackend backend, ChunkTransferPolicy transferPolicy, StorageProperties props,
                               Clock clock) {
        this.fileService = fileService;
        this.shareLinkService = shareLinkService;
        this.chunkIndex = chunkIndex;
        this.backend = backend;
        this.transferPolicy = transferPolicy;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Writes the content of an owned, non-trashed file to {@code sink}.
     *
     * @return number of bytes written
     */
    public long download(UUID fileId, UUID ownerId, OutputStream sink) {
        return transfer(fileService.getActive(fileId, ownerId), sink);
    }

    /**
     * Same as {@link #download} for a share link token. The download slot is taken before any byte moves and
     * given back when the transfer fails, so a limited link is never served more often than allowed.
     */
    public long downloadShared(String token, OutputStream sink) {
        ShareLink link = shareLinkService.resolve(token);
        shareLinkService.registerDownload(link);
        try {
            return transfer(link.getFile(), sink);
        } catch (RuntimeException e) {
            shareLinkService.releaseDownload(link);
            throw e;
        }
    }

    private long transfer(StoredFile file, OutputStream sink) {
        UUID fileId = file.getId();
        List<ChunkIndex.ChunkRecord> records = chunkIndex.listOrdered(fileId);
        verifyLayout(file, records);
        if (file.getBackend() != null && !file.getBackend().equals(backend.name())) {
            throw new BackendUnavailableException("File " + fileId + " lives on backend '" + file.getBackend()
                    + "' but '" + backend.name() + "' is active");
        }

        long t0 = System.nanoTime();
        Path temp = null;
        try {
            temp = createTemp();
            MessageDigest digest = Digests.sha256();
            try (OutputStream out = new DigestOutputStream(Files.newOutputStream(temp), digest)) {
                OrderedChunkWriter writer = new OrderedChunkWriter(out);
                transferPolicy.run(
                        "download file=" + fileId,
                        records.iterator(),
                        record -> fetch(record),
                        (record, data) -> writer.accept(record.sequenceIndex(), data),
                        new TransferControl(),
                        clock.instant().plus(props.getDownloadTimeout()));
                if (writer.chunksWritten() != records.size()) {
                    throw new IncompleteException("Reassembled %d of %d chunks for file %s"
                            .formatted(writer.chunksWritten(), records.size(), fileId));
                }
            }

            long size = Files.size(temp);
            if (size != file.getSizeBytes()) {
                throw new IncompleteException("Reassembled %d bytes but file %s has %d".formatted(size, fileId, file.getSizeBytes()));
            }
            String checksum = Digests.hex(digest);
            if (file.getChecksum() != null && !file.getChecksum().equalsIgnoreCase(checksum)) {
                throw new IncompleteException("Checksum mismatch for file " + fileId);
            }

            Files.copy(temp, sink);
            sink.flush();
            LOGGER.info("DOWNLOAD DONE file={} size={} chunks={} in={}ms",
                    fileId, size, records.size(), (System.nanoTime() - t0) / 1_000_000);
            return size;
        } catch (IOException e) {
            throw new StorageException("Download of file " + fileId + " failed", e);
        } catch (RuntimeException e) {
            LOGGER.error("DOWNLOAD FAIL file={} err={}", fileId, e.toString());
            throw e;
        } finally {
            deleteTemp(temp);
        }
    }

    private byte[] fetch(ChunkIndex.ChunkRecord record) {
        byte[] data = backend.get(record.locator());
        if (data.length != record.size()) {
            throw new IncompleteException("Chunk %d of file %s has %d bytes, expected %d"
                    .formatted(record.sequenceIndex(), record.fileId(), data.length, record.size()));
        }
        return data;
    }

    private static void verifyLayout(StoredFile file, List<ChunkIndex.ChunkRecord> records) {
        if (records.isEmpty()) {
            if (file.getSizeBytes() > 0) {
                throw new NotFoundException("No chunks recorded for file " + file.getId());
            }
            return;
        }
        long total = records.stream().mapToLong(ChunkIndex.ChunkRecord::size).sum();
        if (total != file.getSizeBytes()) {
            throw new IncompleteException("Chunks of file %s add up to %d bytes, expected %d"
                    .formatted(file.getId(), total, file.getSizeBytes()));
        }
    }

    private Path createTemp() throws IOException {
        if (props.getTempDir() == null || props.getTempDir().isBlank()) {
            return Files.createTempFile("download-", ".part");
        }
        return Files.createTempFile(Files.createDirectories(Path.of(props.getTempDir())), "download-", ".part");
    }

    private void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOGGER.warn("DOWNLOAD temp delete failed path={} err={}", temp, e.toString());
        }
    }
}
