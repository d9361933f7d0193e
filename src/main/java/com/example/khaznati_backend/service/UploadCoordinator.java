package com.example.khaznati_backend.service;

import com.example.khaznati_backend.config.StorageProperties;
import com.example.khaznati_backend.exception.BackendUnavailableException;
import com.example.khaznati_backend.exception.ConflictException;
import com.example.khaznati_backend.exception.IncompleteException;
import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.exception.StorageException;
import com.example.khaznati_backend.exception.TransferCancelledException;
import com.example.khaznati_backend.exception.TransferTimeoutException;
import com.example.khaznati_backend.model.StoredFile;
import com.example.khaznati_backend.service.Interfaces.ObjectBackend;
import com.example.khaznati_backend.util.Digests;
import com.example.khaznati_backend.util.NameRules;
import com.example.khaznati_backend.util.UploadState;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Drives uploads from raw bytes to a finalized {@link StoredFile}.
 * <p>
 * {@code INITIATED -> SPLITTING -> UPLOADING -> FINALIZING -> COMPLETED}, with {@code FAILED} reachable from
 * every non-terminal state. Content is staged to a temp file first so its size and checksum are known before
 * any chunk reaches the backend. A failed upload leaves no file row and no usage behind; chunks that already
 * reached the backend are deleted best-effort.
 */
@Service
public class UploadCoordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(UploadCoordinator.class);
    private static final Pattern SHA256_HEX = Pattern.compile("^[0-9a-f]{64}$");

    private final ObjectBackend backend;
    private final ChunkTransferPolicy transferPolicy;
    private final UploadFinalizer finalizer;
    private final AccountService accountService;
    private final FolderService folderService;
    private final StorageProperties props;
    private final Executor pipelineExecutor;
    private final Clock clock;

    private final Map<UUID, UploadSession> sessions = new ConcurrentHashMap<>();

    public UploadCoordinator(ObjectBackend backend,
                             ChunkTransferPolicy transferPolicy,
                             UploadFinalizer finalizer,
                             AccountService accountService,
                             FolderService folderService,
                             StorageProperties props,
                             @Qualifier("uploadPipelineExecutor") Executor pipelineExecutor,
                             Clock clock) {
        this.backend = backend;
        this.transferPolicy = transferPolicy;
        this.finalizer = finalizer;
        this.accountService = accountService;
        this.folderService = folderService;
        this.props = props;
        this.pipelineExecutor = pipelineExecutor;
        this.clock = clock;
    }

    /**
     * Registers an upload.
     *
     * @param sizeHint expected size in bytes, checked against the quota right away when given
     * @param checksum expected SHA-256 (hex) of the content, verified on receive when given
     */
    public UploadHandle initUpload(UUID ownerId, String name, @Nullable Long sizeHint, @Nullable UUID folderId,
                                   @Nullable String mimeType, @Nullable String checksum) {
        String cleanName = NameRules.requireValidName(name, "File");
        if (sizeHint != null && sizeHint < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
        String expectedChecksum = normalizeChecksum(checksum);
        accountService.getOwner(ownerId);
        if (folderId != null && !folderService.folderExists(folderId, ownerId)) {
            throw new NotFoundException("Folder not found: " + folderId);
        }
        if (sizeHint != null) {
            accountService.checkQuota(ownerId, sizeHint);
        }

        UploadSession session = new UploadSession(UUID.randomUUID(), ownerId, cleanName, folderId,
                mimeType, expectedChecksum, sizeHint, clock.instant());
        sessions.put(session.getId(), session);
        LOGGER.info("UPLOAD INIT handle={} owner={} name={} sizeHint={} folder={}",
                session.getId(), ownerId, cleanName, sizeHint, folderId);
        return new UploadHandle(session.getId());
    }

    /**
     * Stages the content and starts the pipeline in the background. Quota and checksum problems surface here,
     * before any chunk is stored.
     */
    public UploadState receive(UploadHandle handle, InputStream content) {
        UploadSession session = require(handle);
        session.markReceived();
        Path staged = null;
        try {
            Staged upload = stage(content);
            staged = upload.path();
            long size = Files.size(staged);
            String sha256 = upload.sha256();

            if (session.getSizeHint() != null && session.getSizeHint() != size) {
                throw new IncompleteException("Received %d bytes but %d were announced".formatted(size, session.getSizeHint()));
            }
            if (session.getExpectedChecksum() != null && !session.getExpectedChecksum().equals(sha256)) {
                throw new IncompleteException("Checksum mismatch for upload " + session.getId());
            }
            accountService.checkQuota(session.getOwnerId(), size);
            if (session.control().isCancelled()) {
                throw new TransferCancelledException("Upload " + session.getId() + " was cancelled");
            }
            session.setStaged(size, ChunkCodec.expectedChunkCount(size, props.getChunkSizeBytes()), sha256);
            LOGGER.info("UPLOAD RECEIVED handle={} size={} chunks={}", session.getId(), size, session.getExpectedChunks());

            Path file = staged;
            pipelineExecutor.execute(() -> runPipeline(session, file));
            return session.getState();
        } catch (RejectedExecutionException e) {
            deleteStaged(staged);
            BackendUnavailableException busy = new BackendUnavailableException("Upload pipeline is saturated", e, true);
            failAndCleanup(session, busy);
            throw busy;
        } catch (IOException e) {
            deleteStaged(staged);
            StorageException failure = new StorageException("Staging upload " + session.getId() + " failed", e);
            failAndCleanup(session, failure);
            throw failure;
        } catch (RuntimeException e) {
            deleteStaged(staged);
            failAndCleanup(session, e);
            throw e;
        }
    }

    /** Waits for the upload to reach a terminal state and returns the file, or rethrows the failure. */
    public StoredFile completeUpload(UploadHandle handle) {
        UploadSession session = require(handle);
        if (!session.isReceived() && !session.getState().isTerminal()) {
            throw new ConflictException("Upload " + handle.id() + " has not received any content");
        }
        try {
            StoredFile file = session.completion().get(props.getUploadTimeout().toMillis(), TimeUnit.MILLISECONDS);
            sessions.remove(session.getId());
            return file;
        } catch (ExecutionException e) {
            sessions.remove(session.getId());
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new StorageException("Upload " + handle.id() + " failed", cause);
        } catch (TimeoutException e) {
            throw new TransferTimeoutException("Upload " + handle.id() + " did not complete within "
                    + props.getUploadTimeout().toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferCancelledException("Interrupted while waiting for upload " + handle.id());
        }
    }

    /** Init, receive and complete in one call, for callers that have the whole stream at hand. */
    public StoredFile upload(UUID ownerId, String name, @Nullable UUID folderId, @Nullable String mimeType,
                             @Nullable String checksum, InputStream content) {
        UploadHandle handle = initUpload(ownerId, name, null, folderId, mimeType, checksum);
        receive(handle, content);
        return completeUpload(handle);
    }

    public UUID ownerOf(UploadHandle handle) {
        return require(handle).getOwnerId();
    }

    public UploadStatus status(UploadHandle handle) {
        UploadSession session = require(handle);
        StoredFile file = session.completion().isDone() && !session.completion().isCompletedExceptionally()
                ? session.completion().getNow(null) : null;
        Throwable failure = session.getFailure();
        return new UploadStatus(
                session.getId(),
                session.getState(),
                session.storedChunkCount(),
                session.getExpectedChunks() < 0 ? null : session.getExpectedChunks(),
                session.getSizeBytes() < 0 ? null : session.getSizeBytes(),
                file == null ? null : file.getId(),
                failure == null ? null : failure.getMessage());
    }

    /**
     * Stops further chunk dispatches. Chunks already in flight finish, then the upload fails and its stored
     * chunks are removed. No effect on finished uploads.
     */
    public UploadState cancel(UploadHandle handle) {
        UploadSession session = require(handle);
        session.control().cancel();
        if (!session.isReceived()) {
            failAndCleanup(session, new TransferCancelledException("Upload " + session.getId() + " was cancelled"));
        }
        LOGGER.info("UPLOAD CANCEL handle={} state={}", session.getId(), session.getState());
        return session.getState();
    }

    /** Drops finished sessions nobody collected and fails sessions that never received content. */
    @Scheduled(fixedDelayString = "${storage.session-sweep-millis:60000}")
    public void sweepStaleSessions() {
        Instant cutoff = clock.instant().minus(props.getSessionTtl());
        sessions.values().removeIf(session -> {
            if (!session.getLastTransitionAt().isBefore(cutoff)) {
                return false;
            }
            if (session.getState().isTerminal()) {
                return true;
            }
            if (!session.isReceived()) {
                failAndCleanup(session, new TransferTimeoutException("Upload " + session.getId() + " never received content"));
                return true;
            }
            return false;
        });
    }

    int activeSessions() {
        return sessions.size();
    }

    private void runPipeline(UploadSession session, Path staged) {
        long t0 = System.nanoTime();
        try {
            session.transition(UploadState.SPLITTING, clock.instant());
            int expected = session.getExpectedChunks();
            if (expected > 0) {
                session.transition(UploadState.UPLOADING, clock.instant());
                uploadChunks(session, staged);
            }
            if (session.control().isCancelled()) {
                throw new TransferCancelledException("Upload " + session.getId() + " was cancelled");
            }
            session.transition(UploadState.FINALIZING, clock.instant());
            verifyStored(session);
            StoredFile file = finalizer.finalizeUpload(session, backend.name());
            session.transition(UploadState.COMPLETED, clock.instant());
            session.completion().complete(file);
            LOGGER.info("UPLOAD DONE handle={} file={} size={} chunks={} in={}ms", session.getId(), file.getId(),
                    session.getSizeBytes(), expected, (System.nanoTime() - t0) / 1_000_000);
        } catch (RuntimeException e) {
            failAndCleanup(session, e);
        } finally {
            deleteStaged(staged);
        }
    }

    private void uploadChunks(UploadSession session, Path staged) {
        ChunkCodec.Cursor cursor = ChunkCodec.split(staged, props.getChunkSizeBytes()).iterator();
        try {
            transferPolicy.run(
                    "upload handle=" + session.getId(),
                    indexed(cursor),
                    chunk -> backend.put(chunk.payload()),
                    (chunk, locator) -> {
                        if (!session.recordChunk(chunk.index(), locator, chunk.payload().length)) {
                            deleteLateChunk(session, chunk.index(), locator);
                        }
                    },
                    session.control(),
                    clock.instant().plus(props.getUploadTimeout()));
        } finally {
            try {
                cursor.close();
            } catch (IOException e) {
                LOGGER.warn("UPLOAD staged file close failed handle={} err={}", session.getId(), e.toString());
            }
        }
    }

    private void verifyStored(UploadSession session) {
        long storedBytes = session.storedChunks().stream().mapToLong(UploadSession.StoredChunk::size).sum();
        if (session.storedChunkCount() != session.getExpectedChunks() || storedBytes != session.getSizeBytes()) {
            throw new IncompleteException("Upload %s stored %d chunks / %d bytes, expected %d / %d".formatted(
                    session.getId(), session.storedChunkCount(), storedBytes, session.getExpectedChunks(), session.getSizeBytes()));
        }
    }

    private void failAndCleanup(UploadSession session, Throwable cause) {
        if (!session.fail(cause, clock.instant())) {
            return;
        }
        LOGGER.error("UPLOAD FAIL handle={} owner={} stored={} err={}",
                session.getId(), session.getOwnerId(), session.storedChunkCount(), cause.toString());
        for (UploadSession.StoredChunk chunk : session.storedChunks()) {
            try {
                backend.delete(chunk.locator());
            } catch (RuntimeException e) {
                LOGGER.warn("UPLOAD CLEANUP chunk delete failed handle={} seq={} locator={} err={}",
                        session.getId(), chunk.sequenceIndex(), chunk.locator(), e.toString());
            }
        }
        session.completion().completeExceptionally(cause);
    }

    // a put that outlived the failure of its upload; the failure cleanup has already run without it
    private void deleteLateChunk(UploadSession session, int sequenceIndex, String locator) {
        try {
            backend.delete(locator);
            LOGGER.warn("UPLOAD LATE CHUNK removed handle={} seq={} locator={}", session.getId(), sequenceIndex, locator);
        } catch (RuntimeException e) {
            LOGGER.warn("UPLOAD CLEANUP chunk delete failed handle={} seq={} locator={} err={}",
                    session.getId(), sequenceIndex, locator, e.toString());
        }
    }

    private Staged stage(InputStream content) throws IOException {
        Path tmp = props.getTempDir() == null || props.getTempDir().isBlank()
                ? Files.createTempFile("upload-", ".part")
                : Files.createTempFile(Files.createDirectories(Path.of(props.getTempDir())), "upload-", ".part");
        MessageDigest digest = Digests.sha256();
        try (InputStream in = new DigestInputStream(content, digest); OutputStream out = Files.newOutputStream(tmp)) {
            in.transferTo(out);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        return new Staged(tmp, Digests.hex(digest));
    }

    private void deleteStaged(Path staged) {
        if (staged == null) {
            return;
        }
        try {
            Files.deleteIfExists(staged);
        } catch (IOException e) {
            LOGGER.warn("UPLOAD staged file delete failed path={} err={}", staged, e.toString());
        }
    }

    private UploadSession require(UploadHandle handle) {
        UploadSession session = handle == null ? null : sessions.get(handle.id());
        if (session == null) {
            throw new NotFoundException("Upload not found: " + (handle == null ? null : handle.id()));
        }
        return session;
    }

    private static String normalizeChecksum(String checksum) {
        if (checksum == null || checksum.isBlank()) {
            return null;
        }
        String normalized = checksum.trim().toLowerCase(Locale.ROOT);
        if (!SHA256_HEX.matcher(normalized).matches()) {
            throw new IllegalArgumentException("checksum must be a hex encoded SHA-256");
        }
        return normalized;
    }

    private static Iterator<IndexedChunk> indexed(Iterator<byte[]> chunks) {
        return new Iterator<>() {
            private int next;

            @Override
            public boolean hasNext() {
                return chunks.hasNext();
            }

            @Override
            public IndexedChunk next() {
                return new IndexedChunk(next++, chunks.next());
            }
        };
    }

    private record IndexedChunk(int index, byte[] payload) {
    }

    private record Staged(Path path, String sha256) {
    }

    public record UploadStatus(UUID handle, UploadState state, int chunksStored, Integer expectedChunks,
                               Long sizeBytes, UUID fileId, String error) {
    }
}
