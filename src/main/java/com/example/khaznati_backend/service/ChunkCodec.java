package com.example.khaznati_backend.service;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Splits byte streams into fixed-size chunks and writes ordered chunks back out. Stateless.
 */
public final class ChunkCodec {

    private ChunkCodec() {
    }

    @FunctionalInterface
    interface StreamOpener {
        InputStream open() throws IOException;
    }

    /**
     * Lazily splits a stream that can only be read once. Iterating the result a second time fails.
     */
    public static ChunkSequence split(InputStream source, int chunkSizeBytes) {
        requirePositive(chunkSizeBytes);
        if (source == null) {
            throw new IllegalArgumentException("source is required");
        }
        return new ChunkSequence(() -> source, false, chunkSizeBytes);
    }

    /**
     * Lazily splits a file. Every iteration reopens it, so the sequence can be walked again (e.g. to retry).
     */
    public static ChunkSequence split(Path file, int chunkSizeBytes) {
        requirePositive(chunkSizeBytes);
        if (file == null) {
            throw new IllegalArgumentException("file is required");
        }
        return new ChunkSequence(() -> Files.newInputStream(file), true, chunkSizeBytes);
    }

    /** Writes chunks in list order. No gap detection, no de-duplication. */
    public static void join(List<byte[]> orderedChunks, OutputStream sink) throws IOException {
        for (byte[] chunk : orderedChunks) {
            sink.write(chunk);
        }
        sink.flush();
    }

    public static int expectedChunkCount(long sizeBytes, int chunkSizeBytes) {
        requirePositive(chunkSizeBytes);
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be >= 0");
        }
        return Math.toIntExact((sizeBytes + chunkSizeBytes - 1) / chunkSizeBytes);
    }

    private static void requirePositive(int chunkSizeBytes) {
        if (chunkSizeBytes <= 0) {
            throw new IllegalArgumentException("chunkSizeBytes must be > 0, got " + chunkSizeBytes);
        }
    }

    public static final class ChunkSequence implements Iterable<byte[]> {
        private final StreamOpener opener;
        private final boolean restartable;
        private final int chunkSizeBytes;
        private boolean consumed;

        private ChunkSequence(StreamOpener opener, boolean restartable, int chunkSizeBytes) {
            this.opener = opener;
            this.restartable = restartable;
            this.chunkSizeBytes = chunkSizeBytes;
        }

        public int chunkSizeBytes() {
            return chunkSizeBytes;
        }

        public boolean isRestartable() {
            return restartable;
        }

        @Override
        public synchronized Cursor iterator() {
            if (consumed && !restartable) {
                throw new IllegalStateException("Stream-backed chunk sequence can only be iterated once");
            }
            consumed = true;
            try {
                return new Cursor(opener.open(), chunkSizeBytes);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot open chunk source", e);
            }
        }
    }

    /**
     * Iterator over one pass of a {@link ChunkSequence}. Closes its stream once exhausted; close it yourself
     * when abandoning a pass early.
     */
    public static final class Cursor implements Iterator<byte[]>, Closeable {
        private final InputStream in;
        private final int chunkSizeBytes;
        private byte[] next;
        private boolean done;

        private Cursor(InputStream in, int chunkSizeBytes) {
            this.in = in;
            this.chunkSizeBytes = chunkSizeBytes;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !done) {
                next = readChunk();
                if (next == null) {
                    done = true;
                    closeSource();
                }
            }
            return next != null;
        }

        @Override
        public byte[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            byte[] chunk = next;
            next = null;
            return chunk;
        }

        @Override
        public void close() throws IOException {
            done = true;
            next = null;
            in.close();
        }

        private byte[] readChunk() {
            try {
                byte[] buffer = in.readNBytes(chunkSizeBytes);
                if (buffer.length == 0) {
                    return null;
                }
                return buffer;
            } catch (IOException e) {
                throw new UncheckedIOException("Reading chunk source failed", e);
            }
        }

        private void closeSource() {
            try {
                in.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Closing chunk source failed", e);
            }
        }
    }
}
