package com.example.khaznati_backend.service;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * Accepts chunks in completion order and writes them to the sink in sequence order. Not thread safe; the
 * transfer policy serializes completion callbacks.
 */
class OrderedChunkWriter {
    private final OutputStream sink;
    private final TreeMap<Integer, byte[]> pending = new TreeMap<>();
    private int nextIndex;
    private long bytesWritten;

    OrderedChunkWriter(OutputStream sink) {
        this.sink = sink;
    }

    void accept(int sequenceIndex, byte[] chunk) throws IOException {
        if (sequenceIndex < nextIndex || pending.containsKey(sequenceIndex)) {
            throw new IllegalStateException("Chunk " + sequenceIndex + " delivered twice");
        }
        pending.put(sequenceIndex, chunk);
        List<byte[]> run = new ArrayList<>();
        while (!pending.isEmpty() && pending.firstKey() == nextIndex) {
            byte[] next = pending.pollFirstEntry().getValue();
            run.add(next);
            bytesWritten += next.length;
            nextIndex++;
        }
        if (!run.isEmpty()) {
            ChunkCodec.join(run, sink);
        }
    }

    int chunksWritten() {
        return nextIndex;
    }

    long bytesWritten() {
        return bytesWritten;
    }

    int pendingCount() {
        return pending.size();
    }
}
