package com.example.khaznati_backend.service;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderedChunkWriterTest {

    @Test
    void holdsBackChunksUntilTheGapIsFilled() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        OrderedChunkWriter writer = new OrderedChunkWriter(out);

        writer.accept(2, new byte[]{5, 6});
        writer.accept(1, new byte[]{3, 4});
        assertThat(out.size()).isZero();
        assertThat(writer.pendingCount()).isEqualTo(2);

        writer.accept(0, new byte[]{1, 2});

        assertThat(out.toByteArray()).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(writer.chunksWritten()).isEqualTo(3);
        assertThat(writer.bytesWritten()).isEqualTo(6);
        assertThat(writer.pendingCount()).isZero();
    }

    @Test
    void rejectsDuplicateChunk() throws Exception {
        OrderedChunkWriter writer = new OrderedChunkWriter(new ByteArrayOutputStream());
        writer.accept(0, new byte[]{1});

        assertThatThrownBy(() -> writer.accept(0, new byte[]{1})).isInstanceOf(IllegalStateException.class);
    }
}
