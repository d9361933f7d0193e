package com.example.khaznati_backend.backend;

import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.util.ConnectionState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalObjectBackendTest {

    @TempDir
    Path baseDir;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-15T08:00:00Z"), ZoneOffset.UTC);

    @Test
    void storesChunksUnderDatedKeys() {
        LocalObjectBackend backend = new LocalObjectBackend(baseDir, "/chunks/", clock);
        assertThat(backend.connectionState()).isEqualTo(ConnectionState.DISCONNECTED);

        String locator = backend.put(new byte[]{1, 2, 3});

        assertThat(locator).startsWith("chunks/2026/03/").endsWith(".bin");
        assertThat(Files.exists(baseDir.resolve(locator))).isTrue();
        assertThat(backend.get(locator)).containsExactly(1, 2, 3);
        assertThat(backend.connectionState()).isEqualTo(ConnectionState.CONNECTED);
    }

    @Test
    void eachPutGetsItsOwnLocator() {
        LocalObjectBackend backend = new LocalObjectBackend(baseDir, "chunks", clock);

        assertThat(backend.put(new byte[]{1})).isNotEqualTo(backend.put(new byte[]{1}));
    }

    @Test
    void deleteIsIdempotent() {
        LocalObjectBackend backend = new LocalObjectBackend(baseDir, "chunks", clock);
        String locator = backend.put(new byte[]{9});

        backend.delete(locator);

        assertThatCode(() -> backend.delete(locator)).doesNotThrowAnyException();
        assertThatThrownBy(() -> backend.get(locator)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void locatorsCannotEscapeTheBaseDirectory() {
        LocalObjectBackend backend = new LocalObjectBackend(baseDir.resolve("store"), "chunks", clock);

        assertThatThrownBy(() -> backend.get("../../etc/passwd")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> backend.get(" ")).isInstanceOf(NotFoundException.class);
    }
}
