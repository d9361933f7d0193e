package com.example.khaznati_backend.backend;

import com.example.khaznati_backend.exception.BackendUnavailableException;
import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.exception.StorageException;
import com.example.khaznati_backend.service.Interfaces.ObjectBackend;
import com.example.khaznati_backend.util.ConnectionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.UUID;

/**
 * Filesystem object store: each chunk becomes one file below {@code baseDir/prefix}. Locators are the
 * object keys relative to the base directory.
 */
public class LocalObjectBackend implements ObjectBackend {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalObjectBackend.class);
    public static final String NAME = "local";

    private final Path baseDir;
    private final String prefix;
    private final Clock clock;
    private final BackendConnection connection;

    public LocalObjectBackend(Path baseDir, String prefix, Clock clock) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.prefix = prefix == null || prefix.isBlank() ? "chunks" : prefix.replaceAll("^/+|/+$", "");
        this.clock = clock;
        this.connection = new BackendConnection(NAME, this::createRoot, Duration.ofSeconds(30));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String put(byte[] payload) {
        connection.ensureConnected();
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC));
        String objectKey = "%s/%d/%02d/%s.bin".formatted(prefix, now.getYear(), now.getMonthValue(), UUID.randomUUID());
        Path target = safeResolve(objectKey);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, payload, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StorageException("Write failed: " + objectKey, e);
        }
        LOGGER.debug("Local chunk stored key={} bytes={}", objectKey, payload.length);
        return objectKey;
    }

    @Override
    public byte[] get(String locator) {
        connection.ensureConnected();
        Path source = safeResolve(locator);
        try {
            return Files.readAllBytes(source);
        } catch (NoSuchFileException e) {
            throw new NotFoundException("Chunk not found: " + locator, e);
        } catch (IOException e) {
            throw new StorageException("Read failed: " + locator, e);
        }
    }

    @Override
    public void delete(String locator) {
        connection.ensureConnected();
        Path target = safeResolve(locator);
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new StorageException("Delete failed: " + locator, e);
        }
    }

    @Override
    public ConnectionState connectionState() {
        return connection.state();
    }

    public Path root() {
        return baseDir;
    }

    private void createRoot() {
        try {
            Files.createDirectories(baseDir.resolve(prefix));
            LOGGER.info("LocalObjectBackend ready. base={}, prefix={}", baseDir, prefix);
        } catch (IOException e) {
            throw new BackendUnavailableException("Cannot create storage directory " + baseDir, e);
        }
    }

    private Path safeResolve(String objectKey) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new NotFoundException("Locator is blank");
        }
        String normalizedKey = objectKey.replace('\\', '/').replaceAll("^/+", "");
        Path p = baseDir.resolve(normalizedKey).normalize();
        if (!p.startsWith(baseDir)) {
            throw new NotFoundException("Invalid locator (path traversal?): " + objectKey);
        }
        return p;
    }
}
