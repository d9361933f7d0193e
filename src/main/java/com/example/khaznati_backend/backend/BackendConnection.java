package com.example.khaznati_backend.backend;

import com.example.khaznati_backend.exception.BackendUnavailableException;
import com.example.khaznati_backend.exception.StorageException;
import com.example.khaznati_backend.exception.TransferTimeoutException;
import com.example.khaznati_backend.util.ConnectionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Lazily established backend connection. The first caller runs the connect action; everyone arriving
 * while it runs waits on the same future instead of starting a second attempt. A failed attempt drops
 * back to {@link ConnectionState#DISCONNECTED} so the next caller tries again.
 */
public class BackendConnection {
    private static final Logger LOGGER = LoggerFactory.getLogger(BackendConnection.class);

    @FunctionalInterface
    public interface Connector {
        void connect();
    }

    private final String backendName;
    private final Connector connector;
    private final Duration timeout;

    private final Object lock = new Object();
    private CompletableFuture<Void> inFlight;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    public BackendConnection(String backendName, Connector connector, Duration timeout) {
        this.backendName = backendName;
        this.connector = connector;
        this.timeout = timeout;
    }

    public void ensureConnected() {
        if (state == ConnectionState.CONNECTED) {
            return;
        }
        CompletableFuture<Void> attempt;
        boolean owner = false;
        synchronized (lock) {
            if (state == ConnectionState.CONNECTED) {
                return;
            }
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                state = ConnectionState.CONNECTING;
                owner = true;
            }
            attempt = inFlight;
        }
        if (owner) {
            runAttempt(attempt);
        }
        await(attempt);
    }

    /** Forgets the current connection, e.g. after the backend rejected our credentials. */
    public void reset() {
        synchronized (lock) {
            if (state == ConnectionState.CONNECTED) {
                state = ConnectionState.DISCONNECTED;
                LOGGER.info("Backend connection reset backend={}", backendName);
            }
        }
    }

    public ConnectionState state() {
        return state;
    }

    private void runAttempt(CompletableFuture<Void> attempt) {
        long t0 = System.nanoTime();
        LOGGER.info("Backend connect start backend={}", backendName);
        try {
            connector.connect();
            synchronized (lock) {
                state = ConnectionState.CONNECTED;
                inFlight = null;
            }
            LOGGER.info("Backend connect ok backend={} in={}ms", backendName, (System.nanoTime() - t0) / 1_000_000);
            attempt.complete(null);
        } catch (RuntimeException e) {
            synchronized (lock) {
                state = ConnectionState.DISCONNECTED;
                inFlight = null;
            }
            LOGGER.warn("Backend connect failed backend={} err={}", backendName, e.toString());
            attempt.completeExceptionally(e);
        }
    }

    private void await(CompletableFuture<Void> attempt) {
        try {
            attempt.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StorageException storageException) {
                throw storageException;
            }
            throw new BackendUnavailableException("Connect to " + backendName + " failed", cause);
        } catch (TimeoutException e) {
            throw new TransferTimeoutException("Connect to " + backendName + " did not finish in " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException("Interrupted while connecting to " + backendName, e);
        }
    }
}
