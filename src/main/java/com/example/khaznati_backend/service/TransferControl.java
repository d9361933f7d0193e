package com.example.khaznati_backend.service;

/**
 * Cancellation flag shared between the owner of a transfer and the dispatcher running it.
 */
public class TransferControl {
    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
