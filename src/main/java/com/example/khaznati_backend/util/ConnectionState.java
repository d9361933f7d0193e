package com.example.khaznati_backend.util;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
