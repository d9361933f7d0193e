package com.example.khaznati_backend.dto.web;

public record EmptyTrashResponse(int removed) {
}
