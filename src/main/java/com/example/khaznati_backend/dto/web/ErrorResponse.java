package com.example.khaznati_backend.dto.web;

public record ErrorResponse(String error, String message) {
}
