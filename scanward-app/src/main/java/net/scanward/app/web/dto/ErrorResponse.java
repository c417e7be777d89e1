package net.scanward.app.web.dto;

public record ErrorResponse(String error, String message, boolean retryable) {}
