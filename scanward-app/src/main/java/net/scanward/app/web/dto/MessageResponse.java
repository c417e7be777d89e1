package net.scanward.app.web.dto;

public record MessageResponse(String message) {}
