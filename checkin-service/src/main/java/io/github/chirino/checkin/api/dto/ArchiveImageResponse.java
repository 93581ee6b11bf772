package io.github.chirino.checkin.api.dto;

public record ArchiveImageResponse(String path, String image) {}
