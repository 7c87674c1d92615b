package com.feedwatch.api.dto.response;

public record CleanupResponse(int removed, int daysToKeep) {}
