package com.studio.access.dto.response;

public record VerifyQrResponse(
    String status,
    String message,
    String kind,
    boolean triggerAttempted
) {}
