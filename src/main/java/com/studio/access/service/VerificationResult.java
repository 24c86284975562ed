package com.studio.access.service;

/**
 * A successful verification. {@code triggerConfirmed} is false when the door-control
 * event could not be recorded; the verification itself still stands.
 */
public record VerificationResult(
    RecordKind kind,
    String recordId,
    boolean triggerAttempted,
    boolean triggerConfirmed
) {}
