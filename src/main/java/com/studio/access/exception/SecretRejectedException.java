package com.studio.access.exception;

import com.studio.access.service.RecordKind;

public class SecretRejectedException extends RuntimeException {

    private final RejectionReason reason;
    private final RecordKind kind;

    public SecretRejectedException(RejectionReason reason, RecordKind kind) {
        super("Invalid or already used QR Code");
        this.reason = reason;
        this.kind = kind;
    }

    public RejectionReason getReason() {
        return reason;
    }

    /** Kind of the matched record, or {@code null} when nothing matched. */
    public RecordKind getKind() {
        return kind;
    }
}
