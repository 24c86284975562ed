package com.studio.access.mapper;

import com.studio.access.dto.response.VerifyQrResponse;
import com.studio.access.service.VerificationResult;

/**
 * Whether the door event was confirmed stays out of the response; the scanner sees the
 * same body either way.
 */
public final class VerificationMapper {

    public static final String STATUS_OK = "ok";

    private VerificationMapper() {}

    public static VerifyQrResponse toResponse(VerificationResult result) {
        return new VerifyQrResponse(
            STATUS_OK,
            "QR Code verified successfully (" + result.kind().label() + ").",
            result.kind().label(),
            result.triggerAttempted()
        );
    }
}
