package com.studio.access.controller;

import com.studio.access.dto.request.VerifyQrRequest;
import com.studio.access.dto.response.VerifyQrResponse;
import com.studio.access.mapper.VerificationMapper;
import com.studio.access.service.VerificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Verification", description = "Single-use QR secret verification for the door scanner")
public class VerificationController {

    private final VerificationService verificationService;

    @PostMapping("/verify-qr")
    @Operation(summary = "Verify a QR secret", description = "Checks the secret against reservations, "
        + "then temporary access grants. A valid secret is consumed and a door-open event is requested. "
        + "The door event outcome does not change the response.")
    @ApiResponse(responseCode = "200", description = "Secret verified and consumed")
    @ApiResponse(responseCode = "400", description = "Missing or malformed qrSecret")
    @ApiResponse(responseCode = "404", description = "Invalid or already used QR code")
    @ApiResponse(responseCode = "500", description = "Record store unavailable or unexpected failure")
    public ResponseEntity<VerifyQrResponse> verify(@Valid @RequestBody VerifyQrRequest request) {
        return ResponseEntity.ok(VerificationMapper.toResponse(verificationService.verify(request.qrSecret())));
    }
}
