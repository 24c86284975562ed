package com.studio.access.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record VerifyQrRequest(

    @NotBlank(message = "qrSecret must not be blank")
    @Size(max = 255, message = "qrSecret must not exceed 255 characters")
    String qrSecret
) {}
