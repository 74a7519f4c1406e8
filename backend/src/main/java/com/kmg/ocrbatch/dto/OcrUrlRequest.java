package com.kmg.ocrbatch.dto;

import jakarta.validation.constraints.NotBlank;

public record OcrUrlRequest(
        @NotBlank String url,
        boolean includeImages
) {
}
