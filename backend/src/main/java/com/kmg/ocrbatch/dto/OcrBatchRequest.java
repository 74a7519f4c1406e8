package com.kmg.ocrbatch.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record OcrBatchRequest(
        @NotEmpty @Size(max = 10) List<@NotBlank String> urls,
        boolean includeImages,
        @Min(1) @Max(32) Integer concurrency
) {
}
