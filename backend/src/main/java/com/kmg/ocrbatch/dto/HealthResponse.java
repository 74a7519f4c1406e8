package com.kmg.ocrbatch.dto;

public record HealthResponse(String status, String version) {
}
