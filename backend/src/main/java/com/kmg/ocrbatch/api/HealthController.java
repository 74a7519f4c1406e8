package com.kmg.ocrbatch.api;

import com.kmg.ocrbatch.dto.HealthResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {
    private final String version;

    public HealthController(@Value("${info.app.version:0.1.0}") String version) {
        this.version = version;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("healthy", version);
    }
}
