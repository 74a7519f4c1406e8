package com.kmg.ocrbatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.ocrbatch.backend.BackendClientAdapter;
import com.kmg.ocrbatch.backend.MistralOcrBackend;
import com.kmg.ocrbatch.backend.OcrBackend;
import com.kmg.ocrbatch.service.BatchScheduler;
import com.kmg.ocrbatch.service.DocumentResolver;
import com.kmg.ocrbatch.service.ResultAggregator;
import com.kmg.ocrbatch.service.RetryPolicy;
import com.kmg.ocrbatch.service.RetryTimer;
import com.kmg.ocrbatch.service.ScheduledRetryTimer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;

@Configuration
public class OrchestrationConfig {

    @Bean
    public DocumentResolver documentResolver(OcrBatchProperties properties) {
        return new DocumentResolver(properties.resolverSettings());
    }

    @Bean
    public OcrBackend mistralOcrBackend(OcrBatchProperties properties, RestClient.Builder restClientBuilder,
                                        ObjectMapper objectMapper) {
        OcrBatchProperties.Backend backend = properties.getBackend();
        if (backend.getApiKey() == null || backend.getApiKey().isBlank()) {
            throw new IllegalStateException(
                    "Mistral API key not found. Please set the MISTRAL_API_KEY environment variable.");
        }

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(backend.getConnectTimeout());
        requestFactory.setReadTimeout(backend.getCallTimeout());

        RestClient restClient = restClientBuilder
                .baseUrl(backend.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + backend.getApiKey())
                .requestFactory(requestFactory)
                .build();
        return new MistralOcrBackend(restClient, objectMapper, backend.getModel());
    }

    @Bean
    public BackendClientAdapter backendClientAdapter(OcrBackend ocrBackend, OcrBatchProperties properties) {
        return new BackendClientAdapter(ocrBackend, properties.getBackend().getCallTimeout());
    }

    @Bean
    public RetryPolicy retryPolicy(OcrBatchProperties properties) {
        return new RetryPolicy(properties.retrySettings());
    }

    @Bean
    public RetryTimer retryTimer() {
        return new ScheduledRetryTimer();
    }

    @Bean
    public ResultAggregator resultAggregator() {
        return new ResultAggregator();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BatchScheduler batchScheduler(BackendClientAdapter adapter, RetryPolicy retryPolicy, RetryTimer retryTimer,
                                         ResultAggregator resultAggregator, Clock clock) {
        return new BatchScheduler(adapter, retryPolicy, retryTimer, resultAggregator, clock);
    }
}
