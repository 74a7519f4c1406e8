package com.kmg.ocrbatch;

import com.kmg.ocrbatch.cli.CliRunner;
import com.kmg.ocrbatch.config.OcrBatchProperties;
import com.kmg.ocrbatch.service.BatchScheduler;
import com.kmg.ocrbatch.service.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "ocr.batch.max-attempts=5")
class OcrBatchApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private OcrBatchProperties properties;

    @Test
    void contextLoads_WiresOrchestrationFromProperties() {
        assertThat(context.getBean(BatchScheduler.class)).isNotNull();
        assertThat(context.getBean(RetryPolicy.class).maxAttempts()).isEqualTo(5);
        assertThat(properties.getBackend().getApiKey()).isEqualTo("test-key");
        assertThat(context.getBeansOfType(CliRunner.class)).isEmpty();
    }
}
