package com.kmg.ocrbatch.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class OcrBatchPropertiesTest {

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        validatorFactory.close();
    }

    @Test
    void validate_Defaults_NoViolations() {
        assertThat(validator.validate(new OcrBatchProperties())).isEmpty();
    }

    @Test
    void validate_DurationsBeyondIntMillis_AreRejected() {
        // given
        OcrBatchProperties properties = new OcrBatchProperties();
        properties.getBackend().setCallTimeout(Duration.ofDays(30));
        properties.getBatch().setTimeout(Duration.ofDays(365));

        // when
        Set<ConstraintViolation<OcrBatchProperties>> violations = validator.validate(properties);

        // then
        assertThat(violations).extracting(violation -> violation.getPropertyPath().toString())
                .containsExactlyInAnyOrder("backend.callTimeout", "batch.timeout");
    }

    @Test
    void validate_ZeroTimeouts_AreRejected() {
        // given
        OcrBatchProperties properties = new OcrBatchProperties();
        properties.getBackend().setConnectTimeout(Duration.ZERO);
        properties.getBatch().setTimeout(Duration.ZERO);

        // when
        Set<ConstraintViolation<OcrBatchProperties>> violations = validator.validate(properties);

        // then
        assertThat(violations).extracting(violation -> violation.getPropertyPath().toString())
                .containsExactlyInAnyOrder("backend.connectTimeout", "batch.timeout");
    }
}
