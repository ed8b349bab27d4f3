package com.llmgateway.credential;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class EndpointSanitizerTest {

    @ParameterizedTest
    @CsvSource({
            "https://llm.internal/v1/chat/completions, https://llm.internal",
            "https://llm.internal/v1/completions, https://llm.internal",
            "https://llm.internal/v1/chat/completions/, https://llm.internal",
            "https://llm.internal/v1, https://llm.internal/v1",
            "https://llm.internal/openai/chat/completions, https://llm.internal/openai",
            "'  http://localhost:8000/  ', http://localhost:8000"
    })
    @DisplayName("should trim operation paths and trailing slashes")
    void shouldSanitize(String raw, String expected) {
        assertThat(EndpointSanitizer.sanitize(raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should treat blank endpoints as absent")
    void shouldTreatBlankAsAbsent() {
        assertThat(EndpointSanitizer.sanitize(null)).isNull();
        assertThat(EndpointSanitizer.sanitize("   ")).isNull();
        assertThat(EndpointSanitizer.sanitize("/")).isNull();
    }
}
