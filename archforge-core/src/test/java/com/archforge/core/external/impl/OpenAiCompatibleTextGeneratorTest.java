package com.archforge.core.external.impl;

import com.archforge.core.config.ProjectConfig.GenerationConfig;
import com.archforge.core.external.TextGenerationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link OpenAiCompatibleTextGenerator}.
 */
class OpenAiCompatibleTextGeneratorTest {

    private GenerationConfig config;
    private OpenAiCompatibleTextGenerator generator;

    @BeforeEach
    void setUp() {
        config = new GenerationConfig("openai", "gpt-4o-mini", "http://localhost:1/v1", "ARCHFORGE_TEST_KEY",
            0.1, 5, 3, 10L, 100L, 2.0);
        generator = new OpenAiCompatibleTextGenerator(config, "test-key");
    }

    @Test
    void requestBody_containsModelMessagesAndTemperature() throws Exception {
        // When
        JsonNode body = new ObjectMapper().readTree(generator.requestBody("Write Order.ts"));

        // Then
        assertThat(body.path("model").asText()).isEqualTo("gpt-4o-mini");
        assertThat(body.path("temperature").asDouble()).isEqualTo(0.1);
        assertThat(body.path("messages")).hasSize(2);
        assertThat(body.path("messages").get(0).path("role").asText()).isEqualTo("system");
        assertThat(body.path("messages").get(1).path("content").asText()).isEqualTo("Write Order.ts");
    }

    @Test
    void extractContent_firstChoice_returnsMessageContent() {
        // Given
        String response = """
            {"choices":[{"message":{"role":"assistant","content":"export class Order {}"}},
                        {"message":{"role":"assistant","content":"ignored"}}]}
            """;

        // When / Then
        assertThat(generator.extractContent(response)).isEqualTo("export class Order {}");
    }

    @Test
    void extractContent_noChoices_throwsRetryable() {
        assertThatThrownBy(() -> generator.extractContent("{\"choices\":[]}"))
            .isInstanceOfSatisfying(TextGenerationException.class, e -> assertThat(e.isRetryable()).isTrue())
            .hasMessageContaining("no choices");
    }

    @Test
    void extractContent_malformedJson_throwsRetryable() {
        assertThatThrownBy(() -> generator.extractContent("<html>bad gateway</html>"))
            .isInstanceOfSatisfying(TextGenerationException.class, e -> assertThat(e.isRetryable()).isTrue())
            .hasMessageStartingWith("Malformed response");
    }

    @Test
    void generate_missingApiKey_failsWithoutRetry() {
        // Given
        OpenAiCompatibleTextGenerator keyless = new OpenAiCompatibleTextGenerator(config, " ");

        // When / Then
        assertThatThrownBy(() -> keyless.generate("prompt"))
            .isInstanceOfSatisfying(TextGenerationException.class, e -> assertThat(e.isRetryable()).isFalse())
            .hasMessageContaining("ARCHFORGE_TEST_KEY");
    }
}
