package com.unitutor.courseware.config;

import dev.langchain4j.model.googleai.GeminiHarmBlockThreshold;
import dev.langchain4j.model.googleai.GeminiHarmCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LangChainConfigTest {

    @Test
    @DisplayName("Content filtering is disabled for every harm category the model checks")
    void shouldDisableBlockingForAllHarmCategories() {
        assertThat(LangChainConfig.SAFETY_SETTINGS)
            .containsOnlyKeys(
                GeminiHarmCategory.HARM_CATEGORY_HARASSMENT,
                GeminiHarmCategory.HARM_CATEGORY_HATE_SPEECH,
                GeminiHarmCategory.HARM_CATEGORY_SEXUALLY_EXPLICIT,
                GeminiHarmCategory.HARM_CATEGORY_DANGEROUS_CONTENT)
            .allSatisfy((category, threshold) ->
                assertThat(threshold).isEqualTo(GeminiHarmBlockThreshold.BLOCK_NONE));
    }
}
