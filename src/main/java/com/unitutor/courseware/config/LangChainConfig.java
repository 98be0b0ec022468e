package com.unitutor.courseware.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GeminiHarmBlockThreshold;
import dev.langchain4j.model.googleai.GeminiHarmCategory;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;

@Configuration
public class LangChainConfig {

    public static final Duration GENERATION_TIMEOUT = Duration.ofSeconds(120);

    /** Slides on medicine, history or law trip the default filters; blocking is turned off for every category. */
    public static final Map<GeminiHarmCategory, GeminiHarmBlockThreshold> SAFETY_SETTINGS = Map.of(
        GeminiHarmCategory.HARM_CATEGORY_HARASSMENT, GeminiHarmBlockThreshold.BLOCK_NONE,
        GeminiHarmCategory.HARM_CATEGORY_HATE_SPEECH, GeminiHarmBlockThreshold.BLOCK_NONE,
        GeminiHarmCategory.HARM_CATEGORY_SEXUALLY_EXPLICIT, GeminiHarmBlockThreshold.BLOCK_NONE,
        GeminiHarmCategory.HARM_CATEGORY_DANGEROUS_CONTENT, GeminiHarmBlockThreshold.BLOCK_NONE
    );

    @Value("${app.gemini.api-key}")
    private String apiKey;

    @Value("${app.gemini.model-name:gemini-2.5-flash}")
    private String modelName;

    @Bean
    public ChatModel chatLanguageModel() {
        return GoogleAiGeminiChatModel.builder()
            .apiKey(apiKey)
            .modelName(modelName)
            .timeout(GENERATION_TIMEOUT)
            .safetySettings(SAFETY_SETTINGS)
            .maxRetries(1)
            .build();
    }
}
