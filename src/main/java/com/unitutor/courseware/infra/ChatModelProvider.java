package com.unitutor.courseware.infra;

import com.unitutor.courseware.config.LangChainConfig;
import com.unitutor.courseware.model.GeneratorConfig;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out the shared chat model, or a dedicated one when a run brings its own key or model name.
 */
@Slf4j
@Component
public class ChatModelProvider {

    private record ModelKey(String apiKey, String modelName) {}

    private final ChatModel defaultModel;
    private final String defaultApiKey;
    private final String defaultModelName;
    private final ConcurrentHashMap<ModelKey, ChatModel> customModels = new ConcurrentHashMap<>();

    public ChatModelProvider(
        ChatModel defaultModel,
        @Value("${app.gemini.api-key}") String defaultApiKey,
        @Value("${app.gemini.model-name:gemini-2.5-flash}") String defaultModelName
    ) {
        this.defaultModel = defaultModel;
        this.defaultApiKey = defaultApiKey;
        this.defaultModelName = defaultModelName;
    }

    public ChatModel forConfig(GeneratorConfig config) {
        if (config == null || !config.hasCustomModel()) {
            return defaultModel;
        }

        String apiKey = isBlank(config.apiKey()) ? defaultApiKey : config.apiKey();
        String modelName = isBlank(config.modelName()) ? defaultModelName : config.modelName();

        return customModels.computeIfAbsent(new ModelKey(apiKey, modelName), this::buildModel);
    }

    private ChatModel buildModel(ModelKey key) {
        log.info("Creating dedicated chat model instance for model {}", key.modelName());
        return GoogleAiGeminiChatModel.builder()
            .apiKey(key.apiKey())
            .modelName(key.modelName())
            .timeout(LangChainConfig.GENERATION_TIMEOUT)
            .safetySettings(LangChainConfig.SAFETY_SETTINGS)
            .maxRetries(1)
            .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
