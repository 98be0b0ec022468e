package com.unitutor.courseware.infra;

import com.unitutor.courseware.exception.PermanentPageException;
import com.unitutor.courseware.exception.TransientGenerationException;
import com.unitutor.courseware.pipeline.GenerationRequest;
import com.unitutor.courseware.pipeline.PageGenerator;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.util.Base64;

@Slf4j
@Component
public class GeminiPageGenerator implements PageGenerator {

    public static final String GENERATION_LIMIT = "generation_limit";
    private static final String IMAGE_MIME_TYPE = "image/png";

    private final ChatModelProvider chatModelProvider;
    private final RateLimiter generationLimiter;

    public GeminiPageGenerator(
        ChatModelProvider chatModelProvider,
        @Qualifier("generationLimiter") RateLimiter generationLimiter
    ) {
        this.chatModelProvider = chatModelProvider;
        this.generationLimiter = generationLimiter;
    }

    @Override
    @Retryable(
        retryFor = RetriableException.class,
        maxAttemptsExpression = "${app.generator.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${app.generator.backoff-ms:2000}", multiplier = 2)
    )
    public String generate(GenerationRequest request) {
        ChatModel chatModel = chatModelProvider.forConfig(request.config());

        UserMessage message = UserMessage.from(
            TextContent.from(request.prompt() + request.context()),
            ImageContent.from(Base64.getEncoder().encodeToString(request.image()), IMAGE_MIME_TYPE)
        );

        ChatRequest chatRequest = ChatRequest.builder()
            .messages(message)
            .parameters(ChatRequestParameters.builder()
                .temperature(request.temperature())
                .maxOutputTokens(request.maxOutputTokens())
                .build())
            .build();

        ChatResponse response = generationLimiter.execute(GENERATION_LIMIT, request.maxOutputTokens(),
            () -> chatModel.chat(chatRequest));

        FinishReason finishReason = response.finishReason();
        if (finishReason == FinishReason.LENGTH) {
            log.warn("Page {}: output hit the token budget of {} and is truncated", request.pageNumber(), request.maxOutputTokens());
        } else if (finishReason == FinishReason.CONTENT_FILTER) {
            log.warn("Page {}: output was flagged by the content filter, keeping whatever text came back", request.pageNumber());
        }

        AiMessage aiMessage = response.aiMessage();
        String text = aiMessage != null ? aiMessage.text() : null;
        return text != null ? text : "";
    }

    @Recover
    public String recoverTransient(RetriableException e, GenerationRequest request) {
        log.error("Page {}: generator still failing after retries: {}", request.pageNumber(), e.getMessage());
        throw new TransientGenerationException(request.pageNumber(), e);
    }

    @Recover
    public String recoverPermanent(RuntimeException e, GenerationRequest request) {
        throw new PermanentPageException(request.pageNumber(), "Generation failed: " + e.getMessage(), e);
    }
}
