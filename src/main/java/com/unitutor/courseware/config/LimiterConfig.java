package com.unitutor.courseware.config;

import com.unitutor.courseware.infra.InMemoryDualRateLimiter;
import com.unitutor.courseware.infra.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("generationLimiter")
    public RateLimiter generationLimiter(
        @Value("${app.limiter.generation.requests-per-minute:10}") int rpm,
        @Value("${app.limiter.generation.tokens-per-minute:250000}") int tpm
    ) {
        return new InMemoryDualRateLimiter(rpm, tpm);
    }
}
