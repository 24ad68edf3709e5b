package com.truetickets.search.config;

import com.truetickets.search.infra.InMemoryRpmRateLimiter;
import com.truetickets.search.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("lookupLimiter")
    public RateLimiter lookupLimiter(LookupProperties properties) {
        return new InMemoryRpmRateLimiter(properties.requestsPerMinute());
    }
}
