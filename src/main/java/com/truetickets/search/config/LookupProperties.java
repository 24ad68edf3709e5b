package com.truetickets.search.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Backend lookup API. {@code bearerToken} is optional; when set it is sent on every request.
 */
@Validated
@ConfigurationProperties(prefix = "app.lookup")
public record LookupProperties(
	@NotBlank String baseUrl,
	String bearerToken,
	@NotNull Duration connectTimeout,
	@NotNull Duration readTimeout,
	@NotNull @Min(1) Integer requestsPerMinute,
	@NotNull @Min(1) Integer concurrency
) {}
