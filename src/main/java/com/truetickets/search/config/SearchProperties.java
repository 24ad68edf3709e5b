package com.truetickets.search.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.search")
public record SearchProperties(
	@NotNull Duration debounce,
	@NotNull @Min(1) @Max(3) Integer suffixLookbackBlocks,
	@NotNull @Min(1) @Max(500) Integer maxQueryLength
) {}
