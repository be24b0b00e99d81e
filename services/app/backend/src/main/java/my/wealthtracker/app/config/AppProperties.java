package my.wealthtracker.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid Projection projection,
		@Valid MonteCarlo monteCarlo,
		@Valid Health health,
		@Valid Attribution attribution,
		@Valid Tax tax
) {
	public record Projection(
			BigDecimal defaultGrowthRatePct,
			Map<String, BigDecimal> growthRates,
			@PositiveOrZero BigDecimal annualInvestmentSharePct,
			@Min(1) @Max(50) Integer maxHorizonYears
	) {
	}

	public record MonteCarlo(
			@Min(100) Integer minSimulations,
			@Min(100) Integer maxSimulations,
			@Min(100) Integer defaultSimulations,
			@PositiveOrZero BigDecimal defaultVolatilityPct,
			@Min(1) Integer batchSize,
			@Min(1) Integer parallelThreshold,
			@Min(1) Integer parallelism,
			@Min(1) Integer timeoutSeconds,
			@Min(1) Integer maxConcurrentJobs,
			@Min(1) Integer jobTtlMinutes
	) {
	}

	public record Health(
			@Min(0) @Max(200) Integer needsImprovementBelow,
			@Min(0) @Max(200) Integer strongAtOrAbove
	) {
	}

	public record Attribution(
			@Min(1) Integer topPerformers
	) {
	}

	public record Tax(
			@PositiveOrZero BigDecimal longTermRatePct,
			@PositiveOrZero BigDecimal shortTermRatePct,
			@PositiveOrZero BigDecimal longTermExemption,
			Map<String, Integer> holdingPeriodDays
	) {
	}
}
