package my.wealthtracker.app.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import my.wealthtracker.app.domain.AssetCategory;

import java.math.BigDecimal;

public record ProjectionRequestDto(
		@NotNull AssetCategory category,
		@NotNull @PositiveOrZero BigDecimal currentValue,
		@NotNull BigDecimal annualGrowthRatePct,
		@PositiveOrZero BigDecimal annualLumpsum,
		@PositiveOrZero BigDecimal periodicContribution,
		@PositiveOrZero BigDecimal stepUpPct,
		@NotNull @Min(1) @Max(50) Integer horizonYears
) {
}
