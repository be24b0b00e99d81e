package my.wealthtracker.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.util.Map;

public record SnapshotMonteCarloRequestDto(
		@NotNull @Valid HoldingSnapshotDto snapshot,
		Map<String, BigDecimal> growthRates,
		@PositiveOrZero BigDecimal volatilityPct,
		@Min(1) @Max(50) Integer years,
		@Min(100) Integer simulationCount,
		Long seed
) {
}
