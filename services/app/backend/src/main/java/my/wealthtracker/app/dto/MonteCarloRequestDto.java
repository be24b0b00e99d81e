package my.wealthtracker.app.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record MonteCarloRequestDto(
		@NotNull @PositiveOrZero BigDecimal startingValue,
		@NotNull BigDecimal expectedAnnualReturnPct,
		@PositiveOrZero BigDecimal volatilityPct,
		@NotNull @Min(1) @Max(50) Integer horizonYears,
		@Min(100) Integer simulationCount,
		Long seed
) {
}
