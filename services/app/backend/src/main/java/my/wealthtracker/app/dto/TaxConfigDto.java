package my.wealthtracker.app.dto;

import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.util.Map;

public record TaxConfigDto(
		@PositiveOrZero BigDecimal longTermRatePct,
		@PositiveOrZero BigDecimal shortTermRatePct,
		@PositiveOrZero BigDecimal longTermExemption,
		Map<String, Integer> holdingPeriodDays
) {
}
