package my.wealthtracker.app.dto;

import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ContributionScheduleDto(
		@PositiveOrZero BigDecimal monthlyAmount,
		LocalDate startDate,
		@PositiveOrZero BigDecimal stepUpPct,
		Boolean active
) {
}
