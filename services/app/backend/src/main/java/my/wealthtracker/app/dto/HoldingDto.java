package my.wealthtracker.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import my.wealthtracker.app.domain.AssetCategory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

public record HoldingDto(
		String id,
		String name,
		@NotNull AssetCategory category,
		@NotNull @PositiveOrZero BigDecimal costBasis,
		@NotNull @PositiveOrZero BigDecimal currentValue,
		LocalDate acquisitionDate,
		@Valid ContributionScheduleDto contributionSchedule,
		Map<String, Object> metadata
) {
}
