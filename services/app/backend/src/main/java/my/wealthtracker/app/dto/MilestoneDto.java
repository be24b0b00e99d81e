package my.wealthtracker.app.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.time.LocalDate;

public record MilestoneDto(
		@NotBlank String name,
		@NotNull @Positive BigDecimal targetAmount,
		LocalDate targetDate
) {
}
