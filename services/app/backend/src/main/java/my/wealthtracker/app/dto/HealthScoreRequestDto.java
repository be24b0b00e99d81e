package my.wealthtracker.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record HealthScoreRequestDto(
		@NotNull @Valid HoldingSnapshotDto snapshot,
		@Valid FinancialFactsDto facts
) {
}
