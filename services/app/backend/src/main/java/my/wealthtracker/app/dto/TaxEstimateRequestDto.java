package my.wealthtracker.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record TaxEstimateRequestDto(
		@NotNull @Valid HoldingSnapshotDto snapshot,
		@Valid TaxConfigDto taxConfig
) {
}
