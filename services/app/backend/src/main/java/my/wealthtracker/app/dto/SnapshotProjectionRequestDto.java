package my.wealthtracker.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.Map;

public record SnapshotProjectionRequestDto(
		@NotNull @Valid HoldingSnapshotDto snapshot,
		Map<String, BigDecimal> growthRates,
		@NotNull @Min(1) @Max(50) Integer years
) {
}
