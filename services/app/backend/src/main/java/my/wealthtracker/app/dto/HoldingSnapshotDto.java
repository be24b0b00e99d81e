package my.wealthtracker.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.List;

public record HoldingSnapshotDto(
		@NotNull @Valid List<HoldingDto> holdings,
		LocalDate valuationDate
) {
}
