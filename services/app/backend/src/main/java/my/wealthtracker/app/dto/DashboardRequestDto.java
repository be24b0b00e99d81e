package my.wealthtracker.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record DashboardRequestDto(
		@NotNull @Valid HoldingSnapshotDto snapshot,
		@Valid List<MilestoneDto> milestones
) {
}
