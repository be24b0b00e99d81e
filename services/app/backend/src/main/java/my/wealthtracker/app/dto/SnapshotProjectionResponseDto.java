package my.wealthtracker.app.dto;

import my.wealthtracker.app.model.ProjectionPoint;
import my.wealthtracker.app.model.ProjectionRequest;

import java.util.List;

public record SnapshotProjectionResponseDto(
		List<ProjectionRequest> requests,
		List<ProjectionPoint> projection
) {
}
