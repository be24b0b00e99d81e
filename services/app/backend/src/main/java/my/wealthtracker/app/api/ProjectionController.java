package my.wealthtracker.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.wealthtracker.app.dto.ProjectionRequestDto;
import my.wealthtracker.app.dto.SnapshotProjectionRequestDto;
import my.wealthtracker.app.dto.SnapshotProjectionResponseDto;
import my.wealthtracker.app.model.ProjectionPoint;
import my.wealthtracker.app.model.ProjectionRequest;
import my.wealthtracker.app.service.ProjectionService;
import my.wealthtracker.app.service.SnapshotMapper;
import my.wealthtracker.app.service.ValidationException;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/projections")
@Tag(name = "Projections")
public class ProjectionController {
	private final ProjectionService projectionService;
	private final SnapshotMapper snapshotMapper;

	public ProjectionController(ProjectionService projectionService, SnapshotMapper snapshotMapper) {
		this.projectionService = projectionService;
		this.snapshotMapper = snapshotMapper;
	}

	@PostMapping("/calculate")
	@Operation(summary = "Project and aggregate per-category growth")
	public List<ProjectionPoint> calculate(@RequestBody List<ProjectionRequestDto> request) {
		if (request == null || request.isEmpty()) {
			throw new ValidationException("requests", "must not be empty");
		}
		List<ProjectionRequest> requests = new ArrayList<>(request.size());
		for (int i = 0; i < request.size(); i++) {
			ProjectionRequestDto item = request.get(i);
			if (item == null || item.horizonYears() == null) {
				throw new ValidationException("requests[" + i + "].horizonYears", "must not be null");
			}
			requests.add(new ProjectionRequest(
					item.category(),
					item.currentValue(),
					item.annualGrowthRatePct(),
					item.annualLumpsum(),
					item.periodicContribution(),
					item.stepUpPct(),
					item.horizonYears()
			));
		}
		return projectionService.calculate(requests);
	}

	@PostMapping("/snapshot")
	@Operation(summary = "Project a holdings snapshot using per-category growth assumptions")
	public SnapshotProjectionResponseDto projectSnapshot(@Valid @RequestBody SnapshotProjectionRequestDto request) {
		ProjectionService.SnapshotProjection result = projectionService.projectSnapshot(
				snapshotMapper.toSnapshot(request.snapshot()),
				snapshotMapper.toCategoryRates(request.growthRates(), "growthRates"),
				request.years());
		return new SnapshotProjectionResponseDto(result.requests(), result.projection());
	}
}
