package my.wealthtracker.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.wealthtracker.app.domain.HoldingSnapshot;
import my.wealthtracker.app.dto.DashboardRequestDto;
import my.wealthtracker.app.dto.HealthScoreRequestDto;
import my.wealthtracker.app.dto.HoldingSnapshotDto;
import my.wealthtracker.app.dto.MonteCarloRequestDto;
import my.wealthtracker.app.dto.SnapshotMonteCarloRequestDto;
import my.wealthtracker.app.dto.TaxEstimateRequestDto;
import my.wealthtracker.app.model.AttributionResult;
import my.wealthtracker.app.model.DashboardSummary;
import my.wealthtracker.app.model.HealthScore;
import my.wealthtracker.app.model.MonteCarloParameters;
import my.wealthtracker.app.model.MonteCarloResult;
import my.wealthtracker.app.model.TaxEstimate;
import my.wealthtracker.app.service.AttributionAnalyzer;
import my.wealthtracker.app.service.DashboardService;
import my.wealthtracker.app.service.HealthScorer;
import my.wealthtracker.app.service.MonteCarloService;
import my.wealthtracker.app.service.SnapshotMapper;
import my.wealthtracker.app.service.TaxConfigService;
import my.wealthtracker.app.service.TaxEstimator;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/analytics")
@Tag(name = "Analytics")
public class AnalyticsController {
	private final SnapshotMapper snapshotMapper;
	private final MonteCarloService monteCarloService;
	private final HealthScorer healthScorer;
	private final AttributionAnalyzer attributionAnalyzer;
	private final TaxEstimator taxEstimator;
	private final TaxConfigService taxConfigService;
	private final DashboardService dashboardService;

	public AnalyticsController(SnapshotMapper snapshotMapper,
							   MonteCarloService monteCarloService,
							   HealthScorer healthScorer,
							   AttributionAnalyzer attributionAnalyzer,
							   TaxEstimator taxEstimator,
							   TaxConfigService taxConfigService,
							   DashboardService dashboardService) {
		this.snapshotMapper = snapshotMapper;
		this.monteCarloService = monteCarloService;
		this.healthScorer = healthScorer;
		this.attributionAnalyzer = attributionAnalyzer;
		this.taxEstimator = taxEstimator;
		this.taxConfigService = taxConfigService;
		this.dashboardService = dashboardService;
	}

	@PostMapping("/monte-carlo")
	@Operation(summary = "Run a Monte Carlo simulation")
	public MonteCarloResult monteCarlo(@Valid @RequestBody MonteCarloRequestDto request) {
		return monteCarloService.simulate(monteCarloService.parameters(request));
	}

	@PostMapping("/monte-carlo/snapshot")
	@Operation(summary = "Run a Monte Carlo simulation for a holdings snapshot")
	public MonteCarloResult monteCarloSnapshot(@Valid @RequestBody SnapshotMonteCarloRequestDto request) {
		HoldingSnapshot snapshot = snapshotMapper.toSnapshot(request.snapshot());
		MonteCarloParameters parameters = monteCarloService.parameters(
				snapshot,
				snapshotMapper.toCategoryRates(request.growthRates(), "growthRates"),
				request.volatilityPct(),
				request.years(),
				request.simulationCount(),
				request.seed());
		return monteCarloService.simulate(parameters);
	}

	@PostMapping("/financial-health-score")
	@Operation(summary = "Score financial health")
	public HealthScore healthScore(@Valid @RequestBody HealthScoreRequestDto request) {
		return healthScorer.score(snapshotMapper.toSnapshot(request.snapshot()), snapshotMapper.toFacts(request.facts()));
	}

	@PostMapping("/performance-attribution")
	@Operation(summary = "Attribute returns to holdings and categories")
	public AttributionResult attribution(@Valid @RequestBody HoldingSnapshotDto request) {
		return attributionAnalyzer.attribute(snapshotMapper.toSnapshot(request));
	}

	@PostMapping("/tax-optimization")
	@Operation(summary = "Estimate gains tax and saving opportunities")
	public TaxEstimate tax(@Valid @RequestBody TaxEstimateRequestDto request) {
		return taxEstimator.estimate(snapshotMapper.toSnapshot(request.snapshot()), taxConfigService.resolve(request.taxConfig()));
	}

	@PostMapping("/dashboard")
	@Operation(summary = "Summarize net worth, allocation and milestone progress")
	public DashboardSummary dashboard(@Valid @RequestBody DashboardRequestDto request) {
		return dashboardService.summarize(snapshotMapper.toSnapshot(request.snapshot()),
				snapshotMapper.toMilestones(request.milestones()));
	}
}
