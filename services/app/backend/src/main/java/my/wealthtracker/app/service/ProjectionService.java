package my.wealthtracker.app.service;

import my.wealthtracker.app.config.AppProperties;
import my.wealthtracker.app.domain.AssetCategory;
import my.wealthtracker.app.domain.ContributionSchedule;
import my.wealthtracker.app.domain.Holding;
import my.wealthtracker.app.domain.HoldingSnapshot;
import my.wealthtracker.app.model.ProjectionPoint;
import my.wealthtracker.app.model.ProjectionRequest;
import my.wealthtracker.app.service.util.Amounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class ProjectionService {
	private static final Logger logger = LoggerFactory.getLogger(ProjectionService.class);
	static final BigDecimal FALLBACK_GROWTH_RATE_PCT = new BigDecimal("7");
	static final BigDecimal DEFAULT_ANNUAL_INVESTMENT_SHARE_PCT = new BigDecimal("5");
	private static final int RATE_SCALE = 4;

	private final GrowthProjector growthProjector;
	private final PortfolioAggregator portfolioAggregator;
	private final Map<AssetCategory, BigDecimal> categoryGrowthRates;
	private final BigDecimal defaultGrowthRatePct;
	private final BigDecimal annualInvestmentSharePct;
	private final int maxHorizonYears;

	public ProjectionService(GrowthProjector growthProjector,
							 PortfolioAggregator portfolioAggregator,
							 AppProperties properties) {
		this.growthProjector = growthProjector;
		this.portfolioAggregator = portfolioAggregator;
		AppProperties.Projection projection = properties == null ? null : properties.projection();
		this.categoryGrowthRates = categoryRates(projection == null ? null : projection.growthRates());
		this.defaultGrowthRatePct = projection == null || projection.defaultGrowthRatePct() == null
				? FALLBACK_GROWTH_RATE_PCT
				: projection.defaultGrowthRatePct();
		this.annualInvestmentSharePct = projection == null || projection.annualInvestmentSharePct() == null
				? DEFAULT_ANNUAL_INVESTMENT_SHARE_PCT
				: projection.annualInvestmentSharePct();
		this.maxHorizonYears = projection == null || projection.maxHorizonYears() == null
				? GrowthProjector.MAX_HORIZON_YEARS
				: Math.min(projection.maxHorizonYears(), GrowthProjector.MAX_HORIZON_YEARS);
	}

	public List<ProjectionPoint> calculate(List<ProjectionRequest> requests) {
		if (requests == null || requests.isEmpty()) {
			throw new ValidationException("requests", "must not be empty");
		}
		int horizon = requests.get(0).horizonYears();
		checkHorizon(horizon);
		List<List<ProjectionPoint>> perCategory = new ArrayList<>(requests.size());
		for (ProjectionRequest request : requests) {
			perCategory.add(growthProjector.project(request));
		}
		List<ProjectionPoint> merged = portfolioAggregator.aggregate(perCategory, horizon);
		logger.debug("Projected {} categories over {} years", requests.size(), horizon);
		return merged;
	}

	public List<ProjectionRequest> buildRequests(HoldingSnapshot snapshot,
												 Map<AssetCategory, BigDecimal> growthRateOverrides,
												 int years) {
		SnapshotValidator.validate(snapshot);
		checkHorizon(years);
		Map<AssetCategory, List<Holding>> byCategory = new EnumMap<>(AssetCategory.class);
		for (Holding holding : snapshot.holdings()) {
			byCategory.computeIfAbsent(holding.category(), key -> new ArrayList<>()).add(holding);
		}
		List<ProjectionRequest> requests = new ArrayList<>(byCategory.size());
		for (Map.Entry<AssetCategory, List<Holding>> entry : byCategory.entrySet()) {
			BigDecimal currentValue = BigDecimal.ZERO;
			BigDecimal monthly = BigDecimal.ZERO;
			BigDecimal stepUpSum = BigDecimal.ZERO;
			int activeSchedules = 0;
			for (Holding holding : entry.getValue()) {
				currentValue = currentValue.add(holding.currentValue());
				ContributionSchedule schedule = holding.contributionSchedule();
				if (schedule != null && schedule.active()) {
					monthly = monthly.add(schedule.monthlyAmount());
					stepUpSum = stepUpSum.add(schedule.stepUpPct());
					activeSchedules++;
				}
			}
			BigDecimal stepUp = activeSchedules == 0
					? BigDecimal.ZERO
					: stepUpSum.divide(BigDecimal.valueOf(activeSchedules), RATE_SCALE, RoundingMode.HALF_UP);
			requests.add(new ProjectionRequest(
					entry.getKey(),
					currentValue,
					growthRate(entry.getKey(), growthRateOverrides),
					Amounts.applyRate(currentValue, annualInvestmentSharePct),
					monthly,
					stepUp,
					years
			));
		}
		return List.copyOf(requests);
	}

	public SnapshotProjection projectSnapshot(HoldingSnapshot snapshot,
											  Map<AssetCategory, BigDecimal> growthRateOverrides,
											  int years) {
		List<ProjectionRequest> requests = buildRequests(snapshot, growthRateOverrides, years);
		if (requests.isEmpty()) {
			return new SnapshotProjection(requests, portfolioAggregator.aggregate(List.of(), years));
		}
		return new SnapshotProjection(requests, calculate(requests));
	}

	public BigDecimal expectedReturnPct(HoldingSnapshot snapshot, Map<AssetCategory, BigDecimal> growthRateOverrides) {
		SnapshotValidator.validate(snapshot);
		BigDecimal total = snapshot.totalCurrentValue();
		if (total.signum() <= 0) {
			return defaultGrowthRatePct;
		}
		BigDecimal weighted = BigDecimal.ZERO;
		for (Map.Entry<AssetCategory, BigDecimal> entry : snapshot.valueByCategory().entrySet()) {
			weighted = weighted.add(entry.getValue().multiply(growthRate(entry.getKey(), growthRateOverrides)));
		}
		return weighted.divide(total, RATE_SCALE, RoundingMode.HALF_UP);
	}

	public BigDecimal growthRate(AssetCategory category, Map<AssetCategory, BigDecimal> overrides) {
		if (overrides != null && overrides.get(category) != null) {
			return overrides.get(category);
		}
		BigDecimal configured = categoryGrowthRates.get(category);
		return configured == null ? defaultGrowthRatePct : configured;
	}

	private void checkHorizon(int years) {
		if (years < 1 || years > maxHorizonYears) {
			throw new ValidationException("horizonYears", "must be between 1 and " + maxHorizonYears);
		}
	}

	private static Map<AssetCategory, BigDecimal> categoryRates(Map<String, BigDecimal> raw) {
		Map<AssetCategory, BigDecimal> rates = new EnumMap<>(AssetCategory.class);
		if (raw == null) {
			return rates;
		}
		raw.forEach((key, value) -> {
			if (value == null) {
				return;
			}
			try {
				rates.put(AssetCategory.fromKey(key), value);
			} catch (IllegalArgumentException ex) {
				throw new ConfigurationException("app.projection.growth-rates." + key, ex.getMessage());
			}
		});
		return rates;
	}

	public record SnapshotProjection(List<ProjectionRequest> requests, List<ProjectionPoint> projection) {
	}
}
