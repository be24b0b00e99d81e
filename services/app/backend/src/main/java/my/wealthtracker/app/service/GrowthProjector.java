package my.wealthtracker.app.service;

import my.wealthtracker.app.model.ProjectionPoint;
import my.wealthtracker.app.model.ProjectionRequest;
import my.wealthtracker.app.service.util.Amounts;
import my.wealthtracker.app.service.util.CompoundingMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Service
public class GrowthProjector {
	private static final Logger logger = LoggerFactory.getLogger(GrowthProjector.class);
	private static final int MONTHS_PER_YEAR = 12;
	public static final int MAX_HORIZON_YEARS = 50;
	public static final BigDecimal MAX_GROWTH_RATE_PCT = new BigDecimal("1000");

	public List<ProjectionPoint> project(ProjectionRequest request) {
		if (request == null) {
			throw new ValidationException("request", "must not be null");
		}
		return project(request.currentValue(),
				request.annualGrowthRatePct(),
				request.annualLumpsum(),
				request.periodicContribution(),
				request.stepUpPct(),
				request.horizonYears());
	}

	public List<ProjectionPoint> project(BigDecimal currentValue,
										 BigDecimal annualGrowthRatePct,
										 BigDecimal annualLumpsum,
										 BigDecimal periodicContribution,
										 BigDecimal stepUpPct,
										 int horizonYears) {
		validate(currentValue, annualGrowthRatePct, annualLumpsum, periodicContribution, stepUpPct, horizonYears);

		double monthlyRate = CompoundingMath.monthlyRate(annualGrowthRatePct.doubleValue());
		double lumpsum = Amounts.safe(annualLumpsum).doubleValue();
		double baseContribution = Amounts.safe(periodicContribution).doubleValue();
		double stepUpFactor = 1.0 + Amounts.safe(stepUpPct).doubleValue() / 100.0;

		double lumpsumCorpus = currentValue.doubleValue();
		double contributionCorpus = 0.0;
		double monthlyContribution = baseContribution;

		List<ProjectionPoint> points = new ArrayList<>(horizonYears);
		for (int year = 1; year <= horizonYears; year++) {
			if (year > 1) {
				monthlyContribution *= stepUpFactor;
			}
			lumpsumCorpus = CompoundingMath.compound(lumpsumCorpus + lumpsum, 0.0, monthlyRate, MONTHS_PER_YEAR);
			contributionCorpus = CompoundingMath.compound(contributionCorpus, monthlyContribution, monthlyRate, MONTHS_PER_YEAR);
			if (!Double.isFinite(lumpsumCorpus) || !Double.isFinite(contributionCorpus)) {
				throw new ValidationException("annualGrowthRatePct", "result is not representable");
			}

			BigDecimal lumpsumValue = Amounts.money(lumpsumCorpus);
			BigDecimal contributionValue = Amounts.money(contributionCorpus);
			points.add(new ProjectionPoint(year, lumpsumValue.add(contributionValue), contributionValue, lumpsumValue));
		}
		logger.debug("Projected {} years at {}% growth, final value {}", horizonYears, annualGrowthRatePct,
				points.get(points.size() - 1).totalValue());
		return List.copyOf(points);
	}

	private void validate(BigDecimal currentValue,
						  BigDecimal annualGrowthRatePct,
						  BigDecimal annualLumpsum,
						  BigDecimal periodicContribution,
						  BigDecimal stepUpPct,
						  int horizonYears) {
		if (horizonYears < 1 || horizonYears > MAX_HORIZON_YEARS) {
			throw new ValidationException("horizonYears", "must be between 1 and " + MAX_HORIZON_YEARS);
		}
		SnapshotValidator.requireNonNegative("currentValue", currentValue);
		if (Double.isInfinite(currentValue.doubleValue())) {
			throw new ValidationException("currentValue", "is too large");
		}
		if (annualGrowthRatePct == null) {
			throw new ValidationException("annualGrowthRatePct", "must not be null");
		}
		if (annualGrowthRatePct.compareTo(Amounts.ONE_HUNDRED.negate()) <= 0) {
			throw new ValidationException("annualGrowthRatePct", "must be greater than -100");
		}
		if (annualGrowthRatePct.compareTo(MAX_GROWTH_RATE_PCT) > 0) {
			throw new ValidationException("annualGrowthRatePct", "must not exceed " + MAX_GROWTH_RATE_PCT);
		}
		if (annualLumpsum != null && annualLumpsum.signum() < 0) {
			throw new ValidationException("annualLumpsum", "must not be negative");
		}
		if (periodicContribution != null && periodicContribution.signum() < 0) {
			throw new ValidationException("periodicContribution", "must not be negative");
		}
		if (stepUpPct != null && stepUpPct.signum() < 0) {
			throw new ValidationException("stepUpPct", "must not be negative");
		}
	}
}
