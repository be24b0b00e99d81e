package my.wealthtracker.app.service.health;

import my.wealthtracker.app.domain.Holding;
import my.wealthtracker.app.domain.HoldingSnapshot;
import my.wealthtracker.app.model.FinancialFacts;
import my.wealthtracker.app.model.HealthCategory;
import my.wealthtracker.app.service.util.PiecewiseLinearRubric;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;

@Component
public class GrowthTrajectoryEvaluator implements HealthCategoryEvaluator {
	static final int DEFAULT_SCORE = 60;
	private static final PiecewiseLinearRubric RUBRIC = PiecewiseLinearRubric.of(MAX_SCORE,
			-20.0, 0.0,
			0.0, 80.0,
			10.0, 140.0,
			25.0, 200.0);

	@Override
	public HealthCategory category() {
		return HealthCategory.GROWTH_TRAJECTORY;
	}

	@Override
	public CategoryEvaluation evaluate(HoldingSnapshot snapshot, FinancialFacts facts) {
		BigDecimal cost = BigDecimal.ZERO;
		BigDecimal value = BigDecimal.ZERO;
		for (Holding holding : snapshot.holdings()) {
			if (holding.costBasis().signum() > 0) {
				cost = cost.add(holding.costBasis());
				value = value.add(holding.currentValue());
			}
		}
		if (cost.signum() <= 0) {
			return new CategoryEvaluation(DEFAULT_SCORE, "No holdings with a cost basis to measure growth");
		}
		double returnPct = (value.doubleValue() - cost.doubleValue()) / cost.doubleValue() * 100.0;
		return new CategoryEvaluation(RUBRIC.score(returnPct),
				String.format(Locale.ROOT, "Portfolio return of %.1f%% on invested capital", returnPct));
	}
}
