package my.wealthtracker.app.service.health;

import my.wealthtracker.app.domain.AssetCategory;
import my.wealthtracker.app.domain.HoldingSnapshot;
import my.wealthtracker.app.model.FinancialFacts;
import my.wealthtracker.app.model.HealthCategory;
import my.wealthtracker.app.service.util.PiecewiseLinearRubric;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

@Component
public class DiversificationEvaluator implements HealthCategoryEvaluator {
	private static final PiecewiseLinearRubric RUBRIC = PiecewiseLinearRubric.of(MAX_SCORE,
			0.0, 0.0,
			0.3, 80.0,
			0.5, 150.0,
			0.6, 200.0);

	@Override
	public HealthCategory category() {
		return HealthCategory.DIVERSIFICATION;
	}

	@Override
	public CategoryEvaluation evaluate(HoldingSnapshot snapshot, FinancialFacts facts) {
		BigDecimal total = snapshot.totalCurrentValue();
		if (snapshot.isEmpty() || total.signum() <= 0) {
			return new CategoryEvaluation(0, "No holdings with a current value");
		}
		Map<AssetCategory, BigDecimal> byCategory = snapshot.valueByCategory();
		AssetCategory largest = null;
		BigDecimal largestValue = BigDecimal.ZERO;
		for (Map.Entry<AssetCategory, BigDecimal> entry : byCategory.entrySet()) {
			if (largest == null || entry.getValue().compareTo(largestValue) > 0) {
				largest = entry.getKey();
				largestValue = entry.getValue();
			}
		}
		double largestShare = largestValue.doubleValue() / total.doubleValue();
		int score = RUBRIC.score(1.0 - largestShare);
		String explanation = String.format(Locale.ROOT, "%s holds %.1f%% of the portfolio across %d categories",
				largest.key(), largestShare * 100.0, byCategory.size());
		return new CategoryEvaluation(score, explanation);
	}
}
