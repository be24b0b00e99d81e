package my.wealthtracker.app.service.health;

import my.wealthtracker.app.domain.HoldingSnapshot;
import my.wealthtracker.app.model.FinancialFacts;
import my.wealthtracker.app.model.HealthCategory;
import my.wealthtracker.app.service.util.PiecewiseLinearRubric;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class DebtBurdenEvaluator implements HealthCategoryEvaluator {
	static final int DEFAULT_SCORE = 80;
	private static final PiecewiseLinearRubric RUBRIC = PiecewiseLinearRubric.of(MAX_SCORE,
			0.0, 200.0,
			0.1, 200.0,
			0.36, 100.0,
			0.5, 0.0);

	@Override
	public HealthCategory category() {
		return HealthCategory.DEBT_MANAGEMENT;
	}

	@Override
	public CategoryEvaluation evaluate(HoldingSnapshot snapshot, FinancialFacts facts) {
		if (facts.monthlyIncome() == null || facts.monthlyIncome().signum() <= 0 || facts.monthlyDebtPayments() == null) {
			return new CategoryEvaluation(DEFAULT_SCORE, "Monthly income or debt payments not provided");
		}
		double ratio = facts.monthlyDebtPayments().doubleValue() / facts.monthlyIncome().doubleValue();
		return new CategoryEvaluation(RUBRIC.score(ratio),
				String.format(Locale.ROOT, "Debt payments take %.1f%% of monthly income", ratio * 100.0));
	}
}
