package my.wealthtracker.app.service.health;

import my.wealthtracker.app.domain.HoldingSnapshot;
import my.wealthtracker.app.model.FinancialFacts;
import my.wealthtracker.app.model.HealthCategory;
import my.wealthtracker.app.service.util.PiecewiseLinearRubric;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class EmergencyFundEvaluator implements HealthCategoryEvaluator {
	static final int DEFAULT_SCORE = 60;
	private static final PiecewiseLinearRubric RUBRIC = PiecewiseLinearRubric.of(MAX_SCORE,
			0.0, 0.0,
			1.0, 40.0,
			3.0, 120.0,
			6.0, 200.0);

	@Override
	public HealthCategory category() {
		return HealthCategory.EMERGENCY_FUND;
	}

	@Override
	public CategoryEvaluation evaluate(HoldingSnapshot snapshot, FinancialFacts facts) {
		if (facts.emergencyFund() == null || facts.monthlyExpenses() == null || facts.monthlyExpenses().signum() <= 0) {
			return new CategoryEvaluation(DEFAULT_SCORE, "Emergency fund or monthly expenses not provided");
		}
		double months = facts.emergencyFund().doubleValue() / facts.monthlyExpenses().doubleValue();
		return new CategoryEvaluation(RUBRIC.score(months),
				String.format(Locale.ROOT, "Emergency fund covers %.1f months of expenses", months));
	}
}
