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
public class SavingsRateEvaluator implements HealthCategoryEvaluator {
	static final int DEFAULT_SCORE = 60;
	private static final PiecewiseLinearRubric RUBRIC = PiecewiseLinearRubric.of(MAX_SCORE,
			0.0, 0.0,
			0.1, 80.0,
			0.2, 140.0,
			0.3, 200.0);

	@Override
	public HealthCategory category() {
		return HealthCategory.SAVINGS_RATE;
	}

	@Override
	public CategoryEvaluation evaluate(HoldingSnapshot snapshot, FinancialFacts facts) {
		BigDecimal income = facts.monthlyIncome();
		if (income == null || income.signum() <= 0) {
			return new CategoryEvaluation(DEFAULT_SCORE, "Monthly income not provided");
		}
		double rate = monthlySavings(snapshot, facts).doubleValue() / income.doubleValue();
		return new CategoryEvaluation(RUBRIC.score(rate),
				String.format(Locale.ROOT, "Saving %.1f%% of monthly income", rate * 100.0));
	}

	private static BigDecimal monthlySavings(HoldingSnapshot snapshot, FinancialFacts facts) {
		if (facts.monthlySavings() != null) {
			return facts.monthlySavings();
		}
		if (facts.monthlyExpenses() != null) {
			return facts.monthlyIncome().subtract(facts.monthlyExpenses());
		}
		BigDecimal contributions = BigDecimal.ZERO;
		for (Holding holding : snapshot.holdings()) {
			if (holding.hasActiveContribution()) {
				contributions = contributions.add(holding.contributionSchedule().monthlyAmount());
			}
		}
		return contributions;
	}
}
