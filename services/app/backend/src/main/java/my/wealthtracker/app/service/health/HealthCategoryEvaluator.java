package my.wealthtracker.app.service.health;

import my.wealthtracker.app.domain.HoldingSnapshot;
import my.wealthtracker.app.model.FinancialFacts;
import my.wealthtracker.app.model.HealthCategory;

public interface HealthCategoryEvaluator {
	int MAX_SCORE = 200;

	HealthCategory category();

	CategoryEvaluation evaluate(HoldingSnapshot snapshot, FinancialFacts facts);

	record CategoryEvaluation(int score, String explanation) {
	}
}
