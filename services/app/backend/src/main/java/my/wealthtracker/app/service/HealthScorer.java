package my.wealthtracker.app.service;

import my.wealthtracker.app.config.AppProperties;
import my.wealthtracker.app.domain.HoldingSnapshot;
import my.wealthtracker.app.model.FinancialFacts;
import my.wealthtracker.app.model.HealthCategory;
import my.wealthtracker.app.model.HealthScore;
import my.wealthtracker.app.service.health.HealthCategoryEvaluator;
import my.wealthtracker.app.service.health.HealthCategoryEvaluator.CategoryEvaluation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class HealthScorer {
	private static final Logger logger = LoggerFactory.getLogger(HealthScorer.class);

	private final Map<HealthCategory, HealthCategoryEvaluator> evaluators;
	private final Thresholds thresholds;

	public HealthScorer(List<HealthCategoryEvaluator> evaluators, Thresholds thresholds) {
		this.evaluators = index(evaluators);
		this.thresholds = thresholds == null ? Thresholds.defaults() : thresholds;
	}

	public HealthScore score(HoldingSnapshot snapshot, FinancialFacts facts) {
		SnapshotValidator.validate(snapshot);
		FinancialFacts resolved = facts == null ? FinancialFacts.empty() : facts;
		validateFacts(resolved);

		int overall = 0;
		Map<String, Integer> scores = new LinkedHashMap<>();
		Map<String, String> explanations = new LinkedHashMap<>();
		List<String> recommendations = new ArrayList<>();
		List<String> strengths = new ArrayList<>();
		for (HealthCategory category : HealthCategory.values()) {
			CategoryEvaluation evaluation = evaluators.get(category).evaluate(snapshot, resolved);
			int score = Math.max(0, Math.min(HealthCategoryEvaluator.MAX_SCORE, evaluation.score()));
			overall += score;
			scores.put(category.key(), score);
			explanations.put(category.key(), evaluation.explanation());
			if (score < thresholds.needsImprovementBelow()) {
				recommendations.add(category.recommendation(evaluation.explanation()));
			}
			if (score >= thresholds.strongAtOrAbove()) {
				strengths.add(category.strength());
			}
		}
		String rating = rating(overall);
		logger.debug("Health score {} ({}) for {} holdings", overall, rating, snapshot.holdings().size());
		return new HealthScore(overall, rating,
				Collections.unmodifiableMap(scores),
				Collections.unmodifiableMap(explanations),
				List.copyOf(recommendations),
				List.copyOf(strengths));
	}

	static String rating(int overall) {
		if (overall >= 800) {
			return "Excellent";
		}
		if (overall >= 600) {
			return "Good";
		}
		if (overall >= 400) {
			return "Fair";
		}
		return "Poor";
	}

	private static void validateFacts(FinancialFacts facts) {
		requireNonNegativeIfPresent("facts.monthlyIncome", facts.monthlyIncome());
		requireNonNegativeIfPresent("facts.monthlyExpenses", facts.monthlyExpenses());
		requireNonNegativeIfPresent("facts.monthlyDebtPayments", facts.monthlyDebtPayments());
		requireNonNegativeIfPresent("facts.emergencyFund", facts.emergencyFund());
	}

	private static void requireNonNegativeIfPresent(String field, BigDecimal value) {
		if (value != null && value.signum() < 0) {
			throw new ValidationException(field, "must not be negative");
		}
	}

	private static Map<HealthCategory, HealthCategoryEvaluator> index(List<HealthCategoryEvaluator> evaluators) {
		Map<HealthCategory, HealthCategoryEvaluator> indexed = new EnumMap<>(HealthCategory.class);
		if (evaluators != null) {
			for (HealthCategoryEvaluator evaluator : evaluators) {
				HealthCategoryEvaluator previous = indexed.put(evaluator.category(), evaluator);
				if (previous != null) {
					throw new ConfigurationException(evaluator.category().key(), "more than one evaluator registered");
				}
			}
		}
		for (HealthCategory category : HealthCategory.values()) {
			if (!indexed.containsKey(category)) {
				throw new ConfigurationException(category.key(), "no evaluator registered");
			}
		}
		return indexed;
	}

	public record Thresholds(int needsImprovementBelow, int strongAtOrAbove) {
		public static Thresholds defaults() {
			return new Thresholds(100, 160);
		}

		public static Thresholds from(AppProperties.Health properties) {
			Thresholds defaults = defaults();
			if (properties == null) {
				return defaults;
			}
			return new Thresholds(
					properties.needsImprovementBelow() == null ? defaults.needsImprovementBelow() : properties.needsImprovementBelow(),
					properties.strongAtOrAbove() == null ? defaults.strongAtOrAbove() : properties.strongAtOrAbove()
			);
		}
	}
}
