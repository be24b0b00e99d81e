package my.wealthtracker.app.service.health;

import my.wealthtracker.app.domain.AssetCategory;
import my.wealthtracker.app.model.FinancialFacts;
import my.wealthtracker.app.service.health.HealthCategoryEvaluator.CategoryEvaluation;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static my.wealthtracker.app.support.SnapshotFixtures.contributing;
import static my.wealthtracker.app.support.SnapshotFixtures.holding;
import static my.wealthtracker.app.support.SnapshotFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;

class HealthEvaluatorsTest {
	private static final FinancialFacts NO_FACTS = FinancialFacts.empty();

	@Test
	void diversificationPenalizesConcentration() {
		DiversificationEvaluator evaluator = new DiversificationEvaluator();

		CategoryEvaluation concentrated = evaluator.evaluate(snapshot(
				holding("a", AssetCategory.EQUITIES, "10", "500"),
				holding("b", AssetCategory.EQUITIES, "10", "500")), NO_FACTS);
		CategoryEvaluation split = evaluator.evaluate(snapshot(
				holding("a", AssetCategory.EQUITIES, "10", "500"),
				holding("b", AssetCategory.PRECIOUS_METALS, "10", "500")), NO_FACTS);

		assertThat(concentrated.score()).isZero();
		assertThat(concentrated.explanation()).contains("equities holds 100.0%");
		assertThat(split.score()).isEqualTo(150);
	}

	@Test
	void emergencyFundMeasuredInMonthsOfExpenses() {
		EmergencyFundEvaluator evaluator = new EmergencyFundEvaluator();
		FinancialFacts facts = new FinancialFacts(null, new BigDecimal("3000"), null, new BigDecimal("9000"), null);

		CategoryEvaluation evaluation = evaluator.evaluate(snapshot(), facts);

		assertThat(evaluation.score()).isEqualTo(120);
		assertThat(evaluation.explanation()).contains("3.0 months");
		assertThat(evaluator.evaluate(snapshot(), NO_FACTS).score()).isEqualTo(EmergencyFundEvaluator.DEFAULT_SCORE);
	}

	@Test
	void debtBurdenUsesPaymentToIncomeRatio() {
		DebtBurdenEvaluator evaluator = new DebtBurdenEvaluator();

		assertThat(evaluator.evaluate(snapshot(),
				new FinancialFacts(new BigDecimal("10000"), null, new BigDecimal("3600"), null, null)).score())
				.isEqualTo(100);
		assertThat(evaluator.evaluate(snapshot(),
				new FinancialFacts(new BigDecimal("10000"), null, BigDecimal.ZERO, null, null)).score())
				.isEqualTo(200);
		assertThat(evaluator.evaluate(snapshot(), NO_FACTS).score()).isEqualTo(DebtBurdenEvaluator.DEFAULT_SCORE);
	}

	@Test
	void savingsRatePrefersStatedSavings() {
		SavingsRateEvaluator evaluator = new SavingsRateEvaluator();
		FinancialFacts facts = new FinancialFacts(new BigDecimal("10000"), new BigDecimal("9500"), null, null,
				new BigDecimal("2000"));

		assertThat(evaluator.evaluate(snapshot(), facts).score()).isEqualTo(140);
	}

	@Test
	void savingsRateFallsBackToActiveContributions() {
		SavingsRateEvaluator evaluator = new SavingsRateEvaluator();
		FinancialFacts incomeOnly = new FinancialFacts(new BigDecimal("10000"), null, null, null, null);

		CategoryEvaluation evaluation = evaluator.evaluate(snapshot(
				contributing("sip", AssetCategory.POOLED_FUNDS, "5000", "1000", "10", true),
				contributing("paused", AssetCategory.POOLED_FUNDS, "5000", "4000", "0", false)), incomeOnly);

		assertThat(evaluation.score()).isEqualTo(80);
		assertThat(evaluator.evaluate(snapshot(), NO_FACTS).score()).isEqualTo(SavingsRateEvaluator.DEFAULT_SCORE);
	}

	@Test
	void growthTrajectoryIgnoresZeroCostHoldings() {
		GrowthTrajectoryEvaluator evaluator = new GrowthTrajectoryEvaluator();

		CategoryEvaluation evaluation = evaluator.evaluate(snapshot(
				holding("a", AssetCategory.EQUITIES, "100", "110"),
				holding("gift", AssetCategory.OTHER, "0", "5000")), NO_FACTS);

		assertThat(evaluation.score()).isEqualTo(140);
		assertThat(evaluator.evaluate(snapshot(holding("gift", AssetCategory.OTHER, "0", "5000")), NO_FACTS).score())
				.isEqualTo(GrowthTrajectoryEvaluator.DEFAULT_SCORE);
	}
}
