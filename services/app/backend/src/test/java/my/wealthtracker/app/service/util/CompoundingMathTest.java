package my.wealthtracker.app.service.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CompoundingMathTest {
	@Test
	void monthlyRateCompoundsBackToAnnualRate() {
		double monthly = CompoundingMath.monthlyRate(12.0);

		assertThat(Math.pow(1.0 + monthly, 12)).isCloseTo(1.12, within(1e-12));
	}

	@Test
	void zeroRateIsPlainSummation() {
		assertThat(CompoundingMath.compound(1000.0, 100.0, 0.0, 12)).isEqualTo(2200.0);
	}

	@Test
	void depositsAreMadeAtStartOfPeriod() {
		// one deposit of 100 compounding for one period at 10%
		assertThat(CompoundingMath.compound(0.0, 100.0, 0.10, 1)).isCloseTo(110.0, within(1e-9));
		// 100 * 1.1^2 + 100 * 1.1
		assertThat(CompoundingMath.compound(0.0, 100.0, 0.10, 2)).isCloseTo(231.0, within(1e-9));
	}

	@Test
	void fullLossWipesOutOpeningBalance() {
		assertThat(CompoundingMath.compound(5000.0, 0.0, -1.0, 1)).isEqualTo(0.0);
	}

	@Test
	void noPeriodsLeavesOpeningUntouched() {
		assertThat(CompoundingMath.compound(42.0, 10.0, 0.05, 0)).isEqualTo(42.0);
	}
}
