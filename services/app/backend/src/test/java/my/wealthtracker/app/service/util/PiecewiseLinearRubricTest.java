package my.wealthtracker.app.service.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PiecewiseLinearRubricTest {
	private final PiecewiseLinearRubric rubric = PiecewiseLinearRubric.of(200,
			0.0, 0.0,
			3.0, 120.0,
			6.0, 200.0);

	@Test
	void interpolatesBetweenBreakpoints() {
		assertThat(rubric.score(1.5)).isEqualTo(60);
		assertThat(rubric.score(4.5)).isEqualTo(160);
	}

	@Test
	void clampsOutsideRange() {
		assertThat(rubric.score(-5.0)).isZero();
		assertThat(rubric.score(60.0)).isEqualTo(200);
	}

	@Test
	void decreasingRubricsAreSupported() {
		PiecewiseLinearRubric debt = PiecewiseLinearRubric.of(200, 0.1, 200.0, 0.5, 0.0);

		assertThat(debt.score(0.3)).isEqualTo(100);
		assertThat(debt.score(0.9)).isZero();
	}

	@Test
	void nanScoresZero() {
		assertThat(rubric.score(Double.NaN)).isZero();
	}

	@Test
	void rejectsOddNumberOfValues() {
		assertThatThrownBy(() -> PiecewiseLinearRubric.of(200, 0.0, 1.0, 2.0))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
