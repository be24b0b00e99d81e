package my.wealthtracker.app.service;

import my.wealthtracker.app.model.ProjectionPoint;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PortfolioAggregatorTest {
	private final PortfolioAggregator aggregator = new PortfolioAggregator();

	@Test
	void sumsSameYearValues() {
		List<ProjectionPoint> equities = List.of(point(1, "100", "40"), point(2, "210", "90"));
		List<ProjectionPoint> gold = List.of(point(1, "50", "0"), point(2, "55", "0"));

		List<ProjectionPoint> merged = aggregator.aggregate(List.of(equities, gold), 2);

		assertThat(merged).hasSize(2);
		assertThat(merged.get(0).totalValue()).isEqualByComparingTo("150");
		assertThat(merged.get(0).contributionValue()).isEqualByComparingTo("40");
		assertThat(merged.get(0).lumpsumValue()).isEqualByComparingTo("110");
		assertThat(merged.get(1).totalValue()).isEqualByComparingTo("265");
	}

	@Test
	void emptyInputYieldsZeroTrajectory() {
		List<ProjectionPoint> merged = aggregator.aggregate(List.of(), 3);

		assertThat(merged).extracting(ProjectionPoint::year).containsExactly(1, 2, 3);
		assertThat(merged).allSatisfy(point -> assertThat(point.totalValue()).isEqualByComparingTo("0"));
	}

	@Test
	void mismatchedHorizonIsConfigurationError() {
		List<ProjectionPoint> shortSeries = List.of(point(1, "100", "0"));

		assertThatThrownBy(() -> aggregator.aggregate(List.of(shortSeries), 2))
				.isInstanceOf(ConfigurationException.class)
				.extracting(ex -> ((ConfigurationException) ex).getSubject())
				.isEqualTo("projections[0]");
	}

	@Test
	void outOfOrderYearsAreConfigurationError() {
		List<ProjectionPoint> swapped = List.of(point(2, "100", "0"), point(1, "90", "0"));

		assertThatThrownBy(() -> aggregator.aggregate(List.of(swapped), 2))
				.isInstanceOf(ConfigurationException.class);
	}

	@Test
	void rejectsNonPositiveHorizon() {
		assertThatThrownBy(() -> aggregator.aggregate(List.of(), 0))
				.isInstanceOf(ValidationException.class);
	}

	private static ProjectionPoint point(int year, String total, String contribution) {
		BigDecimal totalValue = new BigDecimal(total);
		BigDecimal contributionValue = new BigDecimal(contribution);
		return new ProjectionPoint(year, totalValue, contributionValue, totalValue.subtract(contributionValue));
	}
}
