package my.wealthtracker.app.service;

import my.wealthtracker.app.domain.AssetCategory;
import my.wealthtracker.app.model.AttributionResult;
import my.wealthtracker.app.model.AttributionResult.Performer;
import my.wealthtracker.app.model.AttributionResult.SectorPerformance;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static my.wealthtracker.app.support.SnapshotFixtures.holding;
import static my.wealthtracker.app.support.SnapshotFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttributionAnalyzerTest {
	private final AttributionAnalyzer analyzer = new AttributionAnalyzer(AttributionAnalyzer.DEFAULT_TOP_PERFORMERS);

	@Test
	void ranksHoldingsByReturn() {
		AttributionResult result = analyzer.attribute(snapshot(
				holding("first", AssetCategory.EQUITIES, "100", "150"),
				holding("second", AssetCategory.EQUITIES, "200", "150")));

		assertThat(result.bestPerformers()).extracting(Performer::holdingId).containsExactly("first", "second");
		assertThat(result.bestPerformers()).extracting(Performer::returnPct)
				.usingElementComparator(BigDecimal::compareTo)
				.containsExactly(new BigDecimal("50"), new BigDecimal("-25"));
	}

	@Test
	void sectorAverageIsCountWeighted() {
		AttributionResult result = analyzer.attribute(snapshot(
				holding("small", AssetCategory.EQUITIES, "100", "200"),
				holding("large", AssetCategory.EQUITIES, "10000", "9000"),
				holding("gold", AssetCategory.PRECIOUS_METALS, "800", "800")));

		SectorPerformance equities = result.sectorAnalysis().get("equities");
		// (100% + -10%) / 2, regardless of position size
		assertThat(equities.averageReturnPct()).isEqualByComparingTo("45");
		assertThat(equities.holdingCount()).isEqualTo(2);
		assertThat(equities.allocationPct()).isEqualByComparingTo("92");
		assertThat(result.sectorAnalysis().get("precious-metals").allocationPct()).isEqualByComparingTo("8");
		assertThat(result.sectorAnalysis()).containsOnlyKeys("equities", "precious-metals");
	}

	@Test
	void zeroCostHoldingsCountTowardsAllocationOnly() {
		AttributionResult result = analyzer.attribute(snapshot(
				holding("gift", AssetCategory.OTHER, "0", "1000"),
				holding("fund", AssetCategory.POOLED_FUNDS, "1000", "1000")));

		assertThat(result.bestPerformers()).extracting(Performer::holdingId).containsExactly("fund");
		SectorPerformance other = result.sectorAnalysis().get("other");
		assertThat(other.allocationPct()).isEqualByComparingTo("50");
		assertThat(other.averageReturnPct()).isNull();
		assertThat(result.portfolioReturnPct()).isEqualByComparingTo("0");
	}

	@Test
	void limitsBestPerformersAndKeepsThemSorted() {
		AttributionAnalyzer topTwo = new AttributionAnalyzer(2);

		AttributionResult result = topTwo.attribute(snapshot(
				holding("a", AssetCategory.EQUITIES, "100", "110"),
				holding("b", AssetCategory.EQUITIES, "100", "300"),
				holding("c", AssetCategory.CRYPTO_ASSETS, "100", "50"),
				holding("d", AssetCategory.CRYPTO_ASSETS, "100", "180")));

		assertThat(result.bestPerformers()).extracting(Performer::holdingId).containsExactly("b", "d");
		assertThat(result.bestPerformers().get(0).returnPct())
				.isGreaterThanOrEqualTo(result.bestPerformers().get(1).returnPct());
	}

	@Test
	void portfolioReturnIsValueWeighted() {
		AttributionResult result = analyzer.attribute(snapshot(
				holding("first", AssetCategory.EQUITIES, "100", "150"),
				holding("second", AssetCategory.EQUITIES, "200", "150")));

		assertThat(result.portfolioReturnPct()).isEqualByComparingTo("0");
	}

	@Test
	void emptySnapshotHasNoPerformers() {
		AttributionResult result = analyzer.attribute(snapshot());

		assertThat(result.bestPerformers()).isEmpty();
		assertThat(result.sectorAnalysis()).isEmpty();
	}

	@Test
	void negativeCurrentValueIsRejected() {
		assertThatThrownBy(() -> analyzer.attribute(snapshot(holding("x", AssetCategory.EQUITIES, "100", "-1"))))
				.isInstanceOf(ValidationException.class)
				.hasMessageContaining("holdings[0].currentValue");
	}
}
