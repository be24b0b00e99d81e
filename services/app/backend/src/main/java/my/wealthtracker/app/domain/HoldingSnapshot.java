package my.wealthtracker.app.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record HoldingSnapshot(List<Holding> holdings, LocalDate valuationDate) {
	public HoldingSnapshot {
		holdings = holdings == null ? List.of() : List.copyOf(holdings);
	}

	public BigDecimal totalCurrentValue() {
		return holdings.stream()
				.map(Holding::currentValue)
				.reduce(BigDecimal.ZERO, BigDecimal::add);
	}

	public BigDecimal totalCostBasis() {
		return holdings.stream()
				.map(Holding::costBasis)
				.reduce(BigDecimal.ZERO, BigDecimal::add);
	}

	public Map<AssetCategory, BigDecimal> valueByCategory() {
		Map<AssetCategory, BigDecimal> values = new EnumMap<>(AssetCategory.class);
		for (Holding holding : holdings) {
			values.merge(holding.category(), holding.currentValue(), BigDecimal::add);
		}
		return values;
	}

	public boolean isEmpty() {
		return holdings.isEmpty();
	}
}
