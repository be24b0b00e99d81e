package my.wealthtracker.app.model;

import my.wealthtracker.app.domain.AssetCategory;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

public record TaxConfig(Map<AssetCategory, Integer> holdingPeriodDays,
						BigDecimal longTermRatePct,
						BigDecimal shortTermRatePct,
						BigDecimal longTermExemption) {
	public TaxConfig {
		Map<AssetCategory, Integer> copy = new EnumMap<>(AssetCategory.class);
		if (holdingPeriodDays != null) {
			copy.putAll(holdingPeriodDays);
		}
		holdingPeriodDays = Map.copyOf(copy);
	}
}
