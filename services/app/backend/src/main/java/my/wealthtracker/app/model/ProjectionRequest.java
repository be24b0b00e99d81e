package my.wealthtracker.app.model;

import my.wealthtracker.app.domain.AssetCategory;

import java.math.BigDecimal;

public record ProjectionRequest(AssetCategory category,
								BigDecimal currentValue,
								BigDecimal annualGrowthRatePct,
								BigDecimal annualLumpsum,
								BigDecimal periodicContribution,
								BigDecimal stepUpPct,
								int horizonYears) {
}
