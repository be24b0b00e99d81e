package my.wealthtracker.app.model;

import java.math.BigDecimal;

public record MonteCarloParameters(BigDecimal startingValue,
								   BigDecimal expectedAnnualReturnPct,
								   BigDecimal volatilityPct,
								   int horizonYears,
								   int simulationCount,
								   Long seed) {
}
