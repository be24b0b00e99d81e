package my.wealthtracker.app.model;

import java.math.BigDecimal;

public record ProjectionPoint(int year,
							  BigDecimal totalValue,
							  BigDecimal contributionValue,
							  BigDecimal lumpsumValue) {
}
