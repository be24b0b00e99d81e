package my.wealthtracker.app.model;

import java.math.BigDecimal;
import java.util.List;

public record TaxEstimate(BigDecimal totalTaxLiability,
						  BigDecimal effectiveTaxRate,
						  BigDecimal longTermLiability,
						  BigDecimal shortTermLiability,
						  CurrentYearTax currentYearTax,
						  List<TaxSavingOpportunity> taxSavingOpportunities) {

	public record CurrentYearTax(BigDecimal longTermGains,
								 BigDecimal shortTermGains) {
	}

	public record TaxSavingOpportunity(String type,
									   String holdingId,
									   String description,
									   BigDecimal potentialTaxSaving) {
	}
}
