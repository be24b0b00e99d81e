package my.wealthtracker.app.model;

import java.math.BigDecimal;

public record FinancialFacts(BigDecimal monthlyIncome,
							 BigDecimal monthlyExpenses,
							 BigDecimal monthlyDebtPayments,
							 BigDecimal emergencyFund,
							 BigDecimal monthlySavings) {
	public static FinancialFacts empty() {
		return new FinancialFacts(null, null, null, null, null);
	}
}
